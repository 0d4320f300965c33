package org.obdispatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.obdispatch.aio.AsyncBoundListener;
import org.obdispatch.aio.AsyncEventListener;
import org.obdispatch.aio.CompletionTracker;
import org.obdispatch.aio.ExecutionContext;
import org.obdispatch.prop.Property;
import org.obdispatch.prop.PropertyValue;
import org.obdispatch.prop.ValidationException;
import org.obdispatch.util.Transaction;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * An object that emits named events to the listeners bound to them. Subclasses declare events with {@link Events @Events} and observable
 * {@link Property properties} with {@code static final} fields; each property is also an event, emitted whenever the property's value
 * changes. More events may be {@link #registerEvent(String...) registered} on an instance at any time.
 *
 * <pre>
 * &#64;Events({ "on_reset" })
 * public class Counter extends Dispatcher {
 * 	public static final IntProperty VALUE = IntProperty.build("value").build();
 * }
 *
 * Counter counter = new Counter();
 * EventListener listener = EventListener.of(e -&gt; log.add(e.getArg(1)));
 * counter.bind("value", listener);
 * counter.set(Counter.VALUE, 1);
 * counter.emit("on_reset");
 * </pre>
 *
 * <p>
 * Bindings never keep their listeners alive. A plain listener is held weakly, as is the owner of an owner-bound listener; once the
 * weakly-held object is collected the binding is silently dropped.
 * </p>
 *
 * <p>
 * Emission is synchronous and not thread-safe with respect to a single dispatcher: code emitting from multiple threads on one instance
 * must serialize its calls.
 * </p>
 */
public class Dispatcher {
	private final EventRegistry theRegistry;

	/**
	 * Creates the dispatcher
	 *
	 * @throws ExistsException If this dispatcher's class declares conflicting names
	 */
	public Dispatcher() throws ExistsException {
		theRegistry = new EventRegistry(this, DispatcherManifest.of(getClass()));
	}

	/** @return The events and properties this dispatcher's class declares */
	public DispatcherManifest getManifest() {
		return theRegistry.getManifest();
	}

	/**
	 * Registers events on this dispatcher. Names that are already registered or declared are ignored.
	 *
	 * @param names The names of the events to register
	 * @throws PropertyExistsException If any of the names is the name of a property, in which case none of the names are registered
	 */
	public void registerEvent(String... names) throws PropertyExistsException {
		theRegistry.register(names);
	}

	/**
	 * @param name The name to check
	 * @return Whether this dispatcher has an event or property with the given name
	 */
	public boolean hasEvent(String name) {
		return theRegistry.hasName(name);
	}

	/** @return The names of all events and properties of this dispatcher */
	public Set<String> getEventNames() {
		return theRegistry.getNames();
	}

	/**
	 * Binds a listener to an event. The listener is held weakly, so the caller must keep it reachable for as long as it should be notified.
	 * Binding a listener to an event it is already bound to does nothing.
	 *
	 * @param name The name of the event or property
	 * @param listener The listener to notify of emissions
	 * @return The binding
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 */
	public Subscription bind(String name, EventListener listener) throws DoesNotExistException {
		Preconditions.checkNotNull(listener, "listener");
		return theRegistry.subscribe(name, listener, Subscriber.LISTENER);
	}

	/**
	 * Binds a listener to an event on behalf of an owner. The owner is held weakly and the listener strongly, so the listener must not
	 * reference the owner. Binding the same owner and listener to an event again does nothing.
	 *
	 * @param <O> The type of the owner
	 * @param name The name of the event or property
	 * @param owner The owner to pass to the listener
	 * @param listener The listener to notify of emissions
	 * @return The binding
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 */
	public <O> Subscription bind(String name, O owner, BoundListener<? super O> listener) throws DoesNotExistException {
		Preconditions.checkNotNull(owner, "owner");
		Preconditions.checkNotNull(listener, "listener");
		return theRegistry.subscribe(name, owner, Subscriber.ofBound(listener));
	}

	/**
	 * Binds each listener in a map to the event it is keyed by
	 *
	 * @param listeners The listeners to bind, by event name
	 * @return The bindings
	 * @throws DoesNotExistException If any of the names is unknown, in which case nothing is bound
	 * @throws NullPointerException If any of the listeners is null, in which case nothing is bound
	 */
	public Subscription bind(Map<String, ? extends EventListener> listeners) throws DoesNotExistException {
		theRegistry.checkNames(listeners.keySet());
		checkListeners(listeners);
		List<Subscription> subs = new ArrayList<>(listeners.size());
		for (Map.Entry<String, ? extends EventListener> entry : listeners.entrySet())
			subs.add(bind(entry.getKey(), entry.getValue()));
		return Subscription.forAll(subs);
	}

	/**
	 * Binds an asynchronous listener to an event, running it on the execution context that is ambient on the calling thread
	 *
	 * @param name The name of the event or property
	 * @param listener The listener to schedule for emissions
	 * @return The binding
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 * @throws BindingContextException If no execution context is ambient on the calling thread
	 * @see ExecutionContext#current()
	 */
	public Subscription bindAsync(String name, AsyncEventListener listener) throws DoesNotExistException, BindingContextException {
		theRegistry.checkName(name);
		ExecutionContext context = ExecutionContext.current().orElseThrow(() -> new BindingContextException(name));
		return bindAsync(context, name, listener);
	}

	/**
	 * Binds an asynchronous listener to an event. The listener is held weakly. Binding a listener to an event it is already bound to does
	 * nothing, even with a different context.
	 *
	 * @param context The execution context to run the listener on
	 * @param name The name of the event or property
	 * @param listener The listener to schedule for emissions
	 * @return The binding
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 */
	public Subscription bindAsync(ExecutionContext context, String name, AsyncEventListener listener) throws DoesNotExistException {
		Preconditions.checkNotNull(context, "context");
		Preconditions.checkNotNull(listener, "listener");
		return theRegistry.subscribe(name, listener, Subscriber.ofAsync(context));
	}

	/**
	 * Binds an asynchronous listener to an event on behalf of an owner, which is held weakly
	 *
	 * @param <O> The type of the owner
	 * @param context The execution context to run the listener on
	 * @param name The name of the event or property
	 * @param owner The owner to pass to the listener
	 * @param listener The listener to schedule for emissions
	 * @return The binding
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 */
	public <O> Subscription bindAsync(ExecutionContext context, String name, O owner, AsyncBoundListener<? super O> listener)
		throws DoesNotExistException {
		Preconditions.checkNotNull(context, "context");
		Preconditions.checkNotNull(owner, "owner");
		Preconditions.checkNotNull(listener, "listener");
		return theRegistry.subscribe(name, owner, Subscriber.ofAsyncBound(context, listener));
	}

	/**
	 * Binds each asynchronous listener in a map to the event it is keyed by
	 *
	 * @param context The execution context to run the listeners on
	 * @param listeners The listeners to bind, by event name
	 * @return The bindings
	 * @throws DoesNotExistException If any of the names is unknown, in which case nothing is bound
	 * @throws NullPointerException If the context or any of the listeners is null, in which case nothing is bound
	 */
	public Subscription bindAsync(ExecutionContext context, Map<String, ? extends AsyncEventListener> listeners)
		throws DoesNotExistException {
		Preconditions.checkNotNull(context, "context");
		theRegistry.checkNames(listeners.keySet());
		checkListeners(listeners);
		List<Subscription> subs = new ArrayList<>(listeners.size());
		for (Map.Entry<String, ? extends AsyncEventListener> entry : listeners.entrySet())
			subs.add(bindAsync(context, entry.getKey(), entry.getValue()));
		return Subscription.forAll(subs);
	}

	private static void checkListeners(Map<String, ?> listeners) {
		for (Map.Entry<String, ?> entry : listeners.entrySet())
			Preconditions.checkNotNull(entry.getValue(), "No listener for %s", entry.getKey());
	}

	/**
	 * Removes bindings from all events of this dispatcher. Each argument may be a listener, the owner of owner-bound listeners (removing all
	 * of its bindings), or the handler of owner-bound listeners (removing its bindings for all owners).
	 *
	 * @param listenersOrOwners The listeners, owners or handlers to unbind
	 * @return The number of bindings removed
	 */
	public int unbind(Object... listenersOrOwners) {
		int removed = 0;
		for (Object listenerOrOwner : listenersOrOwners)
			removed += theRegistry.unsubscribe(listenerOrOwner);
		return removed;
	}

	/**
	 * @param owner The owner of the bindings to remove
	 * @param listener The owner-bound listener to unbind for the owner
	 * @return The number of bindings removed
	 */
	public int unbind(Object owner, BoundListener<?> listener) {
		return theRegistry.unsubscribe(owner, listener);
	}

	/**
	 * @param owner The owner of the bindings to remove
	 * @param listener The owner-bound asynchronous listener to unbind for the owner
	 * @return The number of bindings removed
	 */
	public int unbind(Object owner, AsyncBoundListener<?> listener) {
		return theRegistry.unsubscribe(owner, listener);
	}

	/**
	 * Emits an event with positional arguments only
	 *
	 * @param name The name of the event or property
	 * @param args The positional arguments
	 * @return {@link Propagation#STOP} if a synchronous listener stopped propagation
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 * @see #emit(String, List, Map)
	 */
	public Propagation emit(String name, Object... args) throws DoesNotExistException {
		return theRegistry.emit(name, Arrays.asList(args), Collections.emptyMap());
	}

	/**
	 * Emits an event. Asynchronous listeners are scheduled on their contexts, then synchronous listeners are called in the order they were
	 * bound until one returns {@link Propagation#STOP}, then futures from {@link Event#next()} are completed. If emissions of the event are
	 * {@link #holdEmissions(String) held}, the emission is held instead.
	 *
	 * @param name The name of the event or property
	 * @param args The positional arguments
	 * @param keywords The keyword arguments
	 * @return {@link Propagation#STOP} if a synchronous listener stopped propagation
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 */
	public Propagation emit(String name, List<?> args, Map<String, ?> keywords) throws DoesNotExistException {
		return theRegistry.emit(name, args, keywords);
	}

	/**
	 * @param name The name of the event or property
	 * @return The event, e.g. to {@link Event#next() wait} for its next emission
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 */
	public Event getDispatcherEvent(String name) throws DoesNotExistException {
		return theRegistry.getEvent(name);
	}

	/**
	 * @param <T> The type of the property
	 * @param property The property
	 * @return This dispatcher's value holder for the property
	 * @throws DoesNotExistException If the property is not a property of this dispatcher's class
	 */
	public <T> PropertyValue<T> property(Property<T> property) throws DoesNotExistException {
		return theRegistry.getValue(property);
	}

	/**
	 * @param <T> The type of the property
	 * @param property The property
	 * @return This dispatcher's value for the property
	 * @throws DoesNotExistException If the property is not a property of this dispatcher's class
	 */
	public <T> T get(Property<T> property) throws DoesNotExistException {
		return theRegistry.getValue(property).get();
	}

	/**
	 * @param <T> The type of the property
	 * @param property The property
	 * @param value The value to assign
	 * @return The previous value
	 * @throws DoesNotExistException If the property is not a property of this dispatcher's class
	 * @throws ValidationException If the value is not acceptable for the property
	 * @see PropertyValue#set(Object)
	 */
	public <T> T set(Property<T> property, T value) throws DoesNotExistException, ValidationException {
		return theRegistry.getValue(property).set(value);
	}

	/**
	 * @param name The name of the property
	 * @return This dispatcher's value for the property
	 * @throws DoesNotExistException If this dispatcher's class has no such property
	 */
	public Object getValue(String name) throws DoesNotExistException {
		return theRegistry.getValue(name).get();
	}

	/**
	 * Assigns a property by name. The value is checked against the property's type like any other assigned value.
	 *
	 * @param name The name of the property
	 * @param value The value to assign
	 * @return The previous value
	 * @throws DoesNotExistException If this dispatcher's class has no such property
	 * @throws ValidationException If the value is not acceptable for the property
	 */
	public Object setValue(String name, Object value) throws DoesNotExistException, ValidationException {
		return ((PropertyValue<Object>) theRegistry.getValue(name)).set(value);
	}

	/**
	 * Holds back emissions of an event until the returned transaction is closed. Held emissions are not delivered; when the last open hold
	 * on the event is closed, the most recent held emission (if any) is delivered. Property values still change while their event is held.
	 *
	 * <pre>
	 * try (Transaction hold = dispatcher.holdEmissions("value")) {
	 * 	for (int i = 0; i &lt; 10; i++)
	 * 		dispatcher.set(VALUE, i);
	 * } // Listeners see value=9 only
	 * </pre>
	 *
	 * @param name The name of the event or property
	 * @return The transaction to close to release the hold
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 */
	public Transaction holdEmissions(String name) throws DoesNotExistException {
		return theRegistry.hold(name);
	}

	/**
	 * @param name The name of the event or property
	 * @return Whether emissions of the event are currently {@link #holdEmissions(String) held}
	 */
	public boolean isEmissionHeld(String name) {
		return theRegistry.isHeld(name);
	}

	/**
	 * Starts retaining the tasks that emissions of the given events schedule for asynchronous listeners, so that they can be waited on
	 *
	 * <pre>
	 * try (CompletionTracker tracker = dispatcher.trackCompletion("value")) {
	 * 	dispatcher.set(VALUE, 1);
	 * } // Waits for asynchronous "value" listeners to finish
	 * </pre>
	 *
	 * @param names The names of the events or properties to track
	 * @return The tracker, which must be closed
	 * @throws DoesNotExistException If any of the names is unknown
	 */
	public CompletionTracker trackCompletion(String... names) throws DoesNotExistException {
		Preconditions.checkArgument(names.length > 0, "No events to track");
		return theRegistry.track(ImmutableSet.copyOf(names));
	}

	/**
	 * @param name The name of the event or property
	 * @return The number of live listeners bound to the event
	 * @throws DoesNotExistException If this dispatcher has no such event or property
	 */
	public int getListenerCount(String name) throws DoesNotExistException {
		return theRegistry.getListenerCount(name);
	}
}
