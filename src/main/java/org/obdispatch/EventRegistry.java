package org.obdispatch;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.obdispatch.aio.CompletionTracker;
import org.obdispatch.prop.Property;
import org.obdispatch.prop.PropertyValue;
import org.obdispatch.util.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableSet;

/**
 * The per-instance state of a {@link Dispatcher}: dynamically registered events, the {@link Event}s that have been bound to or emitted,
 * property values, emission holds and open completion trackers. Events and property values are created the first time they are needed.
 */
final class EventRegistry {
	private static final Logger logger = LoggerFactory.getLogger(EventRegistry.class);

	private final Dispatcher theOwner;
	private final DispatcherManifest theManifest;
	private final Set<String> theDynamicEvents;
	private final ConcurrentHashMap<String, Event> theEvents;
	private final ConcurrentHashMap<String, PropertyValue<?>> theValues;
	private final ConcurrentHashMap<String, EmissionLock> theLocks;
	private final List<CompletionTracker> theTrackers;

	EventRegistry(Dispatcher owner, DispatcherManifest manifest) {
		theOwner = owner;
		theManifest = manifest;
		theDynamicEvents = Collections.synchronizedSet(new LinkedHashSet<>());
		theEvents = new ConcurrentHashMap<>();
		theValues = new ConcurrentHashMap<>();
		theLocks = new ConcurrentHashMap<>();
		theTrackers = new CopyOnWriteArrayList<>();
	}

	DispatcherManifest getManifest() {
		return theManifest;
	}

	boolean hasName(String name) {
		return theManifest.hasName(name) || theDynamicEvents.contains(name);
	}

	Set<String> getNames() {
		ImmutableSet.Builder<String> names = ImmutableSet.builder();
		names.addAll(theManifest.getProperties().keySet());
		names.addAll(theManifest.getEventNames());
		synchronized (theDynamicEvents) {
			names.addAll(theDynamicEvents);
		}
		return names.build();
	}

	/**
	 * @param name The name of the event or property
	 * @throws DoesNotExistException If no such event or property exists
	 */
	void checkName(String name) throws DoesNotExistException {
		if (!hasName(name))
			throw new DoesNotExistException(name);
	}

	void checkNames(Collection<String> names) throws DoesNotExistException {
		for (String name : names)
			checkName(name);
	}

	/**
	 * @param names The event names to register
	 * @return The names that were not registered already
	 * @throws PropertyExistsException If any of the names is a property name, in which case no names are registered
	 */
	Set<String> register(String... names) throws PropertyExistsException {
		for (String name : names) {
			if (name == null || name.isEmpty())
				throw new IllegalArgumentException("Event names may not be empty");
			else if (theManifest.hasProperty(name))
				throw new PropertyExistsException(name);
		}
		Set<String> added = new LinkedHashSet<>();
		for (String name : names) {
			if (!theManifest.hasEvent(name) && theDynamicEvents.add(name))
				added.add(name);
		}
		if (!added.isEmpty())
			logger.debug("Registered events {} on {}", added, theOwner);
		return added;
	}

	Event getEvent(String name) throws DoesNotExistException {
		Event event = theEvents.get(name);
		if (event != null)
			return event;
		checkName(name);
		return theEvents.computeIfAbsent(name, Event::new);
	}

	Subscription subscribe(String name, Object owner, Subscriber subscriber) throws DoesNotExistException {
		Subscription sub = getEvent(name).subscribe(owner, subscriber);
		logger.debug("Bound {} to {} on {}", subscriber, name, theOwner);
		return sub;
	}

	int unsubscribe(Object listenerOrOwner) {
		int removed = 0;
		for (Event event : theEvents.values())
			removed += event.unsubscribe(listenerOrOwner);
		if (removed > 0)
			logger.debug("Unbound {} bindings of {} from {}", removed, listenerOrOwner, theOwner);
		return removed;
	}

	int unsubscribe(Object owner, Object handler) {
		int removed = 0;
		for (Event event : theEvents.values())
			removed += event.unsubscribe(owner, handler);
		if (removed > 0)
			logger.debug("Unbound {} bindings of {} for {} from {}", removed, handler, owner, theOwner);
		return removed;
	}

	Propagation emit(String name, List<?> args, Map<String, ?> keywords) throws DoesNotExistException {
		checkName(name);
		Emission emission = Emission.of(name, args, keywords);
		EmissionLock lock = theLocks.get(name);
		if (lock != null && lock.capture(emission)) {
			logger.trace("Held {}", emission);
			return Propagation.CONTINUE;
		}
		return deliver(emission);
	}

	private Propagation deliver(Emission emission) {
		Event event = theEvents.get(emission.getEventName());
		if (event == null)
			return Propagation.CONTINUE;
		return event.fire(emission, this::taskScheduled);
	}

	private void taskScheduled(String name, CompletableFuture<Void> task) {
		for (CompletionTracker tracker : theTrackers)
			tracker.retain(name, task);
	}

	<T> PropertyValue<T> getValue(Property<T> property) throws DoesNotExistException {
		if (theManifest.getProperty(property.getName()) != property)
			throw new DoesNotExistException(property.getName(),
				"Property \"" + property.getName() + "\" does not belong to " + theManifest.getType().getSimpleName());
		return (PropertyValue<T>) getValue(property.getName());
	}

	PropertyValue<?> getValue(String name) throws DoesNotExistException {
		PropertyValue<?> value = theValues.get(name);
		if (value != null)
			return value;
		Property<?> property = theManifest.getProperty(name);
		if (property == null)
			throw new DoesNotExistException(name, "No property named \"" + name + "\" in " + theManifest.getType().getSimpleName());
		return theValues.computeIfAbsent(name, n -> property.createValue(theOwner));
	}

	Transaction hold(String name) throws DoesNotExistException {
		checkName(name);
		return theLocks.computeIfAbsent(name, EmissionLock::new).hold(this::deliver);
	}

	boolean isHeld(String name) {
		EmissionLock lock = theLocks.get(name);
		return lock != null && lock.isHeld();
	}

	CompletionTracker track(Set<String> names) throws DoesNotExistException {
		checkNames(names);
		CompletionTracker[] tracker = new CompletionTracker[1];
		tracker[0] = new CompletionTracker(names, () -> theTrackers.remove(tracker[0]));
		theTrackers.add(tracker[0]);
		logger.debug("Tracking completion of {} on {}", names, theOwner);
		return tracker[0];
	}

	int getListenerCount(String name) throws DoesNotExistException {
		checkName(name);
		Event event = theEvents.get(name);
		return event == null ? 0 : event.getListenerCount();
	}
}
