package org.obdispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

import org.obdispatch.util.WeakListenerSet;
import org.obdispatch.util.WeakListenerSet.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named channel belonging to one {@link Dispatcher} instance, delivering each emission to the listeners bound to it. Events are created
 * by the dispatcher the first time they are bound to, emitted or requested, and live as long as the dispatcher.
 *
 * <p>
 * Besides its listeners, an event can be waited on: each call to {@link #next()} returns a new future that completes with the next
 * emission. An event never completes; it can be waited on any number of times.
 * </p>
 */
public class Event {
	private static final Logger logger = LoggerFactory.getLogger(Event.class);

	private final String theName;
	private final WeakListenerSet<Subscriber> theListeners;
	private final List<CompletableFuture<Emission>> theWaiters;

	Event(String name) {
		theName = name;
		theListeners = new WeakListenerSet<>();
		theWaiters = new ArrayList<>();
	}

	/** @return The name of this event */
	public String getName() {
		return theName;
	}

	Subscription subscribe(Object owner, Subscriber subscriber) {
		Entry<Subscriber> entry = theListeners.add(owner, subscriber);
		return new Subscription() {
			@Override
			public void unsubscribe() {
				theListeners.remove(entry);
			}

			@Override
			public boolean isBound() {
				return entry.isAlive();
			}

			@Override
			public String toString() {
				return theName + ":" + entry;
			}
		};
	}

	/**
	 * @param listenerOrOwner A listener, an owner, or the handler of an owner-bound listener
	 * @return The number of bindings removed
	 */
	int unsubscribe(Object listenerOrOwner) {
		return theListeners.removeIf(entry -> entry.getOwner() == listenerOrOwner || entry.getListener().isHandler(listenerOrOwner));
	}

	/**
	 * @param owner The owner of the bindings to remove
	 * @param handler The handler of the bindings to remove
	 * @return The number of bindings removed
	 */
	int unsubscribe(Object owner, Object handler) {
		return theListeners.removeIf(entry -> entry.getOwner() == owner && entry.getListener().isHandler(handler));
	}

	/**
	 * Delivers an emission. Asynchronous listeners are scheduled first, then synchronous listeners are called in the order they were bound
	 * until one stops propagation, then all waiters from {@link #next()} are completed.
	 *
	 * @param emission The emission to deliver
	 * @param onTask Receives each task scheduled for an asynchronous listener
	 * @return {@link Propagation#STOP} if a synchronous listener stopped propagation
	 */
	Propagation fire(Emission emission, BiConsumer<String, CompletableFuture<Void>> onTask) {
		List<Entry<Subscriber>> listeners = theListeners.snapshot();
		if (logger.isTraceEnabled())
			logger.trace("Emitting {} to {} listeners", emission, listeners.size());
		for (Entry<Subscriber> entry : listeners) {
			if (!entry.getListener().isAsync())
				continue;
			Object owner = entry.getOwner();
			if (owner != null && entry.isAlive())
				onTask.accept(theName, entry.getListener().schedule(owner, emission));
		}
		Propagation result = Propagation.CONTINUE;
		for (Entry<Subscriber> entry : listeners) {
			if (entry.getListener().isAsync())
				continue;
			Object owner = entry.getOwner();
			if (owner == null || !entry.isAlive())
				continue;
			if (entry.getListener().call(owner, emission) == Propagation.STOP) {
				logger.trace("Propagation of {} stopped by {}", emission, owner);
				result = Propagation.STOP;
				break;
			}
		}
		List<CompletableFuture<Emission>> waiters;
		synchronized (theWaiters) {
			if (theWaiters.isEmpty())
				return result;
			waiters = new ArrayList<>(theWaiters);
			theWaiters.clear();
		}
		for (CompletableFuture<Emission> waiter : waiters)
			waiter.complete(emission);
		return result;
	}

	/**
	 * Creates a waiter for the next emission of this event. Waiters are not listeners: they do not count toward
	 * {@link #getListenerCount()} and are completed even if a listener stops propagation.
	 *
	 * @return A future that completes with the next emission of this event after this call
	 */
	public CompletableFuture<Emission> next() {
		CompletableFuture<Emission> waiter = new CompletableFuture<>();
		synchronized (theWaiters) {
			theWaiters.add(waiter);
		}
		// Drop cancelled waiters
		waiter.whenComplete((r, ex) -> {
			if (waiter.isCancelled()) {
				synchronized (theWaiters) {
					theWaiters.remove(waiter);
				}
			}
		});
		return waiter;
	}

	/** @return The number of live listeners bound to this event */
	public int getListenerCount() {
		return theListeners.size();
	}

	/** @return The number of live asynchronous listeners bound to this event */
	public int getAsyncListenerCount() {
		return theListeners.count(entry -> entry.getListener().isAsync());
	}

	/** @return The number of futures from {@link #next()} waiting for the next emission */
	public int getWaiterCount() {
		synchronized (theWaiters) {
			return theWaiters.size();
		}
	}

	@Override
	public String toString() {
		return theName;
	}
}
