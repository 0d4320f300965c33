package org.obdispatch.util;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Stores an ordered set of listeners, each of which is only weakly reachable through this set. Every listener is registered against an
 * owner, which is held by a {@link WeakReference}; the payload registered with it is held strongly and so must not itself reference the
 * owner. Once the owner has been garbage-collected, its entry is dead and is dropped the next time this set is traversed.
 *
 * <p>
 * Listeners added or removed while this set is being iterated do not disturb the iteration: the iteration works over a snapshot, but skips
 * any entry that was removed after the snapshot was taken.
 * </p>
 *
 * @param <L> The type of the listener payload to store
 */
public class WeakListenerSet<L> {
	/**
	 * An entry in a {@link WeakListenerSet}
	 *
	 * @param <L> The type of the listener payload
	 */
	public static final class Entry<L> {
		private final WeakReference<Object> theOwner;
		private final L theListener;
		private volatile boolean isRemoved;

		Entry(Object owner, L listener) {
			theOwner = new WeakReference<>(owner);
			theListener = listener;
		}

		/** @return The owner of this entry, or null if it has been garbage-collected */
		public Object getOwner() {
			return theOwner.get();
		}

		/** @return The listener payload of this entry */
		public L getListener() {
			return theListener;
		}

		/** @return Whether this entry is still registered and its owner is still reachable */
		public boolean isAlive() {
			return !isRemoved && theOwner.get() != null;
		}

		@Override
		public String toString() {
			return theListener + "@" + theOwner.get();
		}
	}

	private final List<Entry<L>> theEntries;
	private final ReentrantReadWriteLock theLock;

	/** Creates the set of listeners */
	public WeakListenerSet() {
		theEntries = new ArrayList<>();
		theLock = new ReentrantReadWriteLock();
	}

	/**
	 * Adds a listener unless an equivalent one (same owner by identity, equal payload) is already present
	 *
	 * @param owner The owner to hold weakly
	 * @param listener The payload to register for the owner
	 * @return The new entry, or the existing equivalent entry
	 */
	public Entry<L> add(Object owner, L listener) {
		if (owner == null)
			throw new NullPointerException("Listener owner may not be null");
		Lock lock = theLock.writeLock();
		lock.lock();
		try {
			Iterator<Entry<L>> iter = theEntries.iterator();
			while (iter.hasNext()) {
				Entry<L> entry = iter.next();
				Object entryOwner = entry.getOwner();
				if (entryOwner == null) {
					entry.isRemoved = true;
					iter.remove();
				} else if (entryOwner == owner && entry.theListener.equals(listener))
					return entry;
			}
			Entry<L> entry = new Entry<>(owner, listener);
			theEntries.add(entry);
			return entry;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @param entry The entry to remove
	 * @return Whether the entry was removed (false if it was not in this set)
	 */
	public boolean remove(Entry<L> entry) {
		Lock lock = theLock.writeLock();
		lock.lock();
		try {
			entry.isRemoved = true;
			return theEntries.remove(entry);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * @param test The test for entries to remove
	 * @return The number of live entries that were removed
	 */
	public int removeIf(Predicate<? super Entry<L>> test) {
		Lock lock = theLock.writeLock();
		lock.lock();
		try {
			int removed = 0;
			Iterator<Entry<L>> iter = theEntries.iterator();
			while (iter.hasNext()) {
				Entry<L> entry = iter.next();
				if (entry.getOwner() == null) {
					entry.isRemoved = true;
					iter.remove();
				} else if (test.test(entry)) {
					entry.isRemoved = true;
					iter.remove();
					removed++;
				}
			}
			return removed;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Prunes dead entries and returns the live ones in the order they were added. Callers iterating the result should check
	 * {@link Entry#isAlive()} before using each entry, since entries may be removed or die after the snapshot is taken.
	 *
	 * @return A snapshot of the live entries in this set
	 */
	public List<Entry<L>> snapshot() {
		List<Entry<L>> snapshot;
		boolean anyDead = false;
		Lock lock = theLock.readLock();
		lock.lock();
		try {
			snapshot = new ArrayList<>(theEntries.size());
			for (Entry<L> entry : theEntries) {
				if (entry.getOwner() == null)
					anyDead = true;
				else
					snapshot.add(entry);
			}
		} finally {
			lock.unlock();
		}
		if (anyDead)
			removeIf(entry -> false);
		return snapshot;
	}

	/** @return The number of live entries in this set. Dead entries are pruned by this call. */
	public int size() {
		return count(entry -> true);
	}

	/**
	 * @param test The test for entries to count
	 * @return The number of live entries in this set that pass the test. Dead entries are pruned by this call.
	 */
	public int count(Predicate<? super Entry<L>> test) {
		removeIf(entry -> false);
		Lock lock = theLock.readLock();
		lock.lock();
		try {
			int count = 0;
			for (Entry<L> entry : theEntries) {
				if (test.test(entry))
					count++;
			}
			return count;
		} finally {
			lock.unlock();
		}
	}
}
