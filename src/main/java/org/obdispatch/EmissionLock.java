package org.obdispatch;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.obdispatch.util.Transaction;

/**
 * Holds back the emissions of one event of one dispatcher while any hold on it is open. Only the most recent held emission is kept, and
 * it is delivered once the outermost hold is closed. Holds are re-entrant for the thread that opened them; other threads opening a hold
 * wait until the current holder is done.
 */
final class EmissionLock {
	private final String theName;
	private final ReentrantLock theLock;
	private Emission theLastEmission;

	EmissionLock(String name) {
		theName = name;
		theLock = new ReentrantLock();
	}

	boolean isHeld() {
		return theLock.isLocked();
	}

	/**
	 * @param emission The emission to hold back
	 * @return Whether the emission was held, false if no hold is open and the emission should be delivered now
	 */
	synchronized boolean capture(Emission emission) {
		if (!theLock.isLocked())
			return false;
		theLastEmission = emission;
		return true;
	}

	/**
	 * @param deliver Delivers the last held emission when the outermost hold is closed
	 * @return The transaction to close to release the hold
	 */
	Transaction hold(Consumer<Emission> deliver) {
		theLock.lock();
		boolean[] closed = new boolean[1];
		return () -> {
			if (closed[0])
				return;
			closed[0] = true;
			boolean unlocked = false;
			try {
				// Deliver while still locked, so that another thread's hold can't deliver first.
				// Emissions captured during delivery are delivered in turn.
				while (!unlocked) {
					Emission last = null;
					synchronized (this) {
						if (theLock.getHoldCount() == 1 && theLastEmission != null) {
							last = theLastEmission;
							theLastEmission = null;
						} else {
							theLock.unlock();
							unlocked = true;
						}
					}
					if (last != null)
						deliver.accept(last);
				}
			} finally {
				if (!unlocked)
					theLock.unlock();
			}
		};
	}

	@Override
	public String toString() {
		return "hold(" + theName + ")";
	}
}
