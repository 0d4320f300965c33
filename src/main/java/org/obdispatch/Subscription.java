package org.obdispatch;

import java.util.Collection;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A listener binding returned by the {@code bind} methods of a {@link Dispatcher}. Unsubscribing removes exactly the binding(s) this
 * subscription represents; other bindings of the same listener are unaffected.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
	/** Removes the binding. Does nothing if the binding has already been removed or its owner has been collected. */
	void unsubscribe();

	@Override
	default void close() {
		unsubscribe();
	}

	/** @return Whether the binding is still in effect, i.e. neither unsubscribed nor dead */
	default boolean isBound() {
		return true;
	}

	/**
	 * @param subs The subscriptions to bundle
	 * @return A single subscription whose {@link #unsubscribe()} method unsubscribes all of the given subscriptions, or {@link #NONE} if
	 *         there are none
	 */
	static Subscription forAll(Collection<? extends Subscription> subs) {
		if (subs.isEmpty())
			return NONE;
		List<Subscription> copy = ImmutableList.copyOf(subs);
		return new Subscription() {
			@Override
			public void unsubscribe() {
				for (Subscription sub : copy)
					sub.unsubscribe();
			}

			@Override
			public boolean isBound() {
				for (Subscription sub : copy) {
					if (sub.isBound())
						return true;
				}
				return false;
			}

			@Override
			public String toString() {
				return copy.toString();
			}
		};
	}

	/** A subscription that binds nothing */
	static Subscription NONE = new Subscription() {
		@Override
		public void unsubscribe() {}

		@Override
		public boolean isBound() {
			return false;
		}

		@Override
		public String toString() {
			return "NONE";
		}
	};
}
