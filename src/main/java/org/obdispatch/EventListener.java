package org.obdispatch;

import java.util.function.Consumer;

/**
 * A synchronous listener for emissions of an {@link Event}.
 *
 * <p>
 * A dispatcher holds listeners of this type only {@link java.lang.ref.WeakReference weakly}. Code binding one must keep it reachable, e.g.
 * in a field of the object that wants the notifications, for as long as the notifications are wanted.
 * </p>
 */
@FunctionalInterface
public interface EventListener {
	/**
	 * @param emission The emission to handle
	 * @return {@link Propagation#STOP} to prevent synchronous listeners bound after this one from receiving the emission
	 */
	Propagation onEvent(Emission emission);

	/**
	 * @param action The action to perform for each emission
	 * @return A listener that performs the action and always continues propagation
	 */
	static EventListener of(Consumer<? super Emission> action) {
		return new EventListener() {
			@Override
			public Propagation onEvent(Emission emission) {
				action.accept(emission);
				return Propagation.CONTINUE;
			}

			@Override
			public String toString() {
				return action.toString();
			}
		};
	}
}
