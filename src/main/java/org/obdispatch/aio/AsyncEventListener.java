package org.obdispatch.aio;

import java.util.concurrent.CompletionStage;

import org.obdispatch.Emission;

/**
 * A listener whose handling of an emission runs as a task on an {@link ExecutionContext} and may complete later. Emitting never waits for
 * an asynchronous listener, and an asynchronous listener cannot stop propagation.
 *
 * <p>
 * Like {@link org.obdispatch.EventListener}, a dispatcher holds listeners of this type only weakly.
 * </p>
 */
@FunctionalInterface
public interface AsyncEventListener {
	/**
	 * Called on the listener's execution context
	 *
	 * @param emission The emission to handle
	 * @return A stage that completes when the handling is finished, or null if it finished already
	 */
	CompletionStage<?> onEvent(Emission emission);
}
