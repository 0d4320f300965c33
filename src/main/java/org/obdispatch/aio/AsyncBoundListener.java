package org.obdispatch.aio;

import java.util.concurrent.CompletionStage;

import org.obdispatch.Emission;

/**
 * An {@link AsyncEventListener asynchronous listener} bound on behalf of an owner object, which the dispatcher holds weakly. An
 * implementation must not capture the owner.
 *
 * @param <O> The type of the owner
 */
@FunctionalInterface
public interface AsyncBoundListener<O> {
	/**
	 * Called on the listener's execution context
	 *
	 * @param owner The owner the listener was bound for
	 * @param emission The emission to handle
	 * @return A stage that completes when the handling is finished, or null if it finished already
	 */
	CompletionStage<?> onEvent(O owner, Emission emission);
}
