package org.obdispatch;

/**
 * A synchronous listener bound on behalf of an owner object. The dispatcher holds the owner weakly and this listener strongly, so an
 * implementation must not capture the owner: it is handed the owner on each emission instead. A method reference such as
 * {@code Listener::onValue} is the typical implementation.
 *
 * @param <O> The type of the owner
 */
@FunctionalInterface
public interface BoundListener<O> {
	/**
	 * @param owner The owner the listener was bound for
	 * @param emission The emission to handle
	 * @return {@link Propagation#STOP} to prevent synchronous listeners bound after this one from receiving the emission
	 */
	Propagation onEvent(O owner, Emission emission);
}
