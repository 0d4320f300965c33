package org.obdispatch;

/**
 * Thrown when an {@link org.obdispatch.aio.AsyncEventListener asynchronous listener} is bound without an explicit
 * {@link org.obdispatch.aio.ExecutionContext execution context} and none is ambient on the calling thread
 */
public class BindingContextException extends DispatchException {
	/** @param eventName The name of the event the listener was to be bound to */
	public BindingContextException(String eventName) {
		super("Asynchronous listener given for \"" + eventName + "\" without an execution context");
	}
}
