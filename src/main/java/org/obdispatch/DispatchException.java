package org.obdispatch;

/** The base type of exceptions thrown by dispatchers for unknown, conflicting or unbindable event names */
public class DispatchException extends RuntimeException {
	/** @param message The message for the exception */
	public DispatchException(String message) {
		super(message);
	}

	/**
	 * @param message The message for the exception
	 * @param cause The exception that caused this exception
	 */
	public DispatchException(String message, Throwable cause) {
		super(message, cause);
	}
}
