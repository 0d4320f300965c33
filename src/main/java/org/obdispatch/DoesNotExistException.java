package org.obdispatch;

/** Thrown when an emission, binding or lookup refers to an event or property name that was never registered */
public class DoesNotExistException extends DispatchException {
	private final String theName;

	/** @param name The name of the unknown event */
	public DoesNotExistException(String name) {
		this(name, "Event \"" + name + "\" is not registered");
	}

	/**
	 * @param name The unknown name
	 * @param message The message for the exception
	 */
	public DoesNotExistException(String name, String message) {
		super(message);
		theName = name;
	}

	/** @return The name that was not found */
	public String getName() {
		return theName;
	}
}
