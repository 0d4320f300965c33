package org.obdispatch;

/** Thrown when a name is declared with a kind that conflicts with an existing declaration of the same name */
public class ExistsException extends DispatchException {
	private final String theName;

	/**
	 * @param name The conflicting name
	 * @param message The message for the exception
	 */
	public ExistsException(String name, String message) {
		super(message);
		theName = name;
	}

	/** @return The conflicting name */
	public String getName() {
		return theName;
	}
}
