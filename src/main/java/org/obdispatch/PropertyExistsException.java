package org.obdispatch;

/** Thrown when an event, or a second distinct property, is declared with the name of an existing property */
public class PropertyExistsException extends ExistsException {
	/** @param name The conflicting name */
	public PropertyExistsException(String name) {
		super(name, "A property named \"" + name + "\" already exists");
	}
}
