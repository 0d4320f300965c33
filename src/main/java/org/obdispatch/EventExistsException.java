package org.obdispatch;

/** Thrown when a property is declared with the name of an existing event */
public class EventExistsException extends ExistsException {
	/** @param name The conflicting name */
	public EventExistsException(String name) {
		super(name, "An event named \"" + name + "\" already exists");
	}
}
