package org.obdispatch.prop;

/** Thrown when null is assigned to a {@link Property} that does not allow it */
public class NoneNotAllowedException extends ValidationException {
	/** @param property The property null was assigned to */
	public NoneNotAllowedException(Property<?> property) {
		super(property, null, "\"null\" not allowed");
	}
}
