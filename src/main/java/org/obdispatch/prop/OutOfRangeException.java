package org.obdispatch.prop;

/** Thrown when a number outside a numeric {@link Property}'s range is assigned to it */
public class OutOfRangeException extends ValidationException {
	/**
	 * @param property The property the value was assigned to
	 * @param value The rejected value
	 * @param range A description of the property's range
	 */
	public OutOfRangeException(Property<?> property, Number value, String range) {
		super(property, value, "Value " + value + " must be in range \"" + range + "\"");
	}
}
