package org.obdispatch.prop;

/** Thrown when a value of the wrong type is assigned to a {@link Property} */
public class InvalidTypeException extends ValidationException {
	/**
	 * @param property The property the value was assigned to
	 * @param value The rejected value
	 */
	public InvalidTypeException(Property<?> property, Object value) {
		super(property, value, "Type \"" + value.getClass().getSimpleName() + "\" not valid");
	}
}
