package org.obdispatch.prop;

/** Thrown when a value assigned to a {@link Property} is rejected. The property keeps its previous value and nothing is emitted. */
public class ValidationException extends IllegalArgumentException {
	private final transient Property<?> theProperty;
	private final transient Object theValue;

	/**
	 * @param property The property the value was assigned to
	 * @param value The rejected value
	 * @param message The reason the value was rejected
	 */
	public ValidationException(Property<?> property, Object value, String message) {
		super(message + " for property \"" + property.getName() + "\"");
		theProperty = property;
		theValue = value;
	}

	/** @return The property the value was assigned to */
	public Property<?> getProperty() {
		return theProperty;
	}

	/** @return The rejected value */
	public Object getValue() {
		return theValue;
	}
}
