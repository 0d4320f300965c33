package org.obdispatch.prop;

import org.obdispatch.Dispatcher;

/**
 * The value of one {@link Property} on one {@link Dispatcher}. Setting the value is the only way to change it, and a change always
 * emits the property's event on the dispatcher.
 *
 * @param <T> The type of the value
 */
public interface PropertyValue<T> {
	/** @return The property this is the value of */
	Property<T> getProperty();

	/** @return The dispatcher this value belongs to */
	Dispatcher getOwner();

	/** @return The current value */
	T get();

	/**
	 * Assigns the value. If the new value is equal to the current one (per the property's {@link Property#isEqual(Object, Object)
	 * equality}), nothing happens. Otherwise the value is validated, stored, and the property's event is emitted with
	 * {@code (owner, newValue, old=oldValue, property=property)}.
	 *
	 * @param value The value to assign
	 * @return The value held before this call
	 * @throws ValidationException If the value is not acceptable for the property
	 */
	T set(T value) throws ValidationException;

	/**
	 * @param value The value to check
	 * @return null if the value may be assigned, or the reason it may not
	 */
	String isAcceptable(T value);
}
