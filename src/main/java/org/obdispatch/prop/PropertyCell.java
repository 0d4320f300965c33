package org.obdispatch.prop;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.obdispatch.Dispatcher;
import org.obdispatch.Emission;
import org.obdispatch.collect.ContainerParent;
import org.obdispatch.collect.ObservableContainers;

/**
 * Default {@link PropertyValue} implementation. Also the parent of the container the value holds, if any, so that modifications of the
 * container are emitted as changes of the property.
 *
 * @param <T> The type of the value
 */
final class PropertyCell<T> implements PropertyValue<T>, ContainerParent {
	private final Property<T> theProperty;
	private final Dispatcher theOwner;
	private T theValue;

	PropertyCell(Property<T> property, Dispatcher owner) {
		theProperty = property;
		theOwner = owner;
		theValue = property.createInitialValue(this);
	}

	@Override
	public Property<T> getProperty() {
		return theProperty;
	}

	@Override
	public Dispatcher getOwner() {
		return theOwner;
	}

	@Override
	public T get() {
		return theValue;
	}

	@Override
	public T set(T value) throws ValidationException {
		T newValue = theProperty.coerce(value, this);
		T old = theValue;
		if (theProperty.isEqual(old, newValue)) {
			if (newValue != value)
				ObservableContainers.detach(newValue);
			return old;
		}
		try {
			theProperty.validate(newValue);
		} catch (ValidationException e) {
			if (newValue != value)
				ObservableContainers.detach(newValue);
			throw e;
		}
		theValue = newValue;
		ObservableContainers.detach(old);
		fire(old);
		return old;
	}

	@Override
	public String isAcceptable(T value) {
		return theProperty.isAcceptable(value);
	}

	/** Emits the property's event for a modification of the container this property holds */
	@Override
	public void containerChanged() {
		fire(null);
	}

	private void fire(T old) {
		Map<String, Object> keywords = new LinkedHashMap<>();
		keywords.put(Emission.OLD_VALUE, old);
		keywords.put(Emission.PROPERTY, theProperty);
		theOwner.emit(theProperty.getName(), Arrays.asList(theOwner, theValue), keywords);
	}

	@Override
	public String toString() {
		return theProperty.getName() + "=" + theValue;
	}
}
