package org.obdispatch.prop;

import org.obdispatch.collect.ContainerParent;
import org.obdispatch.util.TypeTokens;

/**
 * A {@link NumberProperty} holding a floating-point number. Any other {@link Number} except a {@link Double} assigned to it is converted
 * to a double first. Rejects null unless built otherwise; defaults to 0.0.
 */
public class DoubleProperty extends NumberProperty<Double> {
	/** @param builder The builder with this property's configuration */
	protected DoubleProperty(Builder builder) {
		super(builder);
	}

	@Override
	protected Double coerce(Object value, ContainerParent parent) {
		if (value == null || value instanceof Double)
			return (Double) value;
		else if (value instanceof Number)
			return ((Number) value).doubleValue();
		throw new InvalidTypeException(this, value);
	}

	@Override
	public void validate(Object value) throws ValidationException {
		if (value instanceof Number && !(value instanceof Double))
			value = ((Number) value).doubleValue();
		super.validate(value);
	}

	/**
	 * @param name The name of the property
	 * @return A builder for the property
	 */
	public static Builder build(String name) {
		return new Builder(name);
	}

	/** Builds {@link DoubleProperty double properties} */
	public static class Builder extends AbstractNumberBuilder<Double, DoubleProperty, Builder> {
		Builder(String name) {
			super(name, TypeTokens.get().DOUBLE, 0.0);
		}

		@Override
		protected DoubleProperty create() {
			return new DoubleProperty(this);
		}
	}
}
