package org.obdispatch.prop;

import com.google.common.reflect.TypeToken;

/**
 * A {@link Property} holding a number, optionally bounded by an inclusive minimum and maximum
 *
 * @param <N> The type of number
 */
public abstract class NumberProperty<N extends Number & Comparable<N>> extends Property<N> {
	private final N theMin;
	private final N theMax;

	/** @param builder The builder with this property's configuration */
	protected NumberProperty(AbstractNumberBuilder<N, ?, ?> builder) {
		super(builder);
		theMin = builder.theMin;
		theMax = builder.theMax;
	}

	/** @return The smallest value this property accepts, or null if it is unbounded below */
	public N getMin() {
		return theMin;
	}

	/** @return The largest value this property accepts, or null if it is unbounded above */
	public N getMax() {
		return theMax;
	}

	@Override
	public void validate(Object value) throws ValidationException {
		super.validate(value);
		if (value == null)
			return;
		N number = (N) value;
		if ((theMin != null && number.compareTo(theMin) < 0) || (theMax != null && number.compareTo(theMax) > 0))
			throw new OutOfRangeException(this, number, describeRange());
	}

	/** @return A description of this property's range, e.g. {@code -10 <= value <= 10} */
	public String describeRange() {
		if (theMin != null && theMax != null)
			return theMin + " <= value <= " + theMax;
		else if (theMin != null)
			return "value >= " + theMin;
		else if (theMax != null)
			return "value <= " + theMax;
		else
			return "any";
	}

	@Override
	protected void describe(StringBuilder str) {
		if (theMin != null || theMax != null)
			str.append(", ").append(describeRange());
		super.describe(str);
	}

	/**
	 * Builds number properties
	 *
	 * @param <N> The type of number
	 * @param <P> The type of property built
	 * @param <B> The sub-type of this builder
	 */
	public static abstract class AbstractNumberBuilder<N extends Number & Comparable<N>, P extends NumberProperty<N>, B extends AbstractNumberBuilder<N, P, B>>
	extends AbstractBuilder<N, P, B> {
		private N theMin;
		private N theMax;

		/**
		 * @param name The name of the property
		 * @param type The type of the property
		 * @param defaultValue The initial default value for the property
		 */
		protected AbstractNumberBuilder(String name, TypeToken<N> type, N defaultValue) {
			super(name, type, defaultValue, false);
		}

		/**
		 * @param min The smallest value the property accepts, or null for no lower bound
		 * @return This builder
		 */
		public B withMin(N min) {
			theMin = min;
			return (B) this;
		}

		/**
		 * @param max The largest value the property accepts, or null for no upper bound
		 * @return This builder
		 */
		public B withMax(N max) {
			theMax = max;
			return (B) this;
		}

		/**
		 * @param min The smallest value the property accepts
		 * @param max The largest value the property accepts
		 * @return This builder
		 */
		public B withRange(N min, N max) {
			if (min != null && max != null && min.compareTo(max) > 0)
				throw new IllegalArgumentException("Minimum " + min + " is greater than maximum " + max + " for property " + getName());
			theMin = min;
			theMax = max;
			return (B) this;
		}
	}
}
