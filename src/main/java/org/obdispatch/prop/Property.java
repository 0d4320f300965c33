package org.obdispatch.prop;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Function;

import org.obdispatch.Dispatcher;
import org.obdispatch.collect.ContainerParent;
import org.obdispatch.util.TypeTokens;

import com.google.common.base.Preconditions;
import com.google.common.reflect.TypeToken;

/**
 * Describes an observable attribute of a {@link Dispatcher} class. A property is declared once, as a {@code static final} field of the
 * dispatcher class, and each instance of the class holds its own {@link PropertyValue value} for it. Each property also implies an event
 * with the same name, which is emitted whenever the value changes:
 *
 * <pre>
 * public class Counter extends Dispatcher {
 * 	public static final Property&lt;Integer&gt; VALUE = Property.build("value", Integer.class).withDefault(0).build();
 * }
 *
 * counter.bind("value", listener);
 * counter.set(Counter.VALUE, 1); // Emits "value" with (counter, 1, old=0, property=VALUE)
 * counter.set(Counter.VALUE, 1); // Equal to the current value: nothing happens
 * </pre>
 *
 * @param <T> The type of the property's value
 */
public class Property<T> {
	private final String theName;
	private final TypeToken<T> theType;
	private final T theDefault;
	private final boolean isNullable;
	private final BiPredicate<? super T, ? super T> theEquality;
	private final Function<? super T, String> theValidator;
	private final String theDescription;

	/** @param builder The builder with this property's configuration */
	protected Property(AbstractBuilder<T, ?, ?> builder) {
		theName = builder.theName;
		theType = builder.theType;
		theDefault = builder.theDefault;
		isNullable = builder.isNullable;
		theEquality = builder.theEquality;
		theValidator = builder.theValidator;
		theDescription = builder.theDescription;
	}

	/** @return The name of this property, which is also the name of its event */
	public String getName() {
		return theName;
	}

	/** @return The type of this property's value */
	public TypeToken<T> getType() {
		return theType;
	}

	/** @return The value each dispatcher's value for this property starts with */
	public T getDefault() {
		return theDefault;
	}

	/** @return Whether null may be assigned to this property */
	public boolean isNullable() {
		return isNullable;
	}

	/** @return The documentation for this property, or null if none was given */
	public String getDescription() {
		return theDescription;
	}

	/**
	 * @param current The current value of the property
	 * @param value The value being assigned
	 * @return Whether the assignment is a no-op
	 */
	public boolean isEqual(T current, T value) {
		if (current == value)
			return true;
		else if (current == null || value == null)
			return false;
		return theEquality.test(current, value);
	}

	/**
	 * @param value The value to check
	 * @throws ValidationException If the value may not be assigned to this property
	 */
	public void validate(Object value) throws ValidationException {
		if (value == null) {
			if (!isNullable)
				throw new NoneNotAllowedException(this);
			return;
		}
		if (!TypeTokens.get().isInstance(theType, value))
			throw new InvalidTypeException(this, value);
		if (theValidator != null) {
			String msg = theValidator.apply((T) value);
			if (msg != null)
				throw new ValidationException(this, value, msg);
		}
	}

	/**
	 * @param value The value to check
	 * @return null if the value may be assigned to this property, or the reason it may not
	 */
	public String isAcceptable(Object value) {
		try {
			validate(value);
			return null;
		} catch (ValidationException e) {
			return e.getMessage();
		}
	}

	/**
	 * Converts an assigned value into the form this property stores. This happens before the value is compared or validated.
	 *
	 * @param value The assigned value
	 * @param parent The value holder the stored value will belong to
	 * @return The value to store
	 */
	protected T coerce(Object value, ContainerParent parent) {
		return (T) value;
	}

	/**
	 * @param parent The value holder the initial value will belong to
	 * @return The initial value for a new dispatcher's value of this property
	 */
	protected T createInitialValue(ContainerParent parent) {
		return coerce(theDefault, parent);
	}

	/**
	 * Creates a dispatcher's value holder for this property. This is called by the dispatcher the first time the property is accessed on
	 * it.
	 *
	 * @param owner The dispatcher to create the value for
	 * @return The new value holder
	 */
	public PropertyValue<T> createValue(Dispatcher owner) {
		return new PropertyCell<>(this, owner);
	}

	/** @return A description of what values this property accepts, e.g. for documentation */
	public String describeConstraints() {
		StringBuilder str = new StringBuilder(TypeTokens.getSimpleName(theType));
		if (!isNullable)
			str.append(", not null");
		describe(str);
		return str.toString();
	}

	/**
	 * Appends subclass-specific constraints to {@link #describeConstraints()}
	 *
	 * @param str The string builder to append to
	 */
	protected void describe(StringBuilder str) {
		if (theValidator != null)
			str.append(", validated");
	}

	@Override
	public String toString() {
		return theName;
	}

	/**
	 * @param <T> The type of the property
	 * @param name The name of the property
	 * @param type The type of the property
	 * @return A builder for the property
	 */
	public static <T> Builder<T> build(String name, Class<T> type) {
		return new Builder<>(name, TypeTokens.get().of(type));
	}

	/**
	 * @param <T> The type of the property
	 * @param name The name of the property
	 * @param type The type of the property
	 * @return A builder for the property
	 */
	public static <T> Builder<T> build(String name, TypeToken<T> type) {
		return new Builder<>(name, type);
	}

	/**
	 * Configures and builds properties
	 *
	 * @param <T> The type of the property
	 * @param <P> The type of property built
	 * @param <B> The sub-type of this builder
	 */
	public static abstract class AbstractBuilder<T, P extends Property<T>, B extends AbstractBuilder<T, P, B>> {
		private final String theName;
		private final TypeToken<T> theType;
		private T theDefault;
		private boolean isNullable;
		private BiPredicate<? super T, ? super T> theEquality;
		private Function<? super T, String> theValidator;
		private String theDescription;

		/**
		 * @param name The name of the property
		 * @param type The type of the property
		 * @param defaultValue The initial default value for the property
		 * @param nullable Whether the property accepts null by default
		 */
		protected AbstractBuilder(String name, TypeToken<T> type, T defaultValue, boolean nullable) {
			Preconditions.checkArgument(name != null && !name.isEmpty(), "A property must have a name");
			theName = name;
			theType = Preconditions.checkNotNull(type, "type");
			theDefault = defaultValue;
			isNullable = nullable;
			theEquality = Objects::equals;
		}

		/** @return The name of the property */
		protected String getName() {
			return theName;
		}

		/**
		 * @param defaultValue The value each dispatcher's value for the property starts with
		 * @return This builder
		 */
		public B withDefault(T defaultValue) {
			theDefault = defaultValue;
			return (B) this;
		}

		/**
		 * @param nullable Whether the property accepts null
		 * @return This builder
		 */
		public B nullable(boolean nullable) {
			isNullable = nullable;
			return (B) this;
		}

		/**
		 * @param equality The test for whether an assigned value is the same as the current one, in which case nothing is emitted. The
		 *        default is {@link Object#equals(Object)}. The test is never given null.
		 * @return This builder
		 */
		public B withEquality(BiPredicate<? super T, ? super T> equality) {
			theEquality = Preconditions.checkNotNull(equality, "equality");
			return (B) this;
		}

		/**
		 * @param validator A function returning null for acceptable values and the reason for rejection for others. It is never given null.
		 * @return This builder
		 */
		public B withValidator(Function<? super T, String> validator) {
			theValidator = validator;
			return (B) this;
		}

		/**
		 * @param description The documentation for the property
		 * @return This builder
		 */
		public B withDescription(String description) {
			theDescription = description;
			return (B) this;
		}

		/** @return A new property with this builder's configuration */
		protected abstract P create();

		/**
		 * @return The property
		 * @throws ValidationException If the default value is not acceptable for the property
		 */
		public P build() throws ValidationException {
			P property = create();
			property.validate(property.getDefault());
			return property;
		}
	}

	/**
	 * Builds plain {@link Property properties}
	 *
	 * @param <T> The type of the property
	 */
	public static class Builder<T> extends AbstractBuilder<T, Property<T>, Builder<T>> {
		Builder(String name, TypeToken<T> type) {
			super(name, type, null, true);
		}

		@Override
		protected Property<T> create() {
			return new Property<>(this);
		}
	}
}
