package org.obdispatch.prop;

import org.obdispatch.util.TypeTokens;

/** A {@link Property} holding a string. Accepts null unless built otherwise; defaults to null. */
public class StringProperty extends Property<String> {
	/** @param builder The builder with this property's configuration */
	protected StringProperty(Builder builder) {
		super(builder);
	}

	/**
	 * @param name The name of the property
	 * @return A builder for the property
	 */
	public static Builder build(String name) {
		return new Builder(name);
	}

	/** Builds {@link StringProperty string properties} */
	public static class Builder extends AbstractBuilder<String, StringProperty, Builder> {
		Builder(String name) {
			super(name, TypeTokens.get().STRING, null, true);
		}

		@Override
		protected StringProperty create() {
			return new StringProperty(this);
		}
	}
}
