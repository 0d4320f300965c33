package org.obdispatch.prop;

import org.obdispatch.util.TypeTokens;

/** A {@link Property} holding a boolean. Rejects null unless built otherwise; defaults to false. */
public class BooleanProperty extends Property<Boolean> {
	/** @param builder The builder with this property's configuration */
	protected BooleanProperty(Builder builder) {
		super(builder);
	}

	/**
	 * @param name The name of the property
	 * @return A builder for the property
	 */
	public static Builder build(String name) {
		return new Builder(name);
	}

	/** Builds {@link BooleanProperty boolean properties} */
	public static class Builder extends AbstractBuilder<Boolean, BooleanProperty, Builder> {
		Builder(String name) {
			super(name, TypeTokens.get().BOOLEAN, Boolean.FALSE, false);
		}

		@Override
		protected BooleanProperty create() {
			return new BooleanProperty(this);
		}
	}
}
