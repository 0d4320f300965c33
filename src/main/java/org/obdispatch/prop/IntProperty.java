package org.obdispatch.prop;

import org.obdispatch.util.TypeTokens;

/** A {@link NumberProperty} holding an integer. Rejects null unless built otherwise; defaults to 0. */
public class IntProperty extends NumberProperty<Integer> {
	/** @param builder The builder with this property's configuration */
	protected IntProperty(Builder builder) {
		super(builder);
	}

	/**
	 * @param name The name of the property
	 * @return A builder for the property
	 */
	public static Builder build(String name) {
		return new Builder(name);
	}

	/** Builds {@link IntProperty integer properties} */
	public static class Builder extends AbstractNumberBuilder<Integer, IntProperty, Builder> {
		Builder(String name) {
			super(name, TypeTokens.get().INT, 0);
		}

		@Override
		protected IntProperty create() {
			return new IntProperty(this);
		}
	}
}
