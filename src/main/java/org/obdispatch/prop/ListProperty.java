package org.obdispatch.prop;

import java.util.Collections;
import java.util.List;

import org.obdispatch.collect.ContainerParent;
import org.obdispatch.collect.ObservableList;

import com.google.common.reflect.TypeToken;

/**
 * A {@link Property} holding an {@link ObservableList}. Any list assigned to the property, and its default, is copied into a new
 * observable list owned by the dispatcher, so that modifying the list (or any list or map nested in it) emits the property's event with
 * no {@link org.obdispatch.Emission#OLD_VALUE old} value. Never null; defaults to an empty list.
 *
 * @param <E> The type of elements in the list
 */
public class ListProperty<E> extends Property<List<E>> {
	/** @param builder The builder with this property's configuration */
	protected ListProperty(Builder<E> builder) {
		super(builder);
	}

	@Override
	protected List<E> coerce(Object value, ContainerParent parent) {
		if (value == null)
			return null;
		else if (value instanceof List)
			return new ObservableList<>((List<E>) value, parent);
		throw new InvalidTypeException(this, value);
	}

	/**
	 * @param <E> The type of elements in the list
	 * @param name The name of the property
	 * @return A builder for the property
	 */
	public static <E> Builder<E> build(String name) {
		return new Builder<>(name, new TypeToken<List<E>>() {});
	}

	/**
	 * Builds {@link ListProperty list properties}
	 *
	 * @param <E> The type of elements in the list
	 */
	public static class Builder<E> extends AbstractBuilder<List<E>, ListProperty<E>, Builder<E>> {
		Builder(String name, TypeToken<List<E>> type) {
			super(name, type, Collections.emptyList(), false);
		}

		@Override
		protected ListProperty<E> create() {
			return new ListProperty<>(this);
		}
	}
}
