package org.obdispatch.prop;

import java.util.Collections;
import java.util.Map;

import org.obdispatch.collect.ContainerParent;
import org.obdispatch.collect.ObservableDict;

import com.google.common.reflect.TypeToken;

/**
 * A {@link Property} holding an {@link ObservableDict}. Any map assigned to the property, and its default, is copied into a new
 * observable dict owned by the dispatcher, so that modifying the map (or any list or map nested in it) emits the property's event with
 * no {@link org.obdispatch.Emission#OLD_VALUE old} value. Never null; defaults to an empty map.
 *
 * @param <K> The type of keys in the map
 * @param <V> The type of values in the map
 */
public class DictProperty<K, V> extends Property<Map<K, V>> {
	/** @param builder The builder with this property's configuration */
	protected DictProperty(Builder<K, V> builder) {
		super(builder);
	}

	@Override
	protected Map<K, V> coerce(Object value, ContainerParent parent) {
		if (value == null)
			return null;
		else if (value instanceof Map)
			return new ObservableDict<>((Map<K, V>) value, parent);
		throw new InvalidTypeException(this, value);
	}

	/**
	 * @param <K> The type of keys in the map
	 * @param <V> The type of values in the map
	 * @param name The name of the property
	 * @return A builder for the property
	 */
	public static <K, V> Builder<K, V> build(String name) {
		return new Builder<>(name, new TypeToken<Map<K, V>>() {});
	}

	/**
	 * Builds {@link DictProperty dict properties}
	 *
	 * @param <K> The type of keys in the map
	 * @param <V> The type of values in the map
	 */
	public static class Builder<K, V> extends AbstractBuilder<Map<K, V>, DictProperty<K, V>, Builder<K, V>> {
		Builder(String name, TypeToken<Map<K, V>> type) {
			super(name, type, Collections.emptyMap(), false);
		}

		@Override
		protected DictProperty<K, V> create() {
			return new DictProperty<>(this);
		}
	}
}
