package org.obdispatch.collect;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

import org.obdispatch.util.Transaction;

/**
 * A map that reports every modification, including modifications of lists and maps nested in it, to its parent. Lists and maps put into
 * an observable dict are copied into nested observable containers. Iteration follows insertion order.
 *
 * <p>
 * Removal through any of the map's views, and {@link Map.Entry#setValue(Object) setValue} on its entries, are reported like the
 * corresponding map operations. {@link #putAll(Map) putAll}, {@link #clear() clear} and {@link #replaceAll(BiFunction) replaceAll} report
 * once per call.
 * </p>
 *
 * @param <K> The type of keys in the map
 * @param <V> The type of values in the map
 */
public class ObservableDict<K, V> extends AbstractMap<K, V> implements ObservableContainer, ContainerParent {
	private final LinkedHashMap<K, V> theValues;
	private final ChangePropagator theChanges;
	private EntrySet theEntrySet;

	/** Creates an empty, detached map */
	public ObservableDict() {
		this(Collections.emptyMap(), null);
	}

	/**
	 * @param values The initial entries for the map, whose values are wrapped as they would be if put
	 * @param parent The parent to report changes to, or null
	 */
	public ObservableDict(Map<? extends K, ? extends V> values, ContainerParent parent) {
		theChanges = new ChangePropagator(parent);
		theValues = new LinkedHashMap<>();
		for (Map.Entry<? extends K, ? extends V> entry : values.entrySet())
			theValues.put(entry.getKey(), wrap(entry.getValue()));
	}

	private V wrap(V value) {
		return (V) ObservableContainers.wrap(value, this);
	}

	@Override
	public ContainerParent getParent() {
		return theChanges.getParent();
	}

	@Override
	public void detach() {
		theChanges.detach();
	}

	@Override
	public Transaction batch() {
		return theChanges.batch();
	}

	@Override
	public void containerChanged() {
		theChanges.changed();
	}

	@Override
	public int size() {
		return theValues.size();
	}

	@Override
	public boolean containsKey(Object key) {
		return theValues.containsKey(key);
	}

	@Override
	public V get(Object key) {
		return theValues.get(key);
	}

	@Override
	public V put(K key, V value) {
		V old = theValues.put(key, wrap(value));
		ObservableContainers.detach(old);
		theChanges.changed();
		return old;
	}

	@Override
	public V remove(Object key) {
		if (!theValues.containsKey(key))
			return null;
		V old = theValues.remove(key);
		ObservableContainers.detach(old);
		theChanges.changed();
		return old;
	}

	@Override
	public void putAll(Map<? extends K, ? extends V> m) {
		try (Transaction t = batch()) {
			for (Map.Entry<? extends K, ? extends V> entry : m.entrySet())
				put(entry.getKey(), entry.getValue());
		}
	}

	@Override
	public void clear() {
		for (V value : theValues.values())
			ObservableContainers.detach(value);
		theValues.clear();
		theChanges.changed();
	}

	@Override
	public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
		try (Transaction t = batch()) {
			super.replaceAll(function);
		}
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		if (theEntrySet == null)
			theEntrySet = new EntrySet();
		return theEntrySet;
	}

	private class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public int size() {
			return theValues.size();
		}

		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			Iterator<Map.Entry<K, V>> backing = theValues.entrySet().iterator();
			return new Iterator<Map.Entry<K, V>>() {
				private Map.Entry<K, V> theLast;

				@Override
				public boolean hasNext() {
					return backing.hasNext();
				}

				@Override
				public Map.Entry<K, V> next() {
					theLast = backing.next();
					return new DictEntry(theLast);
				}

				@Override
				public void remove() {
					backing.remove();
					ObservableContainers.detach(theLast.getValue());
					theChanges.changed();
				}
			};
		}
	}

	private class DictEntry implements Map.Entry<K, V> {
		private final Map.Entry<K, V> theBacking;

		DictEntry(Map.Entry<K, V> backing) {
			theBacking = backing;
		}

		@Override
		public K getKey() {
			return theBacking.getKey();
		}

		@Override
		public V getValue() {
			return theBacking.getValue();
		}

		@Override
		public V setValue(V value) {
			V old = theBacking.setValue(wrap(value));
			ObservableContainers.detach(old);
			theChanges.changed();
			return old;
		}

		@Override
		public int hashCode() {
			return theBacking.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return theBacking.equals(obj);
		}

		@Override
		public String toString() {
			return theBacking.toString();
		}
	}
}
