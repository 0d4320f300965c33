package org.obdispatch.collect;

import java.util.List;
import java.util.Map;

/** Static utilities for wrapping values into {@link ObservableContainer}s */
public final class ObservableContainers {
	private ObservableContainers() {}

	/**
	 * Wraps lists and maps, recursively, into observable containers reporting to the given parent. Any list or map is copied into a new
	 * container, even one that is already observable, so that every container has exactly one parent.
	 *
	 * @param value The value to wrap
	 * @param parent The parent for the new container
	 * @return A new {@link ObservableList} or {@link ObservableDict} if the value is a list or map, otherwise the value itself
	 */
	public static Object wrap(Object value, ContainerParent parent) {
		if (value instanceof List)
			return new ObservableList<>((List<?>) value, parent);
		else if (value instanceof Map)
			return new ObservableDict<>((Map<?, ?>) value, parent);
		else
			return value;
	}

	/**
	 * Detaches the value from its parent if it is an {@link ObservableContainer}
	 *
	 * @param value The value that is no longer held by its parent
	 */
	public static void detach(Object value) {
		if (value instanceof ObservableContainer)
			((ObservableContainer) value).detach();
	}
}
