package org.obdispatch.collect;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.RandomAccess;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import org.obdispatch.util.Transaction;

/**
 * A list that reports every modification, including modifications of lists and maps nested in it, to its parent. Lists and maps added to
 * an observable list are copied into nested observable containers.
 *
 * <p>
 * Bulk operations ({@link #addAll(Collection) addAll}, {@link #clear() clear}, {@link #removeIf(Predicate) removeIf},
 * {@link #replaceAll(UnaryOperator) replaceAll}, {@link #sort(Comparator) sort}, and {@link #subList(int, int) sub list} clearing) report
 * once per call.
 * </p>
 *
 * @param <E> The type of elements in the list
 */
public class ObservableList<E> extends AbstractList<E> implements ObservableContainer, ContainerParent, RandomAccess {
	private final ArrayList<E> theValues;
	private final ChangePropagator theChanges;

	/** Creates an empty, detached list */
	public ObservableList() {
		this(Collections.emptyList(), null);
	}

	/**
	 * @param values The initial values for the list, which are wrapped as they would be if added
	 * @param parent The parent to report changes to, or null
	 */
	public ObservableList(Collection<? extends E> values, ContainerParent parent) {
		theChanges = new ChangePropagator(parent);
		theValues = new ArrayList<>(values.size());
		for (E value : values)
			theValues.add(wrap(value));
	}

	private E wrap(E value) {
		return (E) ObservableContainers.wrap(value, this);
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
	public E get(int index) {
		return theValues.get(index);
	}

	@Override
	public int size() {
		return theValues.size();
	}

	@Override
	public E set(int index, E element) {
		E old = theValues.set(index, wrap(element));
		ObservableContainers.detach(old);
		theChanges.changed();
		return old;
	}

	@Override
	public void add(int index, E element) {
		theValues.add(index, wrap(element));
		modCount++;
		theChanges.changed();
	}

	@Override
	public E remove(int index) {
		E old = theValues.remove(index);
		modCount++;
		ObservableContainers.detach(old);
		theChanges.changed();
		return old;
	}

	@Override
	public boolean addAll(Collection<? extends E> c) {
		return addAll(theValues.size(), c);
	}

	@Override
	public boolean addAll(int index, Collection<? extends E> c) {
		if (index < 0 || index > theValues.size())
			throw new IndexOutOfBoundsException(index + " of " + theValues.size());
		if (c.isEmpty())
			return false;
		List<E> wrapped = new ArrayList<>(c.size());
		for (E value : c)
			wrapped.add(wrap(value));
		theValues.addAll(index, wrapped);
		modCount++;
		theChanges.changed();
		return true;
	}

	@Override
	public void clear() {
		for (E value : theValues)
			ObservableContainers.detach(value);
		theValues.clear();
		modCount++;
		theChanges.changed();
	}

	@Override
	protected void removeRange(int fromIndex, int toIndex) {
		if (fromIndex == toIndex)
			return;
		List<E> range = theValues.subList(fromIndex, toIndex);
		for (E value : range)
			ObservableContainers.detach(value);
		range.clear();
		modCount++;
		theChanges.changed();
	}

	@Override
	public boolean removeIf(Predicate<? super E> filter) {
		try (Transaction t = batch()) {
			return super.removeIf(filter);
		}
	}

	@Override
	public void replaceAll(UnaryOperator<E> operator) {
		if (theValues.isEmpty())
			return;
		for (int i = 0; i < theValues.size(); i++) {
			E old = theValues.get(i);
			E replacement = operator.apply(old);
			if (replacement != old) {
				theValues.set(i, wrap(replacement));
				ObservableContainers.detach(old);
			}
		}
		theChanges.changed();
	}

	@Override
	public void sort(Comparator<? super E> c) {
		theValues.sort(c);
		modCount++;
		theChanges.changed();
	}
}
