package org.obdispatch.collect;

import org.obdispatch.util.Transaction;

/**
 * A list or map that reports every modification of itself, or of any container nested in it, to its {@link ContainerParent parent}. The
 * chain of parents ends at the {@link org.obdispatch.prop.PropertyValue property} holding the outermost container, which emits its
 * change event with the whole current value.
 *
 * <p>
 * Parent links are weak: a container does not keep its parent alive.
 * </p>
 */
public interface ObservableContainer {
	/** @return The parent this container reports its changes to, or null if it is detached or the parent has been collected */
	ContainerParent getParent();

	/**
	 * Detaches this container from its parent. Containers are detached when they are removed from their parent or replaced as a property's
	 * value; modifications after that are not reported anywhere.
	 */
	void detach();

	/**
	 * Groups modifications so that they are reported once, when the returned transaction is closed, instead of once each. Batches may be
	 * nested; the report happens when the outermost one closes, and only if something was modified.
	 *
	 * @return The transaction to close to end the batch
	 */
	Transaction batch();
}
