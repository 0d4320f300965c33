package org.obdispatch.collect;

/** Something an {@link ObservableContainer} reports its changes to: an enclosing container, or the property holding the container */
@FunctionalInterface
public interface ContainerParent {
	/** Called after a child container, or anything nested in it, has been modified */
	void containerChanged();
}
