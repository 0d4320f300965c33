package org.obdispatch.collect;

import java.lang.ref.WeakReference;

import org.obdispatch.util.Transaction;

/** The parent link and batching state shared by {@link ObservableList} and {@link ObservableDict} */
final class ChangePropagator {
	private volatile WeakReference<ContainerParent> theParent;
	private int theBatchDepth;
	private boolean isDirty;

	ChangePropagator(ContainerParent parent) {
		theParent = parent == null ? null : new WeakReference<>(parent);
	}

	ContainerParent getParent() {
		WeakReference<ContainerParent> parent = theParent;
		return parent == null ? null : parent.get();
	}

	void detach() {
		theParent = null;
	}

	Transaction batch() {
		theBatchDepth++;
		boolean[] closed = new boolean[1];
		return () -> {
			if (closed[0])
				return;
			closed[0] = true;
			if (--theBatchDepth == 0 && isDirty) {
				isDirty = false;
				propagate();
			}
		};
	}

	void changed() {
		if (theBatchDepth > 0)
			isDirty = true;
		else
			propagate();
	}

	private void propagate() {
		ContainerParent parent = getParent();
		if (parent != null)
			parent.containerChanged();
	}
}
