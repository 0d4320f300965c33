package org.obdispatch.aio;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;

/**
 * Retains the asynchronous listener tasks that emissions of a set of events schedule while this tracker is open, so that code can wait
 * for all of them to finish. Outside any open tracker, scheduled tasks are not retained by anything.
 *
 * <p>
 * Obtained from {@link org.obdispatch.Dispatcher#trackCompletion(String...)}. Closing the tracker stops retaining tasks and waits for the
 * retained ones to complete. There is no timeout; code that needs one should wait on {@link #completion()} with one before closing.
 * </p>
 */
public class CompletionTracker implements AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(CompletionTracker.class);

	private final Set<String> theEventNames;
	private final ListMultimap<String, CompletableFuture<Void>> theTasks;
	private final Runnable theOnClose;
	private volatile boolean isClosed;

	/**
	 * @param eventNames The names of the events whose tasks to retain
	 * @param onClose Called once when this tracker is closed, to stop feeding it tasks
	 */
	public CompletionTracker(Set<String> eventNames, Runnable onClose) {
		theEventNames = ImmutableSet.copyOf(eventNames);
		theTasks = Multimaps.synchronizedListMultimap(ArrayListMultimap.create());
		theOnClose = onClose;
	}

	/** @return The names of the events whose tasks this tracker retains */
	public Set<String> getEventNames() {
		return theEventNames;
	}

	/**
	 * @param eventName The name of the event
	 * @return Whether this tracker is open and retains tasks for the given event
	 */
	public boolean tracks(String eventName) {
		return !isClosed && theEventNames.contains(eventName);
	}

	/**
	 * Called by the dispatcher for each task scheduled by an emission of a tracked event
	 *
	 * @param eventName The name of the emitted event
	 * @param task The task that was scheduled
	 */
	public void retain(String eventName, CompletableFuture<Void> task) {
		if (tracks(eventName))
			theTasks.put(eventName, task);
	}

	/**
	 * @param eventName The name of the event
	 * @return The number of tasks retained for the event
	 */
	public int getTaskCount(String eventName) {
		synchronized (theTasks) {
			return theTasks.get(eventName).size();
		}
	}

	/**
	 * @param eventName The name of the tracked event to wait for
	 * @return A future that completes when every task retained so far for the event has finished, successfully or not
	 */
	public CompletableFuture<Void> completion(String eventName) {
		Preconditions.checkArgument(theEventNames.contains(eventName), "Event \"%s\" is not tracked by this tracker", eventName);
		List<CompletableFuture<Void>> tasks;
		synchronized (theTasks) {
			tasks = new ArrayList<>(theTasks.get(eventName));
		}
		return allSettled(tasks);
	}

	/** @return A future that completes when every task retained so far has finished, successfully or not */
	public CompletableFuture<Void> completion() {
		List<CompletableFuture<Void>> tasks;
		synchronized (theTasks) {
			tasks = new ArrayList<>(theTasks.values());
		}
		return allSettled(tasks);
	}

	/** @return Whether this tracker has been closed */
	public boolean isClosed() {
		return isClosed;
	}

	/**
	 * Stops retaining tasks and blocks until all retained tasks have finished. This must not be called from the execution context the
	 * retained tasks run on, or it will wait forever.
	 */
	@Override
	public void close() {
		if (isClosed)
			return;
		isClosed = true;
		theOnClose.run();
		CompletableFuture<Void> done = completion();
		if (!done.isDone())
			logger.debug("Waiting for {} tasks of {}", theTasks.size(), theEventNames);
		done.join();
	}

	private static CompletableFuture<Void> allSettled(List<CompletableFuture<Void>> tasks) {
		CompletableFuture<?>[] settled = new CompletableFuture[tasks.size()];
		for (int i = 0; i < settled.length; i++)
			settled[i] = tasks.get(i).handle((r, ex) -> null);
		return CompletableFuture.allOf(settled);
	}

	@Override
	public String toString() {
		return "tracker" + theEventNames;
	}
}
