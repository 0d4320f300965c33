package org.obdispatch.aio;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.obdispatch.util.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * An {@link ExecutionContext} that runs its tasks one at a time, in submission order, on a single dedicated daemon thread. The loop is
 * ambient on its own thread, so asynchronous listeners bound from inside a task need not name it.
 */
public class EventLoop implements ExecutionContext, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(EventLoop.class);

	private final String theName;
	private final ExecutorService theExecutor;
	private volatile Thread theThread;

	/** Creates an event loop with a default name */
	public EventLoop() {
		this("event-loop");
	}

	/** @param name The name of the loop, used as its thread name prefix */
	public EventLoop(String name) {
		theName = name;
		theExecutor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()//
			.setNameFormat(name + "-%d").setDaemon(true)//
			.setUncaughtExceptionHandler((t, e) -> logger.error("Uncaught exception on {}", t.getName(), e))//
			.build());
	}

	/** @return The name of this loop */
	public String getName() {
		return theName;
	}

	/** @return Whether the calling thread is this loop's thread */
	public boolean inLoop() {
		return Thread.currentThread() == theThread;
	}

	/** @return Whether this loop has been closed */
	public boolean isClosed() {
		return theExecutor.isShutdown();
	}

	@Override
	public void execute(Runnable command) throws RejectedExecutionException {
		theExecutor.execute(() -> {
			theThread = Thread.currentThread();
			try (Transaction t = enter()) {
				command.run();
			}
		});
	}

	/**
	 * Runs a computation on this loop
	 *
	 * @param <T> The type of the result
	 * @param task The computation to run
	 * @return A future for the computation's result
	 */
	public <T> CompletableFuture<T> submit(Supplier<T> task) {
		return CompletableFuture.supplyAsync(task, this);
	}

	/** Stops this loop, waiting briefly for queued tasks to finish */
	@Override
	public void close() {
		theExecutor.shutdown();
		try {
			if (!theExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
				logger.warn("{} did not finish its tasks in time; interrupting", theName);
				theExecutor.shutdownNow();
			}
		} catch (InterruptedException e) {
			theExecutor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	@Override
	public String toString() {
		return theName;
	}
}
