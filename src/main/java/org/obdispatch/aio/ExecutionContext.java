package org.obdispatch.aio;

import java.util.Optional;
import java.util.concurrent.Executor;

import org.obdispatch.util.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * A task scheduler that {@link AsyncEventListener asynchronous listeners} run on. Each thread may have one ambient context, which is used
 * when an asynchronous listener is bound without specifying one.
 */
public interface ExecutionContext extends Executor {
	/** @return The context that is ambient on the calling thread, if any */
	static Optional<ExecutionContext> current() {
		return Optional.ofNullable(AmbientContexts.get());
	}

	/**
	 * Makes this context ambient on the calling thread until the returned transaction is closed
	 *
	 * @return The transaction to close to restore the previously ambient context
	 */
	default Transaction enter() {
		ExecutionContext old = AmbientContexts.set(this);
		Thread thread = Thread.currentThread();
		return () -> {
			if (Thread.currentThread() != thread)
				throw new IllegalStateException("An execution context must be exited on the thread that entered it");
			AmbientContexts.set(old);
		};
	}

	/**
	 * Called when a task scheduled on this context fails. Failures of asynchronous listeners are never reported back to the code that
	 * emitted the event.
	 *
	 * @param failure The failure
	 * @param source A description of the task that failed
	 */
	default void reportFailure(Throwable failure, Object source) {
		LoggerFactory.getLogger(ExecutionContext.class).warn("Asynchronous listener {} failed on {}", source, this, failure);
	}

	/**
	 * @param executor The executor to run tasks on
	 * @return An execution context that runs its tasks on the given executor, with itself ambient while each task runs
	 */
	static ExecutionContext of(Executor executor) {
		Preconditions.checkNotNull(executor, "executor");
		if (executor instanceof ExecutionContext)
			return (ExecutionContext) executor;
		return new ExecutorContext(executor);
	}

	/** Implements {@link ExecutionContext#of(Executor)} */
	class ExecutorContext implements ExecutionContext {
		private static final Logger logger = LoggerFactory.getLogger(ExecutorContext.class);

		private final Executor theExecutor;

		ExecutorContext(Executor executor) {
			theExecutor = executor;
		}

		@Override
		public void execute(Runnable command) {
			theExecutor.execute(() -> {
				try (Transaction t = enter()) {
					command.run();
				} catch (RuntimeException | Error e) {
					logger.error("Uncaught exception in task on {}", this, e);
					throw e;
				}
			});
		}

		@Override
		public String toString() {
			return "context(" + theExecutor + ")";
		}
	}
}
