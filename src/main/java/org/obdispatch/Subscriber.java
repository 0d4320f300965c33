package org.obdispatch;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BiFunction;

import org.obdispatch.aio.AsyncBoundListener;
import org.obdispatch.aio.AsyncEventListener;
import org.obdispatch.aio.ExecutionContext;

/**
 * The payload an {@link Event} registers for each binding. The owner of the binding is held weakly by the event's listener set; this class
 * only holds what must be strongly reachable to call the owner: the user's handler (if the owner is not itself the listener) and the
 * execution context for asynchronous listeners.
 */
final class Subscriber {
	private final Object theHandler;
	private final ExecutionContext theContext;
	private final BiFunction<Object, Emission, Object> theInvoker;

	private Subscriber(Object handler, ExecutionContext context, BiFunction<Object, Emission, Object> invoker) {
		theHandler = handler;
		theContext = context;
		theInvoker = invoker;
	}

	/** Calls owners that are themselves {@link EventListener}s */
	static final Subscriber LISTENER = new Subscriber(null, null, (owner, emission) -> ((EventListener) owner).onEvent(emission));

	static <O> Subscriber ofBound(BoundListener<? super O> listener) {
		return new Subscriber(listener, null, (owner, emission) -> listener.onEvent((O) owner, emission));
	}

	static Subscriber ofAsync(ExecutionContext context) {
		return new Subscriber(null, context, (owner, emission) -> ((AsyncEventListener) owner).onEvent(emission));
	}

	static <O> Subscriber ofAsyncBound(ExecutionContext context, AsyncBoundListener<? super O> listener) {
		return new Subscriber(listener, context, (owner, emission) -> listener.onEvent((O) owner, emission));
	}

	boolean isAsync() {
		return theContext != null;
	}

	/**
	 * @param owner The owner or listener the binding was made for, or the handler of an owner-bound listener
	 * @return Whether this subscriber's handler is the given object
	 */
	boolean isHandler(Object owner) {
		return theHandler != null && theHandler == owner;
	}

	Propagation call(Object owner, Emission emission) {
		Object result = theInvoker.apply(owner, emission);
		return result == Propagation.STOP ? Propagation.STOP : Propagation.CONTINUE;
	}

	CompletableFuture<Void> schedule(Object owner, Emission emission) {
		CompletableFuture<Void> task = new CompletableFuture<>();
		try {
			theContext.execute(() -> {
				try {
					CompletionStage<?> stage = (CompletionStage<?>) theInvoker.apply(owner, emission);
					if (stage == null)
						task.complete(null);
					else {
						stage.whenComplete((r, ex) -> {
							if (ex != null)
								task.completeExceptionally(ex);
							else
								task.complete(null);
						});
					}
				} catch (RuntimeException | Error e) {
					task.completeExceptionally(e);
				}
			});
		} catch (RejectedExecutionException e) {
			task.completeExceptionally(e);
		}
		task.whenComplete((r, ex) -> {
			if (ex != null)
				theContext.reportFailure(ex, emission + " -> " + owner);
		});
		return task;
	}

	@Override
	public int hashCode() {
		return theHandler == null ? 0 : System.identityHashCode(theHandler);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Subscriber))
			return false;
		Subscriber other = (Subscriber) obj;
		return theHandler == other.theHandler && isAsync() == other.isAsync();
	}

	@Override
	public String toString() {
		String str = theHandler == null ? "listener" : theHandler.toString();
		return isAsync() ? str + " on " + theContext : str;
	}
}
