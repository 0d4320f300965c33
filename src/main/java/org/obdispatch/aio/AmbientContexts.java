package org.obdispatch.aio;

/** Tracks the {@link ExecutionContext} that is ambient on each thread */
final class AmbientContexts {
	private static final ThreadLocal<ExecutionContext> CURRENT = new ThreadLocal<>();

	private AmbientContexts() {}

	static ExecutionContext get() {
		return CURRENT.get();
	}

	static ExecutionContext set(ExecutionContext context) {
		ExecutionContext old = CURRENT.get();
		if (context == null)
			CURRENT.remove();
		else
			CURRENT.set(context);
		return old;
	}
}
