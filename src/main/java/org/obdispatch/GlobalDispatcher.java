package org.obdispatch;

/**
 * The process-wide {@link Dispatcher}, for events that are not tied to any particular object. {@link Receiver @Receiver} methods are bound
 * to it by {@link Receivers#register(Object)}.
 */
public final class GlobalDispatcher extends Dispatcher {
	private static final GlobalDispatcher INSTANCE = new GlobalDispatcher();

	/** @return The global dispatcher */
	public static GlobalDispatcher get() {
		return INSTANCE;
	}

	private GlobalDispatcher() {}

	/** Also binds any {@link Receiver#cache() cached} receivers waiting for the registered events */
	@Override
	public void registerEvent(String... names) throws PropertyExistsException {
		super.registerEvent(names);
		Receivers.bindCached(names);
	}

	@Override
	public String toString() {
		return "global";
	}
}
