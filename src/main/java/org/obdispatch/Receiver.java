package org.obdispatch;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method to be bound to events of the {@link GlobalDispatcher} when its object (or, for a static method, its class) is
 * {@link Receivers#register(Object) registered}. The method must take a single {@link Emission} parameter and return {@code void},
 * {@link Propagation}, or a {@link java.util.concurrent.CompletionStage}. Methods returning a completion stage are bound as asynchronous
 * listeners on the execution context ambient when they are registered.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Receiver {
	/** @return The names of the events to bind the method to */
	String[] value();

	/**
	 * @return Whether to hold the method until an event that is not registered yet is registered on the global dispatcher, instead of
	 *         failing with a {@link DoesNotExistException}
	 */
	boolean cache() default false;

	/** @return Whether to register events that are not registered yet on the global dispatcher */
	boolean autoRegister() default false;
}
