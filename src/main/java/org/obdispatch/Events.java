package org.obdispatch;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the events every instance of a {@link Dispatcher} subclass has. Declarations are inherited: a subclass has the events declared
 * on it and on all of its superclasses, and may redeclare an inherited name.
 *
 * @see DispatcherManifest
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Events {
	/** @return The names of the declared events */
	String[] value();
}
