package org.obdispatch;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;
import org.obdispatch.prop.IntProperty;
import org.obdispatch.prop.Property;
import org.obdispatch.prop.StringProperty;

/** Tests how {@link DispatcherManifest}s are assembled from class declarations */
public class DispatcherManifestTest {
	/** A base dispatcher */
	@Events("on_base")
	public static class Base extends Dispatcher {
		/** Overridden by {@link Sub} */
		public static final Property<Object> NAME = Property.build("name", Object.class).withDefault("base").build();
		/** Inherited by {@link Sub} */
		public static final IntProperty COUNT = IntProperty.build("count").withRange(0, 10).withDescription("How many").build();
	}

	/** Extends {@link Base} */
	@Events({ "on_sub", "on_base" })
	public static class Sub extends Base {
		/** Replaces {@link Base#NAME} */
		public static final StringProperty NAME = StringProperty.build("name").withDefault("sub").build();
		/** Added by this class */
		public static final Property<Object> EXTRA = Property.build("extra", Object.class).build();
	}

	/** Declares an event with the name of its own property */
	@Events("clash")
	public static class EventClash extends Dispatcher {
		/** Clashes with the event */
		public static final Property<Object> CLASH = Property.build("clash", Object.class).build();
	}

	/** Declares a property with the name of an inherited event */
	public static class InheritedEventClash extends Base {
		/** Clashes with {@link Base}'s event */
		public static final Property<Object> ON_BASE = Property.build("on_base", Object.class).build();
	}

	/** Declares two properties with the same name */
	public static class PropertyClash extends Dispatcher {
		/** The first property */
		public static final Property<Object> A = Property.build("same", Object.class).build();
		/** The second property */
		public static final Property<Object> B = Property.build("same", Object.class).build();
	}

	/** Creates an instance of itself before its property is assigned */
	public static class EarlyInstance extends Dispatcher {
		static final EarlyInstance FIRST = new EarlyInstance();
		/** Still null when {@link #FIRST} is created */
		public static final Property<Object> LATE = Property.build("late", Object.class).build();
	}

	/** Tests that events and properties are inherited and merged */
	@Test
	public void inheritance() {
		DispatcherManifest base = DispatcherManifest.of(Base.class);
		DispatcherManifest sub = DispatcherManifest.of(Sub.class);
		assertSame(sub, DispatcherManifest.of(Sub.class));

		assertEquals(Arrays.asList("on_base"), new ArrayList<>(base.getEventNames()));
		assertEquals(Arrays.asList("on_base", "on_sub"), new ArrayList<>(sub.getEventNames()));
		assertEquals(Arrays.asList("name", "count", "extra"), new ArrayList<>(sub.getProperties().keySet()));
		assertSame(Sub.NAME, sub.getProperty("name"));
		assertSame(Base.NAME, base.getProperty("name"));
		assertSame(Base.COUNT, sub.getProperty("count"));
		assertTrue(sub.hasEvent("on_sub"));
		assertFalse(sub.hasEvent("count"));
		assertTrue(sub.hasProperty("count"));
		assertTrue(sub.hasName("count"));
		assertFalse(base.hasName("on_sub"));

		Sub instance = new Sub();
		assertSame(sub, instance.getManifest());
		assertSame(DispatcherManifest.of(Dispatcher.class), new Dispatcher().getManifest());
		assertEquals("sub", instance.get(Sub.NAME));
		assertEquals(Integer.valueOf(0), instance.get(Base.COUNT));
		try {
			instance.get(Base.NAME);
			fail("Expected DoesNotExistException for an overridden property");
		} catch (DoesNotExistException e) {
			assertEquals("name", e.getName());
		}
		assertEquals("base", new Base().get(Base.NAME));
	}

	/** Tests property introspection without an instance */
	@Test
	public void introspection() {
		Property<?> count = DispatcherManifest.of(Sub.class).getProperty("count");
		assertEquals("count", count.getName());
		assertEquals(Integer.valueOf(0), count.getDefault());
		assertEquals("How many", count.getDescription());
		assertEquals("Integer, not null, 0 <= value <= 10", count.describeConstraints());
		assertEquals("String", Sub.NAME.describeConstraints());
	}

	/** Tests that conflicting declarations are rejected */
	@Test
	public void conflicts() {
		try {
			DispatcherManifest.of(EventClash.class);
			fail("Expected PropertyExistsException");
		} catch (PropertyExistsException e) {
			assertEquals("clash", e.getName());
		}
		try {
			new EventClash();
			fail("Expected PropertyExistsException");
		} catch (PropertyExistsException e) {
			assertEquals("clash", e.getName());
		}
		try {
			DispatcherManifest.of(InheritedEventClash.class);
			fail("Expected EventExistsException");
		} catch (EventExistsException e) {
			assertEquals("on_base", e.getName());
		}
		try {
			DispatcherManifest.of(PropertyClash.class);
			fail("Expected PropertyExistsException");
		} catch (PropertyExistsException e) {
			assertEquals("same", e.getName());
		}
	}

	/** Tests that a manifest is not built while a property field is still unassigned */
	@Test
	public void unassignedProperty() {
		try {
			new EarlyInstance();
			fail("Expected the class initialization to fail");
		} catch (ExceptionInInitializerError e) {
			assertTrue(e.getCause() instanceof DispatchException);
			assertTrue(e.getCause().getMessage(), e.getCause().getMessage().contains("EarlyInstance.LATE"));
		}
	}
}
