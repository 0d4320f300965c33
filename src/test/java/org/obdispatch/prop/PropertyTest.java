package org.obdispatch.prop;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.obdispatch.Dispatcher;
import org.obdispatch.DoesNotExistException;
import org.obdispatch.Emission;
import org.obdispatch.Propagation;
import org.obdispatch.Recorder;

/** Tests {@link Property} change detection and emission */
public class PropertyTest {
	/** Counts */
	public static class Counter extends Dispatcher {
		/** The count */
		public static final Property<Integer> VALUE = Property.build("value", Integer.class).withDefault(0).nullable(false).build();
	}

	/** Has a property with custom equality and validation */
	public static class Named extends Dispatcher {
		/** Compared case-insensitively, must not be blank */
		public static final Property<String> NAME = Property.build("name", String.class)//
			.withDefault("default").nullable(false)//
			.withEquality(String::equalsIgnoreCase)//
			.withValidator(s -> s.trim().isEmpty() ? "Name must not be blank" : null)//
			.build();
	}

	/** An object logging counter values */
	public static class ValueLog {
		final List<Object> log = new ArrayList<>();

		void onValue(Dispatcher instance, Object value) {
			log.add(value);
		}
	}

	/** Tests the basic scenario: only actual changes are emitted */
	@Test
	public void counter() {
		Counter counter = new Counter();
		ValueLog valueLog = new ValueLog();
		counter.bind("value", valueLog, (log, emission) -> {
			log.onValue((Dispatcher) emission.getArg(0), emission.getArg(1));
			return Propagation.CONTINUE;
		});
		assertEquals(Integer.valueOf(0), counter.get(Counter.VALUE));
		counter.set(Counter.VALUE, 0);
		counter.set(Counter.VALUE, 1);
		counter.set(Counter.VALUE, 1);
		counter.set(Counter.VALUE, 2);
		assertEquals(Arrays.asList(1, 2), valueLog.log);
	}

	/** Tests the arguments of a property's emission */
	@Test
	public void emissionArguments() {
		Counter counter = new Counter();
		Recorder recorder = new Recorder();
		counter.bind("value", recorder);
		assertEquals(Integer.valueOf(0), counter.set(Counter.VALUE, 5));
		Emission emission = recorder.getLast();
		assertEquals("value", emission.getEventName());
		assertSame(counter, emission.getArg(0));
		assertEquals(5, emission.getArg(1));
		assertEquals(0, emission.getKeyword(Emission.OLD_VALUE));
		assertSame(Counter.VALUE, emission.getKeyword(Emission.PROPERTY));

		// Instances hold their own values
		Counter other = new Counter();
		assertEquals(Integer.valueOf(0), other.get(Counter.VALUE));
		other.set(Counter.VALUE, 7);
		assertEquals(Integer.valueOf(5), counter.get(Counter.VALUE));
		assertEquals(1, recorder.getCount());
	}

	/** Tests custom equality and validation */
	@Test
	public void equalityAndValidation() {
		Named named = new Named();
		Recorder recorder = new Recorder();
		named.bind("name", recorder);
		named.set(Named.NAME, "DEFAULT");
		assertEquals(0, recorder.getCount());
		assertEquals("default", named.get(Named.NAME));

		try {
			named.set(Named.NAME, " ");
			fail("Expected ValidationException");
		} catch (ValidationException e) {
			assertEquals("Name must not be blank for property \"name\"", e.getMessage());
			assertSame(Named.NAME, e.getProperty());
			assertEquals(" ", e.getValue());
		}
		assertEquals("default", named.get(Named.NAME));
		assertEquals(0, recorder.getCount());

		try {
			named.set(Named.NAME, null);
			fail("Expected ValidationException");
		} catch (ValidationException e) {
			assertTrue(e instanceof NoneNotAllowedException);
		}

		PropertyValue<String> value = named.property(Named.NAME);
		assertSame(named, value.getOwner());
		assertSame(Named.NAME, value.getProperty());
		assertEquals("Name must not be blank for property \"name\"", value.isAcceptable(""));
		assertNull(value.isAcceptable("x"));
		assertEquals("default", value.set("other"));
		assertEquals("other", value.get());
		assertEquals(1, recorder.getCount());
	}

	/** Tests accessing properties by name */
	@Test
	public void byName() {
		Counter counter = new Counter();
		assertEquals(0, counter.getValue("value"));
		assertEquals(0, counter.setValue("value", 3));
		assertEquals(Integer.valueOf(3), counter.get(Counter.VALUE));
		try {
			counter.setValue("value", "three");
			fail("Expected InvalidTypeException");
		} catch (InvalidTypeException e) {
			assertEquals("Type \"String\" not valid for property \"value\"", e.getMessage());
		}
		try {
			counter.getValue("nope");
			fail("Expected DoesNotExistException");
		} catch (DoesNotExistException e) {
			assertEquals("nope", e.getName());
		}
		try {
			counter.get(Named.NAME);
			fail("Expected DoesNotExistException");
		} catch (DoesNotExistException e) {
			assertEquals("name", e.getName());
		}
	}

	/** Tests that a default value the property does not accept is rejected when the property is built */
	@Test(expected = NoneNotAllowedException.class)
	public void invalidDefault() {
		Property.build("bad", Integer.class).nullable(false).build();
	}
}
