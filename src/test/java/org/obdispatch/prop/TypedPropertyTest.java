package org.obdispatch.prop;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.obdispatch.Dispatcher;

/** Tests the typed {@link Property} subclasses */
public class TypedPropertyTest {
	/** Has string properties */
	public static class Strings extends Dispatcher {
		/** Nullable */
		public static final StringProperty FOO = StringProperty.build("foo").build();
		/** Not nullable */
		public static final StringProperty BAR = StringProperty.build("bar").nullable(false).withDefault("").build();
	}

	/** Has boolean properties */
	public static class Booleans extends Dispatcher {
		/** Not nullable */
		public static final BooleanProperty FOO = BooleanProperty.build("foo").build();
		/** Nullable */
		public static final BooleanProperty BAR = BooleanProperty.build("bar").withDefault(true).nullable(true).build();
	}

	/** Has integer properties */
	public static class Ints extends Dispatcher {
		/** Unbounded */
		public static final IntProperty U = IntProperty.build("u").build();
		/** Bounded below */
		public static final IntProperty V = IntProperty.build("v").withMin(-10).build();
		/** Bounded above */
		public static final IntProperty W = IntProperty.build("w").withMax(10).build();
		/** Bounded */
		public static final IntProperty X = IntProperty.build("x").withRange(-10, 10).build();
	}

	/** Has a double property */
	public static class Doubles extends Dispatcher {
		/** Bounded */
		public static final DoubleProperty X = DoubleProperty.build("x").withRange(-10.0, 10.0).build();
	}

	/** Tests {@link StringProperty} */
	@Test
	public void stringProperty() {
		Strings a = new Strings();
		assertNull(a.get(Strings.FOO));
		a.set(Strings.FOO, "1");
		assertEquals("1", a.get(Strings.FOO));
		a.set(Strings.FOO, null);
		assertNull(a.get(Strings.FOO));
		a.set(Strings.FOO, "2");

		try {
			a.setValue("foo", 1);
			fail("Expected InvalidTypeException");
		} catch (InvalidTypeException e) {
			assertTrue(e.getMessage().contains("Type \"Integer\" not valid"));
		}
		assertEquals("2", a.get(Strings.FOO));

		a.set(Strings.BAR, "3");
		try {
			a.set(Strings.BAR, null);
			fail("Expected NoneNotAllowedException");
		} catch (NoneNotAllowedException e) {
			assertTrue(e.getMessage().contains("\"null\" not allowed"));
		}
		assertEquals("3", a.get(Strings.BAR));
	}

	/** Tests {@link BooleanProperty} */
	@Test
	public void booleanProperty() {
		Booleans a = new Booleans();
		assertFalse(a.get(Booleans.FOO));
		assertTrue(a.get(Booleans.BAR));
		a.set(Booleans.FOO, true);
		a.set(Booleans.BAR, false);
		assertTrue(a.get(Booleans.FOO));
		assertFalse(a.get(Booleans.BAR));

		for (Object value : new Object[] { 1, "a", new Object() }) {
			try {
				a.setValue("foo", value);
				fail("Expected InvalidTypeException");
			} catch (InvalidTypeException e) {
				assertTrue(e.getMessage().contains("Type \"" + value.getClass().getSimpleName() + "\" not valid"));
			}
			assertTrue(a.get(Booleans.FOO));
		}

		try {
			a.set(Booleans.FOO, null);
			fail("Expected NoneNotAllowedException");
		} catch (NoneNotAllowedException e) {
			assertTrue(e.getMessage().contains("\"null\" not allowed"));
		}
		a.set(Booleans.BAR, null);
		assertNull(a.get(Booleans.BAR));
	}

	/** Tests {@link IntProperty} */
	@Test
	public void intProperty() {
		Ints a = new Ints();
		assertEquals(Integer.valueOf(0), a.get(Ints.U));
		for (Object value : new Object[] { "a", true, new Object(), 0.1 }) {
			try {
				a.setValue("u", value);
				fail("Expected InvalidTypeException");
			} catch (InvalidTypeException e) {
				assertTrue(e.getMessage().contains("Type \"" + value.getClass().getSimpleName() + "\" not valid"));
			}
		}

		for (int i = 0; i < 10; i++) {
			a.set(Ints.X, i);
			a.set(Ints.X, -i);
		}
		a.set(Ints.V, Integer.MAX_VALUE);
		a.set(Ints.W, Integer.MIN_VALUE);

		try {
			a.set(Ints.X, -11);
			fail("Expected OutOfRangeException");
		} catch (OutOfRangeException e) {
			assertEquals("Value -11 must be in range \"-10 <= value <= 10\" for property \"x\"", e.getMessage());
		}
		assertEquals(Integer.valueOf(-9), a.get(Ints.X));
		try {
			a.set(Ints.V, -11);
			fail("Expected OutOfRangeException");
		} catch (OutOfRangeException e) {
			assertTrue(e.getMessage().contains("\"value >= -10\""));
		}
		try {
			a.set(Ints.W, 11);
			fail("Expected OutOfRangeException");
		} catch (OutOfRangeException e) {
			assertTrue(e.getMessage().contains("\"value <= 10\""));
		}
		assertEquals("-10 <= value <= 10", Ints.X.describeRange());
		assertEquals(Integer.valueOf(-10), Ints.X.getMin());
		assertNull(Ints.V.getMax());
	}

	/** Tests {@link DoubleProperty} */
	@Test
	public void doubleProperty() {
		Doubles a = new Doubles();
		assertEquals(0.0, a.get(Doubles.X), 0.0);
		for (Object value : new Object[] { "a", true, new Object() }) {
			try {
				a.setValue("x", value);
				fail("Expected InvalidTypeException");
			} catch (InvalidTypeException e) {
				assertTrue(e.getMessage().contains("Type \"" + value.getClass().getSimpleName() + "\" not valid"));
			}
		}

		for (int i = 0; i < 10; i++) {
			a.setValue("x", i);
			assertEquals(Double.valueOf(i), a.get(Doubles.X));
			a.set(Doubles.X, (double) -i);
		}
		assertEquals(-9.0, a.get(Doubles.X), 0.0);

		for (Object value : new Object[] { -11, 11, -10.1, 10.1 }) {
			try {
				a.setValue("x", value);
				fail("Expected OutOfRangeException");
			} catch (OutOfRangeException e) {
				double fvalue = ((Number) value).doubleValue();
				assertTrue(e.getMessage().contains("Value " + fvalue + " must be in range \"-10.0 <= value <= 10.0\""));
			}
		}
		assertEquals(-9.0, a.get(Doubles.X), 0.0);
		assertNull(Doubles.X.isAcceptable(5));
	}

	/** Tests that an inverted range is rejected */
	@Test(expected = IllegalArgumentException.class)
	public void invertedRange() {
		IntProperty.build("bad").withRange(10, -10);
	}
}
