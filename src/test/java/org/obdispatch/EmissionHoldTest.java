package org.obdispatch;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.Test;
import org.obdispatch.prop.ListProperty;
import org.obdispatch.prop.Property;
import org.obdispatch.util.Transaction;

/** Tests {@link Dispatcher#holdEmissions(String)} */
public class EmissionHoldTest {
	/** A dispatcher with an event and properties to hold */
	@Events("on_test")
	public static class Holder extends Dispatcher {
		/** A plain property */
		public static final Property<Object> VALUE = Property.build("value", Object.class).build();
		/** A list property */
		public static final ListProperty<Integer> ITEMS = ListProperty.<Integer> build("items").build();
	}

	/** Tests that only the last held emission is delivered, once, when the hold is released */
	@Test
	public void holdEvent() {
		Holder holder = new Holder();
		Recorder recorder = new Recorder();
		holder.bind("on_test", recorder);

		holder.emit("on_test", "before");
		assertEquals(1, recorder.getCount());
		recorder.clear();

		try (Transaction hold = holder.holdEmissions("on_test")) {
			assertTrue(holder.isEmissionHeld("on_test"));
			for (int i = 0; i < 10; i++)
				holder.emit("on_test", Arrays.asList("letter" + i), Collections.singletonMap("count", i));
			assertEquals(0, recorder.getCount());
		}
		assertFalse(holder.isEmissionHeld("on_test"));
		assertEquals(1, recorder.getCount());
		assertEquals("letter9", recorder.getLast().getArg(0));
		assertEquals(9, recorder.getLast().getKeyword("count"));

		// Nothing emitted while held: nothing delivered on release
		recorder.clear();
		holder.holdEmissions("on_test").close();
		assertEquals(0, recorder.getCount());
	}

	/** Tests that nested holds deliver only when the outermost is released */
	@Test
	public void nestedHolds() {
		Holder holder = new Holder();
		Recorder recorder = new Recorder();
		holder.bind("on_test", recorder);
		Transaction outer = holder.holdEmissions("on_test");
		try (Transaction inner = holder.holdEmissions("on_test")) {
			holder.emit("on_test", 1);
		}
		assertTrue(holder.isEmissionHeld("on_test"));
		holder.emit("on_test", 2);
		assertEquals(0, recorder.getCount());
		outer.close();
		outer.close();
		assertEquals(Arrays.asList(2), recorder.getArgs(0));
	}

	/** Tests holding property events: values change immediately, listeners are notified once */
	@Test
	public void holdProperty() {
		Holder holder = new Holder();
		Recorder recorder = new Recorder();
		holder.bind(Holder.VALUE.getName(), recorder);
		holder.bind(Holder.ITEMS.getName(), recorder);

		try (Transaction hold = holder.holdEmissions("value")) {
			for (int i = 0; i < 4; i++) {
				holder.set(Holder.VALUE, i);
				assertEquals(i, holder.get(Holder.VALUE));
			}
		}
		assertEquals(1, recorder.getCount());
		assertEquals(3, recorder.getLast().getArg(1));
		assertEquals(Holder.VALUE, recorder.getLast().getKeyword(Emission.PROPERTY));
		recorder.clear();

		try (Transaction hold = holder.holdEmissions("items")) {
			// Not held
			holder.set(Holder.VALUE, "foo");
			List<Integer> items = holder.get(Holder.ITEMS);
			for (int i = 0; i < 4; i++)
				items.add(i);
			assertEquals(1, recorder.getCount());
		}
		assertEquals(2, recorder.getCount());
		assertEquals("items", recorder.getLast().getEventName());
		assertEquals(Arrays.asList(0, 1, 2, 3), recorder.getLast().getArg(1));
	}

	/** Tests that a hold from another thread waits until the current holder releases */
	@Test
	public void holdFromOtherThread() throws Exception {
		Holder holder = new Holder();
		Recorder recorder = new Recorder();
		holder.bind("on_test", recorder);

		CompletableFuture<Void> other;
		try (Transaction hold = holder.holdEmissions("on_test")) {
			other = CompletableFuture.runAsync(() -> {
				try (Transaction otherHold = holder.holdEmissions("on_test")) {
					holder.emit("on_test", "other", "first");
					holder.emit("on_test", "other", "second");
				}
			});
			Thread.sleep(100);
			assertFalse(other.isDone());
			holder.emit("on_test", "mine", "first");
			holder.emit("on_test", "mine", "second");
		}
		other.get(5, TimeUnit.SECONDS);
		assertEquals(Arrays.asList("mine", "other"), recorder.getArgs(0));
		assertEquals(Arrays.asList("second", "second"), recorder.getArgs(1));
	}

	/** Tests holding an unknown event */
	@Test
	public void unknownEvent() {
		try {
			new Holder().holdEmissions("nope");
			fail("Expected DoesNotExistException");
		} catch (DoesNotExistException e) {
			assertEquals("nope", e.getName());
		}
	}
}
