package org.obdispatch;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

/** Tests {@link Receiver @Receiver} methods and the {@link GlobalDispatcher} */
public class ReceiversTest {
	/** Receives registered events */
	public static class Registered {
		final List<Object> foo = new ArrayList<>();
		final List<Object> fooBar = new ArrayList<>();

		@Receiver("rcv_foo")
		void onFoo(Emission emission) {
			foo.add(emission.getArg(0));
		}

		@Receiver({ "rcv_foo", "rcv_bar" })
		Propagation onFooBar(Emission emission) {
			fooBar.add(emission.getArg(0));
			return Propagation.CONTINUE;
		}
	}

	/** Receives an event that is never registered */
	public static class Unregistered {
		int calls;

		@Receiver("rcv_registered")
		void onRegistered(Emission emission) {
			calls++;
		}

		@Receiver("rcv_missing")
		void onMissing(Emission emission) {
			calls++;
		}
	}

	/** Receives an event that is registered later */
	public static class Cached {
		final List<Object> received = new ArrayList<>();

		@Receiver(value = "rcv_cached", cache = true)
		void onCached(Emission emission) {
			received.add(emission.getArg(0));
		}
	}

	/** Receives an event that it registers */
	public static class AutoRegistered {
		final List<Object> received = new ArrayList<>();

		@Receiver(value = "rcv_auto", autoRegister = true)
		void onAuto(Emission emission) {
			received.add(emission.getArg(0));
		}
	}

	/** Has static receivers */
	public static class Statics {
		static final List<Object> RECEIVED = new ArrayList<>();

		@Receiver(value = "rcv_static", autoRegister = true)
		static void onStatic(Emission emission) {
			RECEIVED.add(emission.getArg(0));
		}
	}

	/** Has a receiver with the wrong signature */
	public static class BadSignature {
		@Receiver(value = "rcv_bad", autoRegister = true)
		void onBad(String value) {}
	}

	/** Tests binding receivers to registered events */
	@Test
	public void registeredEvents() {
		GlobalDispatcher global = GlobalDispatcher.get();
		global.registerEvent("rcv_foo", "rcv_bar");
		Registered receiver = new Registered();
		Receivers.register(receiver);
		// Registering again binds nothing new
		Receivers.register(receiver);

		for (int i = 0; i < 3; i++)
			global.emit("rcv_foo", i);
		for (String s : Arrays.asList("a", "b"))
			global.emit("rcv_bar", s);

		assertEquals(Arrays.asList(0, 1, 2), receiver.foo);
		assertEquals(Arrays.asList(0, 1, 2, "a", "b"), receiver.fooBar);

		assertEquals(3, global.unbind(receiver));
		global.emit("rcv_foo", 3);
		assertEquals(3, receiver.foo.size());
	}

	/** Tests that receivers for unregistered events are rejected, with nothing bound */
	@Test
	public void unregisteredEvent() {
		GlobalDispatcher global = GlobalDispatcher.get();
		global.registerEvent("rcv_registered");
		Unregistered receiver = new Unregistered();
		try {
			Receivers.register(receiver);
			fail("Expected DoesNotExistException");
		} catch (DoesNotExistException e) {
			assertEquals("rcv_missing", e.getName());
		}
		global.emit("rcv_registered");
		assertEquals(0, receiver.calls);
	}

	/** Tests that a caching receiver is bound once its event is registered */
	@Test
	public void cachedReceiver() {
		GlobalDispatcher global = GlobalDispatcher.get();
		Cached receiver = new Cached();
		Subscription sub = Receivers.register(receiver);
		// Nothing is bound until the event is registered
		assertSame(Subscription.NONE, sub);
		assertEquals(1, Receivers.getCachedCount("rcv_cached"));
		try {
			global.emit("rcv_cached", 47);
			fail("Expected DoesNotExistException");
		} catch (DoesNotExistException e) {
			assertEquals("rcv_cached", e.getName());
		}

		global.registerEvent("rcv_cached");
		assertEquals(0, Receivers.getCachedCount("rcv_cached"));
		global.emit("rcv_cached", 1);
		assertEquals(Arrays.asList(1), receiver.received);
		global.unbind(receiver);
		sub.unsubscribe();
	}

	/** Tests a receiver that registers its event */
	@Test
	public void autoRegister() {
		GlobalDispatcher global = GlobalDispatcher.get();
		AutoRegistered receiver = new AutoRegistered();
		Receivers.register(receiver);
		assertTrue(global.hasEvent("rcv_auto"));
		global.emit("rcv_auto", 1);
		assertEquals(Arrays.asList(1), receiver.received);
		global.unbind(receiver);
	}

	/** Tests static receivers */
	@Test
	public void staticReceivers() {
		Subscription sub = Receivers.register(Statics.class);
		GlobalDispatcher.get().emit("rcv_static", "s");
		sub.unsubscribe();
		GlobalDispatcher.get().emit("rcv_static", "t");
		assertEquals(Arrays.asList("s"), Statics.RECEIVED);
	}

	/** Tests that methods with the wrong signature are rejected */
	@Test(expected = IllegalArgumentException.class)
	public void badSignature() {
		Receivers.register(new BadSignature());
	}
}
