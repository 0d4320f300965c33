package org.obdispatch;

import java.lang.ref.WeakReference;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

import org.obdispatch.aio.AsyncBoundListener;
import org.obdispatch.aio.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;

/**
 * Binds {@link Receiver @Receiver} methods to the {@link GlobalDispatcher}.
 *
 * <pre>
 * public class MessagePrinter {
 * 	&#64;Receiver("on_message")
 * 	void onMessage(Emission emission) {
 * 		System.out.println(emission.getArg(0));
 * 	}
 * }
 *
 * MessagePrinter printer = new MessagePrinter();
 * Receivers.register(printer);
 * GlobalDispatcher.get().emit("on_message", "hello");
 * </pre>
 *
 * Registered objects are held weakly, like the owners of any owner-bound listener. Registering an object again does not bind its
 * receivers twice, and {@link Dispatcher#unbind(Object...) unbinding} the object from the global dispatcher removes all of them.
 */
public final class Receivers {
	private static final Logger logger = LoggerFactory.getLogger(Receivers.class);

	private static final ListMultimap<String, CachedReceiver> CACHE = Multimaps.synchronizedListMultimap(ArrayListMultimap.create());
	private static final Map<Method, BoundListener<Object>> LISTENERS = new ConcurrentHashMap<>();
	private static final Map<Method, AsyncBoundListener<Object>> ASYNC_LISTENERS = new ConcurrentHashMap<>();

	private Receivers() {}

	/**
	 * Binds the annotated instance methods of an object, including inherited ones
	 *
	 * @param target The object whose receiver methods to bind
	 * @return The bindings made now, not including receivers {@link Receiver#cache() cached} for events not yet registered
	 * @throws IllegalArgumentException If an annotated method does not have a receiver's signature
	 * @throws DoesNotExistException If a receiver names an unregistered event and neither caches nor auto-registers
	 * @throws BindingContextException If an asynchronous receiver is registered with no ambient execution context
	 */
	public static Subscription register(Object target)
		throws IllegalArgumentException, DoesNotExistException, BindingContextException {
		Preconditions.checkNotNull(target, "target");
		return register(target, target.getClass(), false);
	}

	/**
	 * Binds the annotated static methods of a class, including inherited ones
	 *
	 * @param type The class whose static receiver methods to bind
	 * @return The bindings made now, not including receivers {@link Receiver#cache() cached} for events not yet registered
	 * @throws IllegalArgumentException If an annotated method does not have a receiver's signature
	 * @throws DoesNotExistException If a receiver names an unregistered event and neither caches nor auto-registers
	 * @throws BindingContextException If an asynchronous receiver is registered with no ambient execution context
	 */
	public static Subscription register(Class<?> type)
		throws IllegalArgumentException, DoesNotExistException, BindingContextException {
		Preconditions.checkNotNull(type, "type");
		return register(type, type, true);
	}

	private static Subscription register(Object owner, Class<?> type, boolean statics) {
		GlobalDispatcher global = GlobalDispatcher.get();
		List<Method> methods = getReceiverMethods(type, statics);
		// Check everything before binding anything
		ExecutionContext context = null;
		for (Method method : methods) {
			Receiver receiver = method.getAnnotation(Receiver.class);
			for (String name : receiver.value()) {
				if (!global.hasEvent(name) && !receiver.cache() && !receiver.autoRegister())
					throw new DoesNotExistException(name);
			}
			if (isAsync(method) && context == null) {
				context = ExecutionContext.current().orElseThrow(() -> new BindingContextException(receiver.value()[0]));
			}
		}

		List<Subscription> subs = new ArrayList<>();
		for (Method method : methods) {
			Receiver receiver = method.getAnnotation(Receiver.class);
			ExecutionContext methodContext = isAsync(method) ? context : null;
			Set<String> toRegister = new LinkedHashSet<>();
			for (String name : receiver.value()) {
				if (global.hasEvent(name))
					subs.add(bind(global, name, owner, method, methodContext));
				else if (receiver.autoRegister())
					toRegister.add(name);
				else {
					logger.debug("Caching receiver {} until {} is registered", method, name);
					CACHE.put(name, new CachedReceiver(owner, method, methodContext));
				}
			}
			if (!toRegister.isEmpty()) {
				global.registerEvent(toRegister.toArray(new String[toRegister.size()]));
				for (String name : toRegister)
					subs.add(bind(global, name, owner, method, methodContext));
			}
		}
		return Subscription.forAll(subs);
	}

	/** Called by the {@link GlobalDispatcher} when events are registered, to bind receivers cached for them */
	static void bindCached(String... names) {
		GlobalDispatcher global = GlobalDispatcher.get();
		for (String name : names) {
			List<CachedReceiver> cached;
			synchronized (CACHE) {
				cached = new ArrayList<>(CACHE.removeAll(name));
			}
			for (CachedReceiver receiver : cached) {
				Object owner = receiver.theOwner.get();
				if (owner != null)
					bind(global, name, owner, receiver.theMethod, receiver.theContext);
			}
		}
	}

	/**
	 * @param name The name of the event
	 * @return The number of receivers cached for the event, waiting for it to be registered
	 */
	public static int getCachedCount(String name) {
		synchronized (CACHE) {
			return CACHE.get(name).size();
		}
	}

	private static Subscription bind(Dispatcher dispatcher, String name, Object owner, Method method, ExecutionContext context) {
		// One listener per method, so that re-registration is idempotent
		if (context != null) {
			AsyncBoundListener<Object> listener = ASYNC_LISTENERS.computeIfAbsent(method,
				m -> (o, emission) -> (CompletionStage<?>) invoke(m, o, emission));
			return dispatcher.bindAsync(context, name, owner, listener);
		} else {
			BoundListener<Object> listener = LISTENERS.computeIfAbsent(method, m -> (o, emission) -> {
				Object result = invoke(m, o, emission);
				return result instanceof Propagation ? (Propagation) result : Propagation.CONTINUE;
			});
			return dispatcher.bind(name, owner, listener);
		}
	}

	private static Object invoke(Method method, Object owner, Emission emission) {
		try {
			return method.invoke(Modifier.isStatic(method.getModifiers()) ? null : owner, emission);
		} catch (InvocationTargetException e) {
			if (e.getCause() instanceof RuntimeException)
				throw (RuntimeException) e.getCause();
			else if (e.getCause() instanceof Error)
				throw (Error) e.getCause();
			throw new DispatchException("Receiver " + method + " failed", e.getCause());
		} catch (IllegalAccessException e) {
			throw new DispatchException("Could not invoke receiver " + method, e);
		}
	}

	private static List<Method> getReceiverMethods(Class<?> type, boolean statics) {
		List<Method> methods = new ArrayList<>();
		for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
			for (Method method : c.getDeclaredMethods()) {
				if (!method.isAnnotationPresent(Receiver.class) || Modifier.isStatic(method.getModifiers()) != statics)
					continue;
				Preconditions.checkArgument(method.getParameterCount() == 1 && method.getParameterTypes()[0].isAssignableFrom(Emission.class),
					"Receiver %s must take a single %s parameter", method, Emission.class.getSimpleName());
				Class<?> returnType = method.getReturnType();
				Preconditions.checkArgument(
					returnType == void.class || returnType == Propagation.class || CompletionStage.class.isAssignableFrom(returnType),
					"Receiver %s must return void, %s or a %s", method, Propagation.class.getSimpleName(),
					CompletionStage.class.getSimpleName());
				Preconditions.checkArgument(method.getAnnotation(Receiver.class).value().length > 0, "Receiver %s names no events", method);
				method.setAccessible(true);
				methods.add(method);
			}
		}
		return methods;
	}

	private static boolean isAsync(Method method) {
		return CompletionStage.class.isAssignableFrom(method.getReturnType());
	}

	private static class CachedReceiver {
		final WeakReference<Object> theOwner;
		final Method theMethod;
		final ExecutionContext theContext;

		CachedReceiver(Object owner, Method method, ExecutionContext context) {
			theOwner = new WeakReference<>(owner);
			theMethod = method;
			theContext = context;
		}
	}
}
