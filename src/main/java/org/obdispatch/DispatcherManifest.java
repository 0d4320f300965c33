package org.obdispatch;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.obdispatch.prop.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The events and properties every instance of a {@link Dispatcher} class has. A class's manifest merges what the class declares, with
 * {@link Events @Events} and {@code static} {@link Property} fields, into the manifest of its superclass. A property declared in a subclass
 * replaces an inherited property of the same name.
 *
 * <p>
 * Manifests are built once per class, the first time the class is instantiated or {@link #of(Class) inspected}, and conflicting
 * declarations are rejected then:
 * <ul>
 * <li>An event with the name of a property throws {@link PropertyExistsException}</li>
 * <li>A property with the name of an inherited event throws {@link EventExistsException}</li>
 * <li>Two different properties with the same name in one class throw {@link PropertyExistsException}</li>
 * </ul>
 * </p>
 */
public final class DispatcherManifest {
	private static final Logger logger = LoggerFactory.getLogger(DispatcherManifest.class);

	private static final DispatcherManifest ROOT = new DispatcherManifest(Dispatcher.class, ImmutableSet.of(), ImmutableMap.of());

	private static final ClassValue<DispatcherManifest> MANIFESTS = new ClassValue<DispatcherManifest>() {
		@Override
		protected DispatcherManifest computeValue(Class<?> type) {
			return build(type.asSubclass(Dispatcher.class));
		}
	};

	private final Class<? extends Dispatcher> theType;
	private final Set<String> theEventNames;
	private final Map<String, Property<?>> theProperties;

	private DispatcherManifest(Class<? extends Dispatcher> type, Set<String> eventNames, Map<String, Property<?>> properties) {
		theType = type;
		theEventNames = eventNames;
		theProperties = properties;
	}

	/** @return The dispatcher class this manifest is for */
	public Class<? extends Dispatcher> getType() {
		return theType;
	}

	/** @return The names of the events declared with {@link Events @Events} on the class and its superclasses */
	public Set<String> getEventNames() {
		return theEventNames;
	}

	/** @return The properties of the class, by name, inherited properties first */
	public Map<String, Property<?>> getProperties() {
		return theProperties;
	}

	/**
	 * @param name The name of the property
	 * @return The property with the given name, or null if the class has no such property
	 */
	public Property<?> getProperty(String name) {
		return theProperties.get(name);
	}

	/**
	 * @param name The name to check
	 * @return Whether the class declares an event (not a property) with the given name
	 */
	public boolean hasEvent(String name) {
		return theEventNames.contains(name);
	}

	/**
	 * @param name The name to check
	 * @return Whether the class has a property with the given name
	 */
	public boolean hasProperty(String name) {
		return theProperties.containsKey(name);
	}

	/**
	 * @param name The name to check
	 * @return Whether the class has an event or a property with the given name
	 */
	public boolean hasName(String name) {
		return theEventNames.contains(name) || theProperties.containsKey(name);
	}

	@Override
	public String toString() {
		return theType.getSimpleName() + "(events=" + theEventNames + ", properties=" + theProperties.keySet() + ")";
	}

	/**
	 * @param type The dispatcher class
	 * @return The manifest for the class
	 * @throws ExistsException If the class or one of its superclasses declares conflicting names
	 * @throws DispatchException If a property field of the class has not been assigned yet
	 */
	public static DispatcherManifest of(Class<? extends Dispatcher> type) throws ExistsException {
		if (type == Dispatcher.class)
			return ROOT;
		return MANIFESTS.get(type);
	}

	private static DispatcherManifest build(Class<? extends Dispatcher> type) {
		DispatcherManifest parent = of(type.getSuperclass().asSubclass(Dispatcher.class));
		Map<String, Property<?>> declared = new LinkedHashMap<>();
		for (Field field : type.getDeclaredFields()) {
			if (!Modifier.isStatic(field.getModifiers()) || !Property.class.isAssignableFrom(field.getType()))
				continue;
			Property<?> property;
			try {
				field.setAccessible(true);
				property = (Property<?>) field.get(null);
			} catch (IllegalAccessException | RuntimeException e) {
				throw new DispatchException("Could not read property field " + type.getName() + "." + field.getName(), e);
			}
			// Happens when the class is instantiated by its own static initializer before the field is assigned
			if (property == null)
				throw new DispatchException("Property field " + type.getName() + "." + field.getName() + " is not initialized");
			Property<?> existing = declared.put(property.getName(), property);
			if (existing != null && existing != property)
				throw new PropertyExistsException(property.getName());
			if (parent.hasEvent(property.getName()))
				throw new EventExistsException(property.getName());
		}

		Map<String, Property<?>> properties = new LinkedHashMap<>(parent.getProperties());
		properties.putAll(declared);

		Set<String> events = new LinkedHashSet<>(parent.getEventNames());
		Events annotation = type.getDeclaredAnnotation(Events.class);
		if (annotation != null) {
			for (String name : annotation.value()) {
				if (properties.containsKey(name))
					throw new PropertyExistsException(name);
				events.add(name);
			}
		}

		DispatcherManifest manifest = new DispatcherManifest(type, ImmutableSet.copyOf(events), ImmutableMap.copyOf(properties));
		logger.debug("Built {}", manifest);
		return manifest;
	}
}
