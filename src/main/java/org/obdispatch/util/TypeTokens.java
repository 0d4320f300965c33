package org.obdispatch.util;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.primitives.Primitives;
import com.google.common.reflect.TypeToken;

/**
 * {@link TypeToken} is quite slow for basic operations like creation and {@link TypeToken#getRawType() getRawType()}. This class caches
 * tokens for classes and provides the few type utilities that properties need to check and describe their values.
 */
public class TypeTokens {
	private static final TypeTokens instance = new TypeTokens();

	/** @return The common instance of this class */
	public static final TypeTokens get() {
		return instance;
	}

	/** The type token for {@link Object} */
	public final TypeToken<Object> OBJECT;
	/** The type token for {@link String} */
	public final TypeToken<String> STRING;
	/** The type token for {@link Boolean} */
	public final TypeToken<Boolean> BOOLEAN;
	/** The type token for {@link Integer} */
	public final TypeToken<Integer> INT;
	/** The type token for {@link Double} */
	public final TypeToken<Double> DOUBLE;

	private final Map<Class<?>, TypeToken<?>> theClassTokens;

	private TypeTokens() {
		theClassTokens = new ConcurrentHashMap<>();
		OBJECT = of(Object.class);
		STRING = of(String.class);
		BOOLEAN = of(Boolean.class);
		INT = of(Integer.class);
		DOUBLE = of(Double.class);
	}

	/**
	 * @param <T> The type of the class
	 * @param clazz The class to get the type token for
	 * @return The (cached) type token for the class, wrapped if the class is primitive
	 */
	public <T> TypeToken<T> of(Class<T> clazz) {
		Class<T> wrapped = Primitives.wrap(clazz);
		return (TypeToken<T>) theClassTokens.computeIfAbsent(wrapped, TypeToken::of);
	}

	/**
	 * @param t The type to get the raw type of
	 * @return The raw type for the given type
	 */
	public static Class<?> getRawType(Type t) {
		while (!(t instanceof Class)) {
			if (t instanceof ParameterizedType) {
				t = ((ParameterizedType) t).getRawType();
			} else if (t instanceof GenericArrayType) {
				return Object[].class;
			} else if (t instanceof WildcardType) {
				Type[] bounds = ((WildcardType) t).getUpperBounds();
				if (bounds.length > 0)
					t = bounds[0];
				else
					return Object.class;
			} else if (t instanceof TypeVariable) {
				Type[] bounds = ((TypeVariable<?>) t).getBounds();
				if (bounds.length > 0)
					t = bounds[0];
				else
					return Object.class;
			} else
				throw new IllegalStateException("Unrecognized type implementation: " + t.getClass().getName());
		}
		return (Class<?>) t;
	}

	/**
	 * Checks the value against the type's raw type
	 *
	 * @param type The type to check against
	 * @param value The value to check
	 * @return Whether the given value is an instance of the given type
	 */
	public boolean isInstance(TypeToken<?> type, Object value) {
		if (value == null)
			return false;
		else if (type == OBJECT)
			return true;
		return Primitives.wrap(getRawType(type.getType())).isInstance(value);
	}

	/**
	 * @param type The type to print
	 * @return A string representation of the given type using just the {@link Class#getSimpleName()} of the type and any parameters
	 */
	public static String getSimpleName(TypeToken<?> type) {
		return getSimpleName(type.getType(), new StringBuilder()).toString();
	}

	/**
	 * @param type The type to print
	 * @param str The StringBuilder to print the type into
	 * @return The string builder
	 */
	public static StringBuilder getSimpleName(Type type, StringBuilder str) {
		if (type instanceof Class)
			str.append(((Class<?>) type).getSimpleName());
		else if (type instanceof ParameterizedType) {
			ParameterizedType p = (ParameterizedType) type;
			getSimpleName(p.getRawType(), str).append('<');
			boolean first = true;
			for (Type arg : p.getActualTypeArguments()) {
				if (first)
					first = false;
				else
					str.append(',');
				getSimpleName(arg, str);
			}
			str.append('>');
		} else
			str.append(type.getTypeName());
		return str;
	}
}
