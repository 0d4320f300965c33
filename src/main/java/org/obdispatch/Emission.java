package org.obdispatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The arguments of one emission of an {@link Event}: the positional arguments and the keyword arguments passed to
 * {@link Dispatcher#emit(String, List, Map)}. Emissions are immutable, although the argument values themselves may not be.
 */
public class Emission {
	/** The keyword under which property events pass the value the property held before the change */
	public static final String OLD_VALUE = "old";
	/** The keyword under which property events pass the {@link org.obdispatch.prop.Property} that changed */
	public static final String PROPERTY = "property";

	private final String theEventName;
	private final List<Object> theArgs;
	private final Map<String, Object> theKeywords;

	/**
	 * @param eventName The name of the event being emitted
	 * @param args The positional arguments of the emission
	 * @param keywords The keyword arguments of the emission
	 */
	protected Emission(String eventName, List<?> args, Map<String, ?> keywords) {
		theEventName = eventName;
		theArgs = args.isEmpty() ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(args));
		theKeywords = keywords.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
	}

	/** @return The name of the event that was emitted */
	public String getEventName() {
		return theEventName;
	}

	/** @return The positional arguments of this emission */
	public List<Object> getArgs() {
		return theArgs;
	}

	/** @return The number of positional arguments in this emission */
	public int getArgCount() {
		return theArgs.size();
	}

	/**
	 * @param index The index of the argument to get
	 * @return The positional argument at the given index
	 * @throws IndexOutOfBoundsException If this emission has no argument at the index
	 */
	public Object getArg(int index) throws IndexOutOfBoundsException {
		return theArgs.get(index);
	}

	/**
	 * @param <T> The expected type of the argument
	 * @param index The index of the argument to get
	 * @param type The expected type of the argument
	 * @return The positional argument at the given index
	 * @throws ClassCastException If the argument is not null and not an instance of the given type
	 */
	public <T> T getArg(int index, Class<T> type) throws ClassCastException {
		return type.cast(theArgs.get(index));
	}

	/** @return The keyword arguments of this emission */
	public Map<String, Object> getKeywords() {
		return theKeywords;
	}

	/**
	 * @param keyword The keyword to get the argument for
	 * @return The keyword argument, or null if it was not passed
	 */
	public Object getKeyword(String keyword) {
		return theKeywords.get(keyword);
	}

	/**
	 * @param keyword The keyword to check
	 * @return Whether a keyword argument was passed with the given keyword (even if its value was null)
	 */
	public boolean hasKeyword(String keyword) {
		return theKeywords.containsKey(keyword);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder(theEventName).append('(');
		boolean first = true;
		for (Object arg : theArgs) {
			if (first)
				first = false;
			else
				str.append(", ");
			str.append(arg);
		}
		for (Map.Entry<String, Object> kw : theKeywords.entrySet()) {
			if (first)
				first = false;
			else
				str.append(", ");
			str.append(kw.getKey()).append('=').append(kw.getValue());
		}
		return str.append(')').toString();
	}

	/**
	 * @param eventName The name of the event being emitted
	 * @param args The positional arguments of the emission
	 * @return The emission
	 */
	public static Emission of(String eventName, Object... args) {
		return new Emission(eventName, Arrays.asList(args), Collections.emptyMap());
	}

	/**
	 * @param eventName The name of the event being emitted
	 * @param args The positional arguments of the emission
	 * @param keywords The keyword arguments of the emission
	 * @return The emission
	 */
	public static Emission of(String eventName, List<?> args, Map<String, ?> keywords) {
		return new Emission(eventName, args, keywords);
	}
}
