package org.obdispatch;

import java.util.ArrayList;
import java.util.List;

/** An {@link EventListener} that records what it receives, for tests */
public class Recorder implements EventListener {
	private final List<Emission> theEmissions;
	private Propagation theResult;

	/** Creates a recorder that continues propagation */
	public Recorder() {
		theEmissions = new ArrayList<>();
		theResult = Propagation.CONTINUE;
	}

	/**
	 * @param result The result to return for each emission
	 * @return This recorder
	 */
	public Recorder returning(Propagation result) {
		theResult = result;
		return this;
	}

	@Override
	public Propagation onEvent(Emission emission) {
		theEmissions.add(emission);
		return theResult;
	}

	/** @return All emissions received */
	public List<Emission> getEmissions() {
		return theEmissions;
	}

	/** @return The number of emissions received */
	public int getCount() {
		return theEmissions.size();
	}

	/** @return The most recent emission received */
	public Emission getLast() {
		return theEmissions.get(theEmissions.size() - 1);
	}

	/**
	 * @param index The index of the argument
	 * @return The argument at the given index of each emission received
	 */
	public List<Object> getArgs(int index) {
		List<Object> args = new ArrayList<>(theEmissions.size());
		for (Emission emission : theEmissions)
			args.add(emission.getArg(index));
		return args;
	}

	/** Forgets all received emissions */
	public void clear() {
		theEmissions.clear();
	}
}
