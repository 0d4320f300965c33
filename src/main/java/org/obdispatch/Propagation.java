package org.obdispatch;

/** Returned by synchronous listeners to control whether an emission continues on to listeners bound after them */
public enum Propagation {
	/** The emission continues to the next listener */
	CONTINUE,
	/** No further synchronous listener receives the emission */
	STOP;
}
