package nl.tue.conformance.model;

public enum ArcType {
	STANDARD, //
	/**
	 * Parsed and written by all formats, but not used when firing transitions.
	 */
	INHIBITOR;
}
