package nl.tue.conformance;

public enum MoveType {
	/**
	 * The next trace token is consumed and a transition matching it fires.
	 */
	SYNC("sync"), //
	/**
	 * A transition fires without consuming a trace token.
	 */
	MODEL("model"), //
	/**
	 * The next trace token is consumed without firing anything.
	 */
	LOG("log");

	private final String label;

	private MoveType(String label) {
		this.label = label;
	}

	public String toString() {
		return label;
	}
}
