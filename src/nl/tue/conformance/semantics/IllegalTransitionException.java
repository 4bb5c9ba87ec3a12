package nl.tue.conformance.semantics;

/**
 * Thrown when a transition is fired that is unknown to the net or not enabled
 * in the given marking.
 */
public class IllegalTransitionException extends Exception {

	private static final long serialVersionUID = 4781538271964385523L;

	private final String transitionId;

	public IllegalTransitionException(String transitionId, String message) {
		super(message);
		this.transitionId = transitionId;
	}

	public String getTransitionId() {
		return transitionId;
	}
}
