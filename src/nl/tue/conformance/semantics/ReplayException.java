package nl.tue.conformance.semantics;

/**
 * Thrown by a strict replay at the first step that names an unknown
 * transition or a transition that is not enabled.
 */
public class ReplayException extends Exception {

	private static final long serialVersionUID = -6520783420877117011L;

	private final int step;
	private final String transitionId;

	public ReplayException(int step, String transitionId, String message, Throwable cause) {
		super(message, cause);
		this.step = step;
		this.transitionId = transitionId;
	}

	/**
	 * Returns the 1-based position of the failing step in the sequence
	 * 
	 * @return
	 */
	public int getStep() {
		return step;
	}

	public String getTransitionId() {
		return transitionId;
	}
}
