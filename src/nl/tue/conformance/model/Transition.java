package nl.tue.conformance.model;

/**
 * A transition of a Petri net. Transitions without a label are invisible
 * (silent) and do not correspond to any activity in an event log.
 */
public class Transition {

	private final String id;
	private final String label;

	public Transition(String id) {
		this(id, null);
	}

	public Transition(String id, String label) {
		this.id = id;
		this.label = label;
	}

	public String getId() {
		return id;
	}

	/**
	 * Returns the label, or null for an invisible transition
	 * 
	 * @return
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * A transition is invisible if it has no label (null or empty).
	 * 
	 * @return
	 */
	public boolean isInvisible() {
		return label == null || label.isEmpty();
	}

	/**
	 * Returns the activity name used when this transition appears in an
	 * alignment, i.e. the label or, for invisible transitions, the id.
	 * 
	 * @return
	 */
	public String getActivity() {
		return isInvisible() ? id : label;
	}

	/**
	 * Checks whether a trace token refers to this transition, either by id or
	 * by label.
	 * 
	 * @param token
	 * @return
	 */
	public boolean matches(String token) {
		return id.equals(token) || (!isInvisible() && label.equals(token));
	}

	@Override
	public int hashCode() {
		return 31 * (id == null ? 0 : id.hashCode()) + (label == null ? 0 : label.hashCode());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Transition)) {
			return false;
		}
		Transition other = (Transition) obj;
		return Place.equal(id, other.id) && Place.equal(label, other.label);
	}

	@Override
	public String toString() {
		return label == null ? id : id + "(" + label + ")";
	}
}
