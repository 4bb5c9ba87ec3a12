package nl.tue.conformance;

/**
 * One step of an alignment. For synchronous and model moves the activity is
 * the label of the fired transition (its id if it is invisible) and the
 * transition id is set. For log moves the activity is the trace token and
 * there is no transition.
 */
public class AlignmentMove {

	private final MoveType moveType;
	private final String activity;
	private final String transitionId;

	public AlignmentMove(MoveType moveType, String activity, String transitionId) {
		this.moveType = moveType;
		this.activity = activity;
		this.transitionId = transitionId;
	}

	public static AlignmentMove sync(String activity, String transitionId) {
		return new AlignmentMove(MoveType.SYNC, activity, transitionId);
	}

	public static AlignmentMove model(String activity, String transitionId) {
		return new AlignmentMove(MoveType.MODEL, activity, transitionId);
	}

	public static AlignmentMove log(String activity) {
		return new AlignmentMove(MoveType.LOG, activity, null);
	}

	public MoveType getMoveType() {
		return moveType;
	}

	public String getActivity() {
		return activity;
	}

	/**
	 * Returns the id of the fired transition, or null for a log move.
	 * 
	 * @return
	 */
	public String getTransitionId() {
		return transitionId;
	}

	@Override
	public int hashCode() {
		int result = moveType.hashCode();
		result = 31 * result + (activity == null ? 0 : activity.hashCode());
		return 31 * result + (transitionId == null ? 0 : transitionId.hashCode());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof AlignmentMove)) {
			return false;
		}
		AlignmentMove other = (AlignmentMove) obj;
		return moveType == other.moveType && (activity == null ? other.activity == null : activity.equals(other.activity))
				&& (transitionId == null ? other.transitionId == null : transitionId.equals(other.transitionId));
	}

	@Override
	public String toString() {
		return "(" + moveType + "," + activity + ")";
	}
}
