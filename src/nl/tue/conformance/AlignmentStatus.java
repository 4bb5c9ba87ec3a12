package nl.tue.conformance;

public enum AlignmentStatus {
	/**
	 * The alignment reaches the goal and is of minimal cost.
	 */
	OPTIMAL,
	/**
	 * The expansion limit was reached. The alignment is the path to the last
	 * node taken from the queue: it may neither be optimal nor reach the goal.
	 */
	CAPPED,
	/**
	 * The search space was exhausted without reaching the goal. The alignment
	 * is empty and the cost is infinite.
	 */
	EXHAUSTED;
}
