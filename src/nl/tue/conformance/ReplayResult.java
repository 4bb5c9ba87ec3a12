package nl.tue.conformance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The alignments of all distinct traces of a log.
 */
public class ReplayResult {

	private final List<TraceAlignment> alignments;
	private final int maxModelMoveCost;

	public ReplayResult(Collection<TraceAlignment> alignments, int maxModelMoveCost) {
		this.alignments = Collections.unmodifiableList(new ArrayList<>(alignments));
		this.maxModelMoveCost = maxModelMoveCost;
	}

	public List<TraceAlignment> getAlignments() {
		return alignments;
	}

	/**
	 * Returns the alignment for the case with the given index, or null.
	 * 
	 * @param traceIndex
	 * @return
	 */
	public TraceAlignment getAlignment(int traceIndex) {
		for (TraceAlignment alignment : alignments) {
			if (alignment.getTraceIndices().contains(traceIndex)) {
				return alignment;
			}
		}
		return null;
	}

	/**
	 * Cost of the cheapest run of the net to an accepting marking, i.e. the
	 * cost of aligning the empty trace.
	 * 
	 * @return
	 */
	public int getMaxModelMoveCost() {
		return maxModelMoveCost;
	}

	public int numberOfCases() {
		int n = 0;
		for (TraceAlignment alignment : alignments) {
			n += alignment.getTraceIndices().size();
		}
		return n;
	}

	/**
	 * Average alignment fitness over all cases, 1 for an empty log.
	 * 
	 * @return
	 */
	public double getAverageFitness() {
		double sum = 0;
		int n = 0;
		for (TraceAlignment alignment : alignments) {
			int cases = alignment.getTraceIndices().size();
			sum += cases * alignment.getAlignment().getFitness();
			n += cases;
		}
		return n == 0 ? 1.0 : sum / n;
	}

	/**
	 * Number of cases whose alignment is not proven optimal.
	 * 
	 * @return
	 */
	public int getUnreliableCount() {
		int n = 0;
		for (TraceAlignment alignment : alignments) {
			if (!alignment.isReliable()) {
				n += alignment.getTraceIndices().size();
			}
		}
		return n;
	}
}
