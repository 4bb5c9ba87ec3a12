package nl.tue.conformance.algorithms;

import gnu.trove.map.TObjectIntMap;
import nl.tue.conformance.semantics.PetrinetSemantics;

/**
 * Computes an optimal prefix alignment: the trace is fully consumed, the net
 * may be left in any marking. Used for running cases that have not completed
 * yet.
 */
public class PrefixDijkstra extends ReplayAlgorithm {

	public PrefixDijkstra(PetrinetSemantics semantics) {
		this(semantics, Debug.NONE);
	}

	public PrefixDijkstra(PetrinetSemantics semantics, Debug debug) {
		super(semantics, debug);
	}

	public PrefixDijkstra(PetrinetSemantics semantics, int[] costMM, int[] costSM, TObjectIntMap<String> costLM,
			Debug debug) {
		super(semantics, costMM, costSM, costLM, debug);
	}

	@Override
	protected boolean isFinal(int node) {
		return getTraceIndex(node) == trace.size();
	}

}
