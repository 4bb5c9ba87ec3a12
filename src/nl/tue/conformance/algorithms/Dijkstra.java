package nl.tue.conformance.algorithms;

import gnu.trove.map.TObjectIntMap;
import nl.tue.conformance.semantics.PetrinetSemantics;

/**
 * Computes an optimal alignment: the trace is fully consumed and the net
 * reached an accepting marking.
 */
public class Dijkstra extends ReplayAlgorithm {

	public Dijkstra(PetrinetSemantics semantics) {
		this(semantics, Debug.NONE);
	}

	public Dijkstra(PetrinetSemantics semantics, Debug debug) {
		super(semantics, debug);
	}

	public Dijkstra(PetrinetSemantics semantics, int[] costMM, int[] costSM, TObjectIntMap<String> costLM,
			Debug debug) {
		super(semantics, costMM, costSM, costLM, debug);
	}

	@Override
	protected boolean isFinal(int node) {
		return getTraceIndex(node) == trace.size() && semantics.isAccepting(getMarking(node));
	}

}
