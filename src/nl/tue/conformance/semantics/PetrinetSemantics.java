package nl.tue.conformance.semantics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import gnu.trove.map.TIntIntMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.conformance.model.Arc;
import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.PetriNets;
import nl.tue.conformance.model.Place;
import nl.tue.conformance.model.Transition;

/**
 * Firing semantics of a place/transition net with arc weights.
 * 
 * The semantics is computed once from a {@link PetriNet} and is immutable
 * afterwards, hence it can be shared between threads. For each transition the
 * input places (arcs place to transition) and output places (arcs transition
 * to place) are stored as sorted arrays of place numbers with their weights.
 * Parallel arcs between the same place and transition are merged by adding up
 * their weights. Inhibitor arcs, and arcs that do not connect a place with a
 * transition, are ignored.
 * 
 * A place is a sink place if it is not an input place of any transition. A
 * marking is accepting if all tokens reside in sink places.
 */
public class PetrinetSemantics {

	private static final int[] EMPTY = new int[0];

	private final PetriNet net;

	private final PlaceIndex places;

	private final Transition[] transitions;

	private final TObjectIntMap<String> id2transition;

	protected final int[][] input;
	protected final int[][] inputWeight;
	protected final int[][] output;
	protected final int[][] outputWeight;

	private final boolean[] sink;

	private final Marking initialMarking;

	public PetrinetSemantics(PetriNet net) {
		this.net = net;
		this.places = new PlaceIndex(net.getPlaces());
		this.transitions = net.getTransitions().toArray(new Transition[0]);
		this.id2transition = new TObjectIntHashMap<>(transitions.length * 2, 0.5f, -1);
		for (int t = 0; t < transitions.length; t++) {
			if (id2transition.containsKey(transitions[t].getId())) {
				throw new IllegalArgumentException("Duplicate transition id: " + transitions[t].getId());
			}
			id2transition.put(transitions[t].getId(), t);
		}

		TIntIntMap[] in = new TIntIntMap[transitions.length];
		TIntIntMap[] out = new TIntIntMap[transitions.length];
		sink = new boolean[places.size()];
		Arrays.fill(sink, true);

		for (Arc a : net.getArcs()) {
			if (a.isInhibitor()) {
				continue;
			}
			int p = places.indexOf(a.getFrom());
			int t = id2transition.get(a.getTo());
			if (p >= 0 && t >= 0) {
				if (in[t] == null) {
					in[t] = new TIntIntHashMap(4);
				}
				in[t].adjustOrPutValue(p, a.getWeight(), a.getWeight());
				sink[p] = false;
				continue;
			}
			t = id2transition.get(a.getFrom());
			p = places.indexOf(a.getTo());
			if (p >= 0 && t >= 0) {
				if (out[t] == null) {
					out[t] = new TIntIntHashMap(4);
				}
				out[t].adjustOrPutValue(p, a.getWeight(), a.getWeight());
			}
		}

		input = new int[transitions.length][];
		inputWeight = new int[transitions.length][];
		output = new int[transitions.length][];
		outputWeight = new int[transitions.length][];
		for (int t = 0; t < transitions.length; t++) {
			input[t] = sortedKeys(in[t]);
			inputWeight[t] = valuesOf(in[t], input[t]);
			output[t] = sortedKeys(out[t]);
			outputWeight[t] = valuesOf(out[t], output[t]);
		}

		int[] tokens = new int[places.size()];
		List<Place> placeList = net.getPlaces();
		for (int p = 0; p < tokens.length; p++) {
			tokens[p] = Math.max(0, placeList.get(p).getTokens());
		}
		initialMarking = new Marking(places, tokens);
	}

	private static int[] sortedKeys(TIntIntMap map) {
		if (map == null) {
			return EMPTY;
		}
		int[] keys = map.keys();
		Arrays.sort(keys);
		return keys;
	}

	private static int[] valuesOf(TIntIntMap map, int[] keys) {
		if (map == null) {
			return EMPTY;
		}
		int[] values = new int[keys.length];
		for (int i = keys.length; i-- > 0;) {
			values[i] = map.get(keys[i]);
		}
		return values;
	}

	public PetriNet getNet() {
		return net;
	}

	public Marking getInitialMarking() {
		return initialMarking;
	}

	public int numTransitions() {
		return transitions.length;
	}

	public int numPlaces() {
		return places.size();
	}

	public Transition getTransition(int transition) {
		return transitions[transition];
	}

	/**
	 * Returns the number of the transition with the given id, or -1.
	 * 
	 * @param transitionId
	 * @return
	 */
	public int indexOf(String transitionId) {
		return id2transition.get(transitionId);
	}

	/**
	 * Returns the ids of all sink places, in declaration order.
	 * 
	 * @return
	 */
	public Set<String> getSinkPlaces() {
		Set<String> sinks = new LinkedHashSet<>();
		for (int p = 0; p < sink.length; p++) {
			if (sink[p]) {
				sinks.add(places.ids[p]);
			}
		}
		return Collections.unmodifiableSet(sinks);
	}

	public boolean isSink(String placeId) {
		int p = places.indexOf(placeId);
		return p >= 0 && sink[p];
	}

	/**
	 * A marking is accepting if every place that is input to some transition
	 * is empty.
	 * 
	 * @param marking
	 * @return
	 */
	public boolean isAccepting(Marking marking) {
		for (int p = sink.length; p-- > 0;) {
			if (!sink[p] && marking.get(p) != 0) {
				return false;
			}
		}
		return true;
	}

	public boolean isEnabled(Marking marking, String transitionId) {
		int t = indexOf(transitionId);
		return t >= 0 && isEnabled(marking, t);
	}

	public boolean isEnabled(Marking marking, int transition) {
		int[] in = input[transition];
		int[] w = inputWeight[transition];
		for (int i = in.length; i-- > 0;) {
			if (marking.get(in[i]) < w[i]) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Fires the transition with the given id and returns the resulting marking.
	 * The given marking is left untouched.
	 * 
	 * @param marking
	 * @param transitionId
	 * @return
	 * @throws IllegalTransitionException
	 *             if the transition is unknown or not enabled
	 */
	public Marking fire(Marking marking, String transitionId) throws IllegalTransitionException {
		int t = indexOf(transitionId);
		if (t < 0) {
			throw new IllegalTransitionException(transitionId, "transition not found: " + transitionId);
		}
		if (!isEnabled(marking, t)) {
			throw new IllegalTransitionException(transitionId, "transition " + transitionId + " not enabled");
		}
		return fire(marking, t);
	}

	/**
	 * Fires transition t, which is assumed to be enabled.
	 * 
	 * @param marking
	 * @param transition
	 * @return
	 */
	public Marking fire(Marking marking, int transition) {
		assert isEnabled(marking, transition);
		int[] tokens = marking.toArray();
		int[] in = input[transition];
		int[] w = inputWeight[transition];
		for (int i = in.length; i-- > 0;) {
			tokens[in[i]] -= w[i];
		}
		int[] out = output[transition];
		w = outputWeight[transition];
		for (int i = out.length; i-- > 0;) {
			tokens[out[i]] += w[i];
		}
		return new Marking(places, tokens);
	}

	/**
	 * Returns all transitions enabled in the marking, in declaration order.
	 * 
	 * @param marking
	 * @return
	 */
	public List<Transition> getExecutableTransitions(Marking marking) {
		List<Transition> enabled = new ArrayList<>();
		for (int t = 0; t < transitions.length; t++) {
			if (isEnabled(marking, t)) {
				enabled.add(transitions[t]);
			}
		}
		return enabled;
	}

	/**
	 * Creates a marking of this net from place ids to tokens. Places not
	 * mentioned are empty.
	 * 
	 * @param tokens
	 * @return
	 */
	public Marking createMarking(Map<String, Integer> tokens) {
		int[] array = new int[places.size()];
		for (Map.Entry<String, Integer> e : tokens.entrySet()) {
			int p = places.indexOf(e.getKey());
			if (p < 0) {
				throw new IllegalArgumentException("Unknown place: " + e.getKey());
			}
			if (e.getValue() < 0) {
				throw new IllegalArgumentException("Negative tokens for place " + e.getKey());
			}
			array[p] = e.getValue();
		}
		return new Marking(places, array);
	}

	/**
	 * Returns the given net with the token counts of its places replaced by
	 * the marking.
	 */
	public PetriNet toNet(Marking marking) {
		return PetriNets.withTokens(net, marking.asMap());
	}
}
