package nl.tue.conformance.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Editing operations on {@link PetriNet} values. None of these methods modify
 * their argument; each returns a fresh net.
 */
public final class PetriNets {

	private PetriNets() {
	}

	/**
	 * Returns the first id of the form {@code prefix + n}, n = 0, 1, ..., that
	 * is used by neither a place nor a transition of the given net.
	 * 
	 * @param net
	 * @param prefix
	 * @return
	 */
	public static String freshId(PetriNet net, String prefix) {
		int n = 0;
		while (net.contains(prefix + n)) {
			n++;
		}
		return prefix + n;
	}

	public static PetriNet addPlace(PetriNet net, Place place) {
		if (net.contains(place.getId())) {
			throw new IllegalArgumentException("Node with id " + place.getId() + " already exists.");
		}
		if (place.getTokens() < 0) {
			throw new IllegalArgumentException("Tokens cannot be negative: " + place.getTokens());
		}
		List<Place> places = new ArrayList<>(net.getPlaces());
		places.add(place);
		return new PetriNet(places, net.getTransitions(), net.getArcs());
	}

	/**
	 * Adds an unlabeled, empty place with a fresh id {@code P<n>}.
	 */
	public static PetriNet addPlace(PetriNet net) {
		return addPlace(net, new Place(freshId(net, "P")));
	}

	public static PetriNet addTransition(PetriNet net, Transition transition) {
		if (net.contains(transition.getId())) {
			throw new IllegalArgumentException("Node with id " + transition.getId() + " already exists.");
		}
		List<Transition> transitions = new ArrayList<>(net.getTransitions());
		transitions.add(transition);
		return new PetriNet(net.getPlaces(), transitions, net.getArcs());
	}

	/**
	 * Adds an invisible transition with a fresh id {@code T<n>}.
	 */
	public static PetriNet addTransition(PetriNet net) {
		return addTransition(net, new Transition(freshId(net, "T")));
	}

	/**
	 * Adds an arc. Both endpoints must exist and must be of a different kind
	 * (place to transition or transition to place).
	 * 
	 * @param net
	 * @param arc
	 * @return
	 */
	public static PetriNet addArc(PetriNet net, Arc arc) {
		if (!net.contains(arc.getFrom()) || !net.contains(arc.getTo())) {
			throw new IllegalArgumentException("Source or target node not found for arc " + arc);
		}
		if (net.isPlace(arc.getFrom()) == net.isPlace(arc.getTo())) {
			throw new IllegalArgumentException("Invalid connection between node types: " + arc);
		}
		if (arc.getWeight() < 1) {
			throw new IllegalArgumentException("Arc weight must be at least 1: " + arc);
		}
		List<Arc> arcs = new ArrayList<>(net.getArcs());
		arcs.add(arc);
		return new PetriNet(net.getPlaces(), net.getTransitions(), arcs);
	}

	/**
	 * Removes the place or transition with the given id together with all arcs
	 * attached to it. Unknown ids leave the net unchanged.
	 * 
	 * @param net
	 * @param id
	 * @return
	 */
	public static PetriNet removeNode(PetriNet net, String id) {
		if (!net.contains(id)) {
			return net;
		}
		List<Place> places = new ArrayList<>(net.getPlaces().size());
		for (Place p : net.getPlaces()) {
			if (!p.getId().equals(id)) {
				places.add(p);
			}
		}
		List<Transition> transitions = new ArrayList<>(net.getTransitions().size());
		for (Transition t : net.getTransitions()) {
			if (!t.getId().equals(id)) {
				transitions.add(t);
			}
		}
		List<Arc> arcs = new ArrayList<>(net.getArcs().size());
		for (Arc a : net.getArcs()) {
			if (!a.getFrom().equals(id) && !a.getTo().equals(id)) {
				arcs.add(a);
			}
		}
		return new PetriNet(places, transitions, arcs);
	}

	public static PetriNet setTokens(PetriNet net, String placeId, int tokens) {
		if (!net.isPlace(placeId)) {
			throw new IllegalArgumentException("Unknown place: " + placeId);
		}
		if (tokens < 0) {
			throw new IllegalArgumentException("Tokens cannot be negative: " + tokens);
		}
		List<Place> places = new ArrayList<>(net.getPlaces().size());
		for (Place p : net.getPlaces()) {
			places.add(p.getId().equals(placeId) ? p.withTokens(tokens) : p);
		}
		return new PetriNet(places, net.getTransitions(), net.getArcs());
	}

	/**
	 * Returns a copy of the net in which every place holds the number of tokens
	 * given in the map. Places not mentioned get 0 tokens.
	 * 
	 * @param net
	 * @param tokens
	 * @return
	 */
	public static PetriNet withTokens(PetriNet net, Map<String, Integer> tokens) {
		List<Place> places = new ArrayList<>(net.getPlaces().size());
		for (Place p : net.getPlaces()) {
			Integer n = tokens.get(p.getId());
			places.add(p.withTokens(n == null ? 0 : n));
		}
		return new PetriNet(places, net.getTransitions(), net.getArcs());
	}
}
