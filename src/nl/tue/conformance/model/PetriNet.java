package nl.tue.conformance.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Petri net as a passive value: places and transitions keyed by id, plus a
 * flat list of arcs. The token counts of the places form the initial marking.
 * 
 * A PetriNet is immutable. All editing operations in {@link PetriNets} return
 * a new net. Structural validity is not checked here, see
 * {@link PetriNetValidator}.
 */
public class PetriNet {

	private final List<Place> places;
	private final List<Transition> transitions;
	private final List<Arc> arcs;

	private final Map<String, Place> id2place;
	private final Map<String, Transition> id2transition;

	public PetriNet(List<Place> places, List<Transition> transitions, List<Arc> arcs) {
		this.places = Collections.unmodifiableList(new ArrayList<>(places));
		this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
		this.arcs = Collections.unmodifiableList(new ArrayList<>(arcs));

		// first declaration wins, duplicates are reported by the validator
		this.id2place = new LinkedHashMap<>();
		for (Place p : this.places) {
			if (!id2place.containsKey(p.getId())) {
				id2place.put(p.getId(), p);
			}
		}
		this.id2transition = new LinkedHashMap<>();
		for (Transition t : this.transitions) {
			if (!id2transition.containsKey(t.getId())) {
				id2transition.put(t.getId(), t);
			}
		}
	}

	public static PetriNet empty() {
		return new PetriNet(Collections.<Place>emptyList(), Collections.<Transition>emptyList(),
				Collections.<Arc>emptyList());
	}

	public List<Place> getPlaces() {
		return places;
	}

	public List<Transition> getTransitions() {
		return transitions;
	}

	public List<Arc> getArcs() {
		return arcs;
	}

	/**
	 * Returns the place with the given id, or null if no such place exists.
	 * 
	 * @param id
	 * @return
	 */
	public Place getPlace(String id) {
		return id2place.get(id);
	}

	/**
	 * Returns the transition with the given id, or null if no such transition
	 * exists.
	 * 
	 * @param id
	 * @return
	 */
	public Transition getTransition(String id) {
		return id2transition.get(id);
	}

	public boolean isPlace(String id) {
		return id2place.containsKey(id);
	}

	public boolean isTransition(String id) {
		return id2transition.containsKey(id);
	}

	public boolean contains(String id) {
		return isPlace(id) || isTransition(id);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * places.hashCode() + transitions.hashCode()) + arcs.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof PetriNet)) {
			return false;
		}
		PetriNet other = (PetriNet) obj;
		return places.equals(other.places) && transitions.equals(other.transitions) && arcs.equals(other.arcs);
	}

	@Override
	public String toString() {
		return "PetriNet[places=" + places + ", transitions=" + transitions + ", arcs=" + arcs + "]";
	}
}
