package nl.tue.conformance.model;

import java.util.HashSet;
import java.util.Set;

/**
 * Structural validation of a {@link PetriNet}.
 * 
 * Ids must be unique across places and transitions together, so that every arc
 * endpoint resolves to exactly one node. Arcs are not required to connect a
 * place with a transition; arcs that do not are ignored when firing.
 */
public final class PetriNetValidator {

	private PetriNetValidator() {
	}

	public static PetriNet validate(PetriNet net) throws PetriNetParseException {
		Set<String> placeIds = new HashSet<>();
		for (Place p : net.getPlaces()) {
			checkId(p.getId(), "place");
			if (!placeIds.add(p.getId())) {
				throw new PetriNetParseException("Duplicate place id: " + p.getId());
			}
			if (p.getTokens() < 0) {
				throw new PetriNetParseException(
						"Place " + p.getId() + " has a negative number of tokens: " + p.getTokens());
			}
		}
		Set<String> transitionIds = new HashSet<>();
		for (Transition t : net.getTransitions()) {
			checkId(t.getId(), "transition");
			if (!transitionIds.add(t.getId())) {
				throw new PetriNetParseException("Duplicate transition id: " + t.getId());
			}
			if (placeIds.contains(t.getId())) {
				throw new PetriNetParseException("Id used for both a place and a transition: " + t.getId());
			}
		}
		for (Arc a : net.getArcs()) {
			if (!(placeIds.contains(a.getFrom()) || transitionIds.contains(a.getFrom()))) {
				throw new PetriNetParseException("Arc.from not found: " + a.getFrom());
			}
			if (!(placeIds.contains(a.getTo()) || transitionIds.contains(a.getTo()))) {
				throw new PetriNetParseException("Arc.to not found: " + a.getTo());
			}
			if (a.getWeight() < 1) {
				throw new PetriNetParseException(
						"Arc " + a.getFrom() + " -> " + a.getTo() + " has weight " + a.getWeight() + ", expected >= 1");
			}
		}
		return net;
	}

	private static void checkId(String id, String kind) throws PetriNetParseException {
		if (id == null || id.isEmpty()) {
			throw new PetriNetParseException("Every " + kind + " needs a non-empty id");
		}
	}
}
