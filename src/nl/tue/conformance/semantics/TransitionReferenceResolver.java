package nl.tue.conformance.semantics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.model.Transition;

/**
 * Resolves user supplied transition references to transition ids before a
 * replay. An exact id match always wins. Otherwise a label match resolves only
 * if the label belongs to a single transition. A label shared by several
 * transitions is never guessed: the reference is dropped with a warning.
 * 
 * The alignment algorithms do not use this class; they match trace tokens
 * against ids and labels themselves and try every matching transition.
 */
public final class TransitionReferenceResolver {

	private TransitionReferenceResolver() {
	}

	public static ResolveResult resolve(PetriNet net, List<String> references) {
		Map<String, List<String>> label2ids = new LinkedHashMap<>();
		for (Transition t : net.getTransitions()) {
			if (t.isInvisible()) {
				continue;
			}
			List<String> ids = label2ids.get(t.getLabel());
			if (ids == null) {
				ids = new ArrayList<>(2);
				label2ids.put(t.getLabel(), ids);
			}
			ids.add(t.getId());
		}

		List<String> ids = new ArrayList<>(references.size());
		List<String> unknown = new ArrayList<>();
		List<String> warnings = new ArrayList<>();

		for (String ref : references) {
			if (net.isTransition(ref)) {
				ids.add(ref);
				continue;
			}
			List<String> matches = label2ids.get(ref);
			if (matches == null) {
				unknown.add(ref);
			} else if (matches.size() == 1) {
				ids.add(matches.get(0));
			} else {
				warnings.add("Ambiguous label '" + ref + "' matches transitions: " + String.join(", ", matches));
			}
		}
		return new ResolveResult(ids, unknown, warnings);
	}
}
