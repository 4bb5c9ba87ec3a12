package nl.tue.conformance.semantics;

import java.util.Collections;
import java.util.List;

import nl.tue.conformance.model.PetriNet;

public class SequenceReplayResult {

	private final PetriNet model;
	private final Marking marking;
	private final List<String> fired;
	private final List<String> warnings;

	public SequenceReplayResult(PetriNet model, Marking marking, List<String> fired, List<String> warnings) {
		this.model = model;
		this.marking = marking;
		this.fired = Collections.unmodifiableList(fired);
		this.warnings = Collections.unmodifiableList(warnings);
	}

	/**
	 * The replayed net, i.e. the input net with the token counts of the final
	 * marking.
	 * 
	 * @return
	 */
	public PetriNet getModel() {
		return model;
	}

	public Marking getMarking() {
		return marking;
	}

	/**
	 * The ids of the transitions that actually fired, in firing order.
	 * 
	 * @return
	 */
	public List<String> getFiredTransitions() {
		return fired;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	public boolean hasWarnings() {
		return !warnings.isEmpty();
	}
}
