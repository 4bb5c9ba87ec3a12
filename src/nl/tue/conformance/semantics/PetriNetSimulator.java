package nl.tue.conformance.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import nl.tue.conformance.model.Transition;

/**
 * Plays out random runs of a net. In every step one of the enabled transitions
 * is chosen uniformly at random. A run ends when no transition is enabled,
 * when the marking is accepting, or when the step limit is reached.
 */
public class PetriNetSimulator {

	private final PetrinetSemantics semantics;
	private final Random random;

	public PetriNetSimulator(PetrinetSemantics semantics, long seed) {
		this.semantics = semantics;
		this.random = new Random(seed);
	}

	public Run simulate(int maxSteps) {
		Marking marking = semantics.getInitialMarking();
		List<String> fired = new ArrayList<>();
		List<String> trace = new ArrayList<>();

		List<Transition> enabled = semantics.getExecutableTransitions(marking);
		while (!enabled.isEmpty() && fired.size() < maxSteps
				&& !(fired.size() > 0 && semantics.isAccepting(marking))) {
			Transition t = enabled.get(random.nextInt(enabled.size()));
			marking = semantics.fire(marking, semantics.indexOf(t.getId()));
			fired.add(t.getId());
			if (!t.isInvisible()) {
				trace.add(t.getLabel());
			}
			enabled = semantics.getExecutableTransitions(marking);
		}
		return new Run(fired, trace, marking);
	}

	public static class Run {
		private final List<String> fired;
		private final List<String> trace;
		private final Marking marking;

		Run(List<String> fired, List<String> trace, Marking marking) {
			this.fired = Collections.unmodifiableList(fired);
			this.trace = Collections.unmodifiableList(trace);
			this.marking = marking;
		}

		/**
		 * Ids of the fired transitions
		 */
		public List<String> getFiredTransitions() {
			return fired;
		}

		/**
		 * Labels of the fired visible transitions, i.e. the observable trace
		 */
		public List<String> getTrace() {
			return trace;
		}

		public Marking getMarking() {
			return marking;
		}
	}
}
