package nl.tue.conformance.semantics;

import java.util.ArrayList;
import java.util.List;

import nl.tue.conformance.model.PetriNet;

/**
 * Replays a sequence of transition ids on a net, starting in its initial
 * marking. Transitions fire in exactly the given order; nothing is reordered
 * and no unlisted transition ever fires.
 * 
 * In strict mode the first unknown or disabled transition aborts the replay
 * with a {@link ReplayException}. In lenient mode such steps are skipped, a
 * warning is recorded, and the replay always completes.
 */
public final class SequenceReplay {

	private SequenceReplay() {
	}

	public static SequenceReplayResult replay(PetriNet net, List<String> sequence, boolean strict)
			throws ReplayException {
		return replay(new PetrinetSemantics(net), sequence, strict);
	}

	public static SequenceReplayResult replay(PetrinetSemantics semantics, List<String> sequence, boolean strict)
			throws ReplayException {
		return replay(semantics, sequence, strict, new ArrayList<String>());
	}

	/**
	 * Resolves the references (ids or labels) first, see
	 * {@link TransitionReferenceResolver}, and replays the resolved ids. Notes
	 * about ambiguous or unknown references are reported as warnings, also in
	 * strict mode.
	 * 
	 * @param net
	 * @param references
	 * @param strict
	 * @return
	 * @throws ReplayException
	 */
	public static SequenceReplayResult replayReferences(PetriNet net, List<String> references, boolean strict)
			throws ReplayException {
		ResolveResult resolved = TransitionReferenceResolver.resolve(net, references);
		List<String> warnings = new ArrayList<>(resolved.getWarnings());
		for (String unknown : resolved.getUnknown()) {
			warnings.add("Unknown transition reference: " + unknown);
		}
		return replay(new PetrinetSemantics(net), resolved.getIds(), strict, warnings);
	}

	private static SequenceReplayResult replay(PetrinetSemantics semantics, List<String> sequence, boolean strict,
			List<String> warnings) throws ReplayException {
		Marking marking = semantics.getInitialMarking();
		List<String> fired = new ArrayList<>(sequence.size());

		for (int step = 0; step < sequence.size(); step++) {
			String tid = sequence.get(step);
			String msg;
			if (semantics.indexOf(tid) < 0) {
				msg = "Step " + (step + 1) + ": transition not found: " + tid;
			} else if (!semantics.isEnabled(marking, tid)) {
				msg = "Step " + (step + 1) + ": transition " + tid + " not enabled";
			} else {
				try {
					marking = semantics.fire(marking, tid);
				} catch (IllegalTransitionException e) {
					// enabledness was checked above
					throw new IllegalStateException(e);
				}
				fired.add(tid);
				continue;
			}
			if (strict) {
				throw new ReplayException(step + 1, tid, msg, null);
			}
			warnings.add(msg);
		}

		return new SequenceReplayResult(semantics.toNet(marking), marking, fired, warnings);
	}
}
