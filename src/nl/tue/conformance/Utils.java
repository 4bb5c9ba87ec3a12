package nl.tue.conformance;

import java.util.Map;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.conformance.model.Transition;
import nl.tue.conformance.semantics.PetrinetSemantics;

public class Utils {

	public static final int OPTIMALALIGNMENT = 1;
	public static final int FAILEDALIGNMENT = 2;
	public static final int STATELIMITREACHED = 4;

	/**
	 * Default block size determines how many search nodes are reserved in one
	 * go. Whenever a block is full, a new block of this size is allocated.
	 */
	public static final int DEFAULTBLOCKSIZE = 1024;

	/**
	 * Initial size of the priority queue. It grows as needed.
	 */
	public static final int DEFAULTQUEUESIZE = 16;

	/**
	 * Initial size of the best cost map. It grows as needed.
	 */
	public static final int DEFAULTVISITEDSIZE = 16;

	/**
	 * Default limit on the number of node expansions of one alignment.
	 */
	public static final int DEFAULTMAXEXPANSIONS = 10000;

	public enum Statistic {
		EXITCODE("Exit code for alignment"), //
		ALIGNMENTLENGTH("Length of the alignment found"), //
		COST("Cost of the alignment"), //
		LMCOST("Cost of log moves"), //
		MMCOST("Cost of model moves"), //
		SMCOST("Cost of synchronous moves"), //
		TRACELENGTH("Length of the trace"), //
		PLACES("Places in the net"), //
		TRANSITIONS("Transitions in the net"), //
		EDGESTRAVERSED("Moves considered"), //
		POLLACTIONS("Nodes polled from queue"), //
		EXPANSIONS("Nodes expanded"), //
		QUEUEACTIONS("Nodes queued"), //
		NODESREACHED("Nodes reached"), //
		MAXQUEUELENGTH("Maximum queue length (elts)"), //
		MAXQUEUECAPACITY("Maximum queue capacity (elts)"), //
		RUNTIME("Time to compute alignment (us)"), //
		SETUPTIME("Time to setup algorithm (us)"), //
		TOTALTIME("Total Time including setup (us)");
		private final String label;

		private Statistic(String label) {
			this.label = label;
		}

		public String toString() {
			return label;
		}
	}

	/**
	 * Model move costs per transition. Transitions not in the map cost 1 when
	 * visible and 0 when invisible.
	 * 
	 * @param semantics
	 * @param costMM
	 *            may be null
	 * @return
	 */
	public static int[] getModelMoveCosts(PetrinetSemantics semantics, Map<String, Integer> costMM) {
		int[] cost = new int[semantics.numTransitions()];
		for (int t = 0; t < cost.length; t++) {
			Transition transition = semantics.getTransition(t);
			Integer c = costMM == null ? null : costMM.get(transition.getId());
			cost[t] = checkCost(c == null ? (transition.isInvisible() ? 0 : 1) : c, transition.getId());
		}
		return cost;
	}

	/**
	 * Synchronous move costs per transition. Transitions not in the map cost 0.
	 * 
	 * @param semantics
	 * @param costSM
	 *            may be null
	 * @return
	 */
	public static int[] getSyncMoveCosts(PetrinetSemantics semantics, Map<String, Integer> costSM) {
		int[] cost = new int[semantics.numTransitions()];
		for (int t = 0; t < cost.length; t++) {
			String id = semantics.getTransition(t).getId();
			Integer c = costSM == null ? null : costSM.get(id);
			cost[t] = checkCost(c == null ? 0 : c, id);
		}
		return cost;
	}

	/**
	 * Log move costs per activity. Activities not in the map cost 1.
	 * 
	 * @param costLM
	 *            may be null
	 * @return
	 */
	public static TObjectIntMap<String> getLogMoveCosts(Map<String, Integer> costLM) {
		TObjectIntMap<String> map = new TObjectIntHashMap<>(costLM == null ? 4 : Math.max(4, costLM.size() * 2), 0.5f, 1);
		if (costLM != null) {
			for (Map.Entry<String, Integer> e : costLM.entrySet()) {
				map.put(e.getKey(), checkCost(e.getValue(), e.getKey()));
			}
		}
		return map;
	}

	private static int checkCost(int cost, String element) {
		if (cost < 0) {
			throw new IllegalArgumentException("Negative cost " + cost + " for " + element);
		}
		return cost;
	}

	/**
	 * Writes an alignment as two rows, the log on top and the model below, e.g.
	 * 
	 * <pre>
	 * log   | A | B | >> |
	 * model | A | >> | C |
	 * </pre>
	 * 
	 * @param alignment
	 * @return
	 */
	public static String toTable(Alignment alignment) {
		StringBuilder log = new StringBuilder("log   |");
		StringBuilder model = new StringBuilder("model |");
		for (AlignmentMove move : alignment.getMoves()) {
			String l = move.getMoveType() == MoveType.MODEL ? ">>" : move.getActivity();
			String m = move.getMoveType() == MoveType.LOG ? ">>" : move.getActivity();
			int width = Math.max(l.length(), m.length());
			log.append(' ').append(pad(l, width)).append(" |");
			model.append(' ').append(pad(m, width)).append(" |");
		}
		return log.append('\n').append(model).toString();
	}

	private static String pad(String s, int width) {
		StringBuilder b = new StringBuilder(s);
		while (b.length() < width) {
			b.append(' ');
		}
		return b.toString();
	}
}
