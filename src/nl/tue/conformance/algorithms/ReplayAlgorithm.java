package nl.tue.conformance.algorithms;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.conformance.Alignment;
import nl.tue.conformance.AlignmentMove;
import nl.tue.conformance.AlignmentStatus;
import nl.tue.conformance.MoveType;
import nl.tue.conformance.Utils;
import nl.tue.conformance.Utils.Statistic;
import nl.tue.conformance.algorithms.datastructures.BinaryHeap;
import nl.tue.conformance.model.Transition;
import nl.tue.conformance.semantics.Marking;
import nl.tue.conformance.semantics.PetrinetSemantics;

/**
 * The replay algorithm implements a uniform cost search over the states
 * (marking, trace index) of a net and a trace. It leaves the goal condition
 * to implementing subclasses.
 *
 * Edge costs are never negative. Hence the first final node polled from the
 * queue is optimal.
 *
 * A node is discarded when it is polled with a cost higher than the best cost
 * recorded for its state. Hence nodes are never removed from the middle of the
 * queue.
 *
 * The number of expansions can be limited. If the limit is exceeded, the path
 * to the node polled last is returned with status
 * {@link AlignmentStatus#CAPPED}. Such an alignment is not necessarily optimal
 * and does not necessarily reach a final state.
 */

/*-
 * Internally, search nodes are stored in a number of parallel arrays. These
 * arrays are double arrays, i.e. the used memory is split up into blocks of
 * blockSize elements, which avoids copying when the arena grows.
 *
 * A node is addressed by an int handle n, which lives in block n >>> blockBit
 * at index n & blockMask. For each node we store the marking, the trace index,
 * the cost g, the predecessor handle, the move type and the transition of the
 * move leading to it, and the key of its state.
 *
 * The initial node has handle 0 and predecessor NOPREDECESSOR.
 */
public abstract class ReplayAlgorithm {

	public static enum Debug {

		DOT {
			@Override
			public synchronized void writeNodeReached(ReplayAlgorithm algorithm, int node, String extra) {
				StringBuilder b = new StringBuilder();
				b.append("n");
				b.append(node);
				b.append(" [label=<n");
				b.append(node);
				b.append("<BR/>");
				b.append(algorithm.getMarking(node));
				b.append("<BR/>i=");
				b.append(algorithm.getTraceIndex(node));
				b.append(",g=");
				b.append(algorithm.getGScore(node));
				b.append(">");
				if (!extra.isEmpty()) {
					b.append(",");
					b.append(extra);
				}
				b.append("];");
				synchronized (output) {
					output.println(b.toString());
				}
			}

			@Override
			public synchronized void writeEdgeTraversed(ReplayAlgorithm algorithm, int fromNode, int toNode,
					String extra) {
				StringBuilder b = new StringBuilder();
				b.append("n");
				b.append(fromNode);
				b.append(" -> ");
				b.append("n");
				b.append(toNode);
				b.append(" [");
				MoveType type = algorithm.getMoveType(toNode);
				if (type != null) {
					b.append("label=<<b>");
					b.append(escape(algorithm.getActivity(toNode)));
					b.append("<br/>");
					b.append(algorithm.getGScore(toNode) - algorithm.getGScore(fromNode));
					b.append("</b>>");
					if (type == MoveType.SYNC) {
						b.append(",fontcolor=forestgreen");
					} else if (type == MoveType.MODEL) {
						b.append(",fontcolor=darkorchid1");
					} else {
						b.append(",fontcolor=goldenrod2");
					}
				}
				if (!extra.isEmpty()) {
					if (type != null) {
						b.append(",");
					}
					b.append(extra);
				}
				b.append("];");
				synchronized (output) {
					output.println(b.toString());
				}
			}
		}, //
		NORMAL, //
		NONE, STATS;

		private static String EMPTY = "";
		private static PrintStream output = System.out;

		public synchronized void writeEdgeTraversed(ReplayAlgorithm algorithm, int fromNode, int toNode,
				String extra) {
		}

		public synchronized void writeNodeReached(ReplayAlgorithm algorithm, int node, String extra) {
		}

		public synchronized void writeEdgeTraversed(ReplayAlgorithm algorithm, int fromNode, int toNode) {
			this.writeEdgeTraversed(algorithm, fromNode, toNode, EMPTY);
		}

		public synchronized void writeNodeReached(ReplayAlgorithm algorithm, int node) {
			this.writeNodeReached(algorithm, node, EMPTY);
		}

		public synchronized void println(Debug db, String s) {
			if (this == db) {
				synchronized (output) {
					output.println(s);
				}
			}
		}

		public synchronized void println(Debug db) {
			if (this == db) {
				synchronized (output) {
					output.println();
				}
			}
		}

		public synchronized void print(Debug db, String s) {
			if (this == db) {
				synchronized (output) {
					output.print(s);
				}
			}
		}

		public synchronized static void setOutputStream(PrintStream out) {
			output = out;
		}

		public synchronized static PrintStream getOutputStream() {
			return output;
		}

		private static String escape(String s) {
			return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
		}
	}

	protected static final int NOPREDECESSOR = -1;

	protected static final byte NOMOVE = -1;

	private static final MoveType[] MOVETYPES = MoveType.values();

	/**
	 * Stores the blockSize as a power of 2
	 */
	protected final int blockSize;

	/**
	 * Stores the number of trailing 0's in the blockSize.
	 */
	protected final int blockBit;

	/**
	 * equals blockSize-1
	 */
	protected final int blockMask;

	/**
	 * Stores the last block in use
	 */
	protected int block;

	/**
	 * Stores the first new index in current block
	 */
	private int indexInBlock;

	protected Marking[][] markings;
	protected int[][] traceIndex;
	protected int[][] g;
	protected int[][] predecessor;
	protected byte[][] moveType;
	protected int[][] transition;
	protected String[][] keys;

	/**
	 * Lowest cost seen so far per state key. Unknown keys map to
	 * Integer.MAX_VALUE.
	 */
	protected TObjectIntMap<String> bestCost;

	/**
	 * Stores the open set as a priority queue of node handles
	 */
	protected BinaryHeap<Integer> queue;

	protected final PetrinetSemantics semantics;

	protected final int[] costMM;
	protected final int[] costSM;
	protected final TObjectIntMap<String> costLM;

	/**
	 * Stores the selected debug level
	 */
	protected final Debug debug;

	protected List<String> trace;

	protected int pollActions;
	protected int expansions;
	protected int queueActions;
	protected int edgesTraversed;
	protected int nodesReached;
	protected int alignmentLength;
	protected int alignmentCost;
	protected int alignmentResult;
	protected int lmCost;
	protected int mmCost;
	protected int smCost;
	protected int setupTime;
	protected int runTime;

	protected long startConstructor;

	/**
	 * Creates an algorithm with default costs: model moves cost 1 (0 for
	 * invisible transitions), log moves cost 1 and synchronous moves cost 0.
	 *
	 * @param semantics
	 * @param debug
	 */
	public ReplayAlgorithm(PetrinetSemantics semantics, Debug debug) {
		this(semantics, Utils.getModelMoveCosts(semantics, null), Utils.getSyncMoveCosts(semantics, null),
				Utils.getLogMoveCosts(null), debug);
	}

	/**
	 *
	 * @param semantics
	 * @param costMM
	 *            model move cost per transition number
	 * @param costSM
	 *            synchronous move cost per transition number
	 * @param costLM
	 *            log move cost per activity, the no entry value is the
	 *            default cost
	 * @param debug
	 */
	public ReplayAlgorithm(PetrinetSemantics semantics, int[] costMM, int[] costSM, TObjectIntMap<String> costLM,
			Debug debug) {
		startConstructor = System.nanoTime();
		if (costMM.length != semantics.numTransitions() || costSM.length != semantics.numTransitions()) {
			throw new IllegalArgumentException("Expected one cost per transition");
		}
		this.semantics = semantics;
		this.costMM = costMM;
		this.costSM = costSM;
		this.costLM = costLM;
		this.debug = debug;

		this.blockSize = Utils.DEFAULTBLOCKSIZE;
		this.blockMask = blockSize - 1;
		int bit = 1;
		int i = 0;
		while (bit < blockSize) {
			bit <<= 1;
			i++;
		}
		this.blockBit = i;

		this.setupTime = (int) ((System.nanoTime() - startConstructor) / 1000);
	}

	/**
	 * Computes an alignment of the given trace with the net.
	 *
	 * @param trace
	 *            the activities of the trace, each matching transition ids or
	 *            labels
	 * @param maxExpansions
	 *            limit on the number of expansions, unbounded if <= 0
	 * @return
	 */
	public Alignment run(List<String> trace, int maxExpansions) {
		this.trace = trace;
		pollActions = 0;
		expansions = 0;
		queueActions = 0;
		edgesTraversed = 0;
		nodesReached = 0;
		alignmentLength = 0;
		alignmentCost = 0;
		alignmentResult = 0;
		lmCost = 0;
		mmCost = 0;
		smCost = 0;
		runTime = 0;

		return runReplayAlgorithm(System.nanoTime(), maxExpansions <= 0 ? Integer.MAX_VALUE : maxExpansions);
	}

	protected Alignment runReplayAlgorithm(long startTime, int maxExpansions) {
		Alignment alignment = null;
		debug.println(Debug.DOT, "Digraph D {");
		try {
			initializeRun();

			while (!queue.isEmpty()) {
				int n = queue.poll();
				pollActions++;

				if (isFinal(n)) {
					alignmentResult |= Utils.OPTIMALALIGNMENT;
					alignment = handleNodeReached(startTime, n, AlignmentStatus.OPTIMAL);
					return alignment;
				}
				if (getGScore(n) > bestCost.get(getKey(n))) {
					// a cheaper path to the same state was queued after n
					continue;
				}
				if (expansions >= maxExpansions) {
					alignmentResult |= Utils.FAILEDALIGNMENT | Utils.STATELIMITREACHED;
					alignment = handleNodeReached(startTime, n, AlignmentStatus.CAPPED);
					return alignment;
				}
				expansions++;
				expandNode(n);
			}
			alignmentResult |= Utils.FAILEDALIGNMENT;
			runTime = (int) ((System.nanoTime() - startTime) / 1000);
			alignment = new Alignment(new ArrayList<AlignmentMove>(0), Double.POSITIVE_INFINITY,
					AlignmentStatus.EXHAUSTED, getStatistics());
			return alignment;
		} finally {
			terminateRun(alignment);
		}
	}

	protected void initializeRun() {
		block = -1;
		indexInBlock = 0;
		markings = new Marking[0][];
		traceIndex = new int[0][];
		g = new int[0][];
		predecessor = new int[0][];
		moveType = new byte[0][];
		transition = new int[0][];
		keys = new String[0][];
		growArrays();

		bestCost = new TObjectIntHashMap<>(Utils.DEFAULTVISITEDSIZE, 0.5f, Integer.MAX_VALUE);
		queue = new BinaryHeap<Integer>(new Comparator<Integer>() {
			public int compare(Integer n1, Integer n2) {
				int c = Integer.compare(getGScore(n1), getGScore(n2));
				if (c != 0) {
					return c;
				}
				// deeper in the trace first
				c = Integer.compare(getTraceIndex(n2), getTraceIndex(n1));
				if (c != 0) {
					return c;
				}
				return Integer.compare(n1, n2);
			}
		}, Utils.DEFAULTQUEUESIZE);

		int n = addNewNode(semantics.getInitialMarking(), 0, 0, NOPREDECESSOR, NOMOVE, -1);
		bestCost.put(getKey(n), 0);
		addToQueue(n);
	}

	protected void expandNode(int n) {
		Marking marking = getMarking(n);
		int i = getTraceIndex(n);
		int gn = getGScore(n);
		String activity = i < trace.size() ? trace.get(i) : null;
		int numTransitions = semantics.numTransitions();

		if (activity != null) {
			for (int t = 0; t < numTransitions; t++) {
				if (semantics.getTransition(t).matches(activity) && semantics.isEnabled(marking, t)) {
					relax(n, semantics.fire(marking, t), i + 1, gn + costSM[t], MoveType.SYNC, t);
				}
			}
		}
		for (int t = 0; t < numTransitions; t++) {
			if (semantics.isEnabled(marking, t)) {
				relax(n, semantics.fire(marking, t), i, gn + costMM[t], MoveType.MODEL, t);
			}
		}
		if (activity != null) {
			relax(n, marking, i + 1, gn + costLM.get(activity), MoveType.LOG, -1);
		}
	}

	/**
	 * Records the successor of node n if it improves the best known cost of its
	 * state.
	 */
	protected void relax(int n, Marking marking, int index, int cost, MoveType type, int t) {
		edgesTraversed++;
		String key = marking.key(index);
		if (cost < bestCost.get(key)) {
			bestCost.put(key, cost);
			int m = addNewNode(marking, index, cost, n, (byte) type.ordinal(), t, key);
			debug.writeEdgeTraversed(this, n, m);
			addToQueue(m);
		}
	}

	protected void addToQueue(int node) {
		queue.add(node);
		queueActions++;
	}

	protected int addNewNode(Marking marking, int index, int cost, int pred, byte type, int t) {
		return addNewNode(marking, index, cost, pred, type, t, marking.key(index));
	}

	protected int addNewNode(Marking marking, int index, int cost, int pred, byte type, int t, String key) {
		int b = block;
		int i = indexInBlock;
		markings[b][i] = marking;
		traceIndex[b][i] = index;
		g[b][i] = cost;
		predecessor[b][i] = pred;
		moveType[b][i] = type;
		transition[b][i] = t;
		keys[b][i] = key;
		nodesReached++;

		int pos = b * blockSize + i;
		indexInBlock++;
		if (indexInBlock >= blockSize) {
			growArrays();
		}
		return pos;
	}

	protected void growArrays() {
		int blocks = block + 2;
		markings = Arrays.copyOf(markings, blocks);
		traceIndex = Arrays.copyOf(traceIndex, blocks);
		g = Arrays.copyOf(g, blocks);
		predecessor = Arrays.copyOf(predecessor, blocks);
		moveType = Arrays.copyOf(moveType, blocks);
		transition = Arrays.copyOf(transition, blocks);
		keys = Arrays.copyOf(keys, blocks);

		block++;
		markings[block] = new Marking[blockSize];
		traceIndex[block] = new int[blockSize];
		g[block] = new int[blockSize];
		predecessor[block] = new int[blockSize];
		moveType[block] = new byte[blockSize];
		transition[block] = new int[blockSize];
		keys[block] = new String[blockSize];
		indexInBlock = 0;
	}

	protected Alignment handleNodeReached(long startTime, int node, AlignmentStatus status) {
		List<AlignmentMove> moves = new ArrayList<>();
		int m = node;
		int n = getPredecessor(m);
		while (n != NOPREDECESSOR) {
			debug.writeEdgeTraversed(this, n, m, "color=red");
			MoveType type = getMoveType(m);
			int t = getTransition(m);
			String activity = getActivity(m);
			if (type == MoveType.SYNC) {
				moves.add(AlignmentMove.sync(activity, semantics.getTransition(t).getId()));
				smCost += costSM[t];
			} else if (type == MoveType.MODEL) {
				moves.add(AlignmentMove.model(activity, semantics.getTransition(t).getId()));
				mmCost += costMM[t];
			} else {
				moves.add(AlignmentMove.log(activity));
				lmCost += costLM.get(activity);
			}
			m = n;
			n = getPredecessor(n);
		}
		Collections.reverse(moves);
		alignmentLength = moves.size();
		alignmentCost = getGScore(node);

		runTime = (int) ((System.nanoTime() - startTime) / 1000);

		return new Alignment(moves, alignmentCost, status, getStatistics());
	}

	protected abstract boolean isFinal(int node);

	public TObjectIntMap<Statistic> getStatistics() {
		TObjectIntMap<Statistic> map = new TObjectIntHashMap<>(20);
		map.put(Statistic.POLLACTIONS, pollActions);
		map.put(Statistic.EXPANSIONS, expansions);
		map.put(Statistic.QUEUEACTIONS, queueActions);
		map.put(Statistic.EDGESTRAVERSED, edgesTraversed);
		map.put(Statistic.NODESREACHED, nodesReached);
		map.put(Statistic.ALIGNMENTLENGTH, alignmentLength);
		map.put(Statistic.COST, (alignmentResult & Utils.OPTIMALALIGNMENT) == 0
				&& (alignmentResult & Utils.STATELIMITREACHED) == 0 ? -1 : alignmentCost);
		map.put(Statistic.EXITCODE, alignmentResult);
		map.put(Statistic.RUNTIME, runTime);
		map.put(Statistic.SETUPTIME, setupTime);
		map.put(Statistic.TOTALTIME, setupTime + runTime);
		map.put(Statistic.MAXQUEUELENGTH, queue == null ? 0 : queue.maxSize());
		map.put(Statistic.MAXQUEUECAPACITY, queue == null ? 0 : queue.capacity());
		map.put(Statistic.TRACELENGTH, trace == null ? 0 : trace.size());
		map.put(Statistic.PLACES, semantics.numPlaces());
		map.put(Statistic.TRANSITIONS, semantics.numTransitions());
		map.put(Statistic.LMCOST, lmCost);
		map.put(Statistic.MMCOST, mmCost);
		map.put(Statistic.SMCOST, smCost);
		return map;
	}

	protected void writeEndOfAlignmentStats(Alignment alignment) {
		if (alignment != null) {
			debug.print(Debug.STATS, String.join(" ", trace));
			TObjectIntMap<Statistic> map = alignment.getStatistics();
			for (Statistic s : Statistic.values()) {
				debug.print(Debug.STATS, "," + map.get(s));
			}
			debug.println(Debug.STATS);
		}
	}

	protected void writeEndOfAlignmentNormal(Alignment alignment) {
		if (alignment != null) {
			debug.println(Debug.NORMAL, "Trace: " + trace);
			debug.println(Debug.NORMAL, Utils.toTable(alignment));
			TObjectIntMap<Statistic> map = alignment.getStatistics();
			for (Statistic s : Statistic.values()) {
				debug.println(Debug.NORMAL, s + ": " + map.get(s));
			}
		}
	}

	protected void writeEndOfAlignmentDot(Alignment alignment) {
		for (int n = 0; n < nodesReached; n++) {
			debug.writeNodeReached(this, n);
		}
		if (alignment != null) {
			TObjectIntMap<Statistic> map = alignment.getStatistics();

			StringBuilder b = new StringBuilder();
			b.append("info [shape=plaintext,label=<");
			for (Statistic s : Statistic.values()) {
				b.append(s);
				b.append(": ");
				b.append(map.get(s));
				b.append("<br/>");
			}
			b.append(">];");

			debug.println(Debug.DOT, b.toString());
		}
		debug.println(Debug.DOT, "}");
	}

	protected void terminateRun(Alignment alignment) {
		synchronized (Debug.getOutputStream()) {
			if (debug == Debug.DOT) {
				writeEndOfAlignmentDot(alignment);
			}
			if (debug == Debug.NORMAL) {
				writeEndOfAlignmentNormal(alignment);
			}
			if (debug == Debug.STATS) {
				writeEndOfAlignmentStats(alignment);
			}
		}
	}

	public PetrinetSemantics getSemantics() {
		return semantics;
	}

	public Marking getMarking(int node) {
		return markings[node >>> blockBit][node & blockMask];
	}

	public int getTraceIndex(int node) {
		return traceIndex[node >>> blockBit][node & blockMask];
	}

	public int getGScore(int node) {
		return g[node >>> blockBit][node & blockMask];
	}

	public int getPredecessor(int node) {
		return predecessor[node >>> blockBit][node & blockMask];
	}

	public int getTransition(int node) {
		return transition[node >>> blockBit][node & blockMask];
	}

	protected String getKey(int node) {
		return keys[node >>> blockBit][node & blockMask];
	}

	/**
	 * Returns the type of the move leading to the node, or null for the initial
	 * node.
	 *
	 * @param node
	 * @return
	 */
	public MoveType getMoveType(int node) {
		byte type = moveType[node >>> blockBit][node & blockMask];
		return type == NOMOVE ? null : MOVETYPES[type];
	}

	/**
	 * Returns the activity of the move leading to the node: the trace token for
	 * log moves, the label (or id) of the transition otherwise.
	 *
	 * @param node
	 * @return
	 */
	public String getActivity(int node) {
		MoveType type = getMoveType(node);
		if (type == null) {
			return "";
		} else if (type == MoveType.LOG) {
			return trace.get(getTraceIndex(getPredecessor(node)));
		} else {
			Transition t = semantics.getTransition(getTransition(node));
			return t.getActivity();
		}
	}

	public int getNumberOfNodes() {
		return nodesReached;
	}
}
