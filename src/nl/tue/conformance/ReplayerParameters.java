package nl.tue.conformance;

import nl.tue.conformance.algorithms.ReplayAlgorithm.Debug;

public abstract class ReplayerParameters {

	public static enum Algorithm {
		DIJKSTRA, PREFIX;
	}

	public final Algorithm algorithm; // which algorithm
	public final int maxExpansions; // limit for the number of expansions, <= 0 is unbounded
	public final int nThreads; // do multithreading
	public final Debug debug; // debug level

	private ReplayerParameters(Algorithm algorithm, int maxExpansions, int nThreads, Debug debug) {
		if (nThreads < 1) {
			throw new IllegalArgumentException("At least one thread is needed, got " + nThreads);
		}
		this.algorithm = algorithm;
		this.maxExpansions = maxExpansions;
		this.nThreads = nThreads;
		this.debug = debug;
	}

	public final static class Default extends ReplayerParameters {
		public Default() {
			super(Algorithm.DIJKSTRA, Utils.DEFAULTMAXEXPANSIONS,
					Math.max(1, Runtime.getRuntime().availableProcessors() / 2), Debug.NONE);
		}

		public Default(int nThreads, Debug debug) {
			super(Algorithm.DIJKSTRA, Utils.DEFAULTMAXEXPANSIONS, nThreads, debug);
		}
	}

	public final static class Dijkstra extends ReplayerParameters {
		public Dijkstra() {
			super(Algorithm.DIJKSTRA, Utils.DEFAULTMAXEXPANSIONS, 1, Debug.NONE);
		}

		public Dijkstra(Debug debug) {
			super(Algorithm.DIJKSTRA, Utils.DEFAULTMAXEXPANSIONS, 1, debug);
		}

		public Dijkstra(int maxExpansions, int nThreads, Debug debug) {
			super(Algorithm.DIJKSTRA, maxExpansions, nThreads, debug);
		}
	}

	public final static class Prefix extends ReplayerParameters {
		public Prefix() {
			super(Algorithm.PREFIX, Utils.DEFAULTMAXEXPANSIONS, 1, Debug.NONE);
		}

		public Prefix(int maxExpansions, int nThreads, Debug debug) {
			super(Algorithm.PREFIX, maxExpansions, nThreads, debug);
		}
	}

	@Override
	public String toString() {
		return algorithm + "(maxExpansions=" + maxExpansions + ", nThreads=" + nThreads + ", debug=" + debug + ")";
	}
}
