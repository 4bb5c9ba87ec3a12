package nl.tue.conformance;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

import gnu.trove.map.TObjectIntMap;
import nl.tue.conformance.Utils.Statistic;
import nl.tue.conformance.algorithms.ReplayAlgorithm;

class TraceReplayTask implements Callable<TraceReplayTask> {

	enum TraceReplayResult {
		DUPLICATE, SUCCESS
	};

	private final Replayer replayer;
	private final List<String> trace;
	private final int traceIndex;
	private TraceAlignment traceAlignment;
	private int original;
	private TraceReplayResult result;
	private final ReplayerParameters parameters;

	/**
	 * Task aligning the empty trace
	 */
	public TraceReplayTask(Replayer replayer, ReplayerParameters parameters) {
		this(replayer, parameters, Collections.<String>emptyList(), -1);
	}

	public TraceReplayTask(Replayer replayer, ReplayerParameters parameters, List<String> trace, int traceIndex) {
		this.replayer = replayer;
		this.parameters = parameters;
		this.trace = trace;
		this.traceIndex = traceIndex;
	}

	public TraceReplayTask call() {
		if (traceIndex < 0) {
			original = -1;
		} else {
			synchronized (replayer.trace2FirstIdenticalTrace) {
				original = replayer.trace2FirstIdenticalTrace.get(trace);
				if (original < 0) {
					replayer.trace2FirstIdenticalTrace.put(trace, traceIndex);
				}
			}
		}
		if (original < 0) {
			ReplayAlgorithm algorithm = replayer.getAlgorithm();
			Alignment alignment = algorithm.run(trace, parameters.maxExpansions);
			traceAlignment = toTraceAlignment(alignment);
			result = TraceReplayResult.SUCCESS;
		} else {
			result = TraceReplayResult.DUPLICATE;
		}
		replayer.getProgress().inc();
		return this;
	}

	public TraceReplayResult getResult() {
		return result;
	}

	public TraceAlignment getSuccesfulResult() {
		return traceAlignment;
	}

	public int getOriginalTraceIndex() {
		return original;
	}

	public int getTraceIndex() {
		return traceIndex;
	}

	public int getTraceLogMoveCost() {
		return replayer.getTraceCost(trace);
	}

	private TraceAlignment toTraceAlignment(Alignment alignment) {
		int mm = 0, lm = 0, smm = 0, slm = 0;
		for (AlignmentMove move : alignment.getMoves()) {
			if (move.getMoveType() == MoveType.LOG) {
				lm += replayer.getCostLM(move.getActivity());
			} else if (move.getMoveType() == MoveType.MODEL) {
				mm += replayer.getCostMM(move.getTransitionId());
			} else {
				smm += replayer.getCostMM(move.getTransitionId());
				slm += replayer.getCostLM(move.getActivity());
			}
		}
		TObjectIntMap<Statistic> statistics = alignment.getStatistics();

		TraceAlignment ta = new TraceAlignment(alignment, traceIndex);
		ta.addInfo(TraceAlignment.RAWFITNESSCOST, alignment.getCost());
		ta.addInfo(TraceAlignment.TIME, statistics.get(Statistic.TOTALTIME) / 1000.0);
		ta.addInfo(TraceAlignment.QUEUEDSTATE, 1.0 * statistics.get(Statistic.QUEUEACTIONS));
		if (lm + slm == 0) {
			ta.addInfo(TraceAlignment.MOVELOGFITNESS, 1.0);
		} else {
			ta.addInfo(TraceAlignment.MOVELOGFITNESS, 1.0 - (1.0 * lm) / (lm + slm));
		}
		if (mm + smm == 0) {
			ta.addInfo(TraceAlignment.MOVEMODELFITNESS, 1.0);
		} else {
			ta.addInfo(TraceAlignment.MOVEMODELFITNESS, 1.0 - (1.0 * mm) / (mm + smm));
		}
		ta.addInfo(TraceAlignment.NUMSTATEGENERATED, 1.0 * statistics.get(Statistic.NODESREACHED));
		ta.addInfo(TraceAlignment.ORIGTRACELENGTH, 1.0 * trace.size());
		return ta;
	}
}
