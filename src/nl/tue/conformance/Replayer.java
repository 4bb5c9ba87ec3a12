package nl.tue.conformance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.conformance.TraceReplayTask.TraceReplayResult;
import nl.tue.conformance.Utils.Statistic;
import nl.tue.conformance.algorithms.Dijkstra;
import nl.tue.conformance.algorithms.PrefixDijkstra;
import nl.tue.conformance.algorithms.ReplayAlgorithm;
import nl.tue.conformance.algorithms.ReplayAlgorithm.Debug;
import nl.tue.conformance.model.PetriNet;
import nl.tue.conformance.semantics.PetrinetSemantics;

/**
 * Aligns traces with a net. Traces are lists of activities, each activity
 * referring to transitions by id or by label.
 * 
 * A replayer holds no state of individual alignments, every trace gets its
 * own algorithm instance. Hence {@link #align(List)} may be called from
 * several threads at once.
 */
public class Replayer {

	final TObjectIntMap<List<String>> trace2FirstIdenticalTrace;

	private final ReplayerParameters parameters;
	private final PetrinetSemantics semantics;
	private final int[] costMM;
	private final int[] costSM;
	private final TObjectIntMap<String> costLM;
	private Progress progress;

	public Replayer(PetriNet net) {
		this(new ReplayerParameters.Default(), net, null, null, null);
	}

	public Replayer(ReplayerParameters parameters, PetriNet net) {
		this(parameters, net, null, null, null);
	}

	/**
	 * 
	 * @param parameters
	 * @param net
	 * @param costMM
	 *            model move cost per transition id, may be null
	 * @param costLM
	 *            log move cost per activity, may be null
	 * @param costSM
	 *            synchronous move cost per transition id, may be null
	 * @throws IllegalArgumentException
	 *             if a cost is negative
	 */
	public Replayer(ReplayerParameters parameters, PetriNet net, Map<String, Integer> costMM,
			Map<String, Integer> costLM, Map<String, Integer> costSM) {
		this.parameters = parameters;
		this.semantics = new PetrinetSemantics(net);
		this.costMM = Utils.getModelMoveCosts(semantics, costMM);
		this.costSM = Utils.getSyncMoveCosts(semantics, costSM);
		this.costLM = Utils.getLogMoveCosts(costLM);

		trace2FirstIdenticalTrace = new TObjectIntHashMap<>(10, 0.7f, -1);
	}

	/**
	 * Aligns a single trace on the calling thread.
	 * 
	 * @param trace
	 * @return
	 */
	public Alignment align(List<String> trace) {
		return getAlgorithm().run(trace, parameters.maxExpansions);
	}

	/**
	 * Aligns all traces of the log. Identical traces are aligned once; the
	 * resulting {@link TraceAlignment} lists the indices of all cases sharing
	 * the trace.
	 * 
	 * @param progress
	 *            is incremented once per trace and checked for cancellation
	 *            between traces
	 * @param log
	 * @return
	 * @throws InterruptedException
	 * @throws ExecutionException
	 */
	public ReplayResult computeReplayResult(Progress progress, List<List<String>> log)
			throws InterruptedException, ExecutionException {
		this.progress = progress;
		synchronized (trace2FirstIdenticalTrace) {
			trace2FirstIdenticalTrace.clear();
		}

		if (parameters.debug == Debug.STATS) {
			parameters.debug.print(Debug.STATS, "Trace");
			for (Statistic s : Statistic.values()) {
				parameters.debug.print(Debug.STATS, ",");
				parameters.debug.print(Debug.STATS, s.toString());
			}
			parameters.debug.println(Debug.STATS);
		}

		ExecutorService service = Executors.newFixedThreadPool(parameters.nThreads);
		getProgress().setMaximum(log.size() + 1);

		List<Future<TraceReplayTask>> resultList = new ArrayList<>();
		try {
			resultList.add(service.submit(new TraceReplayTask(this, parameters)));

			int t = 0;
			for (List<String> trace : log) {
				if (isCancelled()) {
					break;
				}
				List<String> copy = Collections.unmodifiableList(new ArrayList<>(trace));
				resultList.add(service.submit(new TraceReplayTask(this, parameters, copy, t)));
				t++;
			}
		} finally {
			service.shutdown();
		}
		return mergeResults(resultList);
	}

	public ReplayResult mergeResults(List<Future<TraceReplayTask>> resultList)
			throws InterruptedException, ExecutionException {

		Iterator<Future<TraceReplayTask>> itResult = resultList.iterator();
		TraceReplayTask tr;

		// get the alignment of the empty trace
		int maxModelMoveCost;
		TraceReplayTask traceReplay = itResult.next().get();
		Alignment empty = traceReplay.getSuccesfulResult().getAlignment();
		if (empty.getStatus() == AlignmentStatus.EXHAUSTED) {
			maxModelMoveCost = 0;
			getProgress().log("No accepting marking reachable, maximal model move cost set to 0");
		} else {
			maxModelMoveCost = (int) empty.getCost();
		}

		TIntObjectMap<TraceAlignment> result = new TIntObjectHashMap<>(10, 0.5f, -1);
		List<TraceReplayTask> duplicates = new ArrayList<>();
		while (itResult.hasNext()) {
			tr = itResult.next().get();
			if (tr.getResult() == TraceReplayResult.SUCCESS) {
				TraceAlignment ta = tr.getSuccesfulResult();
				double cost = ta.getInfo(TraceAlignment.RAWFITNESSCOST);
				ta.addInfo(TraceAlignment.TRACEFITNESS,
						traceFitness(cost, maxModelMoveCost + tr.getTraceLogMoveCost()));
				if (!ta.isReliable()) {
					getProgress().log("Alignment of trace " + tr.getTraceIndex() + " is "
							+ ta.getAlignment().getStatus().toString().toLowerCase());
				}
				result.put(tr.getTraceIndex(), ta);
			} else {
				duplicates.add(tr);
			}
		}
		for (TraceReplayTask duplicate : duplicates) {
			result.get(duplicate.getOriginalTraceIndex()).addNewCase(duplicate.getTraceIndex());
		}

		List<TraceAlignment> alignments = new ArrayList<>(result.size());
		for (int t : result.keys()) {
			alignments.add(result.get(t));
		}
		Collections.sort(alignments, new Comparator<TraceAlignment>() {
			public int compare(TraceAlignment o1, TraceAlignment o2) {
				return o1.getTraceIndices().first().compareTo(o2.getTraceIndices().first());
			}
		});
		return new ReplayResult(alignments, maxModelMoveCost);
	}

	static double traceFitness(double cost, int worstCost) {
		if (worstCost == 0) {
			return cost == 0 ? 1.0 : 0.0;
		}
		return Math.max(0.0, 1 - cost / worstCost);
	}

	ReplayAlgorithm getAlgorithm() {
		switch (parameters.algorithm) {
			case PREFIX :
				return new PrefixDijkstra(semantics, costMM, costSM, costLM, parameters.debug);
			case DIJKSTRA :
			default :
				return new Dijkstra(semantics, costMM, costSM, costLM, parameters.debug);
		}
	}

	private boolean isCancelled() {
		return getProgress().isCancelled();
	}

	int getTraceCost(List<String> trace) {
		int cost = 0;
		for (String activity : trace) {
			cost += costLM.get(activity);
		}
		return cost;
	}

	int getCostLM(String activity) {
		return costLM.get(activity);
	}

	int getCostMM(String transitionId) {
		int t = semantics.indexOf(transitionId);
		return t < 0 ? 1 : costMM[t];
	}

	public PetrinetSemantics getSemantics() {
		return semantics;
	}

	public ReplayerParameters getParameters() {
		return parameters;
	}

	public Progress getProgress() {
		return progress == null ? Progress.INVISIBLE : progress;
	}

}
