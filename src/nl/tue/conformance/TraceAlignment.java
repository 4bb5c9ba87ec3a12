package nl.tue.conformance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The alignment of one distinct trace of a log, together with the indices of
 * all cases sharing that trace and a number of derived measures.
 */
public class TraceAlignment {

	public static final String RAWFITNESSCOST = "Raw Fitness Cost";
	public static final String TRACEFITNESS = "Trace Fitness";
	public static final String MOVELOGFITNESS = "Move-Log Fitness";
	public static final String MOVEMODELFITNESS = "Move-Model Fitness";
	public static final String QUEUEDSTATE = "Num. States Queued";
	public static final String NUMSTATEGENERATED = "Num. States Generated";
	public static final String ORIGTRACELENGTH = "Trace Length";
	public static final String TIME = "Calculation Time (ms)";

	private final Alignment alignment;
	private final SortedSet<Integer> traceIndices = new TreeSet<>();
	private final Map<String, Double> info = new LinkedHashMap<>();

	public TraceAlignment(Alignment alignment, int traceIndex) {
		this.alignment = alignment;
		this.traceIndices.add(traceIndex);
	}

	public Alignment getAlignment() {
		return alignment;
	}

	public boolean isReliable() {
		return alignment.isReliable();
	}

	/**
	 * Returns the indices of the cases with this trace, in ascending order.
	 * 
	 * @return
	 */
	public SortedSet<Integer> getTraceIndices() {
		return Collections.unmodifiableSortedSet(traceIndices);
	}

	synchronized void addNewCase(int traceIndex) {
		traceIndices.add(traceIndex);
	}

	void addInfo(String key, double value) {
		info.put(key, value);
	}

	public Map<String, Double> getInfo() {
		return Collections.unmodifiableMap(info);
	}

	public double getInfo(String key) {
		Double value = info.get(key);
		return value == null ? Double.NaN : value;
	}

	@Override
	public String toString() {
		return traceIndices + " " + alignment;
	}
}
