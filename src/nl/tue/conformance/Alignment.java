package nl.tue.conformance;

import java.util.Collections;
import java.util.List;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.conformance.Utils.Statistic;

/**
 * The result of aligning one trace with a net: the sequence of moves, its
 * total cost and the status of the search that produced it.
 * 
 * Only alignments with status {@link AlignmentStatus#OPTIMAL} are proven to be
 * of minimal cost. Callers must check {@link #isReliable()} before treating
 * the cost as the distance between trace and model.
 */
public class Alignment {

	private final List<AlignmentMove> moves;
	private final double cost;
	private final AlignmentStatus status;
	private final TObjectIntMap<Statistic> statistics;

	public Alignment(List<AlignmentMove> moves, double cost, AlignmentStatus status,
			TObjectIntMap<Statistic> statistics) {
		this.moves = Collections.unmodifiableList(moves);
		this.cost = cost;
		this.status = status;
		this.statistics = statistics == null ? new TObjectIntHashMap<Statistic>() : statistics;
	}

	public List<AlignmentMove> getMoves() {
		return moves;
	}

	public int size() {
		return moves.size();
	}

	/**
	 * Returns the total cost, or {@link Double#POSITIVE_INFINITY} if the search
	 * was exhausted.
	 * 
	 * @return
	 */
	public double getCost() {
		return cost;
	}

	public AlignmentStatus getStatus() {
		return status;
	}

	public boolean isReliable() {
		return status == AlignmentStatus.OPTIMAL;
	}

	public TObjectIntMap<Statistic> getStatistics() {
		return statistics;
	}

	public int count(MoveType type) {
		int n = 0;
		for (AlignmentMove move : moves) {
			if (move.getMoveType() == type) {
				n++;
			}
		}
		return n;
	}

	/**
	 * Fitness in [0,1], computed as 1 - cost / length, clamped. An empty
	 * alignment has fitness 1 if its cost is 0 and 0 otherwise.
	 * 
	 * @return
	 */
	public double getFitness() {
		return fitness(moves.size(), cost);
	}

	public static double fitness(int length, double cost) {
		if (length == 0) {
			return cost == 0 ? 1.0 : 0.0;
		}
		double fitness = 1.0 - cost / length;
		return Math.max(0.0, Math.min(1.0, fitness));
	}

	@Override
	public String toString() {
		return status + " cost=" + cost + " " + moves;
	}
}
