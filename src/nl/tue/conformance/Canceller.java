package nl.tue.conformance;

/**
 * Polled by a {@link Replayer} before it hands the next trace to a worker.
 * Once this returns true, no further traces are submitted; alignments that are
 * already running finish normally and keep their results.
 */
public interface Canceller {

	public boolean isCancelled();

}
