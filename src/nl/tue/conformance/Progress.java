package nl.tue.conformance;

/**
 * Progress of replaying a collection of traces: the maximum is set to the
 * number of traces to align and inc is called once per finished trace.
 */
public interface Progress extends Canceller {

	public final static Progress INVISIBLE = new Progress() {

		public void setMaximum(int maximum) {
		}

		public void inc() {
		}

		public boolean isCancelled() {
			return false;
		}

		public void log(String message) {
			System.out.println(message);
		}

	};

	public void setMaximum(int maximum);

	public void inc();

	public void log(String message);
}
