package nl.tue.conformance.model;

/**
 * A place of a Petri net. A place carries an identifier, an optional label and
 * the number of tokens it holds in the initial marking of the net.
 * 
 * Places are immutable. Use {@link #withTokens(int)} to obtain a copy with a
 * different token count.
 */
public class Place {

	private final String id;
	private final String label;
	private final int tokens;

	public Place(String id) {
		this(id, null, 0);
	}

	public Place(String id, String label) {
		this(id, label, 0);
	}

	public Place(String id, String label, int tokens) {
		this.id = id;
		this.label = label;
		this.tokens = tokens;
	}

	public String getId() {
		return id;
	}

	/**
	 * Returns the label, or null if the place has no label.
	 * 
	 * @return
	 */
	public String getLabel() {
		return label;
	}

	public boolean hasLabel() {
		return label != null;
	}

	public int getTokens() {
		return tokens;
	}

	public Place withTokens(int tokens) {
		return new Place(id, label, tokens);
	}

	@Override
	public int hashCode() {
		int result = id == null ? 0 : id.hashCode();
		result = 31 * result + (label == null ? 0 : label.hashCode());
		return 31 * result + tokens;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Place)) {
			return false;
		}
		Place other = (Place) obj;
		return tokens == other.tokens && equal(id, other.id) && equal(label, other.label);
	}

	static boolean equal(Object a, Object b) {
		return a == null ? b == null : a.equals(b);
	}

	@Override
	public String toString() {
		StringBuilder b = new StringBuilder();
		b.append(id);
		if (label != null) {
			b.append("(").append(label).append(")");
		}
		if (tokens > 0) {
			b.append(" x").append(tokens);
		}
		return b.toString();
	}
}
