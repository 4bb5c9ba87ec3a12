package nl.tue.conformance.model;

/**
 * A directed arc between two nodes of a net. The direction is inferred from
 * the endpoints: an arc from a place to a transition is an input arc of that
 * transition, an arc from a transition to a place is an output arc. Arcs
 * between two nodes of the same kind are kept in the model but never take part
 * in firing.
 */
public class Arc {

	public static final int DEFAULTWEIGHT = 1;

	private final String from;
	private final String to;
	private final int weight;
	private final ArcType type;

	public Arc(String from, String to) {
		this(from, to, DEFAULTWEIGHT, ArcType.STANDARD);
	}

	public Arc(String from, String to, int weight) {
		this(from, to, weight, ArcType.STANDARD);
	}

	public Arc(String from, String to, int weight, ArcType type) {
		this.from = from;
		this.to = to;
		this.weight = weight;
		this.type = type == null ? ArcType.STANDARD : type;
	}

	public String getFrom() {
		return from;
	}

	public String getTo() {
		return to;
	}

	public int getWeight() {
		return weight;
	}

	public ArcType getType() {
		return type;
	}

	public boolean isInhibitor() {
		return type == ArcType.INHIBITOR;
	}

	@Override
	public int hashCode() {
		int result = from == null ? 0 : from.hashCode();
		result = 31 * result + (to == null ? 0 : to.hashCode());
		result = 31 * result + weight;
		return 31 * result + type.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Arc)) {
			return false;
		}
		Arc other = (Arc) obj;
		return weight == other.weight && type == other.type && Place.equal(from, other.from)
				&& Place.equal(to, other.to);
	}

	@Override
	public String toString() {
		return from + (isInhibitor() ? " -o " : " -> ") + to + (weight != DEFAULTWEIGHT ? " [" + weight + "]" : "");
	}
}
