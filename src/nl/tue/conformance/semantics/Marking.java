package nl.tue.conformance.semantics;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A marking assigns a non-negative number of tokens to every place of a net.
 * 
 * Markings are values: they are never modified after construction. Firing a
 * transition always produces a new marking, so markings can be shared freely
 * between search branches and threads.
 */
public final class Marking {

	private final PlaceIndex places;
	private final int[] tokens;
	private int hash;

	Marking(PlaceIndex places, int[] tokens) {
		this.places = places;
		this.tokens = tokens;
	}

	/**
	 * Returns the number of tokens in the given place, 0 for unknown places.
	 * 
	 * @param placeId
	 * @return
	 */
	public int get(String placeId) {
		int p = places.indexOf(placeId);
		return p < 0 ? 0 : tokens[p];
	}

	int get(int place) {
		return tokens[place];
	}

	/**
	 * Returns a copy of the token counts
	 * 
	 * @return
	 */
	int[] toArray() {
		return Arrays.copyOf(tokens, tokens.length);
	}

	PlaceIndex getPlaceIndex() {
		return places;
	}

	public int numPlaces() {
		return tokens.length;
	}

	public int totalTokens() {
		int sum = 0;
		for (int n : tokens) {
			sum += n;
		}
		return sum;
	}

	/**
	 * Returns the marking as a map from place id to tokens, in place
	 * declaration order, including empty places.
	 * 
	 * @return
	 */
	public Map<String, Integer> asMap() {
		Map<String, Integer> map = new LinkedHashMap<>();
		for (int p = 0; p < tokens.length; p++) {
			map.put(places.ids[p], tokens[p]);
		}
		return map;
	}

	/**
	 * Builds the deterministic key of the search state (this marking, trace
	 * position). The key lists the trace position followed by all (place,
	 * tokens) pairs sorted by place id, separated by '|'.
	 * 
	 * @param traceIndex
	 * @return
	 */
	public String key(int traceIndex) {
		StringBuilder b = new StringBuilder(8 + 8 * tokens.length);
		b.append(traceIndex);
		for (int p : places.sorted) {
			b.append('|');
			b.append(places.ids[p]);
			b.append('|');
			b.append(tokens[p]);
		}
		return b.toString();
	}

	@Override
	public int hashCode() {
		int h = hash;
		if (h == 0) {
			h = 31 * Arrays.hashCode(places.ids) + Arrays.hashCode(tokens);
			hash = h;
		}
		return h;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Marking)) {
			return false;
		}
		Marking other = (Marking) obj;
		return Arrays.equals(tokens, other.tokens)
				&& (places == other.places || Arrays.equals(places.ids, other.places.ids));
	}

	/**
	 * Writes the marking as a bag, e.g. [P0,2P3], leaving out empty places.
	 */
	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		buf.append('[');
		for (int p = 0; p < tokens.length; p++) {
			if (tokens[p] > 0) {
				if (buf.length() > 1) {
					buf.append(',');
				}
				if (tokens[p] > 1) {
					buf.append(tokens[p]);
				}
				buf.append(places.ids[p]);
			}
		}
		buf.append(']');
		return buf.toString();
	}
}
