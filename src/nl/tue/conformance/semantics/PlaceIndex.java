package nl.tue.conformance.semantics;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import nl.tue.conformance.model.Place;

/**
 * Fixed numbering of the places of a net, shared by all markings of that net.
 * Places are numbered in declaration order; {@link #sorted} lists the numbers
 * in lexicographic order of the place ids.
 */
final class PlaceIndex {

	final String[] ids;
	final int[] sorted;
	private final TObjectIntMap<String> id2index;

	PlaceIndex(List<Place> places) {
		ids = new String[places.size()];
		id2index = new TObjectIntHashMap<>(places.size() * 2, 0.5f, -1);
		for (int p = 0; p < ids.length; p++) {
			ids[p] = places.get(p).getId();
			if (id2index.containsKey(ids[p])) {
				throw new IllegalArgumentException("Duplicate place id: " + ids[p]);
			}
			id2index.put(ids[p], p);
		}
		Integer[] order = new Integer[ids.length];
		for (int p = 0; p < ids.length; p++) {
			order[p] = p;
		}
		Arrays.sort(order, new Comparator<Integer>() {
			public int compare(Integer p1, Integer p2) {
				return ids[p1].compareTo(ids[p2]);
			}
		});
		sorted = new int[ids.length];
		for (int i = 0; i < ids.length; i++) {
			sorted[i] = order[i];
		}
	}

	/**
	 * returns the number of the place, or -1 if the id is not a place.
	 */
	int indexOf(String placeId) {
		return id2index.get(placeId);
	}

	int size() {
		return ids.length;
	}
}
