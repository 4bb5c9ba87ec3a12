package nl.tue.conformance.algorithms.datastructures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Binary min-heap ordered by a comparator. The head of the heap is the least
 * element with respect to the comparator; use a reversed comparator for a
 * max-heap.
 * 
 * add and poll take O(log n), peek O(1). Building a heap from a collection
 * takes O(n).
 * 
 * The heap carries no knowledge of what it stores and is not thread safe.
 * 
 * @param <T>
 */
public class BinaryHeap<T> {

	private static final int DEFAULTCAPACITY = 16;

	private final Comparator<? super T> comparator;

	private Object[] heap;

	private int size;

	private int maxSize;

	public BinaryHeap(Comparator<? super T> comparator) {
		this(comparator, DEFAULTCAPACITY);
	}

	/**
	 * Creates a {@code BinaryHeap} with the specified initial capacity that
	 * orders its elements according to the specified comparator.
	 * 
	 * @param comparator
	 *            the comparator that will be used to order this heap.
	 * @param initialCapacity
	 *            the initial capacity for this heap
	 * 
	 * @throws IllegalArgumentException
	 *             if {@code initialCapacity} is less than 1
	 */
	public BinaryHeap(Comparator<? super T> comparator, int initialCapacity) {
		if (initialCapacity < 1) {
			throw new IllegalArgumentException("Initial capacity should be at least 1");
		}
		this.comparator = comparator;
		this.heap = new Object[initialCapacity];
	}

	/**
	 * Builds a heap containing all given elements in linear time.
	 * 
	 * @param comparator
	 * @param elements
	 */
	public BinaryHeap(Comparator<? super T> comparator, Collection<? extends T> elements) {
		this(comparator, Math.max(DEFAULTCAPACITY, elements.size()));
		for (T e : elements) {
			heap[size++] = e;
		}
		heapify();
		maxSize = size;
	}

	public static BinaryHeap<Integer> minHeap(Collection<Integer> numbers) {
		return new BinaryHeap<Integer>(new Comparator<Integer>() {
			public int compare(Integer a, Integer b) {
				return Integer.compare(a, b);
			}
		}, numbers);
	}

	public static BinaryHeap<Integer> maxHeap(Collection<Integer> numbers) {
		return new BinaryHeap<Integer>(new Comparator<Integer>() {
			public int compare(Integer a, Integer b) {
				return Integer.compare(b, a);
			}
		}, numbers);
	}

	/**
	 * Comparator for a min-heap on a numeric key of the elements.
	 */
	public static <T> Comparator<T> byKey(final Key<? super T> key) {
		return new Comparator<T>() {
			public int compare(T a, T b) {
				return Double.compare(key.of(a), key.of(b));
			}
		};
	}

	/**
	 * Comparator for a max-heap on a numeric key of the elements.
	 */
	public static <T> Comparator<T> byKeyDescending(final Key<? super T> key) {
		return new Comparator<T>() {
			public int compare(T a, T b) {
				return Double.compare(key.of(b), key.of(a));
			}
		};
	}

	public interface Key<T> {
		public double of(T element);
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	/**
	 * returns the maximum number of elements the heap ever contained.
	 * 
	 * @return
	 */
	public int maxSize() {
		return maxSize;
	}

	/**
	 * returns the current capacity of the backing array.
	 * 
	 * @return
	 */
	public int capacity() {
		return heap.length;
	}

	public void clear() {
		Arrays.fill(heap, 0, size, null);
		size = 0;
	}

	/**
	 * Returns the least element without removing it, or null if the heap is
	 * empty.
	 * 
	 * @return
	 */
	@SuppressWarnings("unchecked")
	public T peek() {
		return size == 0 ? null : (T) heap[0];
	}

	public void add(T element) {
		if (element == null) {
			throw new NullPointerException();
		}
		if (size == heap.length) {
			grow();
		}
		heap[size] = element;
		siftUp(size++);
		if (size > maxSize) {
			maxSize = size;
		}
	}

	/**
	 * Removes and returns the least element, or returns null if the heap is
	 * empty.
	 * 
	 * @return
	 */
	@SuppressWarnings("unchecked")
	public T poll() {
		if (size == 0) {
			return null;
		}
		T top = (T) heap[0];
		T last = (T) heap[--size];
		heap[size] = null;
		if (size > 0) {
			heap[0] = last;
			siftDown(0);
		}
		return top;
	}

	/**
	 * Replaces the least element by the given one and restores the heap order.
	 * On an empty heap, this is the same as {@link #add(Object)}.
	 * 
	 * @param element
	 * @return the element that was replaced, or null if the heap was empty
	 */
	@SuppressWarnings("unchecked")
	public T replaceTop(T element) {
		if (size == 0) {
			add(element);
			return null;
		}
		if (element == null) {
			throw new NullPointerException();
		}
		T top = (T) heap[0];
		heap[0] = element;
		siftDown(0);
		return top;
	}

	/**
	 * Returns a copy of the elements in heap order (not sorted).
	 * 
	 * @return
	 */
	@SuppressWarnings("unchecked")
	public List<T> toList() {
		List<T> list = new ArrayList<>(size);
		for (int i = 0; i < size; i++) {
			list.add((T) heap[i]);
		}
		return list;
	}

	private void grow() {
		int oldCapacity = heap.length;
		// Double size if small; else grow by 50%
		int newCapacity = oldCapacity + ((oldCapacity < 64) ? (oldCapacity + 2) : (oldCapacity >> 1));
		if (newCapacity < 0) {
			// overflow
			newCapacity = Integer.MAX_VALUE - 8;
		}
		heap = Arrays.copyOf(heap, newCapacity);
	}

	private void heapify() {
		for (int i = (size >>> 1) - 1; i >= 0; i--) {
			siftDown(i);
		}
	}

	@SuppressWarnings("unchecked")
	private void siftUp(int index) {
		T value = (T) heap[index];
		while (index > 0) {
			int parent = (index - 1) >>> 1;
			T p = (T) heap[parent];
			if (comparator.compare(value, p) >= 0) {
				break;
			}
			heap[index] = p;
			index = parent;
		}
		heap[index] = value;
	}

	@SuppressWarnings("unchecked")
	private void siftDown(int index) {
		T value = (T) heap[index];
		int half = size >>> 1;
		while (index < half) {
			int child = (index << 1) + 1;
			T c = (T) heap[child];
			int right = child + 1;
			if (right < size && comparator.compare((T) heap[right], c) < 0) {
				child = right;
				c = (T) heap[child];
			}
			if (comparator.compare(c, value) >= 0) {
				break;
			}
			heap[index] = c;
			index = child;
		}
		heap[index] = value;
	}

	@Override
	public String toString() {
		return toList().toString();
	}
}
