package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntConsumer;

import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * A mutable set of context ids. Iteration is in ascending id order, so the
 * first element is always the smallest id.
 */
public final class ContextIds implements Iterable<Integer> {
	private final MutableSparseIntSet ids;

	private ContextIds(MutableSparseIntSet ids) {
		this.ids = ids;
	}

	public static ContextIds empty() {
		return new ContextIds(MutableSparseIntSet.makeEmpty());
	}

	public static ContextIds of(int... ids) {
		var result = empty();
		for (int id : ids) {
			result.add(id);
		}
		return result;
	}

	public static ContextIds copyOf(ContextIds other) {
		var result = empty();
		result.ids.addAll(other.ids);
		return result;
	}

	public boolean add(int id) {
		return ids.add(id);
	}

	public boolean addAll(ContextIds other) {
		return ids.addAll(other.ids);
	}

	public boolean remove(int id) {
		return ids.remove(id);
	}

	/** Removes every id of {@code other} from this set. */
	public void removeAll(ContextIds other) {
		if (other == this) {
			ids.clear();
			return;
		}
		for (IntIterator it = other.ids.intIterator(); it.hasNext();) {
			ids.remove(it.next());
		}
	}

	public void retainAll(ContextIds other) {
		ids.intersectWith(other.ids);
	}

	public void clear() {
		ids.clear();
	}

	public boolean contains(int id) {
		return ids.contains(id);
	}

	public boolean containsAll(ContextIds other) {
		for (IntIterator it = other.ids.intIterator(); it.hasNext();) {
			if (!ids.contains(it.next())) {
				return false;
			}
		}
		return true;
	}

	public boolean containsAny(ContextIds other) {
		var smaller = size() <= other.size() ? this : other;
		var larger = smaller == this ? other : this;
		for (IntIterator it = smaller.ids.intIterator(); it.hasNext();) {
			if (larger.ids.contains(it.next())) {
				return true;
			}
		}
		return false;
	}

	public int size() {
		return ids.size();
	}

	public boolean isEmpty() {
		return ids.isEmpty();
	}

	/** Smallest id in the set. */
	public int first() {
		IntIterator it = ids.intIterator();
		if (!it.hasNext()) {
			throw new NoSuchElementException("Empty context id set");
		}
		return it.next();
	}

	public ContextIds intersection(ContextIds other) {
		var smaller = size() <= other.size() ? this : other;
		var larger = smaller == this ? other : this;
		var result = empty();
		for (IntIterator it = smaller.ids.intIterator(); it.hasNext();) {
			int id = it.next();
			if (larger.ids.contains(id)) {
				result.ids.add(id);
			}
		}
		return result;
	}

	public ContextIds difference(ContextIds other) {
		var result = empty();
		for (IntIterator it = ids.intIterator(); it.hasNext();) {
			int id = it.next();
			if (!other.ids.contains(id)) {
				result.ids.add(id);
			}
		}
		return result;
	}

	public ContextIds union(ContextIds other) {
		var result = copyOf(this);
		result.ids.addAll(other.ids);
		return result;
	}

	public void forEachId(IntConsumer action) {
		for (IntIterator it = ids.intIterator(); it.hasNext();) {
			action.accept(it.next());
		}
	}

	public List<Integer> toList() {
		var result = new ArrayList<Integer>(size());
		forEachId(result::add);
		return result;
	}

	@Override
	public Iterator<Integer> iterator() {
		IntIterator it = ids.intIterator();
		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				return it.hasNext();
			}

			@Override
			public Integer next() {
				if (!it.hasNext()) {
					throw new NoSuchElementException();
				}
				return it.next();
			}
		};
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof ContextIds)) return false;
		var other = (ContextIds) o;
		return size() == other.size() && containsAll(other);
	}

	@Override
	public int hashCode() {
		int hash = 0;
		for (IntIterator it = ids.intIterator(); it.hasNext();) {
			hash += it.next();
		}
		return hash;
	}

	@Override
	public String toString() {
		var str = new StringBuilder("{");
		var sep = "";
		for (IntIterator it = ids.intIterator(); it.hasNext();) {
			str.append(sep).append(it.next());
			sep = " ";
		}
		return str.append("}").toString();
	}
}
