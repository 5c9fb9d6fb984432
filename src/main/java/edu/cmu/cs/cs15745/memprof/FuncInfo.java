package edu.cmu.cs.cs15745.memprof;

import java.util.Objects;

/** A function clone: the original function and a clone number (0 is the original). */
public final class FuncInfo<F> {
	private final F func;
	private final int cloneNo;

	private FuncInfo(F func, int cloneNo) {
		this.func = Objects.requireNonNull(func);
		this.cloneNo = cloneNo;
	}

	public static <F> FuncInfo<F> of(F func, int cloneNo) {
		return new FuncInfo<>(func, cloneNo);
	}

	public F func() {
		return func;
	}

	public int cloneNo() {
		return cloneNo;
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(func) + cloneNo;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof FuncInfo<?>)) return false;
		var other = (FuncInfo<?>) o;
		return func == other.func && cloneNo == other.cloneNo;
	}

	@Override
	public String toString() {
		return String.format("%s (clone %d)", func, cloneNo);
	}
}
