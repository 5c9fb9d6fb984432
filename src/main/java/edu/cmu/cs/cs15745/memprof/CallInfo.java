package edu.cmu.cs.cs15745.memprof;

import java.util.Objects;

/**
 * A callsite clone: a profiled call together with the clone number of the
 * function copy it lives in. Clone 0 is the original call.
 */
public final class CallInfo<C> {
	private final C call;
	private final int cloneNo;

	private CallInfo(C call, int cloneNo) {
		this.call = Objects.requireNonNull(call);
		if (cloneNo < 0) {
			throw new IllegalArgumentException("Negative clone number " + cloneNo);
		}
		this.cloneNo = cloneNo;
	}

	public static <C> CallInfo<C> of(C call) {
		return new CallInfo<>(call, 0);
	}

	public static <C> CallInfo<C> of(C call, int cloneNo) {
		return new CallInfo<>(call, cloneNo);
	}

	public C call() {
		return call;
	}

	public int cloneNo() {
		return cloneNo;
	}

	public CallInfo<C> withCloneNo(int newCloneNo) {
		return new CallInfo<>(call, newCloneNo);
	}

	@Override
	public int hashCode() {
		return 31 * System.identityHashCode(call) + cloneNo;
	}

	// Calls are compared by identity.
	@Override
	public boolean equals(Object o) {
		if (!(o instanceof CallInfo<?>)) return false;
		var other = (CallInfo<?>) o;
		return call == other.call && cloneNo == other.cloneNo;
	}

	@Override
	public String toString() {
		return String.format("%s\t(clone %d)", call, cloneNo);
	}
}
