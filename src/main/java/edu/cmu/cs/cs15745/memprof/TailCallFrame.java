package edu.cmu.cs.cs15745.memprof;

import java.util.Objects;

/** A tail call found between a profiled caller and callee, with the function containing it. */
public final class TailCallFrame<F, C> {
	private final C call;
	private final F function;

	public TailCallFrame(C call, F function) {
		this.call = Objects.requireNonNull(call);
		this.function = Objects.requireNonNull(function);
	}

	public C call() {
		return call;
	}

	public F function() {
		return function;
	}

	@Override
	public String toString() {
		return String.format("%s in %s", call, function);
	}
}
