package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A function and its profiled calls, in program order. */
public final class FunctionProfile<F, C> {
	private final F function;
	private final List<ProfiledCall<C>> calls;

	public FunctionProfile(F function, List<? extends ProfiledCall<C>> calls) {
		this.function = Objects.requireNonNull(function);
		this.calls = new ArrayList<>(calls);
	}

	public F function() {
		return function;
	}

	public List<ProfiledCall<C>> calls() {
		return calls;
	}
}
