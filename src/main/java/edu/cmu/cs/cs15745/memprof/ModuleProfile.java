package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the graph is built from: the profiled calls of every function in
 * the module.
 */
public final class ModuleProfile<F, C> {
	private final List<FunctionProfile<F, C>> functions = new ArrayList<>();

	public ModuleProfile<F, C> add(FunctionProfile<F, C> function) {
		functions.add(function);
		return this;
	}

	public ModuleProfile<F, C> add(F function, List<? extends ProfiledCall<C>> calls) {
		return add(new FunctionProfile<>(function, calls));
	}

	public List<FunctionProfile<F, C>> functions() {
		return functions;
	}
}
