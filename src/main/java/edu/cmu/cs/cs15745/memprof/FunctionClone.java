package edu.cmu.cs.cs15745.memprof;

import java.util.Map;
import java.util.Objects;

/**
 * A function clone together with the counterpart, in the clone, of each
 * profiled call of the original function.
 */
public final class FunctionClone<F, C> {
	private final FuncInfo<F> func;
	private final Map<CallInfo<C>, CallInfo<C>> callMap;

	public FunctionClone(FuncInfo<F> func, Map<CallInfo<C>, CallInfo<C>> callMap) {
		this.func = Objects.requireNonNull(func);
		this.callMap = Objects.requireNonNull(callMap);
	}

	public FuncInfo<F> func() {
		return func;
	}

	public Map<CallInfo<C>, CallInfo<C>> callMap() {
		return callMap;
	}

	public CallInfo<C> map(CallInfo<C> call) {
		return callMap.getOrDefault(call, call);
	}
}
