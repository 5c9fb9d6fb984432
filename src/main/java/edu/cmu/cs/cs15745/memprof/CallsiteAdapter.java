package edu.cmu.cs.cs15745.memprof;

import java.util.List;

/**
 * Everything the disambiguation engine needs from the representation it runs
 * on. {@code F} is the function type and {@code C} the call type; calls are
 * compared by identity.
 */
public interface CallsiteAdapter<F, C> {

	/** The canonical stack id for an id (or an index into a stack id table). */
	long getStackId(long idOrIndex);

	/** The statically known callee of {@code call}, or null if it has none. */
	F getCalleeFunc(C call);

	/**
	 * Whether {@code call} reaches {@code func}, either directly or through a
	 * unique chain of tail calls no deeper than the configured limit. In the
	 * latter case the chain is appended to {@code foundCalleeChain}, ordered
	 * from callee to caller.
	 */
	boolean calleeMatchesFunc(C call, F func, F callerFunc, List<TailCallFrame<F, C>> foundCalleeChain);

	/** Whether both calls have the same (known) callee. */
	boolean sameCallee(C call1, C call2);

	/**
	 * Clone {@code func} for callsite clone number {@code cloneNo}, mapping each
	 * of {@code callsInFunc} to its counterpart in the clone.
	 */
	FunctionClone<F, C> cloneFunctionForCallsite(
			FuncInfo<F> func, CallInfo<C> call, List<CallInfo<C>> callsInFunc, int cloneNo);

	/** Record the allocation type hint of an allocation call clone. */
	void updateAllocationCall(CallInfo<C> call, AllocationType allocType);

	AllocationType getAllocationCallType(CallInfo<C> call);

	/** Make the call clone {@code callerCall} target function clone {@code calleeFunc}. */
	void updateCall(CallInfo<C> callerCall, FuncInfo<F> calleeFunc);

	/** Label for dot export. */
	String getLabel(F func, C call, int cloneNo);

	/** Called once the allocation node of {@code call} is complete. */
	default void onAllocationNodeBuilt(C call, int allocTypes) { }
}
