package edu.cmu.cs.cs15745.memprof;

import java.util.Objects;

/**
 * Caller to callee edge of the context graph, decorated with the ids of the
 * contexts flowing along it. Removing an edge clears it, so stale references
 * held while iterating over a copy of an edge list can detect that it is gone.
 */
public final class ContextEdge<F, C> {
	private ContextNode<F, C> callee;
	private ContextNode<F, C> caller;
	private int allocTypes;
	// Set before cloning when recursive contexts are cloned; not kept up to date afterwards.
	private boolean backedge = false;
	private final ContextIds contextIds;

	ContextEdge(ContextNode<F, C> callee, ContextNode<F, C> caller, int allocTypes, ContextIds contextIds) {
		this.callee = Objects.requireNonNull(callee);
		this.caller = Objects.requireNonNull(caller);
		this.allocTypes = allocTypes;
		this.contextIds = Objects.requireNonNull(contextIds);
	}

	public ContextNode<F, C> callee() {
		return callee;
	}

	public ContextNode<F, C> caller() {
		return caller;
	}

	void setCallee(ContextNode<F, C> callee) {
		this.callee = callee;
	}

	void setCaller(ContextNode<F, C> caller) {
		this.caller = caller;
	}

	public int allocTypes() {
		return allocTypes;
	}

	void setAllocTypes(int allocTypes) {
		this.allocTypes = allocTypes;
	}

	void addAllocTypes(int types) {
		this.allocTypes |= types;
	}

	public boolean isBackedge() {
		return backedge;
	}

	void setBackedge(boolean backedge) {
		this.backedge = backedge;
	}

	/** The live id set of this edge; mutations are visible to the graph. */
	public ContextIds contextIds() {
		return contextIds;
	}

	void clear() {
		contextIds.clear();
		allocTypes = AllocationType.NONE.bit();
		caller = null;
		callee = null;
	}

	public boolean isRemoved() {
		if (callee != null || caller != null) {
			return false;
		}
		assert allocTypes == AllocationType.NONE.bit();
		assert contextIds.isEmpty();
		return true;
	}

	@Override
	public String toString() {
		return String.format("Edge from Callee %s to Caller: %s AllocTypes: %s ContextIds: %s%s",
				callee == null ? "null" : callee.id(),
				caller == null ? "null" : caller.id(),
				AllocationType.toString(allocTypes),
				contextIds,
				backedge ? " (BE)" : "");
	}
}
