package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.List;

/**
 * Node of the callsite context graph. Either an allocation call, or an
 * interior call appearing in the profiled contexts of some allocation.
 */
public final class ContextNode<F, C> {
	private final int id;
	private final boolean allocation;
	private final boolean callerEdgesCarryContext;
	private F function;

	// Set when the call was dropped because of recursion.
	private boolean recursive = false;

	private int allocTypes = AllocationType.NONE.bit();

	private CallInfo<C> call;

	// Other calls in the same function with the same (possibly pruned) stack
	// ids. They are updated the same way as the primary call.
	private final List<CallInfo<C>> matchingCalls = new ArrayList<>();

	// Allocation nodes: a unique id. Stack nodes built from MIBs: the stack id.
	// Not assigned for clones.
	private long origStackOrAllocId = 0;

	private final List<ContextEdge<F, C>> calleeEdges = new ArrayList<>();
	private final List<ContextEdge<F, C>> callerEdges = new ArrayList<>();

	private final List<ContextNode<F, C>> clones = new ArrayList<>();
	private ContextNode<F, C> cloneOf = null;

	ContextNode(int id, boolean allocation, F function, CallInfo<C> call, boolean cloneRecursiveContexts) {
		this.id = id;
		this.allocation = allocation;
		this.function = function;
		this.call = call;
		this.callerEdgesCarryContext = allocation || cloneRecursiveContexts;
	}

	public int id() {
		return id;
	}

	public boolean isAllocation() {
		return allocation;
	}

	/** The enclosing function of the node's call, or null if not known. */
	public F function() {
		return function;
	}

	void setFunction(F function) {
		this.function = function;
	}

	public boolean isRecursive() {
		return recursive;
	}

	void setRecursive(boolean recursive) {
		this.recursive = recursive;
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

	public CallInfo<C> call() {
		return call;
	}

	void setCall(CallInfo<C> call) {
		this.call = call;
	}

	public boolean hasCall() {
		return call != null;
	}

	public List<CallInfo<C>> matchingCalls() {
		return matchingCalls;
	}

	public long origStackOrAllocId() {
		return origStackOrAllocId;
	}

	void setOrigStackOrAllocId(long origStackOrAllocId) {
		this.origStackOrAllocId = origStackOrAllocId;
	}

	public List<ContextEdge<F, C>> calleeEdges() {
		return calleeEdges;
	}

	public List<ContextEdge<F, C>> callerEdges() {
		return callerEdges;
	}

	public List<ContextNode<F, C>> clones() {
		return clones;
	}

	public ContextNode<F, C> cloneOf() {
		return cloneOf;
	}

	public boolean isClone() {
		return cloneOf != null;
	}

	public ContextNode<F, C> origNode() {
		return cloneOf == null ? this : cloneOf;
	}

	/** Records {@code clone} under the root of this node's clone tree. */
	void addClone(ContextNode<F, C> clone) {
		if (cloneOf != null) {
			cloneOf.clones.add(clone);
			clone.cloneOf = cloneOf;
		} else {
			assert clone.cloneOf == null;
			clones.add(clone);
			clone.cloneOf = this;
		}
	}

	/**
	 * Whether caller edges must be consulted for this node's ids. True for
	 * allocations, and while cloning through recursive cycles, where ids may
	 * have left a callee edge but not yet the incoming backedge.
	 */
	boolean useCallerEdgesForContextInfo() {
		return callerEdgesCarryContext;
	}

	private List<ContextEdge<F, C>> contextEdges() {
		if (!useCallerEdgesForContextInfo()) {
			return calleeEdges;
		}
		var edges = new ArrayList<ContextEdge<F, C>>(calleeEdges.size() + callerEdges.size());
		edges.addAll(calleeEdges);
		edges.addAll(callerEdges);
		return edges;
	}

	/** Union of the ids on this node's edges. */
	public ContextIds getContextIds() {
		var result = ContextIds.empty();
		for (var edge : contextEdges()) {
			result.addAll(edge.contextIds());
		}
		return result;
	}

	public int computeAllocType() {
		int allocType = AllocationType.NONE.bit();
		for (var edge : contextEdges()) {
			allocType |= edge.allocTypes();
			if (allocType == AllocationType.BOTH) {
				return allocType;
			}
		}
		return allocType;
	}

	public boolean emptyContextIds() {
		for (var edge : contextEdges()) {
			if (!edge.contextIds().isEmpty()) {
				return false;
			}
		}
		return true;
	}

	/** A node is effectively removed once no context reaches it. */
	public boolean isRemoved() {
		return allocTypes == AllocationType.NONE.bit();
	}

	void addOrUpdateCallerEdge(ContextNode<F, C> caller, AllocationType allocType, int contextId) {
		for (var edge : callerEdges) {
			if (edge.caller() == caller) {
				edge.addAllocTypes(allocType.bit());
				edge.contextIds().add(contextId);
				return;
			}
		}
		var edge = new ContextEdge<>(this, caller, allocType.bit(), ContextIds.of(contextId));
		callerEdges.add(edge);
		caller.calleeEdges.add(edge);
	}

	public ContextEdge<F, C> findEdgeFromCallee(ContextNode<F, C> callee) {
		for (var edge : calleeEdges) {
			if (edge.callee() == callee) {
				return edge;
			}
		}
		return null;
	}

	public ContextEdge<F, C> findEdgeFromCaller(ContextNode<F, C> caller) {
		for (var edge : callerEdges) {
			if (edge.caller() == caller) {
				return edge;
			}
		}
		return null;
	}

	void eraseCalleeEdge(ContextEdge<F, C> edge) {
		if (!removeByIdentity(calleeEdges, edge)) {
			throw new IllegalStateException("Callee edge not found on node " + id);
		}
	}

	void eraseCallerEdge(ContextEdge<F, C> edge) {
		if (!removeByIdentity(callerEdges, edge)) {
			throw new IllegalStateException("Caller edge not found on node " + id);
		}
	}

	private static <T> boolean removeByIdentity(List<T> list, T elem) {
		for (var it = list.iterator(); it.hasNext();) {
			if (it.next() == elem) {
				it.remove();
				return true;
			}
		}
		return false;
	}

	@Override
	public String toString() {
		var str = new StringBuilder();
		str.append("Node ").append(id).append("\n\t");
		str.append(call == null ? "null Call" : call.toString());
		if (!matchingCalls.isEmpty()) {
			str.append("\n\tMatchingCalls:");
			for (var matching : matchingCalls) {
				str.append("\n\t").append(matching);
			}
		}
		str.append("\n\tNodeId: ").append(id);
		str.append("\n\tAllocTypes: ").append(AllocationType.toString(allocTypes));
		str.append("\n\tContextIds: ").append(getContextIds());
		str.append("\n\tCalleeEdges:");
		for (var edge : calleeEdges) {
			str.append("\n\t\t").append(edge);
		}
		str.append("\n\tCallerEdges:");
		for (var edge : callerEdges) {
			str.append("\n\t\t").append(edge);
		}
		if (!clones.isEmpty()) {
			str.append("\n\tClones: ");
			var sep = "";
			for (var clone : clones) {
				str.append(sep).append(clone.id);
				sep = ", ";
			}
		} else if (cloneOf != null) {
			str.append("\n\tClone of ").append(cloneOf.id);
		}
		return str.toString();
	}
}
