package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The callsite context graph: one node per allocation call and per profiled
 * interior callsite, connected by edges carrying the ids of the profiled
 * contexts flowing through them.
 *
 * The graph owns all nodes. Edges are shared between their endpoints; removing
 * an edge clears it, so references retained while iterating over a copy of an
 * edge list can tell that it is gone.
 *
 * The pipeline stages in this package ({@link GraphBuilder},
 * {@link StackNodeReconciler}, {@link MultiTargetResolver},
 * {@link BackedgeMarker}, {@link CloneIdentifier}, {@link CloneMerger},
 * {@link FunctionAssigner}) mutate the graph through the package-private
 * primitives below.
 */
public final class CallsiteContextGraph<F, C> {
	private static final Logger logger = LogManager.getLogger(CallsiteContextGraph.class);

	private final CallsiteAdapter<F, C> adapter;
	private final DisambiguationOptions options;
	private final Statistics stats;
	private final GraphChecker checker;

	// Owner of every node ever created; a node's id is its position.
	private final List<ContextNode<F, C>> nodes = new ArrayList<>();

	private final Map<Integer, AllocationType> contextIdToAllocationType = new HashMap<>();
	private final Map<Integer, List<ContextSizeInfo>> contextIdToContextSizeInfos = new HashMap<>();
	private final Map<Long, ContextNode<F, C>> stackEntryIdToContextNode = new HashMap<>();
	private final Map<CallInfo<C>, ContextNode<F, C>> allocationCallToContextNode = new LinkedHashMap<>();
	private final Map<CallInfo<C>, ContextNode<F, C>> nonAllocationCallToContextNode = new LinkedHashMap<>();
	private final Map<F, List<CallInfo<C>>> funcToCallsWithMetadata = new LinkedHashMap<>();

	// Stack ids (or stack id indices) recorded on each interior callsite.
	private final Map<C, List<Long>> callsiteStackIds = new IdentityHashMap<>();

	private int lastContextId = 0;

	// Context ids of the allocation selected for dot export.
	private final ContextIds dotAllocContextIds = ContextIds.empty();

	public CallsiteContextGraph(CallsiteAdapter<F, C> adapter, DisambiguationOptions options, Statistics stats) {
		this.adapter = Objects.requireNonNull(adapter);
		this.options = Objects.requireNonNull(options);
		this.stats = Objects.requireNonNull(stats);
		this.checker = new GraphChecker(options);
	}

	public CallsiteAdapter<F, C> adapter() {
		return adapter;
	}

	public DisambiguationOptions options() {
		return options;
	}

	public Statistics stats() {
		return stats;
	}

	GraphChecker checker() {
		return checker;
	}

	// Includes removed nodes.
	public List<ContextNode<F, C>> nodes() {
		return nodes;
	}

	public Collection<ContextNode<F, C>> allocationNodes() {
		return allocationCallToContextNode.values();
	}

	Map<CallInfo<C>, ContextNode<F, C>> allocationCallToContextNode() {
		return allocationCallToContextNode;
	}

	Map<CallInfo<C>, ContextNode<F, C>> nonAllocationCallToContextNode() {
		return nonAllocationCallToContextNode;
	}

	Map<F, List<CallInfo<C>>> funcToCallsWithMetadata() {
		return funcToCallsWithMetadata;
	}

	void addCallWithMetadata(F func, CallInfo<C> call) {
		funcToCallsWithMetadata.computeIfAbsent(func, unused -> new ArrayList<>()).add(call);
	}

	void recordCallsiteStackIds(C call, List<Long> stackIds) {
		if (callsiteStackIds.putIfAbsent(call, stackIds) != null) {
			throw new IllegalStateException("Callsite recorded twice: " + call);
		}
	}

	/** Stack ids (or indices) recorded on {@code call}, outermost last. */
	List<Long> callsiteStackIds(C call) {
		return callsiteStackIds.getOrDefault(call, List.of());
	}

	public int lastContextId() {
		return lastContextId;
	}

	int nextContextId() {
		return ++lastContextId;
	}

	public AllocationType allocationType(int contextId) {
		return Objects.requireNonNull(contextIdToAllocationType.get(contextId), () -> "Unknown context id " + contextId);
	}

	void setAllocationType(int contextId, AllocationType allocType) {
		contextIdToAllocationType.put(contextId, allocType);
	}

	Map<Integer, List<ContextSizeInfo>> contextIdToContextSizeInfos() {
		return contextIdToContextSizeInfos;
	}

	ContextIds dotAllocContextIds() {
		return dotAllocContextIds;
	}

	ContextNode<F, C> createNewNode(boolean isAllocation, F func, CallInfo<C> call) {
		var node = new ContextNode<F, C>(nodes.size(), isAllocation, func, call, options.cloneRecursiveContexts());
		nodes.add(node);
		return node;
	}

	ContextNode<F, C> addAllocNode(CallInfo<C> call, F func) {
		if (getNodeForAlloc(call) != null) {
			throw new IllegalStateException("Allocation registered twice: " + call);
		}
		var allocNode = createNewNode(true, func, call);
		allocationCallToContextNode.put(call, allocNode);
		// The context id counter doubles as a unique allocation id.
		allocNode.setOrigStackOrAllocId(lastContextId);
		allocNode.setAllocTypes(AllocationType.NONE.bit());
		return allocNode;
	}

	ContextNode<F, C> getOrCreateStackNode(long stackId) {
		var stackNode = getNodeForStackId(stackId);
		if (stackNode == null) {
			stackNode = createNewNode(false, null, null);
			stackEntryIdToContextNode.put(stackId, stackNode);
			stackNode.setOrigStackOrAllocId(stackId);
		}
		return stackNode;
	}

	public ContextNode<F, C> getNodeForInst(CallInfo<C> call) {
		var node = getNodeForAlloc(call);
		if (node != null) {
			return node;
		}
		return nonAllocationCallToContextNode.get(call);
	}

	public ContextNode<F, C> getNodeForAlloc(CallInfo<C> call) {
		return allocationCallToContextNode.get(call);
	}

	public ContextNode<F, C> getNodeForStackId(long stackId) {
		return stackEntryIdToContextNode.get(stackId);
	}

	/** Calls that already have a node, either as primary or as matching call. */
	Set<CallInfo<C>> placedCalls() {
		var result = new HashSet<CallInfo<C>>(allocationCallToContextNode.keySet());
		for (var entry : nonAllocationCallToContextNode.entrySet()) {
			result.add(entry.getKey());
			result.addAll(entry.getValue().matchingCalls());
		}
		return result;
	}

	int computeAllocType(ContextIds contextIds) {
		int allocType = AllocationType.NONE.bit();
		for (int id : contextIds) {
			allocType |= allocationType(id).bit();
			if (allocType == AllocationType.BOTH) {
				return allocType;
			}
		}
		return allocType;
	}

	int intersectAllocTypes(ContextIds ids1, ContextIds ids2) {
		var smaller = ids1.size() < ids2.size() ? ids1 : ids2;
		var larger = smaller == ids1 ? ids2 : ids1;
		int allocType = AllocationType.NONE.bit();
		for (int id : smaller) {
			if (!larger.contains(id)) {
				continue;
			}
			allocType |= allocationType(id).bit();
			if (allocType == AllocationType.BOTH) {
				return allocType;
			}
		}
		return allocType;
	}

	/** New edge from {@code caller} to {@code callee}, linked into both nodes. */
	ContextEdge<F, C> addEdge(ContextNode<F, C> callee, ContextNode<F, C> caller, int allocTypes, ContextIds contextIds) {
		var edge = new ContextEdge<>(callee, caller, allocTypes, contextIds);
		callee.callerEdges().add(edge);
		caller.calleeEdges().add(edge);
		return edge;
	}

	void removeEdgeFromGraph(ContextEdge<F, C> edge) {
		if (edge.isRemoved()) {
			throw new IllegalStateException("Edge already removed");
		}
		var callee = edge.callee();
		var caller = edge.caller();
		edge.clear();
		callee.eraseCallerEdge(edge);
		caller.eraseCalleeEdge(edge);
	}

	void removeNoneTypeCalleeEdges(ContextNode<F, C> node) {
		for (var edge : new ArrayList<>(node.calleeEdges())) {
			if (edge.allocTypes() == AllocationType.NONE.bit()) {
				assert edge.contextIds().isEmpty();
				removeEdgeFromGraph(edge);
			}
		}
	}

	void removeNoneTypeCallerEdges(ContextNode<F, C> node) {
		for (var it = node.callerEdges().iterator(); it.hasNext();) {
			var edge = it.next();
			if (edge.allocTypes() == AllocationType.NONE.bit()) {
				assert edge.contextIds().isEmpty();
				edge.caller().eraseCalleeEdge(edge);
				it.remove();
			}
		}
	}

	void recursivelyRemoveNoneTypeCalleeEdges(ContextNode<F, C> node, Set<ContextNode<F, C>> visited) {
		if (!visited.add(node)) {
			return;
		}
		removeNoneTypeCalleeEdges(node);
		for (var clone : new ArrayList<>(node.clones())) {
			recursivelyRemoveNoneTypeCalleeEdges(clone, visited);
		}
		// The recursion may remove some of node's caller edges.
		for (var edge : new ArrayList<>(node.callerEdges())) {
			if (edge.isRemoved()) {
				continue;
			}
			recursivelyRemoveNoneTypeCalleeEdges(edge.caller(), visited);
		}
	}

	/**
	 * Moves {@code edge}, or just {@code contextIdsToMove} of its ids when not
	 * empty, onto a new clone of its callee. Returns the clone.
	 */
	ContextNode<F, C> moveEdgeToNewCalleeClone(ContextEdge<F, C> edge, ContextIds contextIdsToMove) {
		var node = edge.callee();
		var clone = createNewNode(node.isAllocation(), node.function(), node.call());
		node.addClone(clone);
		clone.matchingCalls().addAll(node.matchingCalls());
		stats.increment(Statistic.NODE_CLONES);
		logger.trace("Cloning node {} into {} for caller {}", node.id(), clone.id(), edge.caller().id());
		moveEdgeToExistingCalleeClone(edge, clone, true, contextIdsToMove);
		return clone;
	}

	ContextNode<F, C> moveEdgeToNewCalleeClone(ContextEdge<F, C> edge) {
		return moveEdgeToNewCalleeClone(edge, ContextIds.empty());
	}

	void moveEdgeToExistingCalleeClone(ContextEdge<F, C> edge, ContextNode<F, C> newCallee, boolean newClone) {
		moveEdgeToExistingCalleeClone(edge, newCallee, newClone, ContextIds.empty());
	}

	/**
	 * Moves {@code edge}, or just {@code contextIdsToMove} of its ids when not
	 * empty, onto {@code newCallee}, a clone of the edge's callee. The ids are
	 * moved along the callee's own callee edges as well.
	 */
	void moveEdgeToExistingCalleeClone(ContextEdge<F, C> edge, ContextNode<F, C> newCallee, boolean newClone,
			ContextIds contextIdsToMove) {
		if (newCallee.origNode() != edge.callee().origNode()) {
			throw new IllegalArgumentException("Node " + newCallee.id() + " is not a clone of " + edge.callee().id());
		}
		boolean edgeIsRecursive = edge.callee() == edge.caller();
		var oldCallee = edge.callee();

		// Reuse an edge to the new callee left over from cloning for another allocation.
		var existingEdgeToNewCallee = newCallee.findEdgeFromCaller(edge.caller());

		var idsToMove = contextIdsToMove.isEmpty() ? ContextIds.copyOf(edge.contextIds()) : contextIdsToMove;

		if (edge.contextIds().size() == idsToMove.size()) {
			newCallee.addAllocTypes(edge.allocTypes());
			if (existingEdgeToNewCallee != null) {
				existingEdgeToNewCallee.contextIds().addAll(idsToMove);
				existingEdgeToNewCallee.addAllocTypes(edge.allocTypes());
				removeEdgeFromGraph(edge);
			} else {
				edge.setCallee(newCallee);
				newCallee.callerEdges().add(edge);
				oldCallee.eraseCallerEdge(edge);
			}
		} else {
			int callerEdgeAllocType = computeAllocType(idsToMove);
			if (existingEdgeToNewCallee != null) {
				existingEdgeToNewCallee.contextIds().addAll(idsToMove);
				existingEdgeToNewCallee.addAllocTypes(callerEdgeAllocType);
			} else {
				addEdge(newCallee, edge.caller(), callerEdgeAllocType, ContextIds.copyOf(idsToMove));
			}
			newCallee.addAllocTypes(callerEdgeAllocType);
			edge.contextIds().removeAll(idsToMove);
			edge.setAllocTypes(computeAllocType(edge.contextIds()));
		}

		for (var oldCalleeEdge : new ArrayList<>(oldCallee.calleeEdges())) {
			var calleeToUse = oldCalleeEdge.callee();
			// Direct recursion stays direct recursion on the clone.
			if (calleeToUse == oldCallee) {
				if (edgeIsRecursive) {
					continue;
				}
				calleeToUse = newCallee;
			}
			var edgeContextIdsToMove = oldCalleeEdge.contextIds().intersection(idsToMove);
			oldCalleeEdge.contextIds().removeAll(edgeContextIdsToMove);
			oldCalleeEdge.setAllocTypes(computeAllocType(oldCalleeEdge.contextIds()));
			if (!newClone) {
				// A reused clone may have lost this edge to none type edge removal.
				var newCalleeEdge = newCallee.findEdgeFromCallee(calleeToUse);
				if (newCalleeEdge != null) {
					newCalleeEdge.contextIds().addAll(edgeContextIdsToMove);
					newCalleeEdge.addAllocTypes(computeAllocType(edgeContextIdsToMove));
					continue;
				}
			}
			addEdge(calleeToUse, newCallee, computeAllocType(edgeContextIdsToMove), edgeContextIdsToMove);
		}
		oldCallee.setAllocTypes(oldCallee.computeAllocType());
		assert (oldCallee.allocTypes() == AllocationType.NONE.bit()) == oldCallee.emptyContextIds();
		if (options.verifyCCG()) {
			checker.checkNode(oldCallee, false);
			checker.checkNode(newCallee, false);
			for (var e : oldCallee.calleeEdges()) {
				checker.checkNode(e.callee(), false);
			}
			for (var e : newCallee.calleeEdges()) {
				checker.checkNode(e.callee(), false);
			}
		}
	}

	/**
	 * Moves callee edge {@code edge} from its caller to {@code newCaller}, and
	 * the ids it carries from the old caller's caller edges to the new caller's.
	 */
	void moveCalleeEdgeToNewCaller(ContextEdge<F, C> edge, ContextNode<F, C> newCaller) {
		var oldCallee = edge.callee();
		var newCallee = oldCallee;
		boolean recursive = edge.caller() == edge.callee();
		if (recursive) {
			newCallee = newCaller;
		}

		var oldCaller = edge.caller();
		oldCaller.eraseCalleeEdge(edge);

		var existingEdgeToNewCaller = newCaller.findEdgeFromCallee(newCallee);
		if (existingEdgeToNewCaller != null) {
			existingEdgeToNewCaller.contextIds().addAll(edge.contextIds());
			existingEdgeToNewCaller.addAllocTypes(edge.allocTypes());
			edge.contextIds().clear();
			edge.setAllocTypes(AllocationType.NONE.bit());
			oldCallee.eraseCallerEdge(edge);
		} else {
			edge.setCaller(newCaller);
			newCaller.calleeEdges().add(edge);
			if (recursive) {
				edge.setCallee(newCallee);
				newCallee.callerEdges().add(edge);
				oldCallee.eraseCallerEdge(edge);
			}
		}
		newCaller.addAllocTypes(edge.allocTypes());

		// Ids of a moved direct recursive edge also leave the old caller through
		// a non-recursive edge; they are moved when that one is.
		if (!recursive) {
			for (var oldCallerEdge : new ArrayList<>(oldCaller.callerEdges())) {
				var oldCallerCaller = oldCallerEdge.caller();
				if (oldCallerCaller == oldCaller) {
					continue;
				}
				var edgeContextIdsToMove = oldCallerEdge.contextIds().intersection(edge.contextIds());
				oldCallerEdge.contextIds().removeAll(edgeContextIdsToMove);
				oldCallerEdge.setAllocTypes(computeAllocType(oldCallerEdge.contextIds()));
				var existingCallerEdge = newCaller.findEdgeFromCaller(oldCallerCaller);
				if (existingCallerEdge != null) {
					existingCallerEdge.contextIds().addAll(edgeContextIdsToMove);
					existingCallerEdge.addAllocTypes(computeAllocType(edgeContextIdsToMove));
					continue;
				}
				addEdge(newCaller, oldCallerCaller, computeAllocType(edgeContextIdsToMove), edgeContextIdsToMove);
			}
		}
		oldCaller.setAllocTypes(oldCaller.computeAllocType());
		assert (oldCaller.allocTypes() == AllocationType.NONE.bit()) == oldCaller.emptyContextIds();
		if (options.verifyCCG()) {
			checker.checkNode(oldCaller, false);
			checker.checkNode(newCaller, false);
			for (var e : oldCaller.callerEdges()) {
				checker.checkNode(e.caller(), false);
			}
			for (var e : newCaller.callerEdges()) {
				checker.checkNode(e.caller(), false);
			}
		}
	}

	String label(ContextNode<F, C> node) {
		return adapter.getLabel(node.function(), node.call().call(), node.call().cloneNo());
	}

	void dump(String when) {
		if (options.dumpCCG()) {
			logger.info("CCG {}:\n{}", when, this);
		}
	}

	void verify() {
		if (options.verifyCCG()) {
			checker.check(this);
		}
	}

	/**
	 * One line per recorded context size of each live allocation node, saying
	 * what the context was profiled as and what the allocation ended up as.
	 */
	public List<String> totalSizes() {
		var result = new ArrayList<String>();
		for (var node : nodes) {
			if (node.isRemoved() || !node.isAllocation()) {
				continue;
			}
			var allocTypeFromCall = adapter.getAllocationCallType(node.call());
			for (int id : node.getContextIds()) {
				var sizes = contextIdToContextSizeInfos.get(id);
				if (sizes == null) {
					continue;
				}
				for (var info : sizes) {
					var line = new StringBuilder();
					line.append("MemProf hinting: ").append(allocationType(id))
							.append(" full allocation context ").append(Long.toUnsignedString(info.fullStackId()))
							.append(" with total size ").append(Long.toUnsignedString(info.totalSize()))
							.append(" is ").append(AllocationType.toString(node.allocTypes())).append(" after cloning");
					if (AllocationType.allocTypeToUse(node.allocTypes()) != allocTypeFromCall) {
						line.append(" marked ").append(allocTypeFromCall).append(" due to cold byte percent");
					}
					line.append(" (context id ").append(id).append(")");
					result.add(line.toString());
				}
			}
		}
		return result;
	}

	@Override
	public String toString() {
		var str = new StringBuilder("Callsite Context Graph:\n");
		for (var node : nodes) {
			if (node.isRemoved()) {
				continue;
			}
			str.append(node).append("\n\n");
		}
		return str.toString();
	}
}
