package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Places the profiled interior callsites onto the graph. A callsite whose
 * stack ids map to a single stack node takes that node over; a callsite whose
 * ids span several stack nodes (because of inlining after profiling) gets a
 * new node spliced in between the innermost and outermost of them, carrying
 * the contexts common to the whole chain.
 *
 * Callsites that already have a node are skipped, so running this again over
 * a reconciled graph changes nothing.
 */
final class StackNodeReconciler<F, C> {
	private static final Logger logger = LogManager.getLogger(StackNodeReconciler.class);

	private final CallsiteContextGraph<F, C> graph;
	private boolean alreadyRun = false;

	// Calls grouped by the outermost of their stack ids that has a node.
	private final Map<Long, List<CallContextInfo<F, C>>> stackIdToMatchingCalls = new LinkedHashMap<>();

	// Calls sharing the stack ids and function of an earlier call, to that call.
	private final Map<CallInfo<C>, CallInfo<C>> callToMatchingCall = new HashMap<>();

	// Duplicated context ids, to all of their duplicates.
	private final Map<Integer, ContextIds> oldToNewContextIds = new HashMap<>();

	private static final class CallContextInfo<F, C> {
		final CallInfo<C> call;
		final List<Long> stackIds;
		final F func;
		ContextIds savedContextIds = ContextIds.empty();

		CallContextInfo(CallInfo<C> call, List<Long> stackIds, F func) {
			this.call = call;
			this.stackIds = stackIds;
			this.func = func;
		}
	}

	StackNodeReconciler(CallsiteContextGraph<F, C> graph) {
		this.graph = Objects.requireNonNull(graph);
	}

	void run() {
		if (alreadyRun) {
			throw new IllegalStateException("Already run.");
		}
		alreadyRun = true;
		collectCalls();
		for (var entry : stackIdToMatchingCalls.entrySet()) {
			computeSavedContextIds(entry.getKey(), entry.getValue());
		}
		if (!oldToNewContextIds.isEmpty()) {
			propagateDuplicateContextIds();
		}
		graph.verify();

		var visited = new HashSet<ContextNode<F, C>>();
		for (var allocNode : new ArrayList<>(graph.allocationNodes())) {
			assignStackNodesPostOrder(allocNode, visited);
		}
		logger.debug("Placed {} callsites", graph.nonAllocationCallToContextNode().size());
		graph.verify();
	}

	private void collectCalls() {
		var placed = graph.placedCalls();
		for (var entry : graph.funcToCallsWithMetadata().entrySet()) {
			for (var call : entry.getValue()) {
				if (graph.getNodeForAlloc(call) != null || placed.contains(call)) {
					continue;
				}
				var stackIds = stackIdsWithContextNodes(graph.callsiteStackIds(call.call()));
				if (stackIds.isEmpty()) {
					continue;
				}
				stackIdToMatchingCalls.computeIfAbsent(stackIds.get(stackIds.size() - 1), unused -> new ArrayList<>())
						.add(new CallContextInfo<>(call, stackIds, entry.getKey()));
			}
		}
	}

	/** The longest prefix of the resolved stack ids that all have nodes. */
	private List<Long> stackIdsWithContextNodes(List<Long> idsOrIndices) {
		var result = new ArrayList<Long>();
		for (long idOrIndex : idsOrIndices) {
			long stackId = graph.adapter().getStackId(idOrIndex);
			if (graph.getNodeForStackId(stackId) == null) {
				break;
			}
			result.add(stackId);
		}
		return result;
	}

	private long lastStackId(CallInfo<C> call) {
		var ids = graph.callsiteStackIds(call.call());
		return graph.adapter().getStackId(ids.get(ids.size() - 1));
	}

	private static int compareStackIds(List<Long> a, List<Long> b) {
		for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
			int cmp = Long.compareUnsigned(a.get(i), b.get(i));
			if (cmp != 0) {
				return cmp;
			}
		}
		return Integer.compare(a.size(), b.size());
	}

	/**
	 * Computes the context ids each call of one group will carry, before any
	 * node is created, so that calls sharing the same outermost node do not
	 * claim the same contexts.
	 */
	private void computeSavedContextIds(long lastId, List<CallContextInfo<F, C>> calls) {
		// A lone call with a single stack id simply takes over the stack node.
		if (calls.size() == 1 && calls.get(0).stackIds.size() == 1) {
			return;
		}

		var funcToIndex = new HashMap<F, Integer>();
		for (var info : calls) {
			funcToIndex.putIfAbsent(info.func, funcToIndex.size());
		}
		// Longest sequences first, so that a call with a shorter sequence only
		// gets the contexts not already claimed by a longer one. Identical
		// sequences end up adjacent, grouped by function.
		Collections.sort(calls, Comparator.<CallContextInfo<F, C>>comparingInt(info -> -info.stackIds.size())
				.thenComparing((a, b) -> compareStackIds(a.stackIds, b.stackIds))
				.thenComparingInt(info -> funcToIndex.get(info.func)));

		var lastNode = graph.getNodeForStackId(lastId);
		if (lastNode.isRecursive()) {
			return;
		}
		var lastNodeContextIds = lastNode.getContextIds();

		for (int i = 0; i < calls.size(); i++) {
			var info = calls.get(i);
			var stackSequenceContextIds = ContextIds.copyOf(lastNodeContextIds);
			if (!intersectAlongChain(lastNode, info.stackIds, stackSequenceContextIds, true)) {
				continue;
			}

			// If the call's full sequence extends past the last node, contexts
			// that continue into one of that node's callers belong to a longer
			// sequence and not to this call.
			if (info.stackIds.get(info.stackIds.size() - 1) != lastStackId(info.call)) {
				for (var callerEdge : lastNode.callerEdges()) {
					stackSequenceContextIds.removeAll(callerEdge.contextIds());
					if (stackSequenceContextIds.isEmpty()) {
						break;
					}
				}
				if (stackSequenceContextIds.isEmpty()) {
					continue;
				}
			}

			// Calls with the same sequence in the same function share the node.
			// The same sequence in a different function needs its own ids.
			boolean duplicateContextIds = false;
			for (int j = i + 1; j < calls.size(); j++) {
				var next = calls.get(j);
				if (!next.stackIds.equals(info.stackIds)) {
					break;
				}
				if (next.func != info.func) {
					duplicateContextIds = true;
					break;
				}
				callToMatchingCall.put(next.call, info.call);
				i = j;
			}

			info.savedContextIds = duplicateContextIds
					? duplicateContextIds(stackSequenceContextIds)
					: stackSequenceContextIds;

			if (!duplicateContextIds) {
				lastNodeContextIds.removeAll(stackSequenceContextIds);
				if (lastNodeContextIds.isEmpty()) {
					break;
				}
			}
		}
	}

	/**
	 * Intersects {@code contextIds} with the edges along {@code stackIds}, from
	 * {@code lastNode} inwards. Returns false if the chain is broken or no
	 * context is left.
	 */
	private boolean intersectAlongChain(ContextNode<F, C> lastNode, List<Long> stackIds, ContextIds contextIds,
			boolean checkRecursive) {
		var prevNode = lastNode;
		for (int k = stackIds.size() - 2; k >= 0; k--) {
			var curNode = graph.getNodeForStackId(stackIds.get(k));
			if (checkRecursive && curNode.isRecursive()) {
				return false;
			}
			var edge = curNode.findEdgeFromCaller(prevNode);
			if (edge == null) {
				return false;
			}
			prevNode = curNode;
			contextIds.retainAll(edge.contextIds());
			if (contextIds.isEmpty()) {
				return false;
			}
		}
		return true;
	}

	private ContextIds duplicateContextIds(ContextIds stackSequenceContextIds) {
		var newContextIds = ContextIds.empty();
		for (int oldId : stackSequenceContextIds) {
			int newId = graph.nextContextId();
			newContextIds.add(newId);
			oldToNewContextIds.computeIfAbsent(oldId, unused -> ContextIds.empty()).add(newId);
			graph.setAllocationType(newId, graph.allocationType(oldId));
			if (graph.dotAllocContextIds().contains(oldId)) {
				graph.dotAllocContextIds().add(newId);
			}
		}
		return newContextIds;
	}

	/** Adds the duplicated ids to every edge, reachable from an allocation, carrying the originals. */
	private void propagateDuplicateContextIds() {
		var visited = new HashSet<ContextEdge<F, C>>();
		for (var allocNode : graph.allocationNodes()) {
			updateCallers(allocNode, visited);
		}
	}

	private void updateCallers(ContextNode<F, C> node, Set<ContextEdge<F, C>> visited) {
		for (var edge : node.callerEdges()) {
			if (!visited.add(edge)) {
				continue;
			}
			var newIdsToAdd = ContextIds.empty();
			for (int id : edge.contextIds()) {
				var newIds = oldToNewContextIds.get(id);
				if (newIds != null) {
					newIdsToAdd.addAll(newIds);
				}
			}
			if (!newIdsToAdd.isEmpty()) {
				edge.contextIds().addAll(newIdsToAdd);
				updateCallers(edge.caller(), visited);
			}
		}
	}

	/**
	 * Creates the callsite nodes, callers first so that a sequence's outer
	 * nodes are already final when an inner one is split.
	 */
	private void assignStackNodesPostOrder(ContextNode<F, C> node, Set<ContextNode<F, C>> visited) {
		if (!visited.add(node)) {
			return;
		}
		for (var edge : new ArrayList<>(node.callerEdges())) {
			if (edge.isRemoved()) {
				continue;
			}
			assignStackNodesPostOrder(edge.caller(), visited);
		}

		if (node.isAllocation() || node.isClone()) {
			return;
		}
		var calls = stackIdToMatchingCalls.get(node.origStackOrAllocId());
		if (calls == null || graph.getNodeForStackId(node.origStackOrAllocId()) != node) {
			return;
		}

		if (calls.size() == 1 && calls.get(0).stackIds.size() == 1) {
			if (node.isRecursive()) {
				return;
			}
			var info = calls.get(0);
			node.setCall(info.call);
			node.setFunction(info.func);
			graph.nonAllocationCallToContextNode().put(info.call, node);
			return;
		}

		var lastNode = node;
		var lastNodeContextIds = lastNode.getContextIds();
		for (var info : calls) {
			var savedContextIds = info.savedContextIds;
			if (savedContextIds.isEmpty()) {
				var matchingCall = callToMatchingCall.get(info.call);
				if (matchingCall == null) {
					continue;
				}
				var matchingNode = graph.nonAllocationCallToContextNode().get(matchingCall);
				if (matchingNode != null) {
					matchingNode.matchingCalls().add(info.call);
				}
				continue;
			}

			// Earlier splits in this traversal may have taken some of the saved ids.
			savedContextIds.retainAll(lastNodeContextIds);
			if (savedContextIds.isEmpty()
					|| !intersectAlongChain(lastNode, info.stackIds, savedContextIds, false)) {
				continue;
			}

			var newNode = graph.createNewNode(false, info.func, info.call);
			graph.nonAllocationCallToContextNode().put(info.call, newNode);
			newNode.setAllocTypes(graph.computeAllocType(savedContextIds));

			var firstNode = graph.getNodeForStackId(info.stackIds.get(0));
			connectNewNode(newNode, firstNode, true, ContextIds.copyOf(savedContextIds));
			connectNewNode(newNode, lastNode, false, ContextIds.copyOf(savedContextIds));

			// Strip the moved ids off the chain the new node replaces.
			ContextNode<F, C> prevNode = null;
			for (long id : info.stackIds) {
				var curNode = graph.getNodeForStackId(id);
				if (prevNode != null) {
					var prevEdge = curNode.findEdgeFromCallee(prevNode);
					if (prevEdge == null) {
						prevNode = curNode;
						continue;
					}
					prevEdge.contextIds().removeAll(savedContextIds);
					if (prevEdge.contextIds().isEmpty()) {
						graph.removeEdgeFromGraph(prevEdge);
					}
				}
				curNode.setAllocTypes(curNode.calleeEdges().isEmpty()
						? AllocationType.NONE.bit()
						: curNode.computeAllocType());
				prevNode = curNode;
			}
			logger.trace("Spliced node {} for {} in place of {} stack nodes", newNode.id(), info.call, info.stackIds.size());

			if (graph.options().verifyNodes()) {
				graph.checker().checkNode(newNode, true);
				for (long id : info.stackIds) {
					graph.checker().checkNode(graph.getNodeForStackId(id), false);
				}
			}
		}
	}

	/**
	 * Moves {@code remainingContextIds} off the edges of {@code origNode}, on
	 * the callee side if {@code towardsCallee} and on the caller side otherwise,
	 * onto new edges of {@code newNode} to the same neighbors.
	 */
	private void connectNewNode(ContextNode<F, C> newNode, ContextNode<F, C> origNode, boolean towardsCallee,
			ContextIds remainingContextIds) {
		var origEdges = towardsCallee ? origNode.calleeEdges() : origNode.callerEdges();

		// Ids on more than one edge went around a recursive cycle, and must be
		// moved off every one of those edges.
		var recursiveContextIds = ContextIds.empty();
		if (graph.options().allowRecursiveCallsites()) {
			var allCallerContextIds = ContextIds.empty();
			for (var edge : origEdges) {
				for (int id : edge.contextIds()) {
					if (!allCallerContextIds.add(id)) {
						recursiveContextIds.add(id);
					}
				}
			}
		}

		for (var edge : new ArrayList<>(origEdges)) {
			if (edge.isRemoved()) {
				continue;
			}
			var newEdgeContextIds = edge.contextIds().intersection(remainingContextIds);
			edge.contextIds().removeAll(newEdgeContextIds);
			if (recursiveContextIds.isEmpty()) {
				remainingContextIds.removeAll(newEdgeContextIds);
			} else {
				remainingContextIds.removeAll(newEdgeContextIds.difference(recursiveContextIds));
			}
			if (newEdgeContextIds.isEmpty()) {
				continue;
			}
			int newAllocType = graph.computeAllocType(newEdgeContextIds);
			if (towardsCallee) {
				graph.addEdge(edge.callee(), newNode, newAllocType, newEdgeContextIds);
			} else {
				graph.addEdge(newNode, edge.caller(), newAllocType, newEdgeContextIds);
			}
			if (edge.contextIds().isEmpty()) {
				graph.removeEdgeFromGraph(edge);
			}
		}
	}
}
