package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Clones nodes so that, as far as the callers allow, each node only carries
 * contexts of a single allocation type. Works one allocation at a time, from
 * the allocation node outwards, cloning a node after its callers.
 */
final class CloneIdentifier<F, C> {
	private static final Logger logger = LogManager.getLogger(CloneIdentifier.class);

	// Caller edges of these types are split off first, indexed by the alloc
	// type mask. NotCold edges go last and stay on the original node, so unknown
	// callers of the original function keep the default behavior.
	private static final int[] ALLOC_TYPE_CLONING_PRIORITY = { 3, 4, 1, 2 };

	private final CallsiteContextGraph<F, C> graph;
	private final DisambiguationOptions options;
	private boolean alreadyRun = false;

	CloneIdentifier(CallsiteContextGraph<F, C> graph) {
		this.graph = Objects.requireNonNull(graph);
		this.options = graph.options();
	}

	void run() {
		if (alreadyRun) {
			throw new IllegalStateException("Already run.");
		}
		alreadyRun = true;
		var visited = new HashSet<ContextNode<F, C>>();
		for (var allocNode : new ArrayList<>(graph.allocationNodes())) {
			visited.clear();
			identifyClones(allocNode, visited, allocNode.getContextIds());
		}
		visited.clear();
		for (var allocNode : graph.allocationNodes()) {
			graph.recursivelyRemoveNoneTypeCalleeEdges(allocNode, visited);
		}
		logger.debug("Identified clones; {} node clones so far", graph.stats().get(Statistic.NODE_CLONES));
		graph.verify();
	}

	private void identifyClones(ContextNode<F, C> node, Set<ContextNode<F, C>> visited, ContextIds allocContextIds) {
		if (options.verifyNodes()) {
			graph.checker().checkNode(node, false);
		}
		assert !node.isClone();
		// Nodes without a call cannot be updated, so neither they nor their callers are cloned for them.
		if (!node.hasCall()) {
			return;
		}
		if (AllocationType.isSingleType(node.allocTypes())) {
			return;
		}
		visited.add(node);

		// Recursion may remove edges of the original list.
		for (var edge : new ArrayList<>(node.callerEdges())) {
			if (edge.isRemoved() || edge.isBackedge()) {
				continue;
			}
			if (!visited.contains(edge.caller()) && !edge.caller().isClone()) {
				identifyClones(edge.caller(), visited, allocContextIds);
			}
		}

		if (AllocationType.isSingleType(node.allocTypes()) || node.callerEdges().size() <= 1) {
			return;
		}

		node.callerEdges().sort(CloneIdentifier::compareCallerEdges);

		// Contexts reaching this node through more than one caller edge are
		// recursive and are left uncloned unless recursive contexts are allowed.
		var recursiveContextIds = ContextIds.empty();
		if (options.allowRecursiveCallsites() && !options.allowRecursiveContexts()) {
			var allCallerContextIds = ContextIds.empty();
			for (var edge : node.callerEdges()) {
				for (int id : edge.contextIds()) {
					if (!allCallerContextIds.add(id)) {
						recursiveContextIds.add(id);
					}
				}
			}
		}

		var callerEdges = new ArrayList<>(node.callerEdges());
		for (var callerEdge : callerEdges) {
			if (callerEdge.isRemoved()) {
				continue;
			}
			if (AllocationType.isSingleType(node.allocTypes()) || node.callerEdges().size() <= 1) {
				break;
			}
			if (!callerEdge.caller().hasCall()) {
				continue;
			}

			var callerEdgeContextsForAlloc = callerEdge.contextIds().intersection(allocContextIds);
			if (!recursiveContextIds.isEmpty()) {
				var nonRecursive = callerEdgeContextsForAlloc.difference(recursiveContextIds);
				graph.stats().add(Statistic.SKIPPED_RECURSIVE_CONTEXTS,
						callerEdgeContextsForAlloc.size() - nonRecursive.size());
				callerEdgeContextsForAlloc = nonRecursive;
			}
			if (callerEdgeContextsForAlloc.isEmpty()) {
				continue;
			}

			int callerAllocTypeForAlloc = graph.computeAllocType(callerEdgeContextsForAlloc);
			var calleeEdgeAllocTypesForCallerEdge = calleeEdgeAllocTypes(node, callerEdgeContextsForAlloc);

			// Cloning is useless unless it separates the caller's type from the
			// node's or splits some callee edge. Backedges were deferred above
			// and are always cloned.
			if (!callerEdge.isBackedge()
					&& AllocationType.allocTypeToUse(callerAllocTypeForAlloc) == AllocationType.allocTypeToUse(node.allocTypes())
					&& allocTypesMatch(calleeEdgeAllocTypesForCallerEdge, node.calleeEdges())) {
				continue;
			}

			if (callerEdge.isBackedge()) {
				graph.stats().increment(Statistic.DEFERRED_BACKEDGES);
			}

			// Clone the backedge caller now, with just the contexts of this edge.
			if (callerEdge.isBackedge() && !callerEdge.caller().isClone() && !visited.contains(callerEdge.caller())) {
				int origIdCount = callerEdge.contextIds().size();
				identifyClones(callerEdge.caller(), visited, callerEdgeContextsForAlloc);
				graph.removeNoneTypeCalleeEdges(callerEdge.caller());
				// The contexts may have moved to an edge from a new clone of the
				// caller; clone this node for that edge instead.
				boolean updatedEdge = false;
				if (origIdCount > callerEdge.contextIds().size()) {
					for (var e : node.callerEdges()) {
						if (e.caller().cloneOf() != callerEdge.caller()) {
							continue;
						}
						var callerEdgeContextsForAllocNew = callerEdgeContextsForAlloc.intersection(e.contextIds());
						if (callerEdgeContextsForAllocNew.isEmpty() || containsEdge(callerEdges, e)) {
							continue;
						}
						callerEdgeContextsForAlloc = callerEdgeContextsForAllocNew;
						callerEdge = e;
						updatedEdge = true;
						break;
					}
				}
				if (callerEdge.isRemoved()) {
					continue;
				}
				if (!updatedEdge) {
					callerEdgeContextsForAlloc = callerEdgeContextsForAlloc.intersection(callerEdge.contextIds());
					if (callerEdgeContextsForAlloc.isEmpty()) {
						continue;
					}
				}
				callerAllocTypeForAlloc = graph.computeAllocType(callerEdgeContextsForAlloc);
				calleeEdgeAllocTypesForCallerEdge = calleeEdgeAllocTypes(node, callerEdgeContextsForAlloc);
			}

			ContextNode<F, C> clone = null;
			for (var curClone : node.clones()) {
				if (AllocationType.allocTypeToUse(curClone.allocTypes()) != AllocationType.allocTypeToUse(callerAllocTypeForAlloc)) {
					continue;
				}
				boolean bothSingleAlloc = AllocationType.isSingleType(curClone.allocTypes())
						&& AllocationType.isSingleType(callerAllocTypeForAlloc);
				if (bothSingleAlloc || allocTypesMatchClone(calleeEdgeAllocTypesForCallerEdge, curClone)) {
					clone = curClone;
					break;
				}
			}
			if (clone != null) {
				graph.moveEdgeToExistingCalleeClone(callerEdge, clone, false, callerEdgeContextsForAlloc);
			} else {
				clone = graph.moveEdgeToNewCalleeClone(callerEdge, callerEdgeContextsForAlloc);
			}
			assert clone.allocTypes() != AllocationType.NONE.bit();
		}

		assert !node.emptyContextIds();
		if (options.verifyNodes()) {
			graph.checker().checkNode(node, false);
		}
	}

	private static <F, C> int compareCallerEdges(ContextEdge<F, C> a, ContextEdge<F, C> b) {
		if (a.contextIds().isEmpty()) {
			return b.contextIds().isEmpty() ? 0 : 1;
		}
		if (b.contextIds().isEmpty()) {
			return -1;
		}
		if (a.allocTypes() == b.allocTypes()) {
			return Integer.compare(a.contextIds().first(), b.contextIds().first());
		}
		return Integer.compare(ALLOC_TYPE_CLONING_PRIORITY[a.allocTypes()], ALLOC_TYPE_CLONING_PRIORITY[b.allocTypes()]);
	}

	private static <F, C> boolean containsEdge(List<ContextEdge<F, C>> edges, ContextEdge<F, C> edge) {
		for (var e : edges) {
			if (e == edge) {
				return true;
			}
		}
		return false;
	}

	private List<Integer> calleeEdgeAllocTypes(ContextNode<F, C> node, ContextIds contextIds) {
		var result = new ArrayList<Integer>(node.calleeEdges().size());
		for (var calleeEdge : node.calleeEdges()) {
			result.add(graph.intersectAllocTypes(calleeEdge.contextIds(), contextIds));
		}
		return result;
	}

	/** Whether the callee edges would carry the same types with just these contexts. */
	private boolean allocTypesMatch(List<Integer> inAllocTypes, List<ContextEdge<F, C>> edges) {
		var matcher = options.cloneReuseMatcher();
		for (int i = 0; i < inAllocTypes.size(); i++) {
			if (!matcher.matches(inAllocTypes.get(i), edges.get(i).allocTypes())) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Whether {@code clone} can take contexts with the given types along the
	 * callee edges of its original node. Callees the clone has no edge to yet
	 * always match.
	 */
	private boolean allocTypesMatchClone(List<Integer> inAllocTypes, ContextNode<F, C> clone) {
		var node = clone.cloneOf();
		var matcher = options.cloneReuseMatcher();
		var edgeCalleeMap = new HashMap<ContextNode<F, C>, Integer>();
		for (var e : clone.calleeEdges()) {
			edgeCalleeMap.put(e.callee(), e.allocTypes());
		}
		for (int i = 0; i < node.calleeEdges().size(); i++) {
			var cloneAllocTypes = edgeCalleeMap.get(node.calleeEdges().get(i).callee());
			if (cloneAllocTypes == null) {
				continue;
			}
			if (!matcher.matches(inAllocTypes.get(i), cloneAllocTypes)) {
				return false;
			}
		}
		return true;
	}
}
