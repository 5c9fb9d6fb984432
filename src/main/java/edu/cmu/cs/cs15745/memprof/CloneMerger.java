package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
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
 * Makes each caller call a single clone of any callee. Clones created for
 * different allocations can leave a caller with edges to several clones of
 * the same node; those edges are merged onto one node, together with the
 * edges of other callers that reach the same allocations through them.
 */
final class CloneMerger<F, C> {
	private static final Logger logger = LogManager.getLogger(CloneMerger.class);

	private final CallsiteContextGraph<F, C> graph;
	private final Map<Integer, ContextNode<F, C>> contextIdToAllocationNode = new HashMap<>();
	private final Set<ContextNode<F, C>> visited = new HashSet<>();
	private boolean alreadyRun = false;

	CloneMerger(CallsiteContextGraph<F, C> graph) {
		this.graph = Objects.requireNonNull(graph);
	}

	void run() {
		if (alreadyRun) {
			throw new IllegalStateException("Already run.");
		}
		alreadyRun = true;
		for (var node : graph.allocationNodes()) {
			for (int id : node.getContextIds()) {
				contextIdToAllocationNode.put(id, node.origNode());
			}
			for (var clone : node.clones()) {
				for (int id : clone.getContextIds()) {
					contextIdToAllocationNode.put(id, clone.origNode());
				}
			}
		}

		for (var node : new ArrayList<>(graph.allocationNodes())) {
			mergeClones(node);
			for (var clone : new ArrayList<>(node.clones())) {
				mergeClones(clone);
			}
		}
		logger.debug("Merged clones; {} new and {} existing merge nodes",
				graph.stats().get(Statistic.NEW_MERGED_NODES), graph.stats().get(Statistic.NON_NEW_MERGED_NODES));
	}

	private void mergeClones(ContextNode<F, C> node) {
		if (!visited.add(node)) {
			return;
		}
		// Merging a caller can give this node new callers, so repeat until
		// every caller has been visited.
		boolean foundUnvisited = true;
		while (foundUnvisited) {
			foundUnvisited = false;
			for (var callerEdge : new ArrayList<>(node.callerEdges())) {
				// Moved onto a different callee during the recursion.
				if (callerEdge.callee() != node) {
					continue;
				}
				if (!visited.contains(callerEdge.caller())) {
					foundUnvisited = true;
				}
				mergeClones(callerEdge.caller());
			}
		}
		mergeNodeCalleeClones(node);
	}

	private void mergeNodeCalleeClones(ContextNode<F, C> node) {
		if (node.emptyContextIds()) {
			return;
		}
		var origNodeToCloneEdges = new LinkedHashMap<ContextNode<F, C>, List<ContextEdge<F, C>>>();
		for (var edge : node.calleeEdges()) {
			var callee = edge.callee();
			if (!callee.isClone() && callee.clones().isEmpty()) {
				continue;
			}
			origNodeToCloneEdges.computeIfAbsent(callee.origNode(), unused -> new ArrayList<>()).add(edge);
		}

		for (var cloneEdges : origNodeToCloneEdges.values()) {
			if (cloneEdges.size() == 1) {
				continue;
			}
			// Callees with the fewest callers first, then clones before the
			// original node.
			var calleeEdges = new ArrayList<>(cloneEdges);
			calleeEdges.sort(Comparator.<ContextEdge<F, C>>comparingInt(e -> e.callee().callerEdges().size())
					.thenComparingInt(e -> e.callee().isClone() ? 0 : 1)
					.thenComparingInt(e -> e.contextIds().first()));

			var otherCallersToShareMerge = findOtherCallersToShareMerge(node, calleeEdges);

			ContextNode<F, C> mergeNode = null;
			for (var calleeEdge : calleeEdges) {
				var origCallee = calleeEdge.callee();
				if (mergeNode == null) {
					if (origCallee.callerEdges().size() == 1 || allCallersMove(origCallee, calleeEdge, otherCallersToShareMerge)) {
						mergeNode = origCallee;
						graph.stats().increment(Statistic.NON_NEW_MERGED_NODES);
						continue;
					}
				}
				if (mergeNode != null) {
					graph.moveEdgeToExistingCalleeClone(calleeEdge, mergeNode, false);
				} else {
					mergeNode = graph.moveEdgeToNewCalleeClone(calleeEdge);
					graph.stats().increment(Statistic.NEW_MERGED_NODES);
				}
				if (!otherCallersToShareMerge.isEmpty()) {
					for (var calleeCallerEdge : new ArrayList<>(origCallee.callerEdges())) {
						if (calleeCallerEdge == calleeEdge || !otherCallersToShareMerge.contains(calleeCallerEdge.caller())) {
							continue;
						}
						graph.moveEdgeToExistingCalleeClone(calleeCallerEdge, mergeNode, false);
					}
				}
				graph.removeNoneTypeCalleeEdges(origCallee);
				graph.removeNoneTypeCalleeEdges(mergeNode);
			}
		}
	}

	/** Whether every other caller of {@code callee} will move to the merge node as well. */
	private boolean allCallersMove(ContextNode<F, C> callee, ContextEdge<F, C> calleeEdge,
			Set<ContextNode<F, C>> otherCallersToShareMerge) {
		if (otherCallersToShareMerge.isEmpty()) {
			return false;
		}
		for (var calleeCallerEdge : callee.callerEdges()) {
			if (calleeCallerEdge == calleeEdge) {
				continue;
			}
			if (!otherCallersToShareMerge.contains(calleeCallerEdge.caller())) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Other callers that call every clone in {@code calleeEdges}, and whose
	 * contexts along each of those edges only reach allocations also reached
	 * along the edge from {@code node}. They can share the merge node.
	 */
	private Set<ContextNode<F, C>> findOtherCallersToShareMerge(ContextNode<F, C> node,
			List<ContextEdge<F, C>> calleeEdges) {
		var result = new HashSet<ContextNode<F, C>>();
		int numCalleeClones = calleeEdges.size();
		if (calleeEdges.get(0).callee().callerEdges().size() < 2) {
			return result;
		}

		var otherCallersToSharedCalleeEdgeCount = new LinkedHashMap<ContextNode<F, C>, Integer>();
		int possibleOtherCallerNodes = 0;
		var calleeEdgeToAllocNodes = new HashMap<ContextEdge<F, C>, Set<ContextNode<F, C>>>();
		for (var calleeEdge : calleeEdges) {
			for (var calleeCallerEdge : calleeEdge.callee().callerEdges()) {
				if (calleeCallerEdge.caller() == node) {
					continue;
				}
				int count = otherCallersToSharedCalleeEdgeCount.merge(calleeCallerEdge.caller(), 1, Integer::sum);
				if (count == numCalleeClones) {
					possibleOtherCallerNodes++;
				}
			}
			var allocNodes = calleeEdgeToAllocNodes.computeIfAbsent(calleeEdge, unused -> new HashSet<>());
			for (int id : calleeEdge.contextIds()) {
				var alloc = contextIdToAllocationNode.get(id);
				if (alloc == null) {
					graph.stats().increment(Statistic.MISSING_ALLOC_FOR_CONTEXT_ID);
					logger.warn("No allocation recorded for context id {}", id);
					continue;
				}
				allocNodes.add(alloc);
			}
		}

		for (var calleeEdge : calleeEdges) {
			if (possibleOtherCallerNodes == 0) {
				break;
			}
			var curCalleeAllocNodes = calleeEdgeToAllocNodes.get(calleeEdge);
			for (var calleeCallerEdge : calleeEdge.callee().callerEdges()) {
				if (calleeCallerEdge == calleeEdge) {
					continue;
				}
				var caller = calleeCallerEdge.caller();
				if (otherCallersToSharedCalleeEdgeCount.getOrDefault(caller, 0) != numCalleeClones) {
					continue;
				}
				for (int id : calleeCallerEdge.contextIds()) {
					var alloc = contextIdToAllocationNode.get(id);
					if (alloc == null) {
						continue;
					}
					if (!curCalleeAllocNodes.contains(alloc)) {
						otherCallersToSharedCalleeEdgeCount.put(caller, 0);
						possibleOtherCallerNodes--;
						break;
					}
				}
			}
		}
		if (possibleOtherCallerNodes == 0) {
			return result;
		}

		for (var entry : otherCallersToSharedCalleeEdgeCount.entrySet()) {
			if (entry.getValue() == numCalleeClones) {
				result.add(entry.getKey());
			}
		}
		return result;
	}
}
