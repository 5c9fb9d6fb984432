package edu.cmu.cs.cs15745.memprof;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Marks the callee edges closing a cycle, found by depth-first search from
 * every callsite node without callers. Cloning along these edges is deferred
 * until the contexts entering the cycle from outside have been handled.
 */
final class BackedgeMarker<F, C> {
	private final CallsiteContextGraph<F, C> graph;
	private final Set<ContextNode<F, C>> visited = new HashSet<>();
	private final Set<ContextNode<F, C>> currentStack = new HashSet<>();
	private boolean alreadyRun = false;

	BackedgeMarker(CallsiteContextGraph<F, C> graph) {
		this.graph = Objects.requireNonNull(graph);
	}

	void run() {
		if (alreadyRun) {
			throw new IllegalStateException("Already run.");
		}
		alreadyRun = true;
		for (var node : graph.nonAllocationCallToContextNode().values()) {
			if (node.isRemoved() || !node.callerEdges().isEmpty()) {
				continue;
			}
			markBackedges(node);
			assert currentStack.isEmpty();
		}
	}

	private void markBackedges(ContextNode<F, C> node) {
		visited.add(node);
		for (var calleeEdge : node.calleeEdges()) {
			var callee = calleeEdge.callee();
			if (visited.contains(callee)) {
				if (currentStack.contains(callee)) {
					calleeEdge.setBackedge(true);
				}
				continue;
			}
			currentStack.add(callee);
			markBackedges(callee);
			currentStack.remove(callee);
		}
	}
}
