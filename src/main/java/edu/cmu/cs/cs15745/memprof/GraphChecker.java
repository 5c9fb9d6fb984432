package edu.cmu.cs.cs15745.memprof;

import java.util.HashSet;
import java.util.Objects;

/**
 * Consistency checks over the context graph. A violation throws
 * {@link GraphConsistencyException}.
 */
final class GraphChecker {
	private final DisambiguationOptions options;

	GraphChecker(DisambiguationOptions options) {
		this.options = Objects.requireNonNull(options);
	}

	<F, C> void checkEdge(ContextEdge<F, C> edge) {
		if (edge.isRemoved()) {
			throw new GraphConsistencyException("Removed edge still reachable");
		}
		if (edge.allocTypes() == AllocationType.NONE.bit()) {
			throw new GraphConsistencyException("Edge with None type: " + edge);
		}
		if (edge.contextIds().isEmpty()) {
			throw new GraphConsistencyException("Edge without context ids: " + edge);
		}
	}

	<F, C> void checkNode(ContextNode<F, C> node, boolean checkEdges) {
		if (node.isRemoved()) {
			return;
		}
		// With recursion the ids on the edges into and out of a node may legitimately differ.
		boolean checkIds = !(options.allowRecursiveCallsites() && options.allowRecursiveContexts());
		var nodeContextIds = node.getContextIds();

		if (!node.callerEdges().isEmpty()) {
			var callerEdgeContextIds = ContextIds.empty();
			for (var edge : node.callerEdges()) {
				if (checkEdges) {
					checkEdge(edge);
				}
				callerEdgeContextIds.addAll(edge.contextIds());
			}
			if (checkIds && !nodeContextIds.containsAll(callerEdgeContextIds)) {
				throw new GraphConsistencyException(
						"Caller edge ids " + callerEdgeContextIds + " not a subset of node " + node.id() + " ids " + nodeContextIds);
			}
		}
		if (!node.calleeEdges().isEmpty()) {
			var calleeEdgeContextIds = ContextIds.empty();
			var callees = new HashSet<ContextNode<F, C>>();
			for (var edge : node.calleeEdges()) {
				if (checkEdges) {
					checkEdge(edge);
				}
				calleeEdgeContextIds.addAll(edge.contextIds());
				if (!callees.add(edge.callee())) {
					throw new GraphConsistencyException("Duplicate callee edge on node " + node.id() + ": " + edge);
				}
			}
			if (checkIds && !calleeEdgeContextIds.equals(nodeContextIds)) {
				throw new GraphConsistencyException(
						"Callee edge ids " + calleeEdgeContextIds + " differ from node " + node.id() + " ids " + nodeContextIds);
			}
		}
		for (var clone : node.clones()) {
			if (clone.cloneOf() != node) {
				throw new GraphConsistencyException("Clone " + clone.id() + " does not point back to " + node.id());
			}
		}
	}

	<F, C> void check(CallsiteContextGraph<F, C> graph) {
		for (var node : graph.nodes()) {
			checkNode(node, false);
			for (var edge : node.callerEdges()) {
				checkEdge(edge);
			}
		}
	}
}
