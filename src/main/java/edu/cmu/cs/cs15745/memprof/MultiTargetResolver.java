package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks that the calls recorded on each callsite node actually reach the
 * functions of its profiled callees.
 *
 * Calls with different known callees (the per-target records of an indirect
 * call, or unrelated calls sharing a location) are split onto one node per
 * callee. Otherwise the first call whose callee matches every profiled callee,
 * possibly through a chain of tail calls, becomes the node's call; the tail
 * calls get nodes of their own. A node with no matching call loses its call
 * and is left alone by the later stages.
 */
final class MultiTargetResolver<F, C> {
	private static final Logger logger = LogManager.getLogger(MultiTargetResolver.class);

	private static final int NO_MATCH = Integer.MIN_VALUE;

	private final CallsiteContextGraph<F, C> graph;
	private boolean alreadyRun = false;

	// Nodes created for tail calls found between a caller and its profiled callee.
	private final Map<CallInfo<C>, ContextNode<F, C>> tailCallToContextNode = new LinkedHashMap<>();

	// Primary calls that changed, applied once iteration over the call map is done.
	private final Map<CallInfo<C>, ContextNode<F, C>> newCallToNode = new LinkedHashMap<>();

	MultiTargetResolver(CallsiteContextGraph<F, C> graph) {
		this.graph = Objects.requireNonNull(graph);
	}

	private static final class CallsWithSameCallee<F, C> {
		final List<CallInfo<C>> calls = new ArrayList<>();
		ContextNode<F, C> node = null;
	}

	void run() {
		if (alreadyRun) {
			throw new IllegalStateException("Already run.");
		}
		alreadyRun = true;
		var callToNode = graph.nonAllocationCallToContextNode();
		for (var node : new ArrayList<>(callToNode.values())) {
			if (!node.hasCall()) {
				continue;
			}
			var allCalls = new ArrayList<CallInfo<C>>(node.matchingCalls().size() + 1);
			allCalls.add(node.call());
			allCalls.addAll(node.matchingCalls());

			if (partitionCallsByCallee(node, allCalls)) {
				continue;
			}

			CallInfo<C> matched = null;
			int matchedIndex = 0;
			for (; matchedIndex < allCalls.size(); matchedIndex++) {
				var thisCall = allCalls.get(matchedIndex);
				if (matchesAllCallees(node, thisCall)) {
					matched = thisCall;
					break;
				}
			}
			node.matchingCalls().clear();
			if (matched == null) {
				graph.stats().increment(Statistic.REMOVED_EDGES_WITH_MISMATCHED_CALLEES);
				logger.trace("No call of node {} matches its profiled callees", node.id());
				node.setCall(null);
				continue;
			}
			if (!matched.equals(node.call())) {
				node.setCall(matched);
				newCallToNode.put(matched, node);
			}
			for (int i = matchedIndex + 1; i < allCalls.size(); i++) {
				var thisCall = allCalls.get(i);
				if (graph.adapter().sameCallee(node.call().call(), thisCall.call())) {
					node.matchingCalls().add(thisCall);
				}
			}
		}

		callToNode.entrySet().removeIf(entry -> !entry.getValue().hasCall() || !entry.getValue().call().equals(entry.getKey()));
		callToNode.putAll(newCallToNode);
		callToNode.putAll(tailCallToContextNode);
		logger.debug("Resolved callees; {} tail call nodes added", tailCallToContextNode.size());
	}

	private boolean matchesAllCallees(ContextNode<F, C> node, CallInfo<C> call) {
		var calleeEdges = node.calleeEdges();
		for (int i = 0; i < calleeEdges.size(); i++) {
			if (!calleeEdges.get(i).callee().hasCall()) {
				continue;
			}
			int next = calleesMatch(call.call(), node, i);
			if (next == NO_MATCH) {
				return false;
			}
			i = next;
		}
		return true;
	}

	/**
	 * Whether {@code call} reaches the function of the callee of the callee
	 * edge at {@code index} of {@code node}. If it does so through tail calls,
	 * the edge is replaced by a chain through nodes for those tail calls.
	 * Returns the index to continue iterating from, or {@link #NO_MATCH}.
	 */
	private int calleesMatch(C call, ContextNode<F, C> node, int index) {
		var edge = node.calleeEdges().get(index);
		var profiledCalleeFunc = edge.callee().function();
		var callerFunc = edge.caller().function();
		var foundCalleeChain = new ArrayList<TailCallFrame<F, C>>();
		if (!graph.adapter().calleeMatchesFunc(call, profiledCalleeFunc, callerFunc, foundCalleeChain)) {
			return NO_MATCH;
		}
		if (foundCalleeChain.isEmpty()) {
			return index;
		}

		int pos = index;
		var curCalleeNode = edge.callee();
		for (var frame : foundCalleeChain) {
			var newCall = CallInfo.of(frame.call());
			var newNode = tailCallToContextNode.get(newCall);
			if (newNode != null) {
				newNode.addAllocTypes(edge.allocTypes());
			} else {
				graph.addCallWithMetadata(frame.function(), newCall);
				newNode = graph.createNewNode(false, frame.function(), newCall);
				tailCallToContextNode.put(newCall, newNode);
				newNode.setAllocTypes(edge.allocTypes());
			}
			pos = addTailCallEdge(edge, pos, newNode, curCalleeNode);
			curCalleeNode = newNode;
		}
		pos = addTailCallEdge(edge, pos, edge.caller(), curCalleeNode);
		graph.removeEdgeFromGraph(edge);
		// The caller keeps at least the edge just added, so stepping back stays in range.
		return pos - 1;
	}

	/**
	 * Adds the contexts of {@code edge} to an edge from {@code caller} to
	 * {@code callee}. A new edge out of the caller of {@code edge} goes just
	 * before it; returns the updated position of {@code edge}.
	 */
	private int addTailCallEdge(ContextEdge<F, C> edge, int pos, ContextNode<F, C> caller, ContextNode<F, C> callee) {
		var curEdge = callee.findEdgeFromCaller(caller);
		if (curEdge != null) {
			curEdge.contextIds().addAll(edge.contextIds());
			curEdge.addAllocTypes(edge.allocTypes());
			return pos;
		}
		var newEdge = new ContextEdge<>(callee, caller, edge.allocTypes(), ContextIds.copyOf(edge.contextIds()));
		callee.callerEdges().add(newEdge);
		if (caller == edge.caller()) {
			caller.calleeEdges().add(pos, newEdge);
			return pos + 1;
		}
		caller.calleeEdges().add(newEdge);
		return pos;
	}

	/**
	 * Splits the calls of {@code node} by their known callee, giving each group
	 * the callee edges to its callee. Returns false if no callee edge matched
	 * any group, leaving the node untouched.
	 */
	private boolean partitionCallsByCallee(ContextNode<F, C> node, List<CallInfo<C>> allCalls) {
		var adapter = graph.adapter();
		var calleeFuncToCallInfo = new LinkedHashMap<F, CallsWithSameCallee<F, C>>();
		for (var thisCall : allCalls) {
			var calleeFunc = adapter.getCalleeFunc(thisCall.call());
			if (calleeFunc != null) {
				calleeFuncToCallInfo.computeIfAbsent(calleeFunc, unused -> new CallsWithSameCallee<>()).calls.add(thisCall);
			}
		}

		var calleeNodeToCallInfo = new LinkedHashMap<ContextNode<F, C>, CallsWithSameCallee<F, C>>();
		for (var edge : node.calleeEdges()) {
			if (!edge.callee().hasCall()) {
				continue;
			}
			var info = calleeFuncToCallInfo.get(edge.callee().function());
			if (info != null) {
				calleeNodeToCallInfo.put(edge.callee(), info);
			}
		}
		if (calleeNodeToCallInfo.isEmpty()) {
			return false;
		}

		ContextNode<F, C> unmatchedCalleesNode = null;
		boolean usedOrigNode = false;
		for (var edge : new ArrayList<>(node.calleeEdges())) {
			if (!edge.callee().hasCall()) {
				continue;
			}
			ContextNode<F, C> callerNodeToUse;
			var info = calleeNodeToCallInfo.get(edge.callee());
			if (info == null) {
				if (unmatchedCalleesNode == null) {
					unmatchedCalleesNode = graph.createNewNode(false, node.function(), null);
				}
				callerNodeToUse = unmatchedCalleesNode;
			} else {
				if (info.node == null) {
					if (!usedOrigNode) {
						info.node = node;
						node.matchingCalls().clear();
						usedOrigNode = true;
					} else {
						info.node = graph.createNewNode(false, node.function(), null);
					}
					info.node.setCall(info.calls.get(0));
					info.node.matchingCalls().addAll(info.calls.subList(1, info.calls.size()));
					newCallToNode.put(info.node.call(), info.node);
				}
				callerNodeToUse = info.node;
			}
			if (callerNodeToUse == node) {
				continue;
			}
			graph.moveCalleeEdgeToNewCaller(edge, callerNodeToUse);
		}

		// Caller edges emptied by the moves are only cleaned up now.
		for (var info : calleeNodeToCallInfo.values()) {
			graph.removeNoneTypeCallerEdges(info.node);
		}
		if (unmatchedCalleesNode != null) {
			graph.removeNoneTypeCallerEdges(unmatchedCalleesNode);
		}
		graph.removeNoneTypeCallerEdges(node);
		logger.trace("Partitioned calls of node {} over {} callees", node.id(), calleeFuncToCallInfo.size());
		return true;
	}
}
