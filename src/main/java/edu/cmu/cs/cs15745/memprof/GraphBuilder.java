package edu.cmu.cs.cs15745.memprof;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the initial context graph from a module profile: one node per
 * allocation, and one node per stack id reached by some profiled context,
 * chained from the allocation outwards.
 */
final class GraphBuilder<F, C> {
	private static final Logger logger = LogManager.getLogger(GraphBuilder.class);

	private final CallsiteContextGraph<F, C> graph;
	private final ModuleProfile<F, C> profile;
	private boolean alreadyRun = false;

	GraphBuilder(CallsiteContextGraph<F, C> graph, ModuleProfile<F, C> profile) {
		this.graph = Objects.requireNonNull(graph);
		this.profile = Objects.requireNonNull(profile);
	}

	void run() {
		if (alreadyRun) {
			throw new IllegalStateException("Already run.");
		}
		alreadyRun = true;
		for (var function : profile.functions()) {
			var func = function.function();
			for (var call : function.calls()) {
				if (call.isAllocation()) {
					addAllocation(func, (ProfiledCall.Allocation<C>) call);
				} else {
					addCallsite(func, (ProfiledCall.Callsite<C>) call);
				}
			}
		}
		logger.debug("Built graph with {} nodes and {} contexts", graph.nodes().size(), graph.lastContextId());
	}

	private void addAllocation(F func, ProfiledCall.Allocation<C> alloc) {
		// Without MIBs there is nothing to disambiguate.
		if (alloc.mibs().isEmpty()) {
			return;
		}
		var callInfo = CallInfo.of(alloc.call());
		graph.addCallWithMetadata(func, callInfo);
		var allocNode = graph.addAllocNode(callInfo, func);
		var options = graph.options();
		for (var mib : alloc.mibs()) {
			addStackNodesForMIB(allocNode, mib, alloc.callsiteContext());
		}
		if (options.exportToDot() && options.hasAllocIdForDot()
				&& allocNode.origStackOrAllocId() == options.allocIdForDot()) {
			graph.dotAllocContextIds().addAll(allocNode.getContextIds());
		}
		graph.adapter().onAllocationNodeBuilt(alloc.call(), allocNode.allocTypes());
	}

	private void addCallsite(F func, ProfiledCall.Callsite<C> callsite) {
		if (callsite.stackIds().isEmpty()) {
			return;
		}
		graph.addCallWithMetadata(func, CallInfo.of(callsite.call()));
		graph.recordCallsiteStackIds(callsite.call(), callsite.stackIds());
	}

	/**
	 * Adds the context of {@code mib} under a fresh context id, from the
	 * allocation node outwards. Stack ids already inlined into the allocation
	 * call itself are skipped.
	 */
	private void addStackNodesForMIB(ContextNode<F, C> allocNode, MibRecord mib, List<Long> callsiteContext) {
		var adapter = graph.adapter();
		var options = graph.options();
		var allocType = mib.allocType().normalize();
		int contextId = graph.nextContextId();
		graph.setAllocationType(contextId, allocType);
		if (options.recordContextSizes() && !mib.contextSizeInfos().isEmpty()) {
			graph.contextIdToContextSizeInfos().put(contextId, List.copyOf(mib.contextSizeInfos()));
		}
		allocNode.addAllocTypes(allocType.bit());

		var stackIds = mib.stackIds();
		int start = 0;
		while (start < callsiteContext.size() && start < stackIds.size()
				&& adapter.getStackId(stackIds.get(start)) == adapter.getStackId(callsiteContext.get(start))) {
			start++;
		}

		var prevNode = allocNode;
		var stackIdSet = new HashSet<Long>();
		for (int i = start; i < stackIds.size(); i++) {
			long stackId = adapter.getStackId(stackIds.get(i));
			var stackNode = graph.getOrCreateStackNode(stackId);
			if (!options.allowRecursiveCallsites() && !stackIdSet.add(stackId)) {
				stackNode.setRecursive(true);
			}
			stackNode.addAllocTypes(allocType.bit());
			prevNode.addOrUpdateCallerEdge(stackNode, allocType, contextId);
			prevNode = stackNode;
		}
	}
}
