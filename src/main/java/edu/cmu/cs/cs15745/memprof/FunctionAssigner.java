package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps the clones of each callsite node onto clones of its enclosing
 * function, creating function clones as needed, then writes the decisions
 * back through the adapter: allocation hints on allocation calls, and the
 * function clone each (cloned) call must target.
 *
 * Assignment is greedy, one function at a time. A callsite clone goes to the
 * function clone its callers already call when they agree. When they do not,
 * the callsite is cloned again so that each clone has a single target.
 */
final class FunctionAssigner<F, C> {
	private static final Logger logger = LogManager.getLogger(FunctionAssigner.class);

	private final CallsiteContextGraph<F, C> graph;
	private final DisambiguationOptions options;
	private boolean alreadyRun = false;

	// Function clone each callsite node (clone) has been assigned to call.
	private final Map<ContextNode<F, C>, FuncInfo<F>> callsiteToCalleeFuncClone = new HashMap<>();

	// Original calls of each node, before any of them is moved into a function clone.
	private final Map<ContextNode<F, C>, CallInfo<C>> origCallOfNode = new HashMap<>();
	private final Map<ContextNode<F, C>, List<CallInfo<C>>> origMatchingCallsOfNode = new HashMap<>();

	private boolean changed = false;

	FunctionAssigner(CallsiteContextGraph<F, C> graph) {
		this.graph = Objects.requireNonNull(graph);
		this.options = graph.options();
	}

	/** Returns whether anything was cloned or updated. */
	boolean run() {
		if (alreadyRun) {
			throw new IllegalStateException("Already run.");
		}
		alreadyRun = true;
		for (var calls : graph.funcToCallsWithMetadata().values()) {
			for (var call : calls) {
				var node = graph.getNodeForInst(call);
				if (node != null && node.hasCall()) {
					origCallOfNode.put(node, call);
					origMatchingCallsOfNode.put(node, List.copyOf(node.matchingCalls()));
				}
			}
		}
		for (var entry : graph.funcToCallsWithMetadata().entrySet()) {
			assignFunction(entry.getKey(), entry.getValue());
		}
		logger.debug("Assigned functions; {} function clones created", graph.stats().get(Statistic.FUNCTION_CLONES));
		updateCalls();
		return changed;
	}

	private void assignFunction(F func, List<CallInfo<C>> callsWithMetadata) {
		var origFunc = FuncInfo.of(func, 0);
		// Indexed by clone number.
		var funcCloneInfos = new ArrayList<FunctionClone<F, C>>();
		// Snapshot, as the tail call resolution may have added calls while building.
		for (var call : new ArrayList<>(callsWithMetadata)) {
			var node = graph.getNodeForInst(call);
			if (node == null || node.clones().isEmpty()) {
				continue;
			}
			assert node.hasCall();
			new CallsiteAssignment(origFunc, call, node, callsWithMetadata, funcCloneInfos).run();
		}
	}

	/** Assignment of the clones of one callsite node to function clones. */
	private final class CallsiteAssignment {
		private final FuncInfo<F> origFunc;
		private final CallInfo<C> call;
		private final ContextNode<F, C> node;
		private final List<CallInfo<C>> callsWithMetadata;
		private final List<FunctionClone<F, C>> funcCloneInfos;
		private final List<CallInfo<C>> origMatchingCalls;
		private final Map<FuncInfo<F>, ContextNode<F, C>> funcCloneToCurNodeClone = new HashMap<>();
		private final ArrayDeque<ContextNode<F, C>> clonesWorklist = new ArrayDeque<>();

		CallsiteAssignment(FuncInfo<F> origFunc, CallInfo<C> call, ContextNode<F, C> node,
				List<CallInfo<C>> callsWithMetadata, List<FunctionClone<F, C>> funcCloneInfos) {
			this.origFunc = origFunc;
			this.call = call;
			this.node = node;
			this.callsWithMetadata = callsWithMetadata;
			this.funcCloneInfos = funcCloneInfos;
			this.origMatchingCalls = origMatchingCallsOfNode.getOrDefault(node, List.of());
		}

		/** Makes {@code callsiteClone} the copy of the call living in {@code funcClone}. */
		private void assign(FuncInfo<F> funcClone, ContextNode<F, C> callsiteClone) {
			funcCloneToCurNodeClone.put(funcClone, callsiteClone);
			var info = funcCloneInfos.get(funcClone.cloneNo());
			callsiteClone.setCall(info.map(call));
			callsiteClone.matchingCalls().clear();
			for (var matchingCall : origMatchingCalls) {
				callsiteClone.matchingCalls().add(info.map(matchingCall));
			}
		}

		private void recordCallersOf(ContextNode<F, C> clone, FuncInfo<F> funcClone) {
			for (var callerEdge : clone.callerEdges()) {
				if (callerEdge.caller().hasCall()) {
					callsiteToCalleeFuncClone.put(callerEdge.caller(), funcClone);
				}
			}
		}

		private FuncInfo<F> findFirstAvailFuncClone() {
			for (var info : funcCloneInfos) {
				if (!funcCloneToCurNodeClone.containsKey(info.func())) {
					return info.func();
				}
			}
			throw new IllegalStateException("No function clone available for a clone of node " + node.id());
		}

		void run() {
			// The original node is ignored once all of its contexts moved to clones.
			if (!node.emptyContextIds()) {
				clonesWorklist.add(node);
			}
			clonesWorklist.addAll(node.clones());

			int nodeCloneCount = 0;
			while (!clonesWorklist.isEmpty()) {
				var clone = clonesWorklist.poll();
				nodeCloneCount++;
				if (options.verifyNodes()) {
					graph.checker().checkNode(clone, true);
				}
				// More callsite clones than function clones: the greedy assignment
				// so far needs a new function clone.
				if (funcCloneInfos.size() < nodeCloneCount) {
					if (nodeCloneCount == 1) {
						funcCloneInfos.add(new FunctionClone<>(origFunc, Map.of()));
						assign(origFunc, clone);
						recordCallersOf(clone, origFunc);
						continue;
					}
					if (cloneFunction(clone)) {
						continue;
					}
				}
				assignToCallersFuncClone(clone);
			}

			if (options.verifyCCG()) {
				var checker = graph.checker();
				checkWithNeighbors(checker, node);
				for (var clone : node.clones()) {
					checkWithNeighbors(checker, clone);
				}
			}
		}

		private void checkWithNeighbors(GraphChecker checker, ContextNode<F, C> n) {
			checker.checkNode(n, true);
			for (var e : n.calleeEdges()) {
				checker.checkNode(e.callee(), true);
			}
			for (var e : n.callerEdges()) {
				checker.checkNode(e.caller(), true);
			}
		}

		/**
		 * Creates a new function clone for {@code clone}. Returns true if that
		 * finished the assignment of {@code clone}.
		 */
		private boolean cloneFunction(ContextNode<F, C> clone) {
			// Callers already calling some function clone move to the new one,
			// taking their other callees in this function along.
			FuncInfo<F> previousAssignedFuncClone = null;
			for (var e : clone.callerEdges()) {
				var funcClone = callsiteToCalleeFuncClone.get(e.caller());
				if (funcClone != null) {
					previousAssignedFuncClone = funcClone;
					break;
				}
			}

			int cloneNo = funcCloneInfos.size();
			var newFuncClone = graph.adapter().cloneFunctionForCallsite(origFunc, call, callsWithMetadata, cloneNo);
			funcCloneInfos.add(newFuncClone);
			graph.stats().increment(Statistic.FUNCTION_CLONES);
			changed = true;
			logger.trace("Cloned {} as clone {} for node {}", origFunc.func(), cloneNo, clone.id());

			if (previousAssignedFuncClone == null) {
				assign(newFuncClone.func(), clone);
				recordCallersOf(clone, newFuncClone.func());
				return true;
			}

			for (var callerEdge : new ArrayList<>(clone.callerEdges())) {
				if (callerEdge.isRemoved() || !callerEdge.caller().hasCall()) {
					continue;
				}
				var caller = callerEdge.caller();
				if (!previousAssignedFuncClone.equals(callsiteToCalleeFuncClone.get(caller))) {
					continue;
				}
				callsiteToCalleeFuncClone.put(caller, newFuncClone.func());

				// The other callsites of this function reached from this caller
				// now have copies in the new function clone.
				for (var calleeEdge : new ArrayList<>(caller.calleeEdges())) {
					if (calleeEdge.isRemoved()) {
						continue;
					}
					var callee = calleeEdge.callee();
					if (callee == clone || !callee.hasCall() || callee == calleeEdge.caller()) {
						continue;
					}
					var newClone = graph.moveEdgeToNewCalleeClone(calleeEdge);
					graph.removeNoneTypeCalleeEdges(newClone);
					graph.removeNoneTypeCalleeEdges(callee);
					var calleeFuncClone = callsiteToCalleeFuncClone.get(callee);
					if (calleeFuncClone != null) {
						callsiteToCalleeFuncClone.put(newClone, calleeFuncClone);
					}
					var origNode = callee.origNode();
					var origCall = origCallOfNode.get(origNode);
					if (origCall == null) {
						continue;
					}
					newClone.setCall(newFuncClone.map(origCall));
					newClone.matchingCalls().clear();
					for (var matchingCall : origMatchingCallsOfNode.getOrDefault(origNode, List.of())) {
						newClone.matchingCalls().add(newFuncClone.map(matchingCall));
					}
				}
			}
			return false;
		}

		/**
		 * Assigns {@code clone} to the function clone its callers call, moving
		 * callers that call a different one onto further callsite clones.
		 */
		private void assignToCallersFuncClone(ContextNode<F, C> clone) {
			var funcCloneToNewCallsiteClone = new HashMap<FuncInfo<F>, ContextNode<F, C>>();
			FuncInfo<F> funcCloneAssignedToCurCallsiteClone = null;
			for (var edge : new ArrayList<>(clone.callerEdges())) {
				if (edge.isRemoved() || !edge.caller().hasCall()) {
					continue;
				}
				var funcCloneCalledByCaller = callsiteToCalleeFuncClone.get(edge.caller());
				if (funcCloneCalledByCaller != null) {
					var curNodeClone = funcCloneToCurNodeClone.get(funcCloneCalledByCaller);
					if ((curNodeClone != null && curNodeClone != clone)
							|| (funcCloneAssignedToCurCallsiteClone != null
									&& !funcCloneAssignedToCurCallsiteClone.equals(funcCloneCalledByCaller))) {
						// The caller keeps its function clone; the callsite is cloned
						// again so that clone can be placed in it later.
						var newClone = funcCloneToNewCallsiteClone.get(funcCloneCalledByCaller);
						if (newClone != null) {
							graph.moveEdgeToExistingCalleeClone(edge, newClone, false);
							graph.removeNoneTypeCalleeEdges(newClone);
						} else {
							newClone = graph.moveEdgeToNewCalleeClone(edge);
							graph.removeNoneTypeCalleeEdges(newClone);
							funcCloneToNewCallsiteClone.put(funcCloneCalledByCaller, newClone);
							clonesWorklist.add(newClone);
						}
						graph.removeNoneTypeCalleeEdges(clone);
						continue;
					}
					if (funcCloneAssignedToCurCallsiteClone == null) {
						funcCloneAssignedToCurCallsiteClone = funcCloneCalledByCaller;
						assign(funcCloneCalledByCaller, clone);
					}
				} else {
					if (funcCloneAssignedToCurCallsiteClone == null) {
						funcCloneAssignedToCurCallsiteClone = findFirstAvailFuncClone();
						assign(funcCloneAssignedToCurCallsiteClone, clone);
					}
					callsiteToCalleeFuncClone.put(edge.caller(), funcCloneAssignedToCurCallsiteClone);
				}
			}
			if (funcCloneAssignedToCurCallsiteClone == null) {
				assign(findFirstAvailFuncClone(), clone);
			}
		}
	}

	/** Writes the decisions back, visiting everything reachable from an allocation. */
	private void updateCalls() {
		var visited = new HashSet<ContextNode<F, C>>();
		for (var allocNode : graph.allocationNodes()) {
			updateCalls(allocNode, visited);
		}
	}

	private void updateCalls(ContextNode<F, C> node, Set<ContextNode<F, C>> visited) {
		if (!visited.add(node)) {
			return;
		}
		for (var clone : node.clones()) {
			updateCalls(clone, visited);
		}
		for (var edge : node.callerEdges()) {
			updateCalls(edge.caller(), visited);
		}
		if (!node.hasCall() || node.emptyContextIds()) {
			return;
		}
		var adapter = graph.adapter();
		if (node.isAllocation()) {
			var allocType = allocTypeToHint(node);
			graph.stats().increment(allocType == AllocationType.COLD ? Statistic.ALLOC_TYPE_COLD : Statistic.ALLOC_TYPE_NOT_COLD);
			adapter.updateAllocationCall(node.call(), allocType);
			changed = true;
			return;
		}
		var calleeFunc = callsiteToCalleeFuncClone.get(node);
		if (calleeFunc == null) {
			return;
		}
		adapter.updateCall(node.call(), calleeFunc);
		for (var matchingCall : node.matchingCalls()) {
			adapter.updateCall(matchingCall, calleeFunc);
		}
		changed = true;
	}

	/**
	 * The hint for an allocation node. An allocation still reached by both
	 * cold and not cold contexts may be promoted to cold by the configured
	 * policy, based on the bytes each kind of context allocated.
	 */
	private AllocationType allocTypeToHint(ContextNode<F, C> node) {
		var allocType = AllocationType.allocTypeToUse(node.allocTypes());
		var sizes = graph.contextIdToContextSizeInfos();
		if (node.allocTypes() != AllocationType.BOTH || sizes.isEmpty()) {
			return allocType;
		}
		long totalCold = 0;
		long total = 0;
		for (int id : node.getContextIds()) {
			var infos = sizes.get(id);
			if (infos == null) {
				continue;
			}
			boolean cold = graph.allocationType(id) == AllocationType.COLD;
			for (var info : infos) {
				total += info.totalSize();
				if (cold) {
					totalCold += info.totalSize();
				}
			}
		}
		if (total > 0 && options.coldPromotionPolicy().promoteToCold(totalCold, total)) {
			return AllocationType.COLD;
		}
		return allocType;
	}
}
