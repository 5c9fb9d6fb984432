package edu.cmu.cs.cs15745.memprof.summary;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.memprof.AllocationType;
import edu.cmu.cs.cs15745.memprof.CallInfo;
import edu.cmu.cs.cs15745.memprof.CallsiteAdapter;
import edu.cmu.cs.cs15745.memprof.DisambiguationOptions;
import edu.cmu.cs.cs15745.memprof.FuncInfo;
import edu.cmu.cs.cs15745.memprof.FunctionClone;
import edu.cmu.cs.cs15745.memprof.ModuleProfile;
import edu.cmu.cs.cs15745.memprof.ProfiledCall;
import edu.cmu.cs.cs15745.memprof.Statistic;
import edu.cmu.cs.cs15745.memprof.Statistics;
import edu.cmu.cs.cs15745.memprof.TailCallFrame;
import edu.cmu.cs.cs15745.memprof.summary.SummaryRecord.AllocInfo;
import edu.cmu.cs.cs15745.memprof.summary.SummaryRecord.CallsiteInfo;

/**
 * Runs the disambiguation on a {@link SummaryIndex}. Nothing is copied:
 * cloning a function grows the versions of its allocations and the clones of
 * its callsites, to be materialized when the functions are compiled.
 */
public final class SummaryCallsiteAdapter implements CallsiteAdapter<FunctionSummary, SummaryRecord> {
	private static final Logger logger = LogManager.getLogger(SummaryCallsiteAdapter.class);

	private final SummaryIndex index;
	private final DisambiguationOptions options;
	private final Statistics stats;

	// Callsites made up for frames found through tail calls, by caller and callee.
	private final Map<FunctionSummary, Map<String, CallsiteInfo>> synthesizedCallsites = new HashMap<>();

	public SummaryCallsiteAdapter(SummaryIndex index, DisambiguationOptions options, Statistics stats) {
		this.index = Objects.requireNonNull(index);
		this.options = Objects.requireNonNull(options);
		this.stats = Objects.requireNonNull(stats);
	}

	/** The profiled records of every function summary, in index order. */
	public static ModuleProfile<FunctionSummary, SummaryRecord> profile(SummaryIndex index) {
		var profile = new ModuleProfile<FunctionSummary, SummaryRecord>();
		for (var function : index.functions()) {
			var calls = new ArrayList<ProfiledCall<SummaryRecord>>();
			for (var alloc : function.allocs()) {
				if (!alloc.mibs().isEmpty()) {
					// Summary MIBs carry no inlined callsite context of their own.
					calls.add(ProfiledCall.allocation(alloc, alloc.mibs(), List.of()));
				}
			}
			for (var callsite : function.callsites()) {
				if (!callsite.stackIdIndices().isEmpty()) {
					calls.add(ProfiledCall.callsite(callsite, callsite.stackIdIndices()));
				}
			}
			profile.add(function, calls);
		}
		return profile;
	}

	/**
	 * Indirect callsites, one per profiled target, that some function clone
	 * must call a callee clone through. The indirect call has to be promoted
	 * to a direct call for those.
	 */
	public List<CallsiteInfo> icpRecords() {
		var result = new ArrayList<CallsiteInfo>();
		for (var function : index.functions()) {
			for (var callsite : function.callsites()) {
				if (callsite.isIndirect() && callsite.clones().stream().anyMatch(c -> c != 0)) {
					result.add(callsite);
				}
			}
		}
		return result;
	}

	@Override
	public long getStackId(long idOrIndex) {
		return index.getStackIdAtIndex(idOrIndex);
	}

	@Override
	public FunctionSummary getCalleeFunc(SummaryRecord call) {
		if (!(call instanceof CallsiteInfo)) {
			return null;
		}
		return index.function(((CallsiteInfo) call).callee());
	}

	@Override
	public boolean calleeMatchesFunc(SummaryRecord call, FunctionSummary func, FunctionSummary callerFunc,
			List<TailCallFrame<FunctionSummary, SummaryRecord>> foundCalleeChain) {
		var callee = ((CallsiteInfo) call).callee();
		if (callee.equals(func.name())) {
			return true;
		}
		var search = new TailCallSearch(func, foundCalleeChain);
		if (!search.find(callee, 1)) {
			logger.debug("Not found through unique tail call chain: {} from {} that actually called {}{}",
					func.name(), callerFunc.name(), callee,
					search.foundMultipleCalleeChains ? " (found multiple possible chains)" : "");
			if (search.foundMultipleCalleeChains) {
				stats.increment(Statistic.FOUND_PROFILED_CALLEE_NON_UNIQUELY_COUNT);
			}
			return false;
		}
		return true;
	}

	private final class TailCallSearch {
		private final FunctionSummary profiledCallee;
		private final List<TailCallFrame<FunctionSummary, SummaryRecord>> foundCalleeChain;
		private boolean foundMultipleCalleeChains = false;

		TailCallSearch(FunctionSummary profiledCallee,
				List<TailCallFrame<FunctionSummary, SummaryRecord>> foundCalleeChain) {
			this.profiledCallee = profiledCallee;
			this.foundCalleeChain = foundCalleeChain;
		}

		boolean find(String curCallee, int depth) {
			if (depth > options.tailCallSearchDepth()) {
				return false;
			}
			var fs = index.function(curCallee);
			// Externally defined.
			if (fs == null) {
				return false;
			}
			boolean foundSingleCalleeChain = false;
			for (var edge : fs.calls()) {
				if (!edge.isTailCall()) {
					continue;
				}
				if (edge.callee().equals(profiledCallee.name())) {
					if (foundSingleCalleeChain) {
						foundMultipleCalleeChains = true;
						return false;
					}
					foundSingleCalleeChain = true;
					stats.increment(Statistic.FOUND_PROFILED_CALLEE_COUNT);
					stats.add(Statistic.FOUND_PROFILED_CALLEE_DEPTH, depth);
					stats.max(Statistic.FOUND_PROFILED_CALLEE_MAX_DEPTH, depth);
					saveCallsite(edge.callee(), fs);
				} else if (find(edge.callee(), depth + 1)) {
					if (foundSingleCalleeChain) {
						foundMultipleCalleeChains = true;
						return false;
					}
					foundSingleCalleeChain = true;
					saveCallsite(edge.callee(), fs);
				} else if (foundMultipleCalleeChains) {
					return false;
				}
			}
			return foundSingleCalleeChain;
		}

		private void saveCallsite(String callee, FunctionSummary fs) {
			var byCallee = synthesizedCallsites.computeIfAbsent(fs, unused -> new LinkedHashMap<>());
			var callsite = byCallee.get(callee);
			if (callsite == null) {
				// No stack ids: the index has no debug info for these callsites.
				callsite = new CallsiteInfo(callee, List.of(), false);
				byCallee.put(callee, callsite);
				fs.addCallsite(callsite);
			}
			foundCalleeChain.add(new TailCallFrame<>(callsite, fs));
		}
	}

	@Override
	public boolean sameCallee(SummaryRecord call1, SummaryRecord call2) {
		if (!(call1 instanceof CallsiteInfo) || !(call2 instanceof CallsiteInfo)) {
			return false;
		}
		return ((CallsiteInfo) call1).callee().equals(((CallsiteInfo) call2).callee());
	}

	@Override
	public FunctionClone<FunctionSummary, SummaryRecord> cloneFunctionForCallsite(FuncInfo<FunctionSummary> func,
			CallInfo<SummaryRecord> call, List<CallInfo<SummaryRecord>> callsInFunc, int cloneNo) {
		var callMap = new LinkedHashMap<CallInfo<SummaryRecord>, CallInfo<SummaryRecord>>();
		for (var inst : callsInFunc) {
			// The version or callee clone is decided later; only make room for it.
			if (inst.call() instanceof AllocInfo) {
				((AllocInfo) inst.call()).addVersion(cloneNo);
			} else {
				((CallsiteInfo) inst.call()).addClone(cloneNo);
			}
			callMap.put(inst, inst.withCloneNo(cloneNo));
		}
		return new FunctionClone<>(FuncInfo.of(func.func(), cloneNo), callMap);
	}

	@Override
	public void updateAllocationCall(CallInfo<SummaryRecord> call, AllocationType allocType) {
		((AllocInfo) call.call()).setVersion(call.cloneNo(), AllocationType.allocTypeToUse(allocType.bit()).bit());
	}

	@Override
	public AllocationType getAllocationCallType(CallInfo<SummaryRecord> call) {
		return AllocationType.fromBit(((AllocInfo) call.call()).version(call.cloneNo()));
	}

	@Override
	public void updateCall(CallInfo<SummaryRecord> callerCall, FuncInfo<FunctionSummary> calleeFunc) {
		var callsite = (CallsiteInfo) callerCall.call();
		int newCalleeCloneNo = calleeFunc.cloneNo();
		int curCalleeCloneNo = callsite.clone(callerCall.cloneNo());
		if (curCalleeCloneNo != 0 && curCalleeCloneNo != newCalleeCloneNo) {
			stats.increment(Statistic.MISMATCHED_CLONE_ASSIGNMENTS);
			logger.warn("Callsite {} clone {} already assigned to callee clone {}, now reassigned to {}",
					callsite, callerCall.cloneNo(), curCalleeCloneNo, newCalleeCloneNo);
		}
		callsite.setClone(callerCall.cloneNo(), newCalleeCloneNo);
	}

	@Override
	public void onAllocationNodeBuilt(SummaryRecord call, int allocTypes) {
		// Unless the allocation is cloned, version 0 keeps the default behavior
		// for ambiguous contexts.
		((AllocInfo) call).setVersion(0, AllocationType.allocTypeToUse(allocTypes).bit());
	}

	@Override
	public String getLabel(FunctionSummary func, SummaryRecord call, int cloneNo) {
		var name = cloneNo == 0 ? func.name() : func.name() + ".memprof." + cloneNo;
		if (call instanceof AllocInfo) {
			return name + " -> alloc";
		}
		return name + " -> " + ((CallsiteInfo) call).callee();
	}
}
