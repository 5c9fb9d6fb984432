package edu.cmu.cs.cs15745.memprof.ir;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
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
import edu.cmu.cs.cs15745.memprof.ir.Ir.Function;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Instruction;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Instruction.Allocation;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Instruction.Call;

/**
 * Runs the disambiguation directly on an {@link Ir} program. Function clones
 * are real copies named {@code <name>.memprof.<n>}, added to the program;
 * allocation hints are written to the allocation's memprof attribute.
 */
public final class IrCallsiteAdapter implements CallsiteAdapter<Function, Instruction> {
	private static final Logger logger = LogManager.getLogger(IrCallsiteAdapter.class);
	private static final String MEMPROF_CLONE_SUFFIX = ".memprof.";

	private final Ir ir;
	private final DisambiguationOptions options;
	private final Statistics stats;

	public IrCallsiteAdapter(Ir ir, DisambiguationOptions options, Statistics stats) {
		this.ir = Objects.requireNonNull(ir);
		this.options = Objects.requireNonNull(options);
		this.stats = Objects.requireNonNull(stats);
	}

	/** The profiled calls of every function of {@code ir}, in program order. */
	public static ModuleProfile<Function, Instruction> profile(Ir ir) {
		var profile = new ModuleProfile<Function, Instruction>();
		for (var function : ir.functions()) {
			var calls = new ArrayList<ProfiledCall<Instruction>>();
			var visitor = new Instruction.StatefulVisitor() {
				@Override
				public void iterAllocation(Allocation a) {
					if (!a.mibs().isEmpty()) {
						calls.add(ProfiledCall.allocation(a, a.mibs(), a.callsiteStackIds()));
					}
				}

				@Override
				public void iterCall(Call c) {
					if (!c.stackIds().isEmpty()) {
						calls.add(ProfiledCall.callsite(c, c.stackIds()));
					}
				}
			}.visitor();
			for (var i : function.instructions()) {
				i.accept(visitor);
			}
			profile.add(function, calls);
		}
		return profile;
	}

	public static String cloneName(String name, int cloneNo) {
		return name + MEMPROF_CLONE_SUFFIX + cloneNo;
	}

	public static boolean isMemProfClone(Function f) {
		return f.name().contains(MEMPROF_CLONE_SUFFIX);
	}

	/** The clone number of a memprof clone, 0 for an original function. */
	public static int getMemProfCloneNum(Function f) {
		int pos = f.name().lastIndexOf(MEMPROF_CLONE_SUFFIX);
		if (pos < 0) {
			return 0;
		}
		return Integer.parseInt(f.name().substring(pos + MEMPROF_CLONE_SUFFIX.length()));
	}

	@Override
	public long getStackId(long idOrIndex) {
		return idOrIndex;
	}

	@Override
	public Function getCalleeFunc(Instruction call) {
		if (!(call instanceof Call)) {
			return null;
		}
		return ((Call) call).callee().map(ir::functionOrNull).orElse(null);
	}

	@Override
	public boolean calleeMatchesFunc(Instruction call, Function func, Function callerFunc,
			List<TailCallFrame<Function, Instruction>> foundCalleeChain) {
		if (!(call instanceof Call) || ((Call) call).isIndirect()) {
			return false;
		}
		var callee = getCalleeFunc(call);
		if (callee == func) {
			return true;
		}
		var search = new TailCallSearch(func, foundCalleeChain);
		if (!search.find(callee, 1)) {
			logger.debug("Not found through unique tail call chain: {} from {} that actually called {}{}",
					func.name(), callerFunc.name(), ((Call) call).callee().get(),
					search.foundMultipleCalleeChains ? " (found multiple possible chains)" : "");
			if (search.foundMultipleCalleeChains) {
				stats.increment(Statistic.FOUND_PROFILED_CALLEE_NON_UNIQUELY_COUNT);
			}
			return false;
		}
		return true;
	}

	/** Depth first search for a unique chain of tail calls reaching the profiled callee. */
	private final class TailCallSearch {
		private final Function profiledCallee;
		private final List<TailCallFrame<Function, Instruction>> foundCalleeChain;
		private boolean foundMultipleCalleeChains = false;

		TailCallSearch(Function profiledCallee, List<TailCallFrame<Function, Instruction>> foundCalleeChain) {
			this.profiledCallee = profiledCallee;
			this.foundCalleeChain = foundCalleeChain;
		}

		boolean find(Function curCallee, int depth) {
			if (depth > options.tailCallSearchDepth() || curCallee == null) {
				return false;
			}
			boolean foundSingleCalleeChain = false;
			for (var i : curCallee.instructions()) {
				if (!(i instanceof Call)) {
					continue;
				}
				var call = (Call) i;
				if (!call.isTailCall() || call.isIndirect()) {
					continue;
				}
				var calledFunction = ir.functionOrNull(call.callee().get());
				if (calledFunction == null) {
					continue;
				}
				if (calledFunction == profiledCallee) {
					if (foundSingleCalleeChain) {
						foundMultipleCalleeChains = true;
						return false;
					}
					foundSingleCalleeChain = true;
					stats.increment(Statistic.FOUND_PROFILED_CALLEE_COUNT);
					stats.add(Statistic.FOUND_PROFILED_CALLEE_DEPTH, depth);
					stats.max(Statistic.FOUND_PROFILED_CALLEE_MAX_DEPTH, depth);
					foundCalleeChain.add(new TailCallFrame<>(call, curCallee));
				} else if (find(calledFunction, depth + 1)) {
					if (foundSingleCalleeChain) {
						foundMultipleCalleeChains = true;
						return false;
					}
					foundSingleCalleeChain = true;
					foundCalleeChain.add(new TailCallFrame<>(call, curCallee));
				} else if (foundMultipleCalleeChains) {
					return false;
				}
			}
			return foundSingleCalleeChain;
		}
	}

	@Override
	public boolean sameCallee(Instruction call1, Instruction call2) {
		if (!(call1 instanceof Call) || !(call2 instanceof Call)) {
			return false;
		}
		var c1 = (Call) call1;
		var c2 = (Call) call2;
		return !c1.isIndirect() && c1.callee().equals(c2.callee());
	}

	@Override
	public FunctionClone<Function, Instruction> cloneFunctionForCallsite(FuncInfo<Function> func,
			CallInfo<Instruction> call, List<CallInfo<Instruction>> callsInFunc, int cloneNo) {
		var copies = new IdentityHashMap<Instruction, Instruction>();
		var newFunc = func.func().copy(cloneName(func.func().name(), cloneNo), copies);
		ir.add(newFunc);
		var callMap = new LinkedHashMap<CallInfo<Instruction>, CallInfo<Instruction>>();
		for (var inst : callsInFunc) {
			var copy = Objects.requireNonNull(copies.get(inst.call()), "call not in function");
			callMap.put(inst, CallInfo.of(copy, cloneNo));
		}
		logger.debug("Created function clone {} for call {}", newFunc.name(), call.call());
		return new FunctionClone<>(FuncInfo.of(newFunc, cloneNo), callMap);
	}

	@Override
	public void updateAllocationCall(CallInfo<Instruction> call, AllocationType allocType) {
		var alloc = (Allocation) call.call();
		alloc.setMemprofAttribute(allocType == AllocationType.COLD ? "cold" : "notcold");
		logger.debug("Hinted {} as {}", alloc, allocType);
	}

	@Override
	public AllocationType getAllocationCallType(CallInfo<Instruction> call) {
		var attr = ((Allocation) call.call()).memprofAttribute();
		if (attr.isEmpty()) {
			return AllocationType.NONE;
		}
		return attr.get().equals("cold") ? AllocationType.COLD : AllocationType.NOT_COLD;
	}

	@Override
	public void updateCall(CallInfo<Instruction> callerCall, FuncInfo<Function> calleeFunc) {
		var call = (Call) callerCall.call();
		var curF = getCalleeFunc(call);
		int newCalleeCloneNo = calleeFunc.cloneNo();
		if (curF != null && isMemProfClone(curF)) {
			int curCalleeCloneNo = getMemProfCloneNum(curF);
			if (curCalleeCloneNo != newCalleeCloneNo) {
				stats.increment(Statistic.MISMATCHED_CLONE_ASSIGNMENTS);
				logger.warn("Call {} already assigned to clone {}, now reassigned to {}",
						call, curCalleeCloneNo, newCalleeCloneNo);
			}
		}
		if (newCalleeCloneNo > 0) {
			call.setCallee(calleeFunc.func().name());
		}
	}

	@Override
	public String getLabel(Function func, Instruction call, int cloneNo) {
		var callee = call.accept(new Instruction.Visitor<String>() {
			@Override
			public String visitAllocation(Allocation a) {
				return "new " + a.type();
			}

			@Override
			public String visitCall(Call c) {
				return c.callee().orElse("*indirect");
			}
		});
		return func.name() + " -> " + callee;
	}
}
