package edu.cmu.cs.cs15745.memprof.summary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.memprof.summary.SummaryRecord.AllocInfo;
import edu.cmu.cs.cs15745.memprof.summary.SummaryRecord.CallsiteInfo;

/**
 * The summary of one function: its profiled allocations and callsites, and
 * the edges of the call graph leaving it.
 */
public final class FunctionSummary {
	private final String name;
	private final List<AllocInfo> allocs;
	private final List<CallsiteInfo> callsites;
	private final List<CallEdge> calls;

	public FunctionSummary(String name, List<AllocInfo> allocs, List<CallsiteInfo> callsites, List<CallEdge> calls) {
		this.name = Objects.requireNonNull(name);
		this.allocs = List.copyOf(allocs);
		this.callsites = new ArrayList<>(callsites);
		this.calls = List.copyOf(calls);
	}

	public String name() {
		return name;
	}

	public List<AllocInfo> allocs() {
		return allocs;
	}

	public List<CallsiteInfo> callsites() {
		return Collections.unmodifiableList(callsites);
	}

	void addCallsite(CallsiteInfo callsite) {
		callsites.add(callsite);
	}

	public List<CallEdge> calls() {
		return calls;
	}

	@Override
	public String toString() {
		return name;
	}

	/** A call graph edge to {@code callee}. */
	public static final class CallEdge {
		private final String callee;
		private final boolean tailCall;

		public CallEdge(String callee, boolean tailCall) {
			this.callee = Objects.requireNonNull(callee);
			this.tailCall = tailCall;
		}

		public String callee() {
			return callee;
		}

		public boolean isTailCall() {
			return tailCall;
		}

		@Override
		public String toString() {
			return (tailCall ? "tail " : "") + callee;
		}
	}
}
