package edu.cmu.cs.cs15745.memprof;

import java.util.List;
import java.util.Objects;

/**
 * A call carrying memory profile metadata. It is one of:
 * <ul>
 * <li>an allocation, with the MIBs profiled for it.</li>
 * <li>an interior callsite, with its own stack id sequence.</li>
 * </ul>
 */
public abstract class ProfiledCall<C> {
	private final C call;

	private ProfiledCall(C call) {
		this.call = Objects.requireNonNull(call);
	}

	public C call() {
		return call;
	}

	public abstract boolean isAllocation();

	public static <C> Allocation<C> allocation(C call, List<MibRecord> mibs, List<Long> callsiteContext) {
		return new Allocation<>(call, mibs, callsiteContext);
	}

	public static <C> Callsite<C> callsite(C call, List<Long> stackIds) {
		return new Callsite<>(call, stackIds);
	}

	public static final class Allocation<C> extends ProfiledCall<C> {
		private final List<MibRecord> mibs;
		// Stack ids inlined into the allocation call itself, shared by every MIB.
		private final List<Long> callsiteContext;

		private Allocation(C call, List<MibRecord> mibs, List<Long> callsiteContext) {
			super(call);
			this.mibs = List.copyOf(mibs);
			this.callsiteContext = List.copyOf(callsiteContext);
		}

		public List<MibRecord> mibs() {
			return mibs;
		}

		public List<Long> callsiteContext() {
			return callsiteContext;
		}

		@Override
		public boolean isAllocation() {
			return true;
		}
	}

	public static final class Callsite<C> extends ProfiledCall<C> {
		private final List<Long> stackIds;

		private Callsite(C call, List<Long> stackIds) {
			super(call);
			this.stackIds = List.copyOf(stackIds);
		}

		/** Stack ids (or indices) from the call outwards. */
		public List<Long> stackIds() {
			return stackIds;
		}

		@Override
		public boolean isAllocation() {
			return false;
		}
	}
}
