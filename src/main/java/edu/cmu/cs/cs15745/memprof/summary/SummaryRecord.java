package edu.cmu.cs.cs15745.memprof.summary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.cmu.cs.cs15745.memprof.MibRecord;

/**
 * A profiled record of a function summary, either an allocation or a
 * callsite. Records are compared by identity.
 */
public abstract class SummaryRecord {
	// Disallow external subclassing.
	private SummaryRecord() {
	}

	/**
	 * An allocation: its MIBs, with stack ids given as indices into the stack
	 * id table, and the allocation type chosen for each function clone.
	 */
	public static final class AllocInfo extends SummaryRecord {
		private final List<MibRecord> mibs;
		// Indexed by function clone number; holds AllocationType bits, 0 if unset.
		private final List<Integer> versions = new ArrayList<>(List.of(0));

		public AllocInfo(List<MibRecord> mibs) {
			this.mibs = List.copyOf(mibs);
		}

		public List<MibRecord> mibs() {
			return mibs;
		}

		public List<Integer> versions() {
			return Collections.unmodifiableList(versions);
		}

		void setVersion(int cloneNo, int allocType) {
			grow(versions, cloneNo);
			versions.set(cloneNo, allocType);
		}

		int version(int cloneNo) {
			return cloneNo < versions.size() ? versions.get(cloneNo) : 0;
		}

		void addVersion(int cloneNo) {
			grow(versions, cloneNo);
		}

		@Override
		public String toString() {
			return String.format("alloc versions %s", versions);
		}
	}

	/**
	 * A callsite: the profiled callee, the stack id indices of the call, and
	 * the callee clone each clone of the call targets.
	 */
	public static final class CallsiteInfo extends SummaryRecord {
		private final String callee;
		private final List<Long> stackIdIndices;
		private final boolean indirect;
		// Indexed by function clone number; 0 is the original callee.
		private final List<Integer> clones = new ArrayList<>(List.of(0));

		// An indirect call has one record per profiled target.
		public CallsiteInfo(String callee, List<Long> stackIdIndices, boolean indirect) {
			this.callee = Objects.requireNonNull(callee);
			this.stackIdIndices = List.copyOf(stackIdIndices);
			this.indirect = indirect;
		}

		public String callee() {
			return callee;
		}

		public List<Long> stackIdIndices() {
			return stackIdIndices;
		}

		public boolean isIndirect() {
			return indirect;
		}

		public List<Integer> clones() {
			return Collections.unmodifiableList(clones);
		}

		int clone(int cloneNo) {
			return cloneNo < clones.size() ? clones.get(cloneNo) : 0;
		}

		void setClone(int cloneNo, int calleeCloneNo) {
			grow(clones, cloneNo);
			clones.set(cloneNo, calleeCloneNo);
		}

		void addClone(int cloneNo) {
			grow(clones, cloneNo);
		}

		@Override
		public String toString() {
			return String.format("callsite %s%s %s clones %s", indirect ? "indirect " : "", callee, stackIdIndices, clones);
		}
	}

	private static void grow(List<Integer> list, int index) {
		while (list.size() <= index) {
			list.add(0);
		}
	}
}
