package edu.cmu.cs.cs15745.memprof;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One profiled context of an allocation: the stack ids (or stack id indices)
 * from the allocation call outwards, and its allocation behavior.
 */
public final class MibRecord {
	private final List<Long> stackIds;
	private final AllocationType allocType;
	private final List<ContextSizeInfo> contextSizeInfos;

	public MibRecord(List<Long> stackIds, AllocationType allocType) {
		this(stackIds, allocType, List.of());
	}

	public MibRecord(List<Long> stackIds, AllocationType allocType, List<ContextSizeInfo> contextSizeInfos) {
		this.stackIds = List.copyOf(stackIds);
		this.allocType = Objects.requireNonNull(allocType);
		this.contextSizeInfos = new ArrayList<>(contextSizeInfos);
	}

	public List<Long> stackIds() {
		return stackIds;
	}

	public AllocationType allocType() {
		return allocType;
	}

	public List<ContextSizeInfo> contextSizeInfos() {
		return contextSizeInfos;
	}

	@Override
	public String toString() {
		return String.format("MIB %s %s", stackIds, allocType);
	}
}
