package edu.cmu.cs.cs15745.memprof.summary;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole program summary: function summaries by name and the table of stack
 * ids the records index into.
 */
public final class SummaryIndex {
	private final List<Long> stackIds;
	private final Map<String, FunctionSummary> functions = new LinkedHashMap<>();

	public SummaryIndex(List<Long> stackIds, List<FunctionSummary> functions) {
		this.stackIds = List.copyOf(stackIds);
		for (var f : functions) {
			if (this.functions.putIfAbsent(f.name(), f) != null) {
				throw new IllegalArgumentException("Function summarized twice: " + f.name());
			}
		}
	}

	public long getStackIdAtIndex(long index) {
		if (index < 0 || index >= stackIds.size()) {
			throw new IndexOutOfBoundsException("Stack id index " + index + " out of " + stackIds.size());
		}
		return stackIds.get((int) index);
	}

	/** The summary of {@code name}, or null if it is not in the index. */
	public FunctionSummary function(String name) {
		return functions.get(name);
	}

	public Collection<FunctionSummary> functions() {
		return Collections.unmodifiableCollection(functions.values());
	}
}
