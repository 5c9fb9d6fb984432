package edu.cmu.cs.cs15745.memprof;

/** Counters collected while disambiguating one module. */
public enum Statistic {
	FUNCTION_CLONES("Number of function clones created during whole program analysis"),
	NODE_CLONES("Number of context node clones created"),
	ALLOC_TYPE_NOT_COLD("Number of not cold static allocations (possibly cloned)"),
	ALLOC_TYPE_COLD("Number of cold static allocations (possibly cloned)"),
	REMOVED_EDGES_WITH_MISMATCHED_CALLEES("Number of edges removed due to mismatched callees (profiled vs IR)"),
	FOUND_PROFILED_CALLEE_COUNT("Number of profiled callees found via tail calls"),
	FOUND_PROFILED_CALLEE_DEPTH("Aggregate depth of profiled callees found via tail calls"),
	FOUND_PROFILED_CALLEE_MAX_DEPTH("Maximum depth of profiled callees found via tail calls"),
	FOUND_PROFILED_CALLEE_NON_UNIQUELY_COUNT("Number of profiled callees found via multiple tail call chains"),
	DEFERRED_BACKEDGES("Number of backedges with deferred cloning"),
	NEW_MERGED_NODES("Number of new nodes created during merging"),
	NON_NEW_MERGED_NODES("Number of non new nodes used during merging"),
	MISSING_ALLOC_FOR_CONTEXT_ID("Number of missing alloc nodes for context ids"),
	MISMATCHED_CLONE_ASSIGNMENTS("Number of callsites assigned to call multiple non-matching clones"),
	SKIPPED_RECURSIVE_CONTEXTS("Number of recursive contexts left uncloned");

	private final String description;

	Statistic(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}
