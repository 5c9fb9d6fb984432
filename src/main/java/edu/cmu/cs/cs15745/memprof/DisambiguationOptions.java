package edu.cmu.cs.cs15745.memprof;

import java.util.Objects;

/**
 * Tuning knobs and debugging switches for one disambiguation run. Build with
 * {@link #builder()}; every field has a default.
 */
public final class DisambiguationOptions {

	/** How much of the graph to export to dot. */
	public enum DotScope {
		ALL,     // The full graph.
		ALLOC,   // Only contexts of allocIdForDot.
		CONTEXT, // Only contextIdForDot.
	}

	/**
	 * Decides whether a context carrying allocation types {@code wanted} along
	 * some callee edge can share a node whose corresponding edge carries
	 * {@code existing}. Used when looking for a clone to reuse.
	 */
	@FunctionalInterface
	public interface CloneReuseMatcher {
		boolean matches(int wanted, int existing);

		/** None matches anything; otherwise the types to use must agree. */
		CloneReuseMatcher DEFAULT = AllocationType::allocTypeMatches;
	}

	/** Decides whether an allocation that stayed ambiguous is hinted cold anyway. */
	@FunctionalInterface
	public interface ColdPromotionPolicy {
		boolean promoteToCold(long totalColdBytes, long totalBytes);

		static ColdPromotionPolicy minColdBytePercent(int percent) {
			return (cold, total) -> percent < 100 && cold * 100 >= total * percent;
		}
	}

	private final int tailCallSearchDepth;
	private final boolean allowRecursiveCallsites;
	private final boolean cloneRecursiveContexts;
	private final boolean allowRecursiveContexts;
	private final boolean mergeClones;
	private final boolean verifyCCG;
	private final boolean verifyNodes;
	private final boolean dumpCCG;
	private final boolean exportToDot;
	private final DotScope dotScope;
	private final Long allocIdForDot;
	private final Integer contextIdForDot;
	private final String dotFilePathPrefix;
	private final int minClonedColdBytePercent;
	private final boolean reportHintedSizes;
	private final CloneReuseMatcher cloneReuseMatcher;
	private final ColdPromotionPolicy coldPromotionPolicy;
	private final boolean customColdPromotion;

	private DisambiguationOptions(Builder b) {
		this.tailCallSearchDepth = b.tailCallSearchDepth;
		this.allowRecursiveCallsites = b.allowRecursiveCallsites;
		this.cloneRecursiveContexts = b.cloneRecursiveContexts;
		this.allowRecursiveContexts = b.allowRecursiveContexts;
		this.mergeClones = b.mergeClones;
		this.verifyCCG = b.verifyCCG;
		this.verifyNodes = b.verifyNodes;
		this.dumpCCG = b.dumpCCG;
		this.exportToDot = b.exportToDot;
		this.dotScope = b.dotScope;
		this.allocIdForDot = b.allocIdForDot;
		this.contextIdForDot = b.contextIdForDot;
		this.dotFilePathPrefix = b.dotFilePathPrefix;
		this.minClonedColdBytePercent = b.minClonedColdBytePercent;
		this.reportHintedSizes = b.reportHintedSizes;
		this.cloneReuseMatcher = b.cloneReuseMatcher;
		this.customColdPromotion = b.coldPromotionPolicy != null;
		this.coldPromotionPolicy = b.coldPromotionPolicy != null
				? b.coldPromotionPolicy
				: ColdPromotionPolicy.minColdBytePercent(b.minClonedColdBytePercent);
	}

	public static DisambiguationOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public int tailCallSearchDepth() {
		return tailCallSearchDepth;
	}

	public boolean allowRecursiveCallsites() {
		return allowRecursiveCallsites;
	}

	public boolean cloneRecursiveContexts() {
		return cloneRecursiveContexts;
	}

	public boolean allowRecursiveContexts() {
		return allowRecursiveContexts;
	}

	public boolean mergeClones() {
		return mergeClones;
	}

	public boolean verifyCCG() {
		return verifyCCG;
	}

	public boolean verifyNodes() {
		return verifyNodes;
	}

	public boolean dumpCCG() {
		return dumpCCG;
	}

	public boolean exportToDot() {
		return exportToDot;
	}

	public DotScope dotScope() {
		return dotScope;
	}

	public boolean hasAllocIdForDot() {
		return allocIdForDot != null;
	}

	public long allocIdForDot() {
		return allocIdForDot == null ? 0 : allocIdForDot;
	}

	public boolean hasContextIdForDot() {
		return contextIdForDot != null;
	}

	public int contextIdForDot() {
		return contextIdForDot == null ? 0 : contextIdForDot;
	}

	public String dotFilePathPrefix() {
		return dotFilePathPrefix;
	}

	public int minClonedColdBytePercent() {
		return minClonedColdBytePercent;
	}

	public boolean reportHintedSizes() {
		return reportHintedSizes;
	}

	/** Whether per-context total sizes need to be kept at all. */
	public boolean recordContextSizes() {
		return reportHintedSizes || minClonedColdBytePercent < 100 || customColdPromotion;
	}

	public CloneReuseMatcher cloneReuseMatcher() {
		return cloneReuseMatcher;
	}

	public ColdPromotionPolicy coldPromotionPolicy() {
		return coldPromotionPolicy;
	}

	public static final class Builder {
		private int tailCallSearchDepth = 5;
		private boolean allowRecursiveCallsites = true;
		private boolean cloneRecursiveContexts = true;
		private boolean allowRecursiveContexts = true;
		private boolean mergeClones = true;
		private boolean verifyCCG = false;
		private boolean verifyNodes = false;
		private boolean dumpCCG = false;
		private boolean exportToDot = false;
		private DotScope dotScope = DotScope.ALL;
		private Long allocIdForDot = null;
		private Integer contextIdForDot = null;
		private String dotFilePathPrefix = "";
		private int minClonedColdBytePercent = 100;
		private boolean reportHintedSizes = false;
		private CloneReuseMatcher cloneReuseMatcher = CloneReuseMatcher.DEFAULT;
		private ColdPromotionPolicy coldPromotionPolicy = null;

		private Builder() { }

		public Builder tailCallSearchDepth(int depth) {
			this.tailCallSearchDepth = depth;
			return this;
		}

		public Builder allowRecursiveCallsites(boolean allow) {
			this.allowRecursiveCallsites = allow;
			return this;
		}

		public Builder cloneRecursiveContexts(boolean clone) {
			this.cloneRecursiveContexts = clone;
			return this;
		}

		public Builder allowRecursiveContexts(boolean allow) {
			this.allowRecursiveContexts = allow;
			return this;
		}

		public Builder mergeClones(boolean merge) {
			this.mergeClones = merge;
			return this;
		}

		public Builder verifyCCG(boolean verify) {
			this.verifyCCG = verify;
			return this;
		}

		public Builder verifyNodes(boolean verify) {
			this.verifyNodes = verify;
			return this;
		}

		public Builder dumpCCG(boolean dump) {
			this.dumpCCG = dump;
			return this;
		}

		public Builder exportToDot(boolean export) {
			this.exportToDot = export;
			return this;
		}

		public Builder dotScope(DotScope scope) {
			this.dotScope = Objects.requireNonNull(scope);
			return this;
		}

		public Builder allocIdForDot(long allocId) {
			this.allocIdForDot = allocId;
			return this;
		}

		public Builder contextIdForDot(int contextId) {
			this.contextIdForDot = contextId;
			return this;
		}

		public Builder dotFilePathPrefix(String prefix) {
			this.dotFilePathPrefix = Objects.requireNonNull(prefix);
			return this;
		}

		public Builder minClonedColdBytePercent(int percent) {
			this.minClonedColdBytePercent = percent;
			return this;
		}

		public Builder reportHintedSizes(boolean report) {
			this.reportHintedSizes = report;
			return this;
		}

		public Builder cloneReuseMatcher(CloneReuseMatcher matcher) {
			this.cloneReuseMatcher = Objects.requireNonNull(matcher);
			return this;
		}

		public Builder coldPromotionPolicy(ColdPromotionPolicy policy) {
			this.coldPromotionPolicy = Objects.requireNonNull(policy);
			return this;
		}

		public DisambiguationOptions build() {
			if (tailCallSearchDepth < 0) {
				throw new IllegalArgumentException("Negative tail call search depth: " + tailCallSearchDepth);
			}
			if (minClonedColdBytePercent < 0 || minClonedColdBytePercent > 100) {
				throw new IllegalArgumentException("Cold byte percent out of range: " + minClonedColdBytePercent);
			}
			if (!allowRecursiveContexts && cloneRecursiveContexts) {
				throw new IllegalArgumentException("Cloning recursive contexts requires allowing them");
			}
			if (dotScope == DotScope.ALLOC && allocIdForDot == null) {
				throw new IllegalArgumentException("Dot scope alloc requires an alloc id");
			}
			if (dotScope == DotScope.CONTEXT && contextIdForDot == null) {
				throw new IllegalArgumentException("Dot scope context requires a context id");
			}
			return new DisambiguationOptions(this);
		}
	}
}
