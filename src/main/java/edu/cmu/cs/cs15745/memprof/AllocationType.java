package edu.cmu.cs.cs15745.memprof;

import java.util.List;

/**
 * Allocation behavior of a profiled context. Masks of these values (an OR of
 * {@link #bit()}s) are carried on nodes and edges of the context graph.
 */
public enum AllocationType {
	NONE(0), NOT_COLD(1), COLD(2), HOT(4);

	public static final int BOTH = NOT_COLD.bit | COLD.bit;

	private final int bit;

	AllocationType(int bit) {
		this.bit = bit;
	}

	public int bit() {
		return bit;
	}

	/** Hot contexts are treated as NotCold everywhere in the graph. */
	public AllocationType normalize() {
		return this == HOT ? NOT_COLD : this;
	}

	public static AllocationType fromBit(int bit) {
		for (var type : values()) {
			if (type.bit == bit) {
				return type;
			}
		}
		throw new IllegalArgumentException("Not a single allocation type: " + bit);
	}

	/**
	 * The type to actually use on an allocation with the given mask. An
	 * allocation we cannot disambiguate falls back to NotCold, so there is no
	 * point in cloning to separate NotCold|Cold from NotCold.
	 */
	public static AllocationType allocTypeToUse(int allocTypes) {
		if (allocTypes == NONE.bit) {
			throw new IllegalArgumentException("No allocation type to use for None");
		}
		if (allocTypes == BOTH) {
			return NOT_COLD;
		}
		return fromBit(allocTypes);
	}

	public static boolean isSingleType(int allocTypes) {
		return allocTypes == NOT_COLD.bit || allocTypes == COLD.bit;
	}

	public static String toString(int allocTypes) {
		if (allocTypes == NONE.bit) {
			return "None";
		}
		var str = new StringBuilder();
		if ((allocTypes & NOT_COLD.bit) != 0) {
			str.append("NotCold");
		}
		if ((allocTypes & COLD.bit) != 0) {
			str.append("Cold");
		}
		return str.toString();
	}

	/**
	 * Whether the masks recorded in {@code inAllocTypes} line up with the given
	 * masks position by position. A None on either side matches anything, since
	 * those contexts never reach that edge.
	 */
	public static boolean allocTypesMatch(List<Integer> inAllocTypes, List<Integer> edgeAllocTypes) {
		if (inAllocTypes.size() != edgeAllocTypes.size()) {
			throw new IllegalArgumentException("Alloc type vectors of different sizes");
		}
		for (int i = 0; i < inAllocTypes.size(); i++) {
			if (!allocTypeMatches(inAllocTypes.get(i), edgeAllocTypes.get(i))) {
				return false;
			}
		}
		return true;
	}

	static boolean allocTypeMatches(int l, int r) {
		if (l == NONE.bit || r == NONE.bit) {
			return true;
		}
		return allocTypeToUse(l) == allocTypeToUse(r);
	}

	@Override
	public String toString() {
		switch (this) {
		case NONE: return "None";
		case NOT_COLD: return "NotCold";
		case COLD: return "Cold";
		default: return "Hot";
		}
	}
}
