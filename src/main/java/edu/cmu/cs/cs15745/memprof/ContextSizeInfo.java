package edu.cmu.cs.cs15745.memprof;

/** Total bytes allocated by one profiled full context. */
public final class ContextSizeInfo {
	private final long fullStackId;
	private final long totalSize;

	public ContextSizeInfo(long fullStackId, long totalSize) {
		this.fullStackId = fullStackId;
		this.totalSize = totalSize;
	}

	public long fullStackId() {
		return fullStackId;
	}

	public long totalSize() {
		return totalSize;
	}

	@Override
	public String toString() {
		return String.format("(%d, %d)", fullStackId, totalSize);
	}
}
