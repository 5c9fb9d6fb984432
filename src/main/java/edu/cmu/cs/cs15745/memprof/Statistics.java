package edu.cmu.cs.cs15745.memprof;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-run counter table.
 */
public final class Statistics {
	private final Map<Statistic, Long> counters = new EnumMap<>(Statistic.class);

	public void increment(Statistic stat) {
		add(stat, 1);
	}

	public void add(Statistic stat, long amount) {
		counters.merge(stat, amount, Long::sum);
	}

	/** Raise the counter to {@code value} if it is currently lower. */
	public void max(Statistic stat, long value) {
		counters.merge(stat, value, Math::max);
	}

	public long get(Statistic stat) {
		return counters.getOrDefault(stat, 0L);
	}

	@Override
	public String toString() {
		var result = new StringBuilder();
		for (var entry : counters.entrySet()) {
			if (entry.getValue() == 0) {
				continue;
			}
			result.append(String.format("%8d %s%n", entry.getValue(), entry.getKey().description()));
		}
		return result.toString();
	}
}
