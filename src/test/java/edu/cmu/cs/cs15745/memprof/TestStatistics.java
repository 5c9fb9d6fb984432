package edu.cmu.cs.cs15745.memprof;

import org.junit.Assert;
import org.junit.Test;

public class TestStatistics {

	@Test
	public void counters() {
		var stats = new Statistics();
		stats.increment(Statistic.NODE_CLONES);
		stats.add(Statistic.NODE_CLONES, 2);
		stats.max(Statistic.FOUND_PROFILED_CALLEE_MAX_DEPTH, 3);
		stats.max(Statistic.FOUND_PROFILED_CALLEE_MAX_DEPTH, 2);
		Assert.assertEquals(3, stats.get(Statistic.NODE_CLONES));
		Assert.assertEquals(3, stats.get(Statistic.FOUND_PROFILED_CALLEE_MAX_DEPTH));
		Assert.assertEquals(0, stats.get(Statistic.FUNCTION_CLONES));
	}

	@Test
	public void onlyNonZeroCountersPrinted() {
		var stats = new Statistics();
		stats.increment(Statistic.FUNCTION_CLONES);
		stats.add(Statistic.NODE_CLONES, 0);
		var str = stats.toString();
		Assert.assertTrue(str.contains(Statistic.FUNCTION_CLONES.description()));
		Assert.assertFalse(str.contains(Statistic.NODE_CLONES.description()));
	}
}
