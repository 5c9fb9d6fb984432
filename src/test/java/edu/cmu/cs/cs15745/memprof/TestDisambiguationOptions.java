package edu.cmu.cs.cs15745.memprof;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.memprof.DisambiguationOptions.ColdPromotionPolicy;
import edu.cmu.cs.cs15745.memprof.DisambiguationOptions.DotScope;

public class TestDisambiguationOptions {

	@Test
	public void defaults() {
		var options = DisambiguationOptions.defaults();
		Assert.assertEquals(5, options.tailCallSearchDepth());
		Assert.assertTrue(options.allowRecursiveCallsites());
		Assert.assertTrue(options.cloneRecursiveContexts());
		Assert.assertTrue(options.mergeClones());
		Assert.assertFalse(options.exportToDot());
		Assert.assertEquals(DotScope.ALL, options.dotScope());
		Assert.assertEquals(100, options.minClonedColdBytePercent());
		Assert.assertFalse(options.recordContextSizes());
	}

	@Test
	public void sizesRecordedForColdBytePercent() {
		Assert.assertTrue(DisambiguationOptions.builder().minClonedColdBytePercent(80).build().recordContextSizes());
		Assert.assertTrue(DisambiguationOptions.builder().reportHintedSizes(true).build().recordContextSizes());
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeDepth() {
		DisambiguationOptions.builder().tailCallSearchDepth(-1).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void percentOutOfRange() {
		DisambiguationOptions.builder().minClonedColdBytePercent(101).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void allocScopeNeedsAllocId() {
		DisambiguationOptions.builder().dotScope(DotScope.ALLOC).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void cloningRecursiveContextsNeedsThem() {
		DisambiguationOptions.builder().allowRecursiveContexts(false).build();
	}

	@Test
	public void coldBytePercent() {
		var half = ColdPromotionPolicy.minColdBytePercent(50);
		Assert.assertTrue(half.promoteToCold(50, 100));
		Assert.assertFalse(half.promoteToCold(49, 100));
		// 100 disables promotion entirely.
		Assert.assertFalse(ColdPromotionPolicy.minColdBytePercent(100).promoteToCold(100, 100));
	}
}
