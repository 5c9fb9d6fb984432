package edu.cmu.cs.cs15745.memprof;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class TestAllocationType {

	@Test
	public void ambiguousFallsBackToNotCold() {
		Assert.assertEquals(AllocationType.NOT_COLD, AllocationType.allocTypeToUse(AllocationType.BOTH));
		Assert.assertEquals(AllocationType.COLD, AllocationType.allocTypeToUse(AllocationType.COLD.bit()));
		Assert.assertEquals(AllocationType.NOT_COLD, AllocationType.HOT.normalize());
	}

	@Test(expected = IllegalArgumentException.class)
	public void noTypeToUseForNone() {
		AllocationType.allocTypeToUse(AllocationType.NONE.bit());
	}

	@Test
	public void singleTypes() {
		Assert.assertTrue(AllocationType.isSingleType(AllocationType.COLD.bit()));
		Assert.assertTrue(AllocationType.isSingleType(AllocationType.NOT_COLD.bit()));
		Assert.assertFalse(AllocationType.isSingleType(AllocationType.BOTH));
		Assert.assertFalse(AllocationType.isSingleType(AllocationType.NONE.bit()));
	}

	@Test
	public void masksPrint() {
		Assert.assertEquals("NotColdCold", AllocationType.toString(AllocationType.BOTH));
		Assert.assertEquals("None", AllocationType.toString(0));
		Assert.assertEquals("Cold", AllocationType.COLD.toString());
	}

	@Test
	public void noneMatchesAnything() {
		int none = AllocationType.NONE.bit();
		int cold = AllocationType.COLD.bit();
		int notCold = AllocationType.NOT_COLD.bit();
		Assert.assertTrue(AllocationType.allocTypesMatch(List.of(none, cold), List.of(cold, cold)));
		Assert.assertTrue(AllocationType.allocTypesMatch(List.of(AllocationType.BOTH), List.of(notCold)));
		Assert.assertFalse(AllocationType.allocTypesMatch(List.of(cold, notCold), List.of(cold, cold)));
	}
}
