package edu.cmu.cs.cs15745.memprof;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class TestContextIds {

	@Test
	public void iteratesInAscendingOrder() {
		var ids = ContextIds.of(5, 1, 3);
		Assert.assertEquals(List.of(1, 3, 5), ids.toList());
		Assert.assertEquals(1, ids.first());
		Assert.assertEquals("{1 3 5}", ids.toString());
	}

	@Test
	public void setOperations() {
		var a = ContextIds.of(1, 2, 3);
		var b = ContextIds.of(2, 3, 4);
		Assert.assertEquals(ContextIds.of(2, 3), a.intersection(b));
		Assert.assertEquals(ContextIds.of(1), a.difference(b));
		Assert.assertEquals(ContextIds.of(1, 2, 3, 4), a.union(b));
		Assert.assertTrue(a.containsAny(b));
		Assert.assertFalse(a.containsAll(b));
		Assert.assertTrue(a.containsAll(ContextIds.of(1, 3)));

		// The operands are left alone.
		Assert.assertEquals(ContextIds.of(1, 2, 3), a);
		Assert.assertEquals(ContextIds.of(2, 3, 4), b);
	}

	@Test
	public void removeAllOfItself() {
		var a = ContextIds.of(1, 2);
		a.removeAll(a);
		Assert.assertTrue(a.isEmpty());
	}

	@Test
	public void copiesAreIndependent() {
		var a = ContextIds.of(7);
		var copy = ContextIds.copyOf(a);
		copy.add(8);
		a.retainAll(ContextIds.of(8));
		Assert.assertEquals(ContextIds.empty(), a);
		Assert.assertEquals(ContextIds.of(7, 8), copy);
	}

	@Test(expected = java.util.NoSuchElementException.class)
	public void firstOfEmpty() {
		ContextIds.empty().first();
	}
}
