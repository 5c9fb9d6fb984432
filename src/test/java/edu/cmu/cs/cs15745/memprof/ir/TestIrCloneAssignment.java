package edu.cmu.cs.cs15745.memprof.ir;

import java.util.Optional;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.memprof.ContextIds;
import edu.cmu.cs.cs15745.memprof.DisambiguationOptions;
import edu.cmu.cs.cs15745.memprof.MemProfContextDisambiguation;
import edu.cmu.cs.cs15745.memprof.Statistic;
import edu.cmu.cs.cs15745.memprof.Statistics;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Function;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Instruction;

/**
 * Programs whose callsite clones have to be merged, duplicated across
 * functions, or spread over several function clones.
 */
public class TestIrCloneAssignment {

	private static MemProfContextDisambiguation<Function, Instruction> disambiguation(Ir ir, Statistics stats) {
		var options = DisambiguationOptions.defaults();
		return new MemProfContextDisambiguation<>(
				new IrCallsiteAdapter(ir, options, stats), IrCallsiteAdapter.profile(ir), options, stats);
	}

	private static void assertHint(String expected, Ir ir, String function, int index) {
		Assert.assertEquals(function + " " + index, Optional.of(expected),
				Programs.allocationIn(ir, function, index).memprofAttribute());
	}

	private static void assertCallee(String expected, Ir ir, String function, int index) {
		Assert.assertEquals(function + " " + index, Optional.of(expected), Programs.callIn(ir, function, index).callee());
	}

	// Live allocation nodes split the profiled contexts between them.
	private static void assertContextsConserved(MemProfContextDisambiguation<Function, Instruction> run,
			ContextIds expected) {
		var all = ContextIds.empty();
		for (var node : run.graph().nodes()) {
			if (!node.isAllocation() || node.isRemoved()) {
				continue;
			}
			var ids = node.getContextIds();
			Assert.assertFalse("Context reaching two allocation copies", all.containsAny(ids));
			all.addAll(ids);
		}
		Assert.assertEquals(expected, all);
	}

	@Test
	public void mergesCalleeClonesOfEachCaller() {
		var ir = Programs.mergeClones();
		var stats = new Statistics();
		var run = disambiguation(ir, stats);
		Assert.assertTrue(run.process());

		Assert.assertEquals(1, stats.get(Statistic.NEW_MERGED_NODES));
		Assert.assertEquals(1, stats.get(Statistic.NON_NEW_MERGED_NODES));

		var graph = run.graph();
		var first = graph.getNodeForStackId(2);
		var second = graph.getNodeForStackId(3);
		Assert.assertEquals(1, first.calleeEdges().size());
		Assert.assertEquals(1, second.calleeEdges().size());
		var firstCallee = first.calleeEdges().get(0).callee();
		var secondCallee = second.calleeEdges().get(0).callee();
		Assert.assertNotSame(firstCallee, secondCallee);
		Assert.assertSame(firstCallee.origNode(), secondCallee.origNode());
		assertContextsConserved(run, ContextIds.of(1, 2, 3, 4));

		assertCallee("foo.memprof.1", ir, "main", 0);
		assertCallee("foo", ir, "main", 1);
		assertCallee("bar", ir, "foo.memprof.1", 0);
		assertCallee("bar.memprof.1", ir, "foo", 0);
		assertHint("notcold", ir, "bar", 0);
		assertHint("cold", ir, "bar", 1);
		assertHint("cold", ir, "bar.memprof.1", 0);
		assertHint("notcold", ir, "bar.memprof.1", 1);
		Assert.assertEquals(2, stats.get(Statistic.FUNCTION_CLONES));
		Assert.assertEquals(0, stats.get(Statistic.MISMATCHED_CLONE_ASSIGNMENTS));
	}

	@Test
	public void inlinedSequenceInTwoFunctionsGetsOwnContexts() {
		var ir = Programs.inlinedTwice();
		var stats = new Statistics();
		var run = disambiguation(ir, stats);
		Assert.assertTrue(run.process());

		// One duplicate per context of the shared sequence.
		Assert.assertEquals(4, run.graph().lastContextId());
		assertCallee("foo", ir, "main", 0);
		assertCallee("qux.memprof.1", ir, "main", 1);
		assertCallee("baz", ir, "foo", 0);
		assertCallee("baz.memprof.1", ir, "qux.memprof.1", 0);
		assertHint("notcold", ir, "baz", 0);
		assertHint("cold", ir, "baz.memprof.1", 0);
		Assert.assertEquals(2, stats.get(Statistic.FUNCTION_CLONES));
	}

	@Test
	public void matchingCallsAreUpdatedTogether() {
		var ir = Programs.repeatedCall();
		var stats = new Statistics();
		var run = disambiguation(ir, stats);
		Assert.assertTrue(run.process());

		// Calls in one function share contexts instead of duplicating them.
		Assert.assertEquals(2, run.graph().lastContextId());
		var node = run.graph().getNodeForStackId(1);
		Assert.assertTrue(node.isRemoved());
		assertCallee("foo", ir, "main", 0);
		assertCallee("foo.memprof.1", ir, "main", 1);
		assertCallee("bar", ir, "foo", 0);
		assertCallee("bar", ir, "foo", 1);
		assertCallee("bar.memprof.1", ir, "foo.memprof.1", 0);
		assertCallee("bar.memprof.1", ir, "foo.memprof.1", 1);
		assertHint("notcold", ir, "bar", 0);
		assertHint("cold", ir, "bar.memprof.1", 0);
		Assert.assertEquals(2, stats.get(Statistic.FUNCTION_CLONES));
	}

	@Test
	public void secondCallsiteFollowsCallersFunctionClone() {
		var ir = Programs.crossedCallees();
		var stats = new Statistics();
		Assert.assertTrue(disambiguation(ir, stats).process());

		assertCallee("foo", ir, "main", 0);
		assertCallee("foo.memprof.1", ir, "main", 1);
		assertCallee("bar", ir, "foo", 0);
		assertCallee("baz.memprof.1", ir, "foo", 1);
		assertCallee("bar.memprof.1", ir, "foo.memprof.1", 0);
		assertCallee("baz", ir, "foo.memprof.1", 1);
		assertHint("notcold", ir, "bar", 0);
		assertHint("cold", ir, "bar.memprof.1", 0);
		assertHint("cold", ir, "baz.memprof.1", 0);
		assertHint("notcold", ir, "baz", 0);
		Assert.assertEquals(3, stats.get(Statistic.FUNCTION_CLONES));
		Assert.assertEquals(0, stats.get(Statistic.MISMATCHED_CLONE_ASSIGNMENTS));
	}

	@Test
	public void callersInDifferentFunctionClonesForceAnotherClone() {
		var ir = Programs.disagreeingCallers();
		var stats = new Statistics();
		var run = disambiguation(ir, stats);
		Assert.assertTrue(run.process());

		// Each call from main gets a copy of foo matching its own contexts.
		assertCallee("foo", ir, "main", 0);
		assertCallee("foo.memprof.2", ir, "main", 1);
		assertCallee("foo.memprof.1", ir, "main", 2);
		assertCallee("bar", ir, "foo", 0);
		assertCallee("baz.memprof.1", ir, "foo", 1);
		assertCallee("bar.memprof.1", ir, "foo.memprof.2", 0);
		assertCallee("baz.memprof.1", ir, "foo.memprof.2", 1);
		assertCallee("bar.memprof.1", ir, "foo.memprof.1", 0);
		assertCallee("baz", ir, "foo.memprof.1", 1);
		assertHint("notcold", ir, "bar", 0);
		assertHint("cold", ir, "bar.memprof.1", 0);
		assertHint("notcold", ir, "baz", 0);
		assertHint("cold", ir, "baz.memprof.1", 0);

		Assert.assertEquals(4, stats.get(Statistic.FUNCTION_CLONES));
		Assert.assertEquals(6, stats.get(Statistic.NODE_CLONES));
		Assert.assertEquals(0, stats.get(Statistic.MISMATCHED_CLONE_ASSIGNMENTS));
		assertContextsConserved(run, ContextIds.of(1, 2, 3, 4, 5, 6));
	}

	@Test
	public void indirectCallsWithTwoTargetsAreNotCloned() {
		var ir = Programs.indirectTwoTargets();
		var stats = new Statistics();
		Assert.assertTrue(disambiguation(ir, stats).process());

		Assert.assertEquals(2, stats.get(Statistic.REMOVED_EDGES_WITH_MISMATCHED_CALLEES));
		Assert.assertEquals(0, stats.get(Statistic.FUNCTION_CLONES));
		Assert.assertEquals(0, stats.get(Statistic.NODE_CLONES));
		Assert.assertEquals(3, ir.functions().size());
		Assert.assertTrue(Programs.callIn(ir, "main", 0).isIndirect());
		Assert.assertTrue(Programs.callIn(ir, "main", 1).isIndirect());
		assertHint("notcold", ir, "foo", 0);
		assertHint("notcold", ir, "bar", 0);
	}
}
