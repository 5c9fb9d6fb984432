package edu.cmu.cs.cs15745.memprof.summary;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.memprof.AllocationType;
import edu.cmu.cs.cs15745.memprof.DisambiguationOptions;
import edu.cmu.cs.cs15745.memprof.MemProfContextDisambiguation;
import edu.cmu.cs.cs15745.memprof.MibRecord;
import edu.cmu.cs.cs15745.memprof.Statistic;
import edu.cmu.cs.cs15745.memprof.Statistics;
import edu.cmu.cs.cs15745.memprof.summary.FunctionSummary.CallEdge;
import edu.cmu.cs.cs15745.memprof.summary.SummaryRecord.AllocInfo;
import edu.cmu.cs.cs15745.memprof.summary.SummaryRecord.CallsiteInfo;

/**
 * Runs over summary indices: cloning only records versions and callee clones.
 */
public class TestSummaryDisambiguation {

	private static MemProfContextDisambiguation<FunctionSummary, SummaryRecord> disambiguation(
			SummaryCallsiteAdapter adapter, SummaryIndex index, Statistics stats) {
		var options = DisambiguationOptions.builder().verifyCCG(true).build();
		return new MemProfContextDisambiguation<>(adapter, SummaryCallsiteAdapter.profile(index), options, stats);
	}

	private static MibRecord mib(AllocationType type, Long... stackIdIndices) {
		return new MibRecord(List.of(stackIdIndices), type);
	}

	private static FunctionSummary summary(String name, List<AllocInfo> allocs, List<CallsiteInfo> callsites,
			CallEdge... calls) {
		return new FunctionSummary(name, allocs, callsites, List.of(calls));
	}

	@Test
	public void recordsVersionsAndCalleeClones() {
		var alloc = new AllocInfo(List.of(mib(AllocationType.NOT_COLD, 0L, 1L), mib(AllocationType.COLD, 0L, 2L)));
		var fooCall = new CallsiteInfo("bar", List.of(0L), false);
		var mainCall1 = new CallsiteInfo("foo", List.of(1L), false);
		var mainCall2 = new CallsiteInfo("foo", List.of(2L), false);
		var index = new SummaryIndex(List.of(1001L, 1002L, 1003L), List.of(
				summary("main", List.of(), List.of(mainCall1, mainCall2), new CallEdge("foo", false)),
				summary("foo", List.of(), List.of(fooCall), new CallEdge("bar", false)),
				summary("bar", List.of(alloc), List.of())));
		var stats = new Statistics();
		var options = DisambiguationOptions.defaults();
		var adapter = new SummaryCallsiteAdapter(index, options, stats);
		Assert.assertTrue(disambiguation(adapter, index, stats).process());

		Assert.assertEquals(List.of(AllocationType.NOT_COLD.bit(), AllocationType.COLD.bit()), alloc.versions());
		Assert.assertEquals(List.of(0, 1), fooCall.clones());
		Assert.assertEquals(List.of(0), mainCall1.clones());
		Assert.assertEquals(List.of(1), mainCall2.clones());
		Assert.assertTrue(adapter.icpRecords().isEmpty());
		Assert.assertEquals(2, stats.get(Statistic.FUNCTION_CLONES));
	}

	@Test
	public void indirectCallNeedingCloneIsPromoted() {
		var alloc = new AllocInfo(List.of(mib(AllocationType.COLD, 0L, 1L), mib(AllocationType.NOT_COLD, 0L, 2L)));
		var toFoo = new CallsiteInfo("foo", List.of(0L), true);
		var toBaz = new CallsiteInfo("baz", List.of(0L), true);
		var top1Call = new CallsiteInfo("main", List.of(1L), false);
		var top2Call = new CallsiteInfo("main", List.of(2L), false);
		var index = new SummaryIndex(List.of(500L, 600L, 700L), List.of(
				summary("top1", List.of(), List.of(top1Call), new CallEdge("main", false)),
				summary("top2", List.of(), List.of(top2Call), new CallEdge("main", false)),
				summary("main", List.of(), List.of(toFoo, toBaz)),
				summary("baz", List.of(), List.of()),
				summary("foo", List.of(alloc), List.of())));
		var stats = new Statistics();
		var adapter = new SummaryCallsiteAdapter(index, DisambiguationOptions.defaults(), stats);
		Assert.assertTrue(disambiguation(adapter, index, stats).process());

		Assert.assertEquals(List.of(toFoo), adapter.icpRecords());
		Assert.assertEquals(List.of(0, 1), toFoo.clones());
		Assert.assertEquals(List.of(0, 0), toBaz.clones());
		Assert.assertEquals(List.of(1), top1Call.clones());
		Assert.assertEquals(List.of(0), top2Call.clones());
		Assert.assertEquals(List.of(AllocationType.NOT_COLD.bit(), AllocationType.COLD.bit()), alloc.versions());
	}

	@Test
	public void stackIdsAreLookedUpByIndex() {
		var index = new SummaryIndex(List.of(1001L, 1002L, 1003L), List.of());
		var adapter = new SummaryCallsiteAdapter(index, DisambiguationOptions.defaults(), new Statistics());
		Assert.assertEquals(1002L, adapter.getStackId(1));
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void unknownStackIndexIsRejected() {
		var index = new SummaryIndex(List.of(1001L), List.of());
		new SummaryCallsiteAdapter(index, DisambiguationOptions.defaults(), new Statistics()).getStackId(3);
	}

	@Test(expected = IllegalArgumentException.class)
	public void duplicateFunctionIsRejected() {
		new SummaryIndex(List.of(), List.of(
				summary("main", List.of(), List.of()),
				summary("main", List.of(), List.of())));
	}
}
