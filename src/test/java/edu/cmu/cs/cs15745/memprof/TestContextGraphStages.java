package edu.cmu.cs.cs15745.memprof;

import org.junit.Assert;
import org.junit.Test;

import edu.cmu.cs.cs15745.memprof.ir.Ir;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Function;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Instruction;
import edu.cmu.cs.cs15745.memprof.ir.IrCallsiteAdapter;
import edu.cmu.cs.cs15745.memprof.ir.Programs;

/**
 * Runs the pipeline stages one by one over small programs.
 */
public class TestContextGraphStages {

	static CallsiteContextGraph<Function, Instruction> build(Ir ir, DisambiguationOptions options) {
		var stats = new Statistics();
		var graph = new CallsiteContextGraph<>(new IrCallsiteAdapter(ir, options, stats), options, stats);
		new GraphBuilder<>(graph, IrCallsiteAdapter.profile(ir)).run();
		return graph;
	}

	static CallsiteContextGraph<Function, Instruction> buildAndReconcile(Ir ir) {
		var graph = build(ir, DisambiguationOptions.builder().verifyCCG(true).build());
		new StackNodeReconciler<>(graph).run();
		return graph;
	}

	static ContextNode<Function, Instruction> allocNode(CallsiteContextGraph<Function, Instruction> graph, Ir ir, String function) {
		return graph.getNodeForAlloc(CallInfo.of(Programs.allocationIn(ir, function)));
	}

	static ContextNode<Function, Instruction> callNode(CallsiteContextGraph<Function, Instruction> graph, Ir ir, String function, int index) {
		return graph.getNodeForInst(CallInfo.of(Programs.callIn(ir, function, index)));
	}

	@Test
	public void buildsOneNodePerStackId() {
		var ir = Programs.basic(false);
		var graph = build(ir, DisambiguationOptions.defaults());

		Assert.assertEquals(4, graph.nodes().size());
		Assert.assertEquals(2, graph.lastContextId());
		Assert.assertEquals(AllocationType.NOT_COLD, graph.allocationType(1));
		Assert.assertEquals(AllocationType.COLD, graph.allocationType(2));

		var alloc = allocNode(graph, ir, "bar");
		Assert.assertEquals(AllocationType.BOTH, alloc.allocTypes());
		var stack1 = graph.getNodeForStackId(1);
		Assert.assertEquals(ContextIds.of(1, 2), alloc.findEdgeFromCaller(stack1).contextIds());
		Assert.assertEquals(ContextIds.of(1), stack1.findEdgeFromCaller(graph.getNodeForStackId(2)).contextIds());
		Assert.assertEquals(ContextIds.of(2), stack1.findEdgeFromCaller(graph.getNodeForStackId(3)).contextIds());
		// Stack nodes get their calls only once reconciled.
		Assert.assertFalse(stack1.hasCall());
	}

	@Test(expected = IllegalStateException.class)
	public void builderRunsOnce() {
		var ir = Programs.basic(false);
		var options = DisambiguationOptions.defaults();
		var stats = new Statistics();
		var graph = new CallsiteContextGraph<>(new IrCallsiteAdapter(ir, options, stats), options, stats);
		var builder = new GraphBuilder<>(graph, IrCallsiteAdapter.profile(ir));
		builder.run();
		builder.run();
	}

	@Test
	public void reconcilePlacesCallsOnStackNodes() {
		var ir = Programs.basic(false);
		var graph = buildAndReconcile(ir);

		var stack1 = graph.getNodeForStackId(1);
		Assert.assertSame(Programs.callIn(ir, "foo", 0), stack1.call().call());
		Assert.assertSame(ir.function("foo"), stack1.function());
		Assert.assertSame(stack1, callNode(graph, ir, "foo", 0));
		Assert.assertSame(graph.getNodeForStackId(2), callNode(graph, ir, "main", 0));
		Assert.assertSame(graph.getNodeForStackId(3), callNode(graph, ir, "main", 1));
	}

	@Test
	public void inlinedCallsiteIsSplicedIn() {
		var ir = Programs.inlined();
		var graph = buildAndReconcile(ir);

		Assert.assertEquals(6, graph.nodes().size());
		Assert.assertTrue(graph.getNodeForStackId(1).isRemoved());
		Assert.assertTrue(graph.getNodeForStackId(2).isRemoved());

		var spliced = callNode(graph, ir, "foo", 0);
		Assert.assertNotNull(spliced);
		Assert.assertSame(ir.function("foo"), spliced.function());
		Assert.assertEquals(AllocationType.BOTH, spliced.allocTypes());
		Assert.assertEquals(1, spliced.calleeEdges().size());
		var calleeEdge = spliced.calleeEdges().get(0);
		Assert.assertSame(allocNode(graph, ir, "baz"), calleeEdge.callee());
		Assert.assertEquals(ContextIds.of(1, 2), calleeEdge.contextIds());
		Assert.assertEquals(2, spliced.callerEdges().size());
		Assert.assertEquals(ContextIds.of(1), spliced.findEdgeFromCaller(graph.getNodeForStackId(3)).contextIds());
		Assert.assertEquals(ContextIds.of(2), spliced.findEdgeFromCaller(graph.getNodeForStackId(4)).contextIds());
	}

	@Test
	public void reconcilingTwiceChangesNothing() {
		var ir = Programs.inlined();
		var graph = buildAndReconcile(ir);
		var spliced = callNode(graph, ir, "foo", 0);

		new StackNodeReconciler<>(graph).run();
		Assert.assertEquals(6, graph.nodes().size());
		Assert.assertSame(spliced, callNode(graph, ir, "foo", 0));
		Assert.assertEquals(2, spliced.callerEdges().size());
		Assert.assertEquals(ContextIds.of(1, 2), spliced.getContextIds());
	}

	@Test
	public void cycleGetsBackedge() {
		var ir = Programs.recursive();
		var graph = buildAndReconcile(ir);
		new BackedgeMarker<>(graph).run();

		var stack1 = graph.getNodeForStackId(1);
		var stack2 = graph.getNodeForStackId(2);
		Assert.assertTrue(stack1.findEdgeFromCaller(stack2).isBackedge());
		Assert.assertFalse(stack2.findEdgeFromCaller(stack1).isBackedge());
		Assert.assertFalse(stack1.findEdgeFromCaller(graph.getNodeForStackId(3)).isBackedge());
	}

	@Test
	public void clonesSeparateColdFromNotCold() {
		var ir = Programs.basic(false);
		var graph = buildAndReconcile(ir);
		new MultiTargetResolver<>(graph).run();
		new BackedgeMarker<>(graph).run();
		new CloneIdentifier<>(graph).run();

		var alloc = allocNode(graph, ir, "bar");
		Assert.assertEquals(1, alloc.clones().size());
		Assert.assertEquals(AllocationType.NOT_COLD.bit(), alloc.allocTypes());
		Assert.assertEquals(AllocationType.COLD.bit(), alloc.clones().get(0).allocTypes());

		var foo = callNode(graph, ir, "foo", 0);
		Assert.assertEquals(1, foo.clones().size());
		var fooClone = foo.clones().get(0);
		Assert.assertSame(foo, fooClone.cloneOf());
		Assert.assertSame(graph.getNodeForStackId(3), fooClone.callerEdges().get(0).caller());
		Assert.assertSame(alloc.clones().get(0), fooClone.calleeEdges().get(0).callee());
		Assert.assertEquals(2, graph.stats().get(Statistic.NODE_CLONES));

		// Every context still reaches exactly one copy of the allocation.
		Assert.assertEquals(ContextIds.of(1), alloc.getContextIds());
		Assert.assertEquals(ContextIds.of(2), alloc.clones().get(0).getContextIds());

		new CloneMerger<>(graph).run();
		Assert.assertEquals(0, graph.stats().get(Statistic.NEW_MERGED_NODES));
		Assert.assertEquals(0, graph.stats().get(Statistic.NON_NEW_MERGED_NODES));

		Assert.assertTrue(new FunctionAssigner<>(graph).run());
		Assert.assertEquals(2, graph.stats().get(Statistic.FUNCTION_CLONES));
		Assert.assertEquals(0, graph.stats().get(Statistic.MISMATCHED_CLONE_ASSIGNMENTS));
	}

	@Test
	public void unambiguousAllocationIsNotCloned() {
		var ir = Programs.allCold();
		var graph = buildAndReconcile(ir);
		new MultiTargetResolver<>(graph).run();
		new CloneIdentifier<>(graph).run();
		Assert.assertTrue(allocNode(graph, ir, "bar").clones().isEmpty());
		Assert.assertEquals(0, graph.stats().get(Statistic.NODE_CLONES));
	}
}
