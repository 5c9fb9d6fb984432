package edu.cmu.cs.cs15745.memprof.ir;

import java.util.List;

import edu.cmu.cs.cs15745.memprof.AllocationType;
import edu.cmu.cs.cs15745.memprof.ContextSizeInfo;
import edu.cmu.cs.cs15745.memprof.MibRecord;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Function;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Instruction;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Instruction.Allocation;
import edu.cmu.cs.cs15745.memprof.ir.Ir.Instruction.Call;

/**
 * Small profiled programs shared by the tests.
 */
public final class Programs {
	private Programs() {
	}

	static MibRecord mib(AllocationType type, Long... stackIds) {
		return new MibRecord(List.of(stackIds), type);
	}

	static MibRecord mib(AllocationType type, ContextSizeInfo size, Long... stackIds) {
		return new MibRecord(List.of(stackIds), type, List.of(size));
	}

	static Allocation alloc(MibRecord... mibs) {
		return new Allocation("p", "T", List.of(mibs), List.of());
	}

	static Function function(String name, Instruction... instructions) {
		return new Function(name, List.of(instructions));
	}

	/**
	 * main calls foo twice (stack ids 2 and 3), foo calls bar (stack id 1),
	 * bar allocates. The allocation is not cold through 2 and cold through 3.
	 */
	public static Ir basic(boolean withSizes) {
		var notCold = withSizes
				? mib(AllocationType.NOT_COLD, new ContextSizeInfo(100, 10), 1L, 2L)
				: mib(AllocationType.NOT_COLD, 1L, 2L);
		var cold = withSizes
				? mib(AllocationType.COLD, new ContextSizeInfo(200, 20), 1L, 3L)
				: mib(AllocationType.COLD, 1L, 3L);
		return new Ir(List.of(
				function("main", Call.direct("foo", 2L), Call.direct("foo", 3L)),
				function("foo", Call.direct("bar", 1L)),
				function("bar", alloc(notCold, cold))));
	}

	/** As {@link #basic}, but every context is cold. */
	public static Ir allCold() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 2L), Call.direct("foo", 3L)),
				function("foo", Call.direct("bar", 1L)),
				function("bar", alloc(mib(AllocationType.COLD, 1L, 2L), mib(AllocationType.COLD, 1L, 3L)))));
	}

	/**
	 * The allocation is reached both ways through the same single callsite,
	 * so no cloning can tell the contexts apart. 40 bytes not cold, 60 cold.
	 */
	public static Ir ambiguous() {
		return new Ir(List.of(
				function("main", Call.direct("foo")),
				function("foo", Call.direct("bar", 1L)),
				function("bar", alloc(
						mib(AllocationType.NOT_COLD, new ContextSizeInfo(1, 40), 1L),
						mib(AllocationType.COLD, new ContextSizeInfo(2, 60), 1L)))));
	}

	/**
	 * As {@link #basic}, but foo actually calls tc, which tail calls bar. With
	 * {@code twoChains} tc tail calls bar twice.
	 */
	public static Ir tailCall(boolean twoChains) {
		var tc = twoChains
				? function("tc", Call.tail("bar"), Call.tail("bar"))
				: function("tc", Call.tail("bar"));
		return new Ir(List.of(
				function("main", Call.direct("foo", 2L), Call.direct("foo", 3L)),
				function("foo", Call.direct("tc", 1L)),
				tc,
				function("bar", alloc(mib(AllocationType.NOT_COLD, 1L, 2L), mib(AllocationType.COLD, 1L, 3L)))));
	}

	/**
	 * bar was inlined into foo after profiling: the call in foo carries both
	 * stack ids 1 and 2.
	 */
	public static Ir inlined() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 3L), Call.direct("foo", 4L)),
				function("foo", Call.direct("baz", 1L, 2L)),
				function("baz", alloc(mib(AllocationType.NOT_COLD, 1L, 2L, 3L), mib(AllocationType.COLD, 1L, 2L, 4L)))));
	}

	/** The cold context goes around a cycle through stack id 1 twice. */
	public static Ir recursive() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 3L), Call.direct("foo", 4L)),
				function("foo", Call.direct("bar", 1L)),
				function("bar", alloc(mib(AllocationType.COLD, 1L, 2L, 1L, 3L), mib(AllocationType.NOT_COLD, 1L, 4L)))));
	}

	/**
	 * As {@link #recursive}, but bar calls back into foo through stack id 2, so
	 * the cycle is made of real calls.
	 */
	public static Ir mutualRecursion() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 3L), Call.direct("foo", 4L)),
				function("foo", Call.direct("bar", 1L)),
				function("bar",
						alloc(mib(AllocationType.COLD, 1L, 2L, 1L, 3L), mib(AllocationType.NOT_COLD, 1L, 4L)),
						Call.direct("foo", 2L))));
	}

	/**
	 * bar has two allocations with opposite types through each caller of foo.
	 * Cloning first gives each caller of foo two clones of the call to bar.
	 */
	public static Ir mergeClones() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 2L), Call.direct("foo", 3L)),
				function("foo", Call.direct("bar", 1L)),
				function("bar",
						alloc(mib(AllocationType.NOT_COLD, 1L, 2L), mib(AllocationType.COLD, 1L, 3L)),
						alloc(mib(AllocationType.COLD, 1L, 2L), mib(AllocationType.NOT_COLD, 1L, 3L)))));
	}

	/**
	 * baz was inlined into both foo and qux after profiling, so the same stack
	 * id sequence 1, 2 shows up on a call in each of them.
	 */
	public static Ir inlinedTwice() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 3L), Call.direct("qux", 4L)),
				function("foo", Call.direct("baz", 1L, 2L)),
				function("qux", Call.direct("baz", 1L, 2L)),
				function("baz", alloc(mib(AllocationType.NOT_COLD, 1L, 2L, 3L), mib(AllocationType.COLD, 1L, 2L, 4L)))));
	}

	/** As {@link #basic}, but foo has two calls to bar with the same stack id. */
	public static Ir repeatedCall() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 2L), Call.direct("foo", 3L)),
				function("foo", Call.direct("bar", 1L), Call.direct("bar", 1L)),
				function("bar", alloc(mib(AllocationType.NOT_COLD, 1L, 2L), mib(AllocationType.COLD, 1L, 3L)))));
	}

	/**
	 * foo calls bar and baz. Through main's first call bar's allocation is not
	 * cold and baz's is cold; through the second it is the other way around.
	 */
	public static Ir crossedCallees() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 3L), Call.direct("foo", 4L)),
				function("foo", Call.direct("bar", 1L), Call.direct("baz", 2L)),
				function("bar", alloc(mib(AllocationType.NOT_COLD, 1L, 3L), mib(AllocationType.COLD, 1L, 4L))),
				function("baz", alloc(mib(AllocationType.COLD, 2L, 3L), mib(AllocationType.NOT_COLD, 2L, 4L)))));
	}

	/**
	 * As {@link #crossedCallees}, with a third call from main. Splitting on bar
	 * groups main's last two calls together, splitting on baz its first two.
	 */
	public static Ir disagreeingCallers() {
		return new Ir(List.of(
				function("main", Call.direct("foo", 3L), Call.direct("foo", 4L), Call.direct("foo", 5L)),
				function("foo", Call.direct("bar", 1L), Call.direct("baz", 2L)),
				function("bar", alloc(
						mib(AllocationType.NOT_COLD, 1L, 3L), mib(AllocationType.COLD, 1L, 4L), mib(AllocationType.COLD, 1L, 5L))),
				function("baz", alloc(
						mib(AllocationType.COLD, 2L, 3L), mib(AllocationType.COLD, 2L, 4L), mib(AllocationType.NOT_COLD, 2L, 5L)))));
	}

	/**
	 * Two indirect calls in main, each profiled as reaching both foo and bar,
	 * with opposite types.
	 */
	public static Ir indirectTwoTargets() {
		return new Ir(List.of(
				function("main", Call.indirect(3L), Call.indirect(4L)),
				function("foo", alloc(mib(AllocationType.NOT_COLD, 3L), mib(AllocationType.COLD, 4L))),
				function("bar", alloc(mib(AllocationType.COLD, 3L), mib(AllocationType.NOT_COLD, 4L)))));
	}

	public static Allocation allocationIn(Ir ir, String function) {
		return allocationIn(ir, function, 0);
	}

	public static Allocation allocationIn(Ir ir, String function, int index) {
		return (Allocation) ir.function(function).instructions().get(index);
	}

	public static Call callIn(Ir ir, String function, int index) {
		return (Call) ir.function(function).instructions().get(index);
	}
}
