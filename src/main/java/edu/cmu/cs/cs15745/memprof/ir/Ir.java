package edu.cmu.cs.cs15745.memprof.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import edu.cmu.cs.cs15745.memprof.MibRecord;

/**
 * Instances of this class represent a whole program as seen by the memory
 * profile guided cloning. A program consists of named functions, each a
 * sequence of:
 * <ul>
 * <li>Allocations, carrying the MIBs profiled for them.</li>
 * <li>Calls, direct or indirect, carrying the stack ids profiled for them.</li>
 * </ul>
 * Instructions are compared by identity; cloning a function copies them.
 */
public final class Ir {
	private final Map<String, Function> functions = new LinkedHashMap<>();

	public Ir(List<Function> functions) {
		for (Function f : functions) {
			add(f);
		}
	}

	public void add(Function f) {
		if (functions.putIfAbsent(f.name(), f) != null) {
			throw new IllegalArgumentException("Function defined twice: " + f.name());
		}
	}

	public Function function(String name) {
		return Objects.requireNonNull(functions.get(name), name);
	}

	/** The function called {@code name}, or null if it is external to the program. */
	public Function functionOrNull(String name) {
		return functions.get(name);
	}

	public Collection<Function> functions() {
		return Collections.unmodifiableCollection(functions.values());
	}

	@Override
	public String toString() {
		return join("\n", functions.values());
	}

	/**
	 * A Function is a record of:
	 * <ul>
	 * <li>The name of the function.</li>
	 * <li>The body of the function, a list of instructions.</li>
	 * </ul>
	 */
	public static final class Function {
		private final String name;
		private final List<Instruction> instructions;

		public Function(String name, List<Instruction> instructions) {
			this.name = Objects.requireNonNull(name);
			this.instructions = new ArrayList<>(instructions);
		}

		public String name() {
			return name;
		}

		public List<Instruction> instructions() {
			return Collections.unmodifiableList(instructions);
		}

		/**
		 * Deep copy under a new name. Each instruction of this function is
		 * mapped to its copy in {@code copies}.
		 */
		public Function copy(String newName, Map<Instruction, Instruction> copies) {
			var body = new ArrayList<Instruction>(instructions.size());
			for (var i : instructions) {
				var copy = i.copy();
				copies.put(i, copy);
				body.add(copy);
			}
			return new Function(newName, body);
		}

		@Override
		public String toString() {
			return String.format("%s {\n\t%s\n}\n", name, join("\n\t", instructions));
		}
	}

	/**
	 * An Instruction is one of the following:
	 * <ul>
	 * <li>x = new T (allocation, possibly profiled)</li>
	 * <li>f(...) or *p(...) (direct or indirect call, possibly a tail call)</li>
	 * </ul>
	 */
	public static abstract class Instruction {
		// Disallow external subclassing.
		private Instruction() {
		}

		/**
		 * Visitor for Instruction's fixed set of subclasses.
		 */
		public interface Visitor<T> {
			T visitAllocation(Allocation a);
			T visitCall(Call c);
		}

		/**
		 * Convenience class for unit-returning visitor.
		 */
		public static abstract class StatefulVisitor {
			public void iterAllocation(Allocation a) { }
			public void iterCall(Call c) { }
			public Visitor<?> visitor() {
				return new Visitor<Object>() {
					@Override
					public Object visitAllocation(Allocation a) {
						iterAllocation(a);
						return null;
					}

					@Override
					public Object visitCall(Call c) {
						iterCall(c);
						return null;
					}
				};
			}
		}

		public abstract <T> T accept(Visitor<T> visitor);

		abstract Instruction copy();

		/**
		 * x = new T (allocation)
		 */
		public static final class Allocation extends Instruction {
			private final String target;
			private final String type;
			private final List<MibRecord> mibs;
			private final List<Long> callsiteStackIds;
			// The hint written back after cloning: "cold" or "notcold".
			private String memprofAttribute = null;

			/**
			 * target = new type, profiled with mibs. The callsite stack ids are
			 * the frames inlined into the allocation call itself.
			 */
			public Allocation(String target, String type, List<MibRecord> mibs, List<Long> callsiteStackIds) {
				this.target = Objects.requireNonNull(target);
				this.type = Objects.requireNonNull(type);
				this.mibs = List.copyOf(mibs);
				this.callsiteStackIds = List.copyOf(callsiteStackIds);
			}

			public String target() {
				return target;
			}

			public String type() {
				return type;
			}

			public List<MibRecord> mibs() {
				return mibs;
			}

			public List<Long> callsiteStackIds() {
				return callsiteStackIds;
			}

			public Optional<String> memprofAttribute() {
				return Optional.ofNullable(memprofAttribute);
			}

			void setMemprofAttribute(String memprofAttribute) {
				this.memprofAttribute = memprofAttribute;
			}

			@Override
			Instruction copy() {
				var copy = new Allocation(target, type, mibs, callsiteStackIds);
				copy.memprofAttribute = memprofAttribute;
				return copy;
			}

			public <T> T accept(Visitor<T> visitor) {
				return visitor.visitAllocation(this);
			}

			@Override
			public String toString() {
				var alloc = String.format("%s = new %s", target, type);
				return memprofAttribute == null ? alloc : String.format("%s #memprof=%s", alloc, memprofAttribute);
			}
		}

		/**
		 * f(...) (call)
		 */
		public static final class Call extends Instruction {
			// Null for an indirect call.
			private String callee;
			private final boolean tailCall;
			private final List<Long> stackIds;

			/**
			 * A call to {@code callee}, or an indirect call if it is empty. The
			 * stack ids are those profiled for the call, outermost last.
			 */
			public Call(Optional<String> callee, boolean tailCall, List<Long> stackIds) {
				this.callee = Objects.requireNonNull(callee).orElse(null);
				this.tailCall = tailCall;
				this.stackIds = List.copyOf(stackIds);
			}

			public static Call direct(String callee, Long... stackIds) {
				return new Call(Optional.of(callee), false, List.of(stackIds));
			}

			public static Call tail(String callee) {
				return new Call(Optional.of(callee), true, List.of());
			}

			public static Call indirect(Long... stackIds) {
				return new Call(Optional.empty(), false, List.of(stackIds));
			}

			public Optional<String> callee() {
				return Optional.ofNullable(callee);
			}

			public boolean isIndirect() {
				return callee == null;
			}

			public boolean isTailCall() {
				return tailCall;
			}

			public List<Long> stackIds() {
				return stackIds;
			}

			void setCallee(String callee) {
				this.callee = Objects.requireNonNull(callee);
			}

			@Override
			Instruction copy() {
				return new Call(callee(), tailCall, stackIds);
			}

			public <T> T accept(Visitor<T> visitor) {
				return visitor.visitCall(this);
			}

			@Override
			public String toString() {
				var call = String.format("%s()", callee == null ? "*indirect" : callee);
				return tailCall ? "tail " + call : call;
			}
		}
	}

	// String.join calling "toString" on each constituent element of the iterable.
	private static String join(CharSequence delimiter, Iterable<?> iter) {
		StringBuilder result = new StringBuilder();
		for (Iterator<?> it = iter.iterator(); it.hasNext();) {
			result.append(it.next());
			if (it.hasNext()) {
				result.append(delimiter);
			}
		}
		return result.toString();
	}
}
