package edu.cmu.cs.cs15745.memprof;

import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Clones functions and callsites so that allocations reached from cold
 * contexts can be hinted separately from those reached from not cold ones.
 *
 * <p>The graph of profiled contexts is built from the module profile, then
 * cloned until each node has a single allocation type as far as its callers
 * allow. The clones are then mapped onto function clones, and the decisions
 * are written back through the {@link CallsiteAdapter}.
 *
 * @param <F> The function type of the representation.
 * @param <C> The call type of the representation.
 */
public final class MemProfContextDisambiguation<F, C> {
	private static final Logger logger = LogManager.getLogger(MemProfContextDisambiguation.class);

	private final CallsiteContextGraph<F, C> graph;
	private final ModuleProfile<F, C> profile;
	private final DisambiguationOptions options;
	private final DotExporter<F, C> dotExporter;
	private List<String> hintedSizes = List.of();
	private boolean alreadyRun = false;

	public MemProfContextDisambiguation(CallsiteAdapter<F, C> adapter, ModuleProfile<F, C> profile,
			DisambiguationOptions options) {
		this(adapter, profile, options, new Statistics());
	}

	public MemProfContextDisambiguation(CallsiteAdapter<F, C> adapter, ModuleProfile<F, C> profile,
			DisambiguationOptions options, Statistics stats) {
		this.profile = Objects.requireNonNull(profile);
		this.options = Objects.requireNonNull(options);
		this.graph = new CallsiteContextGraph<>(adapter, options, stats);
		this.dotExporter = new DotExporter<>(graph);
	}

	public CallsiteContextGraph<F, C> graph() {
		return graph;
	}

	public Statistics stats() {
		return graph.stats();
	}

	/** The hinted size report of the last run, empty unless enabled. */
	public List<String> hintedSizes() {
		return hintedSizes;
	}

	/**
	 * Runs the whole analysis and applies its decisions. Returns whether
	 * anything was cloned or updated.
	 */
	public boolean process() {
		if (alreadyRun) {
			throw new IllegalStateException("Already run.");
		}
		alreadyRun = true;

		new GraphBuilder<>(graph, profile).run();
		graph.dump("before updating call stack chains");
		exportToDot("prestackupdate");
		graph.verify();

		new StackNodeReconciler<>(graph).run();
		graph.dump("after updating call stack chains");
		exportToDot("poststackupdate");

		new MultiTargetResolver<>(graph).run();
		if (options.cloneRecursiveContexts()) {
			new BackedgeMarker<>(graph).run();
		}
		graph.dump("before cloning");
		exportToDot("postbuild");
		graph.verify();

		new CloneIdentifier<>(graph).run();
		graph.dump("after cloning");
		exportToDot("cloned");

		if (options.mergeClones()) {
			new CloneMerger<>(graph).run();
			graph.dump("after merging");
			exportToDot("aftermerge");
			graph.verify();
		}

		boolean changed = new FunctionAssigner<>(graph).run();
		graph.dump("after assigning function clones");
		exportToDot("clonefuncassign");
		graph.verify();

		if (options.reportHintedSizes()) {
			hintedSizes = graph.totalSizes();
			for (var line : hintedSizes) {
				logger.info(line);
			}
		}
		logger.debug("Statistics:\n{}", graph.stats());
		return changed;
	}

	private void exportToDot(String label) {
		if (options.exportToDot()) {
			dotExporter.export(label);
		}
	}
}
