package edu.cmu.cs.cs15745.memprof;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cmu.cs.cs15745.memprof.DisambiguationOptions.DotScope;

/**
 * Renders the context graph in dot format. Nodes and edges are colored by
 * allocation type; when an allocation or context is selected, the part of the
 * graph it reaches is either highlighted or, depending on the scope, the only
 * part shown.
 */
final class DotExporter<F, C> {
	private static final Logger logger = LogManager.getLogger(DotExporter.class);

	private final CallsiteContextGraph<F, C> graph;
	private final DisambiguationOptions options;
	private final boolean doHighlight;

	DotExporter(CallsiteContextGraph<F, C> graph) {
		this.graph = Objects.requireNonNull(graph);
		this.options = graph.options();
		this.doHighlight = (options.hasAllocIdForDot() && options.dotScope() == DotScope.ALL)
				|| (options.hasContextIdForDot() && options.dotScope() != DotScope.CONTEXT);
	}

	/** Writes {@code <prefix>ccg.<label>.dot}. */
	Path export(String label) {
		var path = Path.of(options.dotFilePathPrefix() + "ccg." + label + ".dot");
		logger.debug("Writing {}", path);
		try {
			Files.writeString(path, render(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException("Could not write " + path, e);
		}
		return path;
	}

	String render() {
		var out = new StringBuilder();
		out.append("digraph \"CallsiteContextGraph\" {\n");
		out.append("\tlabel=\"CallsiteContextGraph\";\n\n");
		for (var node : graph.nodes()) {
			if (isNodeHidden(node)) {
				continue;
			}
			out.append("\t").append(nodeId(node))
					.append(" [shape=record,").append(nodeAttributes(node))
					.append(",label=\"{").append(escape(nodeLabel(node))).append("}\"];\n");
		}
		for (var node : graph.nodes()) {
			if (isNodeHidden(node)) {
				continue;
			}
			for (var edge : node.calleeEdges()) {
				if (isNodeHidden(edge.callee())) {
					continue;
				}
				out.append("\t").append(nodeId(node)).append(" -> ").append(nodeId(edge.callee()))
						.append("[").append(edgeAttributes(edge)).append("];\n");
			}
		}
		out.append("}\n");
		return out.toString();
	}

	private static String nodeId(ContextNode<?, ?> node) {
		return "N" + node.id();
	}

	private String nodeLabel(ContextNode<F, C> node) {
		var label = new StringBuilder("OrigId: ");
		if (node.isAllocation()) {
			label.append("Alloc");
		}
		label.append(Long.toUnsignedString(node.origStackOrAllocId())).append("\n");
		if (node.hasCall()) {
			label.append(graph.label(node));
		} else {
			label.append("null call");
			label.append(node.isRecursive() ? " (recursive)" : " (external)");
		}
		return label.toString();
	}

	private boolean isHighlighted(ContextIds contextIds) {
		if (!doHighlight) {
			return false;
		}
		if (options.hasAllocIdForDot()) {
			return contextIds.containsAny(graph.dotAllocContextIds());
		}
		return contextIds.contains(options.contextIdForDot());
	}

	private String nodeAttributes(ContextNode<F, C> node) {
		var contextIds = node.getContextIds();
		boolean highlight = isHighlighted(contextIds);
		var attrs = new StringBuilder();
		attrs.append("tooltip=\"").append(nodeId(node)).append(" ").append(contextIdsString(contextIds)).append("\"");
		if (highlight) {
			attrs.append(",fontsize=\"30\"");
		}
		attrs.append(",fillcolor=\"").append(color(node.allocTypes(), highlight)).append("\"");
		if (node.isClone()) {
			attrs.append(",color=\"blue\",style=\"filled,bold,dashed\"");
		} else {
			attrs.append(",style=\"filled\"");
		}
		return attrs.toString();
	}

	private String edgeAttributes(ContextEdge<F, C> edge) {
		boolean highlight = isHighlighted(edge.contextIds());
		var color = color(edge.allocTypes(), highlight);
		var attrs = new StringBuilder();
		attrs.append("tooltip=\"").append(contextIdsString(edge.contextIds())).append("\"");
		// fillcolor is the arrow head, color the line.
		attrs.append(",fillcolor=\"").append(color).append("\"");
		attrs.append(",color=\"").append(color).append("\"");
		if (edge.isBackedge()) {
			attrs.append(",style=\"dotted\"");
		}
		if (highlight) {
			attrs.append(",penwidth=\"2.0\",weight=\"2\"");
		}
		return attrs.toString();
	}

	private static String contextIdsString(ContextIds contextIds) {
		var str = new StringBuilder("ContextIds:");
		if (contextIds.size() < 100) {
			for (int id : contextIds) {
				str.append(" ").append(id);
			}
		} else {
			str.append(" (").append(contextIds.size()).append(" ids)");
		}
		return str.toString();
	}

	private String color(int allocTypes, boolean highlight) {
		if (allocTypes == AllocationType.NOT_COLD.bit()) {
			return !doHighlight || highlight ? "brown1" : "lightpink";
		}
		if (allocTypes == AllocationType.COLD.bit()) {
			return !doHighlight || highlight ? "cyan" : "lightskyblue";
		}
		if (allocTypes == AllocationType.BOTH) {
			return highlight ? "magenta" : "mediumorchid1";
		}
		return "gray";
	}

	private boolean isNodeHidden(ContextNode<F, C> node) {
		if (node.isRemoved()) {
			return true;
		}
		switch (options.dotScope()) {
		case ALLOC:
			return !node.getContextIds().containsAny(graph.dotAllocContextIds());
		case CONTEXT:
			return !node.getContextIds().contains(options.contextIdForDot());
		default:
			return false;
		}
	}

	private static String escape(String label) {
		var str = new StringBuilder();
		for (char c : label.toCharArray()) {
			switch (c) {
			case '\n':
				str.append("\\n");
				break;
			case '"':
			case '{':
			case '}':
			case '<':
			case '>':
			case '|':
			case '\\':
				str.append('\\').append(c);
				break;
			default:
				str.append(c);
			}
		}
		return str.toString();
	}
}
