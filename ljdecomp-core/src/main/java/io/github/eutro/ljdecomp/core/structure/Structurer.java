package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.cfg.ControlFlowGraph;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.passes.IRPass;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.TreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Recovers structured control flow from a normalized graph.
 * <p>
 * Every block starts as its own {@link Region}. Loops are structured innermost first,
 * trying each {@link LoopIdiom} before the generic {@link LoopKind} rules; then the
 * acyclic rules merge what is left. Regions that never merge are laid out as labeled
 * blocks joined by gotos.
 */
public class Structurer implements IRPass<ControlFlowGraph, StructuredNode> {
    private static final Logger LOG = LoggerFactory.getLogger(Structurer.class);

    public static final List<LoopIdiom> DEFAULT_IDIOMS = Collections.unmodifiableList(Arrays.asList(
            NumericForIdiom.INSTANCE,
            GenericForIdiom.INSTANCE));

    private final List<LoopIdiom> idioms;

    public Structurer() {
        this(DEFAULT_IDIOMS);
    }

    /**
     * @param idioms The loop idioms to try, in order.
     */
    public Structurer(List<LoopIdiom> idioms) {
        this.idioms = new ArrayList<>(idioms);
    }

    @Override
    public StructuredNode run(ControlFlowGraph cfg) {
        return structure(cfg);
    }

    public Sequence structure(ControlFlowGraph cfg) {
        RegionGraph graph = RegionGraph.fromCfg(cfg);
        for (LuaExts.LoopInfo loop : cfg.loops()) {
            structureLoop(graph, loop);
        }
        Sequence tree = finish(graph);
        TreeValidator.checkScoping(tree);
        LOG.debug("{}: structured into\n{}", cfg.function().source, tree);
        return tree;
    }

    /**
     * Run the rules again over a tree that is already structured.
     *
     * @param tree The tree.
     * @return An equivalent tree; the same tree, as there is nothing left to merge.
     */
    public StructuredNode restructure(StructuredNode tree) {
        RegionGraph graph = RegionGraph.single(tree);
        Sequence result = finish(graph);
        return result.nodes.size() == 1 && !(tree instanceof Sequence) ? result.nodes.get(0) : result;
    }

    private void structureLoop(RegionGraph graph, LuaExts.LoopInfo loop) {
        LoopScope scope = new LoopScope(graph, loop);
        LoopKind generic = GenericLoops.classify(scope).kind;
        for (LoopIdiom idiom : idioms) {
            if (idiom.apply(scope)) {
                LOG.debug("{} matched {}", loop, idiom.name());
                graph.report(DiagnosticKind.AMBIGUOUS_IDIOM_MATCH,
                        idiom.name() + " loop chosen over the generic " + generic.name().toLowerCase() + " classification",
                        loop.header.startOffset);
                return;
            }
        }
        graph.foldConditions(scope.members);
        GenericLoops.structure(scope);
    }

    private Sequence finish(RegionGraph graph) {
        Set<Region> all = new LinkedHashSet<>(graph.liveRegions());
        graph.reduce(all, null);
        List<Region> live = graph.liveRegions();
        Region root = graph.root();
        if (live.size() == 1 && root.exit.kind == Exit.Kind.TERMINAL) {
            StructuredNode body = root.labeledBody();
            return body instanceof Sequence ? (Sequence) body : new Sequence(body);
        }
        LOG.warn("{} regions left unstructured: {}", live.size(), RegionGraph.offsets(live));
        graph.report(DiagnosticKind.IRREDUCIBLE_CONTROL_FLOW,
                "control flow has no structured form; emitting labeled blocks",
                RegionGraph.offsets(live).toArray(new Integer[0]));
        return graph.linearize(root, live);
    }
}
