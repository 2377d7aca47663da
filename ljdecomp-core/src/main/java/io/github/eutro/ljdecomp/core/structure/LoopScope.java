package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.diag.DecompilationException;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * One natural loop of a {@link RegionGraph}, with the operations loop rules are built from.
 */
public final class LoopScope {
    public final RegionGraph graph;
    public final LuaExts.LoopInfo loop;
    public final Region header;
    /**
     * The live regions of the loop. Absorbed regions are dropped as rules run.
     */
    public final Set<Region> members = new LinkedHashSet<>();

    LoopScope(RegionGraph graph, LuaExts.LoopInfo loop) {
        this.graph = graph;
        this.loop = loop;
        this.header = graph.requireRegion(loop.header);
        Set<BasicBlock> body = new HashSet<>(loop.body);
        for (Region region : graph.liveRegions()) {
            if (region.head != null && body.contains(region.head)) members.add(region);
        }
    }

    public boolean contains(Region region) {
        return members.contains(region);
    }

    /**
     * @param target An edge target.
     * @return Whether the edge leaves the loop.
     */
    public boolean isExit(Target target) {
        switch (target.kind) {
            case REGION:
                return !contains(Objects.requireNonNull(target.region));
            case BACK:
                return target.header != loop.header;
            default:
                return false;
        }
    }

    public boolean isBackToHeader(Target target) {
        return target.kind == Target.Kind.BACK && target.header == loop.header;
    }

    /**
     * @return The regions outside the loop with an edge to the header.
     */
    public List<Region> entries() {
        List<Region> entries = new ArrayList<>();
        for (Region pred : graph.preds(header)) {
            if (!contains(pred)) entries.add(pred);
        }
        return entries;
    }

    /**
     * Replace the edges of the loop by escapes: back edges to the header become
     * {@code continue}, exits to the follow region {@code break}, and other
     * exits gotos to labeled regions.
     *
     * @param follow       Where control goes after the loop, or null.
     * @param control      The region owning an exit edge to keep as it is, or null.
     * @param controlIndex The index of that edge among the region's targets.
     */
    public void convertExits(@Nullable Region follow, @Nullable Region control, int controlIndex) {
        for (Region region : members) {
            Target[] targets = region.exit.targets;
            for (int i = 0; i < targets.length; i++) {
                if (region == control && i == controlIndex) continue;
                Target target = targets[i];
                if (isBackToHeader(target)) {
                    targets[i] = Target.CONTINUE;
                } else if (target.kind == Target.Kind.BACK) {
                    targets[i] = Target.goTo(graph.requireRegion(Objects.requireNonNull(target.header)).requireLabel());
                } else if (target.isRegion() && isExit(target)) {
                    Region to = Objects.requireNonNull(target.region);
                    targets[i] = to == follow ? Target.BREAK : Target.goTo(to.requireLabel());
                }
            }
        }
    }

    /**
     * Run the acyclic rules over the loop.
     *
     * @param pinned A region that must not absorb anything, or null.
     */
    public void reduce(@Nullable Region pinned) {
        graph.reduce(members, pinned);
    }

    /**
     * Turn what is left of the loop body into statements.
     *
     * @param entry  Where the body starts.
     * @param except A region that is not part of the body, or null.
     * @return The body; a trailing jump to the next iteration is left implicit.
     */
    public Sequence body(Target entry, @Nullable Region except) {
        List<Region> rest = new ArrayList<>(members);
        rest.remove(except);
        if (entry.isRegion() && rest.size() == 1 && rest.get(0) == entry.region) {
            return finish(rest.get(0));
        }
        Sequence seq = new Sequence();
        if (rest.isEmpty()) {
            if (entry.isEscape() && entry.kind != Target.Kind.CONTINUE) seq.append(entry.toStatement());
            return seq;
        }
        graph.report(DiagnosticKind.IRREDUCIBLE_CONTROL_FLOW,
                "the body of " + loop + " has no structured form",
                RegionGraph.offsets(rest).toArray(new Integer[0]));
        Region first;
        if (entry.isRegion() && rest.contains(entry.region)) {
            first = entry.region;
        } else {
            first = rest.get(0);
            seq.append(jumpTo(entry, first));
        }
        seq.append(graph.linearize(first, rest));
        // the header's label is now placed inside the loop
        if (rest.contains(header)) header.label = null;
        return seq;
    }

    private StructuredNode jumpTo(Target entry, Region first) {
        if (entry.isEscape()) return entry.toStatement();
        return new StructuredNode.Goto(entry.isRegion()
                ? Objects.requireNonNull(entry.region).requireLabel()
                : first.requireLabel());
    }

    private Sequence finish(Region region) {
        // the header's label goes around the whole loop
        Sequence seq = new Sequence(region == header ? region.body : region.labeledBody());
        Exit exit = region.exit;
        switch (exit.kind) {
            case TERMINAL:
                break;
            case JUMP:
                if (exit.targets[0].kind == Target.Kind.CONTINUE) break;
                if (!exit.targets[0].isEscape()) {
                    throw new DecompilationException(DiagnosticKind.INTERNAL_ERROR,
                            "body of " + loop + " leaves through " + exit.targets[0]);
                }
                seq.append(exit.targets[0].toStatement());
                break;
            default:
                seq.append(graph.exitStatements(region));
                break;
        }
        return seq;
    }

    /**
     * Replace the loop by one statement in the region {@code into}, which is the header or an entry.
     *
     * @param into The surviving region.
     * @param node The loop statement.
     * @param exit How control leaves the statement.
     */
    public void collapse(Region into, StructuredNode node, Exit exit) {
        StructuredNode labeled = header.label == null || into == header
                ? node
                : new StructuredNode.Block(header.label, new Sequence(node));
        if (into == header) {
            into.body = new Sequence(labeled);
        } else {
            into.body.append(labeled);
        }
        into.exit = exit;
        for (Region member : new ArrayList<>(members)) {
            graph.absorb(into, member);
        }
        members.clear();
        members.add(into);
    }

    /**
     * @param follow Where control goes after the loop, or null if it never ends normally.
     * @return The exit of the collapsed loop.
     */
    public static Exit exitTo(@Nullable Region follow) {
        return follow == null ? Exit.terminal() : Exit.jump(Target.region(follow));
    }
}
