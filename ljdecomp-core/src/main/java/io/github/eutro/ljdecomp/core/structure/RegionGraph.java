package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.cfg.ControlFlowGraph;
import io.github.eutro.ljdecomp.core.diag.DecompilationException;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.tree.Conditions;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.If;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.Sequence;
import io.github.eutro.ljdecomp.core.tree.TempFolding;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * The regions of a function being structured, and the acyclic rules that merge them.
 */
public final class RegionGraph {
    private static final Logger LOG = LoggerFactory.getLogger(RegionGraph.class);

    private final @Nullable ControlFlowGraph cfg;
    private final @Nullable DecompileContext ctx;
    private final List<Region> regions = new ArrayList<>();
    private final Map<BasicBlock, Region> byHead = new HashMap<>();
    private final Region root;

    private RegionGraph(@Nullable ControlFlowGraph cfg, @Nullable DecompileContext ctx, List<Region> regions) {
        this.cfg = cfg;
        this.ctx = ctx;
        this.regions.addAll(regions);
        for (Region region : regions) {
            if (region.head != null) byHead.put(region.head, region);
        }
        this.root = regions.get(0);
    }

    /**
     * Build one region per block. Edges whose target dominates their source become {@link Target.Kind#BACK}.
     *
     * @param cfg The normalized graph.
     * @return The region graph.
     */
    static RegionGraph fromCfg(ControlFlowGraph cfg) {
        IrToTree converter = new IrToTree(cfg.function().source);
        Map<BasicBlock, Region> made = new LinkedHashMap<>();
        for (BasicBlock bb : cfg.blocks()) {
            made.put(bb, new Region(bb, bb.startOffset, converter.body(bb), Exit.terminal()));
        }
        for (Region region : made.values()) {
            BasicBlock from = Objects.requireNonNull(region.head);
            region.exit = converter.exit(from, region.body, to -> cfg.isBackEdge(from, to)
                    ? Target.back(to)
                    : Target.region(made.get(to)));
            if (from.getNullable(LuaExts.LOOP_MARKER) != null) {
                region.loopMarker = true;
            }
        }
        return new RegionGraph(cfg, cfg.context(), new ArrayList<>(made.values()));
    }

    /**
     * A graph of one region holding an already structured tree.
     *
     * @param tree The tree.
     * @return The region graph.
     */
    static RegionGraph single(StructuredNode tree) {
        Sequence body = tree instanceof Sequence ? (Sequence) tree : new Sequence(tree);
        return new RegionGraph(null, null, Collections.singletonList(new Region(null, 0, body, Exit.terminal())));
    }

    public @Nullable ControlFlowGraph cfg() {
        return cfg;
    }

    public Region root() {
        return root;
    }

    /**
     * @return The live regions, in offset order.
     */
    public List<Region> liveRegions() {
        return regions.stream()
                .filter(Region::isAlive)
                .sorted(Comparator.comparingInt(r -> r.startOffset))
                .collect(Collectors.toList());
    }

    /**
     * @param head A block.
     * @return The live region entered through that block, or null.
     */
    public @Nullable Region regionAt(BasicBlock head) {
        Region region = byHead.get(head);
        return region != null && region.alive ? region : null;
    }

    /**
     * Count the region edges into each live region.
     *
     * @return The counts, absent for regions without predecessors.
     */
    public Map<Region, Integer> predCounts() {
        Map<Region, Integer> counts = new HashMap<>();
        for (Region region : regions) {
            if (!region.alive) continue;
            for (Target target : region.exit.targets) {
                if (target.isRegion()) counts.merge(target.region, 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * @param region A region.
     * @return The live regions with an edge to it.
     */
    public List<Region> preds(Region region) {
        List<Region> preds = new ArrayList<>();
        for (Region other : liveRegions()) {
            for (Target target : other.exit.targets) {
                if (target.isRegion() && target.region == region) {
                    preds.add(other);
                    break;
                }
            }
        }
        return preds;
    }

    /**
     * Merge the blocks of {@code from} into {@code into}, and retire {@code from}.
     * The caller has already moved its statements.
     *
     * @param into The surviving region.
     * @param from The absorbed region.
     */
    public void absorb(Region into, Region from) {
        if (into == from) return;
        into.blocks.addAll(from.blocks);
        from.alive = false;
    }

    public void report(DiagnosticKind kind, String message, Integer... offsets) {
        if (ctx != null) ctx.report(kind, message, offsets);
    }

    // acyclic rules

    /**
     * Apply the acyclic rules within a scope until none applies, or the work bound is reached.
     *
     * @param scope  The regions that may be merged. Absorbed regions are removed.
     * @param pinned A region that must not absorb anything, or null.
     * @return Whether anything changed.
     */
    public boolean reduce(Set<Region> scope, @Nullable Region pinned) {
        boolean changed = false;
        int budget = 4 * scope.size() + 16;
        boolean progress = true;
        while (progress && budget-- > 0) {
            progress = false;
            List<Region> order = new ArrayList<>(scope);
            order.sort(Comparator.comparingInt(r -> r.startOffset));
            for (Region a : order) {
                if (!a.alive || a == pinned) continue;
                if (applyRule(a, scope, pinned, predCounts())) {
                    progress = changed = true;
                }
            }
            scope.removeIf(r -> !r.alive);
        }
        if (progress) LOG.warn("reduction of {} regions stopped at its work bound", scope.size());
        return changed;
    }

    /**
     * Apply only the short-circuit rule within a scope, so compound loop tests become single regions.
     *
     * @param scope The regions that may be merged. Absorbed regions are removed.
     */
    public void foldConditions(Set<Region> scope) {
        boolean progress = true;
        while (progress) {
            progress = false;
            List<Region> order = new ArrayList<>(scope);
            order.sort(Comparator.comparingInt(r -> r.startOffset));
            for (Region a : order) {
                if (a.alive && a.exit.kind == Exit.Kind.COND && shortCircuit(a, scope, null, predCounts())) {
                    progress = true;
                }
            }
            scope.removeIf(r -> !r.alive);
        }
    }

    private boolean applyRule(Region a, Set<Region> scope, @Nullable Region pinned, Map<Region, Integer> preds) {
        switch (a.exit.kind) {
            case JUMP: {
                Region b = absorbable(a, a.exit.targets[0], scope, pinned, preds);
                if (b == null) return false;
                a.body.append(b.labeledBody());
                a.exit = b.exit;
                absorb(a, b);
                return true;
            }
            case COND:
                return shortCircuit(a, scope, pinned, preds)
                        || ifThen(a, scope, pinned, preds)
                        || ifElse(a, scope, pinned, preds)
                        || absorbEscape(a);
            default:
                return false;
        }
    }

    private @Nullable Region absorbable(Region a, Target target, Set<Region> scope, @Nullable Region pinned,
                                        Map<Region, Integer> preds) {
        if (!target.isRegion()) return null;
        Region b = Objects.requireNonNull(target.region);
        if (b == a || b == pinned || b == root || !b.alive || !scope.contains(b)) return null;
        if (preds.getOrDefault(b, 0) != 1) return null;
        return b;
    }

    private boolean shortCircuit(Region a, Set<Region> scope, @Nullable Region pinned, Map<Region, Integer> preds) {
        Exit outer = a.exit;
        for (int i = 0; i < 2; i++) {
            Region b = absorbable(a, outer.targets[i], scope, pinned, preds);
            if (b == null || b.label != null || b.exit.kind != Exit.Kind.COND) continue;
            Target other = outer.targets[1 - i];
            Exit inner = b.exit;
            if (!other.equals(inner.targets[0]) && !other.equals(inner.targets[1])) continue;
            Expr c2 = foldTemps(b);
            if (c2 == null) continue;
            Expr c1 = Objects.requireNonNull(outer.cond);
            Exit merged;
            if (i == 1) {
                // not taken falls into b
                merged = other.equals(inner.targets[0])
                        ? Exit.cond(Conditions.or(c1, c2), inner.targets[0], inner.targets[1])
                        : Exit.cond(Conditions.or(c1, Conditions.not(c2)), inner.targets[1], inner.targets[0]);
            } else {
                merged = other.equals(inner.targets[1])
                        ? Exit.cond(Conditions.and(c1, c2), inner.targets[0], inner.targets[1])
                        : Exit.cond(Conditions.and(c1, Conditions.not(c2)), inner.targets[1], inner.targets[0]);
            }
            LOG.debug("folding {} into the condition of {}", b, a);
            a.exit = merged;
            absorb(a, b);
            return true;
        }
        return false;
    }

    /**
     * Fold the statements of a condition-only region into its condition.
     *
     * @param b The region.
     * @return The folded condition, or null if some statement is not a dead temporary.
     */
    private @Nullable Expr foldTemps(Region b) {
        Expr cond = Objects.requireNonNull(b.exit.cond);
        if (b.body.isEmpty()) return cond;
        if (cfg == null || b.blocks.size() != 1 || b.head == null) return null;
        BytecodeFunction source = cfg.function().source;
        List<TempFolding.Def> defs = new ArrayList<>();
        for (StructuredNode node : b.body.nodes) {
            if (!(node instanceof ExprStatement)) return null;
            ExprStatement stmt = (ExprStatement) node;
            if (stmt.targets.size() != 1 || stmt.values.size() != 1) return null;
            if (!(stmt.targets.get(0) instanceof Expr.Register)) return null;
            if (stmt.values.get(0) instanceof Expr.MultRes) return null;
            int slot = ((Expr.Register) stmt.targets.get(0)).slot;
            if (cfg.liveOut(b.head).contains(cfg.function().register(slot))) return null;
            if (source.debugInfo != null && source.debugInfo.variableAt(slot, stmt.pc + 1) != null) return null;
            defs.add(new TempFolding.Def(slot, stmt.values.get(0)));
        }
        List<Expr> consumer = new ArrayList<>(Collections.singletonList(cond));
        if (TempFolding.fold(defs, consumer) != defs.size()) return null;
        return consumer.get(0);
    }

    private boolean ifThen(Region a, Set<Region> scope, @Nullable Region pinned, Map<Region, Integer> preds) {
        Exit e = a.exit;
        for (int i = 0; i < 2; i++) {
            Region b = absorbable(a, e.targets[i], scope, pinned, preds);
            if (b == null) continue;
            Target other = e.targets[1 - i];
            boolean rejoins = b.exit.kind == Exit.Kind.JUMP && b.exit.targets[0].equals(other);
            if (!rejoins && !b.exit.isTerminalLike()) continue;
            Sequence then = new Sequence(b.labeledBody());
            if (!rejoins && b.exit.kind == Exit.Kind.JUMP) then.append(b.exit.targets[0].toStatement());
            Expr cond = Objects.requireNonNull(e.cond);
            a.body.append(new If(i == 0 ? cond : Conditions.not(cond), then, null));
            a.exit = Exit.jump(other);
            absorb(a, b);
            return true;
        }
        return false;
    }

    private boolean ifElse(Region a, Set<Region> scope, @Nullable Region pinned, Map<Region, Integer> preds) {
        Exit e = a.exit;
        Region t = absorbable(a, e.targets[0], scope, pinned, preds);
        Region f = absorbable(a, e.targets[1], scope, pinned, preds);
        if (t == null || f == null || t == f) return false;
        Exit join;
        if (t.exit.kind == Exit.Kind.TERMINAL && f.exit.kind == Exit.Kind.TERMINAL) {
            join = Exit.terminal();
        } else if (t.exit.kind == Exit.Kind.JUMP && f.exit.kind == Exit.Kind.JUMP
                && t.exit.targets[0].equals(f.exit.targets[0])) {
            join = t.exit;
        } else {
            return false;
        }
        a.body.append(new If(Objects.requireNonNull(e.cond), new Sequence(t.labeledBody()), new Sequence(f.labeledBody())));
        a.exit = join;
        absorb(a, t);
        absorb(a, f);
        return true;
    }

    private boolean absorbEscape(Region a) {
        Exit e = a.exit;
        for (int i = 0; i < 2; i++) {
            Target escape = e.targets[i];
            if (!escape.isEscape()) continue;
            Expr cond = Objects.requireNonNull(e.cond);
            a.body.append(new If(i == 0 ? cond : Conditions.not(cond), new Sequence(escape.toStatement()), null));
            a.exit = Exit.jump(e.targets[1 - i]);
            return true;
        }
        return false;
    }

    // fallback

    /**
     * Lay regions out in order as labeled blocks that jump to each other explicitly.
     *
     * @param first  The region control enters through; laid out first, unlabeled unless gotos target it.
     * @param others The other regions.
     * @return The statements.
     */
    public Sequence linearize(Region first, Collection<Region> others) {
        List<Region> rest = new ArrayList<>(others);
        rest.remove(first);
        rest.sort(Comparator.comparingInt(r -> r.startOffset));
        for (Region region : rest) {
            region.requireLabel();
        }
        Sequence seq = new Sequence(first.labeledBody());
        seq.append(exitStatements(first));
        for (Region region : rest) {
            Sequence body = new Sequence(region.body);
            body.append(exitStatements(region));
            seq.append(new StructuredNode.Block(region.requireLabel(), body));
        }
        return seq;
    }

    Sequence exitStatements(Region region) {
        Exit e = region.exit;
        switch (e.kind) {
            case TERMINAL:
                return new Sequence();
            case JUMP:
                return new Sequence(jump(e.targets[0]));
            case COND:
                return new Sequence(
                        new If(Objects.requireNonNull(e.cond), new Sequence(jump(e.targets[0])), null),
                        jump(e.targets[1]));
            default:
                throw new DecompilationException(DiagnosticKind.INTERNAL_ERROR,
                        "loop control of " + region + " has no matching loop");
        }
    }

    private StructuredNode jump(Target target) {
        switch (target.kind) {
            case REGION:
                return new StructuredNode.Goto(Objects.requireNonNull(target.region).requireLabel());
            case BACK:
                return new StructuredNode.Goto(requireRegion(Objects.requireNonNull(target.header)).requireLabel());
            default:
                return target.toStatement();
        }
    }

    Region requireRegion(BasicBlock head) {
        Region region = regionAt(head);
        if (region == null) {
            throw new DecompilationException(DiagnosticKind.INTERNAL_ERROR, "no region at " + head.toTargetString());
        }
        return region;
    }

    static List<Integer> offsets(Collection<Region> regions) {
        return regions.stream().map(r -> r.startOffset).sorted().collect(Collectors.toList());
    }
}
