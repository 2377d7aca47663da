package io.github.eutro.ljdecomp.core.cfg;

import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.ext.MetadataState;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.ir.Function;
import io.github.eutro.ljdecomp.core.ir.Var;
import io.github.eutro.ljdecomp.core.passes.meta.ComputeDoms;
import io.github.eutro.ljdecomp.core.passes.meta.ComputeLoops;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A read-only view of a normalized {@link Function}.
 * <p>
 * The view reads the metadata exts attached by {@link NormalizeCfg}; it is
 * invalid once the function's blocks are changed.
 */
public final class ControlFlowGraph {
    private final Function func;

    ControlFlowGraph(Function func) {
        this.func = func;
    }

    public Function function() {
        return func;
    }

    public @Nullable DecompileContext context() {
        return func.getNullable(LuaExts.CONTEXT);
    }

    public BasicBlock entry() {
        return func.blocks.get(0);
    }

    /**
     * The blocks, in offset order.
     *
     * @return The blocks.
     */
    public List<BasicBlock> blocks() {
        return Collections.unmodifiableList(func.blocks);
    }

    public @Nullable BasicBlock blockAt(int offset) {
        return func.blockAt(offset);
    }

    public List<BasicBlock> preds(BasicBlock bb) {
        return bb.getExtOrThrow(CommonExts.PREDS);
    }

    public List<BasicBlock> succs(BasicBlock bb) {
        return bb.getControl().targets;
    }

    /**
     * @param bb The block.
     * @return The immediate dominator, or null for the entry.
     */
    public @Nullable BasicBlock idom(BasicBlock bb) {
        return bb.getNullable(CommonExts.IDOM);
    }

    public boolean dominates(BasicBlock a, BasicBlock b) {
        return ComputeDoms.dominates(a, b);
    }

    public boolean isBackEdge(BasicBlock from, BasicBlock to) {
        return ComputeLoops.isBackEdge(from, to);
    }

    /**
     * @return Every edge whose target dominates its source, as {@code [from, to]} pairs.
     */
    public List<BasicBlock[]> backEdges() {
        List<BasicBlock[]> edges = new ArrayList<>();
        for (BasicBlock bb : func.blocks) {
            for (BasicBlock target : succs(bb)) {
                if (isBackEdge(bb, target)) edges.add(new BasicBlock[]{bb, target});
            }
        }
        return edges;
    }

    /**
     * @return The natural loops, innermost first.
     */
    public List<LuaExts.LoopInfo> loops() {
        return func.getExtOrThrow(LuaExts.LOOPS);
    }

    public @Nullable LuaExts.LoopInfo loopAt(BasicBlock header) {
        return header.getNullable(LuaExts.LOOP);
    }

    public Set<Var> liveIn(BasicBlock bb) {
        return bb.getExtOrThrow(CommonExts.LIVE_DATA).liveIn;
    }

    public Set<Var> liveOut(BasicBlock bb) {
        return bb.getExtOrThrow(CommonExts.LIVE_DATA).liveOut;
    }

    boolean isComplete() {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        return ms.isValid(MetadataState.PREDS)
                && ms.isValid(MetadataState.DOMS)
                && ms.isValid(MetadataState.LOOPS)
                && ms.isValid(MetadataState.LIVE_DATA);
    }

    @Override
    public String toString() {
        return "cfg of " + func;
    }
}
