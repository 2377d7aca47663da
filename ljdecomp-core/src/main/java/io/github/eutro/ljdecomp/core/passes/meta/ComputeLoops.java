package io.github.eutro.ljdecomp.core.passes.meta;

import io.github.eutro.ljdecomp.core.ext.CommonExts;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.ext.LuaExts.LoopInfo;
import io.github.eutro.ljdecomp.core.ext.MetadataState;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.ir.Function;
import io.github.eutro.ljdecomp.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Finds the natural loops of a function, attaching {@link LuaExts#LOOPS} to it and
 * {@link LuaExts#LOOP} to each header.
 * <p>
 * An edge is a back edge if its target dominates its source. The body of the loop of a header
 * is the header and every block that reaches one of its back edges without passing through it.
 * Back edges sharing a header form one loop.
 */
public class ComputeLoops implements InPlaceIRPass<Function> {
    public static final ComputeLoops INSTANCE = new ComputeLoops();

    /**
     * Check whether an edge is a back edge. Requires dominators.
     *
     * @param from The source of the edge.
     * @param to   The target of the edge.
     * @return Whether {@code to} dominates {@code from}.
     */
    public static boolean isBackEdge(BasicBlock from, BasicBlock to) {
        return ComputeDoms.dominates(to, from);
    }

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.PREDS, MetadataState.DOMS);

        Map<BasicBlock, List<BasicBlock>> latchesByHeader = new LinkedHashMap<>();
        for (BasicBlock block : func.blocks) {
            block.removeExt(LuaExts.LOOP);
            for (BasicBlock target : block.getControl().targets) {
                if (isBackEdge(block, target)) {
                    List<BasicBlock> latches = latchesByHeader.computeIfAbsent(target, $ -> new ArrayList<>());
                    if (!latches.contains(block)) latches.add(block);
                }
            }
        }

        Map<BasicBlock, Integer> position = new HashMap<>();
        for (int i = 0; i < func.blocks.size(); i++) {
            position.put(func.blocks.get(i), i);
        }

        List<LoopInfo> loops = new ArrayList<>();
        for (Map.Entry<BasicBlock, List<BasicBlock>> entry : latchesByHeader.entrySet()) {
            BasicBlock header = entry.getKey();
            Set<BasicBlock> body = new HashSet<>();
            body.add(header);
            Deque<BasicBlock> work = new ArrayDeque<>(entry.getValue());
            while (!work.isEmpty()) {
                BasicBlock next = work.pop();
                if (body.add(next)) {
                    work.addAll(next.getExtOrThrow(CommonExts.PREDS));
                }
            }
            List<BasicBlock> sorted = new ArrayList<>(body);
            sorted.sort(Comparator.comparing(position::get));
            LoopInfo loop = new LoopInfo(header, sorted, entry.getValue());
            header.attachExt(LuaExts.LOOP, loop);
            loops.add(loop);
        }
        // nested loops have strictly smaller bodies
        loops.sort(Comparator.<LoopInfo>comparingInt(l -> l.body.size())
                .thenComparing(l -> -l.header.startOffset));
        func.attachExt(LuaExts.LOOPS, loops);

        ms.validate(MetadataState.LOOPS);
    }
}
