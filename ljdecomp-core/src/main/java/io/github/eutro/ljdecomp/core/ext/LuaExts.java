package io.github.eutro.ljdecomp.core.ext;

import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;

import java.util.List;

/**
 * Exts that relate the IR back to the bytecode.
 */
public class LuaExts {
    /**
     * The offset of the bytecode instruction an effect or control was lowered from.
     */
    public static final Ext<Integer> PC = Ext.create(Integer.class, "PC");
    /**
     * On a block starting with a {@code LOOP} instruction, that instruction's offset.
     */
    public static final Ext<Integer> LOOP_MARKER = Ext.create(Integer.class, "LOOP_MARKER");
    /**
     * On a function, where its diagnostics go.
     */
    public static final Ext<DecompileContext> CONTEXT = Ext.create(DecompileContext.class, "CONTEXT");

    /**
     * On a function, its natural loops, innermost first.
     */
    public static final Ext<List<LoopInfo>> LOOPS = Ext.create(List.class, "LOOPS");
    /**
     * On a loop header, the loop it heads.
     */
    public static final Ext<LoopInfo> LOOP = Ext.create(LoopInfo.class, "LOOP");

    /**
     * A natural loop.
     */
    public static class LoopInfo {
        public final BasicBlock header;
        /**
         * The blocks of the loop, including the header, in offset order.
         */
        public final List<BasicBlock> body;
        /**
         * The blocks with a back edge to the header.
         */
        public final List<BasicBlock> latches;

        public LoopInfo(BasicBlock header, List<BasicBlock> body, List<BasicBlock> latches) {
            this.header = header;
            this.body = body;
            this.latches = latches;
        }

        @Override
        public String toString() {
            return "loop " + header.toTargetString() + " of " + body.size() + " blocks";
        }
    }
}
