package io.github.eutro.ljdecomp.test;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.FormatVersion;
import io.github.eutro.ljdecomp.core.bc.Opcode;
import io.github.eutro.ljdecomp.core.cfg.ControlFlowGraph;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException;
import io.github.eutro.ljdecomp.core.diag.UnsupportedOpcodeException;
import io.github.eutro.ljdecomp.core.ext.LuaExts;
import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.ir.Effect;
import io.github.eutro.ljdecomp.core.ir.Function;
import io.github.eutro.ljdecomp.core.ops.CommonOps;
import io.github.eutro.ljdecomp.core.ops.LuaOps;
import io.github.eutro.ljdecomp.core.passes.convert.BytecodeToIr;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IRTest {
    static DumpBuilder.Proto ifElse(DumpBuilder builder) {
        DumpBuilder.Proto proto = builder.proto(0, 1);
        int a = proto.str("a");
        return proto
                .ad(Opcode.GGET, 0, a)
                .ad(Opcode.ISF, 0, 0)
                .jump(Opcode.JMP, 1, 5)
                .ad(Opcode.KSHORT, 0, 1)
                .jump(Opcode.JMP, 1, 6)
                .ad(Opcode.KSHORT, 0, 2)
                .ad(Opcode.RET1, 0, 2);
    }

    @Test
    void testBlocksPartitionInstructions() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).stripped();
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        BytecodeFunction fn = Utils.readRoot(builder, ifElse(builder), ctx);
        Function func = new BytecodeToIr(ctx).run(fn);

        List<Integer> starts = new ArrayList<>();
        int expectedStart = 0;
        for (BasicBlock bb : func.blocks) {
            starts.add(bb.startOffset);
            assertEquals(expectedStart, bb.startOffset);
            assertTrue(bb.endOffset > bb.startOffset, bb::toString);
            assertNotNull(bb.getControl(), bb::toString);
            expectedStart = bb.endOffset;
        }
        assertEquals(fn.size(), expectedStart);
        assertEquals(Arrays.asList(0, 3, 5, 6), starts);

        BasicBlock entry = func.blocks.get(0);
        assertSame(LuaOps.COND, entry.getControl().insn().op.key);
        assertEquals(Arrays.asList(func.blockAt(5), func.blockAt(3)), entry.getControl().targets);
        assertSame(CommonOps.RETURN, func.blockAt(6).getControl().insn().op.key);
        for (BasicBlock bb : func.blocks) {
            for (Effect effect : bb.getEffects()) {
                Integer pc = effect.getNullable(LuaExts.PC);
                assertNotNull(pc, effect::toString);
                assertTrue(pc >= bb.startOffset && pc < bb.endOffset, effect::toString);
            }
        }
    }

    @Test
    void testConditionWithoutJump() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).stripped();
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        DumpBuilder.Proto proto = builder.proto(1, 1)
                .ad(Opcode.IST, 0, 0)
                .ad(Opcode.RET0, 0, 1);
        BytecodeFunction fn = Utils.readRoot(builder, proto, ctx);
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> new BytecodeToIr(ctx).run(fn));
        assertEquals(0, e.getOffset());
    }

    @Test
    void testJumpIntoComparePair() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).stripped();
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        DumpBuilder.Proto proto = builder.proto(1, 1)
                .ad(Opcode.IST, 0, 0)
                .jump(Opcode.JMP, 1, 3)
                .jump(Opcode.JMP, 1, 1)
                .ad(Opcode.RET0, 0, 1);
        BytecodeFunction fn = Utils.readRoot(builder, proto, ctx);
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> new BytecodeToIr(ctx).run(fn));
        assertEquals(1, e.getOffset());
    }

    @Test
    void testJitOnlyOpcode() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_0).stripped();
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_0);
        DumpBuilder.Proto proto = builder.proto(0, 1)
                .ad(Opcode.JLOOP, 0, 0)
                .ad(Opcode.RET0, 0, 1);
        BytecodeFunction fn = Utils.readRoot(builder, proto, ctx);
        UnsupportedOpcodeException e = assertThrows(UnsupportedOpcodeException.class,
                () -> new BytecodeToIr(ctx).run(fn));
        assertEquals(0, e.getPc());
        assertEquals(FormatVersion.LUAJIT_2_0.number(Opcode.JLOOP), e.getOpcode());
    }

    @Test
    void testUnreachableBlocksPruned() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).stripped();
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        DumpBuilder.Proto proto = builder.proto(0, 1)
                .ad(Opcode.RET0, 0, 1)
                .ad(Opcode.KSHORT, 0, 1)
                .ad(Opcode.RET1, 0, 2);
        BytecodeFunction fn = Utils.readRoot(builder, proto, ctx);
        ControlFlowGraph cfg = Utils.cfg(fn, ctx);
        assertEquals(1, cfg.blocks().size());
        assertTrue(ctx.diagnostics.has(DiagnosticKind.UNREACHABLE_CODE));
        assertEquals(Arrays.asList(1), ctx.diagnostics.getAll().get(0).offsets);
    }

    @Test
    void testLoopDetected() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).stripped();
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        BytecodeFunction fn = Utils.readRoot(builder, StructurerTest.countingWhile(builder), ctx);
        ControlFlowGraph cfg = Utils.cfg(fn, ctx);
        assertEquals(1, cfg.loops().size());
        BasicBlock header = cfg.loops().get(0).header;
        assertEquals(2, header.startOffset);
        assertTrue(cfg.dominates(cfg.entry(), header));
        assertEquals(1, cfg.backEdges().size());
        assertSame(header, cfg.backEdges().get(0)[1]);
    }
}
