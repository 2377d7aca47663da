package io.github.eutro.ljdecomp.test;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.FormatVersion;
import io.github.eutro.ljdecomp.core.bc.Opcode;
import io.github.eutro.ljdecomp.core.diag.DecompilationException;
import io.github.eutro.ljdecomp.core.diag.Diagnostic;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.structure.Structurer;
import io.github.eutro.ljdecomp.core.tree.Expr;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.*;
import io.github.eutro.ljdecomp.core.tree.TreeDumper;
import io.github.eutro.ljdecomp.core.tree.TreeValidator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class StructurerTest {
    /**
     * {@code local i, n = 0, 10; while i < n do i = i + 1 end; return i}
     */
    static DumpBuilder.Proto countingWhile(DumpBuilder builder) {
        DumpBuilder.Proto proto = builder.proto(0, 2);
        int one = proto.num(1);
        return proto
                .ad(Opcode.KSHORT, 0, 0)
                .ad(Opcode.KSHORT, 1, 10)
                .ad(Opcode.ISGE, 0, 1)
                .jump(Opcode.JMP, 2, 6)
                .abc(Opcode.ADDVN, 0, 0, one)
                .jump(Opcode.JMP, 2, 2)
                .ad(Opcode.RET1, 0, 2);
    }

    /**
     * {@code for i = 1, 3 do f(i) end}
     */
    static DumpBuilder.Proto numericFor(DumpBuilder builder) {
        DumpBuilder.Proto proto = builder.proto(0, 6);
        int f = proto.str("f");
        return proto
                .ad(Opcode.KSHORT, 0, 1)
                .ad(Opcode.KSHORT, 1, 3)
                .ad(Opcode.KSHORT, 2, 1)
                .jump(Opcode.FORI, 0, 8)
                .ad(Opcode.GGET, 4, f)
                .ad(Opcode.MOV, 5, 3)
                .abc(Opcode.CALL, 4, 1, 2)
                .jump(Opcode.FORL, 0, 4)
                .ad(Opcode.RET0, 0, 1);
    }

    /**
     * {@code while true do if a then break end end}
     */
    static DumpBuilder.Proto breakingLoop(DumpBuilder builder) {
        DumpBuilder.Proto proto = builder.proto(0, 1);
        int a = proto.str("a");
        return proto
                .ad(Opcode.GGET, 0, a)
                .ad(Opcode.IST, 0, 0)
                .jump(Opcode.JMP, 1, 4)
                .jump(Opcode.JMP, 1, 0)
                .ad(Opcode.RET0, 0, 1);
    }

    /**
     * {@code if a and b then f() end}
     */
    static DumpBuilder.Proto andCondition(DumpBuilder builder) {
        DumpBuilder.Proto proto = builder.proto(0, 1);
        int a = proto.str("a");
        int b = proto.str("b");
        int f = proto.str("f");
        return proto
                .ad(Opcode.GGET, 0, a)
                .ad(Opcode.ISF, 0, 0)
                .jump(Opcode.JMP, 1, 8)
                .ad(Opcode.GGET, 0, b)
                .ad(Opcode.ISF, 0, 0)
                .jump(Opcode.JMP, 1, 8)
                .ad(Opcode.GGET, 0, f)
                .abc(Opcode.CALL, 0, 1, 1)
                .ad(Opcode.RET0, 0, 1);
    }

    /**
     * {@code repeat f() until a}
     */
    static DumpBuilder.Proto repeatCall(DumpBuilder builder) {
        DumpBuilder.Proto proto = builder.proto(0, 1);
        int f = proto.str("f");
        int a = proto.str("a");
        return proto
                .jump(Opcode.LOOP, 0, 6)
                .ad(Opcode.GGET, 0, f)
                .abc(Opcode.CALL, 0, 1, 1)
                .ad(Opcode.GGET, 0, a)
                .ad(Opcode.ISF, 0, 0)
                .jump(Opcode.JMP, 1, 0)
                .ad(Opcode.RET0, 0, 1);
    }

    /**
     * {@code for k, v in pairs(t) do f(k) end}
     */
    static DumpBuilder.Proto pairsLoop(DumpBuilder builder) {
        DumpBuilder.Proto proto = builder.proto(0, 7);
        int pairs = proto.str("pairs");
        int t = proto.str("t");
        int f = proto.str("f");
        return proto
                .ad(Opcode.GGET, 0, pairs)
                .ad(Opcode.GGET, 1, t)
                .abc(Opcode.CALL, 0, 4, 2)
                .jump(Opcode.JMP, 3, 7)
                .ad(Opcode.GGET, 5, f)
                .ad(Opcode.MOV, 6, 3)
                .abc(Opcode.CALL, 5, 1, 2)
                .abc(Opcode.ITERC, 3, 3, 3)
                .jump(Opcode.ITERL, 3, 4)
                .ad(Opcode.RET0, 0, 1);
    }

    /**
     * Two entries into the cycle between pc 3 and pc 4, which no loop statement expresses.
     */
    static DumpBuilder.Proto irreducible(DumpBuilder builder) {
        DumpBuilder.Proto proto = builder.proto(0, 4);
        int a = proto.str("a");
        int f = proto.str("f");
        int b = proto.str("b");
        return proto
                .ad(Opcode.GGET, 0, a)
                .ad(Opcode.IST, 0, 0)
                .jump(Opcode.JMP, 1, 4)
                .ad(Opcode.KSHORT, 1, 5)
                .ad(Opcode.GGET, 2, f)
                .ad(Opcode.MOV, 3, 1)
                .abc(Opcode.CALL, 2, 1, 2)
                .ad(Opcode.GGET, 0, b)
                .ad(Opcode.IST, 0, 0)
                .jump(Opcode.JMP, 1, 3)
                .ad(Opcode.RET0, 0, 1);
    }

    private static Sequence structure(Function<DumpBuilder, DumpBuilder.Proto> program, DecompileContext ctx) {
        DumpBuilder builder = new DumpBuilder(ctx.version).stripped();
        BytecodeFunction fn = Utils.readRoot(builder, program.apply(builder), ctx);
        return Utils.structure(fn, ctx);
    }

    private static void assertLoopScoped(StructuredNode node, int loopDepth) {
        if (node.kind() == StructuredNode.Kind.BREAK || node.kind() == StructuredNode.Kind.CONTINUE) {
            assertTrue(loopDepth > 0, "break or continue outside a loop");
        }
        for (StructuredNode child : node.children()) {
            assertLoopScoped(child, node.isLoop() ? loopDepth + 1 : loopDepth);
        }
    }

    @Test
    void testStraightLine() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(b -> b.proto(0, 1)
                .ad(Opcode.KSHORT, 0, 1)
                .ad(Opcode.RET1, 0, 2), ctx);
        assertEquals("r0 = 1\nreturn r0\n", TreeDumper.dump(tree));
        assertTrue(ctx.diagnostics.isEmpty());
    }

    @Test
    void testIfElse() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(IRTest::ifElse, ctx);
        List<StructuredNode> ifs = Utils.nodesOf(tree, StructuredNode.Kind.IF);
        assertEquals(1, ifs.size(), () -> TreeDumper.dump(tree));
        If anIf = (If) ifs.get(0);
        assertEquals(1, anIf.then.nodes.size());
        assertNotNull(anIf.orElse);
        assertEquals(1, anIf.orElse.nodes.size());
        assertEquals(1, Utils.nodesOf(tree, StructuredNode.Kind.RETURN).size());
        assertTrue(Utils.nodesOf(tree, StructuredNode.Kind.GOTO).isEmpty());
    }

    @Test
    void testNumericFor() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(StructurerTest::numericFor, ctx);
        List<StructuredNode> loops = Utils.nodesOf(tree, StructuredNode.Kind.NUMERIC_FOR);
        assertEquals(1, loops.size(), () -> TreeDumper.dump(tree));
        NumericFor loop = (NumericFor) loops.get(0);
        assertEquals(3, ((Expr.Register) loop.variable).slot);
        assertEquals(0, ((Expr.Register) loop.start).slot);
        assertEquals(3, loop.body.nodes.size());
        assertTrue(Utils.nodesOf(tree, StructuredNode.Kind.WHILE).isEmpty());
        assertTrue(ctx.diagnostics.has(DiagnosticKind.AMBIGUOUS_IDIOM_MATCH));
    }

    @Test
    void testWhile() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(StructurerTest::countingWhile, ctx);
        List<StructuredNode> loops = Utils.nodesOf(tree, StructuredNode.Kind.WHILE);
        assertEquals(1, loops.size(), () -> TreeDumper.dump(tree));
        While loop = (While) loops.get(0);
        assertEquals("r0 < r1", loop.cond.toString());
        assertEquals(1, loop.body.nodes.size());
        assertTrue(Utils.nodesOf(tree, StructuredNode.Kind.NUMERIC_FOR).isEmpty());
        assertFalse(ctx.diagnostics.has(DiagnosticKind.AMBIGUOUS_IDIOM_MATCH));
        assertEquals("r0 = 0\nr1 = 10\nwhile r0 < r1 do\n  r0 = r0 + 1\nend\nreturn r0\n", TreeDumper.dump(tree));
    }

    @Test
    void testBreakStaysInLoop() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(StructurerTest::breakingLoop, ctx);
        assertEquals(1, Utils.nodesOf(tree, StructuredNode.Kind.WHILE).size(), () -> TreeDumper.dump(tree));
        assertEquals(1, Utils.nodesOf(tree, StructuredNode.Kind.BREAK).size());
        assertLoopScoped(tree, 0);
        for (Function<DumpBuilder, DumpBuilder.Proto> program : programs()) {
            assertLoopScoped(structure(program, new DecompileContext(FormatVersion.LUAJIT_2_1)), 0);
        }
    }

    @Test
    void testAndCondition() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(StructurerTest::andCondition, ctx);
        List<StructuredNode> ifs = Utils.nodesOf(tree, StructuredNode.Kind.IF);
        assertEquals(1, ifs.size(), () -> TreeDumper.dump(tree));
        If anIf = (If) ifs.get(0);
        assertEquals("r0 and b", anIf.cond.toString());
        assertNull(anIf.orElse);
        assertTrue(Utils.nodesOf(tree, StructuredNode.Kind.GOTO).isEmpty());
    }

    @Test
    void testRepeatUntil() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(StructurerTest::repeatCall, ctx);
        List<StructuredNode> loops = Utils.nodesOf(tree, StructuredNode.Kind.REPEAT_UNTIL);
        assertEquals(1, loops.size(), () -> TreeDumper.dump(tree));
        assertEquals("r0", ((RepeatUntil) loops.get(0)).cond.toString());
        assertTrue(Utils.nodesOf(tree, StructuredNode.Kind.WHILE).isEmpty());
        assertTrue(Utils.nodesOf(tree, StructuredNode.Kind.GOTO).isEmpty());
        assertLoopScoped(tree, 0);
    }

    @Test
    void testGenericFor() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(StructurerTest::pairsLoop, ctx);
        List<StructuredNode> loops = Utils.nodesOf(tree, StructuredNode.Kind.GENERIC_FOR);
        assertEquals(1, loops.size(), () -> TreeDumper.dump(tree));
        GenericFor loop = (GenericFor) loops.get(0);
        assertEquals(2, loop.variables.size());
        assertEquals(3, ((Expr.Register) loop.variables.get(0)).slot);
        assertEquals(4, ((Expr.Register) loop.variables.get(1)).slot);
        assertEquals(3, loop.iterators.size());
        assertEquals(0, ((Expr.Register) loop.iterators.get(0)).slot);
        assertFalse(loop.body.nodes.isEmpty());
        assertTrue(Utils.nodesOf(tree, StructuredNode.Kind.WHILE).isEmpty());
        assertTrue(Utils.nodesOf(tree, StructuredNode.Kind.GOTO).isEmpty());
    }

    @Test
    void testIrreducibleResidue() {
        DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
        Sequence tree = structure(StructurerTest::irreducible, ctx);
        assertFalse(Utils.nodesOf(tree, StructuredNode.Kind.BLOCK).isEmpty(), () -> TreeDumper.dump(tree));
        assertFalse(Utils.nodesOf(tree, StructuredNode.Kind.GOTO).isEmpty());
        TreeValidator.checkScoping(tree);
        Diagnostic irreducible = null;
        for (Diagnostic diagnostic : ctx.diagnostics.getAll()) {
            if (diagnostic.kind == DiagnosticKind.IRREDUCIBLE_CONTROL_FLOW) irreducible = diagnostic;
        }
        assertNotNull(irreducible);
        assertTrue(irreducible.offsets.contains(3), irreducible.offsets::toString);
        assertTrue(irreducible.offsets.contains(4), irreducible.offsets::toString);
    }

    @Test
    void testScopingChecked() {
        assertThrows(DecompilationException.class, () -> TreeValidator.checkScoping(new Sequence(new Break())));
        assertThrows(DecompilationException.class, () -> TreeValidator.checkScoping(new Sequence(new Goto("nowhere"))));
        TreeValidator.checkScoping(new Sequence(new While(Expr.Constant.of(true), new Sequence(new Break()))));
    }

    @Test
    void testRestructureIdempotent() {
        for (Function<DumpBuilder, DumpBuilder.Proto> program : programs()) {
            Sequence tree = structure(program, new DecompileContext(FormatVersion.LUAJIT_2_1));
            String before = TreeDumper.dump(tree);
            StructuredNode again = new Structurer().restructure(tree);
            assertEquals(before, TreeDumper.dump(again));
        }
    }

    private static List<Function<DumpBuilder, DumpBuilder.Proto>> programs() {
        return Arrays.asList(
                IRTest::ifElse,
                StructurerTest::countingWhile,
                StructurerTest::numericFor,
                StructurerTest::breakingLoop);
    }
}
