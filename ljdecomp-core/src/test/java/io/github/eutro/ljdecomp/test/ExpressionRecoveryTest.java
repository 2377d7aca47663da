package io.github.eutro.ljdecomp.test;

import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.FormatVersion;
import io.github.eutro.ljdecomp.core.bc.Opcode;
import io.github.eutro.ljdecomp.core.diag.Diagnostic;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.recover.StructuredFunction;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.StructuredNode.ExprStatement;
import io.github.eutro.ljdecomp.core.tree.TreeDumper;
import io.github.eutro.ljdecomp.core.tree.TreeValidator;
import io.github.eutro.ljdecomp.core.tree.Trees;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionRecoveryTest {
    private DecompileContext ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);

    private StructuredFunction decompile(boolean stripped, Function<DumpBuilder, DumpBuilder.Proto> program) {
        DumpBuilder builder = new DumpBuilder(ctx.version);
        if (stripped) builder.stripped();
        BytecodeFunction fn = Utils.readRoot(builder, program.apply(builder), ctx);
        StructuredFunction result = Utils.decompile(fn, ctx);
        TreeValidator.validate(result.root);
        return result;
    }

    private String source(boolean stripped, Function<DumpBuilder, DumpBuilder.Proto> program) {
        return TreeDumper.dump(decompile(stripped, program).root);
    }

    @Test
    void testReturnConstant() {
        assertEquals("return 1\n", source(true, b -> b.proto(0, 1)
                .ad(Opcode.KSHORT, 0, 1)
                .ad(Opcode.RET1, 0, 2)));
    }

    @Test
    void testGlobalCall() {
        assertEquals("print(\"hi\")\nreturn\n", source(true, b -> {
            DumpBuilder.Proto p = b.proto(0, 2);
            int print = p.str("print");
            int hi = p.str("hi");
            return p.ad(Opcode.GGET, 0, print)
                    .ad(Opcode.KSTR, 1, hi)
                    .abc(Opcode.CALL, 0, 1, 2)
                    .ad(Opcode.RET0, 0, 1);
        }));
    }

    @Test
    void testMethodCall() {
        assertEquals("obj:m(1)\nreturn\n", source(true, b -> {
            DumpBuilder.Proto p = b.proto(0, 3);
            int obj = p.str("obj");
            int m = p.str("m");
            return p.ad(Opcode.GGET, 0, obj)
                    .ad(Opcode.MOV, 1, 0)
                    .abc(Opcode.TGETS, 0, 0, m)
                    .ad(Opcode.KSHORT, 2, 1)
                    .abc(Opcode.CALL, 0, 1, 3)
                    .ad(Opcode.RET0, 0, 1);
        }));
    }

    @Test
    void testCallResultsReturned() {
        assertEquals("return f()\n", source(true, b -> {
            DumpBuilder.Proto p = b.proto(0, 1);
            int f = p.str("f");
            return p.ad(Opcode.GGET, 0, f)
                    .abc(Opcode.CALL, 0, 0, 1)
                    .ad(Opcode.RETM, 0, 0);
        }));
    }

    @Test
    void testTableConstructor() {
        assertEquals("return {a, b = y}\n", source(true, b -> {
            DumpBuilder.Proto p = b.proto(0, 2);
            int a = p.str("a");
            int y = p.str("y");
            int key = p.str("b");
            return p.ad(Opcode.TNEW, 0, 0)
                    .ad(Opcode.GGET, 1, a)
                    .abc(Opcode.TSETB, 1, 0, 1)
                    .ad(Opcode.GGET, 1, y)
                    .abc(Opcode.TSETS, 1, 0, key)
                    .ad(Opcode.RET1, 0, 2);
        }));
    }

    @Test
    void testTableConstructorSpread() {
        assertEquals("return {f()}\n", source(true, b -> {
            DumpBuilder.Proto p = b.proto(0, 2);
            int f = p.str("f");
            int start = p.num(1);
            return p.ad(Opcode.TNEW, 0, 0)
                    .ad(Opcode.GGET, 1, f)
                    .abc(Opcode.CALL, 1, 0, 1)
                    .ad(Opcode.TSETM, 1, start)
                    .ad(Opcode.RET1, 0, 2);
        }));
    }

    @Test
    void testOr() {
        assertEquals("return a or b\n", source(true, b -> {
            DumpBuilder.Proto p = b.proto(0, 1);
            int a = p.str("a");
            int bk = p.str("b");
            return p.ad(Opcode.GGET, 0, a)
                    .ad(Opcode.IST, 0, 0)
                    .jump(Opcode.JMP, 1, 4)
                    .ad(Opcode.GGET, 0, bk)
                    .ad(Opcode.RET1, 0, 2);
        }));
    }

    @Test
    void testComparisonValue() {
        assertEquals("return a < b\n", source(true, b -> {
            DumpBuilder.Proto p = b.proto(0, 2);
            int a = p.str("a");
            int bk = p.str("b");
            return p.ad(Opcode.GGET, 0, a)
                    .ad(Opcode.GGET, 1, bk)
                    .ad(Opcode.ISLT, 0, 1)
                    .jump(Opcode.JMP, 2, 6)
                    .ad(Opcode.KPRI, 0, 1)
                    .jump(Opcode.JMP, 2, 7)
                    .ad(Opcode.KPRI, 0, 2)
                    .ad(Opcode.RET1, 0, 2);
        }));
    }

    @Test
    void testNamedLocal() {
        assertEquals("local x = 1\nreturn x\n", source(false, b -> b.proto(0, 1)
                .ad(Opcode.KSHORT, 0, 1)
                .ad(Opcode.RET1, 0, 2)
                .local("x", 1, 2)));
        assertTrue(ctx.diagnostics.isEmpty(), () -> ctx.diagnostics.getAll().toString());
    }

    @Test
    void testNamedParameter() {
        StructuredFunction fn = decompile(false, b -> {
            DumpBuilder.Proto p = b.proto(1, 2);
            int one = p.num(1);
            return p.abc(Opcode.ADDVN, 1, 0, one)
                    .ad(Opcode.RET1, 1, 2)
                    .local("a", 0, 2);
        });
        assertEquals("return a + 1\n", TreeDumper.dump(fn.root));
        assertEquals(Collections.singletonList("a"), fn.parameters);
    }

    @Test
    void testStrippedParameter() {
        StructuredFunction fn = decompile(true, b -> {
            DumpBuilder.Proto p = b.proto(1, 2);
            int one = p.num(1);
            return p.abc(Opcode.ADDVN, 1, 0, one)
                    .ad(Opcode.RET1, 1, 2);
        });
        assertEquals("return slot0 + 1\n", TreeDumper.dump(fn.root));
        assertEquals(Collections.singletonList("slot0"), fn.parameters);
        assertFalse(ctx.diagnostics.has(DiagnosticKind.UNRESOLVED_DEBUG_NAME));
    }

    private static DumpBuilder.Proto doubled(DumpBuilder b) {
        return b.proto(0, 2)
                .ad(Opcode.KSHORT, 0, 5)
                .abc(Opcode.ADDVV, 1, 0, 0)
                .ad(Opcode.RET1, 1, 2);
    }

    @Test
    void testSyntheticLocal() {
        assertEquals("local slot0 = 5\nreturn slot0 + slot0\n", source(true, ExpressionRecoveryTest::doubled));
        assertTrue(ctx.diagnostics.isEmpty());
    }

    @Test
    void testUnresolvedDebugName() {
        assertEquals("local slot0 = 5\nreturn slot0 + slot0\n",
                source(false, b -> doubled(b).withDebugInfo()));
        long unresolved = 0;
        for (Diagnostic diagnostic : ctx.diagnostics.getAll()) {
            if (diagnostic.kind == DiagnosticKind.UNRESOLVED_DEBUG_NAME) unresolved++;
        }
        assertEquals(1, unresolved);
    }

    @Test
    void testNumericForLoop() {
        assertEquals("for slot3 = 1, 3, 1 do\n  f(slot3)\nend\nreturn\n", source(true, StructurerTest::numericFor));
    }

    @Test
    void testWhileCondition() {
        assertEquals("while not a do\nend\nreturn\n", source(true, StructurerTest::breakingLoop));
    }

    @Test
    void testIfCondition() {
        assertEquals("if a < 10 then\n  f()\nend\nreturn\n", source(true, b -> {
            DumpBuilder.Proto p = b.proto(0, 2);
            int a = p.str("a");
            int f = p.str("f");
            return p.ad(Opcode.GGET, 0, a)
                    .ad(Opcode.KSHORT, 1, 10)
                    .ad(Opcode.ISGE, 0, 1)
                    .jump(Opcode.JMP, 2, 6)
                    .ad(Opcode.GGET, 0, f)
                    .abc(Opcode.CALL, 0, 1, 1)
                    .ad(Opcode.RET0, 0, 1);
        }));
    }

    @Test
    void testAndCondition() {
        assertEquals("if a and b then\n  f()\nend\nreturn\n", source(true, StructurerTest::andCondition));
    }

    @Test
    void testRepeatUntil() {
        assertEquals("repeat\n  f()\nuntil a\nreturn\n", source(true, StructurerTest::repeatCall));
    }

    @Test
    void testLocalDeclaredBeforeLabels() {
        StructuredFunction fn = decompile(true, StructurerTest::irreducible);
        assertTrue(ctx.diagnostics.has(DiagnosticKind.IRREDUCIBLE_CONTROL_FLOW));
        List<StructuredNode> declarations = new ArrayList<>();
        Trees.forEachNode(fn.root, node -> {
            if (node instanceof ExprStatement && ((ExprStatement) node).localDeclaration
                    && ((ExprStatement) node).targets.toString().contains("slot1")) {
                declarations.add(node);
            }
        });
        String source = TreeDumper.dump(fn.root);
        assertEquals(1, declarations.size(), source);

        int declared = fn.root.nodes.indexOf(declarations.get(0));
        assertTrue(declared >= 0, source);
        for (int i = 0; i < declared; i++) {
            StructuredNode node = fn.root.nodes.get(i);
            assertNotEquals(StructuredNode.Kind.BLOCK, node.kind(), source);
            assertTrue(Utils.nodesOf(node, StructuredNode.Kind.GOTO).isEmpty(), source);
        }
    }

    @Test
    void testNoRegistersLeft() {
        for (Function<DumpBuilder, DumpBuilder.Proto> program : Arrays.<Function<DumpBuilder, DumpBuilder.Proto>>asList(
                IRTest::ifElse,
                StructurerTest::countingWhile,
                StructurerTest::numericFor,
                StructurerTest::breakingLoop,
                StructurerTest::andCondition,
                StructurerTest::repeatCall)) {
            ctx = new DecompileContext(FormatVersion.LUAJIT_2_1);
            String source = source(true, program);
            assertFalse(source.matches("(?s).*\\br\\d.*"), source);
            assertFalse(source.contains("MULTRES"), source);
        }
    }
}
