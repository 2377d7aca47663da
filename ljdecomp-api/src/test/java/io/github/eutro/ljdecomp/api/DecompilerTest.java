package io.github.eutro.ljdecomp.api;

import io.github.eutro.ljdecomp.api.bits.LogDiagnostics;
import io.github.eutro.ljdecomp.core.bc.FormatVersion;
import io.github.eutro.ljdecomp.core.bc.Opcode;
import io.github.eutro.ljdecomp.core.diag.Diagnostic;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException;
import io.github.eutro.ljdecomp.core.tree.TreeDumper;
import io.github.eutro.ljdecomp.test.DumpBuilder;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class DecompilerTest {
    /**
     * A root that defines two globals: {@code good}, which returns 1,
     * and {@code bad}, whose bytecode writes past its frame.
     */
    static byte[] goodAndBad() {
        DumpBuilder builder = new DumpBuilder(FormatVersion.LUAJIT_2_1).stripped();
        DumpBuilder.Proto good = builder.proto(0, 1)
                .ad(Opcode.KSHORT, 0, 1)
                .ad(Opcode.RET1, 0, 2);
        DumpBuilder.Proto bad = builder.proto(0, 1)
                .ad(Opcode.MOV, 1, 0)
                .ad(Opcode.RET0, 0, 1);
        DumpBuilder.Proto root = builder.proto(0, 1);
        int goodFn = root.child(good);
        int badFn = root.child(bad);
        int goodName = root.str("good");
        int badName = root.str("bad");
        root.ad(Opcode.FNEW, 0, goodFn)
                .ad(Opcode.GSET, 0, goodName)
                .ad(Opcode.FNEW, 0, badFn)
                .ad(Opcode.GSET, 0, badName)
                .ad(Opcode.RET0, 0, 1);
        return builder.build(root);
    }

    static List<FunctionResult> failures(DecompileResult result) {
        List<FunctionResult> failed = new ArrayList<>();
        for (FunctionResult function : result.functions) {
            if (!function.isSuccess()) failed.add(function);
        }
        return failed;
    }

    @Test
    void testFailureIsolatedToFunction() {
        DecompileResult result = new Decompiler()
                .submit(ByteBuffer.wrap(goodAndBad()), FormatVersion.LUAJIT_2_1)
                .run();
        assertEquals(3, result.functions.size());
        assertTrue(result.getFunction(0).isSuccess(), () -> result.getFunction(0).toString());

        List<FunctionResult> failed = failures(result);
        assertEquals(1, failed.size());
        FunctionResult bad = failed.get(0);
        assertNull(bad.tree);
        assertFalse(bad.diagnostics.isEmpty());
        for (Diagnostic diagnostic : bad.diagnostics) {
            assertEquals(bad.function.index, diagnostic.functionIndex);
        }
        assertEquals(DiagnosticKind.MALFORMED_BYTECODE, bad.diagnostics.get(0).kind);
        assertTrue(result.hasErrors());

        for (FunctionResult function : result.functions) {
            if (function != bad && function.function.index != 0) {
                assertEquals("return 1\n", TreeDumper.dump(function.tree));
            }
        }
    }

    @Test
    void testResultsInDumpOrder() {
        byte[] dump = goodAndBad();
        DecompileResult sequential = new Decompiler()
                .submit(ByteBuffer.wrap(dump), FormatVersion.LUAJIT_2_1)
                .run();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        DecompileResult concurrent;
        try {
            concurrent = new Decompiler()
                    .submit(ByteBuffer.wrap(dump), FormatVersion.LUAJIT_2_1)
                    .run(executor);
        } finally {
            executor.shutdown();
        }
        assertEquals(sequential.functions.size(), concurrent.functions.size());
        for (int i = 0; i < sequential.functions.size(); i++) {
            FunctionResult expected = sequential.getFunction(i);
            FunctionResult actual = concurrent.getFunction(i);
            assertEquals(i, actual.function.index);
            assertEquals(expected.isSuccess(), actual.isSuccess());
            assertEquals(expected.toString(), actual.toString());
        }
    }

    @Test
    void testBrokenDumpThrows() {
        DumpDecompilation decompilation = new Decompiler()
                .submit(ByteBuffer.wrap(new byte[]{0x1b, 'L', 'X', 2}), FormatVersion.LUAJIT_2_1);
        assertThrows(MalformedBytecodeException.class, decompilation::run);
    }

    @Test
    void testSubmitStream() throws Exception {
        DecompileResult result = new Decompiler()
                .submit(new ByteArrayInputStream(goodAndBad()), FormatVersion.LUAJIT_2_1)
                .run();
        assertEquals(3, result.functions.size());
        assertEquals(1, failures(result).size());
    }

    @Test
    void testLogDiagnostics() {
        Decompiler decompiler = new Decompiler();
        assertNull(decompiler.add(new LogDiagnostics()));
        DecompileResult result = decompiler.submit(ByteBuffer.wrap(goodAndBad()), FormatVersion.LUAJIT_2_1).run();
        assertTrue(result.hasErrors());
    }
}
