package io.github.eutro.ljdecomp.api;

import io.github.eutro.ljdecomp.api.events.DiagnosticEvent;
import io.github.eutro.ljdecomp.api.events.FunctionDecompiledEvent;
import io.github.eutro.ljdecomp.api.events.IrPassesEvent;
import io.github.eutro.ljdecomp.api.events.RunDumpDecompilationEvent;
import io.github.eutro.ljdecomp.core.bc.FormatVersion;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class EventsTest {
    private static DumpDecompilation submit(Decompiler decompiler) {
        return decompiler.submit(ByteBuffer.wrap(DecompilerTest.goodAndBad()), FormatVersion.LUAJIT_2_1);
    }

    @Test
    void testFunctionEvents() {
        DumpDecompilation decompilation = submit(new Decompiler());
        List<FunctionResult> seen = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger irPasses = new AtomicInteger();
        decompilation.listen(FunctionDecompiledEvent.class, evt -> seen.add(evt.result));
        decompilation.listen(IrPassesEvent.class, evt -> {
            assertNotNull(evt.ir);
            irPasses.incrementAndGet();
        });
        DecompileResult result = decompilation.run();
        assertEquals(3, seen.size());
        for (FunctionResult function : result.functions) {
            assertTrue(seen.contains(function));
        }
        // the bad function fails before it reaches IR
        assertEquals(2, irPasses.get());
    }

    @Test
    void testDiagnosticEvents() {
        DumpDecompilation decompilation = submit(new Decompiler());
        List<DiagnosticKind> kinds = new ArrayList<>();
        decompilation.listen(DiagnosticEvent.class, evt -> kinds.add(evt.diagnostic.kind));
        DecompileResult result = decompilation.run();
        assertTrue(kinds.contains(DiagnosticKind.MALFORMED_BYTECODE), kinds::toString);
        assertEquals(result.allDiagnostics().size(), kinds.size());
    }

    @Test
    void testCancelledDiagnosticKept() {
        DumpDecompilation decompilation = submit(new Decompiler());
        AtomicInteger late = new AtomicInteger();
        decompilation.listen(DiagnosticEvent.class, DiagnosticEvent::cancel);
        decompilation.listen(DiagnosticEvent.class, evt -> late.incrementAndGet());
        DecompileResult result = decompilation.run();
        assertEquals(0, late.get());
        assertTrue(result.hasErrors());
    }

    @Test
    void testListenersLifted() {
        Decompiler decompiler = new Decompiler();
        AtomicInteger runs = new AtomicInteger();
        AtomicInteger functions = new AtomicInteger();
        decompiler.listen(RunDumpDecompilationEvent.class, evt -> runs.incrementAndGet());
        decompiler.lift().listen(FunctionDecompiledEvent.class, evt -> functions.incrementAndGet());
        submit(decompiler).run();
        submit(decompiler).run();
        assertEquals(2, runs.get());
        assertEquals(6, functions.get());
    }
}
