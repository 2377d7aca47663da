package io.github.eutro.ljdecomp.api;

import io.github.eutro.ljdecomp.api.events.*;
import io.github.eutro.ljdecomp.core.bc.BytecodeDump;
import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.DumpReader;
import io.github.eutro.ljdecomp.core.bc.FormatVersion;
import io.github.eutro.ljdecomp.core.cfg.ControlFlowGraph;
import io.github.eutro.ljdecomp.core.cfg.NormalizeCfg;
import io.github.eutro.ljdecomp.core.diag.DecompilationException;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.diag.DiagnosticKind;
import io.github.eutro.ljdecomp.core.ir.Function;
import io.github.eutro.ljdecomp.core.passes.convert.BytecodeToIr;
import io.github.eutro.ljdecomp.core.recover.ExpressionRecovery;
import io.github.eutro.ljdecomp.core.recover.StructuredFunction;
import io.github.eutro.ljdecomp.core.structure.Structurer;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * The decompilation of a single dump.
 * <p>
 * Decompilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunDumpDecompilationEvent} is fired on the {@link Decompiler decompiler}.</li>
 *     <li>The dump is {@link DumpReader read}. A structurally broken dump aborts the run here.</li>
 *     <li>Then, for each function:
 *     <ol>
 *         <li>The function is {@link BytecodeToIr lowered to IR}.</li>
 *         <li>{@link IrPassesEvent} is fired.</li>
 *         <li>The control flow graph is {@link NormalizeCfg normalized}.</li>
 *         <li>Control flow is {@link Structurer structured}.</li>
 *         <li>Expressions and locals are {@link ExpressionRecovery recovered}.</li>
 *         <li>{@link FunctionDecompiledEvent} is fired.</li>
 *     </ol>
 *     </li>
 * </ol>
 * A function that fails gets an error diagnostic and no tree; the others are unaffected.
 * {@link DiagnosticEvent} is fired for each diagnostic as it is reported.
 */
public class DumpDecompilation extends EventSupplier<DumpDecompileEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(DumpDecompilation.class);

    private final Decompiler decompiler;
    @NotNull
    public final ByteBuffer buffer;
    @NotNull
    public final FormatVersion version;

    DumpDecompilation(Decompiler decompiler, @NotNull ByteBuffer buffer, @NotNull FormatVersion version) {
        this.decompiler = decompiler;
        this.buffer = buffer;
        this.version = version;
    }

    /**
     * Run the decompilation on this thread.
     *
     * @return The result.
     * @throws io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException If the dump is structurally broken.
     */
    public DecompileResult run() {
        return run(null);
    }

    /**
     * Run the decompilation, decompiling functions concurrently on the executor.
     * Results are in dump order regardless.
     *
     * @param executor The executor, or null to run on this thread.
     * @return The result.
     * @throws io.github.eutro.ljdecomp.core.diag.MalformedBytecodeException If the dump is structurally broken.
     */
    public DecompileResult run(@Nullable ExecutorService executor) {
        decompiler.dispatch(RunDumpDecompilationEvent.class, new RunDumpDecompilationEvent(this));
        DecompileContext ctx = new DecompileContext(version);
        ctx.diagnostics.onReport(d -> dispatch(DiagnosticEvent.class, new DiagnosticEvent(d)));
        BytecodeDump dump = DumpReader.read(buffer.duplicate(), version, ctx);

        List<FunctionResult> results = new ArrayList<>(dump.functions.size());
        if (executor == null) {
            for (BytecodeFunction fn : dump.functions) {
                results.add(decompile(fn, ctx.forFunction(fn.index)));
            }
        } else {
            List<Future<FunctionResult>> futures = new ArrayList<>(dump.functions.size());
            for (BytecodeFunction fn : dump.functions) {
                DecompileContext fctx = ctx.forFunction(fn.index);
                futures.add(executor.submit(() -> decompile(fn, fctx)));
            }
            for (Future<FunctionResult> future : futures) {
                results.add(await(future));
            }
        }
        LOG.debug("decompiled {} functions", results.size());
        return new DecompileResult(dump, results, ctx.diagnostics.getAll());
    }

    private static FunctionResult await(Future<FunctionResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecompilationException(DiagnosticKind.INTERNAL_ERROR, "interrupted while decompiling", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new DecompilationException(DiagnosticKind.INTERNAL_ERROR, "decompiling failed", cause);
        }
    }

    private FunctionResult decompile(BytecodeFunction fn, DecompileContext fctx) {
        fctx.diagnostics.onReport(d -> dispatch(DiagnosticEvent.class, new DiagnosticEvent(d)));
        StructuredNode.Sequence tree = null;
        List<String> parameters = Collections.emptyList();
        try {
            DecompilationException failure = fn.getDecodeFailure();
            if (failure != null) throw failure;
            Function ir = new BytecodeToIr(fctx).run(fn);
            ir = dispatch(IrPassesEvent.class, new IrPassesEvent(fn, ir)).ir;
            ControlFlowGraph cfg = NormalizeCfg.INSTANCE.run(ir);
            StructuredNode.Sequence structured = new Structurer(decompiler.getLoopIdioms()).structure(cfg);
            StructuredFunction recovered = ExpressionRecovery.INSTANCE.run(new StructuredFunction(fn, structured, fctx));
            tree = recovered.root;
            parameters = recovered.parameters;
        } catch (DecompilationException e) {
            LOG.debug("{} failed", fn, e);
            fctx.report(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("{} failed unexpectedly", fn, e);
            fctx.report(DiagnosticKind.INTERNAL_ERROR, String.valueOf(e));
        }
        FunctionResult result = new FunctionResult(fn, tree, parameters, fctx.diagnostics.getAll());
        dispatch(FunctionDecompiledEvent.class, new FunctionDecompiledEvent(result));
        return result;
    }
}
