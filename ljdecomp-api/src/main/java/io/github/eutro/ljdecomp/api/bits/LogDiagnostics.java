package io.github.eutro.ljdecomp.api.bits;

import io.github.eutro.ljdecomp.api.Decompiler;
import io.github.eutro.ljdecomp.api.events.DiagnosticEvent;
import io.github.eutro.ljdecomp.api.events.RunDumpDecompilationEvent;
import io.github.eutro.ljdecomp.core.diag.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A bit which logs every diagnostic of every decompilation, at the level of its severity.
 */
public class LogDiagnostics implements Bit<Decompiler, Void> {
    private static final Logger LOG = LoggerFactory.getLogger(LogDiagnostics.class);

    @Override
    public Void addTo(Decompiler decompiler) {
        decompiler.listen(RunDumpDecompilationEvent.class, evt ->
                evt.decompilation.listen(DiagnosticEvent.class, de -> log(de.diagnostic)));
        return null;
    }

    static void log(Diagnostic diagnostic) {
        switch (diagnostic.getSeverity()) {
            case ERROR:
                LOG.error("{}", diagnostic);
                break;
            case WARNING:
                LOG.warn("{}", diagnostic);
                break;
            default:
                LOG.info("{}", diagnostic);
                break;
        }
    }
}
