package io.github.eutro.ljdecomp.core.diag;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * An ordered accumulator of diagnostics.
 * <p>
 * Not thread-safe; each concurrently decompiled function gets its own.
 */
public class Diagnostics {
    private final List<Diagnostic> list = new ArrayList<>();
    private final List<Consumer<Diagnostic>> listeners = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        list.add(diagnostic);
        for (Consumer<Diagnostic> listener : listeners) {
            listener.accept(diagnostic);
        }
    }

    public void report(DiagnosticKind kind, int functionIndex, String message, Integer... offsets) {
        report(new Diagnostic(kind, functionIndex, message, Arrays.asList(offsets)));
    }

    /**
     * Run a consumer on every diagnostic reported from now on.
     *
     * @param listener The listener.
     */
    public void onReport(Consumer<Diagnostic> listener) {
        listeners.add(listener);
    }

    public List<Diagnostic> getAll() {
        return Collections.unmodifiableList(list);
    }

    public boolean has(DiagnosticKind kind) {
        for (Diagnostic diagnostic : list) {
            if (diagnostic.kind == kind) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }
}
