package io.github.eutro.ljdecomp.api;

import io.github.eutro.ljdecomp.api.bits.Bit;
import io.github.eutro.ljdecomp.api.events.*;
import io.github.eutro.ljdecomp.core.bc.FormatVersion;
import io.github.eutro.ljdecomp.core.structure.LoopIdiom;
import io.github.eutro.ljdecomp.core.structure.Structurer;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * The entry point for decompiling LuaJIT bytecode dumps.
 * <p>
 * Dumps are submitted to get a {@link DumpDecompilation}, which does the work when run.
 * Listeners added here apply to every decompilation.
 */
public class Decompiler extends EventSupplier<DecompilerEvent> {
    private final List<LoopIdiom> loopIdioms;

    public Decompiler() {
        this(Structurer.DEFAULT_IDIOMS);
    }

    /**
     * @param loopIdioms The loop idioms the structurer tries, in order.
     */
    public Decompiler(List<LoopIdiom> loopIdioms) {
        this.loopIdioms = Collections.unmodifiableList(new ArrayList<>(loopIdioms));
    }

    public List<LoopIdiom> getLoopIdioms() {
        return loopIdioms;
    }

    @Contract(pure = true)
    public DumpDecompilation submit(InputStream stream, FormatVersion version) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        int read;
        while ((read = stream.read(buf)) != -1) {
            out.write(buf, 0, read);
        }
        return submit(ByteBuffer.wrap(out.toByteArray()), version);
    }

    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    public DumpDecompilation submit(ByteBuffer buffer, FormatVersion version) {
        return new DumpDecompilation(this, buffer, version);
    }

    /**
     * @return A dispatcher whose listeners are added to every decompilation when it runs.
     */
    public EventDispatcher<DumpDecompileEvent> lift() {
        return new EventDispatcher<DumpDecompileEvent>() {
            @Override
            public <T extends DumpDecompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                Decompiler.this.listen(RunDumpDecompilationEvent.class, evt ->
                        evt.decompilation.listen(eventClass, listener));
            }
        };
    }

    public <T> T add(Bit<? super Decompiler, T> bit) {
        return bit.addTo(this);
    }
}
