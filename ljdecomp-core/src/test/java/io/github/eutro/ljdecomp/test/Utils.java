package io.github.eutro.ljdecomp.test;

import io.github.eutro.ljdecomp.core.bc.BytecodeDump;
import io.github.eutro.ljdecomp.core.bc.BytecodeFunction;
import io.github.eutro.ljdecomp.core.bc.DumpReader;
import io.github.eutro.ljdecomp.core.cfg.ControlFlowGraph;
import io.github.eutro.ljdecomp.core.cfg.NormalizeCfg;
import io.github.eutro.ljdecomp.core.diag.DecompileContext;
import io.github.eutro.ljdecomp.core.passes.convert.BytecodeToIr;
import io.github.eutro.ljdecomp.core.recover.ExpressionRecovery;
import io.github.eutro.ljdecomp.core.recover.StructuredFunction;
import io.github.eutro.ljdecomp.core.structure.Structurer;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import io.github.eutro.ljdecomp.core.tree.Trees;
import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

public class Utils {
    @NotNull
    public static BytecodeDump read(DumpBuilder builder, DumpBuilder.Proto root, DecompileContext ctx) {
        return DumpReader.read(builder.buffer(root), ctx.version, ctx);
    }

    @NotNull
    public static BytecodeFunction readRoot(DumpBuilder builder, DumpBuilder.Proto root, DecompileContext ctx) {
        return read(builder, root, ctx).getRoot();
    }

    @NotNull
    public static ControlFlowGraph cfg(BytecodeFunction fn, DecompileContext ctx) {
        return NormalizeCfg.INSTANCE.run(new BytecodeToIr(ctx).run(fn));
    }

    @NotNull
    public static StructuredNode.Sequence structure(BytecodeFunction fn, DecompileContext ctx) {
        return new Structurer().structure(cfg(fn, ctx));
    }

    @NotNull
    public static StructuredFunction decompile(BytecodeFunction fn, DecompileContext ctx) {
        return ExpressionRecovery.INSTANCE.run(new StructuredFunction(fn, structure(fn, ctx), ctx));
    }

    @NotNull
    public static List<StructuredNode> nodesOf(StructuredNode root, StructuredNode.Kind kind) {
        List<StructuredNode> found = new ArrayList<>();
        Trees.forEachNode(root, node -> {
            if (node.kind() == kind) found.add(node);
        });
        return found;
    }

    @NotNull
    public static ByteBuffer truncated(byte[] dump, int drop) {
        byte[] cut = new byte[dump.length - drop];
        System.arraycopy(dump, 0, cut, 0, cut.length);
        return ByteBuffer.wrap(cut);
    }
}
