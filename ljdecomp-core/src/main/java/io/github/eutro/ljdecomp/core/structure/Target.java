package io.github.eutro.ljdecomp.core.structure;

import io.github.eutro.ljdecomp.core.ir.BasicBlock;
import io.github.eutro.ljdecomp.core.tree.StructuredNode;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Where control goes when a region is left.
 */
public final class Target {
    public enum Kind {
        /**
         * Another region of the graph.
         */
        REGION,
        /**
         * Out of the innermost enclosing loop.
         */
        BREAK,
        /**
         * To the next iteration of the innermost enclosing loop.
         */
        CONTINUE,
        /**
         * To a labeled region.
         */
        GOTO,
        /**
         * Along a back edge, to a loop header that has not been structured yet.
         */
        BACK,
    }

    public static final Target BREAK = new Target(Kind.BREAK, null, null, null);
    public static final Target CONTINUE = new Target(Kind.CONTINUE, null, null, null);

    public final Kind kind;
    public final @Nullable Region region;
    public final @Nullable BasicBlock header;
    public final @Nullable String label;

    private Target(Kind kind, @Nullable Region region, @Nullable BasicBlock header, @Nullable String label) {
        this.kind = kind;
        this.region = region;
        this.header = header;
        this.label = label;
    }

    public static Target region(Region region) {
        return new Target(Kind.REGION, region, null, null);
    }

    public static Target back(BasicBlock header) {
        return new Target(Kind.BACK, null, header, null);
    }

    public static Target goTo(String label) {
        return new Target(Kind.GOTO, null, null, label);
    }

    public boolean isRegion() {
        return kind == Kind.REGION;
    }

    /**
     * @return Whether this leaves the current construct as a statement: break, continue or goto.
     */
    public boolean isEscape() {
        return kind == Kind.BREAK || kind == Kind.CONTINUE || kind == Kind.GOTO;
    }

    /**
     * @return The statement that performs this escape.
     */
    public StructuredNode toStatement() {
        switch (kind) {
            case BREAK:
                return new StructuredNode.Break();
            case CONTINUE:
                return new StructuredNode.Continue();
            case GOTO:
                return new StructuredNode.Goto(Objects.requireNonNull(label));
            default:
                throw new IllegalStateException(this + " is not an escape");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Target target = (Target) o;
        return kind == target.kind
                && region == target.region
                && header == target.header
                && Objects.equals(label, target.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, System.identityHashCode(region), System.identityHashCode(header), label);
    }

    @Override
    public String toString() {
        switch (kind) {
            case REGION:
                return "-> " + region;
            case BACK:
                return "back " + Objects.requireNonNull(header).toTargetString();
            case GOTO:
                return "goto " + label;
            default:
                return kind.name().toLowerCase();
        }
    }
}
