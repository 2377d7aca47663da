package io.github.eutro.ljdecomp.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value can be stored in an {@link ExtContainer}.
 * <p>
 * Exts are compared by creation order, which is only stable within one run.
 *
 * @param <T> The type of value stored under this key.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id = NEXT_ID.getAndIncrement();
    private final Class<? super T> type;
    private final String name;

    private Ext(Class<? super T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * The class only documents the erased type of the values, so generic value
     * types such as {@code List<BasicBlock>} can be given as {@code List.class}.
     *
     * @param type The erasure of the value type.
     * @param name A name, for debugging.
     * @param <T>  The erased type.
     * @param <R>  The value type.
     * @return The ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the erased type this ext was created with.
     *
     * @return The type.
     */
    public Class<? super T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
