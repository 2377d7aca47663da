package io.github.eutro.ljdecomp.core.bc;

import java.util.*;

/**
 * A constant table template, as duplicated by {@code TDUP}.
 * <p>
 * Keys and values are {@link Primitive}s, {@link Integer}s, {@link Double}s or {@link String}s.
 */
public final class TableConstant {
    /**
     * The array part; element {@code i} is the value at key {@code i}, so element 0 is usually nil.
     */
    public final List<Object> array;
    public final Map<Object, Object> hash;

    public TableConstant(List<Object> array, Map<Object, Object> hash) {
        this.array = Collections.unmodifiableList(new ArrayList<>(array));
        this.hash = Collections.unmodifiableMap(new LinkedHashMap<>(hash));
    }

    public boolean isEmpty() {
        for (Object o : array) {
            if (o != Primitive.NIL) return false;
        }
        return hash.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableConstant)) return false;
        TableConstant that = (TableConstant) o;
        return array.equals(that.array) && hash.equals(that.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(array, hash);
    }

    @Override
    public String toString() {
        return "{" + array + ", " + hash + "}";
    }
}
