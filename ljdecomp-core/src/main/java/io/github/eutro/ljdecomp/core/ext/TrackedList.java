package io.github.eutro.ljdecomp.core.ext;

import java.util.*;

/**
 * A list view that is notified of every element entering and leaving it,
 * so owners can keep back-references up to date.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> backing;

    protected TrackedList(List<E> backing) {
        this.backing = backing;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return backing.get(index);
    }

    @Override
    public int size() {
        return backing.size();
    }

    @Override
    public void add(int index, E element) {
        onAdded(element);
        backing.add(index, element);
    }

    @Override
    public E set(int index, E element) {
        E old = backing.set(index, element);
        onRemoved(old);
        onAdded(element);
        return old;
    }

    @Override
    public E remove(int index) {
        E old = backing.remove(index);
        onRemoved(old);
        return old;
    }

    @Override
    public void clear() {
        for (E e : backing) {
            onRemoved(e);
        }
        backing.clear();
    }
}
