package io.github.eutro.irkit.ext;

import java.util.*;

/**
 * A list which notifies its owner of every element that enters or leaves it.
 * <p>
 * {@link #onAdded(Object)} runs before an element is stored, so an owner
 * may reject the element by throwing, leaving the list unchanged.
 * {@link #onRemoved(Object)} runs after the element is gone.
 *
 * @param <E> The type of elements.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> backing = new ArrayList<>();

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
        if (index < 0 || index > backing.size()) throw new IndexOutOfBoundsException("index " + index);
        onAdded(element);
        backing.add(index, element);
        modCount++;
    }

    @Override
    public E set(int index, E element) {
        E old = backing.get(index);
        if (old == element) return old;
        onAdded(element);
        backing.set(index, element);
        onRemoved(old);
        return old;
    }

    @Override
    public E remove(int index) {
        E removed = backing.remove(index);
        modCount++;
        onRemoved(removed);
        return removed;
    }

    @Override
    public int indexOf(Object o) {
        // elements are identified by reference
        for (int i = 0; i < backing.size(); i++) {
            if (backing.get(i) == o) return i;
        }
        return -1;
    }

    @Override
    public boolean contains(Object o) {
        return indexOf(o) != -1;
    }

    @Override
    public boolean remove(Object o) {
        int index = indexOf(o);
        if (index == -1) return false;
        remove(index);
        return true;
    }

    @Override
    public void clear() {
        List<E> removed = new ArrayList<>(backing);
        backing.clear();
        modCount++;
        for (E e : removed) {
            onRemoved(e);
        }
    }
}
