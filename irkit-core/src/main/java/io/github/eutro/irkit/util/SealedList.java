package io.github.eutro.irkit.util;

import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A list which can no longer be modified.
 * <p>
 * Every mutator throws {@link ImmutabilityViolationException}, including those reached
 * through iterators and sub-lists. Lists are built with a {@link Builder}, which
 * only supports appending, and is itself closed once {@link Builder#seal() sealed}.
 *
 * @param <E> The type of elements in the list.
 */
public final class SealedList<E> extends AbstractList<E> implements RandomAccess {
    private static final SealedList<?> EMPTY = new SealedList<>(new Object[0]);

    private final Object[] elements;

    private SealedList(Object[] elements) {
        this.elements = elements;
    }

    /**
     * Get the empty sealed list.
     *
     * @param <E> The type of elements in the list.
     * @return The empty list.
     */
    @SuppressWarnings("unchecked")
    public static <E> SealedList<E> empty() {
        return (SealedList<E>) EMPTY;
    }

    /**
     * Seal a copy of the given collection. Sealed lists are returned as-is.
     *
     * @param elements The elements.
     * @param <E>      The type of elements in the list.
     * @return The sealed list.
     */
    @SuppressWarnings("unchecked")
    public static <E> SealedList<E> of(Collection<? extends E> elements) {
        if (elements instanceof SealedList) return (SealedList<E>) elements;
        if (elements.isEmpty()) return empty();
        return new SealedList<>(elements.toArray());
    }

    /**
     * Seal the given elements.
     *
     * @param elements The elements.
     * @param <E>      The type of elements in the list.
     * @return The sealed list.
     */
    @SafeVarargs
    public static <E> SealedList<E> of(E... elements) {
        if (elements.length == 0) return empty();
        return new SealedList<>(elements.clone());
    }

    /**
     * Create a new builder.
     *
     * @param <E> The type of elements in the list.
     * @return The builder.
     */
    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    @SuppressWarnings("unchecked")
    @Override
    public E get(int index) {
        return (E) elements[index];
    }

    @Override
    public int size() {
        return elements.length;
    }

    private static ImmutabilityViolationException violation() {
        return new ImmutabilityViolationException("sealed list cannot be modified");
    }

    @Override
    public boolean add(E e) {
        throw violation();
    }

    @Override
    public void add(int index, E element) {
        throw violation();
    }

    @Override
    public E set(int index, E element) {
        throw violation();
    }

    @Override
    public E remove(int index) {
        throw violation();
    }

    @Override
    public boolean remove(Object o) {
        throw violation();
    }

    @Override
    public boolean addAll(@NotNull Collection<? extends E> c) {
        throw violation();
    }

    @Override
    public boolean addAll(int index, @NotNull Collection<? extends E> c) {
        throw violation();
    }

    @Override
    public boolean removeAll(@NotNull Collection<?> c) {
        throw violation();
    }

    @Override
    public boolean retainAll(@NotNull Collection<?> c) {
        throw violation();
    }

    @Override
    public boolean removeIf(Predicate<? super E> filter) {
        throw violation();
    }

    @Override
    public void replaceAll(UnaryOperator<E> operator) {
        throw violation();
    }

    @Override
    public void sort(Comparator<? super E> c) {
        throw violation();
    }

    @Override
    public void clear() {
        throw violation();
    }

    @Override
    protected void removeRange(int fromIndex, int toIndex) {
        throw violation();
    }

    /**
     * An append-only builder of a {@link SealedList}.
     *
     * @param <E> The type of elements in the list.
     */
    public static final class Builder<E> {
        private final List<E> elements = new ArrayList<>();
        private boolean sealed;

        private Builder() {
        }

        private void checkOpen() {
            if (sealed) throw new ImmutabilityViolationException("builder was already sealed");
        }

        public Builder<E> add(E element) {
            checkOpen();
            elements.add(element);
            return this;
        }

        public Builder<E> addAll(Collection<? extends E> elements) {
            checkOpen();
            this.elements.addAll(elements);
            return this;
        }

        public int size() {
            return elements.size();
        }

        /**
         * Produce the sealed list, closing this builder.
         *
         * @return The sealed list.
         */
        public SealedList<E> seal() {
            checkOpen();
            sealed = true;
            return SealedList.of(elements);
        }
    }
}
