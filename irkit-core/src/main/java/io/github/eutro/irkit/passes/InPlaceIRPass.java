package io.github.eutro.irkit.passes;

/**
 * An IR pass which mutates its input.
 *
 * @param <T> The type of the IR this pass operates on.
 */
@FunctionalInterface
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass.
     *
     * @param t The IR to run this pass on.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
