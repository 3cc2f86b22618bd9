package io.github.eutro.irkit.ir;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A named group of operation kinds, registered together.
 */
public final class Dialect {
    private final String name;
    private final List<OpKind> kinds;

    public Dialect(String name, OpKind... kinds) {
        this.name = name;
        this.kinds = Collections.unmodifiableList(Arrays.asList(kinds.clone()));
    }

    public String getName() {
        return name;
    }

    public List<OpKind> getKinds() {
        return kinds;
    }

    @Override
    public String toString() {
        return name;
    }
}
