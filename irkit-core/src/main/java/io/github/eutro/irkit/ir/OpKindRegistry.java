package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.attr.Attribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Maps operation names to their kinds.
 * <p>
 * A registry is filled once, then {@link #seal() sealed}; it is an ordinary object
 * that is passed to whatever needs it, not a global.
 */
public class OpKindRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpKindRegistry.class);

    private final Map<String, OpKind> kinds = new LinkedHashMap<>();
    private boolean sealed;

    /**
     * Register a kind.
     *
     * @param kind The kind.
     * @return This registry.
     * @throws IllegalStateException If the registry is sealed, or a kind with the same name is registered.
     */
    public OpKindRegistry register(OpKind kind) {
        if (sealed) {
            throw new IllegalStateException("registry is sealed, cannot register " + kind.getName());
        }
        OpKind existing = kinds.putIfAbsent(kind.getName(), kind);
        if (existing != null) {
            throw new IllegalStateException("duplicate operation kind " + kind.getName());
        }
        LOGGER.debug("registered operation kind {}", kind.getName());
        return this;
    }

    public OpKindRegistry load(Dialect dialect) {
        for (OpKind kind : dialect.getKinds()) {
            register(kind);
        }
        LOGGER.debug("loaded dialect {} ({} kinds)", dialect.getName(), dialect.getKinds().size());
        return this;
    }

    public OpKindRegistry seal() {
        sealed = true;
        return this;
    }

    public boolean isSealed() {
        return sealed;
    }

    public Optional<OpKind> lookup(String name) {
        return Optional.ofNullable(kinds.get(name));
    }

    public OpKind getKind(String name) {
        OpKind kind = kinds.get(name);
        if (kind == null) {
            throw new IllegalArgumentException("unknown operation kind " + name);
        }
        return kind;
    }

    public Collection<OpKind> getKinds() {
        return Collections.unmodifiableCollection(kinds.values());
    }

    /**
     * Create an operation of the named kind, and verify it.
     *
     * @param name        The name of the kind.
     * @param operands    The operands.
     * @param resultTypes The types of the results.
     * @param attributes  The attributes.
     * @param successors  The successor blocks.
     * @param regions     The regions.
     * @return The new operation.
     * @throws VerifyException If the new operation does not verify.
     */
    public Operation create(String name,
                            List<? extends Value> operands,
                            List<? extends Attribute> resultTypes,
                            Map<String, ? extends Attribute> attributes,
                            List<Block> successors,
                            List<Region> regions) {
        Operation op = getKind(name).create(operands, resultTypes, attributes, successors, regions);
        op.verify();
        return op;
    }
}
