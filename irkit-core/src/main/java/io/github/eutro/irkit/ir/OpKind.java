package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ext.CommonExts;
import io.github.eutro.irkit.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The kind of an operation, such as {@code arith.addi}.
 * <p>
 * A kind carries the factory used to construct its operations, an optional verifier,
 * and optional names for its operand and result positions, which matchers use to
 * project fields by name. Exts attached to a kind are visible on all of its operations.
 */
public class OpKind extends ExtHolder {
    private final String name;
    private final OpFactory factory;
    @Nullable
    private final OpVerifier verifier;
    private final List<String> operandNames;
    private final List<String> resultNames;

    private OpKind(Builder builder) {
        this.name = builder.name;
        this.factory = builder.factory;
        this.verifier = builder.verifier;
        this.operandNames = Collections.unmodifiableList(new ArrayList<>(builder.operandNames));
        this.resultNames = Collections.unmodifiableList(new ArrayList<>(builder.resultNames));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Get the dialect prefix of this kind's name, e.g. {@code arith} for {@code arith.addi}.
     *
     * @return The dialect name, or the empty string if the name has no prefix.
     */
    public String getDialectName() {
        int dot = name.indexOf('.');
        return dot < 0 ? "" : name.substring(0, dot);
    }

    public List<String> getOperandNames() {
        return operandNames;
    }

    public List<String> getResultNames() {
        return resultNames;
    }

    public int operandIndex(String name) {
        return operandNames.indexOf(name);
    }

    public int resultIndex(String name) {
        return resultNames.indexOf(name);
    }

    /**
     * Construct an operation of this kind through its factory.
     *
     * @param operands    The operands.
     * @param resultTypes The types of the results.
     * @param attributes  The attributes.
     * @param successors  The successor blocks.
     * @param regions     The regions, which the operation takes ownership of.
     * @return The new operation.
     */
    public Operation create(List<? extends Value> operands,
                            List<? extends Attribute> resultTypes,
                            Map<String, ? extends Attribute> attributes,
                            List<Block> successors,
                            List<Region> regions) {
        Operation op = factory.create(this, operands, resultTypes, attributes, successors, regions);
        if (op.getKind() != this) {
            throw new IllegalStateException(String.format("factory of %s created an operation of kind %s",
                    name, op.getName()));
        }
        return op;
    }

    public Operation create(List<? extends Value> operands, List<? extends Attribute> resultTypes) {
        return create(operands, resultTypes, Collections.emptyMap(), Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Run this kind's verifier on an operation, if it has one.
     *
     * @param op The operation.
     * @throws VerifyException If verification fails.
     */
    public void verify(Operation op) {
        if (verifier != null) {
            verifier.verify(op);
        }
    }

    @Override
    public String toString() {
        return name;
    }

    public static class Builder {
        private final String name;
        private OpFactory factory = Operation::new;
        @Nullable
        private OpVerifier verifier;
        private List<String> operandNames = Collections.emptyList();
        private List<String> resultNames = Collections.emptyList();
        private boolean pure;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder factory(OpFactory factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public Builder verifier(OpVerifier verifier) {
            this.verifier = verifier;
            return this;
        }

        public Builder operandNames(String... names) {
            operandNames = Arrays.asList(names);
            return this;
        }

        public Builder resultNames(String... names) {
            resultNames = Arrays.asList(names);
            return this;
        }

        /**
         * Mark operations of this kind as {@link CommonExts#IS_PURE pure}.
         *
         * @return This builder.
         */
        public Builder pure() {
            pure = true;
            return this;
        }

        public OpKind build() {
            OpKind kind = new OpKind(this);
            if (pure) CommonExts.markPure(kind);
            return kind;
        }
    }
}
