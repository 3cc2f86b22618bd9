package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.OpKind;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Builds immutable operations, either from scratch or by overriding fields of an existing one.
 * <p>
 * {@link #build()} returns the operations that must be inserted, in order: those
 * introduced by {@link IOperand#of(IOp) pending operands} first, each once and after any
 * other pending operation it uses, then the new operation.
 */
public final class IOpBuilder {
    @Nullable
    private final IOp base;
    private final OpKind kind;
    @Nullable
    private final Map<IValue, IValue> env;

    private List<IOperand> operands;
    private List<Attribute> resultTypes;
    @Nullable
    private Map<String, Attribute> attributes;
    private List<IBlock> successors;
    private List<IRegion> regions;

    private IOpBuilder(@Nullable IOp base, OpKind kind, @Nullable Map<IValue, IValue> env) {
        this.base = base;
        this.kind = kind;
        this.env = env;
        if (base == null) {
            operands = Collections.emptyList();
            resultTypes = Collections.emptyList();
            attributes = Collections.emptyMap();
            successors = Collections.emptyList();
            regions = Collections.emptyList();
        } else {
            operands = IOperand.values(base.getOperands());
            resultTypes = base.getResultTypes();
            successors = base.getSuccessors();
            regions = base.getRegions();
        }
    }

    public static IOpBuilder newOp(OpKind kind) {
        return new IOpBuilder(null, kind, null);
    }

    /**
     * Start building a copy of {@code old}, sharing its {@link OpData} unless attributes are changed.
     *
     * @param old The operation to copy.
     * @return The builder.
     */
    public static IOpBuilder fromOp(IOp old) {
        return new IOpBuilder(old, old.getKind(), null);
    }

    /**
     * Start building a copy of {@code old} whose operands are remapped through {@code env}.
     * Building records each result of {@code old} against the corresponding new result in {@code env}.
     *
     * @param old The operation to copy.
     * @param env The substitution.
     * @return The builder.
     */
    public static IOpBuilder fromOp(IOp old, Map<IValue, IValue> env) {
        return new IOpBuilder(old, old.getKind(), env);
    }

    public IOpBuilder operands(IOperand... operands) {
        return operands(Arrays.asList(operands));
    }

    public IOpBuilder operands(List<IOperand> operands) {
        this.operands = new ArrayList<>(operands);
        return this;
    }

    public IOpBuilder operandValues(List<? extends IValue> values) {
        return operands(IOperand.values(values));
    }

    public IOpBuilder resultTypes(Attribute... types) {
        return resultTypes(Arrays.asList(types));
    }

    public IOpBuilder resultTypes(List<? extends Attribute> types) {
        this.resultTypes = new ArrayList<>(types);
        return this;
    }

    public IOpBuilder attributes(Map<String, ? extends Attribute> attributes) {
        this.attributes = new LinkedHashMap<>(attributes);
        return this;
    }

    /**
     * Set a single attribute, keeping the others.
     *
     * @param name  The name of the attribute.
     * @param value The value.
     * @return This builder.
     */
    public IOpBuilder attribute(String name, Attribute value) {
        if (attributes == null) {
            attributes = new LinkedHashMap<>(base == null ? Collections.emptyMap() : base.getAttributes());
        } else if (!(attributes instanceof LinkedHashMap)) {
            attributes = new LinkedHashMap<>(attributes);
        }
        attributes.put(name, value);
        return this;
    }

    public IOpBuilder successors(IBlock... successors) {
        return successors(Arrays.asList(successors));
    }

    public IOpBuilder successors(List<IBlock> successors) {
        this.successors = new ArrayList<>(successors);
        return this;
    }

    public IOpBuilder regions(IRegion... regions) {
        return regions(Arrays.asList(regions));
    }

    public IOpBuilder regions(List<IRegion> regions) {
        this.regions = new ArrayList<>(regions);
        return this;
    }

    /**
     * Build the operation.
     *
     * @return The operations to insert, ending with the new operation.
     */
    public List<IOp> build() {
        Set<IOp> pending = Collections.newSetFromMap(new IdentityHashMap<>());
        List<IOp> collected = new ArrayList<>();
        List<IValue> values = new ArrayList<>(operands.size());
        for (IOperand operand : operands) {
            for (IOp op : operand.pending()) {
                if (pending.add(op)) collected.add(op);
            }
            IValue value = operand.value();
            if (env != null) {
                IValue mapped = env.get(value);
                if (mapped != null) value = mapped;
            }
            values.add(value);
        }

        List<IOp> ops = new ArrayList<>(collected.size() + 1);
        Set<IOp> placed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IOp op : collected) {
            place(op, pending, placed, ops);
        }

        OpData data = attributes == null && base != null
                ? base.getOpData()
                : new OpData(kind, attributes == null ? Collections.emptyMap() : attributes);
        IOp op = new IOp(data, values, resultTypes, successors, regions);
        ops.add(op);

        if (env != null && base != null) {
            int n = Math.min(base.getResults().size(), op.getResults().size());
            for (int i = 0; i < n; i++) {
                env.put(base.getResults().get(i), op.getResults().get(i));
            }
        }
        return ops;
    }

    // producers among the pending operations go first, otherwise first occurrence order is kept
    private static void place(IOp op, Set<IOp> pending, Set<IOp> placed, List<IOp> ops) {
        if (!pending.contains(op) || !placed.add(op)) return;
        for (IValue operand : op.getOperands()) {
            if (operand instanceof IResult) {
                place(((IResult) operand).getOp(), pending, placed, ops);
            }
        }
        ops.add(op);
    }

    /**
     * Build the operation alone, when no operand introduces new operations.
     *
     * @return The new operation.
     */
    public IOp buildOp() {
        List<IOp> ops = build();
        if (ops.size() != 1) {
            throw new IllegalStateException("building " + kind.getName() + " introduced "
                    + (ops.size() - 1) + " other operation(s), use build()");
        }
        return ops.get(0);
    }
}
