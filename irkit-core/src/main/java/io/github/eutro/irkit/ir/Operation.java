package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ext.*;
import io.github.eutro.irkit.util.GraphWalker;
import io.github.eutro.irkit.util.SealedList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A mutable operation: the unit of computation in the IR.
 * <p>
 * An operation has a {@link OpKind kind}, a fixed-arity list of operands, results,
 * successor blocks, an ordered attribute map and owned regions. Its results are
 * created with it and never change. Setting an operand keeps the use lists of
 * both the old and the new value current.
 * <p>
 * Exts not found on the operation are looked up on its kind.
 */
public class Operation extends DelegatingExtHolder {
    /**
     * Whether to record where each operation was constructed, for use in diagnostics.
     * <p>
     * Read from the {@code IRKIT_TRACK_OP_CREATIONS} environment variable.
     */
    public static boolean TRACK_OP_CREATIONS = System.getenv("IRKIT_TRACK_OP_CREATIONS") != null;
    /**
     * The stack trace of the construction of this operation, if {@link #TRACK_OP_CREATIONS} was set.
     */
    @Nullable
    public final Throwable created = TRACK_OP_CREATIONS ? new Throwable("constructed") : null;

    private final OpKind kind;
    private Value[] operands;
    private final SealedList<OpResult> results;
    private final List<Block> successors;
    private final Map<String, Attribute> attributes;
    private final TrackedList<Region> regions = new TrackedList<Region>() {
        @Override
        protected void onAdded(Region elt) {
            Ownership.checkInsertion(elt, Operation.this);
            elt.attachExt(CommonExts.OWNING_OP, Operation.this);
        }

        @Override
        protected void onRemoved(Region elt) {
            elt.removeExt(CommonExts.OWNING_OP);
        }
    };

    public Operation(OpKind kind,
                     List<? extends Value> operands,
                     List<? extends Attribute> resultTypes,
                     Map<String, ? extends Attribute> attributes,
                     List<Block> successors,
                     List<Region> regions) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.operands = new Value[operands.size()];
        for (int i = 0; i < this.operands.length; i++) {
            this.operands[i] = Objects.requireNonNull(operands.get(i), "operand");
        }
        SealedList.Builder<OpResult> results = SealedList.builder();
        for (Attribute type : resultTypes) {
            results.add(new OpResult(type, this, results.size()));
        }
        this.results = results.seal();
        this.successors = new ArrayList<>(successors);
        this.attributes = new LinkedHashMap<>(attributes);
        try {
            this.regions.addAll(regions);
        } catch (RuntimeException e) {
            // release the regions claimed before the failure
            this.regions.clear();
            throw e;
        }
        // uses are only registered once nothing else can fail
        for (int i = 0; i < this.operands.length; i++) {
            this.operands[i].addUse(new Use(this, i));
        }
    }

    /**
     * Create an operation with only operands and result types.
     *
     * @param kind        The kind of the operation.
     * @param operands    The operands.
     * @param resultTypes The types of the results.
     */
    public Operation(OpKind kind, List<? extends Value> operands, List<? extends Attribute> resultTypes) {
        this(kind, operands, resultTypes, Collections.emptyMap(), Collections.emptyList(), Collections.emptyList());
    }

    @Override
    protected ExtContainer getDelegate() {
        return kind;
    }

    public OpKind getKind() {
        return kind;
    }

    public String getName() {
        return kind.getName();
    }

    // operands

    /**
     * Get a view of the operands of this operation.
     * <p>
     * The view has a fixed size; {@link List#set(int, Object)} is {@link #setOperand(int, Value)}.
     *
     * @return The operands.
     */
    public List<Value> getOperands() {
        return new Operands();
    }

    public int getNumOperands() {
        return operands.length;
    }

    public Value getOperand(int index) {
        return operands[index];
    }

    /**
     * Get an operand by the field name its kind gives it.
     *
     * @param name The field name.
     * @return The operand, or null if the kind has no such operand.
     */
    @Nullable
    public Value getNamedOperand(String name) {
        int index = kind.operandIndex(name);
        return index < 0 || index >= operands.length ? null : operands[index];
    }

    public void setOperand(int index, Value value) {
        Objects.requireNonNull(value, "value");
        Value old = operands[index];
        if (old == value) return;
        Use use = new Use(this, index);
        old.removeUse(use);
        operands[index] = value;
        value.addUse(use);
    }

    /**
     * Replace all operands of this operation, possibly changing their number.
     *
     * @param values The new operands.
     */
    public void setOperands(List<? extends Value> values) {
        Value[] newOperands = values.toArray(new Value[0]);
        for (Value value : newOperands) Objects.requireNonNull(value, "value");
        dropOperandUses();
        operands = newOperands;
        for (int i = 0; i < newOperands.length; i++) {
            newOperands[i].addUse(new Use(this, i));
        }
    }

    private void dropOperandUses() {
        for (int i = 0; i < operands.length; i++) {
            operands[i].removeUse(new Use(this, i));
        }
    }

    // results

    public SealedList<OpResult> getResults() {
        return results;
    }

    public OpResult getResult(int index) {
        return results.get(index);
    }

    /**
     * Get the first result of this operation.
     *
     * @return The first result, or null if there are none.
     */
    @Nullable
    public OpResult getResult() {
        return results.isEmpty() ? null : results.get(0);
    }

    @Nullable
    public OpResult getNamedResult(String name) {
        int index = kind.resultIndex(name);
        return index < 0 || index >= results.size() ? null : results.get(index);
    }

    public List<Attribute> getResultTypes() {
        return results.stream().map(Value::getType).collect(Collectors.toList());
    }

    /**
     * Whether any result of this operation has uses.
     *
     * @return Whether the results are used.
     */
    public boolean hasUses() {
        for (OpResult result : results) {
            if (result.hasUses()) return true;
        }
        return false;
    }

    // successors

    public List<Block> getSuccessors() {
        return Collections.unmodifiableList(successors);
    }

    public Block getSuccessor(int index) {
        return successors.get(index);
    }

    public void setSuccessor(int index, Block block) {
        successors.set(index, Objects.requireNonNull(block, "block"));
    }

    // attributes

    public Map<String, Attribute> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @Nullable
    public Attribute getAttribute(String name) {
        return attributes.get(name);
    }

    /**
     * Get an attribute, requiring that it is present and of the given class.
     *
     * @param name The name of the attribute.
     * @param type The expected class.
     * @param <T>  The expected type.
     * @return The attribute.
     * @throws DiagnosticException If the attribute is missing or of another class.
     */
    public <T extends Attribute> T getAttr(String name, Class<T> type) {
        Attribute attr = attributes.get(name);
        if (attr == null) {
            throw new DiagnosticException(this, "missing attribute '" + name + "'");
        }
        if (!type.isInstance(attr)) {
            throw new DiagnosticException(this, String.format("attribute '%s' is %s, expected %s",
                    name, attr.getAttrName(), type.getSimpleName()));
        }
        return type.cast(attr);
    }

    public void setAttribute(String name, Attribute value) {
        attributes.put(name, Objects.requireNonNull(value, "value"));
    }

    @Nullable
    public Attribute removeAttribute(String name) {
        return attributes.remove(name);
    }

    // regions

    /**
     * Get the regions owned by this operation.
     * <p>
     * Adding a region to this list takes ownership of it.
     *
     * @return The regions.
     */
    public List<Region> getRegions() {
        return regions;
    }

    public Region getRegion(int index) {
        return regions.get(index);
    }

    @Nullable
    public Region getRegion() {
        return regions.isEmpty() ? null : regions.get(0);
    }

    // parents

    @Nullable
    public Block getParentBlock() {
        return owner;
    }

    @Nullable
    public Region getParentRegion() {
        return owner == null ? null : owner.getParentRegion();
    }

    @Nullable
    public Operation getParentOp() {
        Region region = getParentRegion();
        return region == null ? null : region.getParentOp();
    }

    /**
     * Whether this operation is {@code other} or contains it in one of its regions.
     *
     * @param other The other operation.
     * @return Whether this is an ancestor of {@code other}.
     */
    public boolean isAncestorOf(Operation other) {
        for (Operation op = other; op != null; op = op.getParentOp()) {
            if (op == this) return true;
        }
        return false;
    }

    // traversal

    /**
     * Visit this operation and all operations nested in it, in pre-order.
     *
     * @param visitor The visitor.
     */
    public void walk(Consumer<? super Operation> visitor) {
        visitor.accept(this);
        for (Region region : regions) {
            region.walk(visitor);
        }
    }

    /**
     * Visit this operation and the operations nested in it in pre-order, for as long as
     * {@code visitor} returns true.
     *
     * @param visitor The visitor.
     * @return Whether the walk ran to completion.
     */
    public boolean walkAbortable(Predicate<? super Operation> visitor) {
        if (!visitor.test(this)) return false;
        for (Region region : regions) {
            if (!region.walkAbortable(visitor)) return false;
        }
        return true;
    }

    public GraphWalker.Order<Operation> preOrder() {
        return GraphWalker.opWalker(this).preOrder();
    }

    /**
     * Get the post-order of this operation and its nested operations,
     * in which every operation comes after the ones nested in it.
     *
     * @return The post-order.
     */
    public GraphWalker.Order<Operation> postOrder() {
        return GraphWalker.opWalker(this).postOrder();
    }

    /**
     * Run the verifiers of the kinds of this operation and all operations nested in it.
     *
     * @throws VerifyException If an operation fails verification.
     */
    public void verify() {
        walk(op -> op.kind.verify(op));
    }

    // mutation

    /**
     * Remove the uses held by this operation and all operations nested in it,
     * leaving them without operands or successors.
     */
    public void dropAllReferences() {
        for (Operation op : postOrder()) {
            op.dropOperandUses();
            op.operands = new Value[0];
            op.successors.clear();
        }
    }

    /**
     * Remove this operation from its block, if it is in one.
     */
    public void detach() {
        if (owner != null) {
            owner.detachOp(this);
        }
    }

    /**
     * Detach this operation and drop all of its references.
     *
     * @throws IllegalStateException If any result of this operation is still used.
     */
    public void erase() {
        for (OpResult result : results) {
            if (result.hasUses()) {
                throw new IllegalStateException(String.format("cannot erase %s, %s is still used by %s",
                        describe(), result.describe(), result.getUses()));
            }
        }
        detach();
        dropAllReferences();
    }

    // printing

    String path() {
        if (owner == null) return "";
        return owner.path() + "/" + owner.getOps().indexOf(this);
    }

    /**
     * Get a printable reference to this operation, made of its name and
     * its position in the tree of regions, blocks and operations.
     * For example, {@code arith.addi@/0/0/3} is the fourth operation in the first block
     * of the first region of a top-level operation.
     *
     * @return The reference.
     */
    public String describe() {
        String path = path();
        return getName() + "@" + (path.isEmpty() ? "/" : path);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!results.isEmpty()) {
            sb.append(results.size()).append(" result(s) = ");
        }
        sb.append(describe())
                .append(Arrays.stream(operands)
                        .map(Value::describe)
                        .collect(Collectors.joining(", ", "(", ")")));
        if (!attributes.isEmpty()) {
            sb.append(' ').append(attributes);
        }
        if (!successors.isEmpty()) {
            sb.append(successors.stream()
                    .map(Block::describe)
                    .collect(Collectors.joining(", ", " [", "]")));
        }
        if (!regions.isEmpty()) {
            sb.append(" (").append(regions.size()).append(" region(s))");
        }
        if (!results.isEmpty()) {
            sb.append(" : ").append(getResultTypes());
        }
        return sb.toString();
    }

    private class Operands extends AbstractList<Value> implements RandomAccess {
        @Override
        public Value get(int index) {
            return operands[index];
        }

        @Override
        public Value set(int index, Value value) {
            Value old = operands[index];
            setOperand(index, value);
            return old;
        }

        @Override
        public int size() {
            return operands.length;
        }
    }

    // exts
    private Block owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(@NotNull Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (Block) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(@NotNull Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
