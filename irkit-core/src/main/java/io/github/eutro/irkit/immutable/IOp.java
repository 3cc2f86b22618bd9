package io.github.eutro.irkit.immutable;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.OpKind;
import io.github.eutro.irkit.util.SealedList;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An immutable operation.
 * <p>
 * All fields are sealed at construction. Operations are compared by identity,
 * and may be shared between several versions of a program.
 */
public final class IOp {
    private final OpData data;
    private final SealedList<IValue> operands;
    private final SealedList<IResult> results;
    private final SealedList<IBlock> successors;
    private final SealedList<IRegion> regions;

    public IOp(OpData data,
               List<? extends IValue> operands,
               List<? extends Attribute> resultTypes,
               List<IBlock> successors,
               List<IRegion> regions) {
        this.data = data;
        this.operands = SealedList.of(operands);
        SealedList.Builder<IResult> results = SealedList.builder();
        for (Attribute type : resultTypes) {
            results.add(new IResult(type, this, results.size()));
        }
        this.results = results.seal();
        this.successors = SealedList.of(successors);
        this.regions = SealedList.of(regions);
    }

    public static IOp get(OpKind kind,
                          List<? extends IValue> operands,
                          List<? extends Attribute> resultTypes,
                          Map<String, ? extends Attribute> attributes,
                          List<IBlock> successors,
                          List<IRegion> regions) {
        return new IOp(new OpData(kind, attributes), operands, resultTypes, successors, regions);
    }

    public OpData getOpData() {
        return data;
    }

    public String getName() {
        return data.getName();
    }

    public OpKind getKind() {
        return data.getKind();
    }

    public Map<String, Attribute> getAttributes() {
        return data.getAttributes();
    }

    @Nullable
    public Attribute getAttribute(String name) {
        return data.getAttribute(name);
    }

    public SealedList<IValue> getOperands() {
        return operands;
    }

    public IValue getOperand(int index) {
        return operands.get(index);
    }

    public SealedList<IResult> getResults() {
        return results;
    }

    @Nullable
    public IResult getResult() {
        return results.isEmpty() ? null : results.get(0);
    }

    public List<Attribute> getResultTypes() {
        return results.stream().map(IValue::getType).collect(Collectors.toList());
    }

    public SealedList<IBlock> getSuccessors() {
        return successors;
    }

    public SealedList<IRegion> getRegions() {
        return regions;
    }

    @Nullable
    public IRegion getRegion() {
        return regions.isEmpty() ? null : regions.get(0);
    }

    public void walk(Consumer<? super IOp> visitor) {
        visitor.accept(this);
        for (IRegion region : regions) {
            region.walk(visitor);
        }
    }

    /**
     * Visit this operation and the operations nested in it in pre-order,
     * for as long as {@code visitor} returns true.
     *
     * @param visitor The visitor.
     * @return Whether the walk ran to completion.
     */
    public boolean walkAbortable(Predicate<? super IOp> visitor) {
        if (!visitor.test(this)) return false;
        for (IRegion region : regions) {
            if (!region.walkAbortable(visitor)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(data.toString());
        sb.append(operands.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")")));
        if (!regions.isEmpty()) sb.append(" (").append(regions.size()).append(" region(s))");
        if (!results.isEmpty()) sb.append(" : ").append(getResultTypes());
        return sb.toString();
    }
}
