package io.github.eutro.irkit.dialects.arith;

import io.github.eutro.irkit.attr.IntegerAttr;
import io.github.eutro.irkit.attr.IntegerType;
import io.github.eutro.irkit.ext.CommonExts;
import io.github.eutro.irkit.immutable.*;
import io.github.eutro.irkit.ir.OpKind;
import io.github.eutro.irkit.ir.OpResult;
import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.ir.Value;
import io.github.eutro.irkit.match.AttributeVariable;
import io.github.eutro.irkit.match.OperationVariable;
import io.github.eutro.irkit.match.Query;
import io.github.eutro.irkit.match.ValueVariable;
import io.github.eutro.irkit.passes.IRPass;
import io.github.eutro.irkit.passes.InPlaceIRPass;
import io.github.eutro.irkit.rewrite.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Constant folding for the {@code arith} dialect.
 * <p>
 * The mutable patterns replace an operation whose operands are all constants with a constant,
 * then erase the constants it used if nothing else uses them. The {@link #IMMUTABLE immutable}
 * patterns only fold, and {@link #immutablePass()} drops the constants they leave unused.
 */
public class FoldConstants {
    /**
     * Folds {@code arith.addi} of two constants, expressed as a {@link Query}.
     */
    public static final RewritePattern FOLD_ADDI = foldAddi();

    /**
     * Folds {@code arith.subi} and {@code arith.muli} of two constants.
     */
    public static final List<RewritePattern> FOLD_BINARY = Collections.unmodifiableList(Arrays.asList(
            new FoldBinary(ArithDialect.SUBI),
            new FoldBinary(ArithDialect.MULI)
    ));

    /**
     * Folds {@code arith.cmpi} of two constants.
     */
    public static final RewritePattern FOLD_CMPI = new OpKindRewritePattern(ArithDialect.CMPI) {
        @Override
        protected void rewrite(Operation op, PatternRewriter rewriter) {
            CmpiOp cmp = (CmpiOp) op;
            IntegerAttr lhs = constantValue(cmp.getLhs());
            IntegerAttr rhs = constantValue(cmp.getRhs());
            if (lhs == null || rhs == null) return;
            boolean result = cmp.getPredicate().evaluate(lhs.getValue(), rhs.getValue(), lhs.getType());
            replaceWithConstant(op, rewriter, new IntegerAttr(result ? 1 : 0, IntegerType.I1));
        }
    };

    public static final List<RewritePattern> PATTERNS;

    static {
        List<RewritePattern> patterns = new ArrayList<>();
        patterns.add(FOLD_ADDI);
        patterns.addAll(FOLD_BINARY);
        patterns.add(FOLD_CMPI);
        PATTERNS = Collections.unmodifiableList(patterns);
    }

    /**
     * Folds {@code arith.addi}, {@code arith.subi}, {@code arith.muli} and {@code arith.cmpi}
     * of two {@code arith.constant}s in the immutable IR.
     */
    public static final List<IRewritePattern> IMMUTABLE = Collections.singletonList(FoldConstants::foldImmutable);

    /**
     * Get a pass which folds constants in every operation nested in its input, to a fixpoint.
     *
     * @return The pass.
     */
    public static InPlaceIRPass<Operation> pass() {
        return new PatternRewriteWalker(new GreedyRewritePatternApplier(PATTERNS));
    }

    /**
     * Get a pass which folds constants by way of the immutable IR, returning a new operation.
     * <p>
     * As with {@link #pass()}, constants left unused by folding are dropped, while whatever
     * was unused before folding is kept.
     *
     * @return The pass.
     */
    public static IRPass<Operation, Operation> immutablePass() {
        return root -> {
            IOp input = new FromMutable().run(root);
            Set<IValue> used = new HashSet<>();
            input.walk(op -> used.addAll(op.getOperands()));

            IRewriter rewriter = new IRewriter(IMMUTABLE);
            IOp folded = rewriter.rewriteOp(input);

            Set<IValue> live = new HashSet<>();
            input.walk(op -> {
                for (IResult result : op.getResults()) {
                    if (!used.contains(result)) live.add(rewriter.resolve(result));
                }
            });
            return new DeadOpElimination(live)
                    .then(new ToMutable())
                    .run(folded);
        };
    }

    private static RewritePattern foldAddi() {
        Query query = Query.root(ArithDialect.ADDI);
        ValueVariable lhs = query.operand(query.getRoot(), "lhs");
        ValueVariable rhs = query.operand(query.getRoot(), "rhs");
        OperationVariable lhsOp = query.definingOp(lhs);
        OperationVariable rhsOp = query.definingOp(rhs);
        query.hasKind(lhsOp, ArithDialect.CONSTANT);
        query.hasKind(rhsOp, ArithDialect.CONSTANT);
        AttributeVariable lhsValue = query.attribute(lhsOp, "value");
        AttributeVariable rhsValue = query.attribute(rhsOp, "value");
        return new QueryRewritePattern(query, (match, rewriter) -> {
            IntegerAttr l = (IntegerAttr) match.get(lhsValue);
            IntegerAttr r = (IntegerAttr) match.get(rhsValue);
            replaceWithConstant(match.getRoot(), rewriter, new IntegerAttr(l.getValue() + r.getValue(), l.getType()));
        });
    }

    private static class FoldBinary extends OpKindRewritePattern {
        FoldBinary(OpKind kind) {
            super(kind);
        }

        @Override
        protected void rewrite(Operation op, PatternRewriter rewriter) {
            IntBinaryOp binary = (IntBinaryOp) op;
            IntegerAttr lhs = constantValue(binary.getLhs());
            IntegerAttr rhs = constantValue(binary.getRhs());
            if (lhs == null || rhs == null) return;
            replaceWithConstant(op, rewriter,
                    new IntegerAttr(binary.fold(lhs.getValue(), rhs.getValue()), lhs.getType()));
        }
    }

    @Nullable
    private static IntegerAttr constantValue(Value value) {
        if (!(value instanceof OpResult)) return null;
        Operation op = ((OpResult) value).getOp();
        if (op.getKind() != ArithDialect.CONSTANT) return null;
        return ((ConstantOp) op).getValue();
    }

    private static void replaceWithConstant(Operation op, PatternRewriter rewriter, IntegerAttr value) {
        Set<Operation> producers = new LinkedHashSet<>();
        for (Value operand : op.getOperands()) {
            Operation producer = operand.getDefiningOp();
            if (producer != null) producers.add(producer);
        }
        rewriter.replaceOp(op, ArithDialect.constant(value));
        for (Operation producer : producers) {
            if (producer.getParentBlock() != null && CommonExts.isPure(producer) && !producer.hasUses()) {
                rewriter.eraseOp(producer);
            }
        }
    }

    @Nullable
    private static IntegerAttr constantValue(IValue value) {
        if (!(value instanceof IResult)) return null;
        IOp op = ((IResult) value).getOp();
        if (op.getKind() != ArithDialect.CONSTANT) return null;
        return (IntegerAttr) op.getAttribute("value");
    }

    private static Optional<List<IOp>> foldImmutable(IOp op) {
        if (op.getKind() != ArithDialect.ADDI
                && op.getKind() != ArithDialect.SUBI
                && op.getKind() != ArithDialect.MULI
                && op.getKind() != ArithDialect.CMPI) {
            return Optional.empty();
        }
        IntegerAttr lhs = constantValue(op.getOperand(0));
        IntegerAttr rhs = constantValue(op.getOperand(1));
        if (lhs == null || rhs == null) return Optional.empty();

        IntegerAttr folded;
        if (op.getKind() == ArithDialect.CMPI) {
            IntegerAttr predicate = (IntegerAttr) op.getAttribute("predicate");
            CmpPredicate cmp = predicate == null ? null : CmpPredicate.byValue(predicate.getValue());
            if (cmp == null) return Optional.empty();
            folded = new IntegerAttr(cmp.evaluate(lhs.getValue(), rhs.getValue(), lhs.getType()) ? 1 : 0,
                    IntegerType.I1);
        } else {
            long value = op.getKind().getExtOrThrow(ArithDialect.FOLDER).applyAsLong(lhs.getValue(), rhs.getValue());
            folded = new IntegerAttr(value, lhs.getType());
        }
        return Optional.of(Collections.singletonList(IOpBuilder.newOp(ArithDialect.CONSTANT)
                .resultTypes(folded.getType())
                .attribute("value", folded)
                .buildOp()));
    }
}
