package io.github.eutro.irkit.test;

import io.github.eutro.irkit.attr.IntegerAttr;
import io.github.eutro.irkit.immutable.*;
import io.github.eutro.irkit.ir.Block;
import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.passes.meta.VerifyIntegrity;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.irkit.test.TestDialect.*;
import static org.junit.jupiter.api.Assertions.*;

public class IRewriterTest {
    private static final IRewritePattern FOLD_ADD = op -> {
        if (op.getKind() != ADD) return Optional.empty();
        Long lhs = constantValue(op.getOperand(0));
        Long rhs = constantValue(op.getOperand(1));
        if (lhs == null || rhs == null) return Optional.empty();
        return Optional.of(Collections.singletonList(IOpBuilder.newOp(CONST)
                .resultTypes(I32)
                .attribute("value", IntegerAttr.of(lhs + rhs, 32))
                .buildOp()));
    };

    private static Long constantValue(IValue value) {
        if (!(value instanceof IResult)) return null;
        IOp op = ((IResult) value).getOp();
        if (op.getKind() != CONST) return null;
        return ((IntegerAttr) op.getAttribute("value")).getValue();
    }

    @Test
    void foldsChainsThroughTheImmutableForm() {
        Operation c1 = constant(1);
        Operation c2 = constant(2);
        Operation a1 = add(c1.getResult(0), c2.getResult(0));
        Operation a2 = add(a1.getResult(0), c2.getResult(0));
        Operation use = use(a2.getResult(0));
        Operation module = module(c1, c2, a1, a2, use);

        Operation rewritten = new IRewriter(FOLD_ADD).rewriteModule(module);

        assertNotSame(module, rewritten);
        assertEquals(Arrays.asList(c1, c2, a1, a2, use), ops(module));
        assertSame(a2.getResult(0), use.getOperand(0));

        List<Operation> newOps = ops(rewritten);
        for (Operation op : newOps) {
            assertNotSame(ADD, op.getKind());
        }
        Operation last = newOps.get(newOps.size() - 1);
        assertSame(USE, last.getKind());
        assertEquals(5, valueOf(last.getOperand(0).getDefiningOp()));
        VerifyIntegrity.INSTANCE.runInPlace(rewritten);
        rewritten.verify();
    }

    @Test
    void rewritesNestedRegions() {
        Operation c1 = constant(1);
        Operation c2 = constant(2);
        Operation inner = add(c1.getResult(0), c2.getResult(0));
        Operation holder = region(Block.of(inner, use(inner.getResult(0))));
        Operation module = module(c1, c2, holder);

        Operation rewritten = new IRewriter(FOLD_ADD).rewriteModule(module);
        List<Operation> innerOps = ops(rewritten).get(2).getRegion(0).getOps();
        assertEquals(2, innerOps.size());
        assertEquals(3, valueOf(innerOps.get(0)));
        assertSame(innerOps.get(0).getResult(0), innerOps.get(1).getOperand(0));
        VerifyIntegrity.INSTANCE.runInPlace(rewritten);
    }

    @Test
    void branchesFollowRewrittenBlocks() {
        IRewritePattern bump = op -> {
            if (op.getKind() != CONST || ((IntegerAttr) op.getAttribute("value")).getValue() != 1) {
                return Optional.empty();
            }
            return Optional.of(Collections.singletonList(IOpBuilder.fromOp(op)
                    .attribute("value", IntegerAttr.of(2, 32))
                    .buildOp()));
        };
        Operation c = constant(1);
        Block exit = Block.of(c, use(c.getResult(0)));
        Block middle = Block.of(br(exit));
        Block entry = Block.of(br(middle));
        Operation module = module(region(entry, middle, exit));

        Operation rewritten = new IRewriter(bump).rewriteModule(module);

        List<Block> blocks = ops(rewritten).get(0).getRegion(0).getBlocks();
        assertEquals(3, blocks.size());
        assertSame(blocks.get(1), blocks.get(0).getOps().get(0).getSuccessor(0));
        assertSame(blocks.get(2), blocks.get(1).getOps().get(0).getSuccessor(0));
        assertEquals(2, valueOf(blocks.get(2).getOps().get(0)));
        assertSame(blocks.get(2).getOps().get(0).getResult(0), blocks.get(2).getOps().get(1).getOperand(0));
        VerifyIntegrity.INSTANCE.runInPlace(rewritten);
    }

    @Test
    void replacementsCanBeResolved() {
        IOp c1 = IOpBuilder.newOp(CONST).resultTypes(I32).attribute("value", IntegerAttr.of(1, 32)).buildOp();
        IOp c2 = IOpBuilder.newOp(CONST).resultTypes(I32).attribute("value", IntegerAttr.of(2, 32)).buildOp();
        IOp add = IOpBuilder.newOp(ADD)
                .operands(IOperand.of(c1.getResult()), IOperand.of(c2.getResult()))
                .resultTypes(I32)
                .buildOp();
        IOp holder = IOpBuilder.newOp(REGION)
                .regions(IRegion.of(new IBlock(Collections.emptyList(), Arrays.asList(c1, c2, add))))
                .buildOp();

        IRewriter rewriter = new IRewriter(FOLD_ADD);
        IOp rewritten = rewriter.rewriteOp(holder);

        IValue folded = rewriter.resolve(add.getResult());
        assertTrue(folded instanceof IResult);
        IOp constant = ((IResult) folded).getOp();
        assertSame(CONST, constant.getKind());
        assertEquals(IntegerAttr.of(3, 32), constant.getAttribute("value"));
        assertSame(constant, rewritten.getRegion().getOps().get(2));
        assertSame(c1.getResult(), rewriter.resolve(c1.getResult()));
    }

    @Test
    void untouchedBlocksAreShared() {
        IOp c = IOpBuilder.newOp(CONST).resultTypes(I32).attribute("value", IntegerAttr.of(1, 32)).buildOp();
        IOp neg = IOpBuilder.newOp(NEG).operands(IOperand.of(c.getResult())).resultTypes(I32).buildOp();
        IBlock block = new IBlock(Collections.emptyList(), Arrays.asList(c, neg));

        IRewriter rewriter = new IRewriter(FOLD_ADD);
        assertSame(block, rewriter.rewriteBlock(block));

        IOp holder = IOpBuilder.newOp(REGION).regions(IRegion.of(block)).buildOp();
        assertSame(holder, rewriter.rewriteOp(holder));
    }

    @Test
    void firstApplicablePatternWins() {
        IRewritePattern never = op -> Optional.empty();
        IRewritePattern empty = op -> Optional.of(Collections.emptyList());
        IRewritePattern negToConst = op -> op.getKind() != NEG ? Optional.empty()
                : Optional.of(Collections.singletonList(IOpBuilder.newOp(CONST)
                .resultTypes(I32)
                .attribute("value", IntegerAttr.of(7, 32))
                .buildOp()));
        IRewritePattern negToZero = op -> op.getKind() != NEG ? Optional.empty()
                : Optional.of(Collections.singletonList(IOpBuilder.newOp(CONST)
                .resultTypes(I32)
                .attribute("value", IntegerAttr.of(0, 32))
                .buildOp()));

        Operation c = constant(1);
        Operation neg = neg(c.getResult(0));
        Operation module = module(c, neg, use(neg.getResult(0)));

        Operation rewritten = new IRewriter(never, empty, negToConst, negToZero).rewriteModule(module);
        Operation user = ops(rewritten).get(ops(rewritten).size() - 1);
        assertEquals(7, valueOf(user.getOperand(0).getDefiningOp()));
    }

    @Test
    void replacementsMustKeepResultCount() {
        IRewritePattern dropsResult = op -> op.getKind() != NEG ? Optional.empty()
                : Optional.of(Collections.singletonList(IOpBuilder.newOp(USE).buildOp()));
        Operation c = constant(1);
        Operation module = module(c, neg(c.getResult(0)));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new IRewriter(dropsResult).rewriteModule(module));
        assertTrue(e.getMessage().contains("test.neg"), e.getMessage());
    }
}
