package io.github.eutro.irkit.test;

import io.github.eutro.irkit.attr.IntegerType;
import io.github.eutro.irkit.dialects.arith.ConstantOp;
import io.github.eutro.irkit.dialects.cf.BranchOp;
import io.github.eutro.irkit.dialects.cf.CondBranchOp;
import io.github.eutro.irkit.immutable.FromMutable;
import io.github.eutro.irkit.immutable.IOp;
import io.github.eutro.irkit.immutable.ToMutable;
import io.github.eutro.irkit.ir.*;
import io.github.eutro.irkit.passes.meta.VerifyIntegrity;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.irkit.dialects.arith.ArithDialect.constant;
import static io.github.eutro.irkit.dialects.cf.CfDialect.br;
import static io.github.eutro.irkit.dialects.cf.CfDialect.condBr;
import static org.junit.jupiter.api.Assertions.*;

public class CfTest {
    private static final IntegerType I32 = IntegerType.I32;
    private static final OpKind FUNC = OpKind.builder("test.func").build();

    /**
     * A diamond: {@code entry} branches to {@code then} or {@code else}, which both jump to {@code exit}.
     */
    private static Operation diamond() {
        Block entry = new Block();
        Block thenBlock = new Block(Collections.singletonList(I32));
        Block elseBlock = new Block(Collections.singletonList(I32));
        Block exit = new Block(Collections.singletonList(I32));

        ConstantOp cond = constant(1, IntegerType.I1);
        ConstantOp x = constant(10, I32);
        ConstantOp y = constant(20, I32);
        entry.addOps(Arrays.asList(cond, x, y,
                condBr(cond.getResult(0),
                        thenBlock, Collections.singletonList(x.getResult(0)),
                        elseBlock, Collections.singletonList(y.getResult(0)))));
        thenBlock.addOp(br(exit, thenBlock.getArg(0)));
        elseBlock.addOp(br(exit, elseBlock.getArg(0)));
        return FUNC.create(Collections.emptyList(), Collections.emptyList(), Collections.emptyMap(),
                Collections.emptyList(), Collections.singletonList(Region.of(entry, thenBlock, elseBlock, exit)));
    }

    @Test
    void branchAccessors() {
        Operation func = diamond();
        func.verify();
        VerifyIntegrity.INSTANCE.runInPlace(func);

        List<Block> blocks = func.getRegion(0).getBlocks();
        CondBranchOp condBr = (CondBranchOp) blocks.get(0).getLastOp();
        assertSame(blocks.get(1), condBr.getThenBlock());
        assertSame(blocks.get(2), condBr.getElseBlock());
        assertSame(blocks.get(0).getOps().get(0).getResult(0), condBr.getCondition());
        assertEquals(Collections.singletonList(blocks.get(0).getOps().get(1).getResult(0)), condBr.getThenOperands());
        assertEquals(Collections.singletonList(blocks.get(0).getOps().get(2).getResult(0)), condBr.getElseOperands());

        BranchOp br = (BranchOp) blocks.get(1).getLastOp();
        assertSame(blocks.get(3), br.getDest());
        assertEquals(Collections.singletonList(blocks.get(1).getArg(0)), br.getDestOperands());
    }

    @Test
    void roundTripsThroughImmutableForm() {
        Operation func = diamond();
        IOp ifunc = new FromMutable().run(func);
        assertSame(ifunc.getRegion().getBlocks().get(3),
                ifunc.getRegion().getBlocks().get(1).getOps().get(0).getSuccessors().get(0));

        Operation back = new ToMutable().run(ifunc);
        assertNotSame(func, back);
        List<Block> blocks = back.getRegion(0).getBlocks();
        assertEquals(4, blocks.size());
        CondBranchOp condBr = (CondBranchOp) blocks.get(0).getLastOp();
        assertSame(blocks.get(1), condBr.getThenBlock());
        assertSame(blocks.get(2), condBr.getElseBlock());
        assertSame(blocks.get(3), ((BranchOp) blocks.get(2).getLastOp()).getDest());
        assertSame(blocks.get(2).getArg(0), ((BranchOp) blocks.get(2).getLastOp()).getDestOperands().get(0));
        back.verify();
        VerifyIntegrity.INSTANCE.runInPlace(back);
    }

    @Test
    void verifierChecksArguments() {
        Block exit = new Block(Collections.singletonList(I32));
        BranchOp missing = br(exit);
        VerifyException e = assertThrows(VerifyException.class, missing::verify);
        assertTrue(e.getMessage().contains("takes 1 argument(s), got 0"), e.getMessage());

        ConstantOp wide = constant(1, IntegerType.I64);
        assertThrows(VerifyException.class, () -> br(exit, wide.getResult(0)).verify());

        ConstantOp notBool = constant(1, I32);
        Block empty = new Block();
        CondBranchOp badCond = condBr(notBool.getResult(0),
                empty, Collections.<Value>emptyList(), empty, Collections.<Value>emptyList());
        e = assertThrows(VerifyException.class, badCond::verify);
        assertTrue(e.getMessage().contains("condition must be an i1"), e.getMessage());
    }
}
