package io.github.eutro.irkit.test;

import io.github.eutro.irkit.attr.IntegerAttr;
import io.github.eutro.irkit.attr.IntegerType;
import io.github.eutro.irkit.immutable.*;
import io.github.eutro.irkit.ir.Block;
import io.github.eutro.irkit.ir.Operation;
import io.github.eutro.irkit.ir.Region;
import io.github.eutro.irkit.ir.Value;
import io.github.eutro.irkit.util.ImmutabilityViolationException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.irkit.test.TestDialect.*;
import static org.junit.jupiter.api.Assertions.*;

public class ImmutableIRTest {
    private static IOp iconst(long value) {
        return IOpBuilder.newOp(CONST)
                .resultTypes(I32)
                .attribute("value", IntegerAttr.of(value, 32))
                .buildOp();
    }

    private static IOp iadd(IValue lhs, IValue rhs) {
        return IOpBuilder.newOp(ADD)
                .operands(IOperand.of(lhs), IOperand.of(rhs))
                .resultTypes(I32)
                .buildOp();
    }

    private static IOp ineg(IValue in) {
        return IOpBuilder.newOp(NEG)
                .operands(IOperand.of(in))
                .resultTypes(I32)
                .buildOp();
    }

    /**
     * Compare two mutable operations structurally, treating values as equal
     * if they are defined at the same position.
     */
    private static void assertSameShape(Operation expected, Operation actual) {
        List<Operation> expectedOps = expected.preOrder().toList();
        List<Operation> actualOps = actual.preOrder().toList();
        assertEquals(expectedOps.size(), actualOps.size());
        Map<Value, Value> values = new HashMap<>();
        Map<Block, Block> blocks = new HashMap<>();
        for (int i = 0; i < expectedOps.size(); i++) {
            Operation e = expectedOps.get(i);
            Operation a = actualOps.get(i);
            assertSame(e.getKind(), a.getKind());
            assertEquals(e.getAttributes(), a.getAttributes());
            assertEquals(e.getResultTypes(), a.getResultTypes());
            assertEquals(e.getNumOperands(), a.getNumOperands());
            assertEquals(e.getRegions().size(), a.getRegions().size());
            for (int r = 0; r < e.getRegions().size(); r++) {
                List<Block> eBlocks = e.getRegion(r).getBlocks();
                List<Block> aBlocks = a.getRegion(r).getBlocks();
                assertEquals(eBlocks.size(), aBlocks.size());
                for (int b = 0; b < eBlocks.size(); b++) {
                    blocks.put(eBlocks.get(b), aBlocks.get(b));
                    assertEquals(eBlocks.get(b).getArgTypes(), aBlocks.get(b).getArgTypes());
                    for (int arg = 0; arg < eBlocks.get(b).getArgs().size(); arg++) {
                        values.put(eBlocks.get(b).getArg(arg), aBlocks.get(b).getArg(arg));
                    }
                }
            }
            for (int o = 0; o < e.getNumOperands(); o++) {
                assertSame(values.get(e.getOperand(o)), a.getOperand(o), "operand " + o + " of " + e.describe());
            }
            for (int r = 0; r < e.getResults().size(); r++) {
                values.put(e.getResult(r), a.getResult(r));
            }
            for (int s = 0; s < e.getSuccessors().size(); s++) {
                assertSame(blocks.get(e.getSuccessor(s)), a.getSuccessor(s));
            }
        }
    }

    private static Operation sampleModule() {
        Block body = new Block(Collections.singletonList(IntegerType.I32));
        Operation c = constant(1);
        Operation add = add(body.getArg(0), c.getResult(0));
        Operation nested = region(Block.of(neg(add.getResult(0))));
        body.addOps(Arrays.asList(c, add, nested, use(add.getResult(0), body.getArg(0))));
        return module(body);
    }

    @Test
    void roundTripPreservesStructure() {
        Operation module = sampleModule();
        IOp imodule = new FromMutable().run(module);
        Operation back = new ToMutable().run(imodule);
        assertNotSame(module, back);
        assertSameShape(module, back);
        back.verify();
    }

    @Test
    void roundTripPreservesSuccessors() {
        Block entry = new Block();
        Block exit = new Block(Collections.singletonList(IntegerType.I32));
        entry.addOp(br(exit));
        exit.addOp(use(exit.getArg(0)));
        Operation region = region(entry, exit);

        IOp iregion = new FromMutable().run(region);
        IRegion r = iregion.getRegion();
        assertNotNull(r);
        assertSame(r.getBlocks().get(1), r.getBlocks().get(0).getOps().get(0).getSuccessors().get(0));

        Operation back = new ToMutable().run(iregion);
        assertSameShape(region, back);
        Region backRegion = back.getRegion(0);
        assertSame(backRegion.getBlocks().get(1), backRegion.getOps().get(0).getSuccessor(0));
    }

    @Test
    void backEdgesCannotBeConverted() {
        Block loop = new Block();
        loop.addOp(br(loop));
        Operation region = region(loop);
        assertThrows(UnresolvedReferenceException.class, () -> new FromMutable().run(region));
    }

    @Test
    void producersAreConvertedOnDemand() {
        Operation c = constant(4);
        Operation neg = neg(c.getResult(0));
        module(c, neg);

        FromMutable from = new FromMutable();
        IOp ineg = from.convertOp(neg);
        IValue operand = ineg.getOperand(0);
        assertTrue(operand instanceof IResult);
        assertSame(CONST, ((IResult) operand).getOp().getKind());
        assertSame(operand, from.lookup(c.getResult(0)));
        assertSame(((IResult) operand).getOp(), from.convertOp(c));
    }

    @Test
    void unmappedBlockArgumentIsUnresolved() {
        Block outer = new Block(Collections.singletonList(IntegerType.I32));
        Operation neg = neg(outer.getArg(0));
        outer.addOp(neg);
        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class,
                () -> new FromMutable().convertOp(neg));
        assertTrue(e.getMessage().contains("arg#0"), e.getMessage());
    }

    @Test
    void unmappedOperandIsUnresolved() {
        IOp c = iconst(1);
        IOp neg = ineg(c.getResult());
        ToMutable to = new ToMutable();
        UnresolvedReferenceException e = assertThrows(UnresolvedReferenceException.class, () -> to.convertOp(neg));
        assertEquals("operand #0 (result#0 of test.const) of test.neg is not defined", e.getMessage());

        IBlock target = new IBlock(Collections.emptyList(), Collections.singletonList(iconst(3)));
        IOp branch = IOpBuilder.newOp(BR).successors(target).buildOp();
        e = assertThrows(UnresolvedReferenceException.class, () -> to.convertOp(branch));
        assertEquals("successor #0 (a block of 0 argument(s) and 1 operation(s)) of test.br"
                + " is not in an enclosing region", e.getMessage());

        Operation existing = constant(1);
        to.bind(c.getResult(), existing.getResult(0));
        Operation converted = to.convertOp(neg);
        assertSame(existing.getResult(0), converted.getOperand(0));
    }

    @Test
    void immutableNodesAreSealed() {
        IOp c = iconst(1);
        IBlock block = new IBlock(Collections.singletonList(I32), Collections.singletonList(c));
        assertThrows(ImmutabilityViolationException.class, () -> block.getOps().add(c));
        assertThrows(ImmutabilityViolationException.class, () -> c.getOperands().clear());
        assertThrows(ImmutabilityViolationException.class, () -> c.getResults().remove(0));
        assertThrows(UnsupportedOperationException.class, () -> c.getAttributes().put("x", IntegerAttr.of(0, 32)));

        IBlockArg arg = block.getArg(0);
        assertSame(block, arg.getBlock());
        assertThrows(ImmutabilityViolationException.class,
                () -> IBlock.withArgs(Collections.singletonList(arg), Collections.emptyList()));
    }

    @Test
    void resultEqualityIsByOpAndIndex() {
        IOp c = iconst(1);
        assertEquals(c.getResult(), c.getResults().get(0));
        assertNotEquals(c.getResult(), iconst(1).getResult());
        IBlockArg a = new IBlockArg(I32, 0);
        IBlockArg b = new IBlockArg(I32, 0);
        assertNotEquals(a, b);
    }

    @Test
    void rebuildSharesIndependentOps() {
        IBlockArg x = new IBlockArg(I32, 0);
        IOp c = iconst(1);
        IOp a = iadd(x, c.getResult());
        IOp unrelated = iconst(2);
        IOp b = ineg(a.getResult());
        IOp tail = ineg(unrelated.getResult());
        IBlock original = IBlock.withArgs(Collections.singletonList(x), Arrays.asList(c, a, unrelated, b, tail));

        IOp replacement = iconst(5);
        Map<IValue, IValue> env = new HashMap<>();
        env.put(a.getResult(), replacement.getResult());
        IBlock rebuilt = IBlock.rebuild(Arrays.asList(c, replacement, unrelated, b, tail), original, env);

        List<IOp> newOps = rebuilt.getOps();
        assertSame(c, newOps.get(0));
        assertSame(replacement, newOps.get(1));
        assertSame(unrelated, newOps.get(2));
        assertNotSame(b, newOps.get(3));
        assertSame(replacement.getResult(), newOps.get(3).getOperand(0));
        assertSame(b.getOpData(), newOps.get(3).getOpData());
        assertSame(tail, newOps.get(4));
        assertSame(newOps.get(3).getResult(), env.get(b.getResult()));
        assertSame(rebuilt.getArg(0), env.get(x));
        assertNotSame(x, rebuilt.getArg(0));
    }

    @Test
    void deadOpsAreDropped() {
        IBlockArg x = new IBlockArg(I32, 0);
        IOp c = iconst(1);
        IOp n = ineg(c.getResult());
        IOp k = iconst(2);
        IOp m = ineg(x);
        IOp u = IOpBuilder.newOp(USE).operands(IOperand.of(m.getResult())).buildOp();
        IBlock block = IBlock.withArgs(Collections.singletonList(x), Arrays.asList(c, n, k, m, u));
        IOp holder = IOpBuilder.newOp(REGION).regions(IRegion.of(block)).buildOp();

        IOp pruned = new DeadOpElimination(Collections.singleton(k.getResult())).run(holder);
        IBlock newBlock = pruned.getRegion().getBlock();
        List<IOp> ops = newBlock.getOps();
        assertEquals(3, ops.size());
        assertSame(k, ops.get(0));
        assertSame(NEG, ops.get(1).getKind());
        assertSame(newBlock.getArg(0), ops.get(1).getOperand(0));
        assertSame(ops.get(1).getResult(), ops.get(2).getOperand(0));

        IOp bare = DeadOpElimination.INSTANCE.run(holder);
        assertEquals(Arrays.asList(NEG, USE), Arrays.asList(
                bare.getRegion().getOps().get(0).getKind(),
                bare.getRegion().getOps().get(1).getKind()));
        assertSame(bare, DeadOpElimination.INSTANCE.run(bare));
        assertEquals(5, holder.getRegion().getOps().size());
    }

    @Test
    void liveValuesFollowRebuilds() {
        IBlockArg x = new IBlockArg(I32, 0);
        IOp c = iconst(1);
        IOp m = ineg(x);
        IBlock block = IBlock.withArgs(Collections.singletonList(x), Arrays.asList(c, m));
        IOp holder = IOpBuilder.newOp(REGION).regions(IRegion.of(block)).buildOp();

        IOp pruned = new DeadOpElimination(Collections.singleton(m.getResult())).run(holder);
        List<IOp> ops = pruned.getRegion().getOps();
        assertEquals(1, ops.size());
        assertNotSame(m, ops.get(0));
        assertSame(pruned.getRegion().getBlock().getArg(0), ops.get(0).getOperand(0));
    }

    @Test
    void substitutionRebuildsOnlyDependents() {
        IBlockArg a0 = new IBlockArg(I32, 0);
        IOp x = ineg(a0);
        IOp y = iconst(3);
        IBlock block = IBlock.withArgs(Collections.singletonList(a0), Arrays.asList(x, y));

        Map<IValue, IValue> env = new HashMap<>();
        IBlock rebuilt = block.rebuildWithSubstitution(env);

        assertSame(y, rebuilt.getOps().get(1));
        assertNotSame(x, rebuilt.getOps().get(0));
        assertSame(rebuilt.getArg(0), rebuilt.getOps().get(0).getOperand(0));
        assertSame(rebuilt.getArg(0), env.get(a0));
        assertSame(rebuilt.getOps().get(0).getResult(), env.get(x.getResult()));
    }

    @Test
    void rebuildFollowsNestedRegions() {
        IOp c = iconst(1);
        IOp inner = ineg(c.getResult());
        IOp holder = IOpBuilder.newOp(REGION)
                .regions(IRegion.of(new IBlock(Collections.emptyList(), Collections.singletonList(inner))))
                .buildOp();
        IOp untouchedInner = iconst(3);
        IOp untouched = IOpBuilder.newOp(REGION)
                .regions(IRegion.of(new IBlock(Collections.emptyList(), Collections.singletonList(untouchedInner))))
                .buildOp();
        IBlock block = new IBlock(Collections.emptyList(), Arrays.asList(c, holder, untouched));

        IOp replacement = iconst(2);
        Map<IValue, IValue> env = new HashMap<>();
        env.put(c.getResult(), replacement.getResult());
        IBlock rebuilt = IBlock.rebuild(Arrays.asList(replacement, holder, untouched), block, env);

        IOp newHolder = rebuilt.getOps().get(1);
        assertNotSame(holder, newHolder);
        IOp newInner = newHolder.getRegion().getOps().get(0);
        assertSame(replacement.getResult(), newInner.getOperand(0));
        assertSame(untouched, rebuilt.getOps().get(2));
    }

    @Test
    void rebuildMintsFreshArguments() {
        IBlockArg x = new IBlockArg(I32, 0);
        IOp neg = ineg(x);
        IBlock block = IBlock.withArgs(Collections.singletonList(x), Collections.singletonList(neg));

        IBlock copy = block.rebuildWithSubstitution(new HashMap<>());
        assertNotSame(x, copy.getArg(0));
        assertSame(copy, copy.getArg(0).getBlock());
        assertSame(copy.getArg(0), copy.getOps().get(0).getOperand(0));
        assertSame(x, block.getOps().get(0).getOperand(0));

        IOp c = iconst(9);
        Map<IValue, IValue> env = new HashMap<>();
        IBlock withConst = IBlock.rebuild(Arrays.asList(c, neg), block, env);
        assertSame(c, withConst.getOps().get(0));
        assertSame(withConst.getArg(0), withConst.getOps().get(1).getOperand(0));
    }

    @Test
    void pendingOperandsAreDeduplicated() {
        IOp shared = iconst(1);
        List<IOp> chain = IOpBuilder.newOp(NEG)
                .operands(IOperand.of(shared))
                .resultTypes(I32)
                .build();
        assertEquals(Arrays.asList(shared, chain.get(1)), chain);

        List<IOp> built = IOpBuilder.newOp(ADD)
                .operands(IOperand.of(chain), IOperand.of(shared))
                .resultTypes(I32)
                .build();
        assertEquals(3, built.size());
        assertSame(shared, built.get(0));
        assertSame(chain.get(1), built.get(1));
        IOp add = built.get(2);
        assertSame(chain.get(1).getResult(), add.getOperand(0));
        assertSame(shared.getResult(), add.getOperand(1));
    }

    @Test
    void pendingProducersComeFirst() {
        IOp shared = iconst(1);
        IOp neg = ineg(shared.getResult());

        List<IOp> built = IOpBuilder.newOp(ADD)
                .operands(IOperand.of(neg), IOperand.of(Arrays.asList(shared, neg)))
                .resultTypes(I32)
                .build();
        assertEquals(3, built.size());
        assertSame(shared, built.get(0));
        assertSame(neg, built.get(1));
        IOp add = built.get(2);
        assertSame(neg.getResult(), add.getOperand(0));
        assertSame(neg.getResult(), add.getOperand(1));

        IOp other = iconst(2);
        List<IOp> independent = IOpBuilder.newOp(ADD)
                .operands(IOperand.of(other), IOperand.of(neg), IOperand.of(shared))
                .resultTypes(I32)
                .build();
        assertEquals(Arrays.asList(other, shared, neg), independent.subList(0, 3));
    }

    @Test
    void fromOpSharesMetadata() {
        IOp c = iconst(1);
        IOp a = iadd(c.getResult(), c.getResult());
        IOp other = iconst(2);

        IOp copy = IOpBuilder.fromOp(a).operandValues(Arrays.asList(other.getResult(), c.getResult())).buildOp();
        assertSame(a.getOpData(), copy.getOpData());
        assertSame(other.getResult(), copy.getOperand(0));

        IOp changed = IOpBuilder.fromOp(c).attribute("value", IntegerAttr.of(3, 32)).buildOp();
        assertNotSame(c.getOpData(), changed.getOpData());
        assertEquals(IntegerAttr.of(3, 32), changed.getAttribute("value"));
        assertEquals(IntegerAttr.of(1, 32), c.getAttribute("value"));

        Map<IValue, IValue> env = new HashMap<>();
        env.put(c.getResult(), other.getResult());
        IOp remapped = IOpBuilder.fromOp(a, env).buildOp();
        assertSame(other.getResult(), remapped.getOperand(1));
        assertSame(remapped.getResult(), env.get(a.getResult()));
    }

    @Test
    void walksAndQueries() {
        IOp c = iconst(1);
        IOp inner = ineg(c.getResult());
        IRegion region = IRegion.of(new IBlock(Collections.emptyList(), Collections.singletonList(inner)));
        IOp holder = IOpBuilder.newOp(REGION).regions(region).buildOp();

        List<IOp> walked = new ArrayList<>();
        holder.walk(walked::add);
        assertEquals(Arrays.asList(holder, inner), walked);
        assertFalse(holder.walkAbortable(op -> op != inner));
        assertTrue(region.isValueUsedInside(c.getResult()));
        assertFalse(region.isValueUsedInside(inner.getResult()));
        assertNull(c.getRegion());
        assertEquals(Collections.singletonList(I32), c.getResultTypes());
        assertEquals("test.neg", inner.getName());
    }
}
