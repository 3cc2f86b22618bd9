package io.github.eutro.irkit.test;

import io.github.eutro.irkit.attr.IntegerAttr;
import io.github.eutro.irkit.attr.IntegerType;
import io.github.eutro.irkit.attr.StringAttr;
import io.github.eutro.irkit.ext.CommonExts;
import io.github.eutro.irkit.ext.Ext;
import io.github.eutro.irkit.ir.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.irkit.test.TestDialect.*;
import static org.junit.jupiter.api.Assertions.*;

public class IRModelTest {
    @Test
    void resultsAndArgsAreStamped() {
        Operation c = constant(1);
        OpResult result = c.getResult(0);
        assertSame(c, result.getOp());
        assertEquals(0, result.getIndex());
        assertSame(c, result.getDefiningOp());

        Block block = new Block(Arrays.asList(IntegerType.I32, IntegerType.I64));
        assertEquals(2, block.getArgs().size());
        assertSame(block, block.getArg(1).getBlock());
        assertEquals(1, block.getArg(1).getIndex());
        assertEquals(IntegerType.I64, block.getArg(1).getType());
        assertNull(block.getArg(0).getDefiningOp());
    }

    @Test
    void useListsFollowOperands() {
        Operation c1 = constant(1);
        Operation c2 = constant(2);
        Operation add = add(c1.getResult(0), c1.getResult(0));
        Operation module = module(c1, c2, add);

        assertEquals(Arrays.asList(new Use(add, 0), new Use(add, 1)), c1.getResult(0).getUses());
        assertEquals(Collections.singletonList(add), c1.getResult(0).getUsers());

        add.setOperand(1, c2.getResult(0));
        assertEquals(Collections.singletonList(new Use(add, 0)), c1.getResult(0).getUses());
        assertEquals(Collections.singletonList(new Use(add, 1)), c2.getResult(0).getUses());

        c1.getResult(0).replaceAllUsesWith(c2.getResult(0));
        assertFalse(c1.getResult(0).hasUses());
        assertEquals(2, c2.getResult(0).getUses().size());
        assertSame(c2.getResult(0), add.getOperand(0));

        c1.erase();
        assertEquals(Arrays.asList(c2, add), ops(module));
    }

    @Test
    void operandListViewUpdatesUses() {
        Operation c1 = constant(1);
        Operation c2 = constant(2);
        Operation use = use(c1.getResult(0));
        use.getOperands().set(0, c2.getResult(0));
        assertFalse(c1.getResult(0).hasUses());
        assertTrue(c2.getResult(0).hasUses());
        assertThrows(UnsupportedOperationException.class, () -> use.getOperands().add(c1.getResult(0)));

        use.setOperands(Arrays.asList(c1.getResult(0), c1.getResult(0), c2.getResult(0)));
        assertEquals(3, use.getNumOperands());
        assertEquals(2, c1.getResult(0).getUses().size());
        assertEquals(Collections.singletonList(new Use(use, 2)), c2.getResult(0).getUses());
    }

    @Test
    void erasingUsedOpFails() {
        Operation c = constant(1);
        Operation use = use(c.getResult(0));
        module(c, use);
        IllegalStateException e = assertThrows(IllegalStateException.class, c::erase);
        assertTrue(e.getMessage().contains("test.const@/0/0/0"), e.getMessage());
        assertSame(c.getParentBlock(), use.getParentBlock());
    }

    @Test
    void erasingDropsNestedReferences() {
        Operation c = constant(1);
        Operation inner = use(c.getResult(0));
        Operation region = region(Block.of(inner));
        module(c, region);
        assertTrue(c.getResult(0).hasUses());

        region.erase();
        assertNull(region.getParentBlock());
        assertFalse(c.getResult(0).hasUses());
        assertEquals(0, inner.getNumOperands());
    }

    @Test
    void ownershipIsExclusive() {
        Operation c = constant(1);
        Block a = Block.of(c);
        Block b = new Block();
        assertSame(a, c.getParentBlock());
        assertThrows(IllegalStateException.class, () -> b.addOp(c));
        assertTrue(b.getOps().isEmpty());

        a.detachOp(c);
        assertNull(c.getParentBlock());
        b.addOp(c);
        assertSame(b, c.getParentBlock());

        Region region = Region.of(a);
        assertThrows(IllegalStateException.class, () -> new Region(Collections.singletonList(a)));
        assertSame(region, a.getParentRegion());
    }

    @Test
    void failedConstructionLeavesNoTrace() {
        Operation c = constant(1);
        Operation module = module(c);
        Region free = Region.of(new Block());
        Region owned = region(new Block()).getRegion(0);

        assertThrows(IllegalStateException.class, () -> REGION.create(
                Collections.singletonList(c.getResult(0)),
                Collections.emptyList(),
                Collections.emptyMap(),
                Collections.emptyList(),
                Arrays.asList(free, owned)));

        assertFalse(c.getResult(0).hasUses());
        assertTrue(c.getResult(0).getUses().isEmpty());
        assertNull(free.getParentOp());
        assertNotNull(owned.getParentOp());

        c.erase();
        assertTrue(ops(module).isEmpty());
    }

    @Test
    void ownershipCannotCycle() {
        Block inner = new Block();
        Operation outer = region(inner);
        Block top = Block.of(outer);
        assertSame(outer, inner.getParentOp());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> {
            outer.detach();
            inner.addOp(outer);
        });
        assertTrue(e.getMessage().contains("own descendant"), e.getMessage());
        assertTrue(inner.getOps().isEmpty());
        assertFalse(top.getOps().contains(outer));
    }

    @Test
    void insertionKeepsOrder() {
        Operation a = constant(1);
        Operation b = constant(2);
        Operation c = constant(3);
        Operation d = constant(4);
        Block block = Block.of(b);
        block.insertOpBefore(a, b);
        block.insertOpAfter(d, b);
        block.insertOpAfter(c, b);
        assertEquals(Arrays.asList(a, b, c, d), block.getOps());
        assertThrows(IllegalArgumentException.class, () -> block.insertOpBefore(constant(5), constant(6)));
    }

    @Test
    void walksArePreOrder() {
        Operation c = constant(1);
        Operation inner1 = use(c.getResult(0));
        Operation inner2 = neg(c.getResult(0));
        Operation nested = region(Block.of(inner1), Block.of(inner2));
        Operation tail = constant(2);
        Operation module = module(c, nested, tail);

        List<Operation> expected = Arrays.asList(module, c, nested, inner1, inner2, tail);
        List<Operation> walked = new ArrayList<>();
        module.walk(walked::add);
        assertEquals(expected, walked);
        assertEquals(expected, module.preOrder().toList());
        assertEquals(Arrays.asList(c, inner1, inner2, nested, tail, module), module.postOrder().toList());

        List<Operation> visited = new ArrayList<>();
        assertFalse(module.walkAbortable(op -> {
            visited.add(op);
            return op != inner1;
        }));
        assertEquals(Arrays.asList(module, c, nested, inner1), visited);
        assertTrue(module.walkAbortable(op -> true));

        assertTrue(nested.getRegion(0).isValueUsedInside(c.getResult(0)));
        assertFalse(nested.getRegion(0).isValueUsedInside(tail.getResult(0)));
    }

    @Test
    void describeUsesTreePosition() {
        Operation c = constant(1);
        Operation inner = use(c.getResult(0));
        Operation nested = region(new Block(), Block.of(inner));
        Operation module = module(c, nested);

        assertEquals("test.module@/", module.describe());
        assertEquals("test.const@/0/0/0", c.describe());
        assertEquals("test.use@/0/0/1/0/1/0", inner.describe());
        assertEquals("result#0 of test.const@/0/0/0", c.getResult(0).describe());
        assertEquals("block@/0/0", module.getRegion(0).getBlock().describe());
    }

    @Test
    void parentAccessors() {
        Operation c = constant(1);
        Block body = Block.of(c);
        Operation module = module(body);
        assertSame(body, c.getParentBlock());
        assertSame(module.getRegion(), c.getParentRegion());
        assertSame(module, c.getParentOp());
        assertTrue(module.isAncestorOf(c));
        assertFalse(c.isAncestorOf(module));
        assertNull(module.getParentOp());
        assertSame(c, module.getRegion().getOps().get(0));
    }

    @Test
    void attributes() {
        Operation c = constant(7);
        assertEquals(7, valueOf(c));
        DiagnosticException missing = assertThrows(DiagnosticException.class,
                () -> c.getAttr("missing", StringAttr.class));
        assertSame(c, missing.getOperation());
        assertThrows(DiagnosticException.class, () -> c.getAttr("value", StringAttr.class));

        c.setAttribute("name", new StringAttr("seven"));
        assertEquals(Arrays.asList("value", "name"), new ArrayList<>(c.getAttributes().keySet()));
        assertEquals(new StringAttr("seven"), c.removeAttribute("name"));
        assertNull(c.getAttribute("name"));
    }

    @Test
    void namedFields() {
        Operation c1 = constant(1);
        Operation c2 = constant(2);
        Operation add = add(c1.getResult(0), c2.getResult(0));
        assertSame(c2.getResult(0), add.getNamedOperand("rhs"));
        assertSame(add.getResult(0), add.getNamedResult("out"));
        assertNull(add.getNamedOperand("in"));
        assertNull(add.getNamedResult("missing"));
    }

    @Test
    void opsSeeKindExts() {
        Ext<String> note = Ext.create(String.class, "note");
        Operation c = constant(1);
        assertTrue(CommonExts.isPure(c));
        assertFalse(CommonExts.isPure(use()));

        c.attachExt(note, "local");
        assertEquals("local", c.getExtOrThrow(note));
        assertFalse(constant(2).getExt(note).isPresent());

        Block block = Block.of(c);
        assertSame(block, c.getExtOrThrow(CommonExts.OWNING_BLOCK));
        c.removeExt(note);
        assertNull(c.getNullable(note));
    }

    @Test
    void verifyRunsKindVerifiers() {
        Operation bad = CONST.create(Collections.emptyList(), Collections.singletonList(I32));
        Operation module = module(constant(1), region(Block.of(bad)));
        VerifyException e = assertThrows(VerifyException.class, module::verify);
        assertSame(bad, e.getOperation());
        assertTrue(e.getMessage().startsWith("test.const@/0/0/1/0/0/0"), e.getMessage());
    }

    @Test
    void registry() {
        OpKindRegistry registry = new OpKindRegistry().load(DIALECT);
        assertSame(ADD, registry.getKind("test.add"));
        assertFalse(registry.lookup("test.missing").isPresent());
        assertThrows(IllegalArgumentException.class, () -> registry.getKind("test.missing"));
        assertThrows(IllegalStateException.class, () -> registry.register(OpKind.builder("test.add").build()));

        Operation c = registry.create("test.const", Collections.emptyList(), Collections.singletonList(I32),
                Collections.singletonMap("value", IntegerAttr.of(3, 32)),
                Collections.emptyList(), Collections.emptyList());
        assertEquals(3, valueOf(c));

        assertThrows(VerifyException.class, () -> registry.create("test.const",
                Collections.emptyList(), Collections.singletonList(I32), Collections.emptyMap(),
                Collections.emptyList(), Collections.emptyList()));

        registry.seal();
        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class, () -> registry.register(OpKind.builder("test.other").build()));
        assertEquals(DIALECT.getKinds().size(), registry.getKinds().size());
    }

    @Test
    void factoryMustProduceItsKind() {
        OpKind liar = OpKind.builder("test.liar")
                .factory((kind, operands, resultTypes, attributes, successors, regions) ->
                        new Operation(ADD, operands, resultTypes))
                .build();
        assertThrows(IllegalStateException.class, () -> liar.create(Collections.emptyList(), Collections.emptyList()));
    }
}
