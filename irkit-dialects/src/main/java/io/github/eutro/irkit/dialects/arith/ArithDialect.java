package io.github.eutro.irkit.dialects.arith;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.attr.IntegerAttr;
import io.github.eutro.irkit.attr.IntegerType;
import io.github.eutro.irkit.attr.TypeAttribute;
import io.github.eutro.irkit.ext.Ext;
import io.github.eutro.irkit.ir.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.function.LongBinaryOperator;

/**
 * The {@code arith} dialect: integer constants, arithmetic and comparisons.
 */
public class ArithDialect {
    /**
     * How an {@link IntBinaryOp} of a kind combines two constants. Attached to the kind.
     */
    public static final Ext<LongBinaryOperator> FOLDER = Ext.create(LongBinaryOperator.class, "FOLDER");

    /**
     * Effect: returns the integer in its {@code value} attribute, which has the type of the result.
     */
    public static final OpKind CONSTANT = OpKind.builder("arith.constant")
            .factory(ConstantOp::new)
            .resultNames("result")
            .verifier(ArithDialect::verifyConstant)
            .pure()
            .build();
    /**
     * Effect: returns {@code lhs + rhs}, wrapping.
     */
    public static final OpKind ADDI = binary("arith.addi");
    /**
     * Effect: returns {@code lhs - rhs}, wrapping.
     */
    public static final OpKind SUBI = binary("arith.subi");
    /**
     * Effect: returns {@code lhs * rhs}, wrapping.
     */
    public static final OpKind MULI = binary("arith.muli");
    /**
     * Effect: compares {@code lhs} with {@code rhs} by its {@code predicate}, returning an {@code i1}.
     */
    public static final OpKind CMPI = OpKind.builder("arith.cmpi")
            .factory(CmpiOp::new)
            .operandNames("lhs", "rhs")
            .resultNames("result")
            .verifier(ArithDialect::verifyCmpi)
            .pure()
            .build();

    public static final Dialect DIALECT = new Dialect("arith", CONSTANT, ADDI, SUBI, MULI, CMPI);

    static {
        ADDI.attachExt(FOLDER, Long::sum);
        SUBI.attachExt(FOLDER, (a, b) -> a - b);
        MULI.attachExt(FOLDER, (a, b) -> a * b);
    }

    private static OpKind binary(String name) {
        return OpKind.builder(name)
                .factory(IntBinaryOp::new)
                .operandNames("lhs", "rhs")
                .resultNames("result")
                .verifier(ArithDialect::verifyBinary)
                .pure()
                .build();
    }

    private static void verifyConstant(Operation op) {
        if (op.getNumOperands() != 0 || op.getResults().size() != 1) {
            throw new VerifyException(op, "expected no operands and one result");
        }
        Attribute value = op.getAttribute("value");
        if (!(value instanceof IntegerAttr)) {
            throw new VerifyException(op, "expected an integer 'value', got " + value);
        }
        if (!((IntegerAttr) value).getType().equals(op.getResult(0).getType())) {
            throw new VerifyException(op, String.format("value of type %s does not match result type %s",
                    ((IntegerAttr) value).getType(), op.getResult(0).getType()));
        }
    }

    private static void verifyOperands(Operation op) {
        if (op.getNumOperands() != 2 || op.getResults().size() != 1) {
            throw new VerifyException(op, "expected two operands and one result");
        }
        Attribute lhs = op.getOperand(0).getType();
        Attribute rhs = op.getOperand(1).getType();
        if (!lhs.equals(rhs)) {
            throw new VerifyException(op, String.format("operands must have the same type, but provided %s and %s",
                    lhs, rhs));
        }
    }

    private static void verifyBinary(Operation op) {
        verifyOperands(op);
        if (!op.getOperand(0).getType().equals(op.getResult(0).getType())) {
            throw new VerifyException(op, String.format("result type %s does not match operand type %s",
                    op.getResult(0).getType(), op.getOperand(0).getType()));
        }
    }

    private static void verifyCmpi(Operation op) {
        verifyOperands(op);
        if (!IntegerType.I1.equals(op.getResult(0).getType())) {
            throw new VerifyException(op, "expected an i1 result, got " + op.getResult(0).getType());
        }
        Attribute predicate = op.getAttribute("predicate");
        if (!(predicate instanceof IntegerAttr)
                || CmpPredicate.byValue(((IntegerAttr) predicate).getValue()) == null) {
            throw new VerifyException(op, "unknown comparison predicate " + predicate);
        }
    }

    public static ConstantOp constant(long value, TypeAttribute type) {
        return (ConstantOp) CONSTANT.create(Collections.emptyList(), Collections.singletonList(type),
                Collections.singletonMap("value", new IntegerAttr(value, type)),
                Collections.emptyList(), Collections.emptyList());
    }

    public static ConstantOp constant(IntegerAttr value) {
        return constant(value.getValue(), value.getType());
    }

    private static IntBinaryOp binaryOp(OpKind kind, Value lhs, Value rhs) {
        return (IntBinaryOp) kind.create(Arrays.asList(lhs, rhs), Collections.singletonList(lhs.getType()));
    }

    public static IntBinaryOp addi(Value lhs, Value rhs) {
        return binaryOp(ADDI, lhs, rhs);
    }

    public static IntBinaryOp subi(Value lhs, Value rhs) {
        return binaryOp(SUBI, lhs, rhs);
    }

    public static IntBinaryOp muli(Value lhs, Value rhs) {
        return binaryOp(MULI, lhs, rhs);
    }

    public static CmpiOp cmpi(CmpPredicate predicate, Value lhs, Value rhs) {
        return cmpi(predicate.ordinal(), lhs, rhs);
    }

    /**
     * Create a comparison with a raw predicate encoding, which is not checked.
     *
     * @param predicate The encoding of the predicate.
     * @param lhs       The left operand.
     * @param rhs       The right operand.
     * @return The comparison.
     */
    public static CmpiOp cmpi(long predicate, Value lhs, Value rhs) {
        return (CmpiOp) CMPI.create(Arrays.asList(lhs, rhs), Collections.singletonList(IntegerType.I1),
                Collections.singletonMap("predicate", IntegerAttr.of(predicate, 64)),
                Collections.emptyList(), Collections.emptyList());
    }
}
