package io.github.eutro.irkit.dialects.cf;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.attr.IntegerType;
import io.github.eutro.irkit.ir.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The {@code cf} dialect: unstructured control flow between the blocks of a region.
 */
public class CfDialect {
    /**
     * Control: an unconditional jump.
     */
    public static final OpKind BR = OpKind.builder("cf.br")
            .factory(BranchOp::new)
            .verifier(op -> {
                if (op.getSuccessors().size() != 1) {
                    throw new VerifyException(op, "expected one successor");
                }
                checkArguments(op, op.getSuccessor(0), op.getOperands());
            })
            .build();
    /**
     * Control: a two-way conditional jump on an {@code i1}.
     */
    public static final OpKind COND_BR = OpKind.builder("cf.cond_br")
            .factory(CondBranchOp::new)
            .verifier(op -> {
                if (op.getSuccessors().size() != 2) {
                    throw new VerifyException(op, "expected two successors");
                }
                int thenCount = op.getSuccessor(0).getArgs().size();
                int elseCount = op.getSuccessor(1).getArgs().size();
                if (op.getNumOperands() != 1 + thenCount + elseCount) {
                    throw new VerifyException(op, String.format("expected %d operand(s), got %d",
                            1 + thenCount + elseCount, op.getNumOperands()));
                }
                if (!IntegerType.I1.equals(op.getOperand(0).getType())) {
                    throw new VerifyException(op, "condition must be an i1, got " + op.getOperand(0).getType());
                }
                CondBranchOp br = (CondBranchOp) op;
                checkArguments(op, br.getThenBlock(), br.getThenOperands());
                checkArguments(op, br.getElseBlock(), br.getElseOperands());
            })
            .build();

    public static final Dialect DIALECT = new Dialect("cf", BR, COND_BR);

    private static void checkArguments(Operation op, Block dest, List<Value> args) {
        List<Attribute> expected = dest.getArgTypes();
        if (args.size() != expected.size()) {
            throw new VerifyException(op, String.format("%s takes %d argument(s), got %d",
                    dest.describe(), expected.size(), args.size()));
        }
        for (int i = 0; i < args.size(); i++) {
            if (!expected.get(i).equals(args.get(i).getType())) {
                throw new VerifyException(op, String.format("argument %d of %s is %s, got %s",
                        i, dest.describe(), expected.get(i), args.get(i).getType()));
            }
        }
    }

    public static BranchOp br(Block dest, Value... args) {
        return (BranchOp) BR.create(Arrays.asList(args), Collections.emptyList(), Collections.emptyMap(),
                Collections.singletonList(dest), Collections.emptyList());
    }

    public static CondBranchOp condBr(Value cond,
                                      Block thenBlock, List<? extends Value> thenArgs,
                                      Block elseBlock, List<? extends Value> elseArgs) {
        List<Value> operands = new ArrayList<>(1 + thenArgs.size() + elseArgs.size());
        operands.add(cond);
        operands.addAll(thenArgs);
        operands.addAll(elseArgs);
        return (CondBranchOp) COND_BR.create(operands, Collections.emptyList(), Collections.emptyMap(),
                Arrays.asList(thenBlock, elseBlock), Collections.emptyList());
    }
}
