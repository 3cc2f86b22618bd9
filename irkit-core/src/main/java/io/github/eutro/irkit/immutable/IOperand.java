package io.github.eutro.irkit.immutable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An operand given to an {@link IOpBuilder}: a value that already exists, or
 * the result of an operation (or the last of a chain of operations) which is
 * inserted along with the operation being built.
 */
public abstract class IOperand {
    private IOperand() {
    }

    public static IOperand of(IValue value) {
        return new Defined(value);
    }

    /**
     * An operand defined by the first result of a new operation.
     *
     * @param op The operation.
     * @return The operand.
     */
    public static IOperand of(IOp op) {
        return new Pending(Collections.singletonList(op));
    }

    /**
     * An operand defined by the first result of the last operation of a chain, as
     * returned by {@link IOpBuilder#build()}.
     *
     * @param chain The chain of new operations.
     * @return The operand.
     */
    public static IOperand of(List<IOp> chain) {
        if (chain.isEmpty()) throw new IllegalArgumentException("empty operation chain");
        return new Pending(chain);
    }

    public static List<IOperand> values(List<? extends IValue> values) {
        List<IOperand> operands = new ArrayList<>(values.size());
        for (IValue value : values) {
            operands.add(of(value));
        }
        return operands;
    }

    abstract IValue value();

    abstract List<IOp> pending();

    private static final class Defined extends IOperand {
        private final IValue value;

        Defined(IValue value) {
            this.value = value;
        }

        @Override
        IValue value() {
            return value;
        }

        @Override
        List<IOp> pending() {
            return Collections.emptyList();
        }
    }

    private static final class Pending extends IOperand {
        private final List<IOp> chain;

        Pending(List<IOp> chain) {
            this.chain = new ArrayList<>(chain);
        }

        @Override
        IValue value() {
            IOp last = chain.get(chain.size() - 1);
            IResult result = last.getResult();
            if (result == null) {
                throw new IllegalArgumentException(last.getName() + " has no result to use as an operand");
            }
            return result;
        }

        @Override
        List<IOp> pending() {
            return chain;
        }
    }
}
