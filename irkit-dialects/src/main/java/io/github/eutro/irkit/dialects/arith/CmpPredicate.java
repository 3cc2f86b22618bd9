package io.github.eutro.irkit.dialects.arith;

import io.github.eutro.irkit.attr.IntegerType;
import io.github.eutro.irkit.attr.TypeAttribute;
import org.jetbrains.annotations.Nullable;

/**
 * The comparison predicates of {@code arith.cmpi}, in the order of their encoding.
 */
public enum CmpPredicate {
    EQ("eq"),
    NE("ne"),
    SLT("slt"),
    SLE("sle"),
    SGT("sgt"),
    SGE("sge"),
    ULT("ult"),
    ULE("ule"),
    UGT("ugt"),
    UGE("uge"),
    ;

    private static final CmpPredicate[] VALUES = values();

    private final String mnemonic;

    CmpPredicate(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    /**
     * Get the predicate with the given encoding.
     *
     * @param value The encoding.
     * @return The predicate, or null if there is none.
     */
    @Nullable
    public static CmpPredicate byValue(long value) {
        if (value < 0 || value >= VALUES.length) return null;
        return VALUES[(int) value];
    }

    public static CmpPredicate byMnemonic(String mnemonic) {
        for (CmpPredicate predicate : VALUES) {
            if (predicate.mnemonic.equals(mnemonic)) return predicate;
        }
        throw new IllegalArgumentException("Unknown comparison mnemonic: " + mnemonic);
    }

    /**
     * Evaluate this predicate on two constants of an integer or index type.
     *
     * @param lhs  The left operand, as stored in its attribute.
     * @param rhs  The right operand, as stored in its attribute.
     * @param type The type of both operands.
     * @return The result of the comparison.
     */
    public boolean evaluate(long lhs, long rhs, TypeAttribute type) {
        long ulhs = lhs;
        long urhs = rhs;
        if (type instanceof IntegerType) {
            ulhs = ((IntegerType) type).toUnsigned(lhs);
            urhs = ((IntegerType) type).toUnsigned(rhs);
        }
        switch (this) {
            case EQ:
                return lhs == rhs;
            case NE:
                return lhs != rhs;
            case SLT:
                return lhs < rhs;
            case SLE:
                return lhs <= rhs;
            case SGT:
                return lhs > rhs;
            case SGE:
                return lhs >= rhs;
            case ULT:
                return Long.compareUnsigned(ulhs, urhs) < 0;
            case ULE:
                return Long.compareUnsigned(ulhs, urhs) <= 0;
            case UGT:
                return Long.compareUnsigned(ulhs, urhs) > 0;
            case UGE:
                return Long.compareUnsigned(ulhs, urhs) >= 0;
            default:
                throw new AssertionError(this);
        }
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
