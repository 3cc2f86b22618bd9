package io.github.eutro.irkit.dialects;

import io.github.eutro.irkit.dialects.arith.ArithDialect;
import io.github.eutro.irkit.dialects.builtin.BuiltinDialect;
import io.github.eutro.irkit.dialects.cf.CfDialect;
import io.github.eutro.irkit.ir.OpKindRegistry;

/**
 * The dialects in this module.
 */
public class Dialects {
    /**
     * Create a sealed registry of the {@code builtin}, {@code arith} and {@code cf} dialects.
     *
     * @return The registry.
     */
    public static OpKindRegistry createRegistry() {
        OpKindRegistry registry = new OpKindRegistry()
                .load(BuiltinDialect.DIALECT)
                .load(ArithDialect.DIALECT)
                .load(CfDialect.DIALECT);
        registry.seal();
        return registry;
    }
}
