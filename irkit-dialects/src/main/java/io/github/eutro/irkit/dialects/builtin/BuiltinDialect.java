package io.github.eutro.irkit.dialects.builtin;

import io.github.eutro.irkit.ir.*;

import java.util.Collections;

/**
 * The {@code builtin} dialect.
 */
public class BuiltinDialect {
    /**
     * The module: no operands or results, and one region holding one block without arguments.
     */
    public static final OpKind MODULE = OpKind.builder("builtin.module")
            .factory(ModuleOp::new)
            .verifier(op -> {
                if (op.getNumOperands() != 0 || !op.getResults().isEmpty()) {
                    throw new VerifyException(op, "a module has no operands or results");
                }
                if (op.getRegions().size() != 1
                        || op.getRegion(0).getBlocks().size() != 1
                        || !op.getRegion(0).getBlock().getArgs().isEmpty()) {
                    throw new VerifyException(op, "a module has one region of one block without arguments");
                }
            })
            .build();

    public static final Dialect DIALECT = new Dialect("builtin", MODULE);

    public static ModuleOp module(Block body) {
        return (ModuleOp) MODULE.create(Collections.emptyList(), Collections.emptyList(), Collections.emptyMap(),
                Collections.emptyList(), Collections.singletonList(Region.of(body)));
    }

    public static ModuleOp module(Operation... ops) {
        return module(Block.of(ops));
    }
}
