package io.github.eutro.irkit.ir;

import io.github.eutro.irkit.attr.Attribute;

import java.util.List;
import java.util.Map;

/**
 * Constructs operations of a kind.
 * <p>
 * Dialects that give their operations a dedicated class register its constructor here,
 * e.g. {@code AddiOp::new}. The plain {@link Operation} constructor is the default.
 */
@FunctionalInterface
public interface OpFactory {
    Operation create(OpKind kind,
                     List<? extends Value> operands,
                     List<? extends Attribute> resultTypes,
                     Map<String, ? extends Attribute> attributes,
                     List<Block> successors,
                     List<Region> regions);
}
