package io.github.eutro.irkit.dialects.builtin;

import io.github.eutro.irkit.attr.Attribute;
import io.github.eutro.irkit.ir.*;

import java.util.List;
import java.util.Map;

/**
 * The top-level container of a program: an operation with a single region of a single block.
 */
public class ModuleOp extends Operation {
    public ModuleOp(OpKind kind,
                    List<? extends Value> operands,
                    List<? extends Attribute> resultTypes,
                    Map<String, ? extends Attribute> attributes,
                    List<Block> successors,
                    List<Region> regions) {
        super(kind, operands, resultTypes, attributes, successors, regions);
    }

    public Block getBody() {
        return getRegion(0).getBlock();
    }
}
