package io.packscan.ast;

import java.util.function.Consumer;

/**
 * A direct child of a node together with the capability to overwrite exactly its slot.
 * <p>
 * Slots are handed out only to {@link TreeVisitor}; the setter writes to a single list index,
 * named field or mapping key of the owning node.
 *
 * @param node   The node currently held in the slot
 * @param setter Overwrites the slot
 */
record ChildSlot(Node node, Consumer<Node> setter) {

    ChildSlot {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        if (setter == null) {
            throw new IllegalArgumentException("setter cannot be null");
        }
    }
}
