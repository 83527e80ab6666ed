package com.plangraph.core.parser;

import com.plangraph.core.model.NodeKind;

/**
 * An element removed from the hierarchy, together with its whole subtree.
 *
 * @param level  epic, story or task
 * @param id     the element's id attribute as written (may be empty)
 * @param reason the first check the element failed
 * @param detail offending raw value
 */
public record DroppedElement(
    NodeKind level,
    String id,
    DropReason reason,
    String detail
) {}
