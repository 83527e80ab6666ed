package com.plangraph.core.parser;

/**
 * Why the parser left an element out of the plan.
 */
public enum DropReason {
    EMPTY_ID,
    UNKNOWN_STATUS,
    INVALID_PRIORITY,
    INVALID_POINTS,
    DUPLICATE_ID
}
