package com.plangraph.core.api;

public enum RenderFormat {
    OUTLINE,
    FLOWCHART,
    DOT
}
