package com.plangraph.core.parser;

import com.plangraph.core.model.Plan;

/**
 * A plan together with the report of what the parser dropped on the way.
 */
public record ParsedPlan(Plan plan, ParseReport report) {}
