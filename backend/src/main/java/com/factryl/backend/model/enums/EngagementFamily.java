package com.factryl.backend.model.enums;

/**
 * Groups of source types that share an engagement formula.
 */
public enum EngagementFamily {
    VIDEO,
    DISCUSSION,
    MICROBLOG,
    LONG_FORM
}
