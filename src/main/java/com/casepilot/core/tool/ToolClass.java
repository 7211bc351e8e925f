package com.casepilot.core.tool;

/**
 * Cache tier of a declared tool. Drives TTL selection in {@link ToolResultCache}.
 *
 * LOOKUP            - point lookups and filtered queries over live data (short TTL)
 * SIMILARITY_SEARCH - vector similarity over past cases (medium TTL)
 * REFERENCE_SEARCH  - relatively static reference material such as policy text (long TTL)
 */
public enum ToolClass {
    LOOKUP,
    SIMILARITY_SEARCH,
    REFERENCE_SEARCH
}
