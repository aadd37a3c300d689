package com.templatebinder.matching;

/**
 * How the pattern strategy turns a matching layer name into a catalog key.
 */
public enum PatternLookupMode {
    /**
     * Lower-cases only the first character of the raw layer name and looks it up verbatim.
     * Only layer names already in exact camelCase resolve. Status, logo and image tables
     * are not consulted.
     */
    CAMEL_CASE,
    /**
     * Drops separators and looks the name up case-insensitively, first as written and then
     * with designer prefixes and suffixes stripped.
     * Status, logo and image tables are consulted after the player table.
     */
    NORMALIZED
}
