package com.templatebinder.matching;

public enum MatchStrategy {
    EXACT,
    PATTERN,
    FUZZY
}
