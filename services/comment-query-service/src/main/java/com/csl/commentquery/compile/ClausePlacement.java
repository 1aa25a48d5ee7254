package com.csl.commentquery.compile;

public enum ClausePlacement {
    FLAT,
    MUST,
    MUST_NOT
}
