package com.csl.commentquery.compile;

public enum ClauseShape {
    TERM,
    TERMS,
    MULTI
}
