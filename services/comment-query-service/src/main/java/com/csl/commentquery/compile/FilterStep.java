package com.csl.commentquery.compile;

import com.csl.commentquery.request.FilterRequest;

@FunctionalInterface
public interface FilterStep {
    void apply(FilterRequest request, FilterAccumulator filter);
}
