package com.csl.commentquery.date;

import java.util.Map;

public interface DateRangeFilterCompiler {
    String AND = "and";
    String OR = "or";

    Map<String, Object> compile(Object dateQuery);
}
