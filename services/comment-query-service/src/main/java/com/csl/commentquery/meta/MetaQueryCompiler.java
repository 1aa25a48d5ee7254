package com.csl.commentquery.meta;

import java.util.Map;

public interface MetaQueryCompiler {
    Map<String, Object> compile(MetaQuery metaQuery);
}
