package com.csl.commentquery.sort;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public enum SortAlias {
    COMMENT_AGENT("comment_agent", "comment_agent.raw"),
    COMMENT_APPROVED("comment_approved", "comment_approved.raw"),
    COMMENT_AUTHOR("comment_author", "comment_author.raw"),
    COMMENT_AUTHOR_EMAIL("comment_author_email", "comment_author_email.raw"),
    COMMENT_AUTHOR_IP("comment_author_IP", "comment_author_IP.raw"),
    COMMENT_AUTHOR_URL("comment_author_url", "comment_author_url.raw"),
    COMMENT_CONTENT("comment_content", "comment_content.raw"),
    COMMENT_DATE("comment_date", "comment_date"),
    COMMENT_DATE_GMT("comment_date_gmt", "comment_date_gmt"),
    COMMENT_ID("comment_ID", "comment_ID"),
    COMMENT_KARMA("comment_karma", "comment_karma"),
    COMMENT_PARENT("comment_parent", "comment_parent"),
    COMMENT_POST_ID("comment_post_ID", "comment_post_ID"),
    COMMENT_TYPE("comment_type", "comment_type.raw"),
    USER_ID("user_id", "user_id"),
    META_VALUE("meta_value", null, "value"),
    META_VALUE_NUM("meta_value_num", null, "long");

    private static final Map<String, SortAlias> BY_ALIAS = new HashMap<>();

    static {
        for (SortAlias alias : values()) {
            BY_ALIAS.put(alias.alias, alias);
        }
    }

    private final String alias;
    private final String field;
    private final String metaSubField;

    SortAlias(String alias, String field) {
        this(alias, field, null);
    }

    SortAlias(String alias, String field, String metaSubField) {
        this.alias = alias;
        this.field = field;
        this.metaSubField = metaSubField;
    }

    public static Optional<SortAlias> fromAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ALIAS.get(alias));
    }

    public String alias() {
        return alias;
    }

    public boolean isMeta() {
        return metaSubField != null;
    }

    public String field() {
        return field;
    }

    public String metaField(String metaKey) {
        return "meta." + metaKey + "." + metaSubField;
    }
}
