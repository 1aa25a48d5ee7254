package com.csl.commentquery.compile;

import java.util.ArrayList;
import java.util.List;

public enum ModerationStatus {
    HOLD("hold", 0),
    APPROVE("approve", 1);

    public static final String ALL = "all";

    private final String literal;
    private final int code;

    ModerationStatus(String literal, int code) {
        this.literal = literal;
        this.code = code;
    }

    public String literal() {
        return literal;
    }

    public int code() {
        return code;
    }

    public static List<Object> encode(List<String> statuses) {
        List<Object> encoded = new ArrayList<>(statuses.size());
        for (String status : statuses) {
            encoded.add(encodeOne(status));
        }
        return encoded;
    }

    private static Object encodeOne(String status) {
        for (ModerationStatus candidate : values()) {
            if (candidate.literal.equals(status)) {
                return candidate.code;
            }
        }
        return status;
    }
}
