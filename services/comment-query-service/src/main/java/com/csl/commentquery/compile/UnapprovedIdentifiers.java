package com.csl.commentquery.compile;

import com.csl.commentquery.request.QueryVars;
import java.util.ArrayList;
import java.util.List;

public final class UnapprovedIdentifiers {
    private final List<Long> userIds;
    private final List<Object> emails;

    private UnapprovedIdentifiers(List<Long> userIds, List<Object> emails) {
        this.userIds = userIds;
        this.emails = emails;
    }

    public static UnapprovedIdentifiers parse(Object raw) {
        List<Long> userIds = new ArrayList<>();
        List<Object> emails = new ArrayList<>();
        for (Object identifier : QueryVars.parseList(raw)) {
            if (QueryVars.isNumeric(identifier)) {
                userIds.add(QueryVars.toAbsLong(identifier));
            } else {
                emails.add(identifier);
            }
        }
        return new UnapprovedIdentifiers(userIds, emails);
    }

    public List<Long> getUserIds() {
        return userIds;
    }

    public List<Object> getEmails() {
        return emails;
    }
}
