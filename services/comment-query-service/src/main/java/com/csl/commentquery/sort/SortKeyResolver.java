package com.csl.commentquery.sort;

import com.csl.commentquery.request.FilterRequest;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class SortKeyResolver {

    public List<SortClause> resolve(String alias, SortDirection direction, FilterRequest request) {
        if (alias == null || alias.isEmpty()) {
            return List.of();
        }
        Optional<SortAlias> known = SortAlias.fromAlias(alias);
        if (known.isEmpty()) {
            return List.of(new SortClause(alias, direction));
        }
        SortAlias sortAlias = known.get();
        if (!sortAlias.isMeta()) {
            return List.of(new SortClause(sortAlias.field(), direction));
        }
        if (request == null || request.isEmpty("meta_key")) {
            return List.of();
        }
        return List.of(new SortClause(sortAlias.metaField(request.getString("meta_key")), direction));
    }
}
