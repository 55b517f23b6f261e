package com.designgrowth.backend.repository;

import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction of optional equality and membership constraints built from request parameters.
 * An optional constraint whose value is null or empty is dropped, so an omitted parameter matches any
 * document. A required constraint is always applied, even to an empty value.
 * Field names are entity property names; the Mongo mapping layer translates them to stored keys.
 */
public final class DocumentFilter {

    private final List<Criteria> criteria = new ArrayList<>();

    private DocumentFilter() {
    }

    public static DocumentFilter matchAll() {
        return new DocumentFilter();
    }

    public DocumentFilter equalTo(String field, String value) {
        if (StringUtils.hasLength(value)) {
            criteria.add(Criteria.where(field).is(value));
        }
        return this;
    }

    public DocumentFilter require(String field, String value) {
        criteria.add(Criteria.where(field).is(value));
        return this;
    }

    // Matches documents whose array field holds the value
    public DocumentFilter contains(String arrayField, String value) {
        if (StringUtils.hasLength(value)) {
            criteria.add(Criteria.where(arrayField).in(value));
        }
        return this;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    public Query toQuery(int limit) {
        Query query = new Query();
        // each criterion targets a distinct field, so adding them one by one yields an implicit AND
        criteria.forEach(query::addCriteria);
        return query.limit(limit);
    }
}
