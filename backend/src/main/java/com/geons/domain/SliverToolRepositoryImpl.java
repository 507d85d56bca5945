package com.geons.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of SliverToolRepositoryCustom using MongoTemplate.find with a pushed-down status predicate.
 */
@Repository
@RequiredArgsConstructor
public class SliverToolRepositoryImpl implements SliverToolRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<SliverTool> findOnline(String toolId, AddressFamily family, Collection<String> siteIds, int limit) {
        Criteria criteria = where("toolId").is(toolId)
                .and(family.statusField()).is(ToolStatus.ONLINE);
        if (siteIds != null) {
            criteria = criteria.and("siteId").in(siteIds);
        }
        Query query = new Query(criteria).limit(limit);
        return mongoTemplate.find(query, SliverTool.class);
    }
}
