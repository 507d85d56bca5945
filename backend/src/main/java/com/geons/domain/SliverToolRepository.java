package com.geons.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for sliver_tools. Filtered candidate queries live in {@link SliverToolRepositoryCustom}.
 */
public interface SliverToolRepository extends MongoRepository<SliverTool, String>, SliverToolRepositoryCustom {
}
