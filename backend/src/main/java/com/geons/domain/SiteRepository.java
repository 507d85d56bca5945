package com.geons.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for sites keyed by siteId.
 */
public interface SiteRepository extends MongoRepository<Site, String> {

    /** Sites tagged with the metro (matches any element of the metro list). */
    List<Site> findByMetro(String metro, Pageable pageable);
}
