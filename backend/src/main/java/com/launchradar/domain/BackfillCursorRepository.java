package com.launchradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for backfill_cursors, keyed by chain name.
 */
public interface BackfillCursorRepository extends MongoRepository<BackfillCursor, String> {
}
