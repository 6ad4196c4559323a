package com.identitygraph.ingestion;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ingestion records.
 */
@Repository
public interface IngestionRecordRepository extends JpaRepository<IngestionRecord, String> {

    List<IngestionRecord> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}
