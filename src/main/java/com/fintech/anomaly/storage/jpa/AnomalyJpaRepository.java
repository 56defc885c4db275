package com.fintech.anomaly.storage.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for anomaly records.
 */
@Repository
public interface AnomalyJpaRepository extends JpaRepository<AnomalyEntity, String> {

    @Query("SELECT a FROM AnomalyEntity a " +
           "WHERE a.compositeScore >= :minScore " +
           "AND (:anomalyOnly = false OR a.compositeScore > 0) " +
           "AND a.eventTime >= :since " +
           "ORDER BY a.eventTime DESC, a.compositeScore DESC")
    List<AnomalyEntity> findRecent(
        @Param("minScore") double minScore,
        @Param("anomalyOnly") boolean anomalyOnly,
        @Param("since") long since,
        Pageable pageable
    );

    @Query("SELECT a FROM AnomalyEntity a " +
           "WHERE a.instrument = :instrument " +
           "AND a.compositeScore >= :minScore " +
           "AND (:anomalyOnly = false OR a.compositeScore > 0) " +
           "AND a.eventTime >= :since " +
           "ORDER BY a.eventTime DESC, a.compositeScore DESC")
    List<AnomalyEntity> findRecentForInstrument(
        @Param("instrument") String instrument,
        @Param("minScore") double minScore,
        @Param("anomalyOnly") boolean anomalyOnly,
        @Param("since") long since,
        Pageable pageable
    );

    @Query("SELECT a FROM AnomalyEntity a " +
           "WHERE a.eventTime >= :since AND a.compositeScore > 0 " +
           "ORDER BY a.compositeScore DESC, a.eventTime DESC")
    List<AnomalyEntity> findTopSince(@Param("since") long since, Pageable pageable);

    @Query("SELECT a.id FROM AnomalyEntity a WHERE a.eventTime < :cutoff ORDER BY a.eventTime ASC")
    List<String> findIdsBefore(@Param("cutoff") long cutoff, Pageable pageable);

    @Query("SELECT a.id FROM AnomalyEntity a ORDER BY a.eventTime ASC, a.id ASC")
    List<String> findOldestIds(Pageable pageable);
}
