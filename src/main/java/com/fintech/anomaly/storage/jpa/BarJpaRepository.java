package com.fintech.anomaly.storage.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for bar rows.
 * Window queries return newest first; callers reverse them.
 */
@Repository
public interface BarJpaRepository extends JpaRepository<BarEntity, String> {

    @Query("SELECT b FROM BarEntity b " +
           "WHERE b.instrument = :instrument " +
           "AND b.intervalType = :intervalType " +
           "AND b.finalBar = true " +
           "ORDER BY b.openTime DESC")
    List<BarEntity> findClosedNewestFirst(
        @Param("instrument") String instrument,
        @Param("intervalType") String intervalType,
        Pageable pageable
    );

    @Query("SELECT b FROM BarEntity b " +
           "WHERE b.instrument = :instrument " +
           "AND b.intervalType = :intervalType " +
           "AND b.finalBar = true " +
           "AND b.openTime < :beforeOpenTime " +
           "ORDER BY b.openTime DESC")
    List<BarEntity> findClosedBeforeNewestFirst(
        @Param("instrument") String instrument,
        @Param("intervalType") String intervalType,
        @Param("beforeOpenTime") long beforeOpenTime,
        Pageable pageable
    );

    @Query("SELECT b FROM BarEntity b " +
           "WHERE b.instrument = :instrument " +
           "AND b.intervalType = :intervalType " +
           "ORDER BY b.openTime DESC")
    List<BarEntity> findNewestFirst(
        @Param("instrument") String instrument,
        @Param("intervalType") String intervalType,
        Pageable pageable
    );

    long countByInstrumentAndIntervalTypeAndFinalBarTrue(String instrument, String intervalType);

    @Query("SELECT MIN(b.openTime) FROM BarEntity b")
    Optional<Long> findOldestOpenTime();

    @Query("SELECT b.id FROM BarEntity b WHERE b.openTime < :cutoff ORDER BY b.openTime ASC")
    List<String> findIdsOpenedBefore(@Param("cutoff") long cutoff, Pageable pageable);

    /**
     * Oldest rows first, id as tie-breaker so eviction order is deterministic.
     */
    @Query("SELECT b.id FROM BarEntity b ORDER BY b.openTime ASC, b.id ASC")
    List<String> findOldestIds(Pageable pageable);

    /**
     * Series holding more than {@code maxRows} bars, as [instrument, intervalType, count] rows.
     */
    @Query("SELECT b.instrument, b.intervalType, COUNT(b) FROM BarEntity b " +
           "GROUP BY b.instrument, b.intervalType " +
           "HAVING COUNT(b) > :maxRows")
    List<Object[]> findSeriesExceeding(@Param("maxRows") long maxRows);

    @Query("SELECT b.openTime FROM BarEntity b " +
           "WHERE b.instrument = :instrument AND b.intervalType = :intervalType " +
           "ORDER BY b.openTime DESC")
    List<Long> findOpenTimesNewestFirst(
        @Param("instrument") String instrument,
        @Param("intervalType") String intervalType,
        Pageable pageable
    );

    @Query("SELECT b.id FROM BarEntity b " +
           "WHERE b.instrument = :instrument AND b.intervalType = :intervalType " +
           "AND b.openTime <= :openTime " +
           "ORDER BY b.openTime ASC")
    List<String> findSeriesIdsOpenedAtOrBefore(
        @Param("instrument") String instrument,
        @Param("intervalType") String intervalType,
        @Param("openTime") long openTime,
        Pageable pageable
    );
}
