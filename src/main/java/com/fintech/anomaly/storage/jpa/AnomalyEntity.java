package com.fintech.anomaly.storage.jpa;

import com.fintech.anomaly.domain.AnomalyReason;
import com.fintech.anomaly.domain.AnomalyRecord;
import com.fintech.anomaly.domain.Interval;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA entity for anomaly records. Rows are insert-only.
 */
@Entity
@Table(
    name = "anomalies",
    indexes = {
        @Index(name = "idx_anomalies_time_score", columnList = "event_time, composite_score"),
        @Index(name = "idx_anomalies_instrument_time", columnList = "instrument, event_time")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_anomaly", columnNames = {"instrument", "event_time", "interval_type"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEntity {

    /**
     * Composite primary key, same format as the scored bar: instrument_interval_openTime
     */
    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 40)
    private String instrument;

    @Column(name = "interval_type", nullable = false, length = 10)
    private String intervalType;

    /**
     * Open time of the scored bar
     */
    @Column(name = "event_time", nullable = false)
    private Long eventTime;

    @Column(name = "close_price", nullable = false)
    private Double closePrice;

    @Column(name = "current_return", nullable = false)
    private Double currentReturn;

    @Column(name = "current_volume", nullable = false)
    private Double currentVolume;

    @Column(name = "current_volatility", nullable = false)
    private Double currentVolatility;

    @Column(name = "price_z_score", nullable = false)
    private Double priceZScore;

    @Column(name = "volume_z_score", nullable = false)
    private Double volumeZScore;

    @Column(name = "volatility_z_score", nullable = false)
    private Double volatilityZScore;

    @Column(name = "return_percentile", nullable = false)
    private Double returnPercentile;

    @Column(name = "composite_score", nullable = false)
    private Double compositeScore;

    /**
     * Triggered dimensions joined with '+', e.g. "price+volume"
     */
    @Column(nullable = false, length = 40)
    private String reasons;

    @Column(name = "quote_volume_24h", nullable = false)
    private Double quoteVolume24h;

    @Column(name = "detected_at", nullable = false)
    private Long detectedAt;

    @Version
    private Long version;

    public static AnomalyEntity fromRecord(AnomalyRecord record) {
        return AnomalyEntity.builder()
            .id(record.key().toStorageId())
            .instrument(record.instrument())
            .intervalType(record.interval().code())
            .eventTime(record.timestamp())
            .closePrice(record.closePrice())
            .currentReturn(record.currentReturn())
            .currentVolume(record.currentVolume())
            .currentVolatility(record.currentVolatility())
            .priceZScore(record.priceZScore())
            .volumeZScore(record.volumeZScore())
            .volatilityZScore(record.volatilityZScore())
            .returnPercentile(record.returnPercentile())
            .compositeScore(record.compositeScore())
            .reasons(AnomalyReason.join(record.reasons()))
            .quoteVolume24h(record.quoteVolume24h())
            .detectedAt(record.detectedAt())
            .build();
    }

    public AnomalyRecord toRecord() {
        return new AnomalyRecord(
            instrument,
            Interval.fromCode(intervalType),
            eventTime,
            closePrice,
            currentReturn,
            currentVolume,
            currentVolatility,
            priceZScore,
            volumeZScore,
            volatilityZScore,
            returnPercentile,
            compositeScore,
            AnomalyReason.parse(reasons),
            quoteVolume24h,
            detectedAt
        );
    }
}
