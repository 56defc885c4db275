package com.fintech.anomaly.storage.jpa;

import com.fintech.anomaly.domain.Bar;
import com.fintech.anomaly.domain.Interval;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA entity for bar persistence.
 *
 * Indexes cover the window queries (instrument + interval + open time) and
 * retention's age-ordered eviction (open time).
 */
@Entity
@Table(
    name = "bars",
    indexes = {
        @Index(name = "idx_bars_series_time", columnList = "instrument, interval_type, open_time DESC"),
        @Index(name = "idx_bars_open_time", columnList = "open_time")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_bar", columnNames = {"instrument", "interval_type", "open_time"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BarEntity {

    /**
     * Composite primary key: instrument_interval_openTime
     * Example: "BTCUSDT_15m_1733000000000"
     */
    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 40)
    private String instrument;

    /**
     * Interval code (e.g., 1m, 15m, 1h)
     */
    @Column(name = "interval_type", nullable = false, length = 10)
    private String intervalType;

    @Column(name = "open_time", nullable = false)
    private Long openTime;

    @Column(name = "close_time", nullable = false)
    private Long closeTime;

    @Column(name = "open_price", nullable = false)
    private Double open;

    @Column(name = "high_price", nullable = false)
    private Double high;

    @Column(name = "low_price", nullable = false)
    private Double low;

    @Column(name = "close_price", nullable = false)
    private Double close;

    @Column(nullable = false)
    private Double volume;

    @Column(name = "quote_volume", nullable = false)
    private Double quoteVolume;

    @Column(name = "trade_count", nullable = false)
    private Long tradeCount;

    /**
     * Once true the row is never modified again.
     */
    @Column(name = "is_final", nullable = false)
    private Boolean finalBar;

    /**
     * Optimistic lock guarding replace-in-place of non-final bars.
     */
    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Long createdAt;

    @Column(name = "updated_at", nullable = false)
    private Long updatedAt;

    public static BarEntity fromBar(Bar bar) {
        return BarEntity.builder()
            .id(bar.key().toStorageId())
            .instrument(bar.instrument())
            .intervalType(bar.interval().code())
            .openTime(bar.openTime())
            .closeTime(bar.closeTime())
            .open(bar.open())
            .high(bar.high())
            .low(bar.low())
            .close(bar.close())
            .volume(bar.volume())
            .quoteVolume(bar.quoteVolume())
            .tradeCount(bar.tradeCount())
            .finalBar(bar.isFinal())
            .build();
    }

    /**
     * Copies the mutable values of {@code bar} onto this managed row.
     */
    public void apply(Bar bar) {
        this.closeTime = bar.closeTime();
        this.open = bar.open();
        this.high = bar.high();
        this.low = bar.low();
        this.close = bar.close();
        this.volume = bar.volume();
        this.quoteVolume = bar.quoteVolume();
        this.tradeCount = bar.tradeCount();
        this.finalBar = bar.isFinal();
    }

    public Bar toBar() {
        return new Bar(
            instrument,
            Interval.fromCode(intervalType),
            openTime,
            closeTime,
            open,
            high,
            low,
            close,
            volume,
            quoteVolume,
            tradeCount,
            Boolean.TRUE.equals(finalBar)
        );
    }

    @PrePersist
    protected void onCreate() {
        long now = System.currentTimeMillis();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = System.currentTimeMillis();
    }
}
