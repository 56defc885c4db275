package com.fintech.anomaly.universe;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The instruments currently tracked, shared by reference between the universe selector
 * (single writer), the ingestion pipeline and the scoring engine. Readers always see one
 * complete immutable snapshot.
 */
@Component
public class ActiveUniverse {

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.EMPTY);

    public Snapshot snapshot() {
        return current.get();
    }

    public List<String> instruments() {
        return current.get().instruments();
    }

    /** 24h quote volume recorded at the last refresh, 0.0 if the instrument is not tracked. */
    public double quoteVolume24h(String instrument) {
        return current.get().quoteVolumes().getOrDefault(instrument, 0.0);
    }

    public int size() {
        return current.get().instruments().size();
    }

    void replace(Snapshot snapshot) {
        current.set(snapshot);
    }

    /**
     * Immutable universe state.
     *
     * @param instruments Tracked instruments, highest 24h quote volume first
     * @param quoteVolumes 24h quote volume per tracked instrument
     * @param refreshedAt Time of the refresh that produced this snapshot (epoch millis), 0 if never
     */
    public record Snapshot(List<String> instruments, Map<String, Double> quoteVolumes, long refreshedAt) {

        public static final Snapshot EMPTY = new Snapshot(List.of(), Map.of(), 0L);

        public Snapshot {
            instruments = List.copyOf(instruments);
            quoteVolumes = Collections.unmodifiableMap(new LinkedHashMap<>(quoteVolumes));
        }
    }
}
