package com.kotsin.scanner.dedup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kotsin.scanner.config.ScannerConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * DeduplicationStore - Per-symbol history of emitted signals.
 *
 * Backs three rules:
 * - duplicate bar: one emission per (symbol, detectorType, barTimeKey)
 * - cooldown: minimum gap between emissions of a detector for a symbol
 * - rate cap: maximum emissions per trailing hour
 *
 * checkAndRecord runs inside the cache's per-key compute, so two concurrent
 * scans of one symbol cannot both pass. Cooldown and rate cap only look at
 * records at or before the checked event time, so a replay of an earlier day
 * is not blocked by later emissions. Records are kept for max(cooldown, 1h)
 * of event time; recording an emission prunes what expired before it.
 * Symbols are upper-cased at the store boundary.
 */
@Slf4j
@Component
public class DeduplicationStore {

    /**
     * Record plus how long it must be kept
     */
    private record Entry(DeduplicationRecord record, long retainMs) {
    }

    /**
     * Records for one symbol, oldest first. Guarded by its own monitor.
     */
    private static final class SymbolHistory {
        private final List<Entry> entries = new ArrayList<>();
        private Instant newestEventTime;

        synchronized boolean contains(String detectorType, String barTimeKey) {
            for (Entry e : entries) {
                DeduplicationRecord r = e.record();
                if (r.getDetectorType().equals(detectorType) && r.getBarTimeKey().equals(barTimeKey)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Newest emission of a detector by event time, ignoring records later than now
         */
        synchronized Optional<DeduplicationRecord> latestAtOrBefore(String detectorType, Instant now) {
            DeduplicationRecord latest = null;
            for (Entry e : entries) {
                DeduplicationRecord r = e.record();
                if (r.getDetectorType().equals(detectorType) && !r.getEmittedAt().isAfter(now)
                        && (latest == null || r.getEmittedAt().isAfter(latest.getEmittedAt()))) {
                    latest = r;
                }
            }
            return Optional.ofNullable(latest);
        }

        /**
         * Emissions in (now - windowMs, now], optionally restricted to one detector type
         */
        synchronized int count(String detectorType, long windowMs, Instant now) {
            long from = now.toEpochMilli() - windowMs;
            int n = 0;
            for (Entry e : entries) {
                DeduplicationRecord r = e.record();
                long t = r.getEmittedAt().toEpochMilli();
                if (t > from && t <= now.toEpochMilli()
                        && (detectorType == null || r.getDetectorType().equals(detectorType))) {
                    n++;
                }
            }
            return n;
        }

        synchronized void add(DeduplicationRecord record, long retainMs) {
            entries.add(new Entry(record, retainMs));
            if (newestEventTime == null || record.getEmittedAt().isAfter(newestEventTime)) {
                newestEventTime = record.getEmittedAt();
            }
        }

        synchronized int prune(Instant reference) {
            int removed = 0;
            Iterator<Entry> it = entries.iterator();
            while (it.hasNext()) {
                Entry e = it.next();
                if (e.record().getEmittedAt().toEpochMilli() + e.retainMs() < reference.toEpochMilli()) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        }

        synchronized Instant newest() {
            return newestEventTime;
        }

        synchronized int size() {
            return entries.size();
        }

        synchronized Instant oldestEmission() {
            Instant oldest = null;
            for (Entry e : entries) {
                if (oldest == null || e.record().getEmittedAt().isBefore(oldest)) {
                    oldest = e.record().getEmittedAt();
                }
            }
            return oldest;
        }

        synchronized Instant newestEmission() {
            Instant newest = null;
            for (Entry e : entries) {
                if (newest == null || e.record().getEmittedAt().isAfter(newest)) {
                    newest = e.record().getEmittedAt();
                }
            }
            return newest;
        }
    }

    private final Cache<String, SymbolHistory> histories = Caffeine.newBuilder()
            .maximumSize(ScannerConstants.MAX_TRACKED_SYMBOLS)
            .expireAfterAccess(ScannerConstants.SYMBOL_IDLE_EXPIRY)
            .build();

    private final AtomicLong totalRecorded = new AtomicLong(0);
    private final AtomicLong totalPruned = new AtomicLong(0);

    // ======================== ATOMIC CHECK ========================

    /**
     * Check duplicate bar, then cooldown, then rate cap; record the emission if all pass.
     * Runs atomically per symbol.
     */
    public DedupCheck checkAndRecord(DeduplicationRecord record, int cooldownMinutes,
                                     int maxPerHour, RateCapScope scope) {
        DedupCheck[] outcome = new DedupCheck[1];
        long retainMs = retentionMs(cooldownMinutes);

        histories.asMap().compute(key(record.getSymbol()), (symbol, existing) -> {
            SymbolHistory history = existing != null ? existing : new SymbolHistory();
            Instant now = record.getEmittedAt();

            if (history.contains(record.getDetectorType(), record.getBarTimeKey())) {
                outcome[0] = DedupCheck.duplicateBar(record.getBarTimeKey());
                return history;
            }

            Optional<DeduplicationRecord> last = history.latestAtOrBefore(record.getDetectorType(), now);
            if (last.isPresent() && cooldownMinutes > 0) {
                long elapsedMs = now.toEpochMilli() - last.get().getEmittedAt().toEpochMilli();
                long cooldownMs = Duration.ofMinutes(cooldownMinutes).toMillis();
                if (elapsedMs < cooldownMs) {
                    outcome[0] = DedupCheck.cooldown(cooldownMinutes, (cooldownMs - elapsedMs) / 1000);
                    return history;
                }
            }

            String typeScope = scope == RateCapScope.SYMBOL ? null : record.getDetectorType();
            int recent = history.count(typeScope, ScannerConstants.RATE_CAP_WINDOW.toMillis(), now);
            if (recent >= maxPerHour) {
                outcome[0] = DedupCheck.rateCap(maxPerHour, scope);
                return history;
            }

            history.add(record, retainMs);
            totalPruned.addAndGet(history.prune(now));
            totalRecorded.incrementAndGet();
            outcome[0] = DedupCheck.recorded();
            return history;
        });

        if (outcome[0].isRecorded()) {
            log.debug("[DEDUP] Recorded {}", record.getBarTimeKey());
        } else {
            log.debug("[DEDUP] {} {}", record.getBarTimeKey(), outcome[0]);
        }
        return outcome[0];
    }

    // ======================== RECORDS ========================

    /**
     * Append a record kept for the minimum retention.
     *
     * @return false when the (symbol, detectorType, barTimeKey) triple is already recorded
     */
    public boolean recordSignal(DeduplicationRecord record) {
        return recordSignal(record, 0);
    }

    public boolean recordSignal(DeduplicationRecord record, int cooldownMinutes) {
        boolean[] added = new boolean[1];
        long retainMs = retentionMs(cooldownMinutes);
        histories.asMap().compute(key(record.getSymbol()), (symbol, existing) -> {
            SymbolHistory history = existing != null ? existing : new SymbolHistory();
            if (!history.contains(record.getDetectorType(), record.getBarTimeKey())) {
                history.add(record, retainMs);
                totalPruned.addAndGet(history.prune(record.getEmittedAt()));
                totalRecorded.incrementAndGet();
                added[0] = true;
            }
            return history;
        });
        return added[0];
    }

    public boolean isDuplicate(String symbol, String detectorType, String barTimeKey) {
        SymbolHistory history = histories.getIfPresent(key(symbol));
        return history != null && history.contains(detectorType, barTimeKey);
    }

    /**
     * Emissions of one detector for a symbol in the window ending at the newest event time seen.
     */
    public int countInWindow(String symbol, String detectorType, long windowMs) {
        SymbolHistory history = histories.getIfPresent(key(symbol));
        if (history == null || history.newest() == null) return 0;
        return history.count(detectorType, windowMs, history.newest());
    }

    public int countInWindow(String symbol, String detectorType, long windowMs, Instant now) {
        SymbolHistory history = histories.getIfPresent(key(symbol));
        return history != null ? history.count(detectorType, windowMs, now) : 0;
    }

    public int countSymbolInWindow(String symbol, long windowMs, Instant now) {
        SymbolHistory history = histories.getIfPresent(key(symbol));
        return history != null ? history.count(null, windowMs, now) : 0;
    }

    /**
     * Newest emission of a detector for a symbol, by event time
     */
    public Optional<DeduplicationRecord> getLastEmission(String symbol, String detectorType) {
        SymbolHistory history = histories.getIfPresent(key(symbol));
        return history != null ? history.latestAtOrBefore(detectorType, Instant.MAX) : Optional.empty();
    }

    // ======================== MAINTENANCE ========================

    /**
     * Drop records whose retention ended before now, and histories left empty.
     *
     * @return number of records removed
     */
    public int prune(Instant now) {
        int removed = 0;
        for (String symbol : List.copyOf(histories.asMap().keySet())) {
            int[] n = new int[1];
            histories.asMap().computeIfPresent(symbol, (k, history) -> {
                n[0] = history.prune(now);
                return history.size() == 0 ? null : history;
            });
            removed += n[0];
        }
        totalPruned.addAndGet(removed);
        if (removed > 0) {
            log.debug("[DEDUP] Pruned {} records", removed);
        }
        return removed;
    }

    public void clear() {
        histories.invalidateAll();
        log.info("[DEDUP] Cleared all deduplication history");
    }

    public void clearSymbol(String symbol) {
        histories.invalidate(key(symbol));
        log.info("[DEDUP] Cleared deduplication history for {}", symbol);
    }

    public DeduplicationStats getStats() {
        return getStats(Instant.now());
    }

    public DeduplicationStats getStats(Instant now) {
        long total = 0;
        int symbols = 0;
        Instant oldest = null;
        Instant newest = null;
        for (SymbolHistory history : histories.asMap().values()) {
            int size = history.size();
            if (size == 0) continue;
            total += size;
            symbols++;
            Instant o = history.oldestEmission();
            Instant n = history.newestEmission();
            if (o != null && (oldest == null || o.isBefore(oldest))) oldest = o;
            if (n != null && (newest == null || n.isAfter(newest))) newest = n;
        }
        return DeduplicationStats.builder()
                .totalSignals(total)
                .uniqueSymbols(symbols)
                .oldestSignalAgeMs(oldest != null ? now.toEpochMilli() - oldest.toEpochMilli() : null)
                .newestSignalAgeMs(newest != null ? now.toEpochMilli() - newest.toEpochMilli() : null)
                .build();
    }

    public long getTotalRecorded() {
        return totalRecorded.get();
    }

    public long getTotalPruned() {
        return totalPruned.get();
    }

    private static String key(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static long retentionMs(int cooldownMinutes) {
        return Math.max(Duration.ofMinutes(Math.max(0, cooldownMinutes)).toMillis(),
                ScannerConstants.MIN_RETENTION.toMillis());
    }
}
