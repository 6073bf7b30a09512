package com.kotsin.scanner.service;

import com.kotsin.scanner.config.ScannerConfig;
import com.kotsin.scanner.config.ScannerConfigValidator;
import com.kotsin.scanner.dedup.BarTimeKeys;
import com.kotsin.scanner.dedup.DedupCheck;
import com.kotsin.scanner.dedup.DeduplicationRecord;
import com.kotsin.scanner.dedup.DeduplicationStats;
import com.kotsin.scanner.dedup.DeduplicationStore;
import com.kotsin.scanner.detector.DetectionContext;
import com.kotsin.scanner.detector.DetectionResult;
import com.kotsin.scanner.detector.DetectorRegistry;
import com.kotsin.scanner.detector.OpportunityDetector;
import com.kotsin.scanner.model.AnalysisMode;
import com.kotsin.scanner.model.AssetClass;
import com.kotsin.scanner.model.CompositeSignal;
import com.kotsin.scanner.model.ConfidenceAssessment;
import com.kotsin.scanner.model.FeatureSnapshot;
import com.kotsin.scanner.model.OptionsChainContext;
import com.kotsin.scanner.model.RiskReward;
import com.kotsin.scanner.model.ScanResult;
import com.kotsin.scanner.model.StyleScores;
import com.kotsin.scanner.threshold.ConfidenceScorer;
import com.kotsin.scanner.threshold.ResolvedThresholds;
import com.kotsin.scanner.threshold.RiskRewardCalculator;
import com.kotsin.scanner.threshold.StyleScorer;
import com.kotsin.scanner.threshold.ThresholdResolver;
import com.kotsin.scanner.threshold.ThresholdValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CompositeScanner - Turns one feature snapshot into zero or more composite signals.
 *
 * PIPELINE per symbol:
 * 1. Universal filters (blacklist, market hours, RVOL, spread, liquidity)
 * 2. Detector selection by asset class and options availability
 * 3. Gate + weighted score; every passing gate counts toward detectionCount
 * 4. Thresholds (base, style, risk/reward; adaptive layer when enabled)
 * 5. Duplicate bar, cooldown and rate cap, checked and recorded atomically
 * 6. Emit and notify listeners
 *
 * Every passing detector is evaluated on its own; several may emit in one call.
 * Time rules run on the snapshot's event time, not the wall clock.
 */
@Slf4j
@Service
public class CompositeScanner {

    public static final String NO_OPPORTUNITIES = "No opportunities detected";

    private final DetectorRegistry registry;
    private final DeduplicationStore deduplicationStore;
    private final UniversalFilters universalFilters;
    private final StyleScorer styleScorer;
    private final RiskRewardCalculator riskRewardCalculator;
    private final ConfidenceScorer confidenceScorer;
    private final ThresholdValidator thresholdValidator;
    private final Executor scanExecutor;

    private final List<CompositeSignalListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Replaced wholesale by updateConfig, never mutated in place
     */
    private volatile ScannerConfig config;

    // Statistics
    private final AtomicLong totalScans = new AtomicLong(0);
    private final AtomicLong totalSignals = new AtomicLong(0);
    private final AtomicLong totalFiltered = new AtomicLong(0);
    private final AtomicLong detectorErrors = new AtomicLong(0);
    private final Map<String, AtomicLong> signalsByType = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> signalsBySymbol = new ConcurrentHashMap<>();

    public CompositeScanner(ScannerConfig config,
                            DetectorRegistry registry,
                            DeduplicationStore deduplicationStore,
                            UniversalFilters universalFilters,
                            StyleScorer styleScorer,
                            RiskRewardCalculator riskRewardCalculator,
                            ConfidenceScorer confidenceScorer,
                            ThresholdValidator thresholdValidator,
                            List<CompositeSignalListener> listeners,
                            @Qualifier("scanExecutor") Executor scanExecutor) {
        ScannerConfigValidator.validateOrThrow(config);
        this.config = config.copy();
        this.registry = registry;
        this.deduplicationStore = deduplicationStore;
        this.universalFilters = universalFilters;
        this.styleScorer = styleScorer;
        this.riskRewardCalculator = riskRewardCalculator;
        this.confidenceScorer = confidenceScorer;
        this.thresholdValidator = thresholdValidator;
        this.scanExecutor = scanExecutor;
        if (listeners != null) {
            this.listeners.addAll(listeners);
        }
        log.info("[SCANNER] Initialized with {} detectors, {} listeners", registry.size(), this.listeners.size());
    }

    // ======================== SCAN ========================

    public ScanResult scanSymbol(String symbol, FeatureSnapshot features) {
        return scanSymbol(symbol, features, null, AnalysisMode.LIVE);
    }

    public ScanResult scanSymbol(String symbol, FeatureSnapshot features, OptionsChainContext options) {
        return scanSymbol(symbol, features, options, AnalysisMode.LIVE);
    }

    public ScanResult scanSymbol(String symbol, FeatureSnapshot features,
                                 OptionsChainContext options, AnalysisMode mode) {
        long start = System.currentTimeMillis();
        ScannerConfig cfg = this.config;
        AnalysisMode analysisMode = mode != null ? mode : AnalysisMode.LIVE;
        String sym = symbol != null ? symbol.trim().toUpperCase(Locale.ROOT) : "";
        totalScans.incrementAndGet();

        if (features == null) {
            return filtered(UniversalFilters.REASON_PREFIX + "missing feature snapshot", 0, start);
        }

        // ========== 1. UNIVERSAL FILTERS ==========
        Optional<String> filterFailure = universalFilters.check(sym, features, cfg, analysisMode);
        if (filterFailure.isPresent()) {
            return filtered(filterFailure.get(), 0, start);
        }

        // ========== 2. DETECTOR SELECTION ==========
        AssetClass assetClass = AssetClass.of(sym);
        List<OpportunityDetector> candidates = registry.forAssetClass(assetClass, options != null);
        DetectionContext context = DetectionContext.of(features, options, analysisMode,
                cfg.getFilters().isAllowNonRegularHours());

        Instant barTime = features.getTimestamp() != null ? features.getTimestamp() : Instant.now();
        Instant detectedAt = Instant.now();

        int detectionCount = 0;
        String firstRejection = null;
        List<CompositeSignal> emitted = new ArrayList<>();

        for (OpportunityDetector detector : candidates) {
            // ========== 3. GATE ==========
            if (!detector.detect(context)) {
                continue;
            }
            detectionCount++;

            try {
                String rejection = evaluate(sym, assetClass, detector, features, options,
                        analysisMode, cfg, barTime, detectedAt, emitted);
                if (rejection != null) {
                    log.debug("[SCANNER] {} {} rejected: {}", sym, detector.getType(), rejection);
                    if (firstRejection == null) {
                        firstRejection = rejection + " [" + detector.getType() + "]";
                    }
                }
            } catch (RuntimeException e) {
                detectorErrors.incrementAndGet();
                log.warn("[SCANNER] {} {} evaluation failed, skipping detector: {}",
                        sym, detector.getType(), e.toString());
            }
        }

        if (emitted.isEmpty()) {
            return filtered(firstRejection != null ? firstRejection : NO_OPPORTUNITIES, detectionCount, start);
        }

        for (CompositeSignal signal : emitted) {
            totalSignals.incrementAndGet();
            signalsByType.computeIfAbsent(signal.getDetectorType(), k -> new AtomicLong()).incrementAndGet();
            signalsBySymbol.computeIfAbsent(signal.getSymbol(), k -> new AtomicLong()).incrementAndGet();
            log.info("[SCANNER] Emitted {}", signal);
            notifyListeners(signal);
        }
        return ScanResult.emitted(emitted, detectionCount, System.currentTimeMillis() - start);
    }

    /**
     * Score, threshold and dedup one detection. Adds the signal to emitted on success.
     *
     * @return rejection reason, or null when the signal was emitted
     */
    private String evaluate(String symbol, AssetClass assetClass, OpportunityDetector detector,
                            FeatureSnapshot features, OptionsChainContext options, AnalysisMode mode,
                            ScannerConfig cfg, Instant barTime, Instant detectedAt,
                            List<CompositeSignal> emitted) {
        DetectionResult result = detector.score(features, options);
        double baseScore = result.getCompositeScore();

        // ========== 4. THRESHOLDS ==========
        StyleScores styles = styleScorer.score(baseScore, features);
        RiskReward riskReward = riskRewardCalculator.calculate(features, detector.getDirection(),
                styles.getRecommendedStyle());
        ResolvedThresholds thresholds = ThresholdResolver.resolve(cfg, assetClass, detector.getType(), mode);
        ThresholdValidator.ValidationResult validation = thresholdValidator.validate(detector, features,
                baseScore, styles, riskReward, thresholds, mode, cfg.getAdaptive().isEnabled());
        if (!validation.isPassed()) {
            return validation.getReason();
        }

        // ========== 5. DUPLICATE BAR / COOLDOWN / RATE CAP ==========
        String barTimeKey = BarTimeKeys.of(symbol, detector.getType(), barTime, cfg.getBarIntervalMinutes());
        DeduplicationRecord record = DeduplicationRecord.builder()
                .symbol(symbol)
                .detectorType(detector.getType())
                .barTimeKey(barTimeKey)
                .emittedAt(barTime)
                .build();
        DedupCheck check = deduplicationStore.checkAndRecord(record, thresholds.getCooldownMinutes(),
                thresholds.getMaxSignalsPerSymbolPerHour(), cfg.getRateCapScope());
        if (!check.isRecorded()) {
            return check.getReason();
        }

        // ========== 6. EMIT ==========
        ConfidenceAssessment confidence = confidenceScorer.assess(features, detector.getDirection(), baseScore);
        emitted.add(CompositeSignal.builder()
                .symbol(symbol)
                .detectorType(detector.getType())
                .direction(detector.getDirection())
                .assetClass(assetClass)
                .compositeScore(baseScore)
                .styleScores(styles)
                .riskReward(riskReward)
                .confidence(confidence.getConfidence())
                .confidenceDetail(confidence)
                .factors(result.getFactors())
                .barTimeKey(barTimeKey)
                .barTime(barTime)
                .detectedAt(detectedAt)
                .sizeMultiplier(validation.getSizeMultiplier())
                .detectorVersion(cfg.getDetectorVersion())
                .analysisMode(mode)
                .filtered(false)
                .build());
        return null;
    }

    private ScanResult filtered(String reason, int detectionCount, long start) {
        totalFiltered.incrementAndGet();
        return ScanResult.filtered(reason, detectionCount, System.currentTimeMillis() - start);
    }

    private void notifyListeners(CompositeSignal signal) {
        for (CompositeSignalListener listener : listeners) {
            try {
                listener.onSignal(signal);
            } catch (RuntimeException e) {
                log.warn("[SCANNER] Listener {} failed for {} {}: {}",
                        listener.getClass().getSimpleName(), signal.getSymbol(), signal.getDetectorType(),
                        e.getMessage());
            }
        }
    }

    // ======================== BATCH ========================

    /**
     * Scan many symbols. Distinct symbols run concurrently on the scan executor;
     * requests for the same symbol run in order on one task. Results keep request order.
     */
    public List<ScanResult> scanBatch(List<ScanRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        ScanResult[] results = new ScanResult[requests.size()];

        Map<String, List<Integer>> bySymbol = new LinkedHashMap<>();
        for (int i = 0; i < requests.size(); i++) {
            String symbol = requests.get(i).getSymbol();
            String key = symbol != null ? symbol.trim().toUpperCase(Locale.ROOT) : "";
            bySymbol.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }

        List<CompletableFuture<Void>> tasks = new ArrayList<>(bySymbol.size());
        for (List<Integer> indexes : bySymbol.values()) {
            tasks.add(CompletableFuture.runAsync(() -> {
                for (int index : indexes) {
                    ScanRequest request = requests.get(index);
                    results[index] = scanSymbol(request.getSymbol(), request.getFeatures(),
                            request.getOptions(), request.getMode());
                }
            }, scanExecutor));
        }
        CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();

        log.debug("[SCANNER] Batch of {} requests across {} symbols complete", requests.size(), bySymbol.size());
        return Arrays.asList(results);
    }

    // ======================== CONFIG ========================

    /**
     * Validate and swap in a copy of the new config. The next scan uses it.
     *
     * @throws IllegalArgumentException when the config is invalid; the current config stays in place
     */
    public void updateConfig(ScannerConfig newConfig) {
        ScannerConfigValidator.validateOrThrow(newConfig);
        this.config = newConfig.copy();
        log.info("[CONFIG] Scanner config updated: thresholds={}, filters={}, adaptive={}, rateCapScope={}",
                newConfig.getThresholds(), newConfig.getFilters(),
                newConfig.getAdaptive().isEnabled(), newConfig.getRateCapScope());
    }

    /**
     * Copy of the active config
     */
    public ScannerConfig getConfig() {
        return config.copy();
    }

    // ======================== LISTENERS ========================

    public void addListener(CompositeSignalListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CompositeSignalListener listener) {
        listeners.remove(listener);
    }

    // ======================== STATS ========================

    public DeduplicationStats getDeduplicationStats() {
        return deduplicationStore.getStats();
    }

    public void clearDeduplication() {
        deduplicationStore.clear();
    }

    public ScannerStats getStats() {
        return ScannerStats.builder()
                .totalScans(totalScans.get())
                .totalSignals(totalSignals.get())
                .totalFiltered(totalFiltered.get())
                .detectorErrors(detectorErrors.get())
                .signalsByType(snapshot(signalsByType))
                .signalsBySymbol(snapshot(signalsBySymbol))
                .build();
    }

    private static Map<String, Long> snapshot(Map<String, AtomicLong> counters) {
        Map<String, Long> copy = new LinkedHashMap<>();
        counters.forEach((k, v) -> copy.put(k, v.get()));
        return copy;
    }
}
