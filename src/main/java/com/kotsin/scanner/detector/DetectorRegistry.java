package com.kotsin.scanner.detector;

import com.kotsin.scanner.config.ScannerConstants;
import com.kotsin.scanner.detector.catalog.EquityDetectors;
import com.kotsin.scanner.detector.catalog.FlowDetectors;
import com.kotsin.scanner.detector.catalog.IndexDetectors;
import com.kotsin.scanner.detector.catalog.KcuDetectors;
import com.kotsin.scanner.model.AssetClass;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * DetectorRegistry - Central catalogue of all opportunity detectors
 *
 * Groups:
 * 1. EQUITY - breakout, mean reversion, trend continuation (stocks, equity ETFs)
 * 2. INDEX - gamma squeeze/flip, EOD pin, power hour, index mean reversion, opening drive
 * 3. KCU - LTP framework setups (level, trend, patience candle) for all classes
 * 4. FLOW - sweep momentum and institutional flow for all classes
 *
 * Every detector is validated on registration. A malformed detector is a
 * programming error and fails startup.
 */
@Slf4j
@Component
public class DetectorRegistry {

    /**
     * Detectors in registration order
     */
    private final List<OpportunityDetector> detectors = new CopyOnWriteArrayList<>();

    /**
     * Detectors by type (for fast lookup)
     */
    private final Map<String, OpportunityDetector> byType = new ConcurrentHashMap<>();

    @PostConstruct
    public void initialize() {
        log.info("[REGISTRY] Initializing opportunity detectors...");

        EquityDetectors.all().forEach(this::register);
        IndexDetectors.all().forEach(this::register);
        KcuDetectors.all().forEach(this::register);
        FlowDetectors.all().forEach(this::register);

        log.info("[REGISTRY] Registered {} detectors ({} equity, {} index, {} options-dependent, {} flow-primary)",
                detectors.size(), equityOnly().size(), indexOnly().size(),
                optionsDependent().size(), flowPrimary().size());
    }

    /**
     * Registry with the standard catalogue, for use outside a Spring context.
     */
    public static DetectorRegistry standard() {
        DetectorRegistry registry = new DetectorRegistry();
        registry.initialize();
        return registry;
    }

    // ======================== REGISTRATION ========================

    /**
     * Register a detector after checking its authoring invariants.
     *
     * @throws IllegalStateException if the detector is malformed or its type is taken
     */
    public synchronized void register(OpportunityDetector detector) {
        if (detector == null) {
            throw new IllegalStateException("Cannot register null detector");
        }
        String type = detector.getType();
        if (type == null || type.isBlank()) {
            throw new IllegalStateException("Detector type must not be blank: " + detector);
        }
        if (byType.containsKey(type)) {
            throw new IllegalStateException("Duplicate detector type: " + type);
        }
        if (detector.getDirection() == null) {
            throw new IllegalStateException("Detector " + type + " has no direction");
        }
        if (detector.getGate() == null) {
            throw new IllegalStateException("Detector " + type + " has no gate");
        }
        if (detector.getAssetClasses() == null || detector.getAssetClasses().isEmpty()) {
            throw new IllegalStateException("Detector " + type + " applies to no asset class");
        }
        if (detector.getScoreFactors() == null || detector.getScoreFactors().isEmpty()) {
            throw new IllegalStateException("Detector " + type + " has no score factors");
        }
        for (ScoreFactor factor : detector.getScoreFactors()) {
            if (!(factor.getWeight() > 0.0 && factor.getWeight() <= 1.0)) {
                throw new IllegalStateException(String.format(
                        "Detector %s factor %s weight %.3f outside (0,1]", type, factor.getName(), factor.getWeight()));
            }
        }
        double total = detector.totalWeight();
        if (Math.abs(total - ScannerConstants.WEIGHT_SUM_TARGET) > ScannerConstants.WEIGHT_SUM_TOLERANCE) {
            throw new IllegalStateException(String.format(
                    "Detector %s weights sum to %.3f, expected 1.0 +/- %.2f",
                    type, total, ScannerConstants.WEIGHT_SUM_TOLERANCE));
        }

        detectors.add(detector);
        byType.put(type, detector);
        log.debug("[REGISTRY] Registered detector: {}", detector);
    }

    // ======================== QUERIES ========================

    public List<OpportunityDetector> all() {
        return Collections.unmodifiableList(detectors);
    }

    public Optional<OpportunityDetector> find(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(byType.get(type));
    }

    /**
     * Detectors that may run for a symbol of this class. Options-dependent
     * detectors are left out when no options context is available.
     */
    public List<OpportunityDetector> forAssetClass(AssetClass assetClass, boolean hasOptions) {
        return filter(d -> d.appliesTo(assetClass) && (hasOptions || !d.isRequiresOptionsData()));
    }

    /**
     * Detectors scoped to stocks and equity ETFs only
     */
    public List<OpportunityDetector> equityOnly() {
        return filter(d -> !d.appliesTo(AssetClass.INDEX));
    }

    /**
     * Detectors scoped to cash indices only
     */
    public List<OpportunityDetector> indexOnly() {
        return filter(d -> d.appliesTo(AssetClass.INDEX)
                && !d.appliesTo(AssetClass.STOCK)
                && !d.appliesTo(AssetClass.EQUITY_ETF));
    }

    public List<OpportunityDetector> optionsDependent() {
        return filter(OpportunityDetector::isRequiresOptionsData);
    }

    public List<OpportunityDetector> flowPrimary() {
        return filter(OpportunityDetector::isFlowPrimary);
    }

    /**
     * Detectors that can be replayed from stored snapshots (no live options chain needed)
     */
    public List<OpportunityDetector> backtestable() {
        return filter(d -> !d.isRequiresOptionsData());
    }

    public int size() {
        return detectors.size();
    }

    private List<OpportunityDetector> filter(Predicate<OpportunityDetector> predicate) {
        return detectors.stream().filter(predicate).toList();
    }
}
