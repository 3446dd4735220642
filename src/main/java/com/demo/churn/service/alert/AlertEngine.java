package com.demo.churn.service.alert;

import com.demo.churn.config.ChurnProperties;
import com.demo.churn.service.monitoring.MonitoringSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One CLEAR / ATTENTION / CRITICAL state machine per {@link AlertKind}, advanced by every
 * closed monitoring window.
 *
 * <p>Entering a non-clear state opens an alert. Staying in it only refreshes
 * {@code lastObservedAt}. Moving between ATTENTION and CRITICAL resolves the open alert and
 * opens one at the new severity, and going back to CLEAR resolves it. The alert log only
 * grows. Timestamps come from the snapshot, so replaying a history gives the same alerts.</p>
 */
@Slf4j
@Service
public class AlertEngine {

    /** Number of most recent windows averaged for the volume check. */
    static final int VOLUME_WINDOWS = 7;

    private final ChurnProperties.Alerts cfg;

    private final Map<AlertKind, AlertState> states = new EnumMap<>(AlertKind.class);
    /** Index in {@link #alerts} of the open alert of each kind. */
    private final Map<AlertKind, Integer> open = new EnumMap<>(AlertKind.class);
    private final List<Alert> alerts = new ArrayList<>();
    private long sequence;

    public AlertEngine(ChurnProperties props) {
        this.cfg = props.getAlerts();
        for (AlertKind k : AlertKind.values()) states.put(k, AlertState.CLEAR);
    }

    private record Assessment(AlertState state, double value, double threshold, String message) {
        static Assessment clear(double value) {
            return new Assessment(AlertState.CLEAR, value, Double.NaN, null);
        }
    }

    /**
     * Advances every state machine with {@code snapshot}. {@code recent} is the snapshot
     * history ending with {@code snapshot}, used for the volume check.
     *
     * @return alerts opened by this evaluation
     */
    public synchronized List<Alert> evaluate(MonitoringSnapshot snapshot, List<MonitoringSnapshot> recent) {
        Instant at = snapshot.getWindowEnd();
        List<Alert> opened = new ArrayList<>();

        Assessment performance = performance(snapshot);
        if (performance != null) advance(AlertKind.PERFORMANCE_DEGRADATION, performance, at, opened);

        Assessment drift = drift(snapshot);
        if (drift != null) advance(AlertKind.DATA_DRIFT, drift, at, opened);

        advance(AlertKind.HIGH_RISK_CUSTOMER, highRisk(snapshot), at, opened);

        if (cfg.getMinVolume() > 0) advance(AlertKind.PREDICTION_VOLUME, volume(recent), at, opened);

        return opened;
    }

    public synchronized AlertState state(AlertKind kind) {
        return states.get(kind);
    }

    public synchronized List<Alert> history() {
        return List.copyOf(alerts);
    }

    public synchronized List<Alert> active() {
        return alerts.stream().filter(a -> !a.isResolved()).toList();
    }

    private Assessment performance(MonitoringSnapshot s) {
        if (s.getPerformance() == null || !s.getPerformance().available()) return null;
        Double v = s.getPerformance().value(cfg.getMetric());
        if (v == null) return null;
        String metric = cfg.getMetric().name().toLowerCase(Locale.ROOT);
        if (v < cfg.getPerformanceCritical()) {
            return new Assessment(AlertState.CRITICAL, v, cfg.getPerformanceCritical(),
                    String.format(Locale.ROOT, "Model %s at %.3f, below the critical threshold %.2f", metric, v, cfg.getPerformanceCritical()));
        }
        if (v < cfg.getPerformanceAttention()) {
            return new Assessment(AlertState.ATTENTION, v, cfg.getPerformanceAttention(),
                    String.format(Locale.ROOT, "Model %s at %.3f, below the attention threshold %.2f", metric, v, cfg.getPerformanceAttention()));
        }
        return Assessment.clear(v);
    }

    private Assessment drift(MonitoringSnapshot s) {
        Double d = s.getDriftScore();
        if (d == null || s.getVolume() < cfg.getDriftMinVolume()) return null;
        String worst = worstFeature(s.getFeatureDrift());
        String where = worst == null ? "" : " (largest on '" + worst + "')";
        if (d > cfg.getDriftCritical()) {
            return new Assessment(AlertState.CRITICAL, d, cfg.getDriftCritical(),
                    String.format(Locale.ROOT, "Input drift %.3f above the critical threshold %.2f%s", d, cfg.getDriftCritical(), where));
        }
        if (d > cfg.getDriftAttention()) {
            return new Assessment(AlertState.ATTENTION, d, cfg.getDriftAttention(),
                    String.format(Locale.ROOT, "Input drift %.3f above the attention threshold %.2f%s", d, cfg.getDriftAttention(), where));
        }
        return Assessment.clear(d);
    }

    private Assessment highRisk(MonitoringSnapshot s) {
        long n = s.getHighRiskCount();
        if (n > cfg.getHighRiskCount()) {
            return new Assessment(AlertState.CRITICAL, n, cfg.getHighRiskCount(),
                    n + " high-risk customers in the window, more than " + cfg.getHighRiskCount());
        }
        return Assessment.clear(n);
    }

    private Assessment volume(List<MonitoringSnapshot> recent) {
        if (recent.isEmpty()) return Assessment.clear(0);
        List<MonitoringSnapshot> tail = recent.subList(Math.max(0, recent.size() - VOLUME_WINDOWS), recent.size());
        double mean = tail.stream().mapToLong(MonitoringSnapshot::getVolume).average().orElse(0);
        if (mean < cfg.getMinVolume()) {
            return new Assessment(AlertState.ATTENTION, mean, cfg.getMinVolume(),
                    String.format(Locale.ROOT, "Mean prediction volume %.1f over the last %d windows, below %.1f",
                            mean, tail.size(), cfg.getMinVolume()));
        }
        return Assessment.clear(mean);
    }

    private void advance(AlertKind kind, Assessment a, Instant at, List<Alert> opened) {
        AlertState previous = states.get(kind);
        if (previous == a.state()) {
            Integer idx = open.get(kind);
            if (idx != null) alerts.set(idx, alerts.get(idx).withLastObservedAt(at));
            return;
        }
        states.put(kind, a.state());
        resolveOpen(kind, at);
        if (a.state() == AlertState.CLEAR) {
            log.info("Alert {} cleared ({} -> CLEAR, value {})", kind, previous, a.value());
            return;
        }
        Alert alert = Alert.builder()
                .id(++sequence)
                .kind(kind)
                .severity(a.state().severity())
                .message(a.message())
                .recommendedAction(kind.getRecommendedAction())
                .observedValue(a.value())
                .threshold(a.threshold())
                .raisedAt(at)
                .lastObservedAt(at)
                .build();
        alerts.add(alert);
        open.put(kind, alerts.size() - 1);
        opened.add(alert);
        log.info("Alert {} raised ({} -> {}): {}", kind, previous, a.state(), a.message());
    }

    private void resolveOpen(AlertKind kind, Instant at) {
        Integer idx = open.remove(kind);
        if (idx != null) {
            alerts.set(idx, alerts.get(idx).withResolved(true).withResolvedAt(at).withLastObservedAt(at));
        }
    }

    private static String worstFeature(Map<String, Double> drift) {
        if (drift == null || drift.isEmpty()) return null;
        return drift.entrySet().stream().max(Map.Entry.comparingByValue()).map(Map.Entry::getKey).orElse(null);
    }
}
