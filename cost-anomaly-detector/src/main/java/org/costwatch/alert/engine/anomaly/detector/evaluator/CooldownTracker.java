package org.costwatch.alert.engine.anomaly.detector.evaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.costwatch.alert.engine.datamodel.CooldownRecord;
import org.costwatch.alert.engine.datamodel.DedupKey;
import org.costwatch.alert.engine.datamodel.store.AlertStore;

/**
 * Last trigger time per dedup key. Records missing from memory are rebuilt from the newest stored
 * alert with the same key, so a restart does not reopen the cooldown window.
 */
public class CooldownTracker {
  private final ConcurrentMap<DedupKey, CooldownRecord> records = new ConcurrentHashMap<>();
  private final AlertStore alertStore;

  public CooldownTracker(AlertStore alertStore) {
    this.alertStore = alertStore;
  }

  public boolean isCoolingDown(DedupKey key, Duration cooldown, Instant now) {
    return current(key).map(record -> record.isCoolingDown(cooldown, now)).orElse(false);
  }

  /**
   * Claims {@code key} for an alert raised at {@code now}. Of several concurrent callers inside
   * one cooldown window exactly one gets {@code true}.
   */
  public boolean tryAcquire(DedupKey key, Duration cooldown, Instant now) {
    current(key);
    AtomicBoolean acquired = new AtomicBoolean(false);
    records.compute(
        key,
        (k, existing) -> {
          if (existing != null && existing.isCoolingDown(cooldown, now)) {
            return existing;
          }
          acquired.set(true);
          return CooldownRecord.of(k, now);
        });
    return acquired.get();
  }

  /** Drops a claim made at {@code acquiredAt} whose alert was never created. */
  public void release(DedupKey key, Instant acquiredAt) {
    records.computeIfPresent(
        key, (k, existing) -> existing.getLastTriggeredAt().equals(acquiredAt) ? null : existing);
  }

  public Optional<CooldownRecord> current(DedupKey key) {
    return Optional.ofNullable(
        records.computeIfAbsent(
            key,
            k ->
                alertStore
                    .findLatestByDedupKey(k.asString())
                    .map(alert -> CooldownRecord.of(k, alert.getTriggeredAt()))
                    .orElse(null)));
  }
}
