package org.adsabs.boost.testutil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.adsabs.boost.application.port.BoostFactorsRepository;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.RecordKey;
import org.adsabs.boost.domain.error.StageException;

/**
 * Map-backed repository. Rows are keyed by bibcode, else scix_id; a failure hook can reject
 * selected upserts.
 */
public final class InMemoryBoostFactorsRepository implements BoostFactorsRepository {
  /** Decides whether an upsert fails. */
  @FunctionalInterface
  public interface Failure {
    void check(BoostFactors factors) throws StageException;
  }

  private final Map<String, BoostFactors> rows = new LinkedHashMap<>();
  private volatile Failure failure = factors -> { };
  private int upserts;

  public void failWhen(Failure failure) {
    this.failure = failure;
  }

  @Override
  public synchronized void upsert(BoostFactors factors) throws StageException {
    upserts++;
    failure.check(factors);
    RecordKey key = factors.key();
    rows.entrySet().removeIf(entry -> matches(entry.getValue().key(), key));
    rows.put(key.bibcode() != null ? key.bibcode() : key.scixId(), factors);
  }

  @Override
  public synchronized Optional<BoostFactors> findByBibcode(String bibcode) {
    return find(f -> bibcode.equals(f.key().bibcode()));
  }

  @Override
  public synchronized Optional<BoostFactors> findByScixId(String scixId) {
    return find(f -> scixId.equals(f.key().scixId()));
  }

  @Override
  public synchronized long forEach(Consumer<BoostFactors> sink) {
    List<BoostFactors> snapshot = new ArrayList<>(rows.values());
    snapshot.forEach(sink);
    return snapshot.size();
  }

  public synchronized int size() {
    return rows.size();
  }

  public synchronized int upserts() {
    return upserts;
  }

  private Optional<BoostFactors> find(Predicate<BoostFactors> predicate) {
    return rows.values().stream().filter(predicate).findFirst();
  }

  private static boolean matches(RecordKey stored, RecordKey incoming) {
    return (incoming.bibcode() != null && incoming.bibcode().equals(stored.bibcode()))
        || (incoming.scixId() != null && incoming.scixId().equals(stored.scixId()));
  }
}
