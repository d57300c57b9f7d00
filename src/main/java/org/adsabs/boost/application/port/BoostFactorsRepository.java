package org.adsabs.boost.application.port;

import java.util.Optional;
import java.util.function.Consumer;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.RecordKey;
import org.adsabs.boost.domain.error.StageException;

/**
 * <strong>What:</strong> Output port for durable storage of boost factors, one row per record.
 * <p><strong>Why:</strong> The store stage depends on this contract only; the JDBC adapter and test
 * doubles plug in behind it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Insert or fully replace the row identified by bibcode or scix_id.</li>
 *   <li>Serialize concurrent writes to the same key so exactly one row survives.</li>
 *   <li>Report transient failures as retryable and constraint violations as permanent.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must support concurrent callers.</p>
 *
 * @since 0.1.0
 */
public interface BoostFactorsRepository extends AutoCloseable {
  /**
   * Inserts or replaces the row for {@code factors.key()}. Repeating the call with the same value
   * leaves the stored state unchanged.
   *
   * @param factors computed factors
   * @throws StageException with kind RETRYABLE or PERMANENT
   */
  void upsert(BoostFactors factors) throws StageException;

  /**
   * Finds factors by bibcode.
   *
   * @param bibcode bibcode
   * @return stored factors, if any
   * @throws StageException if the lookup fails
   */
  Optional<BoostFactors> findByBibcode(String bibcode) throws StageException;

  /**
   * Finds factors by scix_id.
   *
   * @param scixId SciX identifier
   * @return stored factors, if any
   * @throws StageException if the lookup fails
   */
  Optional<BoostFactors> findByScixId(String scixId) throws StageException;

  /**
   * Looks up a key by bibcode first, then by scix_id.
   *
   * @param key record key
   * @return stored factors, if any
   * @throws StageException if a lookup fails
   */
  default Optional<BoostFactors> find(RecordKey key) throws StageException {
    if (key.bibcode() != null) {
      Optional<BoostFactors> found = findByBibcode(key.bibcode());
      if (found.isPresent()) {
        return found;
      }
    }
    return key.scixId() != null ? findByScixId(key.scixId()) : Optional.empty();
  }

  /**
   * Streams every stored row in insertion order.
   *
   * @param sink receives each row
   * @return number of rows visited
   * @throws StageException if the scan fails
   */
  long forEach(Consumer<BoostFactors> sink) throws StageException;

  @Override
  default void close() throws Exception {}
}
