package org.adsabs.boost.application.port;

import java.util.List;
import org.adsabs.boost.domain.BoostRequest;

/**
 * Paged supply of input records, for inputs too large to hold in memory.
 *
 * @since 0.1.0
 */
public interface RecordSource extends AutoCloseable {
  /**
   * Returns the next page of records.
   *
   * @param maxRecords page size limit
   * @return up to {@code maxRecords} records; empty when the source is exhausted
   * @throws Exception if the underlying input cannot be read
   */
  List<BoostRequest> nextPage(int maxRecords) throws Exception;

  @Override
  default void close() throws Exception {}
}
