package org.adsabs.boost.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Contiguous slice of the input submitted together.
 *
 * @param index zero-based batch position
 * @param records records in input order
 * @since 0.1.0
 */
public record Batch(int index, List<BoostRequest> records) {
  public Batch {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    records = List.copyOf(Objects.requireNonNull(records, "records"));
  }

  public int size() {
    return records.size();
  }

  /**
   * Splits {@code records} into consecutive batches of at most {@code batchSize} elements, preserving
   * order. An empty input yields no batches.
   *
   * @param records input records
   * @param batchSize maximum batch size; must be positive
   * @return batches in input order
   */
  public static List<Batch> partition(List<BoostRequest> records, int batchSize) {
    Objects.requireNonNull(records, "records");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    List<Batch> batches = new ArrayList<>((records.size() + batchSize - 1) / batchSize);
    for (int from = 0; from < records.size(); from += batchSize) {
      int to = Math.min(records.size(), from + batchSize);
      batches.add(new Batch(batches.size(), records.subList(from, to)));
    }
    return batches;
  }
}
