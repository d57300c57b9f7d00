package org.adsabs.boost.infrastructure.export;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.Discipline;

/**
 * Writes boost factors as CSV with a header row.
 *
 * <p>Column order: bibcode, scix_id, created, doctype_boost, refereed_boost, recency_boost,
 * boost_factor, the six discipline weights, then the six final boosts.</p>
 *
 * @since 0.1.0
 */
public final class CsvBoostFactorsExporter implements AutoCloseable {
  static final List<String> HEADER = header();

  private final SequenceWriter writer;
  private long rows;

  /**
   * Starts an export; the header is written immediately.
   *
   * @param out destination; closed with this exporter
   * @throws IOException if the header cannot be written
   */
  public CsvBoostFactorsExporter(Writer out) throws IOException {
    Objects.requireNonNull(out, "out");
    CsvSchema.Builder schema = CsvSchema.builder();
    HEADER.forEach(schema::addColumn);
    // Quote only values that contain a separator, quote or line break.
    CsvMapper mapper = CsvMapper.builder()
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
        .build();
    this.writer = mapper
        .writerFor(List.class)
        .with(schema.build().withHeader())
        .writeValues(out);
  }

  private static List<String> header() {
    List<String> columns = new ArrayList<>(List.of(
        "bibcode", "scix_id", "created", "doctype_boost", "refereed_boost", "recency_boost", "boost_factor"));
    for (Discipline discipline : Discipline.values()) {
      columns.add(discipline.tag() + "_weight");
    }
    for (Discipline discipline : Discipline.values()) {
      columns.add(discipline.tag() + "_final_boost");
    }
    return List.copyOf(columns);
  }

  /**
   * Appends one row.
   *
   * @param factors stored factors
   * @throws UncheckedIOException if the write fails
   */
  public void write(BoostFactors factors) {
    List<Object> row = new ArrayList<>(HEADER.size());
    row.add(factors.key().bibcode() == null ? "" : factors.key().bibcode());
    row.add(factors.key().scixId() == null ? "" : factors.key().scixId());
    row.add(factors.created().toString());
    row.add(factors.basics().doctype());
    row.add(factors.basics().refereed());
    row.add(factors.basics().recency());
    row.add(factors.combinedBoost());
    for (Discipline discipline : Discipline.values()) {
      row.add(factors.disciplineWeights().get(discipline));
    }
    for (Discipline discipline : Discipline.values()) {
      row.add(factors.finalBoosts().get(discipline));
    }
    try {
      writer.write(row);
      rows++;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write CSV row for " + factors.key().display(), ex);
    }
  }

  public long rows() {
    return rows;
  }

  @Override
  public void close() throws IOException {
    writer.close();
  }
}
