package org.adsabs.boost.infrastructure.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.adsabs.boost.application.codec.UpstreamRecordParser;
import org.adsabs.boost.application.port.RecordSource;

/**
 * Chooses a record source by file extension.
 *
 * @since 0.1.0
 */
public final class RecordSources {
  private RecordSources() {}

  /**
   * Opens {@code path} as CSV when it ends in {@code .csv}, otherwise as a JSON array.
   *
   * @param path input file
   * @param parser upstream message parser
   * @return open source; the caller closes it
   * @throws IOException if the file cannot be read
   */
  public static RecordSource open(Path path, UpstreamRecordParser parser) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new IOException("record file not found: " + path);
    }
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".csv") ? new CsvRecordSource(path, parser) : new JsonArrayRecordSource(path, parser);
  }
}
