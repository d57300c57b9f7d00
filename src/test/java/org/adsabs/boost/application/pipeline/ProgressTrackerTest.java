package org.adsabs.boost.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.adsabs.boost.domain.error.ErrorKind;
import org.adsabs.boost.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.Test;

class ProgressTrackerTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void reportsProgressOnCadence() {
    ProgressTracker tracker = new ProgressTracker(2, metrics);

    tracker.record(ChainOutcome.succeeded("a"));
    tracker.record(ChainOutcome.failed("b", Stage.STORE, ErrorKind.PERMANENT));
    tracker.record(ChainOutcome.storedWithoutNotification("c"));
    tracker.record(ChainOutcome.dispatched("d"));
    tracker.record(ChainOutcome.succeeded("e"));

    assertEquals(5, tracker.processed());
    assertEquals(3, tracker.succeeded());
    assertEquals(1, tracker.failed());
    assertEquals(List.of(2L, 4L), metrics.observed("boost.progress.processed"));
    assertEquals(1, metrics.count("boost.notify.failed"));
    assertEquals(1, metrics.count("boost.records.dispatched"));
  }

  @Test
  void unknownDoctypesAreCountedEveryTime() {
    UnknownDoctypeLog unknown = new UnknownDoctypeLog(metrics);

    for (int i = 0; i < UnknownDoctypeLog.LOG_EVERY + 5; i++) {
      unknown.accept("poster");
    }

    assertEquals(UnknownDoctypeLog.LOG_EVERY + 5, unknown.occurrences());
    assertEquals(UnknownDoctypeLog.LOG_EVERY + 5, metrics.count("boost.doctype.unknown"));
  }
}
