package org.adsabs.boost.testutil;

import java.util.ArrayList;
import java.util.List;
import org.adsabs.boost.application.port.NotificationPort;
import org.adsabs.boost.domain.BoostFactors;
import org.adsabs.boost.domain.error.RetryableStageException;
import org.adsabs.boost.domain.error.StageException;

/**
 * Records published factors; can be told to fail a number of times first.
 */
public final class RecordingNotificationPort implements NotificationPort {
  private final List<BoostFactors> published = new ArrayList<>();
  private int failuresRemaining;
  private int attempts;

  public synchronized void failNext(int times) {
    failuresRemaining = times;
  }

  @Override
  public synchronized void publish(BoostFactors factors) throws StageException {
    attempts++;
    if (failuresRemaining > 0) {
      failuresRemaining--;
      throw new RetryableStageException("broker unavailable", null);
    }
    published.add(factors);
  }

  public synchronized List<BoostFactors> published() {
    return List.copyOf(published);
  }

  public synchronized int attempts() {
    return attempts;
  }
}
