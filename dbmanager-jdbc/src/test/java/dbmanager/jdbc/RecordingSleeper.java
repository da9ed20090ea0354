package dbmanager.jdbc;

import dbmanager.spi.Sleeper;

import java.util.ArrayList;
import java.util.List;

final class RecordingSleeper implements Sleeper {
  private final List<Long> delays = new ArrayList<>();

  @Override
  public synchronized void sleep(long millis) {
    delays.add(millis);
  }

  synchronized List<Long> delays() {
    return List.copyOf(delays);
  }
}
