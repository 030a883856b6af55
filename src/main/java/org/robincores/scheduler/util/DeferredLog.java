package org.robincores.scheduler.util;

import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

import java.util.ArrayList;
import java.util.List;

// Represents a buffer of log records that can be replayed to another logger later
public class DeferredLog extends AbstractAppender {
  private final List<LogEvent> records = new ArrayList<>();

  public DeferredLog(String name) {
    super(name, null, null, true, Property.EMPTY_ARRAY);
  }

  @Override
  public synchronized void append(LogEvent event) {
    records.add(event.toImmutable());
  }

  // Attach to a logger; the logger stops propagating to its parents while captured
  public void capture(org.apache.logging.log4j.core.Logger logger) {
    if (!isStarted()) {
      start();
    }
    logger.setAdditive(false);
    logger.addAppender(this);
  }

  public void release(org.apache.logging.log4j.core.Logger logger) {
    logger.removeAppender(this);
    logger.setAdditive(true);
  }

  // Empties the buffer
  public synchronized void forward(Logger target) {
    for (LogEvent r : records) {
      target.log(r.getLevel(), r.getMessage());
    }
    records.clear();
  }

  public synchronized int size() {
    return records.size();
  }

  public synchronized List<LogEvent> getRecords() {
    return new ArrayList<>(records);
  }
}
