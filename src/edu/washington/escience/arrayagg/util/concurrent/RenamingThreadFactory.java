package edu.washington.escience.arrayagg.util.concurrent;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Name threads by a prefix and a number. The numbering starts at 0. Threads are daemons.
 */
public class RenamingThreadFactory implements ThreadFactory {

  /** The logger for this class. */
  private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(RenamingThreadFactory.class);

  /**
   * the prefix.
   */
  private final String prefix;
  /**
   * The atomic suffix number generator.
   */
  private final AtomicInteger seq;

  /**
   * @param prefix the prefix.
   */
  public RenamingThreadFactory(final String prefix) {
    this.prefix = prefix;
    seq = new AtomicInteger(0);
  }

  @Override
  public Thread newThread(final Runnable r) {
    Thread t = new Thread(r, prefix + "#" + seq.getAndIncrement());
    t.setDaemon(true);
    t.setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
      @Override
      public void uncaughtException(final Thread thread, final Throwable e) {
        LOGGER.error("Uncaught exception in thread: " + thread, e);
      }
    });
    return t;
  }
}
