package io.faultline.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread factory for the transport's background threads.
 *
 * <p>Threads are named {@code <prefix>1}, {@code <prefix>2}, etc. and are daemons, so a
 * pending delivery never keeps the host application's JVM alive. A thread that dies from
 * an uncaught exception is logged instead of being reported to the application's default
 * handler, which may itself be the faultline uncaught-exception integration.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String prefix;
  private final AtomicInteger counter = new AtomicInteger(1);

  public DaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Background thread " + t.getName() + " terminated", e));
    return thread;
  }
}
