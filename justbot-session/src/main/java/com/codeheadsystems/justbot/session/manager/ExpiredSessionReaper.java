package com.codeheadsystems.justbot.session.manager;

import com.codeheadsystems.justbot.session.SessionRegistry;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically removes expired sessions from a {@link SessionRegistry}.
 * <p>
 * Runs every {@code reapInterval} from the registry's configuration on a daemon thread.
 * Call {@link #shutdown()} on application shutdown to release the thread.
 */
@Singleton
public class ExpiredSessionReaper {

  private static final Logger log = LoggerFactory.getLogger(ExpiredSessionReaper.class);

  private final SessionRegistry<?> registry;
  private final ScheduledExecutorService sessionReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "justbot-session-reaper");
        t.setDaemon(true);
        return t;
      });

  @Inject
  public ExpiredSessionReaper(final SessionRegistry<?> registry) {
    this.registry = registry;
    long intervalMillis = registry.config().reapInterval().toMillis();
    sessionReaper.scheduleAtFixedRate(this::reap, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    log.info("ExpiredSessionReaper(interval={})", registry.config().reapInterval());
  }

  /**
   * Runs one pass.
   *
   * @return the number of sessions removed
   */
  public int reap() {
    return registry.removeExpired();
  }

  public void shutdown() {
    sessionReaper.shutdown();
  }
}
