package replay.fault;

import replay.spi.FaultInjector;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * {@link FaultInjector} for test harnesses. An armed point makes the next matching
 * single-statement batch fail with a synthetic {@link SQLException} carrying the armed
 * vendor error code, so that classification and retry can be exercised without a
 * misbehaving database.
 *
 * <p>A batch matches when it has exactly one statement and that statement contains the
 * armed marker (for example {@code "CREATE TABLE"}).
 *
 * <p>This class is thread-safe.
 */
public final class StatementFaultInjector implements FaultInjector {
  private static final Logger logger = Logger.getLogger(StatementFaultInjector.class.getName());

  /** Unlimited number of firings. */
  public static final int ALWAYS = -1;

  private final Map<String, Armed> points = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

  /**
   * Arms {@code point} until {@link #disarm(String)} is called.
   *
   * @param point     injection point name, see {@link FaultPoints}
   * @param errorCode vendor error code of the synthetic failure (0..65535)
   * @param marker    substring the single statement must contain
   * @return this injector
   */
  public StatementFaultInjector arm(String point, int errorCode, String marker) {
    return armTimes(point, errorCode, marker, ALWAYS);
  }

  /**
   * Arms {@code point} for at most {@code times} firings.
   *
   * @param times number of firings, or {@link #ALWAYS}
   * @return this injector
   */
  public StatementFaultInjector armTimes(String point, int errorCode, String marker, int times) {
    Objects.requireNonNull(point, "point");
    Objects.requireNonNull(marker, "marker");
    if (errorCode < 0 || errorCode > 0xFFFF) {
      throw new IllegalArgumentException("errorCode must be in 0..65535, got: " + errorCode);
    }
    if (times == 0 || times < ALWAYS) {
      throw new IllegalArgumentException("times must be > 0 or ALWAYS, got: " + times);
    }
    points.put(point, new Armed(errorCode, marker, new AtomicInteger(times)));
    return this;
  }

  public void disarm(String point) {
    points.remove(point);
  }

  /**
   * @return how many times {@code point} has fired
   */
  public int hits(String point) {
    AtomicInteger count = hits.get(point);
    return count == null ? 0 : count.get();
  }

  @Override
  public Optional<SQLException> inject(String point, List<String> statements) {
    Armed armed = points.get(point);
    if (armed == null || statements.size() != 1 || !statements.get(0).contains(armed.marker())) {
      return Optional.empty();
    }
    if (!armed.consume()) {
      points.remove(point, armed);
      return Optional.empty();
    }
    hits.computeIfAbsent(point, p -> new AtomicInteger()).incrementAndGet();
    logger.warning("Injected failure at " + point + ": error code " + armed.errorCode());
    return Optional.of(new SQLException("injected failure at " + point, "HY000", armed.errorCode()));
  }

  private record Armed(int errorCode, String marker, AtomicInteger remaining) {
    boolean consume() {
      while (true) {
        int left = remaining.get();
        if (left == ALWAYS) {
          return true;
        }
        if (left == 0) {
          return false;
        }
        if (remaining.compareAndSet(left, left - 1)) {
          return true;
        }
      }
    }
  }
}
