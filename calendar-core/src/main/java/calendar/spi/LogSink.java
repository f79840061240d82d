package calendar.spi;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives diagnostics for degraded federation outcomes: unknown backends, unsupported
 * operations, and missing calendars or objects. Never invoked on success paths.
 *
 * <p>{@link #JUL} writes each record to the {@code java.util.logging} logger named by
 * its category.
 */
@FunctionalInterface
public interface LogSink {

  String CATEGORY_BACKEND = "calendar.backend";
  String CATEGORY_OPERATION = "calendar.operation";
  String CATEGORY_LOOKUP = "calendar.lookup";

  LogSink JUL = (category, message, level) -> Logger.getLogger(category).log(level, message);

  /**
   * Records one diagnostic.
   *
   * @param category logical source of the record
   * @param message  human-readable detail
   * @param level    severity
   */
  void record(String category, String message, Level level);
}
