package calendar.registry;

import calendar.spi.CalendarBackend;

import java.util.List;

/**
 * Constructs a backend from the arguments stored in a {@link BackendDescriptor}.
 *
 * <p>Factories are registered with a {@link DefaultBackendRegistry} under a type key and
 * replace reflective construction by class name.
 */
@FunctionalInterface
public interface BackendFactory {

  /**
   * @param arguments the descriptor's arguments, never {@code null}
   * @return a new backend
   * @throws IllegalArgumentException if the arguments do not fit this factory
   */
  CalendarBackend create(List<Object> arguments);
}
