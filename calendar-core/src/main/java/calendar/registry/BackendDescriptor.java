package calendar.registry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration-time description of a backend that has not been constructed yet.
 *
 * <p>{@code type} is the key of a {@link BackendFactory} in the registry's factory table;
 * {@code arguments} are passed to that factory as-is, in order. Argument values may be
 * {@code null}.
 *
 * @param name      descriptor name, free-form and not required to be unique
 * @param type      factory key
 * @param arguments constructor arguments
 */
public record BackendDescriptor(String name, String type, List<Object> arguments) {

  public BackendDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(arguments, "arguments");
    arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
  }

  /**
   * Creates a descriptor with the given arguments.
   */
  public static BackendDescriptor of(String name, String type, Object... arguments) {
    return new BackendDescriptor(name, type, Arrays.asList(arguments));
  }
}
