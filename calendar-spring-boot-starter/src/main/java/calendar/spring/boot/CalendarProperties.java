package calendar.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the calendar federation layer.
 *
 * <pre>
 * calendar.backends[0].name=personal
 * calendar.backends[0].type=database
 * calendar.backends[1].name=shared
 * calendar.backends[1].type=local
 * calendar.backends[1].arguments=CREATE_OBJECT,EDIT_OBJECT
 * </pre>
 *
 * @see CalendarAutoConfiguration
 */
@ConfigurationProperties(prefix = "calendar")
public class CalendarProperties {

  /**
   * Activate the default backend when no configured descriptor could be activated.
   */
  private boolean activateDefault = true;

  /**
   * Backend descriptors, set up in order at startup.
   */
  private List<Backend> backends = new ArrayList<>();

  private final Jdbc jdbc = new Jdbc();
  private final Metrics metrics = new Metrics();

  public boolean isActivateDefault() {
    return activateDefault;
  }

  public void setActivateDefault(boolean activateDefault) {
    this.activateDefault = activateDefault;
  }

  public List<Backend> getBackends() {
    return backends;
  }

  public void setBackends(List<Backend> backends) {
    this.backends = backends;
  }

  public Jdbc getJdbc() {
    return jdbc;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Backend {
    /**
     * Descriptor name, used in logs and setup reports.
     */
    private String name;

    /**
     * Factory type: a built-in type ({@code local}, {@code database}) or the bean name of a
     * {@link calendar.registry.BackendFactory}.
     */
    private String type;

    /**
     * Arguments handed to the factory after the ones the factory binds itself.
     */
    private List<String> arguments = new ArrayList<>();

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public List<String> getArguments() {
      return arguments;
    }

    public void setArguments(List<String> arguments) {
      this.arguments = arguments;
    }
  }

  public static class Jdbc {
    /**
     * Prefix of the calendar tables.
     */
    private String tablePrefix = "calendar_";

    public String getTablePrefix() {
      return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
      this.tablePrefix = tablePrefix;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "calendar";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
