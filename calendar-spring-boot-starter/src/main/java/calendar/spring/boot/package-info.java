/**
 * Spring Boot auto-configuration for the calendar federation layer.
 *
 * <p>{@link calendar.spring.boot.CalendarAutoConfiguration} wires the registry, dispatcher
 * and merge engine from {@link calendar.spring.boot.CalendarProperties};
 * {@link calendar.spring.boot.CalendarMicrometerAutoConfiguration} adds Micrometer metrics.
 */
package calendar.spring.boot;
