/**
 * Root API of the calendar federation layer: one identifier scheme and one operation
 * surface over calendars stored in independently implemented backends.
 *
 * <h2>Core Design</h2>
 * <p>Calendars and objects are addressed by flat {@linkplain calendar.ObjectId composite
 * identifiers} of the form {@code backend.calendar[.uid]}. The
 * {@linkplain calendar.dispatch.CalendarDispatcher dispatcher} decodes an identifier,
 * resolves the backend from the {@linkplain calendar.registry.BackendRegistry registry}, and
 * delegates the operation when the backend supports it. Deletes fall back to hiding, period
 * listings to local filtering, and merges and moves to the
 * {@linkplain calendar.dispatch.MergeEngine merge engine}'s create-then-delete emulation.
 * Backend failures come back as {@link calendar.OperationResult} values.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>calendar-core</b>: model, codec, registry, dispatcher, the {@code local}
 *       backend (only depends on ulid-creator)</li>
 *   <li><b>calendar-jdbc</b>: the {@code database} backend and JDBC stores
 *       (H2, MySQL, PostgreSQL)</li>
 *   <li><b>calendar-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>calendar-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * @see calendar.CalendarFederation
 * @see calendar.ObjectId
 * @see calendar.OperationResult
 */
package calendar;
