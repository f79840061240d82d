/**
 * Service Provider Interfaces (SPI) for extending the calendar federation layer.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in storage backends, calendar caching, hidden-item persistence,
 * UID indexing, diagnostics, and metrics.
 *
 * @see calendar.spi.CalendarBackend
 * @see calendar.spi.CalendarCache
 * @see calendar.spi.HiddenItemStore
 * @see calendar.spi.UidIndex
 * @see calendar.spi.LogSink
 * @see calendar.spi.MetricsExporter
 */
package calendar.spi;
