package calendar.dispatch;

import calendar.CalendarObject;
import calendar.ObjectId;
import calendar.OperationResult;
import calendar.spi.BackendAction;
import calendar.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Merges calendars and moves objects across backends, using native support where a single
 * backend offers it and {@link CalendarDispatcher} primitives otherwise.
 *
 * <p>Emulated merges and moves are not atomic. A failure part way leaves every object that
 * was already moved in the destination; the report says how far each source got. Merges
 * must not run concurrently against the same source or destination.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MergeReport report = engine.mergeCalendars("database.personal", "database.work", "local.old");
 * if (!report.isSuccess()) {
 *   report.sources().forEach(source -> log(source.sourceId(), source.result()));
 * }
 * }</pre>
 */
public final class MergeEngine {
  private static final Logger logger = Logger.getLogger(MergeEngine.class.getName());

  private final CalendarDispatcher dispatcher;
  private final MetricsExporter metrics;

  public MergeEngine(CalendarDispatcher dispatcher) {
    this(dispatcher, MetricsExporter.NOOP);
  }

  public MergeEngine(CalendarDispatcher dispatcher, MetricsExporter metrics) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Merges every source calendar into the destination, in the order given. Each drained
   * source is deleted, or hidden when its backend cannot delete.
   *
   * @param destinationId composite identifier of the destination calendar
   * @param sourceIds     composite identifiers of the source calendars
   * @return per-source outcomes
   * @throws calendar.MalformedIdentifierException if an identifier is not a calendar identifier
   * @throws IllegalArgumentException if a source is the destination itself
   */
  public MergeReport mergeCalendars(String destinationId, String... sourceIds) {
    ObjectId destination = ObjectId.decodeCalendar(destinationId);
    List<ObjectId> sources = new ArrayList<>(sourceIds.length);
    for (String sourceId : sourceIds) {
      ObjectId source = ObjectId.decodeCalendar(sourceId);
      if (source.equals(destination)) {
        throw new IllegalArgumentException("Cannot merge calendar " + sourceId + " into itself");
      }
      sources.add(source);
    }

    List<MergeReport.SourceOutcome> outcomes = new ArrayList<>(sources.size());
    OperationResult<?> target = dispatcher.getCalendar(destination.toString());
    for (ObjectId source : sources) {
      MergeReport.SourceOutcome outcome = target.isSuccess()
          ? mergeOne(destination, source)
          : new MergeReport.SourceOutcome(source.toString(), modeFor(destination, source), 0,
              target.asFailure());
      metrics.recordMergedObjects(outcome.objectsMoved());
      outcomes.add(outcome);
    }
    return new MergeReport(destination.toString(), outcomes);
  }

  private MergeReport.Mode modeFor(ObjectId destination, ObjectId source) {
    return dispatcher.canMergeNatively(destination.toString(), source.toString())
        ? MergeReport.Mode.DELEGATED
        : MergeReport.Mode.EMULATED;
  }

  private MergeReport.SourceOutcome mergeOne(ObjectId destination, ObjectId source) {
    String sourceId = source.toString();
    if (modeFor(destination, source) == MergeReport.Mode.DELEGATED) {
      OperationResult<Integer> merged = dispatcher.mergeCalendar(destination.toString(), sourceId);
      return new MergeReport.SourceOutcome(sourceId, MergeReport.Mode.DELEGATED,
          merged.value().orElse(0),
          merged.isSuccess() ? OperationResult.done() : merged.asFailure());
    }

    logger.log(Level.FINE, "Merging {0} into {1} object by object",
        new Object[]{sourceId, destination});
    OperationResult<List<CalendarObject>> objects = dispatcher.listObjects(sourceId);
    if (!objects.isSuccess()) {
      return emulated(sourceId, 0, objects.asFailure());
    }
    int moved = 0;
    for (CalendarObject object : objects.orElseThrow()) {
      OperationResult<String> result = transfer(object, destination);
      if (!result.isSuccess()) {
        logger.log(Level.WARNING, "Merge of {0} into {1} stopped after {2} objects: {3}",
            new Object[]{sourceId, destination, moved, result});
        return emulated(sourceId, moved, result.asFailure());
      }
      moved++;
    }
    OperationResult<Void> deleted = dispatcher.deleteCalendar(sourceId);
    if (deleted.isSuccess()) {
      metrics.incrementEmulated(BackendAction.MERGE_CALENDAR);
    }
    return emulated(sourceId, moved, deleted);
  }

  private static MergeReport.SourceOutcome emulated(String sourceId, int moved,
      OperationResult<Void> result) {
    return new MergeReport.SourceOutcome(sourceId, MergeReport.Mode.EMULATED, moved, result);
  }

  /**
   * Moves an object into another calendar, natively when source and destination share a
   * backend that supports it, otherwise by creating a copy in the destination and deleting
   * the original.
   *
   * @param objectId              composite object identifier
   * @param destinationCalendarId composite identifier of the destination calendar
   * @return the object's new composite identifier
   */
  public OperationResult<String> moveObject(String objectId, String destinationCalendarId) {
    ObjectId source = ObjectId.decodeObject(objectId);
    ObjectId destination = ObjectId.decodeCalendar(destinationCalendarId);
    if (source.backend().equals(destination.backend())
        && dispatcher.supports(source.backend(), BackendAction.MOVE_OBJECT)) {
      return dispatcher.moveObject(objectId, destinationCalendarId);
    }
    if (source.calendarId().equals(destination.toString())) {
      throw new IllegalArgumentException("Object " + objectId + " is already in " + destinationCalendarId);
    }
    OperationResult<CalendarObject> found = dispatcher.findObject(objectId);
    if (!found.isSuccess()) {
      return found.asFailure();
    }
    return transfer(found.orElseThrow(), destination);
  }

  private OperationResult<String> transfer(CalendarObject object, ObjectId destination) {
    String sourceId = object.objectId().orElseThrow();
    OperationResult<CalendarObject> created = dispatcher.createObject(destination.toString(), object);
    if (!created.isSuccess()) {
      return created.asFailure();
    }
    OperationResult<Void> deleted = dispatcher.deleteObject(sourceId);
    if (!deleted.isSuccess()) {
      return deleted.asFailure();
    }
    metrics.incrementEmulated(BackendAction.MOVE_OBJECT);
    return OperationResult.success(created.orElseThrow().objectId().orElseThrow());
  }
}
