package calendar.dispatch;

import calendar.Calendar;
import calendar.CalendarFilter;
import calendar.CalendarObject;
import calendar.FailureReason;
import calendar.ObjectId;
import calendar.OperationResult;
import calendar.local.InMemoryHiddenItemStore;
import calendar.local.InMemoryUidIndex;
import calendar.registry.BackendRegistry;
import calendar.spi.BackendAction;
import calendar.spi.CalendarBackend;
import calendar.spi.CalendarCache;
import calendar.spi.HiddenItemStore;
import calendar.spi.LogSink;
import calendar.spi.MetricsExporter;
import calendar.spi.UidIndex;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Public operation surface of the federation layer.
 *
 * <p>Every operation decodes its identifiers, resolves the owning backend through the
 * {@link BackendRegistry} and consults the {@link CapabilityNegotiator} before mutating
 * anything or listing a period. Malformed identifiers throw; everything a backend reports,
 * including exceptions it throws, comes back as an {@link OperationResult}.
 *
 * <p>Calendars and objects returned by this class are tagged with their composite
 * identifiers. Items hidden because their backend cannot delete them are left out of
 * listings and reported as {@link FailureReason#NOT_FOUND} by direct lookups.
 *
 * <p>Every object returned or stored is recorded in the {@link UidIndex}, so that
 * {@link #findObjectByUid(String)} can resolve it later; deleting or hiding an object
 * evicts its entry.
 *
 * <p>This class is thread-safe as long as its collaborators are.
 *
 * @see MergeEngine
 */
public final class CalendarDispatcher {
  private static final Logger logger = Logger.getLogger(CalendarDispatcher.class.getName());

  private final BackendRegistry registry;
  private final CapabilityNegotiator negotiator;
  private final CalendarCache cache;
  private final HiddenItemStore hiddenItems;
  private final UidIndex uidIndex;
  private final LogSink logSink;
  private final MetricsExporter metrics;

  private CalendarDispatcher(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.negotiator = new CapabilityNegotiator(registry);
    this.cache = builder.cache != null ? builder.cache : CalendarCache.NONE;
    this.hiddenItems = builder.hiddenItems != null ? builder.hiddenItems : new InMemoryHiddenItemStore();
    this.uidIndex = builder.uidIndex != null ? builder.uidIndex : new InMemoryUidIndex();
    this.logSink = builder.logSink != null ? builder.logSink : LogSink.JUL;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns {@code true} if the activated backend named {@code backendName} implements
   * {@code action} natively.
   */
  public boolean supports(String backendName, BackendAction action) {
    return negotiator.supports(backendName, action);
  }

  // ---------------------------------------------------------------- calendars

  /**
   * Lists every calendar of {@code userId} across all activated backends.
   */
  public List<Calendar> listCalendars(String userId) {
    return listCalendars(userId, CalendarFilter.all());
  }

  /**
   * Lists calendars of {@code userId}, backend by backend.
   *
   * <p>Backends are consulted in the filter's subset order, or in activation order without
   * a subset. Names in the subset that match no activated backend are skipped and logged. A
   * backend that fails while listing is skipped as well. Within one backend the backend's
   * own order is kept.
   *
   * @param userId the user id
   * @param filter active, writable and backend filters
   * @return tagged calendars, never {@code null}
   */
  public List<Calendar> listCalendars(String userId, CalendarFilter filter) {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(filter, "filter");
    List<String> names = filter.backends()
        .<List<String>>map(ArrayList::new)
        .orElseGet(registry::listActivatedNames);
    List<Calendar> result = new ArrayList<>();
    for (String name : names) {
      Optional<CalendarBackend> backend = registry.find(name);
      if (backend.isEmpty()) {
        backendNotFound(name);
        continue;
      }
      try {
        result.addAll(calendarsOf(name, backend.get(), userId, filter));
      } catch (RuntimeException e) {
        metrics.incrementBackendFailure(null);
        logger.log(Level.WARNING, "Backend " + name + " failed to list calendars of "
            + userId + "; skipping it", e);
      }
    }
    return Collections.unmodifiableList(result);
  }

  private List<Calendar> calendarsOf(String name, CalendarBackend backend, String userId,
      CalendarFilter filter) {
    List<Calendar> result = new ArrayList<>();
    for (Calendar calendar : backend.getCalendars(userId)) {
      if (filter.activeOnly() && !calendar.active()) {
        continue;
      }
      if (filter.writableOnly() && !backend.isCalendarWritableByUser(calendar.uri(), userId)) {
        continue;
      }
      Calendar tagged = calendar.tag(name);
      if (!hiddenItems.isCalendarHidden(ObjectId.encode(name, calendar.uri()))) {
        result.add(tagged);
      }
    }
    return result;
  }

  /**
   * Looks up a calendar, trusting the {@link CalendarCache} when it holds a fresh entry.
   *
   * @param calendarId composite calendar identifier
   * @return the tagged calendar, or a failure
   * @throws calendar.MalformedIdentifierException if {@code calendarId} is not a calendar identifier
   */
  public OperationResult<Calendar> getCalendar(String calendarId) {
    ObjectId id = ObjectId.decodeCalendar(calendarId);
    OperationResult<Boolean> hidden = calendarHidden(id);
    if (!hidden.isSuccess()) {
      return hidden.asFailure();
    }
    if (hidden.orElseThrow()) {
      return notFound("Calendar", id);
    }
    Optional<Calendar> cached = cache.lookup(id.toString());
    if (cached.isPresent() && !cache.isStale(id.toString())) {
      return OperationResult.success(cached.get());
    }
    OperationResult<CalendarBackend> backend = backendFor(id);
    if (!backend.isSuccess()) {
      return backend.asFailure();
    }
    return lookupCalendar(backend.orElseThrow(), id);
  }

  /**
   * Creates a calendar in the named backend.
   *
   * @param backendName canonical backend name
   * @param calendar    the calendar to create
   * @return the stored, tagged calendar
   * @throws calendar.InvalidSegmentException if the backend name or URI cannot form an identifier
   */
  public OperationResult<Calendar> createCalendar(String backendName, Calendar calendar) {
    Objects.requireNonNull(calendar, "calendar");
    ObjectId id = ObjectId.of(backendName, calendar.uri());
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    if (negotiator.negotiate(backend, BackendAction.CREATE_CALENDAR) != Negotiation.DELEGATE) {
      return unsupported(id, BackendAction.CREATE_CALENDAR);
    }
    OperationResult<Calendar> created = invoke(id, BackendAction.CREATE_CALENDAR,
        () -> backend.createCalendar(calendar));
    if (!created.isSuccess()) {
      return created;
    }
    metrics.incrementDelegated(BackendAction.CREATE_CALENDAR);
    return OperationResult.success(created.orElseThrow().tag(id.backend()));
  }

  /**
   * Replaces the stored state of an existing calendar.
   *
   * @param calendarId composite calendar identifier
   * @param calendar   the new state; its URI must match the identifier
   * @return the stored, tagged calendar
   */
  public OperationResult<Calendar> editCalendar(String calendarId, Calendar calendar) {
    Objects.requireNonNull(calendar, "calendar");
    ObjectId id = ObjectId.decodeCalendar(calendarId);
    if (!id.calendar().equals(calendar.uri())) {
      throw new IllegalArgumentException("Calendar URI " + calendar.uri()
          + " does not match identifier " + calendarId);
    }
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<Calendar> existing = lookupCalendar(backend, id);
    if (!existing.isSuccess()) {
      return existing;
    }
    if (negotiator.negotiate(backend, BackendAction.EDIT_CALENDAR) != Negotiation.DELEGATE) {
      return unsupported(id, BackendAction.EDIT_CALENDAR);
    }
    OperationResult<Calendar> edited = invoke(id, BackendAction.EDIT_CALENDAR,
        () -> backend.editCalendar(calendar));
    if (!edited.isSuccess()) {
      return edited;
    }
    metrics.incrementDelegated(BackendAction.EDIT_CALENDAR);
    return OperationResult.success(edited.orElseThrow().tag(id.backend()));
  }

  /**
   * Deletes a calendar, hiding it when the backend cannot delete.
   *
   * <p>Either way the calendar disappears from later listings and lookups.
   *
   * @param calendarId composite calendar identifier
   * @return success, or a failure if the calendar does not exist or the backend failed
   */
  public OperationResult<Void> deleteCalendar(String calendarId) {
    ObjectId id = ObjectId.decodeCalendar(calendarId);
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<Calendar> existing = lookupCalendar(backend, id);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    Negotiation negotiation = negotiator.negotiate(backend, BackendAction.DELETE_CALENDAR);
    if (negotiation == Negotiation.DELEGATE) {
      OperationResult<Boolean> deleted = invoke(id, BackendAction.DELETE_CALENDAR,
          () -> backend.deleteCalendar(id.calendar()));
      if (!deleted.isSuccess()) {
        return deleted.asFailure();
      }
      if (!deleted.orElseThrow()) {
        return notFound("Calendar", id);
      }
      metrics.incrementDelegated(BackendAction.DELETE_CALENDAR);
      return OperationResult.done();
    }
    logger.log(Level.FINE, "Backend {0} cannot delete calendars; hiding {1}",
        new Object[]{id.backend(), id});
    OperationResult<Void> hidden = updateStore(id, "hide",
        () -> hiddenItems.hideCalendar(id.toString()));
    if (!hidden.isSuccess()) {
      return hidden;
    }
    metrics.incrementEmulated(BackendAction.DELETE_CALENDAR);
    return OperationResult.done();
  }

  /**
   * Marks a calendar modified without changing its content.
   *
   * @param calendarId composite calendar identifier
   */
  public OperationResult<Void> touchCalendar(String calendarId) {
    ObjectId id = ObjectId.decodeCalendar(calendarId);
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<Boolean> hidden = calendarHidden(id);
    if (!hidden.isSuccess()) {
      return hidden.asFailure();
    }
    if (hidden.orElseThrow()) {
      return notFound("Calendar", id);
    }
    if (negotiator.negotiate(backend, BackendAction.TOUCH_CALENDAR) != Negotiation.DELEGATE) {
      return unsupported(id, BackendAction.TOUCH_CALENDAR);
    }
    OperationResult<Boolean> touched = invoke(id, BackendAction.TOUCH_CALENDAR,
        () -> backend.touchCalendar(id.calendar()));
    if (!touched.isSuccess()) {
      return touched.asFailure();
    }
    if (!touched.orElseThrow()) {
      return notFound("Calendar", id);
    }
    metrics.incrementDelegated(BackendAction.TOUCH_CALENDAR);
    return OperationResult.done();
  }

  /**
   * Merges {@code sourceId} into {@code destinationId} with the backend's native merge.
   *
   * <p>Both calendars must live in the same backend and that backend must support
   * {@link BackendAction#MERGE_CALENDAR}; anything else is reported unsupported. A source
   * holding hidden objects is reported unsupported as well, since the backend knows nothing
   * of them. {@link MergeEngine} falls back to object-by-object emulation.
   *
   * @return the number of objects moved
   */
  public OperationResult<Integer> mergeCalendar(String destinationId, String sourceId) {
    ObjectId destination = ObjectId.decodeCalendar(destinationId);
    ObjectId source = ObjectId.decodeCalendar(sourceId);
    if (destination.equals(source)) {
      throw new IllegalArgumentException("Cannot merge calendar " + sourceId + " into itself");
    }
    OperationResult<CalendarBackend> resolved = backendFor(source);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    if (!source.backend().equals(destination.backend())) {
      return unsupported(source, BackendAction.MERGE_CALENDAR);
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<Calendar> existing = lookupCalendar(backend, source);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    existing = lookupCalendar(backend, destination);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    if (!negotiator.supports(backend, BackendAction.MERGE_CALENDAR)) {
      return unsupported(source, BackendAction.MERGE_CALENDAR);
    }
    OperationResult<Boolean> holdsHidden = holdsHiddenObjects(backend, source);
    if (!holdsHidden.isSuccess()) {
      return holdsHidden.asFailure();
    }
    if (holdsHidden.orElseThrow()) {
      // the backend would carry them into the destination under identifiers nobody hid
      return unsupported(source, BackendAction.MERGE_CALENDAR);
    }
    OperationResult<Integer> merged = invoke(source, BackendAction.MERGE_CALENDAR,
        () -> backend.mergeCalendar(destination.calendar(), source.calendar()));
    if (merged.isSuccess()) {
      metrics.incrementDelegated(BackendAction.MERGE_CALENDAR);
    }
    return merged;
  }

  /**
   * Returns {@code true} if {@link #mergeCalendar(String, String)} would delegate: both
   * calendars share an activated backend that merges natively and the source holds no
   * hidden objects.
   *
   * @param destinationId composite identifier of the destination calendar
   * @param sourceId      composite identifier of the source calendar
   */
  public boolean canMergeNatively(String destinationId, String sourceId) {
    ObjectId destination = ObjectId.decodeCalendar(destinationId);
    ObjectId source = ObjectId.decodeCalendar(sourceId);
    if (!source.backend().equals(destination.backend())) {
      return false;
    }
    Optional<CalendarBackend> backend = registry.find(source.backend());
    if (backend.isEmpty() || !negotiator.supports(backend.get(), BackendAction.MERGE_CALENDAR)) {
      return false;
    }
    OperationResult<Boolean> holdsHidden = holdsHiddenObjects(backend.get(), source);
    return holdsHidden.isSuccess() && !holdsHidden.orElseThrow();
  }

  // ---------------------------------------------------------------- objects

  /**
   * Lists every visible object of a calendar.
   *
   * @param calendarId composite calendar identifier
   * @return tagged objects in backend order
   */
  public OperationResult<List<CalendarObject>> listObjects(String calendarId) {
    ObjectId id = ObjectId.decodeCalendar(calendarId);
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<Calendar> existing = lookupCalendar(backend, id);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    OperationResult<List<CalendarObject>> objects = invoke(id, null,
        () -> backend.getObjects(id.calendar()));
    if (!objects.isSuccess()) {
      return objects;
    }
    return visible(id, objects.orElseThrow());
  }

  /**
   * Lists the visible objects of a calendar whose time bounds intersect
   * {@code [start, end]}, both ends inclusive.
   *
   * <p>Delegates to the backend when it supports {@link BackendAction#GET_IN_PERIOD};
   * otherwise fetches every object and filters locally. Objects without a start are
   * never part of a period.
   *
   * @param calendarId composite calendar identifier
   * @param start      period start
   * @param end        period end, not before {@code start}
   * @return tagged objects in backend order
   */
  public OperationResult<List<CalendarObject>> listObjectsInPeriod(String calendarId,
      Instant start, Instant end) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start " + start + " is after end " + end);
    }
    ObjectId id = ObjectId.decodeCalendar(calendarId);
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<Calendar> existing = lookupCalendar(backend, id);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    if (negotiator.negotiate(backend, BackendAction.GET_IN_PERIOD) == Negotiation.DELEGATE) {
      OperationResult<List<CalendarObject>> objects = invoke(id, BackendAction.GET_IN_PERIOD,
          () -> backend.getInPeriod(id.calendar(), start, end));
      if (!objects.isSuccess()) {
        return objects;
      }
      metrics.incrementDelegated(BackendAction.GET_IN_PERIOD);
      return visible(id, objects.orElseThrow());
    }
    logger.log(Level.FINE, "Backend {0} cannot list periods; filtering {1} locally",
        new Object[]{id.backend(), id});
    OperationResult<List<CalendarObject>> all = invoke(id, BackendAction.GET_IN_PERIOD,
        () -> backend.getObjects(id.calendar()));
    if (!all.isSuccess()) {
      return all;
    }
    List<CalendarObject> inPeriod = new ArrayList<>();
    for (CalendarObject object : all.orElseThrow()) {
      if (object.overlaps(start, end)) {
        inPeriod.add(object);
      }
    }
    metrics.incrementEmulated(BackendAction.GET_IN_PERIOD);
    return visible(id, inPeriod);
  }

  /**
   * Looks up one object.
   *
   * @param objectId composite object identifier
   * @return the tagged object, or a failure
   * @throws calendar.MalformedIdentifierException if {@code objectId} is not an object identifier
   */
  public OperationResult<CalendarObject> findObject(String objectId) {
    ObjectId id = ObjectId.decodeObject(objectId);
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    OperationResult<CalendarObject> found = lookupObject(resolved.orElseThrow(), id);
    found.value().ifPresent(object ->
        updateIndex(object.uid(), () -> uidIndex.put(object.uid(), id.toString())));
    return found;
  }

  /**
   * Looks up an object by bare UID through the {@link UidIndex}.
   *
   * <p>An index entry whose object no longer exists is evicted.
   *
   * @param uid the object UID
   * @return the tagged object, {@link FailureReason#UID_NOT_INDEXED} if the UID was never
   *     observed, or the failure of the underlying lookup
   */
  public OperationResult<CalendarObject> findObjectByUid(String uid) {
    Objects.requireNonNull(uid, "uid");
    Optional<String> indexed;
    try {
      indexed = uidIndex.lookup(uid);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "UID index failed to look up " + uid, e);
      return OperationResult.failure(FailureReason.BACKEND_OPERATION_FAILED,
          "UID index lookup failed for " + uid + ": " + e.getMessage());
    }
    if (indexed.isEmpty()) {
      String message = "UID not indexed: " + uid;
      logSink.record(LogSink.CATEGORY_LOOKUP, message, Level.FINE);
      return OperationResult.failure(FailureReason.UID_NOT_INDEXED, message);
    }
    String objectId = indexed.get();
    OperationResult<CalendarObject> found = findObject(objectId);
    if (found.failureReason().filter(reason -> reason == FailureReason.NOT_FOUND).isPresent()) {
      updateIndex(uid, () -> uidIndex.remove(uid, objectId));
    }
    return found;
  }

  /**
   * Stores a new object in a calendar.
   *
   * @param calendarId composite calendar identifier
   * @param object     the object to store
   * @return the stored, tagged object
   */
  public OperationResult<CalendarObject> createObject(String calendarId, CalendarObject object) {
    Objects.requireNonNull(object, "object");
    ObjectId id = ObjectId.decodeCalendar(calendarId);
    ObjectId target = id.withObject(object.uid());
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<Calendar> existing = lookupCalendar(backend, id);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    if (negotiator.negotiate(backend, BackendAction.CREATE_OBJECT) != Negotiation.DELEGATE) {
      return unsupported(target, BackendAction.CREATE_OBJECT);
    }
    OperationResult<CalendarObject> created = invoke(target, BackendAction.CREATE_OBJECT,
        () -> backend.createObject(id.calendar(), object));
    if (!created.isSuccess()) {
      return created;
    }
    metrics.incrementDelegated(BackendAction.CREATE_OBJECT);
    return OperationResult.success(indexed(id, created.orElseThrow()));
  }

  /**
   * Replaces an existing object.
   *
   * @param objectId composite object identifier
   * @param object   the new state; its UID must match the identifier
   * @return the stored, tagged object
   */
  public OperationResult<CalendarObject> editObject(String objectId, CalendarObject object) {
    Objects.requireNonNull(object, "object");
    ObjectId id = ObjectId.decodeObject(objectId);
    if (!id.uid().equals(object.uid())) {
      throw new IllegalArgumentException("Object UID " + object.uid()
          + " does not match identifier " + objectId);
    }
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<CalendarObject> existing = lookupObject(backend, id);
    if (!existing.isSuccess()) {
      return existing;
    }
    if (negotiator.negotiate(backend, BackendAction.EDIT_OBJECT) != Negotiation.DELEGATE) {
      return unsupported(id, BackendAction.EDIT_OBJECT);
    }
    OperationResult<CalendarObject> edited = invoke(id, BackendAction.EDIT_OBJECT,
        () -> backend.editObject(id.calendar(), object));
    if (!edited.isSuccess()) {
      return edited;
    }
    metrics.incrementDelegated(BackendAction.EDIT_OBJECT);
    return OperationResult.success(indexed(ObjectId.of(id.backend(), id.calendar()), edited.orElseThrow()));
  }

  /**
   * Deletes an object, hiding it when the backend cannot delete.
   *
   * @param objectId composite object identifier
   */
  public OperationResult<Void> deleteObject(String objectId) {
    ObjectId id = ObjectId.decodeObject(objectId);
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<CalendarObject> existing = lookupObject(backend, id);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    Negotiation negotiation = negotiator.negotiate(backend, BackendAction.DELETE_OBJECT);
    if (negotiation == Negotiation.DELEGATE) {
      OperationResult<Boolean> deleted = invoke(id, BackendAction.DELETE_OBJECT,
          () -> backend.deleteObject(id.calendar(), id.uid()));
      if (!deleted.isSuccess()) {
        return deleted.asFailure();
      }
      updateIndex(id.uid(), () -> uidIndex.remove(id.uid(), id.toString()));
      if (!deleted.orElseThrow()) {
        return notFound("Object", id);
      }
      metrics.incrementDelegated(BackendAction.DELETE_OBJECT);
      return OperationResult.done();
    }
    logger.log(Level.FINE, "Backend {0} cannot delete objects; hiding {1}",
        new Object[]{id.backend(), id});
    OperationResult<Void> hidden = updateStore(id, "hide",
        () -> hiddenItems.hideObject(id.toString()));
    if (!hidden.isSuccess()) {
      return hidden;
    }
    updateIndex(id.uid(), () -> uidIndex.remove(id.uid(), id.toString()));
    metrics.incrementEmulated(BackendAction.DELETE_OBJECT);
    return OperationResult.done();
  }

  /**
   * Marks an object modified without changing its content.
   *
   * @param objectId composite object identifier
   */
  public OperationResult<Void> touchObject(String objectId) {
    ObjectId id = ObjectId.decodeObject(objectId);
    OperationResult<CalendarBackend> resolved = backendFor(id);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<CalendarObject> existing = lookupObject(backend, id);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    if (negotiator.negotiate(backend, BackendAction.TOUCH_OBJECT) != Negotiation.DELEGATE) {
      return unsupported(id, BackendAction.TOUCH_OBJECT);
    }
    OperationResult<Boolean> touched = invoke(id, BackendAction.TOUCH_OBJECT,
        () -> backend.touchObject(id.calendar(), id.uid()));
    if (!touched.isSuccess()) {
      return touched.asFailure();
    }
    if (!touched.orElseThrow()) {
      return notFound("Object", id);
    }
    metrics.incrementDelegated(BackendAction.TOUCH_OBJECT);
    return OperationResult.done();
  }

  /**
   * Moves an object with the backend's native move.
   *
   * <p>Source and destination must live in the same backend and that backend must support
   * {@link BackendAction#MOVE_OBJECT}; anything else is reported unsupported.
   * {@link MergeEngine#moveObject(String, String)} falls back to create and delete.
   *
   * @param objectId              composite object identifier
   * @param destinationCalendarId composite identifier of the destination calendar
   * @return the object's new composite identifier
   */
  public OperationResult<String> moveObject(String objectId, String destinationCalendarId) {
    ObjectId source = ObjectId.decodeObject(objectId);
    ObjectId destination = ObjectId.decodeCalendar(destinationCalendarId);
    if (source.calendarId().equals(destination.toString())) {
      throw new IllegalArgumentException("Object " + objectId + " is already in " + destinationCalendarId);
    }
    OperationResult<CalendarBackend> resolved = backendFor(source);
    if (!resolved.isSuccess()) {
      return resolved.asFailure();
    }
    if (!source.backend().equals(destination.backend())) {
      return unsupported(source, BackendAction.MOVE_OBJECT);
    }
    CalendarBackend backend = resolved.orElseThrow();
    OperationResult<CalendarObject> existing = lookupObject(backend, source);
    if (!existing.isSuccess()) {
      return existing.asFailure();
    }
    OperationResult<Calendar> target = lookupCalendar(backend, destination);
    if (!target.isSuccess()) {
      return target.asFailure();
    }
    if (!negotiator.supports(backend, BackendAction.MOVE_OBJECT)) {
      return unsupported(source, BackendAction.MOVE_OBJECT);
    }
    OperationResult<Boolean> moved = invoke(source, BackendAction.MOVE_OBJECT,
        () -> backend.moveObject(source.calendar(), source.uid(), destination.calendar()));
    if (!moved.isSuccess()) {
      return moved.asFailure();
    }
    if (!moved.orElseThrow()) {
      return notFound("Object", source);
    }
    String movedId = destination.withObject(source.uid()).toString();
    updateIndex(source.uid(), () -> uidIndex.put(source.uid(), movedId));
    metrics.incrementDelegated(BackendAction.MOVE_OBJECT);
    return OperationResult.success(movedId);
  }

  // ---------------------------------------------------------------- helpers

  private OperationResult<CalendarBackend> backendFor(ObjectId id) {
    Optional<CalendarBackend> backend = registry.find(id.backend());
    if (backend.isEmpty()) {
      return backendNotFound(id.backend());
    }
    return OperationResult.success(backend.get());
  }

  private <T> OperationResult<T> backendNotFound(String name) {
    metrics.incrementBackendNotFound();
    String message = "Backend not found: " + name;
    logSink.record(LogSink.CATEGORY_BACKEND, message, Level.WARNING);
    return OperationResult.failure(FailureReason.BACKEND_NOT_FOUND, message);
  }

  private <T> OperationResult<T> unsupported(ObjectId id, BackendAction action) {
    metrics.incrementUnsupported(action);
    String message = "Backend " + id.backend() + " does not support " + action + " for " + id;
    logSink.record(LogSink.CATEGORY_OPERATION, message, Level.INFO);
    return OperationResult.failure(FailureReason.UNSUPPORTED_OPERATION, message);
  }

  private <T> OperationResult<T> notFound(String kind, ObjectId id) {
    String message = kind + " not found: " + id;
    logSink.record(LogSink.CATEGORY_LOOKUP, message, Level.FINE);
    return OperationResult.failure(FailureReason.NOT_FOUND, message);
  }

  private <T> OperationResult<T> invoke(ObjectId id, BackendAction action, Supplier<T> call) {
    try {
      return OperationResult.success(call.get());
    } catch (RuntimeException e) {
      metrics.incrementBackendFailure(action);
      String operation = action == null ? "read" : action.name();
      logger.log(Level.WARNING, "Backend " + id.backend() + " failed " + operation + " on " + id, e);
      return OperationResult.failure(FailureReason.BACKEND_OPERATION_FAILED,
          operation + " failed on " + id + ": " + e.getMessage());
    }
  }

  private OperationResult<Calendar> lookupCalendar(CalendarBackend backend, ObjectId id) {
    OperationResult<Boolean> hidden = calendarHidden(id);
    if (!hidden.isSuccess()) {
      return hidden.asFailure();
    }
    if (hidden.orElseThrow()) {
      return notFound("Calendar", id);
    }
    OperationResult<Optional<Calendar>> found = invoke(id, null,
        () -> backend.findCalendar(id.calendar()));
    if (!found.isSuccess()) {
      return found.asFailure();
    }
    Optional<Calendar> calendar = found.orElseThrow();
    if (calendar.isEmpty()) {
      return notFound("Calendar", id);
    }
    return OperationResult.success(calendar.get().tag(id.backend()));
  }

  private OperationResult<CalendarObject> lookupObject(CalendarBackend backend, ObjectId id) {
    OperationResult<Boolean> hidden = consultStore(id, "hidden check",
        () -> hiddenItems.isCalendarHidden(id.calendarId()) || hiddenItems.isObjectHidden(id.toString()));
    if (!hidden.isSuccess()) {
      return hidden.asFailure();
    }
    if (hidden.orElseThrow()) {
      return notFound("Object", id);
    }
    OperationResult<Optional<CalendarObject>> found = invoke(id, null,
        () -> backend.findObject(id.calendar(), id.uid()));
    if (!found.isSuccess()) {
      return found.asFailure();
    }
    Optional<CalendarObject> object = found.orElseThrow();
    if (object.isEmpty()) {
      return notFound("Object", id);
    }
    return OperationResult.success(object.get().tag(id.backend(), id.calendar()));
  }

  private OperationResult<Boolean> calendarHidden(ObjectId id) {
    return consultStore(id, "hidden check", () -> hiddenItems.isCalendarHidden(id.toString()));
  }

  private OperationResult<Boolean> holdsHiddenObjects(CalendarBackend backend, ObjectId calendarId) {
    OperationResult<List<CalendarObject>> objects = invoke(calendarId, null,
        () -> backend.getObjects(calendarId.calendar()));
    if (!objects.isSuccess()) {
      return objects.asFailure();
    }
    List<String> objectIds = new ArrayList<>();
    for (CalendarObject object : objects.orElseThrow()) {
      objectIds.add(calendarId.withObject(object.uid()).toString());
    }
    return consultStore(calendarId, "hidden check",
        () -> !hiddenItems.hiddenObjects(objectIds).isEmpty());
  }

  private OperationResult<List<CalendarObject>> visible(ObjectId calendarId,
      List<CalendarObject> objects) {
    Map<String, CalendarObject> byId = new LinkedHashMap<>();
    for (CalendarObject object : objects) {
      byId.put(calendarId.withObject(object.uid()).toString(), object);
    }
    OperationResult<Set<String>> hidden = consultStore(calendarId, "hidden check",
        () -> hiddenItems.hiddenObjects(byId.keySet()));
    if (!hidden.isSuccess()) {
      return hidden.asFailure();
    }
    List<CalendarObject> result = new ArrayList<>(byId.size());
    Map<String, String> entries = new LinkedHashMap<>();
    for (Map.Entry<String, CalendarObject> entry : byId.entrySet()) {
      if (!hidden.orElseThrow().contains(entry.getKey())) {
        CalendarObject tagged = entry.getValue().tag(calendarId.backend(), calendarId.calendar());
        entries.put(tagged.uid(), entry.getKey());
        result.add(tagged);
      }
    }
    if (!entries.isEmpty()) {
      updateIndex(calendarId.toString(), () -> uidIndex.putAll(entries));
    }
    return OperationResult.success(Collections.unmodifiableList(result));
  }

  private CalendarObject indexed(ObjectId calendarId, CalendarObject object) {
    CalendarObject tagged = object.tag(calendarId.backend(), calendarId.calendar());
    updateIndex(tagged.uid(), () -> uidIndex.put(tagged.uid(), tagged.objectId().orElseThrow()));
    return tagged;
  }

  private <T> OperationResult<T> consultStore(ObjectId id, String operation, Supplier<T> call) {
    try {
      return OperationResult.success(call.get());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Hidden-item store failed " + operation + " for " + id, e);
      return OperationResult.failure(FailureReason.BACKEND_OPERATION_FAILED,
          operation + " failed for " + id + ": " + e.getMessage());
    }
  }

  private OperationResult<Void> updateStore(ObjectId id, String operation, Runnable call) {
    return consultStore(id, operation, () -> {
      call.run();
      return null;
    });
  }

  // index failures never fail the operation; later observations repopulate it
  private void updateIndex(String key, Runnable update) {
    try {
      update.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "UID index update failed for " + key, e);
    }
  }

  /**
   * Builder for {@link CalendarDispatcher}.
   */
  public static final class Builder {
    private BackendRegistry registry;
    private CalendarCache cache;
    private HiddenItemStore hiddenItems;
    private UidIndex uidIndex;
    private LogSink logSink;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the registry backends are resolved from.
     *
     * <p><b>Required.</b>
     *
     * @param registry the backend registry
     * @return this builder
     */
    public Builder registry(BackendRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the cache gate consulted by {@link #getCalendar(String)}.
     *
     * <p>Optional. Defaults to {@link CalendarCache#NONE}.
     *
     * @param cache the cache gate
     * @return this builder
     */
    public Builder cache(CalendarCache cache) {
      this.cache = cache;
      return this;
    }

    /**
     * Sets the store recording calendars and objects hidden instead of deleted.
     *
     * <p>Optional. Defaults to an {@link InMemoryHiddenItemStore}.
     *
     * @param hiddenItems the hidden-item store
     * @return this builder
     */
    public Builder hiddenItems(HiddenItemStore hiddenItems) {
      this.hiddenItems = hiddenItems;
      return this;
    }

    /**
     * Sets the UID index.
     *
     * <p>Optional. Defaults to an {@link InMemoryUidIndex}.
     *
     * @param uidIndex the UID index
     * @return this builder
     */
    public Builder uidIndex(UidIndex uidIndex) {
      this.uidIndex = uidIndex;
      return this;
    }

    /**
     * Sets the sink for unknown-backend, unsupported and not-found diagnostics.
     *
     * <p>Optional. Defaults to {@link LogSink#JUL}.
     *
     * @param logSink the log sink
     * @return this builder
     */
    public Builder logSink(LogSink logSink) {
      this.logSink = logSink;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public CalendarDispatcher build() {
      return new CalendarDispatcher(this);
    }
  }
}
