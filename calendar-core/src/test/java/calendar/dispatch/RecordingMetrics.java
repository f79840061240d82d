package calendar.dispatch;

import calendar.spi.BackendAction;
import calendar.spi.MetricsExporter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

class RecordingMetrics implements MetricsExporter {
  final Map<BackendAction, AtomicInteger> delegated = new ConcurrentHashMap<>();
  final Map<BackendAction, AtomicInteger> emulated = new ConcurrentHashMap<>();
  final Map<BackendAction, AtomicInteger> unsupported = new ConcurrentHashMap<>();
  final AtomicInteger failures = new AtomicInteger();
  final AtomicInteger backendNotFound = new AtomicInteger();
  final List<Integer> mergedObjects = new CopyOnWriteArrayList<>();

  @Override
  public void incrementDelegated(BackendAction action) {
    delegated.computeIfAbsent(action, ignored -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public void incrementEmulated(BackendAction action) {
    emulated.computeIfAbsent(action, ignored -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public void incrementUnsupported(BackendAction action) {
    unsupported.computeIfAbsent(action, ignored -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public void incrementBackendFailure(BackendAction action) {
    failures.incrementAndGet();
  }

  @Override
  public void incrementBackendNotFound() {
    backendNotFound.incrementAndGet();
  }

  @Override
  public void recordMergedObjects(int count) {
    mergedObjects.add(count);
  }

  int emulated(BackendAction action) {
    AtomicInteger count = emulated.get(action);
    return count == null ? 0 : count.get();
  }

  int delegated(BackendAction action) {
    AtomicInteger count = delegated.get(action);
    return count == null ? 0 : count.get();
  }

  int unsupported(BackendAction action) {
    AtomicInteger count = unsupported.get(action);
    return count == null ? 0 : count.get();
  }
}
