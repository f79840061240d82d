package calendar.dispatch;

import calendar.OperationResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link MergeEngine#mergeCalendars(String, String...)}, one entry per source
 * calendar in caller order. Sources that failed are not rolled back; objects already moved
 * stay in the destination.
 *
 * @param destinationId composite identifier of the destination calendar
 * @param sources       per-source outcomes
 */
public record MergeReport(String destinationId, List<SourceOutcome> sources) {

  public MergeReport {
    Objects.requireNonNull(destinationId, "destinationId");
    sources = List.copyOf(sources);
  }

  /** Returns {@code true} when every source was merged and removed. */
  public boolean isSuccess() {
    return sources.stream().allMatch(source -> source.result().isSuccess());
  }

  /** Returns the total number of objects moved into the destination. */
  public int objectsMoved() {
    return sources.stream().mapToInt(SourceOutcome::objectsMoved).sum();
  }

  /**
   * How a source was merged.
   */
  public enum Mode {
    /** Handed to the backend's native merge. */
    DELEGATED,
    /** Moved object by object, then deleted (or hidden). */
    EMULATED
  }

  /**
   * @param sourceId     composite identifier of the source calendar
   * @param mode         how the merge was carried out
   * @param objectsMoved objects that reached the destination, also on failure
   * @param result       success, or the failure that stopped this source
   */
  public record SourceOutcome(String sourceId, Mode mode, int objectsMoved,
      OperationResult<Void> result) {
    public SourceOutcome {
      Objects.requireNonNull(sourceId, "sourceId");
      Objects.requireNonNull(mode, "mode");
      Objects.requireNonNull(result, "result");
    }
  }
}
