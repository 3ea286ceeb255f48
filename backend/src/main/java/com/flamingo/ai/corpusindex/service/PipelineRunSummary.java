package com.flamingo.ai.corpusindex.service;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of one batch pipeline run. Partial processing is the normal case, so a run reports counts
 * rather than a success flag.
 *
 * @param pipeline pipeline name, e.g. "index"
 * @param processed items fully processed
 * @param skipped items left out by a safe fallback (empty input, failed embedding, rejected vector)
 * @param errored items that failed with an error
 * @param details pipeline-specific counts, in insertion order
 * @param elapsed wall-clock duration of the run
 */
public record PipelineRunSummary(
    String pipeline,
    int processed,
    int skipped,
    int errored,
    Map<String, Integer> details,
    Duration elapsed) {

  public PipelineRunSummary {
    details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public int detail(String key) {
    return details.getOrDefault(key, 0);
  }

  /** Single log line, e.g. {@code [index] processed=10 skipped=1 errored=0 chunks=120 (3.2s)}. */
  public String summaryLine() {
    String extra =
        details.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(" "));
    return String.format(
        "[%s] processed=%d skipped=%d errored=%d%s (%.1fs)",
        pipeline,
        processed,
        skipped,
        errored,
        extra.isEmpty() ? "" : " " + extra,
        elapsed.toMillis() / 1000.0);
  }
}
