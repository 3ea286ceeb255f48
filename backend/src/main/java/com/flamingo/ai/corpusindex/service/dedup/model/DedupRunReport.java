package com.flamingo.ai.corpusindex.service.dedup.model;

import com.flamingo.ai.corpusindex.service.PipelineRunSummary;
import java.util.List;

/**
 * Outcome of a dedup run.
 *
 * @param passes per-pass counts, in run order
 * @param detectOnly whether links were only reported
 * @param summary run totals
 */
public record DedupRunReport(
    List<DedupPassReport> passes, boolean detectOnly, PipelineRunSummary summary) {}
