package com.flamingo.ai.corpusindex.service.dedup.model;

import java.util.List;

/**
 * Which claim of a group survives.
 *
 * @param keptId highest quality claim, the root of the group
 * @param duplicateIds every other member, ascending id
 */
public record DuplicateResolution(long keptId, List<Long> duplicateIds) {}
