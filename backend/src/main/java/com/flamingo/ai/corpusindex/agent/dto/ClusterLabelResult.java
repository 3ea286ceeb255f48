package com.flamingo.ai.corpusindex.agent.dto;

import java.util.List;

/** Structured output from ClusterLabelingAgent. */
public record ClusterLabelResult(
    String label, // 2-5 word topic name
    String description, // one or two sentences
    List<String> keywords // 3-5 keywords
    ) {}
