package com.flamingo.ai.corpusindex.domain.model;

/**
 * One entry of a document's ordered section list.
 *
 * @param heading section heading; {@code null} or blank for untitled leading text
 * @param text body text of the section
 * @param page page the section starts on, when the extractor knows it
 */
public record DocumentSection(String heading, String text, Integer page) {}
