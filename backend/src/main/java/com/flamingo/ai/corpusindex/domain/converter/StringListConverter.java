package com.flamingo.ai.corpusindex.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Persists {@code List<String>} (authors, keywords) as a JSON array. */
@Converter
public class StringListConverter extends JsonAttributeConverter<List<String>> {

  public StringListConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected List<String> emptyValue() {
    return new ArrayList<>();
  }

  @Override
  protected boolean isEmpty(List<String> attribute) {
    return attribute.isEmpty();
  }
}
