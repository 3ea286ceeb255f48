package com.flamingo.ai.corpusindex.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.corpusindex.domain.model.DocumentSection;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Persists a document's ordered section list as a JSON array of objects. */
@Converter
public class DocumentSectionListConverter extends JsonAttributeConverter<List<DocumentSection>> {

  public DocumentSectionListConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected List<DocumentSection> emptyValue() {
    return new ArrayList<>();
  }

  @Override
  protected boolean isEmpty(List<DocumentSection> attribute) {
    return attribute.isEmpty();
  }
}
