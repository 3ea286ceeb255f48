package com.flamingo.ai.corpusindex.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

/** Persists a centroid vector as a JSON number array. */
@Converter
public class FloatArrayConverter extends JsonAttributeConverter<float[]> {

  public FloatArrayConverter() {
    super(new TypeReference<>() {});
  }

  @Override
  protected float[] emptyValue() {
    return null;
  }

  @Override
  protected boolean isEmpty(float[] attribute) {
    return attribute.length == 0;
  }
}
