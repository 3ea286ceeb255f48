package com.flamingo.ai.corpusindex.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import lombok.extern.slf4j.Slf4j;

/**
 * Base JPA converter persisting a value as JSON in a TEXT column.
 *
 * <p>Unreadable column values map to {@link #emptyValue()} so one corrupt row does not fail a whole
 * batch read.
 *
 * @param <T> the attribute type
 */
@Slf4j
abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

  static final ObjectMapper MAPPER = new ObjectMapper();

  private final TypeReference<T> type;

  protected JsonAttributeConverter(TypeReference<T> type) {
    this.type = type;
  }

  /** Value returned for null or unreadable columns. */
  protected abstract T emptyValue();

  /** Whether the attribute should be stored as SQL NULL. */
  protected abstract boolean isEmpty(T attribute);

  @Override
  public String convertToDatabaseColumn(T attribute) {
    if (attribute == null || isEmpty(attribute)) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Failed to serialize " + getClass().getSimpleName() + " value", e);
    }
  }

  @Override
  public T convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return emptyValue();
    }
    try {
      return MAPPER.readValue(dbData, type);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize {} column: {}", getClass().getSimpleName(), e.getMessage());
      return emptyValue();
    }
  }
}
