package io.b2mash.crm.crmcore.repository;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/** Reads and writes {@code jsonb} column values as JSON text. */
@Component
public class JsonColumnMapper {

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public JsonColumnMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String write(Object value) {
    return value != null ? objectMapper.writeValueAsString(value) : null;
  }

  /** Returns the column as a mutable map; SQL {@code NULL} reads as an empty map. */
  public Map<String, Object> readMap(String json) {
    if (json == null) {
      return new LinkedHashMap<>();
    }
    return objectMapper.readValue(json, MAP_TYPE);
  }

  /** Returns the column as a map, keeping SQL {@code NULL} as {@code null}. */
  public Map<String, Object> readNullableMap(String json) {
    return json != null ? objectMapper.readValue(json, MAP_TYPE) : null;
  }

  public <T> T read(String json, Class<T> type) {
    return json != null ? objectMapper.readValue(json, type) : null;
  }

  /** Converts an entity into its flat field map, the form audit snapshots and diffs use. */
  public Map<String, Object> toFieldMap(Object entity) {
    return objectMapper.convertValue(entity, MAP_TYPE);
  }
}
