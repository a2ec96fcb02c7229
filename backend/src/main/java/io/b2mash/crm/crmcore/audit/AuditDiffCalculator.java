package io.b2mash.crm.crmcore.audit;

import io.b2mash.crm.crmcore.repository.JsonColumnMapper;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Builds audit payloads from entity snapshots. Entities are flattened to their JSON field maps, so
 * comparison happens on serialized values.
 */
@Component
public class AuditDiffCalculator {

  /** Identity and bookkeeping fields that change on every write and carry no business data. */
  static final Set<String> EXCLUDED_FIELDS =
      Set.of("id", "createdAt", "createdBy", "updatedAt", "updatedBy");

  private final JsonColumnMapper json;

  public AuditDiffCalculator(JsonColumnMapper json) {
    this.json = json;
  }

  public Map<String, Object> snapshot(Object entity) {
    return json.toFieldMap(entity);
  }

  /**
   * Returns {@code {field: {"before": x, "after": y}}} for every non-metadata field whose value
   * differs. An empty map means nothing observable changed.
   */
  public Map<String, Object> diff(Object before, Object after) {
    return diffFields(snapshot(before), snapshot(after));
  }

  static Map<String, Object> diffFields(Map<String, Object> before, Map<String, Object> after) {
    var keys = new LinkedHashSet<String>(before.keySet());
    keys.addAll(after.keySet());
    keys.removeAll(EXCLUDED_FIELDS);

    var changes = new LinkedHashMap<String, Object>();
    for (String key : keys) {
      Object oldValue = before.get(key);
      Object newValue = after.get(key);
      if (!Objects.equals(oldValue, newValue)) {
        // LinkedHashMap rather than Map.of: either side may be null
        var change = new LinkedHashMap<String, Object>();
        change.put("before", oldValue);
        change.put("after", newValue);
        changes.put(key, change);
      }
    }
    return changes;
  }
}
