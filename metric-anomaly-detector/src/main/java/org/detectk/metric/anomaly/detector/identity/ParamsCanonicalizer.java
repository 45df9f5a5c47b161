package org.detectk.metric.anomaly.detector.identity;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.detectk.metric.anomaly.datamodel.exception.ConfigurationException;
import org.detectk.metric.anomaly.detector.config.DetectorDefaults;
import org.detectk.metric.anomaly.detector.config.DetectorKind;

/**
 * Produces the canonical text form of detector parameters: values normalized (numbers compared by
 * magnitude, durations in ISO-8601, enums by label), keys equal to their default dropped, and the
 * remainder serialized as key-sorted JSON.
 */
public class ParamsCanonicalizer {
  private static final ObjectMapper CANONICAL_MAPPER =
      new ObjectMapper()
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

  private final DetectorDefaults defaults;

  public ParamsCanonicalizer(DetectorDefaults defaults) {
    this.defaults = defaults;
  }

  public DetectorDefaults getDefaults() {
    return defaults;
  }

  public SortedMap<String, Object> canonicalize(DetectorKind kind, Map<String, Object> params) {
    Map<String, Object> kindDefaults = defaults.forKind(kind);
    SortedMap<String, Object> canonical = new TreeMap<>();
    params.forEach(
        (key, value) -> {
          if (value == null) {
            return;
          }
          Object normalized = normalize(value);
          Object defaultValue = kindDefaults.get(key);
          if (defaultValue != null && Objects.equals(normalized, normalize(defaultValue))) {
            return;
          }
          canonical.put(key, normalized);
        });
    return canonical;
  }

  public String toCanonicalJson(DetectorKind kind, Map<String, Object> params) {
    try {
      return CANONICAL_MAPPER.writeValueAsString(canonicalize(kind, params));
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Unable to serialize detector params: " + params, e);
    }
  }

  static Object normalize(Object value) {
    if (value instanceof Number) {
      BigDecimal decimal = new BigDecimal(value.toString()).stripTrailingZeros();
      // BigDecimal equality is scale sensitive, keep zero in one form
      return decimal.signum() == 0 ? BigDecimal.ZERO : decimal;
    }
    if (value instanceof Duration) {
      return value.toString();
    }
    if (value instanceof Enum) {
      return ((Enum<?>) value).name().toLowerCase();
    }
    if (value instanceof List) {
      List<Object> normalized = new ArrayList<>();
      for (Object item : (List<?>) value) {
        normalized.add(normalize(item));
      }
      return normalized;
    }
    if (value instanceof Map) {
      SortedMap<String, Object> normalized = new TreeMap<>();
      ((Map<?, ?>) value).forEach((k, v) -> normalized.put(String.valueOf(k), normalize(v)));
      return normalized;
    }
    return value;
  }
}
