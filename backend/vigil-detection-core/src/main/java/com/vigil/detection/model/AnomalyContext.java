package com.vigil.detection.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.vigil.detection.stats.PercentileSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metadata attached to a score or an alert. The known keys are typed; anything else a caller
 * sends is kept in {@link #getAttributes()} and written back flat.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnomalyContext {

  private Double threshold;
  private PercentileSet percentileValues;
  private Integer totalValues;
  private final Map<String, Object> attributes = new LinkedHashMap<>();

  public AnomalyContext() {}

  public static AnomalyContext withThreshold(double threshold) {
    AnomalyContext ctx = new AnomalyContext();
    ctx.threshold = threshold;
    return ctx;
  }

  public static AnomalyContext withPercentiles(PercentileSet percentiles) {
    AnomalyContext ctx = new AnomalyContext();
    ctx.percentileValues = percentiles;
    return ctx;
  }

  public static AnomalyContext withTotalValues(int totalValues) {
    AnomalyContext ctx = new AnomalyContext();
    ctx.totalValues = totalValues;
    return ctx;
  }

  /** Returns a new context holding this context's entries overlaid by {@code other}'s. */
  public AnomalyContext merge(AnomalyContext other) {
    AnomalyContext out = new AnomalyContext();
    out.threshold = threshold;
    out.percentileValues = percentileValues;
    out.totalValues = totalValues;
    out.attributes.putAll(attributes);
    if (other != null) {
      if (other.threshold != null) out.threshold = other.threshold;
      if (other.percentileValues != null) out.percentileValues = other.percentileValues;
      if (other.totalValues != null) out.totalValues = other.totalValues;
      out.attributes.putAll(other.attributes);
    }
    return out;
  }

  public Double getThreshold() { return threshold; }
  public void setThreshold(Double threshold) { this.threshold = threshold; }
  public PercentileSet getPercentileValues() { return percentileValues; }
  public void setPercentileValues(PercentileSet percentileValues) { this.percentileValues = percentileValues; }
  public Integer getTotalValues() { return totalValues; }
  public void setTotalValues(Integer totalValues) { this.totalValues = totalValues; }

  @JsonAnyGetter
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  @JsonAnySetter
  public void putAttribute(String key, Object value) {
    attributes.put(key, value);
  }

  @JsonIgnore
  public boolean isEmpty() {
    return threshold == null && percentileValues == null && totalValues == null && attributes.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AnomalyContext that)) return false;
    return Objects.equals(threshold, that.threshold)
        && Objects.equals(percentileValues, that.percentileValues)
        && Objects.equals(totalValues, that.totalValues)
        && attributes.equals(that.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(threshold, percentileValues, totalValues, attributes);
  }
}
