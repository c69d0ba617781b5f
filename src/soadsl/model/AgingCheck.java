package soadsl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HCI/TDDB aging check. {@code params} holds the model coefficients (keys a..n) in document order.
 */
public record AgingCheck(String type, String variant, Map<String, LimitValue> params) {
  public AgingCheck {
    params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }
}
