package soadsl.frontend;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import soadsl.model.LimitValue;

/**
 * Typed, path-aware access to one YAML mapping as loaded by snakeyaml. Every accessor records the key as consumed, so the keys
 * nobody asked for can be collected with {@link #remaining()}.
 */
class YamlFields {
  private final String path;
  private final LinkedHashMap<String, Object> map = new LinkedHashMap<>();
  private final Set<String> consumed = new LinkedHashSet<>();

  YamlFields(String path, Object node) throws SpecParseException {
    this.path = path;
    if (node == null)
      return;
    if (!(node instanceof Map))
      throw new SpecParseException(path, "Expected a mapping, got " + describe(node));
    for (Map.Entry<?, ?> entry : ((Map<?, ?>)node).entrySet())
      map.put(String.valueOf(entry.getKey()), entry.getValue());
  }

  String getPath() { return path; }

  String child(String key) { return path.isEmpty() ? key : path + "." + key; }

  boolean has(String key) { return map.get(key) != null; }

  boolean isEmpty() { return map.isEmpty(); }

  Set<String> keys() { return map.keySet(); }

  Object raw(String key) {
    consumed.add(key);
    return map.get(key);
  }

  /** Keys not read so far, with their raw values, in document order. */
  LinkedHashMap<String, Object> remaining() {
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    map.forEach((key, value) -> {
      if (!consumed.contains(key) && value != null)
        ret.put(key, value);
    });
    return ret;
  }

  /** Like {@link #remaining()}, but each value must be a string, number or boolean. */
  LinkedHashMap<String, Object> remainingScalars() throws SpecParseException {
    LinkedHashMap<String, Object> ret = remaining();
    for (Map.Entry<String, Object> entry : ret.entrySet()) {
      Object value = entry.getValue();
      if (!(value instanceof String || value instanceof Number || value instanceof Boolean))
        throw new SpecParseException(child(entry.getKey()), "Expected a scalar, got " + describe(value));
    }
    return ret;
  }

  String string(String key, String defaultValue) throws SpecParseException {
    Object value = raw(key);
    return value == null ? defaultValue : scalarToString(value, child(key));
  }

  String requiredString(String key) throws SpecParseException {
    String ret = string(key, null);
    if (ret == null || ret.isEmpty())
      throw new SpecParseException(child(key), "Required field is missing");
    return ret;
  }

  LimitValue limit(String key) throws SpecParseException {
    Object value = raw(key);
    return value == null ? null : toLimit(value, child(key));
  }

  LimitValue limit(String key, double defaultValue) throws SpecParseException {
    LimitValue ret = limit(key);
    return ret == null ? LimitValue.of(defaultValue) : ret;
  }

  LimitValue requiredLimit(String key) throws SpecParseException {
    LimitValue ret = limit(key);
    if (ret == null)
      throw new SpecParseException(child(key), "Required field is missing");
    return ret;
  }

  Double number(String key) throws SpecParseException {
    Object value = raw(key);
    return value == null ? null : toNumber(value, child(key));
  }

  int integer(String key, int defaultValue) throws SpecParseException {
    Object value = raw(key);
    if (value == null)
      return defaultValue;
    if (!(value instanceof Integer))
      throw new SpecParseException(child(key), "Expected an integer, got " + describe(value));
    return (Integer)value;
  }

  YamlFields map(String key) throws SpecParseException { return new YamlFields(child(key), raw(key)); }

  YamlFields requiredMap(String key) throws SpecParseException {
    if (!has(key))
      throw new SpecParseException(child(key), "Required section is missing");
    return map(key);
  }

  List<Object> list(String key) throws SpecParseException {
    Object value = raw(key);
    if (value == null)
      return List.of();
    if (!(value instanceof List))
      throw new SpecParseException(child(key), "Expected a list, got " + describe(value));
    return new ArrayList<>((List<?>)value);
  }

  /** A list of scalars; a single scalar counts as a one-element list. */
  List<String> stringList(String key) throws SpecParseException {
    Object value = map.get(key);
    if (value != null && !(value instanceof List))
      return List.of(string(key, ""));
    List<String> ret = new ArrayList<>();
    List<Object> items = list(key);
    for (int i = 0; i < items.size(); ++i)
      ret.add(scalarToString(items.get(i), child(key) + "[" + i + "]"));
    return ret;
  }

  /** Every entry of this mapping as a number, in document order. */
  LinkedHashMap<String, Double> numbers() throws SpecParseException {
    LinkedHashMap<String, Double> ret = new LinkedHashMap<>();
    for (String key : keys())
      ret.put(key, toNumber(raw(key), child(key)));
    return ret;
  }

  /** Every entry of this mapping as a limit value, in document order. */
  LinkedHashMap<String, LimitValue> limits() throws SpecParseException {
    LinkedHashMap<String, LimitValue> ret = new LinkedHashMap<>();
    for (String key : keys()) {
      Object value = raw(key);
      if (value != null)
        ret.put(key, toLimit(value, child(key)));
    }
    return ret;
  }

  static String scalarToString(Object value, String path) throws SpecParseException {
    if (value instanceof String || value instanceof Number || value instanceof Boolean)
      return value.toString();
    if (value instanceof Date)
      return ((Date)value).toInstant().atZone(ZoneOffset.UTC).toLocalDate().toString();
    throw new SpecParseException(path, "Expected a scalar, got " + describe(value));
  }

  static double toNumber(Object value, String path) throws SpecParseException {
    if (value instanceof Number)
      return ((Number)value).doubleValue();
    if (value instanceof String) {
      LimitValue parsed = LimitValue.expression((String)value);
      if (parsed.isNumeric())
        return parsed.doubleValue();
    }
    throw new SpecParseException(path, "Expected a number, got " + describe(value));
  }

  /**
   * A number, an expression string, {@code {expression: ...}} or {@code {formula: ..., parameters: [...], coefficients: [...]}}.
   */
  static LimitValue toLimit(Object value, String path) throws SpecParseException {
    if (value instanceof Number)
      return LimitValue.of((Number)value);
    if (value instanceof String)
      return LimitValue.expression((String)value);
    if (value instanceof Map) {
      YamlFields structured = new YamlFields(path, value);
      if (structured.has("expression"))
        return LimitValue.expression(structured.string("expression", ""));
      if (structured.has("formula")) {
        List<String> parameters = structured.stringList("parameters");
        List<Number> coefficients = new ArrayList<>();
        List<Object> rawCoefficients = structured.list("coefficients");
        for (int i = 0; i < rawCoefficients.size(); ++i)
          coefficients.add(toNumber(rawCoefficients.get(i), structured.child("coefficients") + "[" + i + "]"));
        return LimitValue.formula(new LimitValue.Formula(structured.string("formula", ""), parameters, coefficients));
      }
      throw new SpecParseException(path, "Limit mapping needs an 'expression' or a 'formula' entry");
    }
    throw new SpecParseException(path, "Expected a number or expression, got " + describe(value));
  }

  static String describe(Object value) {
    if (value instanceof Map)
      return "a mapping";
    if (value instanceof List)
      return "a list";
    return "'" + value + "'";
  }
}
