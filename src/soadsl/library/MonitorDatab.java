package soadsl.library;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import soadsl.model.MonitorKind;

/**
 * Monitor library read from YAML:
 *
 * <pre>
 * monitors:
 *   ovcheck:
 *     veriloga: ovcheck_mos_alt.va
 *     description: Single-branch voltage/current check
 * time_limit_mapping:
 *   steady: tmaxfrac0
 * </pre>
 */
public class MonitorDatab implements MonitorLibrary {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Registration of one checker model. */
  public static record MonitorModel(MonitorKind kind, String veriloga, String description) {}

  private final EnumMap<MonitorKind, MonitorModel> models = new EnumMap<>(MonitorKind.class);
  private final LinkedHashMap<String, String> timeLimits = new LinkedHashMap<>();

  public MonitorDatab register(MonitorKind kind, String veriloga, String description) {
    models.put(kind, new MonitorModel(kind, veriloga, description));
    return this;
  }

  public MonitorDatab mapTimeLimit(String category, String alias) {
    timeLimits.put(category, alias);
    return this;
  }

  /** All six kinds registered, and the four standard time-limit categories mapped to {@code tmaxfrac0..3}. */
  public static MonitorDatab standard() {
    MonitorDatab ret = new MonitorDatab();
    for (MonitorKind kind : MonitorKind.values())
      ret.register(kind, "", "");
    return ret.mapTimeLimit("steady", "tmaxfrac0")
        .mapTimeLimit("transient_1pct", "tmaxfrac1")
        .mapTimeLimit("transient_10pct", "tmaxfrac2")
        .mapTimeLimit("review", "tmaxfrac3");
  }

  @Override
  public boolean isRegistered(MonitorKind kind) {
    return models.containsKey(kind);
  }

  public Optional<MonitorModel> getModel(MonitorKind kind) { return Optional.ofNullable(models.get(kind)); }

  @Override
  public Optional<String> timeLimitAlias(String category) {
    return Optional.ofNullable(timeLimits.get(category));
  }

  public Map<String, String> getTimeLimits() { return Collections.unmodifiableMap(timeLimits); }

  public static MonitorDatab load(Path file) throws LibraryException {
    MonitorDatab ret = fromYaml(LibraryYaml.load(file), file.toString());
    logger.info("MonitorDatab. Read {} monitor kinds and {} time limits from {}", ret.models.size(), ret.timeLimits.size(), file);
    return ret;
  }

  public static MonitorDatab parse(String text) throws LibraryException { return fromYaml(LibraryYaml.load(text, "<text>"), "<text>"); }

  private static MonitorDatab fromYaml(Map<String, Object> root, String origin) throws LibraryException {
    MonitorDatab ret = new MonitorDatab();
    Map<String, Object> monitors = LibraryYaml.asMap(root.get("monitors"), origin + ": monitors");
    for (Map.Entry<String, Object> entry : monitors.entrySet()) {
      Optional<MonitorKind> kind = MonitorKind.fromSerialName(entry.getKey());
      if (kind.isEmpty()) {
        logger.warn("MonitorDatab. Ignoring unknown monitor kind '{}' in {}", entry.getKey(), origin);
        continue;
      }
      Map<String, Object> model = LibraryYaml.asMap(entry.getValue(), origin + ": monitors." + entry.getKey());
      ret.register(kind.get(), String.valueOf(model.getOrDefault("veriloga", "")), String.valueOf(model.getOrDefault("description", "")));
    }
    Map<String, Object> timeLimits = LibraryYaml.asMap(root.get("time_limit_mapping"), origin + ": time_limit_mapping");
    timeLimits.forEach((category, alias) -> ret.mapTimeLimit(category, String.valueOf(alias)));
    return ret;
  }
}
