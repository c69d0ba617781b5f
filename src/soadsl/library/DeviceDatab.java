package soadsl.library;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Device library read from YAML:
 *
 * <pre>
 * devices:
 *   nmos_5v:
 *     type: nmos
 *     terminals: [d, g, s, b]
 *     parameters: [w, l, nf]
 * </pre>
 */
public class DeviceDatab implements DeviceLibrary {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LinkedHashMap<String, DeviceInfo> devices = new LinkedHashMap<>();

  public DeviceDatab addDevice(DeviceInfo device) {
    if (devices.put(device.name(), device) != null)
      logger.warn("DeviceDatab. Device {} defined twice, keeping the later definition", device.name());
    return this;
  }

  @Override
  public Optional<DeviceInfo> lookup(String name) {
    return Optional.ofNullable(devices.get(name));
  }

  @Override
  public Set<String> names() {
    return Collections.unmodifiableSet(devices.keySet());
  }

  public static DeviceDatab load(Path file) throws LibraryException {
    DeviceDatab ret = fromYaml(LibraryYaml.load(file), file.toString());
    logger.info("DeviceDatab. Read {} devices from {}", ret.devices.size(), file);
    return ret;
  }

  public static DeviceDatab parse(String text) throws LibraryException { return fromYaml(LibraryYaml.load(text, "<text>"), "<text>"); }

  private static DeviceDatab fromYaml(Map<String, Object> root, String origin) throws LibraryException {
    DeviceDatab ret = new DeviceDatab();
    Map<String, Object> devices = LibraryYaml.asMap(root.get("devices"), origin + ": devices");
    for (Map.Entry<String, Object> entry : devices.entrySet()) {
      String where = origin + ": devices." + entry.getKey();
      Map<String, Object> device = LibraryYaml.asMap(entry.getValue(), where);
      ret.addDevice(new DeviceInfo(entry.getKey(), String.valueOf(device.getOrDefault("type", "")),
                                   LibraryYaml.asStringList(device.get("terminals"), where + ".terminals"),
                                   LibraryYaml.asStringList(device.get("parameters"), where + ".parameters")));
    }
    return ret;
  }
}
