package soadsl.library;

import java.util.List;

/**
 * Library entry of one device.
 *
 * @param type       device class, e.g. {@code nmos}, {@code resistor}
 * @param terminals  terminal names, e.g. {@code [d, g, s, b]}; empty if unknown
 * @param parameters instance parameter names an expression may reference as {@code $name}; empty if unknown
 */
public record DeviceInfo(String name, String type, List<String> terminals, List<String> parameters) {
  public DeviceInfo {
    terminals = List.copyOf(terminals);
    parameters = List.copyOf(parameters);
  }

  public boolean hasTerminal(String terminal) { return terminals.isEmpty() || terminals.contains(terminal); }

  public boolean hasParameter(String parameter) { return parameters.isEmpty() || parameters.contains(parameter); }
}
