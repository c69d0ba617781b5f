package soadsl.library;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/** Shared YAML reading of the library files. */
final class LibraryYaml {
  private LibraryYaml() {}

  static Map<String, Object> load(Path file) throws LibraryException {
    try (InputStream readFile = Files.newInputStream(file)) {
      return root(new Yaml(new SafeConstructor(new LoaderOptions())).load(readFile), file.toString());
    } catch (IOException e) {
      throw new LibraryException("Cannot read library " + file + ": " + e.getMessage(), e);
    } catch (YAMLException e) {
      throw new LibraryException("Malformed library " + file + ": " + e.getMessage(), e);
    }
  }

  static Map<String, Object> load(String text, String origin) throws LibraryException {
    try {
      return root(new Yaml(new SafeConstructor(new LoaderOptions())).load(text), origin);
    } catch (YAMLException e) {
      throw new LibraryException("Malformed library " + origin + ": " + e.getMessage(), e);
    }
  }

  private static Map<String, Object> root(Object parsed, String origin) throws LibraryException {
    if (parsed == null)
      return new LinkedHashMap<>();
    return asMap(parsed, origin);
  }

  static Map<String, Object> asMap(Object value, String where) throws LibraryException {
    if (value == null)
      return new LinkedHashMap<>();
    if (!(value instanceof Map))
      throw new LibraryException(where + ": expected a mapping");
    LinkedHashMap<String, Object> ret = new LinkedHashMap<>();
    ((Map<?, ?>)value).forEach((key, entry) -> ret.put(String.valueOf(key), entry));
    return ret;
  }

  static List<String> asStringList(Object value, String where) throws LibraryException {
    List<String> ret = new ArrayList<>();
    if (value == null)
      return ret;
    if (value instanceof Map) {
      ((Map<?, ?>)value).keySet().forEach(key -> ret.add(String.valueOf(key)));
      return ret;
    }
    if (!(value instanceof List))
      throw new LibraryException(where + ": expected a list");
    ((List<?>)value).forEach(entry -> ret.add(String.valueOf(entry)));
    return ret;
  }
}
