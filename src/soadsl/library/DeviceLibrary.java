package soadsl.library;

import java.util.Optional;
import java.util.Set;

/** Read-only device lookup used during lowering. */
public interface DeviceLibrary {
  Optional<DeviceInfo> lookup(String name);

  Set<String> names();
}
