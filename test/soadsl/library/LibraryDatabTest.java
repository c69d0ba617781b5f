package soadsl.library;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import soadsl.drc.RuleChecker;
import soadsl.model.MonitorKind;

class LibraryDatabTest {

  @Test
  void testDeviceLibrary() throws LibraryException {
    DeviceDatab devices = DeviceDatab.parse("""
        devices:
          nmos_core:
            type: nmos
            terminals: [d, g, s, b]
            parameters: [w, l]
          rpoly:
            type: resistor
            terminals:
              p: anode
              n: cathode
        """);
    Assertions.assertEquals(List.of("nmos_core", "rpoly"), List.copyOf(devices.names()));
    DeviceInfo nmos = devices.lookup("nmos_core").orElseThrow();
    Assertions.assertEquals("nmos", nmos.type());
    Assertions.assertTrue(nmos.hasTerminal("g"));
    Assertions.assertFalse(nmos.hasTerminal("x"));
    Assertions.assertFalse(nmos.hasParameter("nf"));
    DeviceInfo rpoly = devices.lookup("rpoly").orElseThrow();
    Assertions.assertEquals(List.of("p", "n"), rpoly.terminals());
    // no parameter list means any parameter is accepted
    Assertions.assertTrue(rpoly.hasParameter("anything"));
    Assertions.assertTrue(devices.lookup("pmos_core").isEmpty());
  }

  @Test
  void testDuplicateDeviceKeepsLater() {
    DeviceDatab devices = new DeviceDatab();
    devices.addDevice(new DeviceInfo("nmos_core", "nmos", List.of(), List.of()));
    devices.addDevice(new DeviceInfo("nmos_core", "pmos", List.of(), List.of()));
    Assertions.assertEquals("pmos", devices.lookup("nmos_core").orElseThrow().type());
  }

  @Test
  void testMalformedLibraries() {
    Assertions.assertThrows(LibraryException.class, () -> DeviceDatab.parse("devices: [nmos_core, pmos_core]"));
    Assertions.assertThrows(LibraryException.class, () -> DeviceDatab.parse("devices:\n  nmos_core:\n    terminals: d\n"));
    Assertions.assertThrows(LibraryException.class, () -> DeviceDatab.parse("devices: {nmos_core: [unclosed"));
    Assertions.assertThrows(LibraryException.class, () -> MonitorDatab.parse("monitors: 3"));
  }

  @Test
  void testMissingFile(@TempDir Path dir) {
    LibraryException e = Assertions.assertThrows(LibraryException.class, () -> DeviceDatab.load(dir.resolve("missing.yaml")));
    Assertions.assertTrue(e.getMessage().startsWith("Cannot read library"));
  }

  @Test
  void testMonitorLibrary() throws LibraryException {
    MonitorDatab monitors = MonitorDatab.parse("""
        monitors:
          ovcheck:
            veriloga: builtin
          parcheckva3:
            veriloga: ./veriloga/parcheck3.va
            description: Parameter range check
          ovcheck_future: {}
        time_limit_mapping:
          steady: tmaxfrac0
          review: tmaxfrac3
        """);
    Assertions.assertTrue(monitors.isRegistered(MonitorKind.Ovcheck));
    Assertions.assertTrue(monitors.isRegistered(MonitorKind.Parcheckva3));
    Assertions.assertFalse(monitors.isRegistered(MonitorKind.Ovcheck6));
    Assertions.assertEquals("./veriloga/parcheck3.va", monitors.getModel(MonitorKind.Parcheckva3).orElseThrow().veriloga());
    Assertions.assertEquals("Parameter range check", monitors.getModel(MonitorKind.Parcheckva3).orElseThrow().description());
    Assertions.assertEquals("tmaxfrac3", monitors.timeLimitAlias("review").orElseThrow());
    Assertions.assertTrue(monitors.timeLimitAlias("transient_1pct").isEmpty());
  }

  @Test
  void testStandardMonitors() {
    MonitorDatab monitors = MonitorDatab.standard();
    for (MonitorKind kind : MonitorKind.values())
      Assertions.assertTrue(monitors.isRegistered(kind), kind.serialName);
    Assertions.assertEquals(List.of("steady", "transient_1pct", "transient_10pct", "review"), List.copyOf(monitors.getTimeLimits().keySet()));
    Assertions.assertEquals("tmaxfrac2", monitors.timeLimitAlias("transient_10pct").orElseThrow());
  }

  @Test
  void testShippedLibraries() throws LibraryException {
    Path devicesFile = Paths.get("libraries", "devices.yaml");
    Path monitorsFile = Paths.get("libraries", "monitors.yaml");
    Assertions.assertTrue(Files.exists(devicesFile));
    DeviceDatab devices = DeviceDatab.load(devicesFile);
    Assertions.assertTrue(devices.names().containsAll(RuleChecker.KNOWN_DEVICES));
    MonitorDatab monitors = MonitorDatab.load(monitorsFile);
    Assertions.assertEquals(MonitorDatab.standard().getTimeLimits(), monitors.getTimeLimits());
    for (MonitorKind kind : MonitorKind.values())
      Assertions.assertTrue(monitors.isRegistered(kind), kind.serialName);
  }
}
