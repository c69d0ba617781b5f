package soadsl.frontend;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import soadsl.model.Branch;
import soadsl.model.LimitValue;
import soadsl.model.Monitor;
import soadsl.model.MonitorDocument;
import soadsl.model.MonitorKind;
import soadsl.model.MonitorSettings;
import soadsl.model.Rule;
import soadsl.model.SOADocument;
import soadsl.model.UniversalDocument;

class SpecParserTest {

  static final String MONITOR_YAML = """
      version: "2.0"
      process: bcd8
      date: 2024-12-16
      global:
        timing: {tmin: 0, tdelay: 0, vballmsg: 1.0, stop: 0}
        tmaxfrac: {level0: 0, level1: 0.01, level2: 0.1, level3: -1}
      parameters:
        vmax: 5.5
        vmax_w:
          formula: linear
          parameters: [w]
          coefficients: [0.5]
      monitors:
        - name: gate_oxide
          monitor_type: ovcheck
          model_name: ovcheck_nmos_5v_gate_oxide
          section: soacheck_nmos_5v_gate_oxide_shared
          device_pattern: nmos_5v
          parameters:
            tmin: global_tmin
            tdelay: global_tdelay
            vballmsg: global_vballmsg
            stop: global_stop
            tmaxfrac: tmaxfrac0
            branch1: v[g,s]
            message1: Gate oxide overvoltage
            vlow: -5.5
            vhigh: vmax
            severity: high
        - name: drain
          monitor_type: ovcheck6
          model_name: ovcheck6_nmos_5v_drain
          section: soacheck_nmos_5v_drain_shared
          device_pattern: nmos_5v
          parameters:
            tmin: 0
            tdelay: 0
            vballmsg: 1
            stop: 0
            branch1: V(d,s)
            vhigh1: 10
            branch2: V(d,b)
            vhigh2: 12
            message2: Drain-bulk
        - name: hci
          monitor_type: ovcheckva_ldmos_hci_tddb
          model_name: hci_model
          section: hci_section
          device_pattern: nmos90_10hv
          parameters:
            tmin: 0
            tdelay: 0
            vballmsg: 1
            stop: 0
            atype: atype
            soa_hcitddb_a: 1.5
            soa_hcitddb_b: {expression: "vmax * 2"}
      """;

  static final String UNIVERSAL_YAML = """
      version: "1.0"
      process: bcd8
      date: 2024-12-16
      global:
        timing: {tmin: 0, tdelay: 1e-9}
        temperature: {tref_soa: 27}
        tmaxfrac: {level0: 0, level1: 0.01}
        limits:
          vmax_core: 1.32
          vmax_w:
            formula: linear
            parameters: [w]
            coefficients: [0.5]
      rules:
        - name: Gate Oxide
          device: nmos_core
          parameter: v[g,s]
          type: voltage
          severity: high
          constraint: {vhigh: vmax_core, vlow: -1.32}
          message: Gate oxide stress
          description: Thin gate oxide
          condition: "T > 100"
        - name: drain
          devices: [nmos_5v]
          applies_to: {devices: [pmos_5v]}
          parameter: multi
          type: multi_branch
          severity: medium
          time_limit: transient_1pct
          branches:
            - {branch: "V(d,s)", vhigh: 5.5, message: Drain-source}
            - {branch: "V(d,b)", vlow: -0.5}
        - {}
      """;

  private final SpecParser parser = new SpecParser();

  @Test
  void testDetectFlavor() throws SpecParseException {
    Assertions.assertEquals(SpecParser.Flavor.Monitor, parser.detectFlavor(MONITOR_YAML));
    Assertions.assertEquals(SpecParser.Flavor.Universal, parser.detectFlavor(UNIVERSAL_YAML));
    Assertions.assertEquals(SpecParser.Flavor.Universal, parser.detectFlavor("process: x"));
    Assertions.assertTrue(parser.parse(MONITOR_YAML) instanceof MonitorDocument);
    Assertions.assertTrue(parser.parse(UNIVERSAL_YAML) instanceof UniversalDocument);
  }

  @Test
  void testMonitorDocument() throws SpecParseException {
    MonitorDocument doc = parser.parseMonitor(MONITOR_YAML);
    Assertions.assertEquals("2.0", doc.getVersion());
    Assertions.assertEquals("bcd8", doc.getProcess());
    Assertions.assertEquals("2024-12-16", doc.getDate());
    Assertions.assertEquals(-1.0, doc.getGlobal().getTmaxfrac(3));
    Assertions.assertEquals(LimitValue.of(5.5), doc.getParameters().get("vmax"));
    Assertions.assertEquals(LimitValue.expression("$w * 0.5"), doc.getParameters().get("vmax_w"));
    Assertions.assertEquals(3, doc.getMonitors().size());

    Monitor gate = doc.getMonitors().get(0);
    Assertions.assertEquals(MonitorKind.Ovcheck, gate.getKind());
    Assertions.assertEquals("nmos_5v", gate.getDevicePattern());
    Assertions.assertEquals(LimitValue.expression("global_tmin"), gate.getCommon().tmin());
    Assertions.assertEquals("tmaxfrac0", gate.getCommon().getTmaxfrac().orElseThrow());
    Assertions.assertEquals(new MonitorSettings.SingleBranch("v[g,s]", "Gate oxide overvoltage", LimitValue.of(-5.5), LimitValue.expression("vmax")),
                            gate.getSettings());
    Assertions.assertEquals(Map.of("severity", "high"), gate.getExtra());

    Monitor drain = doc.getMonitors().get(1);
    Assertions.assertTrue(drain.getCommon().getTmaxfrac().isEmpty());
    List<Branch> branches = ((MonitorSettings.MultiBranch)drain.getSettings()).branches();
    Assertions.assertEquals(2, branches.size());
    Assertions.assertEquals(new Branch("V(d,s)", LimitValue.of(10), null, null), branches.get(0));
    Assertions.assertEquals("Drain-bulk", branches.get(1).message());
    Assertions.assertTrue(drain.getExtra().isEmpty());

    MonitorSettings.Aging aging = (MonitorSettings.Aging)doc.getMonitors().get(2).getSettings();
    Assertions.assertEquals("atype", aging.atype());
    Assertions.assertEquals(List.of("soa_hcitddb_a", "soa_hcitddb_b"), List.copyOf(aging.coefficients().keySet()));
    Assertions.assertEquals(LimitValue.expression("vmax * 2"), aging.coefficients().get("soa_hcitddb_b"));
  }

  @Test
  void testSelfHeatingMonitor() throws SpecParseException {
    String yaml = MONITOR_YAML.replace("      vlow: -5.5\n", "      dtmax: 5\n      idc_high: 0.01\n");
    MonitorSettings settings = parser.parseMonitor(yaml).getMonitors().get(0).getSettings();
    Assertions.assertTrue(settings instanceof MonitorSettings.SelfHeatingCheck);
    MonitorSettings.SelfHeatingCheck selfHeating = (MonitorSettings.SelfHeatingCheck)settings;
    Assertions.assertEquals(LimitValue.of(5), selfHeating.dtmax());
    Assertions.assertEquals(LimitValue.of(0.01), selfHeating.idcHigh());
    Assertions.assertNull(selfHeating.irmsHigh());
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {"model_name: ovcheck_nmos_5v_gate_oxide|monitors[0].model_name",
                                       "monitor_type: ovcheck|monitors[0].monitor_type",
                                       "section: soacheck_nmos_5v_gate_oxide_shared|monitors[0].section",
                                       "stop: global_stop|monitors[0].parameters.stop",
                                       "tmaxfrac: {level0: 0, level1: 0.01, level2: 0.1, level3: -1}|global.tmaxfrac", "process: bcd8|process"})
  void testMissingMonitorFields(String removedLine, String fieldPath) {
    String yaml = MONITOR_YAML.lines().filter(line -> !line.trim().equals(removedLine)).collect(Collectors.joining("\n"));
    Assertions.assertEquals(MONITOR_YAML.lines().count() - 1, yaml.lines().count());
    SpecParseException e = Assertions.assertThrows(SpecParseException.class, () -> parser.parseMonitor(yaml));
    Assertions.assertEquals(fieldPath, e.getFieldPath());
    Assertions.assertTrue(e.getMessage().startsWith(fieldPath + ": "));
  }

  @Test
  void testMissingTmaxfracLevel() {
    String yaml = MONITOR_YAML.replace(", level3: -1}", "}");
    SpecParseException e = Assertions.assertThrows(SpecParseException.class, () -> parser.parseMonitor(yaml));
    Assertions.assertEquals("global.tmaxfrac.level3", e.getFieldPath());
  }

  @Test
  void testUnknownMonitorType() {
    String yaml = MONITOR_YAML.replace("monitor_type: ovcheck6", "monitor_type: ovcheck7");
    SpecParseException e = Assertions.assertThrows(SpecParseException.class, () -> parser.parseMonitor(yaml));
    Assertions.assertEquals("monitors[1].monitor_type", e.getFieldPath());
  }

  @ParameterizedTest
  @ValueSource(strings = {"note: {a: 1}", "note: [1, 2]", "note: 2024-12-16"})
  void testNonScalarExtraRejected(String note) {
    String yaml = MONITOR_YAML.replace("severity: high", note);
    SpecParseException e = Assertions.assertThrows(SpecParseException.class, () -> parser.parseMonitor(yaml));
    Assertions.assertEquals("monitors[0].parameters.note", e.getFieldPath());
  }

  @Test
  void testStateDetectionKeys() throws SpecParseException {
    String yaml = MONITOR_YAML.replace("monitor_type: ovcheck\n", "monitor_type: ovcheckva_mos2\n")
                      .replace("severity: high", "vhigh_on: 5.5\n            pmosvthsign: -1\n            inst2probe: mp");
    MonitorSettings.StateDependent settings = (MonitorSettings.StateDependent)parser.parseMonitor(yaml).getMonitors().get(0).getSettings();
    Assertions.assertEquals(LimitValue.of(5.5), settings.vhighOn());
    Assertions.assertEquals(-1, settings.pmosvthsign());
    Assertions.assertEquals("mp", settings.inst2probe());
  }

  @Test
  void testMalformedYaml() {
    SpecParseException e = Assertions.assertThrows(SpecParseException.class, () -> parser.parse("rules: [unclosed"));
    Assertions.assertTrue(e.getMessage().startsWith("YAML parsing error"));
  }

  @Test
  void testUniversalDocument() throws SpecParseException {
    UniversalDocument doc = parser.parseUniversal(UNIVERSAL_YAML);
    Assertions.assertEquals("2024-12-16", doc.getDate());
    Assertions.assertEquals(LimitValue.of(1e-9), doc.getGlobal().getTiming().get("tdelay"));
    Assertions.assertFalse(doc.getGlobal().getTiming().containsKey("stop"));
    Assertions.assertEquals(LimitValue.of(27), doc.getGlobal().getTemperature().get("tref_soa"));
    Assertions.assertTrue(doc.getGlobal().getLimits().get("vmax_w").isFormula());
    Assertions.assertEquals(List.of("w"), doc.getGlobal().getLimits().get("vmax_w").getFormula().parameters());
    Assertions.assertEquals(3, doc.getRules().size());

    Rule gate = doc.getRules().get(0);
    Assertions.assertEquals("Gate Oxide", gate.getName());
    Assertions.assertEquals(List.of("nmos_core"), gate.getDevices());
    Assertions.assertEquals(LimitValue.expression("vmax_core"), gate.getConstraint().vhigh());
    Assertions.assertEquals(LimitValue.of(-1.32), gate.getConstraint().vlow());
    Assertions.assertEquals(Rule.DEFAULT_TIME_LIMIT, gate.getTimeLimit());
    Assertions.assertEquals("Thin gate oxide", gate.getDescription());
    Assertions.assertEquals("T > 100", gate.getCondition());

    Rule drain = doc.getRules().get(1);
    Assertions.assertEquals(List.of("nmos_5v", "pmos_5v"), drain.getDevices());
    Assertions.assertEquals("transient_1pct", drain.getTimeLimit());
    Assertions.assertTrue(drain.isMultiBranch());
    Assertions.assertEquals(new Branch("V(d,b)", null, LimitValue.of(-0.5), null), drain.getBranches().get(1));

    Rule empty = doc.getRules().get(2);
    Assertions.assertEquals("", empty.getName());
    Assertions.assertTrue(empty.getDevices().isEmpty());
    Assertions.assertNull(empty.getConstraint());
    Assertions.assertTrue(empty.getRuleType().isEmpty());
  }

  @Test
  void testUniversalRejectsWrongShapes() {
    SpecParseException global = Assertions.assertThrows(SpecParseException.class, () -> parser.parseUniversal("global: [1, 2]"));
    Assertions.assertEquals("global", global.getFieldPath());
    SpecParseException tmaxfrac =
        Assertions.assertThrows(SpecParseException.class, () -> parser.parseUniversal("global: {tmaxfrac: {level0: abc}}"));
    Assertions.assertEquals("global.tmaxfrac.level0", tmaxfrac.getFieldPath());
    SpecParseException rules = Assertions.assertThrows(SpecParseException.class, () -> parser.parseUniversal("rules: {a: 1}"));
    Assertions.assertEquals("rules", rules.getFieldPath());
  }

  @Test
  void testUniversalDefaults() throws SpecParseException {
    UniversalDocument doc = parser.parseUniversal("rules: []");
    Assertions.assertEquals(SOADocument.DEFAULT_VERSION, doc.getVersion());
    Assertions.assertEquals("", doc.getProcess());
    Assertions.assertTrue(doc.getGlobal().getTiming().isEmpty());
  }

  @Test
  void testFileExtension(@TempDir Path dir) throws Exception {
    Path json = dir.resolve("rules.json");
    Files.writeString(json, "{}");
    SpecParseException e = Assertions.assertThrows(SpecParseException.class, () -> parser.parseFile(json));
    Assertions.assertTrue(e.getMessage().contains("Only YAML format is supported"));

    Path yml = dir.resolve("rules.yml");
    Files.writeString(yml, UNIVERSAL_YAML);
    Assertions.assertEquals(3, ((UniversalDocument)parser.parseFile(yml)).getRules().size());
  }
}
