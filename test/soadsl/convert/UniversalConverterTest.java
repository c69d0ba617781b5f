package soadsl.convert;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import soadsl.frontend.SpecParseException;
import soadsl.frontend.SpecParser;
import soadsl.library.DeviceDatab;
import soadsl.library.DeviceInfo;
import soadsl.library.MonitorDatab;
import soadsl.model.Branch;
import soadsl.model.Constraint;
import soadsl.model.LimitValue;
import soadsl.model.Monitor;
import soadsl.model.MonitorDocument;
import soadsl.model.MonitorKind;
import soadsl.model.MonitorSettings;
import soadsl.model.Rule;
import soadsl.model.RuleType;
import soadsl.model.StateDetection;
import soadsl.model.TemperatureDependence;

class UniversalConverterTest {

  static final String GLOBAL = """
      global:
        timing: {tmin: 1e-9}
        temperature: {tref_soa: 27}
        tmaxfrac: {level1: 0.02}
        limits:
          vmax_core: 1.32
          vmax_w:
            formula: linear
            parameters: [w]
            coefficients: [0.5]
      rules:
      """;

  static DeviceDatab devices() {
    List<String> mos = List.of("d", "g", "s", "b");
    return new DeviceDatab()
        .addDevice(new DeviceInfo("nmos_core", "nmos", mos, List.of("w", "l")))
        .addDevice(new DeviceInfo("pmos_core", "pmos", mos, List.of("w", "l")))
        .addDevice(new DeviceInfo("nmos90_10hv", "nmos", mos, List.of("w", "l")));
  }

  private final UniversalConverter converter = new UniversalConverter(devices(), MonitorDatab.standard());

  private MonitorDocument convert(String rules) throws SpecParseException, ConversionException {
    return converter.convert(new SpecParser().parseUniversal(GLOBAL + rules));
  }

  private MonitorSettings settingsOf(String rule) throws SpecParseException, ConversionException {
    return convert(rule).getMonitors().get(0).getSettings();
  }

  @Test
  void testDocumentDefaults() throws SpecParseException, ConversionException {
    MonitorDocument doc = convert("  []\n");
    Assertions.assertEquals("UNKNOWN", doc.getProcess());
    Assertions.assertEquals("UNKNOWN", doc.getDate());
    Assertions.assertEquals(Map.of("tmin", LimitValue.of(1e-9), "tdelay", LimitValue.of(0), "vballmsg", LimitValue.of(1.0), "stop", LimitValue.of(0)),
                            doc.getGlobal().getTiming());
    Assertions.assertEquals(List.of(0.0, 0.02, 0.10, -1.0), List.copyOf(doc.getGlobal().getTmaxfrac().values()));
    Assertions.assertEquals(List.of("global_tmin", "global_tdelay", "global_vballmsg", "global_stop", "tmaxfrac0", "tmaxfrac1", "tmaxfrac2",
                                    "tmaxfrac3", "vmax_core", "vmax_w"),
                            List.copyOf(doc.getParameters().keySet()));
    Assertions.assertEquals(LimitValue.of(0.02), doc.getParameters().get("tmaxfrac1"));
    Assertions.assertEquals(LimitValue.expression("$w * 0.5"), doc.getParameters().get("vmax_w"));
    Assertions.assertTrue(doc.getMonitors().isEmpty());
  }

  @Test
  void testSingleBranch() throws SpecParseException, ConversionException {
    MonitorDocument doc = convert("""
          - name: Gate Oxide
            devices: [nmos_core, pmos_core]
            parameter: v[g,s]
            type: voltage
            severity: high
            time_limit: transient_10pct
            message: Gate oxide stress
            constraint: {vhigh: "vmax_core * 2", vlow: -1.32}
        """);
    Assertions.assertEquals(2, doc.getMonitors().size());
    Monitor nmos = doc.getMonitors().get(0);
    Assertions.assertEquals("Gate Oxide", nmos.getName());
    Assertions.assertEquals(MonitorKind.Ovcheck, nmos.getKind());
    Assertions.assertEquals("ovcheck_nmos_core_gate_oxide", nmos.getModelName());
    Assertions.assertEquals("soacheck_nmos_core_gate_oxide_shared", nmos.getSection());
    Assertions.assertEquals("nmos_core", nmos.getDevicePattern());
    Assertions.assertEquals(LimitValue.expression("global_vballmsg"), nmos.getCommon().vballmsg());
    Assertions.assertEquals("tmaxfrac2", nmos.getCommon().getTmaxfrac().orElseThrow());
    Assertions.assertEquals(new MonitorSettings.SingleBranch("v[g,s]", "Gate oxide stress", LimitValue.of(-1.32), LimitValue.of(2.64)),
                            nmos.getSettings());
    Assertions.assertEquals("ovcheck_pmos_core_gate_oxide", doc.getMonitors().get(1).getModelName());
  }

  @Test
  void testCurrentBoundsFallback() throws SpecParseException, ConversionException {
    MonitorSettings settings = settingsOf("""
          - name: drain current
            device: nmos_core
            parameter: i[d]
            type: ihigh
            constraint: {ihigh: "$w * 1e-3"}
        """);
    Assertions.assertEquals(new MonitorSettings.SingleBranch("i[d]", null, null, LimitValue.expression("$w * 1e-3")), settings);
  }

  @Test
  void testUnknownDevice() {
    ConversionException e = Assertions.assertThrows(ConversionException.class, () -> convert("""
          - name: gate
            device: flux_capacitor
            parameter: v[g,s]
            type: voltage
            constraint: {vhigh: 5}
        """));
    Assertions.assertTrue(e.getMessage().contains("Unknown device: flux_capacitor"));
    Assertions.assertEquals("gate", e.getRuleName());
  }

  @Test
  void testMissingTimeLimitAlias() throws SpecParseException, ConversionException {
    Monitor monitor = convert("""
          - name: gate
            device: nmos_core
            parameter: v[g,s]
            type: voltage
            time_limit: weekly
            constraint: {vhigh: 5}
        """).getMonitors().get(0);
    Assertions.assertTrue(monitor.getCommon().getTmaxfrac().isEmpty());
  }

  @Test
  void testClassificationPrecedence() throws ConversionException {
    Constraint onOff = new Constraint(null, null, null, null, LimitValue.of(5), LimitValue.of(7), null, null);
    Constraint plain = new Constraint(LimitValue.of(5), null, null, null, null, null, null, null);
    TemperatureDependence td = new TemperatureDependence(null, LimitValue.of(5), -0.01);
    List<Branch> branches = List.of(new Branch("V(d,s)", LimitValue.of(5), null, null));

    Assertions.assertEquals(UniversalConverter.Category.StateDependent,
                            UniversalConverter.classify(Rule.builder("r").type(RuleType.Pwl).constraint(onOff).temperatureDependence(td).build()));
    Assertions.assertEquals(UniversalConverter.Category.TemperatureDependent,
                            UniversalConverter.classify(Rule.builder("r").type(RuleType.Aging).temperatureDependence(td).build()));
    Assertions.assertEquals(UniversalConverter.Category.TemperatureDependent, UniversalConverter.classify(Rule.builder("r").type(RuleType.Pwl).build()));
    Assertions.assertEquals(UniversalConverter.Category.Aging, UniversalConverter.classify(Rule.builder("r").type(RuleType.Aging).branches(branches).build()));
    Assertions.assertEquals(UniversalConverter.Category.ParameterCheck, UniversalConverter.classify(Rule.builder("r").type(RuleType.Parameter).build()));
    Assertions.assertEquals(UniversalConverter.Category.SelfHeating,
                            UniversalConverter.classify(Rule.builder("r").type(RuleType.CurrentWithHeating).branches(branches).build()));
    Assertions.assertEquals(UniversalConverter.Category.MultiBranch,
                            UniversalConverter.classify(Rule.builder("r").type(RuleType.Voltage).constraint(plain).branches(branches).build()));
    Assertions.assertEquals(UniversalConverter.Category.SingleBranch, UniversalConverter.classify(Rule.builder("r").type(RuleType.VLow).build()));

    ConversionException e =
        Assertions.assertThrows(ConversionException.class, () -> UniversalConverter.classify(Rule.builder("odd").type("bogus").build()));
    Assertions.assertEquals("Cannot determine monitor type for rule: odd", e.getMessage());
  }

  @ParameterizedTest
  @CsvSource({"Gate Oxide,gate_oxide", "Drain-Source Max,drain_source_max", "vgs_limit,vgs_limit"})
  void testSlugify(String name, String slug) {
    Assertions.assertEquals(slug, UniversalConverter.slugify(name));
  }

  @Test
  void testMultiBranch() throws SpecParseException, ConversionException {
    MonitorSettings settings = settingsOf("""
          - name: drain
            device: nmos90_10hv
            parameter: multi
            type: multi_branch
            constraint: {vlow: -0.5}
            branches:
              - {branch: "V(d,s)", vhigh: 10, message: Drain-source}
              - {branch: "V(d,b)", vhigh: 12, vlow: -1}
        """);
    Assertions.assertEquals(new MonitorSettings.MultiBranch(List.of(new Branch("V(d,s)", LimitValue.of(10), LimitValue.of(-0.5), "Drain-source"),
                                                                    new Branch("V(d,b)", LimitValue.of(12), LimitValue.of(-1), "Branch2"))),
                            settings);
  }

  @Test
  void testTooManyBranches() {
    StringBuilder rule = new StringBuilder("""
          - name: drain
            device: nmos90_10hv
            type: multi_branch
            branches:
        """);
    for (int i = 0; i < 7; ++i)
      rule.append("      - {branch: \"V(d,s)\", vhigh: 5}\n");
    ConversionException e = Assertions.assertThrows(ConversionException.class, () -> convert(rule.toString()));
    Assertions.assertTrue(e.getMessage().startsWith("Too many branches (7), maximum is 6"));
  }

  @Test
  void testStateDependent() throws SpecParseException, ConversionException {
    String rule = """
          - name: drain state
            device: nmos90_10hv
            parameter: v[d,s]
            type: state_dependent
            constraint: {vhigh_on: 5, vhigh_off: 7}
            gate_control: {vhigh_gc: 5.5, vlow_gc: -0.5}
            monitor_params: {param: vth0, vgt: 0.3, pmosvthsign: -1}
        """;
    Monitor monitor = convert(rule).getMonitors().get(0);
    Assertions.assertEquals("ovcheckva_mos2_nmos90_10hv_drain_state", monitor.getModelName());
    Assertions.assertEquals(new MonitorSettings.StateDependent(LimitValue.of(5), LimitValue.of(7), LimitValue.of(5.5), LimitValue.of(-0.5), "vth0",
                                                               LimitValue.of(0.3), -1, StateDetection.DEFAULT_INST2PROBE),
                            monitor.getSettings());

    MonitorSettings defaults = settingsOf(rule.replace("    monitor_params: {param: vth0, vgt: 0.3, pmosvthsign: -1}\n", ""));
    Assertions.assertEquals("vth", ((MonitorSettings.StateDependent)defaults).param());
    Assertions.assertEquals(LimitValue.of(0.0), ((MonitorSettings.StateDependent)defaults).vgt());
    Assertions.assertNull(((MonitorSettings.StateDependent)defaults).pmosvthsign());
    Assertions.assertNull(((MonitorSettings.StateDependent)defaults).inst2probe());
  }

  @Test
  void testTemperatureDependent() throws SpecParseException, ConversionException {
    String rule = """
          - name: gate pwl
            device: nmos_core
            parameter: v[g,s]
            type: pwl
            message: Gate over temperature
            temperature_dependent: {reference_temp: 25, reference_value: 5.0, temp_coefficient: -0.01}
        """;
    Assertions.assertEquals(new MonitorSettings.TemperatureDependent("v[g,s]", "Gate over temperature", LimitValue.expression("-5.0 + 0.01 * (T - 25)"),
                                                                     LimitValue.expression("5.0 - 0.01 * (T - 25)")),
                            settingsOf(rule));

    // reference temperature from the global section, expression reference value
    MonitorSettings.TemperatureDependent fromGlobal = (MonitorSettings.TemperatureDependent)settingsOf(
        rule.replace("{reference_temp: 25, reference_value: 5.0, temp_coefficient: -0.01}",
                     "{reference_value: \"vmax_core + $w\", temp_coefficient: 0.02}"));
    Assertions.assertEquals(LimitValue.expression("(vmax_core + $w) + 0.02 * (T - 27)"), fromGlobal.vhigh());
    Assertions.assertEquals(LimitValue.expression("-(vmax_core + $w) - 0.02 * (T - 27)"), fromGlobal.vlow());

    MonitorSettings.TemperatureDependent plain = (MonitorSettings.TemperatureDependent)settingsOf(
        rule.replace("    temperature_dependent: {reference_temp: 25, reference_value: 5.0, temp_coefficient: -0.01}\n",
                     "    constraint: {vhigh: 5, vlow: -5}\n"));
    Assertions.assertEquals(LimitValue.of(5), plain.vhigh());
    Assertions.assertEquals(LimitValue.of(-5), plain.vlow());
  }

  @Test
  void testAging() throws SpecParseException, ConversionException {
    Monitor monitor = convert("""
          - name: hci
            device: nmos90_10hv
            parameter: v[d,s]
            type: aging
            aging_check:
              type: hci
              params:
                c: {formula: linear, parameters: [w], coefficients: [2]}
                a: 1.5
                z: 9
        """).getMonitors().get(0);
    Assertions.assertEquals(MonitorKind.OvcheckvaLdmosHciTddb, monitor.getKind());
    MonitorSettings.Aging aging = (MonitorSettings.Aging)monitor.getSettings();
    Assertions.assertEquals("atype", aging.atype());
    Assertions.assertEquals(List.of("soa_hcitddb_a", "soa_hcitddb_c"), List.copyOf(aging.coefficients().keySet()));
    Assertions.assertEquals(LimitValue.of(1.5), aging.coefficients().get("soa_hcitddb_a"));
    Assertions.assertEquals(LimitValue.expression("$w * 2.0"), aging.coefficients().get("soa_hcitddb_c"));
  }

  @Test
  void testParameterCheck() throws SpecParseException, ConversionException {
    MonitorSettings settings = settingsOf("""
          - name: vth drift
            device: nmos_core
            parameter: vth
            type: parameter
            constraint: {vlow: 0.3, vhigh: 0.8}
        """);
    Assertions.assertEquals(new MonitorSettings.ParameterCheck("vth", null, LimitValue.of(0.3), LimitValue.of(0.8)), settings);
  }

  @Test
  void testSelfHeating() throws SpecParseException, ConversionException {
    MonitorSettings settings = settingsOf("""
          - name: heating
            device: nmos_core
            parameter: i[d]
            type: current_with_heating
            constraints:
              - {name: dc, type: idc, ihigh: 0.01}
              - {name: rms, type: irms, ihigh: "vmax_core / 100"}
        """);
    Assertions.assertEquals(new MonitorSettings.SelfHeatingCheck(LimitValue.of(5.0), LimitValue.of(1e-7), "shmonitor_nofeedback", LimitValue.of(0.01),
                                                                 null, LimitValue.of(0.0132)),
                            settings);
  }

  @Test
  void testUnsupportedFormula() {
    ConversionException e = Assertions.assertThrows(ConversionException.class, () -> convert("""
          - name: gate
            device: nmos_core
            parameter: v[g,s]
            type: voltage
            constraint:
              vhigh: {formula: quadratic, parameters: [w], coefficients: [1]}
        """));
    Assertions.assertTrue(e.getMessage().contains("Unsupported limit formula: quadratic"));
  }
}
