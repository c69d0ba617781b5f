package soadsl;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import soadsl.backend.SpectreGenerator;
import soadsl.convert.ConversionException;
import soadsl.convert.UniversalConverter;
import soadsl.drc.RuleChecker;
import soadsl.drc.ValidationReport;
import soadsl.frontend.MonitorDocumentWriter;
import soadsl.frontend.SpecParseException;
import soadsl.frontend.SpecParser;
import soadsl.library.DeviceDatab;
import soadsl.library.DeviceLibrary;
import soadsl.library.LibraryException;
import soadsl.library.MonitorDatab;
import soadsl.library.MonitorLibrary;
import soadsl.model.MonitorDocument;
import soadsl.model.SOADocument;
import soadsl.model.UniversalDocument;
import soadsl.ui.SOADSLConfig;

/**
 * Entry point to the compiler pipeline: parse, validate, lower and generate.
 */
public class SOADSL {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Outcome of {@link SOADSL#compile}; {@code netlist} is null if validation failed. */
  public static record Compilation(ValidationReport report, String netlist) {
    public boolean succeeded() { return netlist != null; }
  }

  private static final ValidationReport NO_DIAGNOSTICS = new ValidationReport(List.of(), List.of());

  private final SpecParser parser = new SpecParser();
  private final RuleChecker checker;
  private final UniversalConverter converter;
  private final SpectreGenerator generator = new SpectreGenerator();
  private final MonitorDocumentWriter writer = new MonitorDocumentWriter();

  public SOADSL(DeviceLibrary devices, MonitorLibrary monitors) {
    Set<String> knownDevices = new HashSet<>(RuleChecker.KNOWN_DEVICES);
    knownDevices.addAll(devices.names());
    this.checker = new RuleChecker(knownDevices);
    this.converter = new UniversalConverter(devices, monitors);
  }

  /** Loads the device and monitor libraries named in {@code config}. */
  public static SOADSL fromConfig(SOADSLConfig config) throws LibraryException {
    DeviceDatab devices = DeviceDatab.load(Paths.get(config.devices_path));
    MonitorDatab monitors = MonitorDatab.load(Paths.get(config.monitors_path));
    logger.info("SOADSL. Loaded {} devices from {}", devices.names().size(), config.devices_path);
    return new SOADSL(devices, monitors);
  }

  public SOADocument parse(Path file) throws SpecParseException { return parser.parseFile(file); }

  public SOADocument parse(String text) throws SpecParseException { return parser.parse(text); }

  /** Monitor documents are checked structurally by the parser; their report is always empty. */
  public ValidationReport validate(SOADocument document) {
    if (document instanceof UniversalDocument)
      return checker.check((UniversalDocument)document);
    return NO_DIAGNOSTICS;
  }

  public MonitorDocument convert(SOADocument document) throws ConversionException {
    if (document instanceof UniversalDocument)
      return converter.convert((UniversalDocument)document);
    return (MonitorDocument)document;
  }

  /** Netlist text of {@code document}; universal documents are lowered first. */
  public String generate(SOADocument document) throws ConversionException { return generator.generate(convert(document)); }

  public String toYaml(MonitorDocument document) { return writer.write(document); }

  /**
   * Validates, then generates unless validation fails.
   *
   * @param strict warnings fail validation
   * @param skipValidation generate without validating; the report is then empty
   */
  public Compilation compile(SOADocument document, boolean strict, boolean skipValidation) throws ConversionException {
    ValidationReport report = skipValidation ? NO_DIAGNOSTICS : validate(document);
    if (!report.passed(strict)) {
      logger.warn("SOADSL. Validation failed with {} errors and {} warnings", report.getErrors().size(), report.getWarnings().size());
      return new Compilation(report, null);
    }
    return new Compilation(report, generate(document));
  }
}
