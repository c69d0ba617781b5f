package soadsl.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import soadsl.expr.ExpressionEvaluator;
import soadsl.model.Branch;
import soadsl.model.CommonParams;
import soadsl.model.LimitValue;
import soadsl.model.Monitor;
import soadsl.model.MonitorDocument;
import soadsl.model.MonitorSettings;
import soadsl.util.GenerateText.DictWords;
import soadsl.util.Numbers;
import soadsl.util.Spectre;

/**
 * Writes a monitor document as a Spectre netlist: a header, the shared {@code base} section with the Verilog-A includes and
 * netlist parameters, then one section per monitor.
 * <p>
 * Output depends on the document only.
 */
public class SpectreGenerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final List<String> VERILOGA_INCLUDES =
      List.of("./veriloga/ovcheck_mos_alt.va", "./veriloga/ovcheck_pwl_alt.va", "./veriloga/ovcheck_ldmos_hci_tddb_alt.va",
              "./veriloga/parcheck3.va", "./veriloga/selfheating_monitor_nofeedback.va");
  public static final String BASE_SECTION = "base";

  private static final Pattern BRANCH_KEY = Pattern.compile("branch\\d*");
  private static final Pattern TEXT_KEY = Pattern.compile("message\\d*|param");

  private final Spectre language = new Spectre();
  private final ExpressionEvaluator rewriter = new ExpressionEvaluator();

  public String generate(MonitorDocument document) {
    StringBuilder out = new StringBuilder();
    writeHeader(out, document);
    writeBaseSection(out, document.getParameters());
    for (Monitor monitor : document.getMonitors()) {
      writeMonitor(out, monitor);
      out.append('\n');
    }
    logger.info("SpectreGenerator. Generated {} monitor sections for process {}", document.getMonitors().size(), document.getProcess());
    return out.toString();
  }

  private void writeHeader(StringBuilder out, MonitorDocument document) {
    line(out, language.GetDict(DictWords.simulator_lang));
    line(out, language.Comment("Generated from SOA DSL"));
    line(out, language.Comment("Process: " + document.getProcess()));
    line(out, language.Comment("Date: " + document.getDate()));
    line(out, language.Comment("Version: " + document.getVersion()));
    out.append('\n');
  }

  private void writeBaseSection(StringBuilder out, Map<String, LimitValue> parameters) {
    line(out, language.Section(BASE_SECTION));
    out.append('\n');
    VERILOGA_INCLUDES.forEach(include -> line(out, language.Include(include)));
    out.append('\n');
    if (!parameters.isEmpty()) {
      line(out, language.GetDict(DictWords.parameters));
      parameters.forEach((key, value) -> line(out, language.Continue(key + " = " + value(value))));
      out.append('\n');
    }
    line(out, language.EndSection(BASE_SECTION));
    out.append('\n');
  }

  private void writeMonitor(StringBuilder out, Monitor monitor) {
    line(out, language.Section(monitor.getSection()));
    line(out, language.Model(monitor.getModelName(), monitor.getKind().serialName));
    CommonParams common = monitor.getCommon();
    line(out, language.Continue(String.join(" ", language.Assign("tmin", value(common.tmin())), language.Assign("tdelay", value(common.tdelay())),
                                            language.Assign("vballmsg", value(common.vballmsg())),
                                            language.Assign("stop", value(common.stop())))));
    common.getTmaxfrac().ifPresent(alias -> line(out, language.Continue(language.Assign("tmaxfrac", alias))));
    for (String kindLine : monitor.getSettings().accept(new KindLines()))
      line(out, language.Continue(kindLine));
    monitor.getExtra().forEach((key, value) -> line(out, language.Continue(language.Assign(key, extra(key, value)))));
    line(out, language.EndSection(monitor.getSection()));
    logger.debug("SpectreGenerator. Wrote section {} ({})", monitor.getSection(), monitor.getKind());
  }

  private static void line(StringBuilder out, String text) { out.append(text).append('\n'); }

  private String value(LimitValue value) { return rewriter.toBackendSyntax(value); }

  /**
   * Pass-through parameters render like typed ones: branches and messages quoted, numbers and expressions bare, any other text
   * quoted.
   */
  private String extra(String key, Object value) {
    if (value instanceof Number)
      return Numbers.format((Number)value);
    String text = String.valueOf(value);
    if (BRANCH_KEY.matcher(key).matches())
      return language.Quote(rewriter.toBackendSyntax(text));
    if (TEXT_KEY.matcher(key).matches())
      return language.Quote(text);
    if (value instanceof Boolean || ExpressionEvaluator.isExpression(text))
      return rewriter.toBackendSyntax(text);
    return language.Quote(text);
  }

  /** Continuation line contents, without the leading {@code +}, for each settings variant. */
  private class KindLines implements MonitorSettings.Visitor<List<String>> {
    private final List<String> lines = new ArrayList<>();

    /** Collects the set assignments of one line; nothing is added if none is set. */
    private class Line {
      private final List<String> parts = new ArrayList<>();

      Line value(String key, LimitValue v) {
        if (v != null)
          parts.add(language.Assign(key, SpectreGenerator.this.value(v)));
        return this;
      }
      Line string(String key, String text) {
        if (text != null)
          parts.add(language.Assign(key, language.Quote(text)));
        return this;
      }
      /** A measured quantity, rewritten to netlist syntax before quoting. */
      Line branch(String key, String quantity) {
        if (quantity != null)
          parts.add(language.Assign(key, language.Quote(rewriter.toBackendSyntax(quantity))));
        return this;
      }
      Line word(String key, String text) {
        if (text != null)
          parts.add(language.Assign(key, text));
        return this;
      }
      void end() {
        if (!parts.isEmpty())
          lines.add(String.join(" ", parts));
      }
    }

    private Line line() { return new Line(); }

    @Override
    public List<String> visit(MonitorSettings.SingleBranch settings) {
      line().value("vlow", settings.vlow()).value("vhigh", settings.vhigh()).branch("branch1", settings.branch())
          .string("message1", settings.message()).end();
      return lines;
    }

    @Override
    public List<String> visit(MonitorSettings.SelfHeatingCheck settings) {
      line().value("dtmax", settings.dtmax()).value("theat", settings.theat()).word("monitor", settings.monitor()).end();
      line().value("idc_high", settings.idcHigh()).end();
      line().value("ipeak_high", settings.ipeakHigh()).end();
      line().value("irms_high", settings.irmsHigh()).end();
      return lines;
    }

    @Override
    public List<String> visit(MonitorSettings.MultiBranch settings) {
      int i = 1;
      for (Branch branch : settings.branches()) {
        line().value("vlow" + i, branch.vlow()).value("vhigh" + i, branch.vhigh()).branch("branch" + i, branch.branch())
            .string("message" + i, branch.message()).end();
        ++i;
      }
      return lines;
    }

    @Override
    public List<String> visit(MonitorSettings.StateDependent settings) {
      line().value("vhigh_on", settings.vhighOn()).end();
      line().value("vhigh_off", settings.vhighOff()).end();
      line().value("vhigh_gc", settings.vhighGc()).end();
      line().value("vlow_gc", settings.vlowGc()).end();
      line().string("param", settings.param()).end();
      line().value("vgt", settings.vgt()).end();
      line().word("pmosvthsign", settings.pmosvthsign() == null ? null : settings.pmosvthsign().toString()).end();
      line().string("inst2probe", settings.inst2probe()).end();
      return lines;
    }

    @Override
    public List<String> visit(MonitorSettings.TemperatureDependent settings) {
      line().value("vlow", settings.vlow()).end();
      line().value("vhigh", settings.vhigh()).end();
      line().branch("branch1", settings.branch()).end();
      line().string("message1", settings.message()).end();
      return lines;
    }

    @Override
    public List<String> visit(MonitorSettings.Aging settings) {
      line().word("atype", settings.atype()).end();
      settings.coefficients().forEach((key, v) -> line().value(key, v).end());
      return lines;
    }

    @Override
    public List<String> visit(MonitorSettings.ParameterCheck settings) {
      line().string("param", settings.param()).end();
      line().value("vgt", settings.vgt()).end();
      line().value("vlow", settings.vlow()).end();
      line().value("vhigh", settings.vhigh()).end();
      return lines;
    }
  }
}
