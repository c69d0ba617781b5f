package soadsl.model;

import java.util.List;

/**
 * User-facing rule document. Never generated directly; it is lowered into a {@link MonitorDocument} first.
 */
public class UniversalDocument extends SOADocument {
  private final List<Rule> rules;

  public UniversalDocument(String version, String process, String date, GlobalConfig global, List<Rule> rules) {
    super(version, process, date, global);
    this.rules = List.copyOf(rules);
  }

  public List<Rule> getRules() { return rules; }

  @Override
  public String toString() {
    return String.format("UniversalDocument %s/%s with %d rules", getProcess(), getVersion(), rules.size());
  }
}
