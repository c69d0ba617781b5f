package soadsl.drc;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered errors and warnings of one validator run.
 */
public class ValidationReport {
  private final List<Diagnostic> errors;
  private final List<Diagnostic> warnings;

  public ValidationReport(List<Diagnostic> errors, List<Diagnostic> warnings) {
    this.errors = List.copyOf(errors);
    this.warnings = List.copyOf(warnings);
  }

  public List<Diagnostic> getErrors() { return errors; }
  public List<Diagnostic> getWarnings() { return warnings; }

  /** Errors first, then warnings. */
  public List<Diagnostic> getDiagnostics() {
    List<Diagnostic> ret = new ArrayList<>(errors);
    ret.addAll(warnings);
    return ret;
  }

  public boolean hasErrors() { return !errors.isEmpty(); }

  /** Strict mode fails on any diagnostic, non-strict mode only on errors. */
  public boolean passed(boolean strict) { return errors.isEmpty() && (!strict || warnings.isEmpty()); }

  /** Human readable report, one diagnostic per line. */
  public String format() {
    StringBuilder ret = new StringBuilder();
    if (!errors.isEmpty()) {
      ret.append(errors.size()).append(" error(s):\n");
      errors.forEach(diag -> ret.append("  ").append(diag).append('\n'));
    }
    if (!warnings.isEmpty()) {
      ret.append(warnings.size()).append(" warning(s):\n");
      warnings.forEach(diag -> ret.append("  ").append(diag).append('\n'));
    }
    if (errors.isEmpty() && warnings.isEmpty())
      ret.append("Validation passed - no errors or warnings\n");
    return ret.toString();
  }

  @Override
  public String toString() {
    return String.format("ValidationReport (%d errors, %d warnings)", errors.size(), warnings.size());
  }
}
