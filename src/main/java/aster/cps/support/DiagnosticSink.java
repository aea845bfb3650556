package aster.cps.support;

import aster.cps.core.CoreModel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 收集一次编译中产生的全部诊断，保持报告顺序。
 */
public final class DiagnosticSink {
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public void error(String code, String message, CoreModel.Span span) {
    diagnostics.add(new Diagnostic(Diagnostic.Severity.ERROR, code, message, span));
  }

  public void warning(String code, String message, CoreModel.Span span) {
    diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, code, message, span));
  }

  public boolean hasErrors() {
    for (Diagnostic d : diagnostics) {
      if (d.isError()) return true;
    }
    return false;
  }

  public List<Diagnostic> errors() { return filter(Diagnostic.Severity.ERROR); }

  public List<Diagnostic> warnings() { return filter(Diagnostic.Severity.WARNING); }

  public List<Diagnostic> all() { return Collections.unmodifiableList(diagnostics); }

  private List<Diagnostic> filter(Diagnostic.Severity severity) {
    List<Diagnostic> out = new ArrayList<>();
    for (Diagnostic d : diagnostics) {
      if (d.severity() == severity) out.add(d);
    }
    return out;
  }
}
