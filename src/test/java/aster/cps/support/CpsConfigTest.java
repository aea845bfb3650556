package aster.cps.support;

import static org.junit.jupiter.api.Assertions.*;

import aster.cps.core.CoreModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class CpsConfigTest {

  @Test
  public void testDefaults() {
    assertFalse(CpsConfig.NAME_PREFIX.isBlank());
    assertTrue(CpsConfig.MAX_DEPTH > 0);
  }

  @ParameterizedTest
  @CsvSource(value = {"NIL, 64", "'  ', 64", "' 10 ', 10", "-3, 64", "0, 64", "deep, 64"}, nullValues = "NIL")
  public void testParsePositive(String raw, int expected) {
    assertEquals(expected, CpsConfig.parsePositive(raw, 64));
  }

  @Test
  public void testDiagnosticRendering() {
    DiagnosticSink sink = new DiagnosticSink();
    sink.warning(Diagnostic.EMPTY_AWAIT, ErrorMessages.emptyAwait(), null);
    sink.error(Diagnostic.UNKNOWN_LABEL, ErrorMessages.unknownLabel("break", "outer"), new CoreModel.Span(4, 9));

    assertTrue(sink.hasErrors());
    assertEquals(2, sink.all().size());
    String rendered = sink.errors().get(0).toString();
    assertTrue(rendered.startsWith("error[E_UNKNOWN_LABEL] 4:9: "), rendered);
    assertTrue(rendered.contains("提示"), rendered);
    assertTrue(sink.warnings().get(0).toString().startsWith("warning[W_EMPTY_AWAIT]: "));
  }
}
