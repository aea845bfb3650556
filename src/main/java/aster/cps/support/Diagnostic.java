package aster.cps.support;

import aster.cps.core.CoreModel;

/**
 * 编译诊断：ERROR 使本次编译失败，WARNING 随结果返回。
 *
 * @param severity 严重级别
 * @param code 稳定的诊断代码，测试与工具据此匹配
 * @param message 面向用户的双语描述
 * @param span 出错节点位置，可能为 null
 */
public record Diagnostic(Severity severity, String code, String message, CoreModel.Span span) {

  public enum Severity { ERROR, WARNING }

  public static final String BREAK_OUTSIDE_LOOP = "E_BREAK_OUTSIDE_LOOP";
  public static final String CONTINUE_OUTSIDE_LOOP = "E_CONTINUE_OUTSIDE_LOOP";
  public static final String UNKNOWN_LABEL = "E_UNKNOWN_LABEL";
  public static final String DEFER_OUTSIDE_AWAIT = "E_DEFER_OUTSIDE_AWAIT";
  public static final String JUMP_OUT_OF_AWAIT = "E_JUMP_OUT_OF_AWAIT";
  public static final String CROSS_LOOP_JUMP = "E_CROSS_LOOP_JUMP";
  public static final String NESTING_TOO_DEEP = "E_NESTING_TOO_DEEP";
  public static final String EMPTY_AWAIT = "W_EMPTY_AWAIT";

  public boolean isError() { return severity == Severity.ERROR; }

  @Override
  public String toString() {
    String where = span != null ? " " + span : "";
    return severity.name().toLowerCase(java.util.Locale.ROOT) + "[" + code + "]" + where + ": " + message;
  }
}
