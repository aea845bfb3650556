package aster.cps.support;

/**
 * 错误消息统一生成工具。
 *
 * <p>所有面向用户的诊断均提供中英文双语描述并附带恢复提示；内部错误只描述被破坏的不变量。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息，保持英文关键字便于检索。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  /**
   * @param keyword "break" 或 "continue"
   */
  public static String jumpOutsideLoop(String keyword) {
    String message = bilingual(keyword + " 语句不在任何循环内", keyword + " outside of any loop");
    return withHint(message, "删除该语句或将其移入循环体", "Remove the statement or move it into a loop body");
  }

  public static String unknownLabel(String keyword, String label) {
    String message = bilingual(keyword + " 引用的标签 '" + label + "' 不属于任何外层循环",
        keyword + " refers to unknown loop label '" + label + "'");
    return withHint(message, "检查标签拼写，标签只能指向外层循环", "Check the label; it must name an enclosing loop");
  }

  public static String deferOutsideAwait() {
    String message = bilingual("defer 只能出现在 await 块内", "defer() used outside of an await block");
    return withHint(message, "把产生回调的调用放入 await { ... } 中",
        "Wrap the call that creates the callback in an await { ... } block");
  }

  public static String jumpOutOfAwait(String keyword) {
    String message = bilingual(keyword + " 不能跳出所在的 await 块", keyword + " cannot leave an await block");
    return withHint(message, "在 await 块结束后再执行 " + keyword,
        "Move the " + keyword + " after the end of the await block");
  }

  public static String crossLoopJump(String keyword, String label) {
    String message = bilingual(keyword + " 跨越了包含 await 的循环到达外层循环 '" + label + "'",
        keyword + " to outer loop '" + label + "' crosses a loop that contains await");
    return withHint(message, "改用标志变量，在内层循环结束后再跳转",
        "Use a flag variable and jump after the inner loop ends");
  }

  public static String emptyAwait() {
    String message = bilingual("await 块内没有 defer 调用，将立即继续执行",
        "await block creates no deferrals and completes immediately");
    return withHint(message, "确认是否遗漏了 defer()", "Check whether a defer() call is missing");
  }

  public static String nestingTooDeep(int limit) {
    String message = bilingual("语句嵌套超过上限 " + limit, "statement nesting exceeds limit " + limit);
    return withHint(message, "拆分函数，或通过 ASTER_CPS_MAX_DEPTH 调高上限",
        "Split the function or raise ASTER_CPS_MAX_DEPTH");
  }

  public static String compilationFailed(int errorCount) {
    return bilingual("CPS 变换失败，共 " + errorCount + " 个错误", "CPS transform failed with " + errorCount + " error(s)");
  }

  public static String invalidCoreJson(String detail) {
    return bilingual("Core JSON 无法解析：" + detail, "invalid Core JSON: " + detail);
  }

  // ==================== 内部错误 ====================

  public static String propagateWithoutLoop(String kind) {
    return "internal: " + kind + " marked PROPAGATE has no enclosing LOOP continuation";
  }

  public static String residualMark(String kind) {
    return "internal: marked " + kind + " survived rotation";
  }

  public static String residualConstruct(String kind) {
    return "internal: " + kind + " survived rotation";
  }

  public static String unmarkedAwait() {
    return "internal: await block reached the plain copy path without an AWAIT mark";
  }

  public static String unboundDefer() {
    return "internal: defer reached rotation without an enclosing deferral counter";
  }
}
