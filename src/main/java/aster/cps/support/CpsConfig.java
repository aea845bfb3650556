package aster.cps.support;

/**
 * CPS 变换配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次。
 * 单次编译可通过 {@code CpsCompiler.Options} 覆盖名称前缀与嵌套深度上限。
 */
public final class CpsConfig {
  private CpsConfig() {}

  /**
   * 调试模式开关
   * 环境变量：ASTER_CPS_DEBUG
   * 启用时以 INFO 级别输出变换后的完整模块 JSON
   */
  public static final boolean DEBUG = System.getenv("ASTER_CPS_DEBUG") != null;

  /**
   * 合成标识符前缀（continuation、deferral 计数器、循环下标等）
   * 环境变量：ASTER_CPS_PREFIX
   * 以该前缀开头的名称保留给变换使用
   */
  public static final String NAME_PREFIX = getEnvOrDefault("ASTER_CPS_PREFIX", "__cps_");

  /**
   * 语句嵌套深度上限，超过时报告编译错误而不是让递归耗尽调用栈
   * 环境变量：ASTER_CPS_MAX_DEPTH
   */
  public static final int MAX_DEPTH = parsePositive(System.getenv("ASTER_CPS_MAX_DEPTH"), 256);

  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null && !value.isBlank() ? value : defaultValue;
  }

  static int parsePositive(String raw, int defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      int v = Integer.parseInt(raw.trim());
      return v > 0 ? v : defaultValue;
    } catch (NumberFormatException e) {
      System.getLogger(CpsConfig.class.getName()).log(System.Logger.Level.WARNING,
          "Ignoring invalid ASTER_CPS_MAX_DEPTH value: " + raw);
      return defaultValue;
    }
  }
}
