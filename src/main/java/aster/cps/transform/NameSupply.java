package aster.cps.transform;

/**
 * 合成标识符分配器。同一次编译内名称全局唯一，所有名称以保留前缀开头。
 */
public final class NameSupply {
  private final String prefix;
  private int counter;

  public NameSupply(String prefix) {
    this.prefix = prefix;
  }

  /**
   * @param hint 名称用途（如 "k"、"break"），只影响可读性
   */
  public String fresh(String hint) {
    return prefix + hint + (++counter);
  }

  public String prefix() { return prefix; }
}
