package aster.cps.transform;

/**
 * 变换内部不变量被破坏。正确输入不会触发；出现即说明标注器或旋转器存在缺陷。
 */
public final class InternalTransformError extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public InternalTransformError(String message) {
    super(message);
  }
}
