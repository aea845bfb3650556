package aster.cps.core;

/**
 * 变换期间附加在语句上的标记。
 */
public enum Flag {
  /** 自身是 wait-block，或位于某个 wait-block 的祖先链上 */
  AWAIT,
  /** 循环体（传递地）包含 wait-block 的循环 */
  LOOP,
  /** 目标循环带 LOOP 标记的 break/continue，以及它到目标循环之间的路径 */
  PROPAGATE
}
