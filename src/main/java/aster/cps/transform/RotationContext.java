package aster.cps.transform;

import aster.cps.core.CoreModel;
import java.util.List;

/**
 * 旋转一段语句时的上下文。
 *
 * @param tail 这段语句正常结束后要执行的语句（对外层 continuation 的调用），可能为空
 * @param loop 最近的 LOOP 循环的跳转目标；不在此类循环内时为 null
 * @param counter 当前 wait-block 的 deferral 计数器变量名；不在 wait-block 内时为 null
 */
record RotationContext(List<CoreModel.Stmt> tail, LoopFrame loop, String counter) {

  /** break 跳到 breakName（循环之后），continue 跳到 nextName（下一轮）。 */
  record LoopFrame(String breakName, String nextName) {}

  static RotationContext functionRoot() {
    return new RotationContext(List.of(), null, null);
  }

  RotationContext withTail(List<CoreModel.Stmt> newTail) {
    return new RotationContext(List.copyOf(newTail), loop, counter);
  }
}
