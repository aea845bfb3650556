package aster.cps.transform;

import aster.cps.core.CoreModel;
import java.util.List;

/**
 * 生成代码调用的运行时协议。协议由宿主运行时实现，这里只按名称构造调用。
 *
 * <pre>
 * c = newDeferralCounter(k)   创建计数器，计数归零且已 fulfill 时调用 k()
 * cb = c.defer(assign?)       计数加一并返回回调；回调被调用时计数减一，assign 接收回调参数
 * c.fulfill()                 wait-block 内的 defer 已全部创建
 * </pre>
 */
public final class RuntimeProtocol {
  private RuntimeProtocol() {}

  public static final String NEW_COUNTER = "newDeferralCounter";
  public static final String DEFER = "defer";
  public static final String FULFILL = "fulfill";

  /** 调用无参 continuation 的语句：{@code name()} */
  static CoreModel.Stmt call(String name) {
    return new CoreModel.Eval(new CoreModel.Call(new CoreModel.Name(name), List.of()));
  }

  static CoreModel.Expr newCounter(CoreModel.Expr continuation) {
    return new CoreModel.Call(new CoreModel.Name(NEW_COUNTER), List.of(continuation));
  }

  static CoreModel.Expr defer(String counter, CoreModel.Lambda assign) {
    CoreModel.Expr target = new CoreModel.Member(new CoreModel.Name(counter), DEFER);
    return new CoreModel.Call(target, assign == null ? List.of() : List.of(assign));
  }

  static CoreModel.Stmt fulfill(String counter) {
    CoreModel.Expr target = new CoreModel.Member(new CoreModel.Name(counter), FULFILL);
    return new CoreModel.Eval(new CoreModel.Call(target, List.of()));
  }

  /**
   * 把 tail 包装成可传给计数器的 continuation 值。tail 恰好是单个无参调用时直接引用被调函数。
   */
  static CoreModel.Expr continuationValue(List<CoreModel.Stmt> tail) {
    if (tail.size() == 1
        && tail.get(0) instanceof CoreModel.Eval ev
        && ev.expr() instanceof CoreModel.Call call
        && call.args().isEmpty()
        && call.target() instanceof CoreModel.Name) {
      return call.target();
    }
    return new CoreModel.Lambda(List.of(), new CoreModel.Block(tail));
  }
}
