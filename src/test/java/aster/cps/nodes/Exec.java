package aster.cps.nodes;

import aster.cps.runtime.Builtins;
import java.util.Objects;

public final class Exec {
  private Exec() {}

  /**
   * 调用闭包或内建函数；运行时回调也经由此处进入求值器。
   */
  public static Object invoke(Object fn, Object[] args) {
    if (fn instanceof ClosureValue closure) return closure.call(args);
    if (fn instanceof Builtins.BuiltinFunction builtin) return builtin.call(args);
    throw new RuntimeException("Value is not callable: " + fn);
  }

  public static boolean toBool(Object o) {
    if (o instanceof Boolean b) return b;
    if (o instanceof Number n) return n.longValue() != 0L;
    if (o instanceof String s) return !s.isEmpty();
    return o != null;
  }

  public static long toLong(Object o) {
    if (o instanceof Number n) return n.longValue();
    throw new RuntimeException("Expected number, got: " + (o == null ? "null" : o.getClass().getSimpleName()));
  }

  public static boolean valueEquals(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) return x.longValue() == y.longValue();
    return Objects.equals(a, b);
  }

  public static String show(Object o) {
    return String.valueOf(o);
  }
}
