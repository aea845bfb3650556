package aster.cps.core;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句树的通用遍历辅助。
 */
public final class Statements {
  private Statements() {}

  /**
   * 直接子语句（各分支、循环体、wait-block 体）。不进入 Define 的函数体：函数体属于独立的编译单元。
   */
  public static List<CoreModel.Stmt> children(CoreModel.Stmt s) {
    if (s instanceof CoreModel.Block b) return b.statements();
    if (s instanceof CoreModel.If iff) {
      if (iff.elseBlock() == null) return List.of(iff.thenBlock());
      return List.of(iff.thenBlock(), iff.elseBlock());
    }
    if (s instanceof CoreModel.Switch sw) {
      List<CoreModel.Stmt> out = new ArrayList<>();
      for (var c : sw.cases()) out.add(c.body());
      if (sw.defaultBlock() != null) out.add(sw.defaultBlock());
      return out;
    }
    if (s instanceof CoreModel.Loop loop) return List.of(loop.body());
    if (s instanceof CoreModel.Await a) return List.of(a.body());
    return List.of();
  }

  /** 语句种类的简短名称，用于日志与错误信息。 */
  public static String kindName(CoreModel.Stmt s) {
    return s.getClass().getSimpleName();
  }
}
