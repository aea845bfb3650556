package aster.cps.transform;

import aster.cps.core.CoreModel;
import aster.cps.core.Statements;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 收集函数体内引入的局部名称，不进入嵌套函数体。
 *
 * <p>含 wait-block 的函数会被拆成多个 continuation 闭包，块级绑定在拆分后对后续 continuation 不可见；
 * 因此这类函数的局部名称统一提升到函数开头。除了 Let、for-in 循环变量和 Define，
 * 对未声明名称的 Set 与 defer 的输出参数同样会在当前作用域引入绑定。</p>
 */
final class LocalVariables {
  private LocalVariables() {}

  /**
   * Let、for-in 循环变量与 Define 声明的名称。
   *
   * @param body 函数体
   * @param params 函数参数，参数名不参与提升
   * @return 按首次出现顺序排列的名称集合
   */
  static Set<String> collect(CoreModel.Block body, Collection<String> params) {
    Set<String> names = new LinkedHashSet<>();
    collectDeclared(body, names);
    names.removeAll(params);
    return names;
  }

  /**
   * Set 的目标与 defer 的输出参数。是否需要提升取决于外层函数是否已有同名绑定，由调用方判断。
   */
  static Set<String> assigned(CoreModel.Block body) {
    Set<String> names = new LinkedHashSet<>();
    collectAssigned(body, names);
    return names;
  }

  private static void collectDeclared(CoreModel.Stmt s, Set<String> names) {
    if (s instanceof CoreModel.Let let) {
      names.add(let.name());
    } else if (s instanceof CoreModel.Define def) {
      names.add(def.name());
    } else if (s instanceof CoreModel.Loop loop && loop.var() != null) {
      names.add(loop.var());
    }
    for (CoreModel.Stmt child : Statements.children(s)) {
      collectDeclared(child, names);
    }
  }

  private static void collectAssigned(CoreModel.Stmt s, Set<String> names) {
    if (s instanceof CoreModel.Let let) {
      outputs(let.expr(), names);
    } else if (s instanceof CoreModel.Set set) {
      names.add(set.name());
      outputs(set.expr(), names);
    } else if (s instanceof CoreModel.Eval ev) {
      outputs(ev.expr(), names);
    } else if (s instanceof CoreModel.Return ret) {
      outputs(ret.expr(), names);
    } else if (s instanceof CoreModel.If iff) {
      outputs(iff.cond(), names);
    } else if (s instanceof CoreModel.Switch sw) {
      outputs(sw.subject(), names);
      for (CoreModel.Case c : sw.cases()) outputs(c.guard(), names);
    } else if (s instanceof CoreModel.Loop loop) {
      outputs(loop.expr(), names);
    }
    for (CoreModel.Stmt child : Statements.children(s)) {
      collectAssigned(child, names);
    }
  }

  /** defer 的输出参数；Lambda 属于独立函数，不进入。 */
  private static void outputs(CoreModel.Expr e, Set<String> names) {
    if (e == null || e instanceof CoreModel.Lambda) {
      return;
    }
    if (e instanceof CoreModel.Defer d) {
      names.addAll(d.outputs());
    } else if (e instanceof CoreModel.Call c) {
      outputs(c.target(), names);
      for (CoreModel.Expr a : c.args()) outputs(a, names);
    } else if (e instanceof CoreModel.Member m) {
      outputs(m.target(), names);
    } else if (e instanceof CoreModel.Index ix) {
      outputs(ix.target(), names);
      outputs(ix.index(), names);
    } else if (e instanceof CoreModel.Unary u) {
      outputs(u.expr(), names);
    } else if (e instanceof CoreModel.Binary b) {
      outputs(b.left(), names);
      outputs(b.right(), names);
    } else if (e instanceof CoreModel.ListE list) {
      for (CoreModel.Expr item : list.items()) outputs(item, names);
    }
  }
}
