package aster.cps.transform;

import aster.cps.core.CoreModel;
import aster.cps.core.FlagTable;
import aster.cps.core.Statements;
import aster.cps.support.ErrorMessages;

/**
 * 旋转后的不变量检查：输出中不能残留 wait-block 或 defer，也不能出现任何带标记的输入节点
 * （带标记的节点必须在旋转中被重建为 continuation 调用）。
 */
public final class RotationVerifier {
  private final FlagTable flags;

  public RotationVerifier(FlagTable flags) {
    this.flags = flags;
  }

  /**
   * @throws InternalTransformError 发现残留时
   */
  public void verify(CoreModel.Module module) {
    for (CoreModel.Func fn : module.funcs()) {
      verifyStmt(fn.body());
    }
  }

  public void verifyStmt(CoreModel.Stmt s) {
    if (flags.isMarked(s)) {
      throw new InternalTransformError(ErrorMessages.residualMark(Statements.kindName(s)));
    }
    if (s instanceof CoreModel.Await) {
      throw new InternalTransformError(ErrorMessages.residualConstruct("Await"));
    }
    if (s instanceof CoreModel.Let let) {
      verifyExpr(let.expr());
    } else if (s instanceof CoreModel.Set set) {
      verifyExpr(set.expr());
    } else if (s instanceof CoreModel.Eval ev) {
      verifyExpr(ev.expr());
    } else if (s instanceof CoreModel.Return ret) {
      verifyExpr(ret.expr());
    } else if (s instanceof CoreModel.If iff) {
      verifyExpr(iff.cond());
    } else if (s instanceof CoreModel.Switch sw) {
      verifyExpr(sw.subject());
      for (CoreModel.Case c : sw.cases()) verifyExpr(c.guard());
    } else if (s instanceof CoreModel.Loop loop) {
      verifyExpr(loop.expr());
    } else if (s instanceof CoreModel.Define def) {
      verifyStmt(def.body());
    }
    for (CoreModel.Stmt child : Statements.children(s)) {
      verifyStmt(child);
    }
  }

  private void verifyExpr(CoreModel.Expr e) {
    if (e == null) {
      return;
    }
    if (e instanceof CoreModel.Defer) {
      throw new InternalTransformError(ErrorMessages.residualConstruct("Defer"));
    } else if (e instanceof CoreModel.Lambda l) {
      verifyStmt(l.body());
    } else if (e instanceof CoreModel.Call c) {
      verifyExpr(c.target());
      for (CoreModel.Expr a : c.args()) verifyExpr(a);
    } else if (e instanceof CoreModel.Member m) {
      verifyExpr(m.target());
    } else if (e instanceof CoreModel.Index ix) {
      verifyExpr(ix.target());
      verifyExpr(ix.index());
    } else if (e instanceof CoreModel.Unary u) {
      verifyExpr(u.expr());
    } else if (e instanceof CoreModel.Binary b) {
      verifyExpr(b.left());
      verifyExpr(b.right());
    } else if (e instanceof CoreModel.ListE list) {
      for (CoreModel.Expr item : list.items()) verifyExpr(item);
    }
  }
}
