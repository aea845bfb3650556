package aster.cps.transform;

import aster.cps.core.CoreModel;
import aster.cps.support.ErrorMessages;
import java.util.ArrayList;
import java.util.List;

/**
 * 复制不需要旋转的语句与表达式，同时完成三件事：
 * 把 defer 绑定到当前 wait-block 的计数器；对嵌套函数体单独做 CPS 变换；
 * 在局部声明被提升的函数里把 Let/Define 改写为赋值。
 */
final class StatementRewriter {
  private final Rotator rotator;
  private final NameSupply names;

  StatementRewriter(Rotator rotator, NameSupply names) {
    this.rotator = rotator;
    this.names = names;
  }

  List<CoreModel.Stmt> copyAll(List<CoreModel.Stmt> stmts, RotationContext ctx) {
    List<CoreModel.Stmt> out = new ArrayList<>(stmts.size());
    for (CoreModel.Stmt s : stmts) {
      out.add(copy(s, ctx));
    }
    return out;
  }

  CoreModel.Block copyBlock(CoreModel.Block b, RotationContext ctx) {
    return b == null ? null : new CoreModel.Block(copyAll(b.statements(), ctx));
  }

  CoreModel.Stmt copy(CoreModel.Stmt s, RotationContext ctx) {
    if (s instanceof CoreModel.Block b) {
      return copyBlock(b, ctx);
    } else if (s instanceof CoreModel.Let let) {
      return bind(let.name(), expr(let.expr(), ctx));
    } else if (s instanceof CoreModel.Set set) {
      return new CoreModel.Set(set.name(), expr(set.expr(), ctx));
    } else if (s instanceof CoreModel.Eval ev) {
      return new CoreModel.Eval(expr(ev.expr(), ctx));
    } else if (s instanceof CoreModel.Return ret) {
      return new CoreModel.Return(expr(ret.expr(), ctx));
    } else if (s instanceof CoreModel.If iff) {
      return new CoreModel.If(expr(iff.cond(), ctx), copyBlock(iff.thenBlock(), ctx), copyBlock(iff.elseBlock(), ctx));
    } else if (s instanceof CoreModel.Switch sw) {
      List<CoreModel.Case> cases = new ArrayList<>();
      for (CoreModel.Case c : sw.cases()) {
        cases.add(new CoreModel.Case(expr(c.guard(), ctx), copyBlock(c.body(), ctx)));
      }
      return new CoreModel.Switch(expr(sw.subject(), ctx), cases, copyBlock(sw.defaultBlock(), ctx));
    } else if (s instanceof CoreModel.Loop loop) {
      return new CoreModel.Loop(loop.label(), loop.loopKind(), loop.var(), expr(loop.expr(), ctx), copyBlock(loop.body(), ctx));
    } else if (s instanceof CoreModel.Define def) {
      CoreModel.Block body = rotator.rotateFunction(def.body(), def.params());
      if (rotator.isHoisted(def.name())) {
        return new CoreModel.Set(def.name(), new CoreModel.Lambda(def.params(), body));
      }
      return new CoreModel.Define(def.name(), def.params(), body);
    } else if (s instanceof CoreModel.Await) {
      throw new InternalTransformError(ErrorMessages.unmarkedAwait());
    }
    // 普通 break/continue 保持原样
    return s;
  }

  /**
   * 声明一个局部名称：提升过的名称只需赋值。
   */
  CoreModel.Stmt bind(String name, CoreModel.Expr value) {
    if (rotator.isHoisted(name)) {
      return new CoreModel.Set(name, value);
    }
    return new CoreModel.Let(name, value);
  }

  CoreModel.Expr expr(CoreModel.Expr e, RotationContext ctx) {
    if (e == null) {
      return null;
    }
    if (e instanceof CoreModel.Defer d) {
      return bindDefer(d, ctx);
    } else if (e instanceof CoreModel.Lambda l) {
      return new CoreModel.Lambda(l.params(), rotator.rotateFunction(l.body(), l.params()));
    } else if (e instanceof CoreModel.Call c) {
      List<CoreModel.Expr> args = new ArrayList<>(c.args().size());
      for (CoreModel.Expr a : c.args()) args.add(expr(a, ctx));
      return new CoreModel.Call(expr(c.target(), ctx), args);
    } else if (e instanceof CoreModel.Member m) {
      return new CoreModel.Member(expr(m.target(), ctx), m.name());
    } else if (e instanceof CoreModel.Index ix) {
      return new CoreModel.Index(expr(ix.target(), ctx), expr(ix.index(), ctx));
    } else if (e instanceof CoreModel.Unary u) {
      return new CoreModel.Unary(u.op(), expr(u.expr(), ctx));
    } else if (e instanceof CoreModel.Binary b) {
      return new CoreModel.Binary(b.op(), expr(b.left(), ctx), expr(b.right(), ctx));
    } else if (e instanceof CoreModel.ListE list) {
      List<CoreModel.Expr> items = new ArrayList<>(list.items().size());
      for (CoreModel.Expr item : list.items()) items.add(expr(item, ctx));
      return new CoreModel.ListE(items);
    }
    // 字面量与名称不可变，直接复用
    return e;
  }

  /**
   * {@code defer(x, y)} 改写为 {@code c.defer((a1, a2) -> { x = a1; y = a2; })}；无输出参数时不生成赋值函数。
   */
  private CoreModel.Expr bindDefer(CoreModel.Defer d, RotationContext ctx) {
    if (ctx.counter() == null) {
      throw new InternalTransformError(ErrorMessages.unboundDefer());
    }
    if (d.outputs().isEmpty()) {
      return RuntimeProtocol.defer(ctx.counter(), null);
    }
    List<String> params = new ArrayList<>();
    List<CoreModel.Stmt> assigns = new ArrayList<>();
    for (String output : d.outputs()) {
      String param = names.fresh("arg");
      params.add(param);
      assigns.add(new CoreModel.Set(output, new CoreModel.Name(param)));
    }
    return RuntimeProtocol.defer(ctx.counter(), new CoreModel.Lambda(params, new CoreModel.Block(assigns)));
  }
}
