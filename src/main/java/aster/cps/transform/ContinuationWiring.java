package aster.cps.transform;

import aster.cps.core.CoreModel;
import aster.cps.core.Statements;
import aster.cps.core.StmtVisitor;
import aster.cps.support.ErrorMessages;
import java.util.ArrayList;
import java.util.List;

/**
 * 按拆分点语句的种类决定如何接上 continuation（即上下文中的 tail）。
 *
 * <table>
 *   <tr><td>Await</td><td>创建计数器，tail 作为计数器的 continuation；块体以 fulfill 结束</td></tr>
 *   <tr><td>If / Switch</td><td>每个分支各自旋转并以 tail 结束；缺省分支补一个只含 tail 的分支</td></tr>
 *   <tr><td>Loop</td><td>tail 成为循环结束后的 break continuation；循环体以调用 next 重新开始下一轮</td></tr>
 *   <tr><td>Break / Continue</td><td>改为调用最近 LOOP 循环的 break / next，丢弃 tail</td></tr>
 *   <tr><td>其它</td><td>原语句之后直接追加 tail</td></tr>
 * </table>
 */
final class ContinuationWiring implements StmtVisitor<List<CoreModel.Stmt>> {
  private final Rotator rotator;
  private final StatementRewriter rewriter;
  private final NameSupply names;
  private final RotationContext ctx;

  ContinuationWiring(Rotator rotator, RotationContext ctx) {
    this.rotator = rotator;
    this.rewriter = rotator.rewriter();
    this.names = rotator.names();
    this.ctx = ctx;
  }

  @Override
  public List<CoreModel.Stmt> visitBlock(CoreModel.Block s) {
    return List.of(rotator.rotate(s, ctx));
  }

  @Override
  public List<CoreModel.Stmt> visitIf(CoreModel.If s) {
    CoreModel.Block thenBlock = rotator.rotate(s.thenBlock(), ctx);
    CoreModel.Block elseBlock = branchOrTail(s.elseBlock());
    return List.of(new CoreModel.If(rewriter.expr(s.cond(), ctx), thenBlock, elseBlock));
  }

  @Override
  public List<CoreModel.Stmt> visitSwitch(CoreModel.Switch s) {
    List<CoreModel.Case> cases = new ArrayList<>(s.cases().size());
    for (CoreModel.Case c : s.cases()) {
      cases.add(new CoreModel.Case(rewriter.expr(c.guard(), ctx), rotator.rotate(c.body(), ctx)));
    }
    return List.of(new CoreModel.Switch(rewriter.expr(s.subject(), ctx), cases, branchOrTail(s.defaultBlock())));
  }

  /** 已有分支照常旋转；缺失的分支在 tail 非空时补成只调用 tail 的分支。 */
  private CoreModel.Block branchOrTail(CoreModel.Block branch) {
    if (branch != null) {
      return rotator.rotate(branch, ctx);
    }
    return ctx.tail().isEmpty() ? null : new CoreModel.Block(ctx.tail());
  }

  @Override
  public List<CoreModel.Stmt> visitAwait(CoreModel.Await s) {
    String counter = names.fresh("deferrals");
    List<CoreModel.Stmt> out = new ArrayList<>();
    out.add(new CoreModel.Let(counter, RuntimeProtocol.newCounter(RuntimeProtocol.continuationValue(ctx.tail()))));
    // 块体内不允许跳出（标注阶段已校验），因此不继承外层循环
    RotationContext body = new RotationContext(List.of(RuntimeProtocol.fulfill(counter)), null, counter);
    out.addAll(rotator.rotateStatements(s.body().statements(), body));
    return out;
  }

  @Override
  public List<CoreModel.Stmt> visitLoop(CoreModel.Loop s) {
    String breakName = names.fresh("break");
    String nextName = names.fresh("next");
    String topName = names.fresh(topHint(s.loopKind()));
    List<CoreModel.Stmt> out = new ArrayList<>();
    out.add(new CoreModel.Define(breakName, List.of(), new CoreModel.Block(ctx.tail())));

    RotationContext.LoopFrame frame = new RotationContext.LoopFrame(breakName, nextName);
    RotationContext bodyCtx = new RotationContext(List.of(RuntimeProtocol.call(nextName)), frame, ctx.counter());
    CoreModel.Block exit = CoreModel.Block.of(RuntimeProtocol.call(breakName));
    CoreModel.Expr expr = rewriter.expr(s.expr(), ctx);

    switch (s.loopKind()) {
      case WHILE: {
        out.add(new CoreModel.Define(nextName, List.of(), CoreModel.Block.of(RuntimeProtocol.call(topName))));
        CoreModel.Block body = rotator.rotate(s.body(), bodyCtx);
        out.add(new CoreModel.Define(topName, List.of(), CoreModel.Block.of(new CoreModel.If(expr, body, exit))));
        break;
      }
      case DO_WHILE: {
        CoreModel.Block again = CoreModel.Block.of(RuntimeProtocol.call(topName));
        out.add(new CoreModel.Define(nextName, List.of(), CoreModel.Block.of(new CoreModel.If(expr, again, exit))));
        out.add(new CoreModel.Define(topName, List.of(), rotator.rotate(s.body(), bodyCtx)));
        break;
      }
      case FOR_IN: {
        String items = names.fresh("items");
        String index = names.fresh("i");
        out.add(new CoreModel.Let(items, expr));
        out.add(new CoreModel.Let(index, new CoreModel.IntE(0)));
        CoreModel.Expr advance = new CoreModel.Binary("+", new CoreModel.Name(index), new CoreModel.IntE(1));
        out.add(new CoreModel.Define(nextName, List.of(),
            CoreModel.Block.of(new CoreModel.Set(index, advance), RuntimeProtocol.call(topName))));
        List<CoreModel.Stmt> iteration = new ArrayList<>();
        iteration.add(rewriter.bind(s.var(), new CoreModel.Index(new CoreModel.Name(items), new CoreModel.Name(index))));
        iteration.addAll(rotator.rotateStatements(s.body().statements(), bodyCtx));
        CoreModel.Expr hasNext = new CoreModel.Binary("<", new CoreModel.Name(index),
            new CoreModel.Member(new CoreModel.Name(items), "length"));
        out.add(new CoreModel.Define(topName, List.of(),
            CoreModel.Block.of(new CoreModel.If(hasNext, new CoreModel.Block(iteration), exit))));
        break;
      }
      default:
        throw new IllegalStateException("Unknown loop kind: " + s.loopKind());
    }
    out.add(RuntimeProtocol.call(topName));
    return out;
  }

  private static String topHint(CoreModel.LoopKind kind) {
    switch (kind) {
      case DO_WHILE: return "do";
      case FOR_IN: return "for";
      default: return "while";
    }
  }

  @Override
  public List<CoreModel.Stmt> visitBreak(CoreModel.Break s) {
    return List.of(RuntimeProtocol.call(loopFrame(s).breakName()));
  }

  @Override
  public List<CoreModel.Stmt> visitContinue(CoreModel.Continue s) {
    return List.of(RuntimeProtocol.call(loopFrame(s).nextName()));
  }

  private RotationContext.LoopFrame loopFrame(CoreModel.Stmt jump) {
    if (ctx.loop() == null) {
      throw new InternalTransformError(ErrorMessages.propagateWithoutLoop(Statements.kindName(jump)));
    }
    return ctx.loop();
  }

  // 以下种类不会带标记；按普通语句处理：原语句后紧跟 tail

  @Override
  public List<CoreModel.Stmt> visitLet(CoreModel.Let s) { return plain(s); }

  @Override
  public List<CoreModel.Stmt> visitSet(CoreModel.Set s) { return plain(s); }

  @Override
  public List<CoreModel.Stmt> visitEval(CoreModel.Eval s) { return plain(s); }

  @Override
  public List<CoreModel.Stmt> visitReturn(CoreModel.Return s) { return plain(s); }

  @Override
  public List<CoreModel.Stmt> visitDefine(CoreModel.Define s) { return plain(s); }

  private List<CoreModel.Stmt> plain(CoreModel.Stmt s) {
    List<CoreModel.Stmt> out = new ArrayList<>();
    out.add(rewriter.copy(s, ctx));
    out.addAll(ctx.tail());
    return out;
  }
}
