package aster.cps.transform;

import aster.cps.core.CoreModel;
import aster.cps.core.Flag;
import aster.cps.core.FlagTable;
import aster.cps.core.Statements;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 旋转器：把带标记的语句块拆成嵌套的 continuation 链。
 *
 * <p>对块 b：找到第一条带 AWAIT 或 PROPAGATE 的语句 c；c 之前的语句原样保留，
 * c 之后的语句移入新的 continuation 块 d 并递归旋转，最后按 c 的种类把 d 接到 c 上
 * （见 {@link ContinuationWiring}）。d 为空时不生成新 continuation，直接接上外层的 tail。</p>
 *
 * <p>旋转是纯函数：输入树保持不变，输出总是新构建的树。</p>
 */
public final class Rotator {
  private static final Logger LOGGER = Logger.getLogger(Rotator.class.getName());

  private final FlagTable flags;
  private final NameSupply names;
  private final StatementRewriter rewriter;
  private Set<String> hoisted = Set.of();
  /** 外层函数（参数与局部名称）中已有的绑定；对这些名称的 Set 指向外层变量，不能提升。 */
  private Set<String> enclosing = Set.of();

  public Rotator(FlagTable flags, NameSupply names) {
    this.flags = flags;
    this.names = names;
    this.rewriter = new StatementRewriter(this, names);
  }

  /**
   * 变换一个函数体（顶层函数、Define 或 Lambda）。不含 wait-block 的函数体只做结构复制，
   * 其中的嵌套函数仍会单独变换。
   *
   * @param body 已标注的函数体
   * @param params 函数参数
   * @return 新函数体
   */
  public CoreModel.Block rotateFunction(CoreModel.Block body, List<String> params) {
    Set<String> savedHoisted = hoisted;
    Set<String> savedEnclosing = enclosing;
    boolean async = flags.has(body, Flag.AWAIT);
    Set<String> locals = LocalVariables.collect(body, params);
    for (String name : LocalVariables.assigned(body)) {
      if (!params.contains(name) && !enclosing.contains(name)) {
        locals.add(name);
      }
    }
    hoisted = async ? locals : Set.of();
    Set<String> visible = new HashSet<>(enclosing);
    visible.addAll(params);
    visible.addAll(locals);
    enclosing = visible;
    try {
      RotationContext root = RotationContext.functionRoot();
      if (!async) {
        return rewriter.copyBlock(body, root);
      }
      List<CoreModel.Stmt> out = new ArrayList<>();
      for (String name : hoisted) {
        out.add(new CoreModel.Let(name, new CoreModel.NullE()));
      }
      out.addAll(rotateStatements(body.statements(), root));
      return new CoreModel.Block(out);
    } finally {
      hoisted = savedHoisted;
      enclosing = savedEnclosing;
    }
  }

  CoreModel.Block rotate(CoreModel.Block b, RotationContext ctx) {
    return new CoreModel.Block(rotateStatements(b.statements(), ctx));
  }

  List<CoreModel.Stmt> rotateStatements(List<CoreModel.Stmt> stmts, RotationContext ctx) {
    int split = firstMarked(stmts);
    if (split < 0) {
      List<CoreModel.Stmt> out = rewriter.copyAll(stmts, ctx);
      out.addAll(ctx.tail());
      return out;
    }
    List<CoreModel.Stmt> out = rewriter.copyAll(stmts.subList(0, split), ctx);
    CoreModel.Stmt pivot = stmts.get(split);
    List<CoreModel.Stmt> rest = stmts.subList(split + 1, stmts.size());

    RotationContext pivotCtx = ctx;
    if (pivot instanceof CoreModel.Break || pivot instanceof CoreModel.Continue) {
      if (!rest.isEmpty()) {
        LOGGER.fine(() -> "dropping " + rest.size() + " unreachable statement(s) after " + Statements.kindName(pivot));
      }
    } else if (!rest.isEmpty()) {
      String k = names.fresh("k");
      out.add(new CoreModel.Define(k, List.of(), rotate(new CoreModel.Block(rest), ctx)));
      pivotCtx = ctx.withTail(List.of(RuntimeProtocol.call(k)));
    }
    out.addAll(pivot.accept(new ContinuationWiring(this, pivotCtx)));
    return out;
  }

  private int firstMarked(List<CoreModel.Stmt> stmts) {
    for (int i = 0; i < stmts.size(); i++) {
      if (flags.hasAny(stmts.get(i), Flag.AWAIT, Flag.PROPAGATE)) {
        return i;
      }
    }
    return -1;
  }

  boolean isHoisted(String name) { return hoisted.contains(name); }

  StatementRewriter rewriter() { return rewriter; }

  NameSupply names() { return names; }
}
