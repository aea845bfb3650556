package aster.cps.transform;

import aster.cps.core.CoreModel;
import aster.cps.core.Flag;
import aster.cps.core.FlagTable;
import aster.cps.core.Statements;
import aster.cps.core.StmtVisitor;
import aster.cps.support.Diagnostic;
import aster.cps.support.DiagnosticSink;
import aster.cps.support.ErrorMessages;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 标注器：对一个函数体依次执行三遍标记。
 *
 * <ol>
 *   <li>Pass A：发现 wait-block，给它及其到函数根的全部祖先打上 AWAIT；同时做结构校验。</li>
 *   <li>Pass B：沿 AWAIT 节点下行，给带 AWAIT 的循环打上 LOOP。</li>
 *   <li>Pass C：对每个 LOOP 循环，找出以它为目标的 break/continue，
 *       给语句及其到循环之间（不含循环本身）的路径打上 PROPAGATE。</li>
 * </ol>
 *
 * <p>Lambda 与 Define 的函数体是独立的编译单元，遇到时递归完整标注，标记不跨越函数边界。
 * 错误写入 {@link DiagnosticSink}，由调用方决定是否中止编译。</p>
 */
public final class Annotator {
  private static final Logger LOGGER = Logger.getLogger(Annotator.class.getName());

  private final FlagTable flags;
  private final DiagnosticSink sink;
  private final int maxDepth;

  public Annotator(FlagTable flags, DiagnosticSink sink, int maxDepth) {
    this.flags = flags;
    this.sink = sink;
    this.maxDepth = maxDepth;
  }

  /**
   * 标注一个函数体。对已标注的树重复调用不会改变标记分配。
   *
   * @param body 函数体
   */
  public void annotate(CoreModel.Block body) {
    annotate(body, 0);
  }

  /**
   * @param baseDepth 外层函数已用掉的嵌套深度；嵌套函数与外层共享同一个深度上限
   */
  private void annotate(CoreModel.Block body, int baseDepth) {
    Unit unit = new Unit(baseDepth);
    unit.visit(body);
    if (unit.depthReported) {
      // 超出上限的子树未经 Pass A 访问，后续各遍不能进入
      return;
    }
    int loops = markLoops(body);
    checkCrossLoopJumps(unit);
    int propagated = 0;
    for (CoreModel.Loop loop : unit.loops) {
      if (flags.has(loop, Flag.LOOP)) {
        propagated += propagate(loop, unit, loop.body(), new ArrayDeque<>());
      }
    }
    if (flags.has(body, Flag.AWAIT) && baseDepth + rotatedDepth(body) > maxDepth) {
      sink.error(Diagnostic.NESTING_TOO_DEEP, ErrorMessages.nestingTooDeep(maxDepth), null);
      return;
    }
    if (unit.waits > 0) {
      int asyncLoops = loops;
      int jumps = propagated;
      LOGGER.fine(() -> String.format("annotated unit: %d await block(s), %d async loop(s), %d redirected jump(s)",
          unit.waits, asyncLoops, jumps));
    }
  }

  // ==================== Pass B ====================

  private int markLoops(CoreModel.Stmt s) {
    if (!flags.has(s, Flag.AWAIT)) {
      return 0;
    }
    int count = 0;
    if (s instanceof CoreModel.Loop) {
      flags.mark(s, Flag.LOOP);
      count++;
    }
    for (CoreModel.Stmt child : Statements.children(s)) {
      count += markLoops(child);
    }
    return count;
  }

  /**
   * 旋转后的嵌套深度。块内每个拆分点都把其后的语句移入新的 continuation，多嵌套一层；
   * If / Switch 的分支互不相连，不累加。
   */
  private int rotatedDepth(CoreModel.Stmt s) {
    boolean sequential = s instanceof CoreModel.Block;
    int splits = 0;
    int deepest = 0;
    for (CoreModel.Stmt child : Statements.children(s)) {
      if (sequential && flags.hasAny(child, Flag.AWAIT, Flag.PROPAGATE)) {
        splits++;
      }
      deepest = Math.max(deepest, splits + rotatedDepth(child));
    }
    return deepest + 1;
  }

  // ==================== Pass C ====================

  private int propagate(CoreModel.Loop owner, Unit unit, CoreModel.Stmt s, Deque<CoreModel.Stmt> path) {
    int count = 0;
    path.push(s);
    Jump jump = unit.jumps.get(s);
    if (jump != null && jump.target == owner && jump.crossed.size() == 1) {
      for (CoreModel.Stmt p : path) {
        flags.mark(p, Flag.PROPAGATE);
      }
      count++;
    }
    for (CoreModel.Stmt child : Statements.children(s)) {
      count += propagate(owner, unit, child, path);
    }
    path.pop();
    return count;
  }

  /**
   * 目标不是最近循环的跳转：只要目标或中间任一循环需要 CPS 改写就无法正确接线，报告错误。
   */
  private void checkCrossLoopJumps(Unit unit) {
    for (Jump jump : unit.jumps.values()) {
      if (jump.crossed.size() < 2) {
        continue;
      }
      for (CoreModel.Loop l : jump.crossed) {
        if (flags.has(l, Flag.LOOP)) {
          sink.error(Diagnostic.CROSS_LOOP_JUMP, ErrorMessages.crossLoopJump(jump.keyword, jump.target.label()), jump.span);
          break;
        }
      }
    }
  }

  // ==================== Pass A ====================

  private static final class AwaitFrame {
    final int loopDepth;
    int defers;

    AwaitFrame(int loopDepth) { this.loopDepth = loopDepth; }
  }

  private static final class Jump {
    final String keyword;
    final CoreModel.Loop target;
    final List<CoreModel.Loop> crossed;
    final CoreModel.Span span;

    Jump(String keyword, CoreModel.Loop target, List<CoreModel.Loop> crossed, CoreModel.Span span) {
      this.keyword = keyword;
      this.target = target;
      this.crossed = crossed;
      this.span = span;
    }
  }

  /** 单个函数体的 Pass A 状态。 */
  private final class Unit implements StmtVisitor<Void> {
    private final Deque<CoreModel.Stmt> path = new ArrayDeque<>();
    private final Deque<CoreModel.Loop> loopStack = new ArrayDeque<>();
    private final Deque<AwaitFrame> awaits = new ArrayDeque<>();
    private final List<CoreModel.Loop> loops = new ArrayList<>();
    private final Map<CoreModel.Stmt, Jump> jumps = new IdentityHashMap<>();
    private final int baseDepth;
    private boolean depthReported;
    private int waits;

    Unit(int baseDepth) {
      this.baseDepth = baseDepth;
    }

    private int depth() {
      return baseDepth + path.size();
    }

    private void tooDeep(CoreModel.Span span) {
      if (!depthReported) {
        sink.error(Diagnostic.NESTING_TOO_DEEP, ErrorMessages.nestingTooDeep(maxDepth), span);
        depthReported = true;
      }
    }

    void visit(CoreModel.Stmt s) {
      if (depth() >= maxDepth) {
        tooDeep(spanOf(s));
        return;
      }
      path.push(s);
      try {
        s.accept(this);
      } finally {
        path.pop();
      }
    }

    @Override
    public Void visitBlock(CoreModel.Block s) {
      for (CoreModel.Stmt child : s.statements()) visit(child);
      return null;
    }

    @Override
    public Void visitLet(CoreModel.Let s) {
      scan(s.expr());
      return null;
    }

    @Override
    public Void visitSet(CoreModel.Set s) {
      scan(s.expr());
      return null;
    }

    @Override
    public Void visitEval(CoreModel.Eval s) {
      scan(s.expr());
      return null;
    }

    @Override
    public Void visitReturn(CoreModel.Return s) {
      scan(s.expr());
      return null;
    }

    @Override
    public Void visitIf(CoreModel.If s) {
      scan(s.cond());
      visit(s.thenBlock());
      if (s.elseBlock() != null) visit(s.elseBlock());
      return null;
    }

    @Override
    public Void visitSwitch(CoreModel.Switch s) {
      scan(s.subject());
      for (CoreModel.Case c : s.cases()) {
        scan(c.guard());
        visit(c.body());
      }
      if (s.defaultBlock() != null) visit(s.defaultBlock());
      return null;
    }

    @Override
    public Void visitLoop(CoreModel.Loop s) {
      scan(s.expr());
      loops.add(s);
      loopStack.push(s);
      try {
        visit(s.body());
      } finally {
        loopStack.pop();
      }
      return null;
    }

    @Override
    public Void visitBreak(CoreModel.Break s) {
      jump(s, "break", s.label(), s.span());
      return null;
    }

    @Override
    public Void visitContinue(CoreModel.Continue s) {
      jump(s, "continue", s.label(), s.span());
      return null;
    }

    @Override
    public Void visitAwait(CoreModel.Await s) {
      waits++;
      // path 栈顶即 s 本身
      for (CoreModel.Stmt p : path) {
        flags.mark(p, Flag.AWAIT);
      }
      AwaitFrame frame = new AwaitFrame(loopStack.size());
      awaits.push(frame);
      try {
        visit(s.body());
      } finally {
        awaits.pop();
      }
      if (frame.defers == 0) {
        sink.warning(Diagnostic.EMPTY_AWAIT, ErrorMessages.emptyAwait(), s.span());
      }
      return null;
    }

    @Override
    public Void visitDefine(CoreModel.Define s) {
      annotate(s.body(), depth());
      return null;
    }

    private void jump(CoreModel.Stmt s, String keyword, String label, CoreModel.Span span) {
      if (loopStack.isEmpty()) {
        String code = s instanceof CoreModel.Break ? Diagnostic.BREAK_OUTSIDE_LOOP : Diagnostic.CONTINUE_OUTSIDE_LOOP;
        sink.error(code, ErrorMessages.jumpOutsideLoop(keyword), span);
        return;
      }
      List<CoreModel.Loop> crossed = new ArrayList<>();
      CoreModel.Loop target = null;
      for (CoreModel.Loop l : loopStack) {
        crossed.add(l);
        if (label == null || label.equals(l.label())) {
          target = l;
          break;
        }
      }
      if (target == null) {
        sink.error(Diagnostic.UNKNOWN_LABEL, ErrorMessages.unknownLabel(keyword, label), span);
        return;
      }
      AwaitFrame await = awaits.peek();
      if (await != null) {
        // 目标在栈中的位置（自底向上，从 1 开始）不超过进入 await 时的循环深度，说明目标在 await 之外
        int targetPosition = loopStack.size() - crossed.size() + 1;
        if (targetPosition <= await.loopDepth) {
          sink.error(Diagnostic.JUMP_OUT_OF_AWAIT, ErrorMessages.jumpOutOfAwait(keyword), span);
          return;
        }
      }
      jumps.put(s, new Jump(keyword, target, List.copyOf(crossed), span));
    }

    private void scan(CoreModel.Expr e) {
      scan(e, 1);
    }

    /** 表达式嵌套同样计入深度上限。 */
    private void scan(CoreModel.Expr e, int exprDepth) {
      if (e == null) {
        return;
      }
      int depth = depth() + exprDepth;
      if (depth >= maxDepth) {
        tooDeep(e instanceof CoreModel.Defer d ? d.span() : null);
        return;
      }
      int next = exprDepth + 1;
      if (e instanceof CoreModel.Defer d) {
        AwaitFrame await = awaits.peek();
        if (await == null) {
          sink.error(Diagnostic.DEFER_OUTSIDE_AWAIT, ErrorMessages.deferOutsideAwait(), d.span());
        } else {
          await.defers++;
        }
      } else if (e instanceof CoreModel.Lambda l) {
        annotate(l.body(), depth);
      } else if (e instanceof CoreModel.Call c) {
        scan(c.target(), next);
        for (CoreModel.Expr a : c.args()) scan(a, next);
      } else if (e instanceof CoreModel.Member m) {
        scan(m.target(), next);
      } else if (e instanceof CoreModel.Index ix) {
        scan(ix.target(), next);
        scan(ix.index(), next);
      } else if (e instanceof CoreModel.Unary u) {
        scan(u.expr(), next);
      } else if (e instanceof CoreModel.Binary b) {
        scan(b.left(), next);
        scan(b.right(), next);
      } else if (e instanceof CoreModel.ListE list) {
        for (CoreModel.Expr item : list.items()) scan(item, next);
      }
    }
  }

  private static CoreModel.Span spanOf(CoreModel.Stmt s) {
    if (s instanceof CoreModel.Break b) return b.span();
    if (s instanceof CoreModel.Continue c) return c.span();
    if (s instanceof CoreModel.Await a) return a.span();
    return null;
  }
}
