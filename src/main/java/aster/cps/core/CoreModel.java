package aster.cps.core;

import com.fasterxml.jackson.annotation.*;
import java.util.List;
import java.util.Objects;

/**
 * Core 语法树：外部解析器产出、CPS 变换消费并原样交给外部打印器。
 *
 * <p>所有节点都是不可变 record，变换过程总是构建新树；节点标记保存在 {@link FlagTable} 中，
 * 以对象身份区分同值子树。JSON 交换格式使用 {@code kind} 属性区分节点类型。</p>
 */
public final class CoreModel {
  private CoreModel() {}

  /** 源码位置（行、列均从 1 开始），用于诊断信息。 */
  public record Span(int line, int column) {
    @Override
    public String toString() { return line + ":" + column; }
  }

  public record Module(String name, List<Func> funcs) {
    public Module {
      funcs = funcs == null ? List.of() : List.copyOf(funcs);
    }
  }

  public record Func(String name, List<String> params, Block body) {
    public Func {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(body, "body");
      params = params == null ? List.of() : List.copyOf(params);
    }
  }

  // ==================== 语句 ====================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Block.class, name = "Block"),
    @JsonSubTypes.Type(value = Let.class, name = "Let"),
    @JsonSubTypes.Type(value = Set.class, name = "Set"),
    @JsonSubTypes.Type(value = Eval.class, name = "Eval"),
    @JsonSubTypes.Type(value = Return.class, name = "Return"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = Switch.class, name = "Switch"),
    @JsonSubTypes.Type(value = Loop.class, name = "Loop"),
    @JsonSubTypes.Type(value = Break.class, name = "Break"),
    @JsonSubTypes.Type(value = Continue.class, name = "Continue"),
    @JsonSubTypes.Type(value = Await.class, name = "Await"),
    @JsonSubTypes.Type(value = Define.class, name = "Define")
  })
  public sealed interface Stmt permits Block, Let, Set, Eval, Return, If, Switch, Loop, Break, Continue, Await, Define {
    <R> R accept(StmtVisitor<R> visitor);
  }

  /** 有序语句序列；顺序即执行顺序。 */
  @JsonTypeName("Block")
  public record Block(List<Stmt> statements) implements Stmt {
    public Block {
      statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public static Block of(Stmt... statements) { return new Block(List.of(statements)); }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlock(this); }
  }

  @JsonTypeName("Let")
  public record Let(String name, Expr expr) implements Stmt {
    public Let {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(expr, "expr");
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLet(this); }
  }

  @JsonTypeName("Set")
  public record Set(String name, Expr expr) implements Stmt {
    public Set {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(expr, "expr");
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitSet(this); }
  }

  /** 表达式语句，通常是一次调用。 */
  @JsonTypeName("Eval")
  public record Eval(Expr expr) implements Stmt {
    public Eval {
      Objects.requireNonNull(expr, "expr");
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitEval(this); }
  }

  @JsonTypeName("Return")
  public record Return(Expr expr) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturn(this); }
  }

  @JsonTypeName("If")
  public record If(Expr cond, Block thenBlock, Block elseBlock) implements Stmt {
    public If {
      Objects.requireNonNull(cond, "cond");
      Objects.requireNonNull(thenBlock, "thenBlock");
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIf(this); }
  }

  /**
   * 多路分支。subject 非空时选中第一个 guard 与 subject 相等的分支；
   * subject 为空时 guard 作为布尔条件依次求值。分支之间不会贯穿。
   */
  @JsonTypeName("Switch")
  public record Switch(Expr subject, List<Case> cases, Block defaultBlock) implements Stmt {
    public Switch {
      cases = cases == null ? List.of() : List.copyOf(cases);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitSwitch(this); }
  }

  public record Case(Expr guard, Block body) {
    public Case {
      Objects.requireNonNull(guard, "guard");
      Objects.requireNonNull(body, "body");
    }
  }

  public enum LoopKind {
    /** while：先判断条件 */
    WHILE,
    /** do-while：先执行循环体 */
    DO_WHILE,
    /** for-in：按下标遍历 expr 求得的列表，逐个绑定到 var */
    FOR_IN
  }

  /**
   * 循环。WHILE/DO_WHILE 的 expr 为条件，FOR_IN 的 expr 为被遍历的列表。
   * label 可选，供带标签的 break/continue 使用。
   */
  @JsonTypeName("Loop")
  public record Loop(String label, LoopKind loopKind, String var, Expr expr, Block body) implements Stmt {
    public Loop {
      Objects.requireNonNull(loopKind, "loopKind");
      Objects.requireNonNull(expr, "expr");
      Objects.requireNonNull(body, "body");
      if (loopKind == LoopKind.FOR_IN) {
        Objects.requireNonNull(var, "var");
      }
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLoop(this); }
  }

  @JsonTypeName("Break")
  public record Break(String label, Span span) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreak(this); }
  }

  @JsonTypeName("Continue")
  public record Continue(String label, Span span) implements Stmt {
    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinue(this); }
  }

  /** wait-block：直到块内创建的全部 deferral 都被回调后才继续执行后续语句。 */
  @JsonTypeName("Await")
  public record Await(Block body, Span span) implements Stmt {
    public Await {
      Objects.requireNonNull(body, "body");
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAwait(this); }
  }

  /** 局部命名函数；变换产生的 continuation 也以此形式出现。 */
  @JsonTypeName("Define")
  public record Define(String name, List<String> params, Block body) implements Stmt {
    public Define {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(body, "body");
      params = params == null ? List.of() : List.copyOf(params);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitDefine(this); }
  }

  // ==================== 表达式 ====================

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Name.class, name = "Name"),
    @JsonSubTypes.Type(value = IntE.class, name = "Int"),
    @JsonSubTypes.Type(value = StringE.class, name = "String"),
    @JsonSubTypes.Type(value = Bool.class, name = "Bool"),
    @JsonSubTypes.Type(value = NullE.class, name = "Null"),
    @JsonSubTypes.Type(value = ListE.class, name = "List"),
    @JsonSubTypes.Type(value = Unary.class, name = "Unary"),
    @JsonSubTypes.Type(value = Binary.class, name = "Binary"),
    @JsonSubTypes.Type(value = Call.class, name = "Call"),
    @JsonSubTypes.Type(value = Member.class, name = "Member"),
    @JsonSubTypes.Type(value = Index.class, name = "Index"),
    @JsonSubTypes.Type(value = Lambda.class, name = "Lambda"),
    @JsonSubTypes.Type(value = Defer.class, name = "Defer")
  })
  public sealed interface Expr permits Name, IntE, StringE, Bool, NullE, ListE, Unary, Binary, Call, Member, Index, Lambda, Defer {}

  @JsonTypeName("Name") public record Name(String name) implements Expr {}
  @JsonTypeName("Int") public record IntE(long value) implements Expr {}
  @JsonTypeName("String") public record StringE(String value) implements Expr {}
  @JsonTypeName("Bool") public record Bool(boolean value) implements Expr {}
  @JsonTypeName("Null") public record NullE() implements Expr {}

  @JsonTypeName("List")
  public record ListE(List<Expr> items) implements Expr {
    public ListE {
      items = items == null ? List.of() : List.copyOf(items);
    }
  }

  /** op: "!" 或 "-" */
  @JsonTypeName("Unary") public record Unary(String op, Expr expr) implements Expr {}

  /** op: 算术 + - * / %，比较 == != < <= > >=，逻辑 && || */
  @JsonTypeName("Binary") public record Binary(String op, Expr left, Expr right) implements Expr {}

  @JsonTypeName("Call")
  public record Call(Expr target, List<Expr> args) implements Expr {
    public Call {
      Objects.requireNonNull(target, "target");
      args = args == null ? List.of() : List.copyOf(args);
    }
  }

  @JsonTypeName("Member") public record Member(Expr target, String name) implements Expr {}
  @JsonTypeName("Index") public record Index(Expr target, Expr index) implements Expr {}

  @JsonTypeName("Lambda")
  public record Lambda(List<String> params, Block body) implements Expr {
    public Lambda {
      Objects.requireNonNull(body, "body");
      params = params == null ? List.of() : List.copyOf(params);
    }
  }

  /**
   * defer 调用：生成一个回调；回调被调用时按位置把参数赋给 outputs 中的变量。
   */
  @JsonTypeName("Defer")
  public record Defer(List<String> outputs, Span span) implements Expr {
    public Defer {
      outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }
  }
}
