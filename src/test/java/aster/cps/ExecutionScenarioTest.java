package aster.cps;

import static aster.cps.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import aster.cps.core.CoreModel;
import aster.cps.runtime.CpsRunner;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/**
 * 端到端执行测试：编译后的模块在虚拟时钟上运行，按 "输出@毫秒" 比较。
 */
public class ExecutionScenarioTest {

  private static List<String> run(CoreModel.Func... funcs) throws Exception {
    CoreModel.Module out = CpsCompiler.compile(module(funcs)).module();
    return new CpsRunner().run(out, "main").stream().map(Object::toString).collect(Collectors.toList());
  }

  private static CoreModel.Expr plus(CoreModel.Expr l, CoreModel.Expr r) { return bin("+", l, r); }

  private static CoreModel.Expr eq(CoreModel.Expr l, long r) { return bin("==", l, num(r)); }

  private static CoreModel.Stmt incr(String var) { return set(var, plus(name(var), num(1))); }

  @Test
  public void testForInWaitsEachIteration() throws Exception {
    List<String> out = run(main(
        forIn("i", call("range", num(3)), await(sleep(100)), print(name("i")))));
    assertEquals(List.of("0@100", "1@200", "2@300"), out);
  }

  @Test
  public void testAwaitWaitsForSlowestDeferral() throws Exception {
    List<String> out = run(main(await(sleep(100), sleep(10)), print(str("done"))));
    assertEquals(List.of("done@100"), out);
  }

  @Test
  public void testBreakAfterAwaitInsideWhile() throws Exception {
    List<String> out = run(main(
        let("n", num(0)),
        whileLoop(bool(true),
            await(sleep(10)),
            incr("n"),
            ifThen(eq(name("n"), 3), brk()),
            print(name("n"))),
        print(str("after"))));
    assertEquals(List.of("1@10", "2@20", "after@30"), out);
  }

  @Test
  public void testContinueSkipsRestOfIteration() throws Exception {
    List<String> out = run(main(
        let("n", num(0)),
        whileLoop(bin("<", name("n"), num(4)),
            await(sleep(10)),
            incr("n"),
            ifThen(eq(bin("%", name("n"), num(2)), 0), cont()),
            print(name("n"))),
        print(str("end"))));
    assertEquals(List.of("1@10", "3@30", "end@40"), out);
  }

  @Test
  public void testStatementsBeforeAwaitRunImmediately() throws Exception {
    List<String> out = run(main(print(str("before")), await(sleep(50)), print(str("after"))));
    assertEquals(List.of("before@0", "after@50"), out);
  }

  @Test
  public void testDeferOutputsReceiveCallbackArguments() throws Exception {
    List<String> out = run(main(
        let("v", nul()),
        let("a", nul()),
        let("b", nul()),
        await(
            eval(call("deliver", defer("v"), num(20), str("payload"))),
            eval(call("deliver", defer("a", "b"), num(5), num(1), num(2)))),
        print(name("v"), plus(name("a"), name("b")))));
    assertEquals(List.of("payload 3@20"), out);
  }

  @Test
  public void testNestedAwaitInsideAwaitBody() throws Exception {
    List<String> out = run(main(
        await(
            print(str("inner start")),
            await(sleep(5)),
            print(str("inner done")),
            sleep(20)),
        print(str("outer done"))));
    assertEquals(List.of("inner start@0", "inner done@5", "outer done@25"), out);
  }

  @Test
  public void testSwitchArmWithAwait() throws Exception {
    List<String> out = run(main(
        forIn("x", list(num(1), num(2), num(3)),
            switchOn(name("x"), block(print(str("other"))),
                caseOf(num(1), await(sleep(10)), print(str("one"))),
                caseOf(num(2), print(str("two"))))),
        print(str("end"))));
    assertEquals(List.of("one@10", "two@10", "other@10", "end@10"), out);
  }

  @Test
  public void testDoWhileRunsBodyFirst() throws Exception {
    List<String> out = run(main(
        let("n", num(0)),
        doWhile(bin("<", name("n"), num(3)), await(sleep(5)), incr("n"), print(name("n"))),
        doWhile(bool(false), await(sleep(1)), print(str("once")))));
    assertEquals(List.of("1@5", "2@10", "3@15", "once@16"), out);
  }

  @Test
  public void testNativeInnerLoopInsideAsyncLoop() throws Exception {
    List<String> out = run(main(
        forIn("x", call("range", num(2)),
            await(sleep(10)),
            let("j", num(0)),
            whileLoop(bool(true), incr("j"), ifThen(eq(name("j"), 2), brk())),
            print(plus(plus(name("x"), str(":")), name("j"))))));
    assertEquals(List.of("0:2@10", "1:2@20"), out);
  }

  @Test
  public void testLabeledBreakAcrossNativeLoops() throws Exception {
    List<String> out = run(main(
        await(sleep(1)),
        let("found", num(-1)),
        labeled("outer", forIn("a", call("range", num(3)),
            forIn("b", call("range", num(3)),
                ifThen(eq(bin("*", name("a"), name("b")), 2),
                    set("found", plus(bin("*", name("a"), num(10)), name("b"))),
                    brk("outer"))))),
        print(name("found"))));
    assertEquals(List.of("12@1"), out);
  }

  @Test
  public void testFunctionsWithoutAwaitKeepDirectStyle() throws Exception {
    List<String> out = run(
        func("add", List.of("a", "b"), ret(plus(name("a"), name("b")))),
        main(print(call("add", num(2), num(3)))));
    assertEquals(List.of("5@0"), out);
  }

  @Test
  public void testConcurrentAsyncCalls() throws Exception {
    List<String> out = run(
        func("worker", List.of("label", "ms"), await(eval(call("setTimeout", defer(), name("ms")))), print(name("label"))),
        main(eval(call("worker", str("slow"), num(30))), eval(call("worker", str("fast"), num(10))), print(str("spawned"))));
    assertEquals(List.of("spawned@0", "fast@10", "slow@30"), out);
  }

  @Test
  public void testSynchronousCallbackStillWaitsForBlockEnd() throws Exception {
    List<String> out = run(main(
        await(eval(call("now", defer())), print(str("inside"))),
        print(str("sync")),
        await(eval(call("now", defer())), sleep(50)),
        print(str("later"))));
    assertEquals(List.of("inside@0", "sync@0", "later@50"), out);
  }

  @Test
  public void testAsyncLambdaAsCallback() throws Exception {
    List<String> out = run(main(
        let("f", lambda(List.of(), await(sleep(5)), print(str("from lambda")))),
        eval(call("setTimeout", name("f"), num(10)))));
    assertEquals(List.of("from lambda@15"), out);
  }

  @Test
  public void testLocalFunctionCalledAcrossAwait() throws Exception {
    List<String> out = run(main(
        define("twice", List.of("x"), ret(bin("*", name("x"), num(2)))),
        let("total", num(0)),
        forIn("i", list(num(1), num(2), num(3)),
            await(sleep(1)),
            set("total", plus(name("total"), call("twice", name("i"))))),
        print(name("total"))));
    assertEquals(List.of("12@3"), out);
  }

  @Test
  public void testAwaitInsideIfThenBreak() throws Exception {
    List<String> out = run(main(
        let("n", num(0)),
        whileLoop(bool(true),
            incr("n"),
            ifThen(eq(name("n"), 2), await(sleep(7)), brk()),
            print(name("n"))),
        print(str("after"))));
    assertEquals(List.of("1@0", "after@7"), out);
  }

  @Test
  public void testUndeclaredSetTargetSurvivesAwaitLoop() throws Exception {
    List<String> out = run(main(
        forIn("i", call("range", num(2)), await(sleep(10)), set("last", name("i"))),
        print(name("last"))));
    assertEquals(List.of("1@20"), out);
  }

  @Test
  public void testUndeclaredDeferOutputIsVisibleAfterAwait() throws Exception {
    List<String> out = run(main(
        await(eval(call("deliver", defer("v"), num(5), str("payload")))),
        print(name("v"))));
    assertEquals(List.of("payload@5"), out);
  }

  @Test
  public void testAsyncLambdaAssignsEnclosingVariable() throws Exception {
    List<String> out = run(main(
        let("total", num(0)),
        let("bump", lambda(List.of(), await(sleep(1)), incr("total"))),
        eval(call("bump")),
        eval(call("setTimeout", lambda(List.of(), print(name("total"))), num(5)))));
    assertEquals(List.of("1@5"), out);
  }
}
