package aster.cps.core;

/**
 * 按语句种类分派的访问者。新增语句种类时所有实现都必须补齐对应分支，由编译器检查。
 */
public interface StmtVisitor<R> {
  R visitBlock(CoreModel.Block s);
  R visitLet(CoreModel.Let s);
  R visitSet(CoreModel.Set s);
  R visitEval(CoreModel.Eval s);
  R visitReturn(CoreModel.Return s);
  R visitIf(CoreModel.If s);
  R visitSwitch(CoreModel.Switch s);
  R visitLoop(CoreModel.Loop s);
  R visitBreak(CoreModel.Break s);
  R visitContinue(CoreModel.Continue s);
  R visitAwait(CoreModel.Await s);
  R visitDefine(CoreModel.Define s);
}
