package aster.cps.runtime;

import aster.cps.nodes.Env;
import aster.cps.nodes.Exec;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 测试运行时的内建函数，绑定到一个调度器和一份输出记录。
 *
 * <pre>
 * print(v...)               记录 (当前虚拟时间, 文本)
 * setTimeout(cb, ms)        ms 后无参调用 cb
 * deliver(cb, ms, v...)     ms 后以 v... 调用 cb
 * now(cb, v...)             立即同步调用 cb
 * range(n)                  [0, 1, ..., n-1]
 * newDeferralCounter(k)     见 {@link DeferralCounter}
 * </pre>
 */
public final class Builtins {

  @FunctionalInterface
  public interface BuiltinFunction {
    Object call(Object[] args);
  }

  /** 一条输出记录。 */
  public record Event(long atMs, String text) {
    @Override
    public String toString() { return text + "@" + atMs; }
  }

  private final Map<String, BuiltinFunction> registry = new LinkedHashMap<>();

  public Builtins(VirtualScheduler scheduler, List<Event> output) {
    register("print", args -> {
      String text = Arrays.stream(args).map(Exec::show).collect(Collectors.joining(" "));
      output.add(new Event(scheduler.now(), text));
      return null;
    });
    register("setTimeout", args -> {
      Object cb = arg(args, 0, "setTimeout");
      scheduler.schedule(Exec.toLong(arg(args, 1, "setTimeout")), () -> Exec.invoke(cb, new Object[0]));
      return null;
    });
    register("deliver", args -> {
      Object cb = arg(args, 0, "deliver");
      long delay = Exec.toLong(arg(args, 1, "deliver"));
      Object[] values = Arrays.copyOfRange(args, 2, args.length);
      scheduler.schedule(delay, () -> Exec.invoke(cb, values));
      return null;
    });
    register("now", args -> Exec.invoke(arg(args, 0, "now"), Arrays.copyOfRange(args, 1, args.length)));
    register("range", args -> {
      long n = Exec.toLong(arg(args, 0, "range"));
      List<Object> out = new ArrayList<>();
      for (long i = 0; i < n; i++) out.add(i);
      return out;
    });
    register("newDeferralCounter", args -> new DeferralCounter(arg(args, 0, "newDeferralCounter")));
  }

  private void register(String name, BuiltinFunction fn) {
    registry.put(name, fn);
  }

  private static Object arg(Object[] args, int i, String fn) {
    if (i >= args.length) {
      throw new RuntimeException(fn + ": missing argument " + i);
    }
    return args[i];
  }

  /** 把全部内建函数定义到 env。 */
  public void install(Env env) {
    registry.forEach(env::define);
  }
}
