package aster.cps;

import aster.cps.core.CoreModel;
import aster.cps.core.FlagTable;
import aster.cps.support.CpsConfig;
import aster.cps.support.Diagnostic;
import aster.cps.support.DiagnosticSink;
import aster.cps.support.ErrorMessages;
import aster.cps.transform.Annotator;
import aster.cps.transform.NameSupply;
import aster.cps.transform.RotationVerifier;
import aster.cps.transform.Rotator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * await/defer CPS 编译阶段
 * <p>
 * 把使用 wait-block 的结构化代码改写为显式 continuation 调用，输出仍是同一套 Core 语法。
 * <p>
 * 编译管道：
 * <pre>
 * Core IR（外部解析器产出） → Annotator（AWAIT / LOOP / PROPAGATE 标记与结构校验）
 *          → Rotator（拆分语句块、接线 continuation） → RotationVerifier → Core IR（交给外部打印器）
 * </pre>
 */
public final class CpsCompiler {

  private static final Logger LOGGER = Logger.getLogger(CpsCompiler.class.getName());

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
      .enable(SerializationFeature.INDENT_OUTPUT)
      .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private CpsCompiler() {
    // 工具类，禁止实例化
  }

  /**
   * 单次编译选项。
   *
   * @param namePrefix 合成标识符前缀
   * @param maxDepth 语句嵌套深度上限
   */
  public record Options(String namePrefix, int maxDepth) {
    public static Options defaults() {
      return new Options(CpsConfig.NAME_PREFIX, CpsConfig.MAX_DEPTH);
    }
  }

  /**
   * 编译结果。
   *
   * @param module 变换后的模块
   * @param warnings 编译警告（如空 wait-block）
   */
  public record Result(CoreModel.Module module, List<Diagnostic> warnings) {}

  public static Result compile(CoreModel.Module module) throws CompilationException {
    return compile(module, Options.defaults());
  }

  /**
   * 变换模块中的全部函数。
   *
   * @param module 外部解析器产出的模块
   * @param options 编译选项
   * @return 变换后的模块与警告
   * @throws CompilationException 存在结构错误时抛出，包含全部错误诊断
   */
  public static Result compile(CoreModel.Module module, Options options) throws CompilationException {
    FlagTable flags = new FlagTable();
    DiagnosticSink sink = new DiagnosticSink();
    Annotator annotator = new Annotator(flags, sink, options.maxDepth());
    for (CoreModel.Func fn : module.funcs()) {
      annotator.annotate(fn.body());
    }
    for (Diagnostic w : sink.warnings()) {
      LOGGER.warning(() -> w.toString());
    }
    if (sink.hasErrors()) {
      List<Diagnostic> errors = sink.errors();
      throw new CompilationException(ErrorMessages.compilationFailed(errors.size()), errors);
    }

    Rotator rotator = new Rotator(flags, new NameSupply(options.namePrefix()));
    List<CoreModel.Func> funcs = new ArrayList<>(module.funcs().size());
    for (CoreModel.Func fn : module.funcs()) {
      funcs.add(new CoreModel.Func(fn.name(), fn.params(), rotator.rotateFunction(fn.body(), fn.params())));
    }
    CoreModel.Module out = new CoreModel.Module(module.name(), funcs);
    new RotationVerifier(flags).verify(out);

    LOGGER.fine(() -> String.format("module %s: %d function(s), %d marked node(s)",
        module.name(), funcs.size(), flags.size()));
    if (CpsConfig.DEBUG && LOGGER.isLoggable(Level.INFO)) {
      try {
        LOGGER.info("transformed module:\n" + MAPPER.writeValueAsString(out));
      } catch (JsonProcessingException e) {
        LOGGER.log(Level.WARNING, "debug dump failed", e);
      }
    }
    return new Result(out, sink.warnings());
  }

  /**
   * Core JSON → 变换后的 Core JSON
   *
   * @param json 外部解析器产出的模块 JSON
   * @return 变换后模块的 JSON（缩进格式）
   * @throws CompilationException 输入无法解析或存在结构错误时抛出
   */
  public static String compileJson(String json) throws CompilationException {
    return writeModule(compile(readModule(json)).module());
  }

  public static CoreModel.Module readModule(String json) throws CompilationException {
    try {
      return MAPPER.readValue(json, CoreModel.Module.class);
    } catch (JsonProcessingException e) {
      throw new CompilationException(ErrorMessages.invalidCoreJson(e.getOriginalMessage()), e);
    }
  }

  public static String writeModule(CoreModel.Module module) throws CompilationException {
    try {
      return MAPPER.writeValueAsString(module);
    } catch (JsonProcessingException e) {
      throw new CompilationException("JSON 序列化失败: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * 编译异常，携带导致失败的全部诊断。
   */
  public static class CompilationException extends Exception {
    private static final long serialVersionUID = 1L;
    private final transient List<Diagnostic> diagnostics;

    public CompilationException(String message, List<Diagnostic> diagnostics) {
      super(message + describe(diagnostics));
      this.diagnostics = List.copyOf(diagnostics);
    }

    public CompilationException(String message, Throwable cause) {
      super(message, cause);
      this.diagnostics = List.of();
    }

    public List<Diagnostic> getDiagnostics() {
      return diagnostics;
    }

    private static String describe(List<Diagnostic> diagnostics) {
      StringBuilder sb = new StringBuilder();
      for (Diagnostic d : diagnostics) {
        sb.append('\n').append(d);
      }
      return sb.toString();
    }
  }
}
