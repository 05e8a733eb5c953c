package metacpp.lowering;

import com.fasterxml.jackson.core.JsonProcessingException;
import metacpp.lowering.analysis.ExternalMayRaiseTable;
import metacpp.lowering.analysis.ThrowabilityAnalyzer;
import metacpp.lowering.core.IdentifierGenerator;
import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.SourceModel;
import metacpp.lowering.cps.ControlFlowLowering;
import metacpp.lowering.runtime.LoweringConfig;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 降级管道
 * <p>
 * 编译管道：
 * <pre>
 * 源模块 → 可抛出性分析（源树） → 控制流降级 → 可抛出性分析（降级树，删除死错误检查）→ 降级模块
 * </pre>
 * <p>
 * 第一次分析决定哪些调用点需要错误检查；第二次分析修正合成续延函数的标记，
 * 并去掉被调方实际上不会抛出时留下的错误机制。两个阶段重复应用都不会改变结果。
 */
public final class LoweringPipeline {

  private static final Logger LOGGER = Logger.getLogger(LoweringPipeline.class.getName());

  private LoweringPipeline() {
    // 工具类，禁止实例化
  }

  /**
   * 编译源模块，标识符前缀由模块名派生。
   *
   * @param module 类型检查后的源模块
   * @param external 已编译单元的可抛出性
   * @return 降级后的模块
   */
  public static LoweredModel.Module compile(SourceModel.Module module, ExternalMayRaiseTable external) {
    String unit = module.name.isEmpty() ? LoweringConfig.DEFAULT_UNIT : module.name;
    return compile(module, external, IdentifierGenerator.forUnit(unit));
  }

  /**
   * 使用给定的标识符生成器编译源模块。
   *
   * @param module 类型检查后的源模块
   * @param external 已编译单元的可抛出性
   * @param ids 标识符生成器
   * @return 降级后的模块
   */
  public static LoweredModel.Module compile(SourceModel.Module module, ExternalMayRaiseTable external,
                                            IdentifierGenerator ids) {
    long start = System.nanoTime();
    SourceModel.Module analyzed = ThrowabilityAnalyzer.recomputeThrowability(module, external);
    LoweredModel.Module lowered = ControlFlowLowering.lowerModule(analyzed, ids);
    LoweredModel.Module result = ThrowabilityAnalyzer.recomputeLowered(lowered, external);

    long elapsedMicros = (System.nanoTime() - start) / 1_000L;
    LOGGER.log(Level.INFO, "Compiled unit {0} in {1} us: {2} source functions, {3} lowered functions",
        new Object[] {module.name, elapsedMicros, module.functions.size(), result.functions.size()});
    if (LoweringConfig.DEBUG) {
      dump(result);
    }
    return result;
  }

  /**
   * 从 JSON 读取源模块并编译为 JSON。
   *
   * @param sourceJson 源模块 JSON
   * @param external 已编译单元的可抛出性
   * @return 降级模块 JSON
   * @throws IOException 读取或序列化失败
   */
  public static String compileJson(String sourceJson, ExternalMayRaiseTable external) throws IOException {
    SourceModel.Module module = new ModuleLoader().loadFromJson(sourceJson);
    return LoweredModelWriter.toJson(compile(module, external));
  }

  private static void dump(LoweredModel.Module module) {
    try {
      LOGGER.log(Level.INFO, "Lowered unit {0}:\n{1}", new Object[] {module.name, LoweredModelWriter.toJson(module)});
    } catch (JsonProcessingException e) {
      LOGGER.log(Level.WARNING, "Failed to serialize lowered unit " + module.name, e);
    }
  }
}
