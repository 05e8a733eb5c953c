package metacpp.lowering.cps;

import metacpp.lowering.core.LoweredModel;

import java.util.List;

/**
 * 一次降级调用的产物：降级后的函数（顶层语句序列时为 {@code null}）、语句以及按创建顺序排列的合成续延函数。
 */
public final class LoweringResult {
  public final LoweredModel.Function function;
  public final List<LoweredModel.Stmt> statements;
  public final List<LoweredModel.Function> synthesized;

  LoweringResult(LoweredModel.Function function, List<LoweredModel.Stmt> statements,
                 List<LoweredModel.Function> synthesized) {
    this.function = function;
    this.statements = List.copyOf(statements);
    this.synthesized = List.copyOf(synthesized);
  }
}
