package metacpp.lowering.visit;

import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.SourceModel.*;

import java.util.List;

/** 源语句序列的返回分析。 */
public final class ReturnInfo {
  private ReturnInfo() {}

  /**
   * 语句序列是否在所有路径上都以 return 或 raise 结束。
   *
   * @param stmts 源语句序列
   * @return true 表示执行不会落到序列末尾之后
   */
  public static boolean alwaysReturns(List<Stmt> stmts) {
    for (Stmt stmt : stmts) {
      if (alwaysReturns(stmt)) {
        return true;
      }
    }
    return false;
  }

  private static boolean alwaysReturns(Stmt stmt) {
    if (stmt instanceof Return || stmt instanceof Raise) {
      return true;
    }
    if (stmt instanceof If i) {
      return alwaysReturns(i.thenStmts) && alwaysReturns(i.elseStmts);
    }
    if (stmt instanceof TryExcept t) {
      return alwaysReturns(t.tryBody) && alwaysReturns(t.exceptBody);
    }
    return false;
  }

  /** 降级后函数体中是否存在填充错误槽的 return。 */
  public static boolean returnsError(List<LoweredModel.Stmt> stmts) {
    boolean[] found = new boolean[1];
    new LoweredVisitor() {
      @Override
      protected void visitReturn(LoweredModel.Return ret) {
        if (ret.error != null) {
          found[0] = true;
        }
      }
    }.visitStmts(stmts);
    return found[0];
  }
}
