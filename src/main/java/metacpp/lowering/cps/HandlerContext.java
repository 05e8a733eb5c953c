package metacpp.lowering.cps;

import metacpp.lowering.core.ExprType;
import metacpp.lowering.core.LoweredModel;

import java.util.Objects;

/**
 * 一个处于作用域内的 except 子句：捕获的异常类型、绑定名，以及预先构造好的处理器续延调用。
 */
public final class HandlerContext {
  public final ExprType.CustomType caughtType;
  public final String caughtName;
  public final LoweredModel.FunctionCall handlerCall;

  public HandlerContext(ExprType.CustomType caughtType, String caughtName, LoweredModel.FunctionCall handlerCall) {
    this.caughtType = Objects.requireNonNull(caughtType, "caughtType");
    this.caughtName = Objects.requireNonNull(caughtName, "caughtName");
    this.handlerCall = Objects.requireNonNull(handlerCall, "handlerCall");
  }

  /** 处理器续延自身是否可能抛出；为 false 时调用点只保留值目标。 */
  public boolean handlerMayRaise() {
    return handlerCall.fun.mayRaise;
  }

  public boolean catches(ExprType type) {
    return caughtType.equals(type);
  }

  @Override
  public String toString() {
    return "except " + caughtType + " as " + caughtName + " -> " + handlerCall.fun.name;
  }
}
