package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;

@NodeChild(value = "lhs", type = LoweredExpressionNode.class)
@NodeChild(value = "rhs", type = LoweredExpressionNode.class)
public abstract class IntComparisonNode extends LoweredExpressionNode {
  private final String op;

  protected IntComparisonNode(String op) {
    this.op = op;
  }

  public static IntComparisonNode create(LoweredExpressionNode lhs, LoweredExpressionNode rhs, String op) {
    return IntComparisonNodeGen.create(op, lhs, rhs);
  }

  @Specialization
  protected boolean doLong(long l, long r) {
    switch (op) {
      case "<": return l < r;
      case "<=": return l <= r;
      case ">": return l > r;
      case ">=": return l >= r;
      default:
        throw new EvaluationException("Unsupported comparison: " + op);
    }
  }

  @Fallback
  protected Object doNotInt(Object l, Object r) {
    throw new EvaluationException(ErrorMessages.typeExpectedGot("int", describe(l instanceof Long ? r : l)));
  }
}
