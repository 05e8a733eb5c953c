package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;

/**
 * 整数四则运算与取模。除数为 0 时抛出 {@link ErrorMessages#arithmeticDivisionByZero()}。
 */
@NodeChild(value = "lhs", type = LoweredExpressionNode.class)
@NodeChild(value = "rhs", type = LoweredExpressionNode.class)
public abstract class IntArithmeticNode extends LoweredExpressionNode {
  private final String op;

  protected IntArithmeticNode(String op) {
    this.op = op;
  }

  public static IntArithmeticNode create(LoweredExpressionNode lhs, LoweredExpressionNode rhs, String op) {
    return IntArithmeticNodeGen.create(op, lhs, rhs);
  }

  @Specialization
  protected long doLong(long l, long r) {
    switch (op) {
      case "+": return l + r;
      case "-": return l - r;
      case "*": return l * r;
      case "/":
        if (r == 0) throw new EvaluationException(ErrorMessages.arithmeticDivisionByZero());
        return l / r;
      case "%":
        if (r == 0) throw new EvaluationException(ErrorMessages.arithmeticDivisionByZero());
        return l % r;
      default:
        throw new EvaluationException("Unsupported int operator: " + op);
    }
  }

  @Fallback
  protected Object doNotInt(Object l, Object r) {
    throw new EvaluationException(ErrorMessages.typeExpectedGot("int", describe(l instanceof Long ? r : l)));
  }
}
