package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;

/** 一元负号，仅对整数。 */
@NodeChild(value = "operand", type = LoweredExpressionNode.class)
public abstract class NegateNode extends LoweredExpressionNode {

  public static NegateNode create(LoweredExpressionNode operand) {
    return NegateNodeGen.create(operand);
  }

  @Specialization
  protected long doLong(long value) {
    return -value;
  }

  @Fallback
  protected Object doNotInt(Object value) {
    throw new EvaluationException(ErrorMessages.typeExpectedGot("int", describe(value)));
  }
}
