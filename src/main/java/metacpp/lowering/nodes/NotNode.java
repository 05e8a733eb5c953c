package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;

@NodeChild(value = "operand", type = LoweredExpressionNode.class)
public abstract class NotNode extends LoweredExpressionNode {

  public static NotNode create(LoweredExpressionNode operand) {
    return NotNodeGen.create(operand);
  }

  @Specialization
  protected boolean doBoolean(boolean value) {
    return !value;
  }

  @Fallback
  protected Object doNotBoolean(Object value) {
    throw new EvaluationException(ErrorMessages.typeExpectedGot("bool", describe(value)));
  }
}
