package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;

public final class AssertNode extends LoweredStatementNode {
  @Child private LoweredExpressionNode condNode;
  private final String message;

  public AssertNode(LoweredExpressionNode condNode, String message) {
    this.condNode = condNode;
    this.message = message;
  }

  @Override
  public void executeVoid(VirtualFrame frame) {
    if (!LoweredExpressionNode.asBoolean(condNode.executeGeneric(frame))) {
      throw new EvaluationException(ErrorMessages.assertionFailed(message));
    }
  }
}
