package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;

/** 顶层错误检查：错误槽有值时终止程序。 */
public final class CheckIfErrorNode extends LoweredStatementNode {
  @Child private LoweredExpressionNode errorNode;

  public CheckIfErrorNode(LoweredExpressionNode errorNode) {
    this.errorNode = errorNode;
  }

  @Override
  public void executeVoid(VirtualFrame frame) {
    Object error = errorNode.executeGeneric(frame);
    if (error != null) {
      throw new EvaluationException(ErrorMessages.uncaughtToplevelError(String.valueOf(error)));
    }
  }
}
