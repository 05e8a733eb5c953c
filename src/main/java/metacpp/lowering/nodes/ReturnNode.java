package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ControlFlowException;
import metacpp.lowering.runtime.Outcome;

/** 双通道 return：值槽与错误槽各自可缺省。 */
public final class ReturnNode extends LoweredStatementNode {
  public static final class ReturnException extends ControlFlowException {
    private static final long serialVersionUID = 1L;
    public final transient Outcome outcome;
    public ReturnException(Outcome outcome) { this.outcome = outcome; }
  }

  @Child private LoweredExpressionNode resultNode;
  @Child private LoweredExpressionNode errorNode;

  public ReturnNode(LoweredExpressionNode resultNode, LoweredExpressionNode errorNode) {
    this.resultNode = resultNode;
    this.errorNode = errorNode;
  }

  @Override
  public void executeVoid(VirtualFrame frame) {
    Object result = resultNode == null ? null : resultNode.executeGeneric(frame);
    Object error = errorNode == null ? null : errorNode.executeGeneric(frame);
    throw new ReturnException(Outcome.of(error == null ? result : null, error));
  }
}
