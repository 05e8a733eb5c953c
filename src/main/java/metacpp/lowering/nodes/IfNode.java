package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import com.oracle.truffle.api.frame.VirtualFrame;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;

/**
 * 条件分支节点 - 条件总是一个已求值的布尔变量，按 boolean 特化；非布尔条件是降级错误。
 */
@NodeChild(value = "condNode", type = LoweredExpressionNode.class)
public abstract class IfNode extends LoweredStatementNode {
  @Child private BlockNode thenNode;
  @Child private BlockNode elseNode;

  protected IfNode(BlockNode thenNode, BlockNode elseNode) {
    this.thenNode = thenNode;
    this.elseNode = elseNode;
  }

  public static IfNode create(LoweredExpressionNode cond, BlockNode thenNode, BlockNode elseNode) {
    return IfNodeGen.create(thenNode, elseNode, cond);
  }

  @Specialization
  protected void doBoolean(VirtualFrame frame, boolean condValue) {
    if (condValue) {
      thenNode.executeVoid(frame);
    } else {
      elseNode.executeVoid(frame);
    }
  }

  @Fallback
  protected void doNotBoolean(Object condValue) {
    throw new EvaluationException(ErrorMessages.typeExpectedGot("bool", LoweredExpressionNode.describe(condValue)));
  }
}
