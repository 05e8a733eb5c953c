package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;
import metacpp.lowering.runtime.LoweringConfig;
import metacpp.lowering.runtime.Outcome;

/**
 * 赋值节点：{@code lhs = rhs} 或双通道的 {@code lhs, lhs2 = rhs}。
 *
 * 只有值目标的调用点收到错误时说明可抛出性标记有误，直接报错而不是丢弃错误。
 */
public final class AssignNode extends LoweredStatementNode {
  private static final int NO_SLOT = -1;

  private final String name;
  private final int slot;
  private final int errorSlot;
  @Child private LoweredExpressionNode valueNode;

  public AssignNode(String name, int slot, LoweredExpressionNode valueNode) {
    this(name, slot, NO_SLOT, valueNode);
  }

  public AssignNode(String name, int slot, int errorSlot, LoweredExpressionNode valueNode) {
    this.name = name;
    this.slot = slot;
    this.errorSlot = errorSlot;
    this.valueNode = valueNode;
  }

  @Override
  public void executeVoid(VirtualFrame frame) {
    Object result = valueNode.executeGeneric(frame);
    if (result instanceof Outcome outcome) {
      if (errorSlot != NO_SLOT) {
        frame.setObject(slot, outcome.getValue());
        frame.setObject(errorSlot, outcome.getError());
        return;
      }
      if (outcome.isError()) {
        throw new EvaluationException(ErrorMessages.droppedError(name + " = " + valueNode));
      }
      result = outcome.getValue();
    } else if (errorSlot != NO_SLOT) {
      frame.setObject(errorSlot, null);
    }
    if (LoweringConfig.DEBUG) {
      System.err.println("DEBUG: " + name + " = " + result);
    }
    frame.setObject(slot, result);
  }
}
