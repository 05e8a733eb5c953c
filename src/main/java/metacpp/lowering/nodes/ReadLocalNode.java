package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;

/** 读取局部变量或参数的帧槽位。 */
public final class ReadLocalNode extends LoweredExpressionNode {
  private final String name;
  private final int slot;

  public ReadLocalNode(String name, int slot) {
    this.name = name;
    this.slot = slot;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    return frame.getObject(slot);
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
