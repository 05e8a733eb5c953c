package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import com.oracle.truffle.api.nodes.RootNode;
import metacpp.lowering.runtime.FrameLayout;
import metacpp.lowering.runtime.Outcome;

/**
 * 降级函数的根节点
 *
 * 参数按顺序写入前 N 个槽位，其余槽位先置为 {@code null}；函数体正常结束（没有 return）时
 * 返回空的 {@link Outcome}。
 */
public final class LoweredRootNode extends RootNode {
  private final String name;
  private final int paramCount;
  private final int slotCount;
  @Child private BlockNode body;

  public LoweredRootNode(FrameLayout layout, String name, BlockNode body) {
    super(null, layout.descriptor());
    this.name = name;
    this.paramCount = layout.parameterCount();
    this.slotCount = layout.slotCount();
    this.body = body;
  }

  @Override
  @ExplodeLoop
  public Object execute(VirtualFrame frame) {
    Object[] args = frame.getArguments();
    for (int i = 0; i < slotCount; i++) {
      frame.setObject(i, i < paramCount && i < args.length ? args[i] : null);
    }
    try {
      body.executeVoid(frame);
    } catch (ReturnNode.ReturnException r) {
      return r.outcome;
    }
    return Outcome.of(null, null);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return "root " + name;
  }
}
