package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.TypeSystemReference;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.Node;
import metacpp.lowering.types.LoweredTypes;

/** 降级树语句节点的基类。 */
@TypeSystemReference(LoweredTypes.class)
public abstract class LoweredStatementNode extends Node {
  public abstract void executeVoid(VirtualFrame frame);
}
