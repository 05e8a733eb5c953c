package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;

import java.util.List;

public final class BlockNode extends LoweredStatementNode {
  @Children private final LoweredStatementNode[] statements;

  public BlockNode(List<LoweredStatementNode> statements) {
    this.statements = statements.toArray(new LoweredStatementNode[0]);
  }

  @Override
  @ExplodeLoop
  public void executeVoid(VirtualFrame frame) {
    for (LoweredStatementNode statement : statements) {
      statement.executeVoid(frame);
    }
  }

  public int size() {
    return statements.length;
  }
}
