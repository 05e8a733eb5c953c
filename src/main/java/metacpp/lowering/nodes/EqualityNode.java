package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;

import java.util.Objects;

/** 结构相等；集合相等见 {@link CollectionNodes.SetEqualityNode}。 */
@NodeChild(value = "lhs", type = LoweredExpressionNode.class)
@NodeChild(value = "rhs", type = LoweredExpressionNode.class)
public abstract class EqualityNode extends LoweredExpressionNode {

  public static EqualityNode create(LoweredExpressionNode lhs, LoweredExpressionNode rhs) {
    return EqualityNodeGen.create(lhs, rhs);
  }

  @Specialization
  protected boolean doLong(long l, long r) {
    return l == r;
  }

  @Specialization
  protected boolean doBoolean(boolean l, boolean r) {
    return l == r;
  }

  @Specialization(replaces = {"doLong", "doBoolean"})
  protected boolean doGeneric(Object l, Object r) {
    return Objects.equals(l, r);
  }
}
