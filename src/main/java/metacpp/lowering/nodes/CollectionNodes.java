package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 列表与集合操作。
 *
 * 集合在运行时表示为无重复元素、保持插入顺序的不可变列表。
 */
public final class CollectionNodes {
  private CollectionNodes() {}

  @SuppressWarnings("unchecked")
  static List<Object> asList(Object value) {
    if (value instanceof List<?> list) {
      return (List<Object>) list;
    }
    throw new EvaluationException(ErrorMessages.typeExpectedGot("list", LoweredExpressionNode.describe(value)));
  }

  public static final class ListNode extends LoweredExpressionNode {
    @Children private final LoweredExpressionNode[] elems;

    public ListNode(List<LoweredExpressionNode> elems) {
      this.elems = elems.toArray(new LoweredExpressionNode[0]);
    }

    @Override
    @ExplodeLoop
    public Object executeGeneric(VirtualFrame frame) {
      List<Object> values = new ArrayList<>(elems.length);
      for (LoweredExpressionNode elem : elems) {
        values.add(elem.executeGeneric(frame));
      }
      return Collections.unmodifiableList(values);
    }
  }

  public static final class AddToSetNode extends LoweredExpressionNode {
    @Child private LoweredExpressionNode set;
    @Child private LoweredExpressionNode elem;

    public AddToSetNode(LoweredExpressionNode set, LoweredExpressionNode elem) {
      this.set = set;
      this.elem = elem;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      List<Object> current = asList(set.executeGeneric(frame));
      Object value = elem.executeGeneric(frame);
      if (current.contains(value)) {
        return current;
      }
      List<Object> result = new ArrayList<>(current);
      result.add(value);
      return Collections.unmodifiableList(result);
    }
  }

  public static final class SetToListNode extends LoweredExpressionNode {
    @Child private LoweredExpressionNode set;

    public SetToListNode(LoweredExpressionNode set) {
      this.set = set;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      return asList(set.executeGeneric(frame));
    }
  }

  public static final class ListToSetNode extends LoweredExpressionNode {
    @Child private LoweredExpressionNode list;

    public ListToSetNode(LoweredExpressionNode list) {
      this.list = list;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      return List.copyOf(new LinkedHashSet<>(asList(list.executeGeneric(frame))));
    }
  }

  public static final class SetEqualityNode extends LoweredExpressionNode {
    @Child private LoweredExpressionNode lhs;
    @Child private LoweredExpressionNode rhs;

    public SetEqualityNode(LoweredExpressionNode lhs, LoweredExpressionNode rhs) {
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      return new HashSet<>(asList(lhs.executeGeneric(frame))).equals(new HashSet<>(asList(rhs.executeGeneric(frame))));
    }
  }

  public static final class IsInListNode extends LoweredExpressionNode {
    @Child private LoweredExpressionNode elem;
    @Child private LoweredExpressionNode list;

    public IsInListNode(LoweredExpressionNode elem, LoweredExpressionNode list) {
      this.elem = elem;
      this.list = list;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      Object value = elem.executeGeneric(frame);
      return asList(list.executeGeneric(frame)).contains(value);
    }
  }
}
