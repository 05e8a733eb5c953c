package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import metacpp.lowering.runtime.Outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 列表推导：逐元素绑定循环变量并调用元素函数。
 *
 * 任一元素调用在错误槽返回异常时立即停止，整个推导以该异常作为结果。
 */
public final class ComprehensionNode extends LoweredExpressionNode {
  @Child private LoweredExpressionNode list;
  private final int loopSlot;
  @Child private CallNode call;

  public ComprehensionNode(LoweredExpressionNode list, int loopSlot, CallNode call) {
    this.list = list;
    this.loopSlot = loopSlot;
    this.call = call;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    List<Object> source = CollectionNodes.asList(list.executeGeneric(frame));
    List<Object> result = new ArrayList<>(source.size());
    for (Object element : source) {
      frame.setObject(loopSlot, element);
      Outcome outcome = (Outcome) call.executeGeneric(frame);
      if (outcome.isError()) {
        return outcome;
      }
      result.add(outcome.getValue());
    }
    return Outcome.value(Collections.unmodifiableList(result));
  }
}
