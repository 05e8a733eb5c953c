package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.Fallback;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;
import metacpp.lowering.runtime.FunctionValue;
import metacpp.lowering.runtime.LoweringConfig;
import metacpp.lowering.runtime.Outcome;

import java.util.Arrays;
import java.util.List;

/**
 * 函数调用节点
 *
 * 被调表达式求值为 {@link FunctionValue}（全局函数或函数类型的参数），结果总是 {@link Outcome}；
 * 是否检查错误槽由外层的赋值语句决定。被调目标按类型特化，其余值交给回退分支报错。
 */
@NodeChild(value = "target", type = LoweredExpressionNode.class)
public abstract class CallNode extends LoweredExpressionNode {
  @Children private final LoweredExpressionNode[] args;

  protected CallNode(LoweredExpressionNode[] args) {
    this.args = args;
  }

  public static CallNode create(LoweredExpressionNode target, List<LoweredExpressionNode> args) {
    return CallNodeGen.create(args.toArray(new LoweredExpressionNode[0]), target);
  }

  protected abstract LoweredExpressionNode getTarget();

  @Specialization
  protected Outcome doCall(VirtualFrame frame, FunctionValue function) {
    Object[] values = evaluateArgs(frame);
    if (LoweringConfig.DEBUG) {
      System.err.println("DEBUG: call " + function.getName() + Arrays.toString(values));
    }
    return function.invoke(values);
  }

  @Fallback
  protected Object doNotCallable(Object target) {
    throw new EvaluationException(ErrorMessages.typeExpectedGot("function", describe(target)));
  }

  @ExplodeLoop
  private Object[] evaluateArgs(VirtualFrame frame) {
    Object[] values = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      values[i] = args[i].executeGeneric(frame);
    }
    return values;
  }

  @Override
  public String toString() {
    return getTarget() + "(...)";
  }
}
