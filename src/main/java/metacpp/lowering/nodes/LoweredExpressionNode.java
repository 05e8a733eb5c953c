package metacpp.lowering.nodes;

import com.oracle.truffle.api.dsl.TypeSystemReference;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.Node;
import com.oracle.truffle.api.nodes.UnexpectedResultException;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;
import metacpp.lowering.types.LoweredTypes;

/**
 * 降级树表达式节点的基类
 *
 * 调用类表达式（函数调用、match 分派、列表推导）返回 {@link metacpp.lowering.runtime.Outcome}，
 * 其余表达式直接返回值。
 *
 * 带类型的节点（字面量、整数与布尔运算、调用目标）用 @Specialization 按 {@link LoweredTypes} 特化，
 * 类型不符时由 @Fallback 报告 {@link ErrorMessages#typeExpectedGot}。
 */
@TypeSystemReference(LoweredTypes.class)
public abstract class LoweredExpressionNode extends Node {

  /**
   * 执行此节点并返回结果（通用版本）
   *
   * @param frame 当前执行帧
   * @return 节点的执行结果
   */
  public abstract Object executeGeneric(VirtualFrame frame);

  public boolean executeBoolean(VirtualFrame frame) throws UnexpectedResultException {
    Object result = executeGeneric(frame);
    if (result instanceof Boolean b) {
      return b;
    }
    throw new UnexpectedResultException(result);
  }

  public long executeLong(VirtualFrame frame) throws UnexpectedResultException {
    Object result = executeGeneric(frame);
    if (result instanceof Long l) {
      return l;
    }
    throw new UnexpectedResultException(result);
  }

  static boolean asBoolean(Object value) {
    if (value instanceof Boolean b) {
      return b;
    }
    throw new EvaluationException(ErrorMessages.typeExpectedGot("bool", describe(value)));
  }

  static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName() + ":" + value;
  }
}
