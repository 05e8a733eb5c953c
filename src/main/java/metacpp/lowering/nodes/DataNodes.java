package metacpp.lowering.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import metacpp.lowering.core.ExprType;
import metacpp.lowering.core.WrapperKind;
import metacpp.lowering.runtime.DataValue;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;
import metacpp.lowering.runtime.TypeValue;

import java.util.ArrayList;
import java.util.List;

/** 自定义类型的构造与字段访问、类型值构造以及错误槽相关操作。 */
public final class DataNodes {
  private DataNodes() {}

  public static final class ConstructNode extends LoweredExpressionNode {
    private final ExprType.CustomType type;
    @Children private final LoweredExpressionNode[] args;

    public ConstructNode(ExprType.CustomType type, List<LoweredExpressionNode> args) {
      this.type = type;
      this.args = args.toArray(new LoweredExpressionNode[0]);
    }

    @Override
    @ExplodeLoop
    public Object executeGeneric(VirtualFrame frame) {
      Object[] values = new Object[args.length];
      for (int i = 0; i < args.length; i++) {
        values[i] = args[i].executeGeneric(frame);
      }
      return new DataValue(type, values);
    }
  }

  public static final class AttributeNode extends LoweredExpressionNode {
    @Child private LoweredExpressionNode target;
    private final String attribute;

    public AttributeNode(LoweredExpressionNode target, String attribute) {
      this.target = target;
      this.attribute = attribute;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      Object value = target.executeGeneric(frame);
      if (value instanceof DataValue data) {
        return data.getField(attribute);
      }
      throw new EvaluationException(ErrorMessages.typeExpectedGot("custom type value", describe(value)));
    }
  }

  public static final class TypeWrapperNode extends LoweredExpressionNode {
    private final WrapperKind wrapper;
    @Child private LoweredExpressionNode inner;

    public TypeWrapperNode(WrapperKind wrapper, LoweredExpressionNode inner) {
      this.wrapper = wrapper;
      this.inner = inner;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      Object value = inner.executeGeneric(frame);
      if (value instanceof TypeValue type) {
        return TypeValue.wrapped(wrapper, type);
      }
      throw new EvaluationException(ErrorMessages.typeExpectedGot("type", describe(value)));
    }
  }

  public static final class TemplateInstantiationNode extends LoweredExpressionNode {
    private final String template;
    @Children private final LoweredExpressionNode[] args;

    public TemplateInstantiationNode(String template, List<LoweredExpressionNode> args) {
      this.template = template;
      this.args = args.toArray(new LoweredExpressionNode[0]);
    }

    @Override
    @ExplodeLoop
    public Object executeGeneric(VirtualFrame frame) {
      List<Object> values = new ArrayList<>(args.length);
      for (LoweredExpressionNode arg : args) {
        values.add(arg.executeGeneric(frame));
      }
      return TypeValue.instantiation(template, values);
    }
  }

  public static final class IsErrorNode extends LoweredExpressionNode {
    @Child private LoweredExpressionNode error;

    public IsErrorNode(LoweredExpressionNode error) {
      this.error = error;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      return error.executeGeneric(frame) != null;
    }
  }

  /** 按类型名判断异常值的具体类型。 */
  public static final class IsInstanceNode extends LoweredExpressionNode {
    @Child private LoweredExpressionNode value;
    private final String typeName;

    public IsInstanceNode(LoweredExpressionNode value, String typeName) {
      this.value = value;
      this.typeName = typeName;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      return value.executeGeneric(frame) instanceof DataValue data && data.getTypeName().equals(typeName);
    }
  }
}
