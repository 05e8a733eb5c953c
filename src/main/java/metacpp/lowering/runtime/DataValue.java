package metacpp.lowering.runtime;

import metacpp.lowering.core.ExprType;

import java.util.Arrays;

/**
 * 自定义类型（含异常类型）的运行时值。字段值按类型声明的顺序存放。
 *
 * 两个值类型名相同且字段逐一相等时相等，集合去重与错误槽比较都依赖这一点。
 */
public final class DataValue {
  private final ExprType.CustomType type;
  private final Object[] values;

  public DataValue(ExprType.CustomType type, Object[] values) {
    if (type.fields.size() != values.length) {
      throw new EvaluationException(ErrorMessages.typeExpectedGot(
          type.fields.size() + " fields for " + type.name, values.length + " values"));
    }
    this.type = type;
    this.values = values.clone();
  }

  public String getTypeName() {
    return type.name;
  }

  /**
   * @throws EvaluationException 类型没有这个字段
   */
  public Object getField(String name) {
    for (int i = 0; i < values.length; i++) {
      if (type.fields.get(i).name.equals(name)) {
        return values[i];
      }
    }
    throw new EvaluationException(ErrorMessages.typeExpectedGot("field of " + type.name, name));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DataValue other && type.name.equals(other.type.name) && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * type.name.hashCode() + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(type.name).append('(');
    for (int i = 0; i < values.length; i++) {
      sb.append(i == 0 ? "" : ", ").append(type.fields.get(i).name).append('=').append(values[i]);
    }
    return sb.append(')').toString();
  }
}
