package metacpp.lowering.nodes;

import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.dsl.Idempotent;
import com.oracle.truffle.api.dsl.Specialization;

/**
 * 常量：布尔、整数与原子类型字面量。整数与布尔按值种类特化，避免装箱。
 */
public abstract class LiteralNode extends LoweredExpressionNode {
  private enum ValueKind {
    LONG, BOOLEAN, OBJECT
  }

  @CompilationFinal private final Object value;
  @CompilationFinal private final ValueKind kind;

  protected LiteralNode(long value) { this.value = value; this.kind = ValueKind.LONG; }
  protected LiteralNode(boolean value) { this.value = value; this.kind = ValueKind.BOOLEAN; }
  protected LiteralNode(Object value) { this.value = value; this.kind = ValueKind.OBJECT; }

  public static LiteralNode create(Object value) {
    if (value instanceof Long l) {
      return LiteralNodeGen.create(l.longValue());
    } else if (value instanceof Boolean b) {
      return LiteralNodeGen.create(b.booleanValue());
    }
    return LiteralNodeGen.create(value);
  }

  @Specialization(guards = "isLong()")
  protected long doLong() {
    return (Long) value;
  }

  @Specialization(guards = "isBoolean()")
  protected boolean doBoolean() {
    return (Boolean) value;
  }

  @Specialization(replaces = {"doLong", "doBoolean"})
  protected Object doGeneric() {
    return value;
  }

  @Idempotent protected boolean isLong() { return kind == ValueKind.LONG; }
  @Idempotent protected boolean isBoolean() { return kind == ValueKind.BOOLEAN; }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
