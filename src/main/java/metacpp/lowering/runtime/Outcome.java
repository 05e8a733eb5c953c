package metacpp.lowering.runtime;

import java.util.Objects;

/**
 * 双通道调用结果：值槽与错误槽至多一个有值。
 */
public final class Outcome {
  private static final Outcome EMPTY = new Outcome(null, null);

  private final Object value;
  private final Object error;

  private Outcome(Object value, Object error) {
    this.value = value;
    this.error = error;
  }

  public static Outcome of(Object value, Object error) {
    if (value == null && error == null) {
      return EMPTY;
    }
    return new Outcome(value, error);
  }

  public static Outcome value(Object value) {
    return of(value, null);
  }

  public static Outcome error(Object error) {
    return of(null, Objects.requireNonNull(error, "error"));
  }

  public Object getValue() {
    return value;
  }

  public Object getError() {
    return error;
  }

  public boolean isError() {
    return error != null;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Outcome other && Objects.equals(value, other.value) && Objects.equals(error, other.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, error);
  }

  @Override
  public String toString() {
    return isError() ? "Outcome{error=" + error + "}" : "Outcome{value=" + value + "}";
  }
}
