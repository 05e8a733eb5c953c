package metacpp.lowering.runtime;

import com.oracle.truffle.api.CallTarget;

import java.util.Objects;

/**
 * 一等函数值：全局函数引用求值的结果，调用返回 {@link Outcome}。
 */
public final class FunctionValue {
  private final String name;
  private final CallTarget callTarget;

  public FunctionValue(String name, CallTarget callTarget) {
    this.name = Objects.requireNonNull(name, "name");
    this.callTarget = Objects.requireNonNull(callTarget, "callTarget");
  }

  public String getName() {
    return name;
  }

  public Outcome invoke(Object... args) {
    return (Outcome) callTarget.call(args);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FunctionValue f && name.equals(f.name) && callTarget == f.callTarget;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return "<function " + name + ">";
  }
}
