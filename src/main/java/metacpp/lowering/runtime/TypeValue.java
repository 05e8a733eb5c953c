package metacpp.lowering.runtime;

import metacpp.lowering.core.WrapperKind;

import java.util.List;
import java.util.Objects;

/**
 * C++ 类型值。模板元程序里"值"就是类型，模式匹配按结构比较这些值。
 */
public abstract class TypeValue {
  private TypeValue() {}

  public static TypeValue atomic(String cppType) {
    return new Atomic(cppType);
  }

  public static TypeValue wrapped(WrapperKind wrapper, TypeValue inner) {
    return new Wrapped(wrapper, inner);
  }

  public static TypeValue instantiation(String template, List<Object> args) {
    return new Instantiation(template, args);
  }

  /** 原子类型，如 {@code int}、{@code void}。 */
  public static final class Atomic extends TypeValue {
    public final String cppType;

    Atomic(String cppType) {
      this.cppType = Objects.requireNonNull(cppType, "cppType");
    }

    @Override public boolean equals(Object o) { return o instanceof Atomic a && cppType.equals(a.cppType); }
    @Override public int hashCode() { return cppType.hashCode(); }
    @Override public String toString() { return cppType; }
  }

  public static final class Wrapped extends TypeValue {
    public final WrapperKind wrapper;
    public final TypeValue inner;

    Wrapped(WrapperKind wrapper, TypeValue inner) {
      this.wrapper = Objects.requireNonNull(wrapper, "wrapper");
      this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override public boolean equals(Object o) { return o instanceof Wrapped w && wrapper == w.wrapper && inner.equals(w.inner); }
    @Override public int hashCode() { return Objects.hash(wrapper, inner); }
    @Override public String toString() { return wrapper.spell(inner.toString()); }
  }

  /** 模板实例；实参可以是类型，也可以是 bool / int 等非类型模板参数。 */
  public static final class Instantiation extends TypeValue {
    public final String template;
    public final List<Object> args;

    Instantiation(String template, List<Object> args) {
      this.template = Objects.requireNonNull(template, "template");
      this.args = List.copyOf(args);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Instantiation i && template.equals(i.template) && args.equals(i.args);
    }

    @Override public int hashCode() { return Objects.hash(template, args); }
    @Override public String toString() { return template + args.toString().replace('[', '<').replace(']', '>'); }
  }
}
