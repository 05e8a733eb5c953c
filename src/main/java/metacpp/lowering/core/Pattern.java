package metacpp.lowering.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * match 分支中针对单个被匹配值的形状约束。源树与降级树共用。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = Pattern.Capture.class, name = "Capture"),
  @JsonSubTypes.Type(value = Pattern.AtomicType.class, name = "AtomicType"),
  @JsonSubTypes.Type(value = Pattern.Wrapper.class, name = "Wrapper"),
  @JsonSubTypes.Type(value = Pattern.TemplateInstantiation.class, name = "TemplateInstantiation")
})
public sealed interface Pattern
    permits Pattern.Capture, Pattern.AtomicType, Pattern.Wrapper, Pattern.TemplateInstantiation {

  /** 收集模式中出现的捕获变量名。 */
  default void collectCaptures(Set<String> out) {
    if (this instanceof Capture c) {
      out.add(c.name);
    } else if (this instanceof Wrapper w) {
      w.inner.collectCaptures(out);
    } else if (this instanceof TemplateInstantiation t) {
      for (Pattern arg : t.args) {
        arg.collectCaptures(out);
      }
    }
  }

  /** 无约束地绑定任意值。 */
  @JsonTypeName("Capture")
  final class Capture implements Pattern {
    public final String name;

    @JsonCreator
    public Capture(@JsonProperty("name") String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    @Override public String toString() { return name; }
  }

  @JsonTypeName("AtomicType")
  final class AtomicType implements Pattern {
    public final String cppType;

    @JsonCreator
    public AtomicType(@JsonProperty("cppType") String cppType) {
      this.cppType = Objects.requireNonNull(cppType, "cppType");
    }

    @Override public String toString() { return cppType; }
  }

  @JsonTypeName("Wrapper")
  final class Wrapper implements Pattern {
    public final WrapperKind wrapper;
    public final Pattern inner;

    @JsonCreator
    public Wrapper(@JsonProperty("wrapper") WrapperKind wrapper, @JsonProperty("inner") Pattern inner) {
      this.wrapper = Objects.requireNonNull(wrapper, "wrapper");
      this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override public String toString() { return wrapper.spell(inner.toString()); }
  }

  @JsonTypeName("TemplateInstantiation")
  final class TemplateInstantiation implements Pattern {
    public final String template;
    public final List<Pattern> args;

    @JsonCreator
    public TemplateInstantiation(@JsonProperty("template") String template, @JsonProperty("args") List<Pattern> args) {
      this.template = Objects.requireNonNull(template, "template");
      this.args = args == null ? List.of() : List.copyOf(args);
    }

    @Override public String toString() { return template + args; }
  }
}
