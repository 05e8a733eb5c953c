package metacpp.lowering.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.List;
import java.util.Objects;

/**
 * 源树与降级树共用的表达式类型。
 *
 * <p>类型比较为结构化比较；自定义类型按名称比较（字段列表仅作描述）。</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ExprType.BoolType.class, name = "Bool"),
  @JsonSubTypes.Type(value = ExprType.IntType.class, name = "Int"),
  @JsonSubTypes.Type(value = ExprType.TypeType.class, name = "Type"),
  @JsonSubTypes.Type(value = ExprType.BottomType.class, name = "Bottom"),
  @JsonSubTypes.Type(value = ExprType.ErrorOrVoidType.class, name = "ErrorOrVoid"),
  @JsonSubTypes.Type(value = ExprType.ListType.class, name = "List"),
  @JsonSubTypes.Type(value = ExprType.SetType.class, name = "Set"),
  @JsonSubTypes.Type(value = ExprType.FunctionType.class, name = "Function"),
  @JsonSubTypes.Type(value = ExprType.CustomType.class, name = "Custom")
})
public sealed interface ExprType
    permits ExprType.BoolType, ExprType.IntType, ExprType.TypeType, ExprType.BottomType,
        ExprType.ErrorOrVoidType, ExprType.ListType, ExprType.SetType, ExprType.FunctionType,
        ExprType.CustomType {

  BoolType BOOL = new BoolType();
  IntType INT = new IntType();
  TypeType TYPE = new TypeType();
  BottomType BOTTOM = new BottomType();
  ErrorOrVoidType ERROR_OR_VOID = new ErrorOrVoidType();

  @JsonTypeName("Bool")
  final class BoolType implements ExprType {
    @Override public boolean equals(Object o) { return o instanceof BoolType; }
    @Override public int hashCode() { return 1; }
    @Override public String toString() { return "bool"; }
  }

  @JsonTypeName("Int")
  final class IntType implements ExprType {
    @Override public boolean equals(Object o) { return o instanceof IntType; }
    @Override public int hashCode() { return 2; }
    @Override public String toString() { return "int"; }
  }

  /** C++ 类型值（模板参数层面的 typename）。 */
  @JsonTypeName("Type")
  final class TypeType implements ExprType {
    @Override public boolean equals(Object o) { return o instanceof TypeType; }
    @Override public int hashCode() { return 3; }
    @Override public String toString() { return "Type"; }
  }

  /** 永不产生值的表达式类型（例如只会抛出的调用）。 */
  @JsonTypeName("Bottom")
  final class BottomType implements ExprType {
    @Override public boolean equals(Object o) { return o instanceof BottomType; }
    @Override public int hashCode() { return 4; }
    @Override public String toString() { return "Bottom"; }
  }

  /** 降级后的错误槽类型：要么为空，要么是某个异常值。 */
  @JsonTypeName("ErrorOrVoid")
  final class ErrorOrVoidType implements ExprType {
    @Override public boolean equals(Object o) { return o instanceof ErrorOrVoidType; }
    @Override public int hashCode() { return 5; }
    @Override public String toString() { return "ErrorOrVoid"; }
  }

  @JsonTypeName("List")
  final class ListType implements ExprType {
    public final ExprType elemType;

    @JsonCreator
    public ListType(@JsonProperty("elemType") ExprType elemType) {
      this.elemType = Objects.requireNonNull(elemType, "elemType");
    }

    @Override public boolean equals(Object o) { return o instanceof ListType other && elemType.equals(other.elemType); }
    @Override public int hashCode() { return 31 * 6 + elemType.hashCode(); }
    @Override public String toString() { return "List[" + elemType + "]"; }
  }

  @JsonTypeName("Set")
  final class SetType implements ExprType {
    public final ExprType elemType;

    @JsonCreator
    public SetType(@JsonProperty("elemType") ExprType elemType) {
      this.elemType = Objects.requireNonNull(elemType, "elemType");
    }

    @Override public boolean equals(Object o) { return o instanceof SetType other && elemType.equals(other.elemType); }
    @Override public int hashCode() { return 31 * 7 + elemType.hashCode(); }
    @Override public String toString() { return "Set[" + elemType + "]"; }
  }

  @JsonTypeName("Function")
  final class FunctionType implements ExprType {
    public final List<ExprType> argTypes;
    public final ExprType returns;

    @JsonCreator
    public FunctionType(@JsonProperty("argTypes") List<ExprType> argTypes,
                        @JsonProperty("returns") ExprType returns) {
      this.argTypes = argTypes == null ? List.of() : List.copyOf(argTypes);
      this.returns = Objects.requireNonNull(returns, "returns");
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof FunctionType other && argTypes.equals(other.argTypes) && returns.equals(other.returns);
    }

    @Override public int hashCode() { return Objects.hash(argTypes, returns); }
    @Override public String toString() { return "Callable[" + argTypes + ", " + returns + "]"; }
  }

  /** 用户自定义记录类型的字段声明。 */
  final class Field {
    public final String name;
    public final ExprType type;

    @JsonCreator
    public Field(@JsonProperty("name") String name, @JsonProperty("type") ExprType type) {
      this.name = Objects.requireNonNull(name, "name");
      this.type = Objects.requireNonNull(type, "type");
    }

    @Override public boolean equals(Object o) { return o instanceof Field f && name.equals(f.name) && type.equals(f.type); }
    @Override public int hashCode() { return Objects.hash(name, type); }
  }

  /**
   * 用户自定义记录类型；{@code exception} 为 true 时即为异常类型，可被 raise / except 引用。
   */
  @JsonTypeName("Custom")
  final class CustomType implements ExprType {
    public final String name;
    public final List<Field> fields;
    public final boolean exception;

    @JsonCreator
    public CustomType(@JsonProperty("name") String name,
                      @JsonProperty("fields") List<Field> fields,
                      @JsonProperty("exception") boolean exception) {
      this.name = Objects.requireNonNull(name, "name");
      this.fields = fields == null ? List.of() : List.copyOf(fields);
      this.exception = exception;
    }

    @JsonIgnore
    public ExprType fieldType(String fieldName) {
      for (Field f : fields) {
        if (f.name.equals(fieldName)) {
          return f.type;
        }
      }
      return null;
    }

    @Override public boolean equals(Object o) { return o instanceof CustomType other && name.equals(other.name); }
    @Override public int hashCode() { return name.hashCode(); }
    @Override public String toString() { return name; }
  }
}
