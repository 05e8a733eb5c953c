package metacpp.lowering.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.util.List;
import java.util.Objects;

/**
 * 降级后的扁平树：没有 raise / try / 结构化匹配，所有操作数都是变量引用。
 *
 * <p>语句只剩 Assignment（可带第二个错误目标）、If、Return（值槽 + 错误槽）、Assert 以及顶层的
 * CheckIfError；模式分派统一由 {@link MatchExpr} 表达。</p>
 */
public final class LoweredModel {
  private LoweredModel() {}

  private static <T> List<T> copy(List<T> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  public static final class Module {
    public final String name;
    public final List<ExprType.CustomType> customTypes;
    public final List<Function> functions;
    public final List<Stmt> toplevel;
    public final List<String> publicNames;

    @JsonCreator
    public Module(@JsonProperty("name") String name,
                  @JsonProperty("customTypes") List<ExprType.CustomType> customTypes,
                  @JsonProperty("functions") List<Function> functions,
                  @JsonProperty("toplevel") List<Stmt> toplevel,
                  @JsonProperty("publicNames") List<String> publicNames) {
      this.name = Objects.requireNonNull(name, "name");
      this.customTypes = copy(customTypes);
      this.functions = copy(functions);
      this.toplevel = copy(toplevel);
      this.publicNames = copy(publicNames);
    }

    public Function function(String functionName) {
      for (Function f : functions) {
        if (f.name.equals(functionName)) {
          return f;
        }
      }
      return null;
    }
  }

  public static final class Param {
    public final String name;
    public final ExprType type;

    @JsonCreator
    public Param(@JsonProperty("name") String name, @JsonProperty("type") ExprType type) {
      this.name = Objects.requireNonNull(name, "name");
      this.type = Objects.requireNonNull(type, "type");
    }

    @Override public String toString() { return name + ": " + type; }
  }

  public static final class Function {
    public final String name;
    public final String description;
    public final List<Param> params;
    public final List<Stmt> body;
    public final ExprType returnType;
    public final boolean mayRaise;

    @JsonCreator
    public Function(@JsonProperty("name") String name,
                    @JsonProperty("description") String description,
                    @JsonProperty("params") List<Param> params,
                    @JsonProperty("body") List<Stmt> body,
                    @JsonProperty("returnType") ExprType returnType,
                    @JsonProperty("mayRaise") boolean mayRaise) {
      this.name = Objects.requireNonNull(name, "name");
      this.description = description == null ? "" : description;
      this.params = copy(params);
      this.body = copy(body);
      this.returnType = Objects.requireNonNull(returnType, "returnType");
      this.mayRaise = mayRaise;
    }

    @JsonIgnore
    public ExprType.FunctionType type() {
      return new ExprType.FunctionType(params.stream().map(p -> p.type).toList(), returnType);
    }

    public Function withBody(List<Stmt> newBody, boolean newMayRaise) {
      return new Function(name, description, params, newBody, returnType, newMayRaise);
    }
  }

  // ---------------------------------------------------------------------------
  // 语句

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Assignment.class, name = "Assignment"),
    @JsonSubTypes.Type(value = Return.class, name = "Return"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = Assert.class, name = "Assert"),
    @JsonSubTypes.Type(value = CheckIfError.class, name = "CheckIfError")
  })
  public sealed interface Stmt permits Assignment, Return, If, Assert, CheckIfError {}

  /** {@code lhs = rhs} 或双通道形式 {@code lhs, lhs2 = rhs}（lhs2 接收错误槽）。 */
  @JsonTypeName("Assignment")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class Assignment implements Stmt {
    public final VarRef lhs;
    public final VarRef lhs2;
    public final Expr rhs;

    @JsonCreator
    public Assignment(@JsonProperty("lhs") VarRef lhs, @JsonProperty("lhs2") VarRef lhs2, @JsonProperty("rhs") Expr rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.lhs2 = lhs2;
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    public Assignment(VarRef lhs, Expr rhs) {
      this(lhs, null, rhs);
    }
  }

  /** 至多一个槽位有值；两者都为空只会出现在无返回值的兜底路径中。 */
  @JsonTypeName("Return")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class Return implements Stmt {
    public final VarRef result;
    public final VarRef error;

    @JsonCreator
    public Return(@JsonProperty("result") VarRef result, @JsonProperty("error") VarRef error) {
      this.result = result;
      this.error = error;
    }
  }

  @JsonTypeName("If")
  public static final class If implements Stmt {
    public final VarRef cond;
    public final List<Stmt> thenStmts;
    public final List<Stmt> elseStmts;

    @JsonCreator
    public If(@JsonProperty("cond") VarRef cond,
              @JsonProperty("thenStmts") List<Stmt> thenStmts,
              @JsonProperty("elseStmts") List<Stmt> elseStmts) {
      this.cond = Objects.requireNonNull(cond, "cond");
      this.thenStmts = copy(thenStmts);
      this.elseStmts = copy(elseStmts);
    }
  }

  @JsonTypeName("Assert")
  public static final class Assert implements Stmt {
    public final VarRef var;
    public final String message;

    @JsonCreator
    public Assert(@JsonProperty("var") VarRef var, @JsonProperty("message") String message) {
      this.var = Objects.requireNonNull(var, "var");
      this.message = message == null ? "" : message;
    }
  }

  /** 顶层计算产生的错误无处可传，只能终止程序。 */
  @JsonTypeName("CheckIfError")
  public static final class CheckIfError implements Stmt {
    public final VarRef var;

    @JsonCreator
    public CheckIfError(@JsonProperty("var") VarRef var) {
      this.var = Objects.requireNonNull(var, "var");
    }
  }

  // ---------------------------------------------------------------------------
  // 表达式

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = VarRef.class, name = "Var"),
    @JsonSubTypes.Type(value = BoolLiteral.class, name = "Bool"),
    @JsonSubTypes.Type(value = IntLiteral.class, name = "Int"),
    @JsonSubTypes.Type(value = TypeLiteral.class, name = "TypeLiteral"),
    @JsonSubTypes.Type(value = TypeWrapper.class, name = "TypeWrapper"),
    @JsonSubTypes.Type(value = TemplateInstantiation.class, name = "TemplateInstantiation"),
    @JsonSubTypes.Type(value = ListExpr.class, name = "List"),
    @JsonSubTypes.Type(value = AddToSet.class, name = "AddToSet"),
    @JsonSubTypes.Type(value = SetToList.class, name = "SetToList"),
    @JsonSubTypes.Type(value = ListToSet.class, name = "ListToSet"),
    @JsonSubTypes.Type(value = SetEquality.class, name = "SetEquality"),
    @JsonSubTypes.Type(value = FunctionCall.class, name = "Call"),
    @JsonSubTypes.Type(value = Construct.class, name = "Construct"),
    @JsonSubTypes.Type(value = AttributeAccess.class, name = "AttributeAccess"),
    @JsonSubTypes.Type(value = Equality.class, name = "Equality"),
    @JsonSubTypes.Type(value = IsInList.class, name = "IsInList"),
    @JsonSubTypes.Type(value = Not.class, name = "Not"),
    @JsonSubTypes.Type(value = UnaryMinus.class, name = "UnaryMinus"),
    @JsonSubTypes.Type(value = IntBinaryOp.class, name = "IntBinaryOp"),
    @JsonSubTypes.Type(value = IntComparison.class, name = "IntComparison"),
    @JsonSubTypes.Type(value = IsError.class, name = "IsError"),
    @JsonSubTypes.Type(value = IsInstance.class, name = "IsInstance"),
    @JsonSubTypes.Type(value = SafeUncheckedCast.class, name = "SafeUncheckedCast"),
    @JsonSubTypes.Type(value = MatchExpr.class, name = "Match"),
    @JsonSubTypes.Type(value = ListComprehension.class, name = "ListComprehension")
  })
  public sealed interface Expr
      permits VarRef, BoolLiteral, IntLiteral, TypeLiteral, TypeWrapper, TemplateInstantiation, ListExpr, AddToSet,
          SetToList, ListToSet, SetEquality, FunctionCall, Construct, AttributeAccess, Equality, IsInList, Not,
          UnaryMinus, IntBinaryOp, IntComparison, IsError, IsInstance, SafeUncheckedCast, MatchExpr,
          ListComprehension {
    ExprType type();
  }

  @JsonTypeName("Var")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static final class VarRef implements Expr {
    public final String name;
    public final ExprType type;
    public final boolean globalFunction;
    public final boolean mayRaise;
    public final String sourceModule;

    @JsonCreator
    public VarRef(@JsonProperty("name") String name,
                  @JsonProperty("type") ExprType type,
                  @JsonProperty("globalFunction") boolean globalFunction,
                  @JsonProperty("mayRaise") boolean mayRaise,
                  @JsonProperty("sourceModule") String sourceModule) {
      this.name = Objects.requireNonNull(name, "name");
      this.type = Objects.requireNonNull(type, "type");
      this.globalFunction = globalFunction;
      this.mayRaise = mayRaise;
      this.sourceModule = sourceModule;
    }

    public static VarRef local(String name, ExprType type) {
      return new VarRef(name, type, false, type instanceof ExprType.FunctionType, null);
    }

    public static VarRef global(String name, ExprType.FunctionType type, boolean mayRaise) {
      return new VarRef(name, type, true, mayRaise, null);
    }

    public VarRef withMayRaise(boolean newMayRaise) {
      return newMayRaise == mayRaise ? this : new VarRef(name, type, globalFunction, newMayRaise, sourceModule);
    }

    @Override public ExprType type() { return type; }

    @Override
    public boolean equals(Object o) {
      return o instanceof VarRef v && name.equals(v.name) && type.equals(v.type)
          && globalFunction == v.globalFunction && mayRaise == v.mayRaise
          && Objects.equals(sourceModule, v.sourceModule);
    }

    @Override public int hashCode() { return Objects.hash(name, type, globalFunction, mayRaise); }
    @Override public String toString() { return name; }
  }

  @JsonTypeName("Bool")
  public static final class BoolLiteral implements Expr {
    public final boolean value;

    @JsonCreator
    public BoolLiteral(@JsonProperty("value") boolean value) { this.value = value; }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("Int")
  public static final class IntLiteral implements Expr {
    public final long value;

    @JsonCreator
    public IntLiteral(@JsonProperty("value") long value) { this.value = value; }

    @Override public ExprType type() { return ExprType.INT; }
  }

  @JsonTypeName("TypeLiteral")
  public static final class TypeLiteral implements Expr {
    public final String cppType;

    @JsonCreator
    public TypeLiteral(@JsonProperty("cppType") String cppType) {
      this.cppType = Objects.requireNonNull(cppType, "cppType");
    }

    @Override public ExprType type() { return ExprType.TYPE; }
  }

  @JsonTypeName("TypeWrapper")
  public static final class TypeWrapper implements Expr {
    public final WrapperKind wrapper;
    public final VarRef inner;

    @JsonCreator
    public TypeWrapper(@JsonProperty("wrapper") WrapperKind wrapper, @JsonProperty("inner") VarRef inner) {
      this.wrapper = Objects.requireNonNull(wrapper, "wrapper");
      this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override public ExprType type() { return ExprType.TYPE; }
  }

  @JsonTypeName("TemplateInstantiation")
  public static final class TemplateInstantiation implements Expr {
    public final String template;
    public final List<VarRef> args;

    @JsonCreator
    public TemplateInstantiation(@JsonProperty("template") String template, @JsonProperty("args") List<VarRef> args) {
      this.template = Objects.requireNonNull(template, "template");
      this.args = copy(args);
    }

    @Override public ExprType type() { return ExprType.TYPE; }
  }

  @JsonTypeName("List")
  public static final class ListExpr implements Expr {
    public final ExprType elemType;
    public final List<VarRef> elems;

    @JsonCreator
    public ListExpr(@JsonProperty("elemType") ExprType elemType, @JsonProperty("elems") List<VarRef> elems) {
      this.elemType = Objects.requireNonNull(elemType, "elemType");
      this.elems = copy(elems);
    }

    @Override public ExprType type() { return new ExprType.ListType(elemType); }
  }

  /** 集合在降级树中以去重列表表示。 */
  @JsonTypeName("AddToSet")
  public static final class AddToSet implements Expr {
    public final VarRef set;
    public final VarRef elem;

    @JsonCreator
    public AddToSet(@JsonProperty("set") VarRef set, @JsonProperty("elem") VarRef elem) {
      this.set = Objects.requireNonNull(set, "set");
      this.elem = Objects.requireNonNull(elem, "elem");
    }

    @Override public ExprType type() { return set.type; }
  }

  @JsonTypeName("SetToList")
  public static final class SetToList implements Expr {
    public final VarRef var;

    @JsonCreator
    public SetToList(@JsonProperty("var") VarRef var) { this.var = Objects.requireNonNull(var, "var"); }

    @Override
    public ExprType type() {
      return var.type instanceof ExprType.SetType st ? new ExprType.ListType(st.elemType) : var.type;
    }
  }

  @JsonTypeName("ListToSet")
  public static final class ListToSet implements Expr {
    public final VarRef var;

    @JsonCreator
    public ListToSet(@JsonProperty("var") VarRef var) { this.var = Objects.requireNonNull(var, "var"); }

    @Override
    public ExprType type() {
      return var.type instanceof ExprType.ListType lt ? new ExprType.SetType(lt.elemType) : var.type;
    }
  }

  @JsonTypeName("SetEquality")
  public static final class SetEquality implements Expr {
    public final VarRef lhs;
    public final VarRef rhs;

    @JsonCreator
    public SetEquality(@JsonProperty("lhs") VarRef lhs, @JsonProperty("rhs") VarRef rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("Call")
  public static final class FunctionCall implements Expr {
    public final VarRef fun;
    public final List<VarRef> args;

    @JsonCreator
    public FunctionCall(@JsonProperty("fun") VarRef fun, @JsonProperty("args") List<VarRef> args) {
      this.fun = Objects.requireNonNull(fun, "fun");
      this.args = copy(args);
    }

    @Override
    public ExprType type() {
      return fun.type instanceof ExprType.FunctionType ft ? ft.returns : ExprType.BOTTOM;
    }
  }

  @JsonTypeName("Construct")
  public static final class Construct implements Expr {
    public final ExprType.CustomType customType;
    public final List<VarRef> args;

    @JsonCreator
    public Construct(@JsonProperty("customType") ExprType.CustomType customType, @JsonProperty("args") List<VarRef> args) {
      this.customType = Objects.requireNonNull(customType, "customType");
      this.args = copy(args);
    }

    @Override public ExprType type() { return customType; }
  }

  @JsonTypeName("AttributeAccess")
  public static final class AttributeAccess implements Expr {
    public final VarRef var;
    public final String attribute;
    public final ExprType type;

    @JsonCreator
    public AttributeAccess(@JsonProperty("var") VarRef var,
                           @JsonProperty("attribute") String attribute,
                           @JsonProperty("type") ExprType type) {
      this.var = Objects.requireNonNull(var, "var");
      this.attribute = Objects.requireNonNull(attribute, "attribute");
      this.type = Objects.requireNonNull(type, "type");
    }

    @Override public ExprType type() { return type; }
  }

  @JsonTypeName("Equality")
  public static final class Equality implements Expr {
    public final VarRef lhs;
    public final VarRef rhs;

    @JsonCreator
    public Equality(@JsonProperty("lhs") VarRef lhs, @JsonProperty("rhs") VarRef rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("IsInList")
  public static final class IsInList implements Expr {
    public final VarRef lhs;
    public final VarRef rhs;

    @JsonCreator
    public IsInList(@JsonProperty("lhs") VarRef lhs, @JsonProperty("rhs") VarRef rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("Not")
  public static final class Not implements Expr {
    public final VarRef var;

    @JsonCreator
    public Not(@JsonProperty("var") VarRef var) { this.var = Objects.requireNonNull(var, "var"); }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("UnaryMinus")
  public static final class UnaryMinus implements Expr {
    public final VarRef var;

    @JsonCreator
    public UnaryMinus(@JsonProperty("var") VarRef var) { this.var = Objects.requireNonNull(var, "var"); }

    @Override public ExprType type() { return ExprType.INT; }
  }

  @JsonTypeName("IntBinaryOp")
  public static final class IntBinaryOp implements Expr {
    public final VarRef lhs;
    public final VarRef rhs;
    public final String op;

    @JsonCreator
    public IntBinaryOp(@JsonProperty("lhs") VarRef lhs, @JsonProperty("rhs") VarRef rhs, @JsonProperty("op") String op) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
      this.op = Objects.requireNonNull(op, "op");
    }

    @Override public ExprType type() { return ExprType.INT; }
  }

  @JsonTypeName("IntComparison")
  public static final class IntComparison implements Expr {
    public final VarRef lhs;
    public final VarRef rhs;
    public final String op;

    @JsonCreator
    public IntComparison(@JsonProperty("lhs") VarRef lhs, @JsonProperty("rhs") VarRef rhs, @JsonProperty("op") String op) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
      this.op = Objects.requireNonNull(op, "op");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  /** 错误槽是否有值。 */
  @JsonTypeName("IsError")
  public static final class IsError implements Expr {
    public final VarRef var;

    @JsonCreator
    public IsError(@JsonProperty("var") VarRef var) { this.var = Objects.requireNonNull(var, "var"); }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("IsInstance")
  public static final class IsInstance implements Expr {
    public final VarRef var;
    public final ExprType.CustomType checkedType;

    @JsonCreator
    public IsInstance(@JsonProperty("var") VarRef var, @JsonProperty("checkedType") ExprType.CustomType checkedType) {
      this.var = Objects.requireNonNull(var, "var");
      this.checkedType = Objects.requireNonNull(checkedType, "checkedType");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  /** 静态已知安全的收窄：把错误槽重新解释为具体异常类型，不做运行时检查。 */
  @JsonTypeName("SafeUncheckedCast")
  public static final class SafeUncheckedCast implements Expr {
    public final VarRef var;
    public final ExprType type;

    @JsonCreator
    public SafeUncheckedCast(@JsonProperty("var") VarRef var, @JsonProperty("type") ExprType type) {
      this.var = Objects.requireNonNull(var, "var");
      this.type = Objects.requireNonNull(type, "type");
    }

    @Override public ExprType type() { return type; }
  }

  /** 有序分派：按顺序尝试每个分支的模式，命中后调用对应的分支函数。 */
  @JsonTypeName("Match")
  public static final class MatchExpr implements Expr {
    public final List<VarRef> matchedVars;
    public final List<MatchCase> cases;
    public final ExprType type;

    @JsonCreator
    public MatchExpr(@JsonProperty("matchedVars") List<VarRef> matchedVars,
                     @JsonProperty("cases") List<MatchCase> cases,
                     @JsonProperty("type") ExprType type) {
      this.matchedVars = copy(matchedVars);
      this.cases = copy(cases);
      this.type = Objects.requireNonNull(type, "type");
    }

    @Override public ExprType type() { return type; }
  }

  public static final class MatchCase {
    public final List<Pattern> patterns;
    public final List<String> matchedVarNames;
    public final FunctionCall call;

    @JsonCreator
    public MatchCase(@JsonProperty("patterns") List<Pattern> patterns,
                     @JsonProperty("matchedVarNames") List<String> matchedVarNames,
                     @JsonProperty("call") FunctionCall call) {
      this.patterns = copy(patterns);
      this.matchedVarNames = copy(matchedVarNames);
      this.call = Objects.requireNonNull(call, "call");
    }

    @JsonIgnore
    public boolean isCatchAll() {
      for (Pattern p : patterns) {
        if (!(p instanceof Pattern.Capture)) {
          return false;
        }
      }
      return true;
    }
  }

  @JsonTypeName("ListComprehension")
  public static final class ListComprehension implements Expr {
    public final VarRef listVar;
    public final VarRef loopVar;
    public final FunctionCall call;

    @JsonCreator
    public ListComprehension(@JsonProperty("listVar") VarRef listVar,
                             @JsonProperty("loopVar") VarRef loopVar,
                             @JsonProperty("call") FunctionCall call) {
      this.listVar = Objects.requireNonNull(listVar, "listVar");
      this.loopVar = Objects.requireNonNull(loopVar, "loopVar");
      this.call = Objects.requireNonNull(call, "call");
    }

    @Override public ExprType type() { return new ExprType.ListType(call.type()); }
  }
}
