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
 * 类型检查后的源树（降级阶段的输入）。
 *
 * <p>所有节点构造后不可变；分析器只会生成带有新 {@code mayRaise} 标记的副本。</p>
 */
public final class SourceModel {
  private SourceModel() {}

  private static <T> List<T> copy(List<T> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  public static final class Module {
    public final String name;
    public final List<ExprType.CustomType> customTypes;
    public final List<Function> functions;
    public final List<Assert> assertions;
    public final List<String> publicNames;

    @JsonCreator
    public Module(@JsonProperty("name") String name,
                  @JsonProperty("customTypes") List<ExprType.CustomType> customTypes,
                  @JsonProperty("functions") List<Function> functions,
                  @JsonProperty("assertions") List<Assert> assertions,
                  @JsonProperty("publicNames") List<String> publicNames) {
      this.name = Objects.requireNonNull(name, "name");
      this.customTypes = copy(customTypes);
      this.functions = copy(functions);
      this.assertions = copy(assertions);
      this.publicNames = copy(publicNames);
    }

    public Module withFunctions(List<Function> newFunctions) {
      return new Module(name, customTypes, newFunctions, assertions, publicNames);
    }

    public Module withAssertions(List<Assert> newAssertions) {
      return new Module(name, customTypes, functions, newAssertions, publicNames);
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
  }

  public static final class Function {
    public final String name;
    public final List<Param> params;
    public final List<Stmt> body;
    public final ExprType returnType;
    public final boolean mayRaise;

    @JsonCreator
    public Function(@JsonProperty("name") String name,
                    @JsonProperty("params") List<Param> params,
                    @JsonProperty("body") List<Stmt> body,
                    @JsonProperty("returnType") ExprType returnType,
                    @JsonProperty("mayRaise") boolean mayRaise) {
      this.name = Objects.requireNonNull(name, "name");
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
      return new Function(name, params, newBody, returnType, newMayRaise);
    }
  }

  // ---------------------------------------------------------------------------
  // 语句

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = Assignment.class, name = "Assignment"),
    @JsonSubTypes.Type(value = Return.class, name = "Return"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = Raise.class, name = "Raise"),
    @JsonSubTypes.Type(value = TryExcept.class, name = "TryExcept"),
    @JsonSubTypes.Type(value = Assert.class, name = "Assert"),
    @JsonSubTypes.Type(value = Pass.class, name = "Pass")
  })
  public sealed interface Stmt permits Assignment, Return, If, Raise, TryExcept, Assert, Pass {}

  @JsonTypeName("Assignment")
  public static final class Assignment implements Stmt {
    public final VarRef lhs;
    public final Expr rhs;

    @JsonCreator
    public Assignment(@JsonProperty("lhs") VarRef lhs, @JsonProperty("rhs") Expr rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }
  }

  @JsonTypeName("Return")
  public static final class Return implements Stmt {
    public final Expr expr;

    @JsonCreator
    public Return(@JsonProperty("expr") Expr expr) {
      this.expr = Objects.requireNonNull(expr, "expr");
    }
  }

  @JsonTypeName("If")
  public static final class If implements Stmt {
    public final Expr cond;
    public final List<Stmt> thenStmts;
    public final List<Stmt> elseStmts;

    @JsonCreator
    public If(@JsonProperty("cond") Expr cond,
              @JsonProperty("thenStmts") List<Stmt> thenStmts,
              @JsonProperty("elseStmts") List<Stmt> elseStmts) {
      this.cond = Objects.requireNonNull(cond, "cond");
      this.thenStmts = copy(thenStmts);
      this.elseStmts = copy(elseStmts);
    }
  }

  @JsonTypeName("Raise")
  public static final class Raise implements Stmt {
    public final Expr expr;

    @JsonCreator
    public Raise(@JsonProperty("expr") Expr expr) {
      this.expr = Objects.requireNonNull(expr, "expr");
    }
  }

  @JsonTypeName("TryExcept")
  public static final class TryExcept implements Stmt {
    public final List<Stmt> tryBody;
    public final ExprType.CustomType caughtType;
    public final String caughtName;
    public final List<Stmt> exceptBody;

    @JsonCreator
    public TryExcept(@JsonProperty("tryBody") List<Stmt> tryBody,
                     @JsonProperty("caughtType") ExprType.CustomType caughtType,
                     @JsonProperty("caughtName") String caughtName,
                     @JsonProperty("exceptBody") List<Stmt> exceptBody) {
      this.tryBody = copy(tryBody);
      this.caughtType = Objects.requireNonNull(caughtType, "caughtType");
      this.caughtName = Objects.requireNonNull(caughtName, "caughtName");
      this.exceptBody = copy(exceptBody);
    }
  }

  @JsonTypeName("Assert")
  public static final class Assert implements Stmt {
    public final Expr expr;
    public final String message;

    @JsonCreator
    public Assert(@JsonProperty("expr") Expr expr, @JsonProperty("message") String message) {
      this.expr = Objects.requireNonNull(expr, "expr");
      this.message = message == null ? "" : message;
    }
  }

  /** 仅用于源码位置对齐的空语句，对语义无影响。 */
  @JsonTypeName("Pass")
  public static final class Pass implements Stmt {}

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
    @JsonSubTypes.Type(value = SetExpr.class, name = "Set"),
    @JsonSubTypes.Type(value = FunctionCall.class, name = "Call"),
    @JsonSubTypes.Type(value = Construct.class, name = "Construct"),
    @JsonSubTypes.Type(value = AttributeAccess.class, name = "AttributeAccess"),
    @JsonSubTypes.Type(value = Equality.class, name = "Equality"),
    @JsonSubTypes.Type(value = In.class, name = "In"),
    @JsonSubTypes.Type(value = And.class, name = "And"),
    @JsonSubTypes.Type(value = Or.class, name = "Or"),
    @JsonSubTypes.Type(value = Not.class, name = "Not"),
    @JsonSubTypes.Type(value = UnaryMinus.class, name = "UnaryMinus"),
    @JsonSubTypes.Type(value = IntBinaryOp.class, name = "IntBinaryOp"),
    @JsonSubTypes.Type(value = IntComparison.class, name = "IntComparison"),
    @JsonSubTypes.Type(value = MatchExpr.class, name = "Match"),
    @JsonSubTypes.Type(value = ListComprehension.class, name = "ListComprehension"),
    @JsonSubTypes.Type(value = SetComprehension.class, name = "SetComprehension")
  })
  public sealed interface Expr
      permits VarRef, BoolLiteral, IntLiteral, TypeLiteral, TypeWrapper, TemplateInstantiation, ListExpr, SetExpr,
          FunctionCall, Construct, AttributeAccess, Equality, In, And, Or, Not, UnaryMinus, IntBinaryOp,
          IntComparison, MatchExpr, ListComprehension, SetComprehension {
    ExprType type();
  }

  /**
   * 变量引用。{@code globalFunction} 表示引用的是模块级函数；{@code sourceModule} 非空时表示引用来自其他编译单元。
   */
  @JsonTypeName("Var")
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

  /** 原子 C++ 类型字面量，如 {@code int}、{@code void}、{@code std::string}。 */
  @JsonTypeName("TypeLiteral")
  public static final class TypeLiteral implements Expr {
    public final String cppType;

    @JsonCreator
    public TypeLiteral(@JsonProperty("cppType") String cppType) {
      this.cppType = Objects.requireNonNull(cppType, "cppType");
    }

    @Override public ExprType type() { return ExprType.TYPE; }
  }

  /** {@code T*}、{@code T&}、{@code T&&}、{@code const T}、{@code T[]} 之类的类型包装。 */
  @JsonTypeName("TypeWrapper")
  public static final class TypeWrapper implements Expr {
    public final WrapperKind wrapper;
    public final Expr inner;

    @JsonCreator
    public TypeWrapper(@JsonProperty("wrapper") WrapperKind wrapper, @JsonProperty("inner") Expr inner) {
      this.wrapper = Objects.requireNonNull(wrapper, "wrapper");
      this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override public ExprType type() { return ExprType.TYPE; }
  }

  @JsonTypeName("TemplateInstantiation")
  public static final class TemplateInstantiation implements Expr {
    public final String template;
    public final List<Expr> args;

    @JsonCreator
    public TemplateInstantiation(@JsonProperty("template") String template, @JsonProperty("args") List<Expr> args) {
      this.template = Objects.requireNonNull(template, "template");
      this.args = copy(args);
    }

    @Override public ExprType type() { return ExprType.TYPE; }
  }

  @JsonTypeName("List")
  public static final class ListExpr implements Expr {
    public final ExprType elemType;
    public final List<Expr> elems;

    @JsonCreator
    public ListExpr(@JsonProperty("elemType") ExprType elemType, @JsonProperty("elems") List<Expr> elems) {
      this.elemType = Objects.requireNonNull(elemType, "elemType");
      this.elems = copy(elems);
    }

    @Override public ExprType type() { return new ExprType.ListType(elemType); }
  }

  @JsonTypeName("Set")
  public static final class SetExpr implements Expr {
    public final ExprType elemType;
    public final List<Expr> elems;

    @JsonCreator
    public SetExpr(@JsonProperty("elemType") ExprType elemType, @JsonProperty("elems") List<Expr> elems) {
      this.elemType = Objects.requireNonNull(elemType, "elemType");
      this.elems = copy(elems);
    }

    @Override public ExprType type() { return new ExprType.SetType(elemType); }
  }

  @JsonTypeName("Call")
  public static final class FunctionCall implements Expr {
    public final Expr fun;
    public final List<Expr> args;
    public final boolean mayRaise;

    @JsonCreator
    public FunctionCall(@JsonProperty("fun") Expr fun,
                        @JsonProperty("args") List<Expr> args,
                        @JsonProperty("mayRaise") boolean mayRaise) {
      this.fun = Objects.requireNonNull(fun, "fun");
      this.args = copy(args);
      this.mayRaise = mayRaise;
    }

    @Override
    public ExprType type() {
      if (fun.type() instanceof ExprType.FunctionType ft) {
        return ft.returns;
      }
      return ExprType.BOTTOM;
    }
  }

  /** 自定义类型（含异常类型）的构造。 */
  @JsonTypeName("Construct")
  public static final class Construct implements Expr {
    public final ExprType.CustomType customType;
    public final List<Expr> args;

    @JsonCreator
    public Construct(@JsonProperty("customType") ExprType.CustomType customType, @JsonProperty("args") List<Expr> args) {
      this.customType = Objects.requireNonNull(customType, "customType");
      this.args = copy(args);
    }

    @Override public ExprType type() { return customType; }
  }

  @JsonTypeName("AttributeAccess")
  public static final class AttributeAccess implements Expr {
    public final Expr expr;
    public final String attribute;
    public final ExprType type;

    @JsonCreator
    public AttributeAccess(@JsonProperty("expr") Expr expr,
                           @JsonProperty("attribute") String attribute,
                           @JsonProperty("type") ExprType type) {
      this.expr = Objects.requireNonNull(expr, "expr");
      this.attribute = Objects.requireNonNull(attribute, "attribute");
      this.type = Objects.requireNonNull(type, "type");
    }

    @Override public ExprType type() { return type; }
  }

  @JsonTypeName("Equality")
  public static final class Equality implements Expr {
    public final Expr lhs;
    public final Expr rhs;

    @JsonCreator
    public Equality(@JsonProperty("lhs") Expr lhs, @JsonProperty("rhs") Expr rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("In")
  public static final class In implements Expr {
    public final Expr lhs;
    public final Expr rhs;

    @JsonCreator
    public In(@JsonProperty("lhs") Expr lhs, @JsonProperty("rhs") Expr rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("And")
  public static final class And implements Expr {
    public final Expr lhs;
    public final Expr rhs;

    @JsonCreator
    public And(@JsonProperty("lhs") Expr lhs, @JsonProperty("rhs") Expr rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("Or")
  public static final class Or implements Expr {
    public final Expr lhs;
    public final Expr rhs;

    @JsonCreator
    public Or(@JsonProperty("lhs") Expr lhs, @JsonProperty("rhs") Expr rhs) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("Not")
  public static final class Not implements Expr {
    public final Expr expr;

    @JsonCreator
    public Not(@JsonProperty("expr") Expr expr) { this.expr = Objects.requireNonNull(expr, "expr"); }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("UnaryMinus")
  public static final class UnaryMinus implements Expr {
    public final Expr expr;

    @JsonCreator
    public UnaryMinus(@JsonProperty("expr") Expr expr) { this.expr = Objects.requireNonNull(expr, "expr"); }

    @Override public ExprType type() { return ExprType.INT; }
  }

  @JsonTypeName("IntBinaryOp")
  public static final class IntBinaryOp implements Expr {
    public final Expr lhs;
    public final Expr rhs;
    public final String op;

    @JsonCreator
    public IntBinaryOp(@JsonProperty("lhs") Expr lhs, @JsonProperty("rhs") Expr rhs, @JsonProperty("op") String op) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
      this.op = Objects.requireNonNull(op, "op");
    }

    @Override public ExprType type() { return ExprType.INT; }
  }

  @JsonTypeName("IntComparison")
  public static final class IntComparison implements Expr {
    public final Expr lhs;
    public final Expr rhs;
    public final String op;

    @JsonCreator
    public IntComparison(@JsonProperty("lhs") Expr lhs, @JsonProperty("rhs") Expr rhs, @JsonProperty("op") String op) {
      this.lhs = Objects.requireNonNull(lhs, "lhs");
      this.rhs = Objects.requireNonNull(rhs, "rhs");
      this.op = Objects.requireNonNull(op, "op");
    }

    @Override public ExprType type() { return ExprType.BOOL; }
  }

  @JsonTypeName("Match")
  public static final class MatchExpr implements Expr {
    public final List<Expr> matchedExprs;
    public final List<MatchCase> cases;
    public final ExprType type;

    @JsonCreator
    public MatchExpr(@JsonProperty("matchedExprs") List<Expr> matchedExprs,
                     @JsonProperty("cases") List<MatchCase> cases,
                     @JsonProperty("type") ExprType type) {
      this.matchedExprs = copy(matchedExprs);
      this.cases = copy(cases);
      this.type = Objects.requireNonNull(type, "type");
    }

    @Override public ExprType type() { return type; }
  }

  /**
   * 匹配分支：每个被匹配表达式对应一个模式；{@code matchedVarNames} 为模式绑定的变量名。
   */
  public static final class MatchCase {
    public final List<Pattern> patterns;
    public final List<String> matchedVarNames;
    public final Expr expr;

    @JsonCreator
    public MatchCase(@JsonProperty("patterns") List<Pattern> patterns,
                     @JsonProperty("matchedVarNames") List<String> matchedVarNames,
                     @JsonProperty("expr") Expr expr) {
      this.patterns = copy(patterns);
      this.matchedVarNames = copy(matchedVarNames);
      this.expr = Objects.requireNonNull(expr, "expr");
    }

    /** 全部模式均为无约束捕获时为兜底分支。 */
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
    public final Expr listExpr;
    public final VarRef loopVar;
    public final Expr resultExpr;

    @JsonCreator
    public ListComprehension(@JsonProperty("listExpr") Expr listExpr,
                             @JsonProperty("loopVar") VarRef loopVar,
                             @JsonProperty("resultExpr") Expr resultExpr) {
      this.listExpr = Objects.requireNonNull(listExpr, "listExpr");
      this.loopVar = Objects.requireNonNull(loopVar, "loopVar");
      this.resultExpr = Objects.requireNonNull(resultExpr, "resultExpr");
    }

    @Override public ExprType type() { return new ExprType.ListType(resultExpr.type()); }
  }

  @JsonTypeName("SetComprehension")
  public static final class SetComprehension implements Expr {
    public final Expr setExpr;
    public final VarRef loopVar;
    public final Expr resultExpr;

    @JsonCreator
    public SetComprehension(@JsonProperty("setExpr") Expr setExpr,
                            @JsonProperty("loopVar") VarRef loopVar,
                            @JsonProperty("resultExpr") Expr resultExpr) {
      this.setExpr = Objects.requireNonNull(setExpr, "setExpr");
      this.loopVar = Objects.requireNonNull(loopVar, "loopVar");
      this.resultExpr = Objects.requireNonNull(resultExpr, "resultExpr");
    }

    @Override public ExprType type() { return new ExprType.SetType(resultExpr.type()); }
  }
}
