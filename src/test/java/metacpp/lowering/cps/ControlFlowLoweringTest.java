package metacpp.lowering.cps;

import metacpp.lowering.LoweringException;
import metacpp.lowering.analysis.ExternalMayRaiseTable;
import metacpp.lowering.analysis.ThrowabilityAnalyzer;
import metacpp.lowering.core.ExprType;
import metacpp.lowering.core.IdentifierGenerator;
import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.Pattern;
import metacpp.lowering.core.SourceModel;
import metacpp.lowering.core.SourceModel.*;
import metacpp.lowering.core.WrapperKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static metacpp.lowering.SourceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ControlFlowLowering 单元测试
 *
 * 测试目标：
 * 1. raise 的两种结果：直接调用处理器或只填错误槽的 return
 * 2. try/except 的续延函数数量与参数
 * 3. 可抛出调用后的错误检查与处理器分派顺序
 * 4. match 与推导式的合成函数
 * 5. 集合字面量、短路求值等表达式拍平
 */
public class ControlFlowLoweringTest {

  private static final ExprType.FunctionType BOOL_TO_INT = fnType(ExprType.INT, ExprType.BOOL);

  private IdentifierGenerator ids;

  @BeforeEach
  public void setUp() {
    ids = IdentifierGenerator.forUnit("test");
  }

  private static List<LoweredModel.Stmt> flatten(List<LoweredModel.Stmt> stmts) {
    List<LoweredModel.Stmt> out = new ArrayList<>();
    for (LoweredModel.Stmt s : stmts) {
      out.add(s);
      if (s instanceof LoweredModel.If i) {
        out.addAll(flatten(i.thenStmts));
        out.addAll(flatten(i.elseStmts));
      }
    }
    return out;
  }

  private static <T> List<T> ofType(List<LoweredModel.Stmt> stmts, Class<T> type) {
    List<T> out = new ArrayList<>();
    for (LoweredModel.Stmt s : flatten(stmts)) {
      if (type.isInstance(s)) {
        out.add(type.cast(s));
      }
    }
    return out;
  }

  private static Set<String> paramNames(LoweredModel.Function function) {
    Set<String> names = new HashSet<>();
    for (LoweredModel.Param p : function.params) {
      names.add(p.name);
    }
    return names;
  }

  @Test
  public void testRaiseWithoutHandlerBecomesErrorReturn() {
    SourceModel.Function fn = function("r", List.of(param("n", ExprType.INT)), ExprType.INT,
        new Raise(raiseValue(1)));
    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);

    assertTrue(result.synthesized.isEmpty());
    List<LoweredModel.Return> returns = ofType(result.statements, LoweredModel.Return.class);
    assertEquals(1, returns.size(), "只应有一个 return");
    LoweredModel.Return ret = returns.get(0);
    assertNull(ret.result, "值槽为空");

    LoweredModel.Assignment construct = (LoweredModel.Assignment) result.statements.get(1);
    assertInstanceOf(LoweredModel.Construct.class, construct.rhs);
    assertEquals(E, ((LoweredModel.Construct) construct.rhs).customType);
    assertEquals(construct.lhs, ret.error, "错误槽就是构造出的 E(1)");
    assertTrue(result.function.mayRaise);
  }

  @Test
  public void testRaiseWithMatchingHandlerCallsHandlerDirectly() {
    SourceModel.Function fn = function("q", List.of(param("n", ExprType.INT)), ExprType.INT,
        new TryExcept(List.of(new Raise(raiseValue(1))), E, "e",
            List.of(new Return(new AttributeAccess(local("e", E), "x", ExprType.INT)))));
    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);

    assertEquals(1, result.synthesized.size());
    LoweredModel.Function handler = result.synthesized.get(0);
    assertEquals("e", handler.params.get(0).name, "处理器的第一个参数是绑定名");

    List<LoweredModel.Stmt> body = result.statements;
    LoweredModel.Assignment bind = (LoweredModel.Assignment) body.get(2);
    assertEquals("e", bind.lhs.name);
    assertEquals(E, bind.lhs.type);
    LoweredModel.Assignment handlerCall = (LoweredModel.Assignment) body.get(3);
    assertEquals(handler.name, ((LoweredModel.FunctionCall) handlerCall.rhs).fun.name);
    assertNull(handlerCall.lhs2, "处理器不会抛出时只有值目标");
    LoweredModel.Return ret = (LoweredModel.Return) body.get(4);
    assertEquals(handlerCall.lhs, ret.result);
    assertNull(ret.error);
    assertFalse(result.function.mayRaise);
  }

  @Test
  public void testRaiseWithNonMatchingHandlerPropagates() {
    SourceModel.Function fn = function("q", List.of(param("n", ExprType.INT)), ExprType.INT,
        new TryExcept(List.of(new Raise(raiseValue(1))), OTHER_ERROR, "o", List.of(new Return(integer(0)))));
    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);

    LoweredModel.Stmt last = result.statements.get(result.statements.size() - 1);
    LoweredModel.Return ret = assertInstanceOf(LoweredModel.Return.class, last);
    assertNull(ret.result);
    assertNotNull(ret.error);
  }

  @Test
  public void testTryExceptWithoutFollowingStatementsSynthesizesOnlyHandler() {
    SourceModel.Function fn = function("k", List.of(param("b", ExprType.BOOL)), ExprType.INT,
        new TryExcept(
            List.of(new Return(call(VarRef.global("f", BOOL_TO_INT, true), local("b", ExprType.BOOL)))),
            E, "e",
            List.of(new Return(new AttributeAccess(local("e", E), "x", ExprType.INT)))));
    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);

    assertEquals(1, result.synthesized.size(), "没有后续语句时不生成 then 续延");
    assertTrue(result.synthesized.get(0).description.contains("except block"));
  }

  @Test
  public void testTryExceptWithFollowingStatements() {
    List<SourceModel.Function> analyzed =
        ThrowabilityAnalyzer.recomputeThrowability(List.of(f(), h()), ExternalMayRaiseTable.empty());
    LoweringResult result = ControlFlowLowering.lowerControlFlow(analyzed.get(1), ids);

    assertEquals(2, result.synthesized.size());
    LoweredModel.Function then = result.synthesized.get(0);
    LoweredModel.Function except = result.synthesized.get(1);
    assertTrue(then.description.contains("after a try-except"));
    assertEquals(Set.of("y"), paramNames(then), "then 续延的参数是后续语句的自由变量");
    assertEquals(List.of("e"), except.params.stream().map(p -> p.name).toList(),
        "except 块先定义 y 再调用 then，y 不是自由变量");

    // try 块中的 f(b) 带错误检查，命中 E 时转入 except 续延
    List<LoweredModel.Assignment> assignments = ofType(result.statements, LoweredModel.Assignment.class);
    LoweredModel.Assignment callF = assignments.stream()
        .filter(a -> a.rhs instanceof LoweredModel.FunctionCall c && c.fun.name.equals("f"))
        .findFirst().orElseThrow();
    assertNotNull(callF.lhs2);
    assertTrue(assignments.stream().anyMatch(a -> a.rhs instanceof LoweredModel.IsInstance i
        && i.checkedType.equals(E)));
    assertTrue(assignments.stream().anyMatch(a -> a.rhs instanceof LoweredModel.SafeUncheckedCast
        && a.lhs.name.equals("e")));
    assertTrue(assignments.stream().anyMatch(a -> a.rhs instanceof LoweredModel.FunctionCall c
        && c.fun.name.equals(then.name)), "try 块正常结束后调用 then 续延");
  }

  @Test
  public void testContinuationWithoutFreeVariablesGetsFallbackParameter() {
    ExprType.FunctionType intToInt = fnType(ExprType.INT, ExprType.INT);
    SourceModel.Function fn = function("p", List.of(param("fn", intToInt), param("n", ExprType.INT)), ExprType.INT,
        new TryExcept(List.of(new Assignment(local("z", ExprType.INT), integer(1))), E, "e", List.of(new Pass())),
        new Return(integer(7)));
    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);

    LoweredModel.Function then = result.synthesized.get(0);
    assertEquals(1, then.params.size());
    assertEquals("n", then.params.get(0).name, "兜底参数是第一个非函数类型的参数");
  }

  @Test
  public void testZeroParameterFunctionForwardsFreshVoidValue() {
    // def p0(): try: z = 1 except E as e: pass; return 7
    SourceModel.Function fn = function("p0", List.of(), ExprType.INT,
        new TryExcept(List.of(new Assignment(local("z", ExprType.INT), integer(1))), E, "e", List.of(new Pass())),
        new Return(integer(7)));
    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);

    LoweredModel.Function then = result.synthesized.get(0);
    assertEquals(1, then.params.size());

    List<LoweredModel.Stmt> all = new ArrayList<>(result.statements);
    for (LoweredModel.Function synthesized : result.synthesized) {
      all.addAll(synthesized.body);
    }
    LoweredModel.VarRef voidVar = null;
    LoweredModel.FunctionCall thenCall = null;
    for (LoweredModel.Stmt stmt : flatten(all)) {
      if (voidVar == null && stmt instanceof LoweredModel.Assignment a
          && a.rhs instanceof LoweredModel.TypeLiteral t && t.cppType.equals("void")) {
        voidVar = a.lhs;
      }
      if (thenCall == null && stmt instanceof LoweredModel.Assignment a
          && a.rhs instanceof LoweredModel.FunctionCall c && c.fun.name.equals(then.name)) {
        thenCall = c;
      }
    }
    assertNotNull(voidVar, "没有参数时写入一个 void 值的新变量");
    assertNotNull(thenCall);
    assertEquals(List.of(voidVar), thenCall.args, "续延以该变量作为兜底实参");
  }


  @Test
  public void testErrorCheckInCallerWithoutHandlers() {
    List<SourceModel.Function> analyzed =
        ThrowabilityAnalyzer.recomputeThrowability(List.of(f(), g()), ExternalMayRaiseTable.empty());
    assertTrue(analyzed.get(0).mayRaise);
    assertTrue(analyzed.get(1).mayRaise);

    LoweringResult result = ControlFlowLowering.lowerControlFlow(analyzed.get(1), ids);
    List<LoweredModel.Stmt> body = result.statements;
    assertEquals(4, body.size(), body.toString());

    LoweredModel.Assignment call = (LoweredModel.Assignment) body.get(0);
    assertEquals("f", ((LoweredModel.FunctionCall) call.rhs).fun.name);
    assertNotNull(call.lhs2);

    LoweredModel.Assignment check = (LoweredModel.Assignment) body.get(1);
    assertEquals(call.lhs2, ((LoweredModel.IsError) check.rhs).var);

    LoweredModel.If dispatch = (LoweredModel.If) body.get(2);
    assertEquals(check.lhs, dispatch.cond);
    assertEquals(1, dispatch.thenStmts.size(), "没有处理器时不插入分派");
    LoweredModel.Return forward = (LoweredModel.Return) dispatch.thenStmts.get(0);
    assertNull(forward.result);
    assertEquals(call.lhs2, forward.error, "原样转发 f 的错误槽");
    assertTrue(dispatch.elseStmts.isEmpty());

    LoweredModel.Return ret = (LoweredModel.Return) body.get(3);
    assertEquals(call.lhs, ret.result);
    assertTrue(result.synthesized.isEmpty());
  }

  @Test
  public void testHandlersTriedNearestFirst() {
    LoweredModel.FunctionCall outerCall = new LoweredModel.FunctionCall(
        LoweredModel.VarRef.global("outer_handler", fnType(ExprType.INT, E), false),
        List.of(LoweredModel.VarRef.local("e", E)));
    LoweredModel.FunctionCall innerCall = new LoweredModel.FunctionCall(
        LoweredModel.VarRef.global("inner_handler", fnType(ExprType.INT, OTHER_ERROR), true),
        List.of(LoweredModel.VarRef.local("o", OTHER_ERROR)));
    HandlerContext outer = new HandlerContext(E, "e", outerCall);
    HandlerContext inner = new HandlerContext(OTHER_ERROR, "o", innerCall);

    SourceModel.Function fn = function("k", List.of(param("b", ExprType.BOOL)), ExprType.INT,
        new Return(call(VarRef.global("f", BOOL_TO_INT, true), local("b", ExprType.BOOL))));
    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids, List.of(outer, inner));

    LoweredModel.If dispatch = (LoweredModel.If) result.statements.get(2);
    List<ExprType.CustomType> checked = new ArrayList<>();
    for (LoweredModel.Stmt s : dispatch.thenStmts) {
      if (s instanceof LoweredModel.Assignment a && a.rhs instanceof LoweredModel.IsInstance i) {
        checked.add(i.checkedType);
      }
    }
    assertEquals(List.of(OTHER_ERROR, E), checked, "最近压入的处理器先尝试");

    // 会抛出的处理器保留双通道，不会抛出的只有值目标
    LoweredModel.If innerBranch = (LoweredModel.If) dispatch.thenStmts.get(1);
    LoweredModel.Assignment innerInvoke = (LoweredModel.Assignment) innerBranch.thenStmts.get(1);
    assertNotNull(innerInvoke.lhs2);
    LoweredModel.If outerBranch = (LoweredModel.If) dispatch.thenStmts.get(3);
    LoweredModel.Assignment outerInvoke = (LoweredModel.Assignment) outerBranch.thenStmts.get(1);
    assertNull(outerInvoke.lhs2);

    LoweredModel.Stmt last = dispatch.thenStmts.get(dispatch.thenStmts.size() - 1);
    assertNull(assertInstanceOf(LoweredModel.Return.class, last).result, "都不匹配时转发错误");
  }

  @Test
  public void testMatchCasesBecomeFunctions() {
    VarRef t = local("t", ExprType.TYPE);
    MatchCase catchAll = new MatchCase(List.of(new Pattern.Capture("other")), List.of("other"),
        new BoolLiteral(false));
    MatchCase pointer = new MatchCase(
        List.of(new Pattern.Wrapper(WrapperKind.POINTER, new Pattern.Capture("u"))), List.of("u"),
        new Equality(local("u", ExprType.TYPE), new TypeLiteral("int")));
    MatchCase pair = new MatchCase(
        List.of(new Pattern.TemplateInstantiation("std::pair",
            List.of(new Pattern.Capture("a"), new Pattern.Capture("b")))),
        List.of("a", "b"),
        new Equality(local("a", ExprType.TYPE), local("b", ExprType.TYPE)));
    SourceModel.Function fn = function("classify", List.of(param("t", ExprType.TYPE)), ExprType.BOOL,
        new Return(new MatchExpr(List.of(t), List.of(catchAll, pointer, pair), ExprType.BOOL)));

    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);
    assertEquals(3, result.synthesized.size(), "每个分支一个函数");

    LoweredModel.Assignment assign = (LoweredModel.Assignment) result.statements.get(0);
    LoweredModel.MatchExpr match = assertInstanceOf(LoweredModel.MatchExpr.class, assign.rhs);
    assertEquals(List.of(t.name), match.matchedVars.stream().map(v -> v.name).toList());
    assertFalse(match.cases.get(0).isCatchAll());
    assertFalse(match.cases.get(1).isCatchAll());
    assertTrue(match.cases.get(2).isCatchAll(), "兜底分支排在最后");

    assertEquals(Set.of("u"), paramNames(result.synthesized.get(0)));
    assertEquals(Set.of("a", "b"), paramNames(result.synthesized.get(1)));
    assertEquals(Set.of("t"), paramNames(result.synthesized.get(2)), "没有自由变量时使用兜底参数");
    assertNull(assign.lhs2, "分支函数都不会抛出");
  }

  @Test
  public void testComprehensionLoopVariableIsFirstParameter() {
    VarRef x = local("x", ExprType.INT);
    VarRef k = local("k", ExprType.INT);
    ExprType intList = new ExprType.ListType(ExprType.INT);
    SourceModel.Function fn = function("scale",
        List.of(param("l", intList), param("k", ExprType.INT)), intList,
        new Return(new ListComprehension(local("l", intList), x, new IntBinaryOp(k, x, "*"))));

    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);
    LoweredModel.Function elem = result.synthesized.get(0);
    assertEquals(List.of("x", "k"), elem.params.stream().map(p -> p.name).toList());
    assertTrue(elem.description.contains("comprehension"));

    LoweredModel.Assignment assign = (LoweredModel.Assignment) result.statements.get(0);
    LoweredModel.ListComprehension lc = assertInstanceOf(LoweredModel.ListComprehension.class, assign.rhs);
    assertEquals("x", lc.loopVar.name);
    assertEquals("l", lc.listVar.name);
  }

  @Test
  public void testSetComprehensionGoesThroughList() {
    ExprType intSet = new ExprType.SetType(ExprType.INT);
    VarRef x = local("x", ExprType.INT);
    SourceModel.Function fn = function("negate", List.of(param("s", intSet)), intSet,
        new Return(new SetComprehension(local("s", intSet), x, new UnaryMinus(x))));

    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);
    List<LoweredModel.Assignment> assignments = ofType(result.statements, LoweredModel.Assignment.class);
    assertInstanceOf(LoweredModel.SetToList.class, assignments.get(0).rhs);
    assertInstanceOf(LoweredModel.ListComprehension.class, assignments.get(1).rhs);
    assertInstanceOf(LoweredModel.ListToSet.class, assignments.get(2).rhs);
  }

  @Test
  public void testSetLiteralBuiltWithAddToSet() {
    ExprType intSet = new ExprType.SetType(ExprType.INT);
    SourceModel.Function fn = function("mk", List.of(param("n", ExprType.INT)), intSet,
        new Return(new SetExpr(ExprType.INT, List.of(local("n", ExprType.INT), integer(3)))));

    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);
    List<LoweredModel.Assignment> assignments = ofType(result.statements, LoweredModel.Assignment.class);
    LoweredModel.ListExpr empty = assertInstanceOf(LoweredModel.ListExpr.class, assignments.get(0).rhs);
    assertTrue(empty.elems.isEmpty());
    assertEquals(intSet, assignments.get(0).lhs.type);
    assertEquals(2, assignments.stream().filter(a -> a.rhs instanceof LoweredModel.AddToSet).count());
  }

  @Test
  public void testShortCircuitAndUsesFreshResult() {
    VarRef a = local("a", ExprType.BOOL);
    VarRef b = local("b", ExprType.BOOL);
    SourceModel.Function fn = function("both", List.of(param("a", ExprType.BOOL), param("b", ExprType.BOOL)),
        ExprType.BOOL, new Return(new And(a, b)));

    LoweringResult result = ControlFlowLowering.lowerControlFlow(fn, ids);
    LoweredModel.If branch = (LoweredModel.If) result.statements.get(0);
    assertEquals("a", branch.cond.name);
    LoweredModel.Assignment evaluated = (LoweredModel.Assignment) branch.thenStmts.get(0);
    assertEquals("b", ((LoweredModel.VarRef) evaluated.rhs).name);
    LoweredModel.Assignment shortCircuit = (LoweredModel.Assignment) branch.elseStmts.get(0);
    assertFalse(((LoweredModel.BoolLiteral) shortCircuit.rhs).value);
    assertEquals(evaluated.lhs, shortCircuit.lhs);
    assertNotEquals("b", evaluated.lhs.name, "结果写入新变量而不是右操作数");
  }

  @Test
  public void testToplevelRaiseRejected() {
    assertThrows(LoweringException.class,
        () -> ControlFlowLowering.lowerStatements(List.of(new Raise(raiseValue(1))), ids));
  }

  @Test
  public void testToplevelCallChecksError() {
    Stmt assertion = new SourceModel.Assert(
        new Equality(call(VarRef.global("f", BOOL_TO_INT, true), new BoolLiteral(false)), integer(2)), "f works");
    LoweringResult result = ControlFlowLowering.lowerStatements(List.of(assertion), ids);

    assertNull(result.function);
    assertEquals(1, ofType(result.statements, LoweredModel.CheckIfError.class).size());
    assertTrue(ofType(result.statements, LoweredModel.Return.class).isEmpty(), "顶层没有 return");
    assertEquals(1, ofType(result.statements, LoweredModel.Assert.class).size());
  }

  @Test
  public void testModuleOrdersSourceFunctionsBeforeSynthesized() {
    SourceModel.Module module = module("m", h(), f());
    LoweredModel.Module lowered = ControlFlowLowering.lowerModule(module, ids);

    assertEquals("h", lowered.functions.get(0).name);
    assertEquals("f", lowered.functions.get(1).name);
    assertEquals(4, lowered.functions.size());
    assertTrue(lowered.functions.get(2).name.startsWith(ids.prefix()));
  }
}
