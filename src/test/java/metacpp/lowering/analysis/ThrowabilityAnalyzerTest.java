package metacpp.lowering.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import metacpp.lowering.LoweringException;
import metacpp.lowering.core.ExprType;
import metacpp.lowering.core.IdentifierGenerator;
import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.SourceModel;
import metacpp.lowering.core.SourceModel.*;
import metacpp.lowering.cps.ControlFlowLowering;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static metacpp.lowering.SourceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ThrowabilityAnalyzer 单元测试
 *
 * 测试目标：
 * 1. 没有可达 raise 的函数集合全部为 false
 * 2. 同一强连通分量的成员结果一致
 * 3. 重复应用结果不变
 * 4. 调用点与函数引用上的标记被改写
 * 5. 降级树后处理删除死错误检查
 */
public class ThrowabilityAnalyzerTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final ExprType.FunctionType INT_TO_INT = fnType(ExprType.INT, ExprType.INT);

  private static Map<String, Boolean> flags(List<SourceModel.Function> functions) {
    Map<String, Boolean> out = new HashMap<>();
    for (SourceModel.Function f : functions) {
      out.put(f.name, f.mayRaise);
    }
    return out;
  }

  /** {@code def name(n): return callee(n)}，初始标记故意设为 true。 */
  private static SourceModel.Function forwarding(String name, String callee) {
    return new SourceModel.Function(name, List.of(param("n", ExprType.INT)),
        List.of(new Return(call(VarRef.global(callee, INT_TO_INT, true), local("n", ExprType.INT)))),
        ExprType.INT, true);
  }

  private static SourceModel.Function identity(String name) {
    return new SourceModel.Function(name, List.of(param("n", ExprType.INT)),
        List.of(new Return(local("n", ExprType.INT))), ExprType.INT, true);
  }

  private static SourceModel.Function raising(String name) {
    return function(name, List.of(param("n", ExprType.INT)), ExprType.INT, new Raise(raiseValue(0)));
  }

  @Test
  public void testNoReachableRaiseMeansNoFunctionRaises() {
    List<SourceModel.Function> result = ThrowabilityAnalyzer.recomputeThrowability(
        List.of(forwarding("a", "b"), forwarding("b", "c"), identity("c")), ExternalMayRaiseTable.empty());

    assertEquals(Map.of("a", false, "b", false, "c", false), flags(result));
    Return ret = (Return) result.get(0).body.get(0);
    FunctionCall call = (FunctionCall) ret.expr;
    assertFalse(((VarRef) call.fun).mayRaise, "对 b 的引用应被改写为不抛出");
    assertFalse(call.mayRaise, "调用点标记跟随被调引用");
  }

  @Test
  public void testRaiseIsPropagatedToTransitiveCallers() {
    List<SourceModel.Function> result = ThrowabilityAnalyzer.recomputeThrowability(
        List.of(forwarding("a", "b"), forwarding("b", "c"), raising("c"), identity("d")),
        ExternalMayRaiseTable.empty());

    assertEquals(Map.of("a", true, "b", true, "c", true, "d", false), flags(result));
  }

  @Test
  public void testStronglyConnectedComponentsAgree() {
    // even -> odd -> even，odd 另外调用会抛出的 fail
    SourceModel.Function even = forwarding("even", "odd");
    SourceModel.Function odd = function("odd", List.of(param("n", ExprType.INT)), ExprType.INT,
        new If(new IntComparison(local("n", ExprType.INT), integer(0), "<"),
            List.of(new Return(call(global("fail", INT_TO_INT), local("n", ExprType.INT)))),
            List.of(new Return(call(global("even", INT_TO_INT), local("n", ExprType.INT))))));
    List<SourceModel.Function> result = ThrowabilityAnalyzer.recomputeThrowability(
        List.of(even, odd, raising("fail"), forwarding("main", "even")), ExternalMayRaiseTable.empty());

    Map<String, Boolean> flags = flags(result);
    assertEquals(flags.get("even"), flags.get("odd"), "同一分量的成员必须一致");
    assertTrue(flags.get("even"));
    assertTrue(flags.get("main"));
  }

  @Test
  public void testNonRaisingCycleStaysFalse() {
    List<SourceModel.Function> result = ThrowabilityAnalyzer.recomputeThrowability(
        List.of(forwarding("ping", "pong"), forwarding("pong", "ping")), ExternalMayRaiseTable.empty());
    assertEquals(Map.of("ping", false, "pong", false), flags(result));
  }

  @Test
  public void testIdempotent() throws Exception {
    List<SourceModel.Function> once = ThrowabilityAnalyzer.recomputeThrowability(
        List.of(f(), g(), h(), forwarding("a", "b"), forwarding("b", "a")), ExternalMayRaiseTable.empty());
    List<SourceModel.Function> twice = ThrowabilityAnalyzer.recomputeThrowability(once, ExternalMayRaiseTable.empty());

    assertEquals(MAPPER.writeValueAsString(once), MAPPER.writeValueAsString(twice));
  }

  @Test
  public void testEmptyInput() {
    assertTrue(ThrowabilityAnalyzer.recomputeThrowability(List.of(), ExternalMayRaiseTable.empty()).isEmpty());
  }

  @Test
  public void testExternalReferencesUseTable() {
    VarRef external = new VarRef("parse", INT_TO_INT, true, false, "lib");
    SourceModel.Function user = function("user", List.of(param("n", ExprType.INT)), ExprType.INT,
        new Return(call(external, local("n", ExprType.INT))));

    ExternalMayRaiseTable table = ExternalMayRaiseTable.empty();
    table.put("lib", "parse", true);
    List<SourceModel.Function> result = ThrowabilityAnalyzer.recomputeThrowability(List.of(user), table);

    assertTrue(result.get(0).mayRaise);
    FunctionCall rewritten = (FunctionCall) ((Return) result.get(0).body.get(0)).expr;
    assertTrue(((VarRef) rewritten.fun).mayRaise, "外部引用标记取自外部表");

    assertThrows(LoweringException.class,
        () -> ThrowabilityAnalyzer.recomputeThrowability(List.of(user), ExternalMayRaiseTable.empty()));
  }

  @Test
  public void testCallingFunctionValuedParameterIsConservative() {
    SourceModel.Function apply = function("apply",
        List.of(param("fn", INT_TO_INT), param("n", ExprType.INT)), ExprType.INT,
        new Return(call(local("fn", INT_TO_INT), local("n", ExprType.INT))));
    List<SourceModel.Function> result =
        ThrowabilityAnalyzer.recomputeThrowability(List.of(apply), ExternalMayRaiseTable.empty());
    assertTrue(result.get(0).mayRaise, "调用函数类型的参数时无法确定被调方");
  }

  @Test
  public void testLoweredPassRemovesDeadErrorChecks() {
    // try: raise E(1) except E as e: return 5；源树上判定为会抛出，降级后实际不会
    SourceModel.Function caught = function("caught", List.of(param("n", ExprType.INT)), ExprType.INT,
        new TryExcept(List.of(new Raise(raiseValue(1))), E, "e", List.of(new Return(integer(5)))));
    SourceModel.Function caller = forwarding("caller", "caught");

    List<SourceModel.Function> analyzed = ThrowabilityAnalyzer.recomputeThrowability(
        List.of(caught, caller), ExternalMayRaiseTable.empty());
    assertTrue(analyzed.get(0).mayRaise, "源树上包含 raise 即视为可能抛出");

    SourceModel.Module module = module("m", analyzed.toArray(new SourceModel.Function[0]));
    LoweredModel.Module lowered = ControlFlowLowering.lowerModule(module, IdentifierGenerator.forUnit("m"));
    LoweredModel.Function callerBefore = lowered.function("caller");
    assertNotNull(((LoweredModel.Assignment) callerBefore.body.get(0)).lhs2, "降级时按源树标记插入了错误目标");

    LoweredModel.Module result = ThrowabilityAnalyzer.recomputeLowered(lowered, ExternalMayRaiseTable.empty());
    assertFalse(result.function("caught").mayRaise);
    LoweredModel.Function callerAfter = result.function("caller");
    assertFalse(callerAfter.mayRaise);
    assertEquals(2, callerAfter.body.size(), "只剩调用与 return：" + callerAfter.body);
    LoweredModel.Assignment callSite = (LoweredModel.Assignment) callerAfter.body.get(0);
    assertNull(callSite.lhs2);
    assertFalse(((LoweredModel.FunctionCall) callSite.rhs).fun.mayRaise);
    LoweredModel.Return ret = (LoweredModel.Return) callerAfter.body.get(1);
    assertNull(ret.error);
  }

  @Test
  public void testLoweredPassIsIdempotent() throws Exception {
    SourceModel.Module module = module("m", f(), g(), h());
    List<SourceModel.Function> analyzed =
        ThrowabilityAnalyzer.recomputeThrowability(module.functions, ExternalMayRaiseTable.empty());
    LoweredModel.Module lowered = ControlFlowLowering.lowerModule(module.withFunctions(analyzed),
        IdentifierGenerator.forUnit("m"));

    LoweredModel.Module once = ThrowabilityAnalyzer.recomputeLowered(lowered, ExternalMayRaiseTable.empty());
    LoweredModel.Module twice = ThrowabilityAnalyzer.recomputeLowered(once, ExternalMayRaiseTable.empty());
    assertEquals(MAPPER.writeValueAsString(once), MAPPER.writeValueAsString(twice));
  }

  @Test
  public void testLongForwardingChainReachesRaise() {
    int n = 20_000;
    List<SourceModel.Function> functions = new ArrayList<>();
    functions.add(raising("g00000"));
    for (int i = 1; i < n; i++) {
      functions.add(forwarding(String.format("g%05d", i), String.format("g%05d", i - 1)));
    }

    Map<String, Boolean> result = flags(ThrowabilityAnalyzer.recomputeThrowability(functions, ExternalMayRaiseTable.empty()));

    assertEquals(n, result.size());
    assertTrue(result.values().stream().allMatch(Boolean::booleanValue));
  }
}
