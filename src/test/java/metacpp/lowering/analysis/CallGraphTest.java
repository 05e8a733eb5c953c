package metacpp.lowering.analysis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CallGraph 单元测试
 *
 * 测试目标：
 * 1. 强连通分量的识别（互递归、自递归）
 * 2. 被调方优先的拓扑顺序及其确定性
 * 3. 非法输入的处理
 */
public class CallGraphTest {

  private CallGraph graph;

  @BeforeEach
  public void setUp() {
    graph = new CallGraph();
  }

  private static List<List<String>> members(List<CallGraph.Component> components) {
    List<List<String>> out = new ArrayList<>();
    for (CallGraph.Component c : components) {
      out.add(c.members);
    }
    return out;
  }

  @Test
  public void testLinearChainCalleesFirst() {
    graph.addFunction("a");
    graph.addFunction("b");
    graph.addFunction("c");
    graph.addCall("a", "b");
    graph.addCall("b", "c");

    assertEquals(List.of(List.of("c"), List.of("b"), List.of("a")), members(graph.componentsCalleesFirst()));
    assertTrue(graph.cyclicComponents().isEmpty(), "无环图不应有环分量");
  }

  @Test
  public void testMutualRecursionFormsOneComponent() {
    graph.addFunction("main");
    graph.addFunction("even");
    graph.addFunction("odd");
    graph.addCall("main", "even");
    graph.addCall("even", "odd");
    graph.addCall("odd", "even");

    List<CallGraph.Component> components = graph.componentsCalleesFirst();
    assertEquals(2, components.size());
    assertEquals(List.of("even", "odd"), components.get(0).members, "分量成员按名称排序");
    assertTrue(components.get(0).cyclic);
    assertEquals(List.of("main"), components.get(1).members);
    assertFalse(components.get(1).cyclic);
  }

  @Test
  public void testSelfRecursionIsCyclic() {
    graph.addFunction("loop");
    graph.addCall("loop", "loop");

    List<CallGraph.Component> cyclic = graph.cyclicComponents();
    assertEquals(1, cyclic.size());
    assertEquals(List.of("loop"), cyclic.get(0).members);
  }

  @Test
  public void testIndependentComponentsOrderedByName() {
    graph.addFunction("zeta");
    graph.addFunction("alpha");
    graph.addFunction("mid");

    assertEquals(List.of(List.of("alpha"), List.of("mid"), List.of("zeta")),
        members(graph.componentsCalleesFirst()), "互不依赖的分量按最小成员名排序");
  }

  @Test
  public void testDiamond() {
    graph.addFunction("top");
    graph.addFunction("left");
    graph.addFunction("right");
    graph.addFunction("bottom");
    graph.addCall("top", "left");
    graph.addCall("top", "right");
    graph.addCall("left", "bottom");
    graph.addCall("right", "bottom");

    assertEquals(List.of(List.of("bottom"), List.of("left"), List.of("right"), List.of("top")),
        members(graph.componentsCalleesFirst()));
  }

  @Test
  public void testCallsToUnknownFunctionsIgnored() {
    graph.addFunction("a");
    graph.addCall("a", "builtin");
    assertTrue(graph.callees("a").isEmpty(), "图外的被调方不建边");
  }

  @Test
  public void testInvalidInput() {
    graph.addFunction("a");
    assertThrows(IllegalArgumentException.class, () -> graph.addFunction("a"));
    assertThrows(IllegalArgumentException.class, () -> graph.addFunction(null));
    assertThrows(IllegalArgumentException.class, () -> graph.addCall("missing", "a"));
  }

  @Test
  public void testLargeChainPerformance() {
    for (int i = 0; i < 500; i++) {
      graph.addFunction(String.format("f%03d", i));
    }
    for (int i = 1; i < 500; i++) {
      graph.addCall(String.format("f%03d", i), String.format("f%03d", i - 1));
    }
    long start = System.nanoTime();
    List<CallGraph.Component> components = graph.componentsCalleesFirst();
    long elapsedMs = (System.nanoTime() - start) / 1_000_000;

    assertEquals(500, components.size());
    assertEquals(List.of("f000"), components.get(0).members);
    assertTrue(elapsedMs < 1000, "500 个节点的凝聚应很快完成，实际 " + elapsedMs + "ms");
  }

  @Test
  public void testDeepAcyclicChainDoesNotExhaustStack() {
    int n = 20_000;
    for (int i = 0; i < n; i++) {
      graph.addFunction(String.format("f%05d", i));
    }
    for (int i = 1; i < n; i++) {
      graph.addCall(String.format("f%05d", i), String.format("f%05d", i - 1));
    }

    List<CallGraph.Component> components = graph.componentsCalleesFirst();

    assertEquals(n, components.size());
    assertEquals(List.of("f00000"), components.get(0).members);
    assertEquals(List.of("f19999"), components.get(n - 1).members);
    assertTrue(graph.cyclicComponents().isEmpty());
  }

  @Test
  public void testDeepRingIsOneComponent() {
    int n = 20_000;
    for (int i = 0; i < n; i++) {
      graph.addFunction(String.format("f%05d", i));
    }
    for (int i = 0; i < n; i++) {
      graph.addCall(String.format("f%05d", i), String.format("f%05d", (i + 1) % n));
    }
    graph.addFunction("main");
    graph.addCall("main", "f12345");

    List<CallGraph.Component> components = graph.componentsCalleesFirst();

    assertEquals(2, components.size());
    assertEquals(n, components.get(0).members.size());
    assertTrue(components.get(0).cyclic);
    assertEquals(List.of("main"), components.get(1).members);
  }
}
