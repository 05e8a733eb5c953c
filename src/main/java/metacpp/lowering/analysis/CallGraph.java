package metacpp.lowering.analysis;

import java.util.*;

/**
 * 调用图 - 函数之间的引用关系及其强连通分量凝聚
 *
 * - 每个函数一个节点，调用方指向被调方
 * - Tarjan 算法求强连通分量
 * - 分量按"被调方优先"的拓扑序输出，同层按最小成员名排序，保证多次运行结果一致
 */
public final class CallGraph {
  // 函数名 -> 被调函数名集合（只含图内节点）
  private final Map<String, Set<String>> edges = new TreeMap<>();

  /**
   * 强连通分量：成员按名称排序。
   */
  public static final class Component {
    public final List<String> members;
    public final boolean cyclic;

    Component(List<String> members, boolean cyclic) {
      this.members = List.copyOf(members);
      this.cyclic = cyclic;
    }

    String smallestMember() {
      return members.get(0);
    }

    @Override
    public String toString() {
      return members.toString();
    }
  }

  /**
   * 添加函数节点
   *
   * @param name 函数名
   * @throws IllegalArgumentException 如果名称为空或已存在
   */
  public void addFunction(String name) {
    if (name == null) {
      throw new IllegalArgumentException("function name cannot be null");
    }
    if (edges.containsKey(name)) {
      throw new IllegalArgumentException("Function already exists: " + name);
    }
    edges.put(name, new TreeSet<>());
  }

  /**
   * 添加调用边；被调方不在图中时忽略（外部名称由外部符号表处理）。
   *
   * @param caller 调用方
   * @param callee 被调方
   */
  public void addCall(String caller, String callee) {
    Set<String> callees = edges.get(caller);
    if (callees == null) {
      throw new IllegalArgumentException("Unknown caller: " + caller);
    }
    if (edges.containsKey(callee)) {
      callees.add(callee);
    }
  }

  public Set<String> callees(String name) {
    Set<String> callees = edges.get(name);
    return callees == null ? Collections.emptySet() : Collections.unmodifiableSet(callees);
  }

  /**
   * 凝聚后的分量，被调方在前。
   *
   * 在凝聚图上执行 Kahn 算法：一个分量的全部被调分量都已输出后它才就绪，
   * 就绪分量按最小成员名从小到大出队。
   *
   * @return 分量列表
   */
  public List<Component> componentsCalleesFirst() {
    List<Component> components = stronglyConnectedComponents();

    Map<String, Integer> componentOf = new HashMap<>();
    for (int i = 0; i < components.size(); i++) {
      for (String member : components.get(i).members) {
        componentOf.put(member, i);
      }
    }

    // 被调分量 -> 调用方分量，以及每个分量尚未输出的被调分量数
    List<Set<Integer>> callers = new ArrayList<>();
    int[] remaining = new int[components.size()];
    for (int i = 0; i < components.size(); i++) {
      callers.add(new HashSet<>());
    }
    for (int i = 0; i < components.size(); i++) {
      Set<Integer> calleeComponents = new HashSet<>();
      for (String member : components.get(i).members) {
        for (String callee : edges.get(member)) {
          int target = componentOf.get(callee);
          if (target != i) {
            calleeComponents.add(target);
          }
        }
      }
      remaining[i] = calleeComponents.size();
      for (int target : calleeComponents) {
        callers.get(target).add(i);
      }
    }

    PriorityQueue<Integer> ready = new PriorityQueue<>(
        Comparator.comparing(i -> components.get(i).smallestMember()));
    for (int i = 0; i < components.size(); i++) {
      if (remaining[i] == 0) {
        ready.offer(i);
      }
    }

    List<Component> ordered = new ArrayList<>(components.size());
    while (!ready.isEmpty()) {
      int next = ready.poll();
      ordered.add(components.get(next));
      for (int caller : callers.get(next)) {
        if (--remaining[caller] == 0) {
          ready.offer(caller);
        }
      }
    }
    return ordered;
  }

  /**
   * 含有环的分量（多个成员，或者单个成员直接递归）。
   *
   * 本分析不判断这些递归在模板实例化时是否终止，这里仅把它们暴露给调用方。
   *
   * @return 有环分量，按被调方优先的顺序
   */
  public List<Component> cyclicComponents() {
    List<Component> cyclic = new ArrayList<>();
    for (Component component : componentsCalleesFirst()) {
      if (component.cyclic) {
        cyclic.add(component);
      }
    }
    return cyclic;
  }

  // ---------------------------------------------------------------------------
  // Tarjan，用显式工作栈代替递归，长调用链不受线程栈深度限制

  private static final class Visit {
    final String name;
    final Iterator<String> callees;

    Visit(String name, Iterator<String> callees) {
      this.name = name;
      this.callees = callees;
    }
  }

  private List<Component> stronglyConnectedComponents() {
    Map<String, Integer> index = new HashMap<>();
    Map<String, Integer> lowLink = new HashMap<>();
    Deque<String> stack = new ArrayDeque<>();
    Set<String> onStack = new HashSet<>();
    List<Component> found = new ArrayList<>();

    for (String root : edges.keySet()) {
      if (index.containsKey(root)) {
        continue;
      }
      Deque<Visit> work = new ArrayDeque<>();
      enter(root, index, lowLink, stack, onStack, work);

      while (!work.isEmpty()) {
        Visit top = work.peek();
        if (top.callees.hasNext()) {
          String callee = top.callees.next();
          if (!index.containsKey(callee)) {
            enter(callee, index, lowLink, stack, onStack, work);
          } else if (onStack.contains(callee)) {
            lowLink.put(top.name, Math.min(lowLink.get(top.name), index.get(callee)));
          }
          continue;
        }

        work.pop();
        String name = top.name;
        if (lowLink.get(name).equals(index.get(name))) {
          List<String> members = new ArrayList<>();
          String member;
          do {
            member = stack.pop();
            onStack.remove(member);
            members.add(member);
          } while (!member.equals(name));
          Collections.sort(members);
          boolean cyclic = members.size() > 1 || edges.get(name).contains(name);
          found.add(new Component(members, cyclic));
        }
        if (!work.isEmpty()) {
          String caller = work.peek().name;
          lowLink.put(caller, Math.min(lowLink.get(caller), lowLink.get(name)));
        }
      }
    }
    return found;
  }

  private void enter(String name, Map<String, Integer> index, Map<String, Integer> lowLink,
                     Deque<String> stack, Set<String> onStack, Deque<Visit> work) {
    int next = index.size();
    index.put(name, next);
    lowLink.put(name, next);
    stack.push(name);
    onStack.add(name);
    work.push(new Visit(name, edges.get(name).iterator()));
  }
}
