package metacpp.lowering.analysis;

import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.SourceModel;
import metacpp.lowering.visit.LoweredTransformation;
import metacpp.lowering.visit.LoweredVisitor;
import metacpp.lowering.visit.SourceTransformation;
import metacpp.lowering.visit.SourceVisitor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 可抛出性分析：在调用图的强连通分量上求不动点，决定哪些函数（以及哪些调用点、函数引用）可能产生错误。
 *
 * <p>同一分量的成员共享同一个结果；分量按被调方优先的确定顺序处理，重复运行得到完全相同的输出。
 * 分析只回答"能否产生错误"，不判断递归是否终止。</p>
 */
public final class ThrowabilityAnalyzer {
  private static final Logger LOGGER = Logger.getLogger(ThrowabilityAnalyzer.class.getName());

  private ThrowabilityAnalyzer() {}

  /** 单个函数在分析中需要的事实。 */
  private static final class Facts {
    final Set<String> globalReferences = new HashSet<>();
    boolean raisesDirectly;
    boolean callsThrowingValue;
    boolean referencesThrowingExternal;
    // 图外的全局引用（例如内建函数）沿用引用上已有的标记
    boolean referencesThrowingUnknownGlobal;

    boolean raisesLocally() {
      return raisesDirectly || callsThrowingValue || referencesThrowingExternal || referencesThrowingUnknownGlobal;
    }
  }

  // ---------------------------------------------------------------------------
  // 源树

  /**
   * 重新计算源函数集合的 mayRaise 标记并改写所有全局引用与调用点。
   *
   * @param functions 源函数集合，可以为空
   * @param external 外部单元名称的可抛出性
   * @return 改写后的函数，顺序与输入相同
   */
  public static List<SourceModel.Function> recomputeThrowability(List<SourceModel.Function> functions,
                                                                ExternalMayRaiseTable external) {
    if (functions.isEmpty()) {
      return List.of();
    }
    Set<String> names = new HashSet<>();
    for (SourceModel.Function f : functions) {
      names.add(f.name);
    }

    Map<String, Facts> facts = new LinkedHashMap<>();
    for (SourceModel.Function f : functions) {
      facts.put(f.name, sourceFacts(f, names, external));
    }
    Map<String, Boolean> mayRaise = solve(facts);

    SourceTransformation rewrite = referenceRewrite(mayRaise, external);
    List<SourceModel.Function> out = new ArrayList<>(functions.size());
    for (SourceModel.Function f : functions) {
      out.add(f.withBody(rewrite.transformStmts(f.body), mayRaise.get(f.name)));
    }
    return out;
  }

  /**
   * 模块版本：除函数外，顶层断言中的全局引用与调用点也按分析结果改写。
   *
   * @param module 源模块
   * @param external 外部单元名称的可抛出性
   * @return 改写后的模块
   */
  public static SourceModel.Module recomputeThrowability(SourceModel.Module module, ExternalMayRaiseTable external) {
    List<SourceModel.Function> functions = recomputeThrowability(module.functions, external);
    Map<String, Boolean> mayRaise = new HashMap<>();
    for (SourceModel.Function f : functions) {
      mayRaise.put(f.name, f.mayRaise);
    }
    SourceTransformation rewrite = referenceRewrite(mayRaise, external);
    List<SourceModel.Assert> assertions = new ArrayList<>(module.assertions.size());
    for (SourceModel.Assert a : module.assertions) {
      assertions.add((SourceModel.Assert) rewrite.transformStmt(a));
    }
    return module.withFunctions(functions).withAssertions(assertions);
  }

  private static SourceTransformation referenceRewrite(Map<String, Boolean> mayRaise, ExternalMayRaiseTable external) {
    return new SourceTransformation() {
      @Override
      protected SourceModel.VarRef transformVarRef(SourceModel.VarRef var) {
        if (var.sourceModule != null) {
          return var.withMayRaise(external.mayRaise(var.sourceModule, var.name));
        }
        if (var.globalFunction && mayRaise.containsKey(var.name)) {
          return var.withMayRaise(mayRaise.get(var.name));
        }
        return var;
      }

      @Override
      protected SourceModel.Expr transformFunctionCall(SourceModel.FunctionCall call) {
        SourceModel.Expr fun = transformExpr(call.fun);
        boolean callMayRaise = fun instanceof SourceModel.VarRef ref ? ref.mayRaise : call.mayRaise;
        return new SourceModel.FunctionCall(fun, transformExprs(call.args), callMayRaise);
      }
    };
  }

  private static Facts sourceFacts(SourceModel.Function function, Set<String> names, ExternalMayRaiseTable external) {
    Facts facts = new Facts();
    new SourceVisitor() {
      @Override
      protected void visitRaise(SourceModel.Raise raise) {
        facts.raisesDirectly = true;
        super.visitRaise(raise);
      }

      @Override
      protected void visitVarRef(SourceModel.VarRef var) {
        recordReference(facts, var.name, var.globalFunction, var.mayRaise, var.sourceModule, names, external);
      }

      @Override
      protected void visitFunctionCall(SourceModel.FunctionCall call) {
        if (call.fun instanceof SourceModel.VarRef ref) {
          if (!ref.globalFunction && ref.sourceModule == null && ref.mayRaise) {
            facts.callsThrowingValue = true;
          }
        } else if (call.mayRaise) {
          facts.callsThrowingValue = true;
        }
        super.visitFunctionCall(call);
      }
    }.visitFunction(function);
    return facts;
  }

  private static void recordReference(Facts facts, String name, boolean globalFunction, boolean flagged,
                                      String sourceModule, Set<String> names, ExternalMayRaiseTable external) {
    if (sourceModule != null) {
      if (external.mayRaise(sourceModule, name)) {
        facts.referencesThrowingExternal = true;
      }
    } else if (globalFunction) {
      if (names.contains(name)) {
        facts.globalReferences.add(name);
      } else if (flagged) {
        facts.referencesThrowingUnknownGlobal = true;
      }
    }
  }

  // ---------------------------------------------------------------------------
  // 降级树

  /**
   * 对降级后的模块重新计算可抛出性，并删除已知不会抛出的调用点上的错误目标与错误检查。
   *
   * <p>降级树中的"直接抛出"是错误槽取自非调用结果的 return（例如构造出的异常值或处理器参数）；
   * 转发被调方错误槽的 return 只依赖被调方。</p>
   *
   * @param module 降级后的模块
   * @param external 外部单元名称的可抛出性
   * @return 改写后的模块
   */
  public static LoweredModel.Module recomputeLowered(LoweredModel.Module module, ExternalMayRaiseTable external) {
    List<LoweredModel.Function> functions = recomputeLowered(module.functions, external);
    Map<String, Boolean> mayRaise = new HashMap<>();
    for (LoweredModel.Function f : functions) {
      mayRaise.put(f.name, f.mayRaise);
    }
    DeadErrorCheckRemoval rewrite = new DeadErrorCheckRemoval(mayRaise, external);
    return new LoweredModel.Module(module.name, module.customTypes, functions,
        rewrite.transformStmts(module.toplevel), module.publicNames);
  }

  /**
   * 降级函数集合版本，供只处理部分函数的调用方使用。
   */
  public static List<LoweredModel.Function> recomputeLowered(List<LoweredModel.Function> functions,
                                                            ExternalMayRaiseTable external) {
    if (functions.isEmpty()) {
      return List.of();
    }
    Set<String> names = new HashSet<>();
    for (LoweredModel.Function f : functions) {
      names.add(f.name);
    }
    Map<String, Facts> facts = new LinkedHashMap<>();
    for (LoweredModel.Function f : functions) {
      facts.put(f.name, loweredFacts(f, names, external));
    }
    Map<String, Boolean> mayRaise = solve(facts);

    List<LoweredModel.Function> out = new ArrayList<>(functions.size());
    for (LoweredModel.Function f : functions) {
      DeadErrorCheckRemoval rewrite = new DeadErrorCheckRemoval(mayRaise, external);
      out.add(f.withBody(rewrite.transformStmts(f.body), mayRaise.get(f.name)));
    }
    return out;
  }

  private static Facts loweredFacts(LoweredModel.Function function, Set<String> names,
                                    ExternalMayRaiseTable external) {
    Facts facts = new Facts();
    Set<String> calleeErrors = new HashSet<>();
    List<String> returnedErrors = new ArrayList<>();
    new LoweredVisitor() {
      @Override
      public void visitStmt(LoweredModel.Stmt stmt) {
        if (stmt instanceof LoweredModel.Assignment a && a.lhs2 != null) {
          calleeErrors.add(a.lhs2.name);
        }
        super.visitStmt(stmt);
      }

      @Override
      protected void visitReturn(LoweredModel.Return ret) {
        if (ret.error != null) {
          returnedErrors.add(ret.error.name);
        }
        super.visitReturn(ret);
      }

      @Override
      protected void visitVarRef(LoweredModel.VarRef var) {
        recordReference(facts, var.name, var.globalFunction, var.mayRaise, var.sourceModule, names, external);
      }

      @Override
      protected void visitFunctionCall(LoweredModel.FunctionCall call) {
        LoweredModel.VarRef fun = call.fun;
        if (!fun.globalFunction && fun.sourceModule == null && fun.mayRaise) {
          facts.callsThrowingValue = true;
        }
        super.visitFunctionCall(call);
      }
    }.visitStmts(function.body);

    for (String error : returnedErrors) {
      if (!calleeErrors.contains(error)) {
        facts.raisesDirectly = true;
      }
    }
    return facts;
  }

  // ---------------------------------------------------------------------------
  // 不动点

  private static Map<String, Boolean> solve(Map<String, Facts> facts) {
    CallGraph graph = new CallGraph();
    for (String name : facts.keySet()) {
      graph.addFunction(name);
    }
    for (Map.Entry<String, Facts> e : facts.entrySet()) {
      for (String callee : e.getValue().globalReferences) {
        graph.addCall(e.getKey(), callee);
      }
    }

    Map<String, Boolean> mayRaise = new HashMap<>();
    for (CallGraph.Component component : graph.componentsCalleesFirst()) {
      boolean raises = false;
      for (String member : component.members) {
        Facts f = facts.get(member);
        if (f.raisesLocally()) {
          raises = true;
          break;
        }
        for (String callee : graph.callees(member)) {
          // 同分量成员尚未求值，不参与判断
          if (Boolean.TRUE.equals(mayRaise.get(callee))) {
            raises = true;
            break;
          }
        }
        if (raises) {
          break;
        }
      }
      for (String member : component.members) {
        mayRaise.put(member, raises);
      }
      if (LOGGER.isLoggable(Level.FINE)) {
        LOGGER.log(Level.FINE, "component {0}{1} -> mayRaise={2}",
            new Object[] {component.members, component.cyclic ? " (cyclic)" : "", raises});
      }
    }
    return mayRaise;
  }

  /**
   * 刷新全局引用上的 mayRaise，并删除不再需要的错误机制：
   * 被调方不会抛出时去掉 {@code lhs2}，随后删除对应的 {@code is_error}、分派 if、{@code CheckIfError}，
   * 以及 return 中引用这些错误变量的错误槽。变量名在函数内唯一，定义总在使用之前，一次顺序遍历即可。
   */
  private static final class DeadErrorCheckRemoval extends LoweredTransformation {
    private final Map<String, Boolean> mayRaise;
    private final ExternalMayRaiseTable external;
    private final Set<String> deadErrors = new HashSet<>();
    private final Set<String> deadChecks = new HashSet<>();

    DeadErrorCheckRemoval(Map<String, Boolean> mayRaise, ExternalMayRaiseTable external) {
      this.mayRaise = mayRaise;
      this.external = external;
    }

    @Override
    protected LoweredModel.VarRef transformVarRef(LoweredModel.VarRef var) {
      if (var.sourceModule != null) {
        return var.withMayRaise(external.mayRaise(var.sourceModule, var.name));
      }
      if (var.globalFunction && mayRaise.containsKey(var.name)) {
        return var.withMayRaise(mayRaise.get(var.name));
      }
      return var;
    }

    @Override
    protected LoweredModel.Stmt transformAssignment(LoweredModel.Assignment assignment) {
      LoweredModel.Expr rhs = transformExpr(assignment.rhs);
      if (rhs instanceof LoweredModel.IsError check && deadErrors.contains(check.var.name)) {
        deadChecks.add(assignment.lhs.name);
        return null;
      }
      if (assignment.lhs2 != null && !mayProduceError(rhs)) {
        deadErrors.add(assignment.lhs2.name);
        return new LoweredModel.Assignment(transformVarRef(assignment.lhs), rhs);
      }
      LoweredModel.VarRef lhs2 = assignment.lhs2 == null ? null : transformVarRef(assignment.lhs2);
      return new LoweredModel.Assignment(transformVarRef(assignment.lhs), lhs2, rhs);
    }

    @Override
    protected LoweredModel.Stmt transformIf(LoweredModel.If stmt) {
      if (deadChecks.contains(stmt.cond.name)) {
        return null;
      }
      return super.transformIf(stmt);
    }

    @Override
    protected LoweredModel.Stmt transformCheckIfError(LoweredModel.CheckIfError stmt) {
      if (deadErrors.contains(stmt.var.name)) {
        return null;
      }
      return super.transformCheckIfError(stmt);
    }

    @Override
    protected LoweredModel.Stmt transformReturn(LoweredModel.Return ret) {
      if (ret.error != null && deadErrors.contains(ret.error.name)) {
        return new LoweredModel.Return(ret.result == null ? null : transformVarRef(ret.result), null);
      }
      return super.transformReturn(ret);
    }

    private static boolean mayProduceError(LoweredModel.Expr rhs) {
      if (rhs instanceof LoweredModel.FunctionCall call) {
        return call.fun.mayRaise;
      }
      if (rhs instanceof LoweredModel.MatchExpr match) {
        for (LoweredModel.MatchCase c : match.cases) {
          if (c.call.fun.mayRaise) {
            return true;
          }
        }
        return false;
      }
      if (rhs instanceof LoweredModel.ListComprehension lc) {
        return lc.call.fun.mayRaise;
      }
      return true;
    }
  }
}
