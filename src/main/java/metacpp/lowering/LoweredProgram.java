package metacpp.lowering;

import com.oracle.truffle.api.CallTarget;
import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.LoweredModel.*;
import metacpp.lowering.core.Pattern;
import metacpp.lowering.nodes.*;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;
import metacpp.lowering.runtime.FrameLayout;
import metacpp.lowering.runtime.FunctionRegistry;
import metacpp.lowering.runtime.FunctionValue;
import metacpp.lowering.runtime.Outcome;
import metacpp.lowering.runtime.TypeValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 降级模块的参考求值器
 *
 * 每个降级函数构建为一个 {@link LoweredRootNode}；全局函数引用在首次执行时按（单元，名称）解析，
 * 带 {@code sourceModule} 的引用在导入的程序中查找。顶层语句单独构建为一个无参数的根节点。
 */
public final class LoweredProgram implements FunctionRegistry {
  private static final Logger LOGGER = Logger.getLogger(LoweredProgram.class.getName());

  private final String unit;
  private final Map<String, FunctionValue> functions = new LinkedHashMap<>();
  private final Map<String, LoweredProgram> imports = new LinkedHashMap<>();
  private final CallTarget toplevel;

  private LoweredProgram(LoweredModel.Module module, List<LoweredProgram> importedPrograms) {
    this.unit = module.name;
    for (LoweredProgram imported : importedPrograms) {
      imports.put(imported.unit, imported);
    }
    for (LoweredModel.Function function : module.functions) {
      LoweredRootNode root = new FunctionBuilder(this, function.name).buildFunction(function.params, function.body);
      functions.put(function.name, new FunctionValue(function.name, root.getCallTarget()));
    }
    this.toplevel = new FunctionBuilder(this, "<toplevel>").buildFunction(List.of(), module.toplevel).getCallTarget();
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "Built {0} root nodes for unit {1}", new Object[]{functions.size(), unit});
    }
  }

  public static LoweredProgram build(LoweredModel.Module module) {
    return new LoweredProgram(module, List.of());
  }

  /**
   * 构建程序，并链接已构建的其他单元。
   *
   * @param module 降级模块
   * @param importedPrograms 被引用的单元，按单元名查找
   * @return 可执行程序
   */
  public static LoweredProgram build(LoweredModel.Module module, List<LoweredProgram> importedPrograms) {
    return new LoweredProgram(module, importedPrograms);
  }

  public String getUnit() {
    return unit;
  }

  public Set<String> functionNames() {
    return functions.keySet();
  }

  /**
   * 调用模块中的函数
   *
   * @param name 函数名
   * @param args 实参
   * @return 调用结果（值槽或错误槽）
   * @throws EvaluationException 如果函数不存在或求值失败
   */
  public Outcome call(String name, Object... args) {
    return lookup(null, name).invoke(args);
  }

  /**
   * 执行顶层断言与计算。
   *
   * @throws EvaluationException 如果断言失败或顶层出现未捕获的异常
   */
  public void runToplevel() {
    toplevel.call();
  }

  @Override
  public FunctionValue lookup(String unitName, String name) {
    if (unitName == null || unitName.equals(unit)) {
      FunctionValue function = functions.get(name);
      if (function == null) {
        throw new EvaluationException(ErrorMessages.unknownExternalSymbol(unit, name));
      }
      return function;
    }
    LoweredProgram imported = imports.get(unitName);
    if (imported == null) {
      throw new EvaluationException(ErrorMessages.unknownExternalSymbol(unitName, name));
    }
    return imported.lookup(unitName, name);
  }

  /** 单个函数体的节点构建器，持有该函数的槽位分配。 */
  private static final class FunctionBuilder {
    private final FunctionRegistry registry;
    private final String name;
    private final FrameLayout.Builder slots;

    FunctionBuilder(FunctionRegistry registry, String name) {
      this.registry = registry;
      this.name = name;
      this.slots = FrameLayout.builder(name);
    }

    LoweredRootNode buildFunction(List<Param> params, List<Stmt> body) {
      for (Param p : params) {
        slots.parameter(p.name);
      }
      BlockNode block = buildBlock(body);
      return new LoweredRootNode(slots.build(), name, block);
    }

    private BlockNode buildBlock(List<Stmt> stmts) {
      List<LoweredStatementNode> nodes = new ArrayList<>(stmts.size());
      for (Stmt stmt : stmts) {
        nodes.add(buildStmt(stmt));
      }
      return new BlockNode(nodes);
    }

    private LoweredStatementNode buildStmt(Stmt stmt) {
      if (stmt instanceof Assignment a) {
        LoweredExpressionNode value = buildExpr(a.rhs);
        int slot = slots.slotFor(a.lhs.name);
        if (a.lhs2 != null) {
          return new AssignNode(a.lhs.name, slot, slots.slotFor(a.lhs2.name), value);
        }
        return new AssignNode(a.lhs.name, slot, value);
      } else if (stmt instanceof Return r) {
        return new ReturnNode(r.result == null ? null : buildVar(r.result), r.error == null ? null : buildVar(r.error));
      } else if (stmt instanceof If i) {
        return IfNode.create(buildVar(i.cond), buildBlock(i.thenStmts), buildBlock(i.elseStmts));
      } else if (stmt instanceof Assert a) {
        return new AssertNode(buildVar(a.var), a.message);
      } else if (stmt instanceof CheckIfError c) {
        return new CheckIfErrorNode(buildVar(c.var));
      }
      throw new EvaluationException("Unexpected statement: " + stmt.getClass().getName());
    }

    private LoweredExpressionNode buildVar(VarRef var) {
      if (var.globalFunction) {
        return new ReadGlobalNode(registry, var.sourceModule, var.name);
      }
      return new ReadLocalNode(var.name, slots.slotFor(var.name));
    }

    private List<LoweredExpressionNode> buildVars(List<VarRef> vars) {
      List<LoweredExpressionNode> nodes = new ArrayList<>(vars.size());
      for (VarRef v : vars) {
        nodes.add(buildVar(v));
      }
      return nodes;
    }

    private CallNode buildCall(FunctionCall call) {
      return CallNode.create(buildVar(call.fun), buildVars(call.args));
    }

    private LoweredExpressionNode buildExpr(Expr expr) {
      if (expr instanceof VarRef v) {
        return buildVar(v);
      } else if (expr instanceof BoolLiteral b) {
        return LiteralNode.create(b.value);
      } else if (expr instanceof IntLiteral i) {
        return LiteralNode.create(i.value);
      } else if (expr instanceof TypeLiteral t) {
        return LiteralNode.create(TypeValue.atomic(t.cppType));
      } else if (expr instanceof TypeWrapper w) {
        return new DataNodes.TypeWrapperNode(w.wrapper, buildVar(w.inner));
      } else if (expr instanceof LoweredModel.TemplateInstantiation t) {
        return new DataNodes.TemplateInstantiationNode(t.template, buildVars(t.args));
      } else if (expr instanceof ListExpr l) {
        return new CollectionNodes.ListNode(buildVars(l.elems));
      } else if (expr instanceof AddToSet a) {
        return new CollectionNodes.AddToSetNode(buildVar(a.set), buildVar(a.elem));
      } else if (expr instanceof SetToList s) {
        return new CollectionNodes.SetToListNode(buildVar(s.var));
      } else if (expr instanceof ListToSet s) {
        return new CollectionNodes.ListToSetNode(buildVar(s.var));
      } else if (expr instanceof SetEquality s) {
        return new CollectionNodes.SetEqualityNode(buildVar(s.lhs), buildVar(s.rhs));
      } else if (expr instanceof FunctionCall c) {
        return buildCall(c);
      } else if (expr instanceof Construct c) {
        return new DataNodes.ConstructNode(c.customType, buildVars(c.args));
      } else if (expr instanceof AttributeAccess a) {
        return new DataNodes.AttributeNode(buildVar(a.var), a.attribute);
      } else if (expr instanceof Equality e) {
        return EqualityNode.create(buildVar(e.lhs), buildVar(e.rhs));
      } else if (expr instanceof IsInList i) {
        return new CollectionNodes.IsInListNode(buildVar(i.lhs), buildVar(i.rhs));
      } else if (expr instanceof Not n) {
        return NotNode.create(buildVar(n.var));
      } else if (expr instanceof UnaryMinus m) {
        return NegateNode.create(buildVar(m.var));
      } else if (expr instanceof IntBinaryOp op) {
        return IntArithmeticNode.create(buildVar(op.lhs), buildVar(op.rhs), op.op);
      } else if (expr instanceof IntComparison op) {
        return IntComparisonNode.create(buildVar(op.lhs), buildVar(op.rhs), op.op);
      } else if (expr instanceof IsError e) {
        return new DataNodes.IsErrorNode(buildVar(e.var));
      } else if (expr instanceof IsInstance i) {
        return new DataNodes.IsInstanceNode(buildVar(i.var), i.checkedType.name);
      } else if (expr instanceof SafeUncheckedCast c) {
        // 值本身已是具体异常，只在类型层面收窄
        return buildVar(c.var);
      } else if (expr instanceof MatchExpr m) {
        return buildMatch(m);
      } else if (expr instanceof ListComprehension lc) {
        LoweredExpressionNode list = buildVar(lc.listVar);
        int loopSlot = slots.slotFor(lc.loopVar.name);
        return new ComprehensionNode(list, loopSlot, buildCall(lc.call));
      }
      throw new EvaluationException("Unexpected expression: " + expr.getClass().getName());
    }

    private LoweredExpressionNode buildMatch(MatchExpr match) {
      List<MatchNode.Case> cases = new ArrayList<>(match.cases.size());
      for (LoweredModel.MatchCase c : match.cases) {
        Set<String> captures = new LinkedHashSet<>(c.matchedVarNames);
        for (Pattern p : c.patterns) {
          p.collectCaptures(captures);
        }
        Map<String, Integer> captureSlots = new LinkedHashMap<>();
        for (String capture : captures) {
          captureSlots.put(capture, slots.slotFor(capture));
        }
        cases.add(new MatchNode.Case(c.patterns, captureSlots, buildCall(c.call)));
      }
      return new MatchNode(buildVars(match.matchedVars), cases);
    }
  }
}
