package metacpp.lowering.cps;

import metacpp.lowering.LoweringException;
import metacpp.lowering.core.ExprType;
import metacpp.lowering.core.IdentifierGenerator;
import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.core.SourceModel;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.visit.FreeVariables;
import metacpp.lowering.visit.ReturnInfo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 控制流降级（CPS 转换）。
 *
 * <p>把 raise、try/except、多分支 match 与推导式改写为显式调用的续延函数和双通道
 * {@code (value, error)} 返回；所有子表达式被拍平为对新变量的赋值。异常处理器在降级时按词法作用域静态解析，
 * 每个 raise 只会得到一个结果：直接调用最近的匹配处理器，或只填错误槽的 return。</p>
 *
 * <p>调用点是否需要错误检查取决于被调引用上的 {@code mayRaise} 标记，因此输入应先经过
 * {@link metacpp.lowering.analysis.ThrowabilityAnalyzer#recomputeThrowability} 处理。</p>
 */
public final class ControlFlowLowering {
  private static final Logger LOGGER = Logger.getLogger(ControlFlowLowering.class.getName());

  private ControlFlowLowering() {}

  /**
   * 降级单个函数。
   *
   * @param function 已分析的源函数
   * @param ids 标识符生成器
   * @return 降级后的函数与合成函数
   */
  public static LoweringResult lowerControlFlow(SourceModel.Function function, IdentifierGenerator ids) {
    return lowerControlFlow(function, ids, List.of());
  }

  /**
   * 降级单个函数。
   *
   * @param function 已分析的源函数
   * @param ids 标识符生成器
   * @param handlerStack 初始处理器栈，按压栈顺序排列（最后一个是最近的处理器）
   * @return 降级后的函数与按创建顺序排列的合成函数
   */
  public static LoweringResult lowerControlFlow(SourceModel.Function function, IdentifierGenerator ids,
                                                List<HandlerContext> handlerStack) {
    FunctionSink sink = new FunctionSink(ids);
    List<LoweredModel.Param> params = lowerParams(function.params);
    StmtWriter writer = new StmtWriter(sink, function.name, params, function.returnType, toDeque(handlerStack));
    lowerStmts(function.body, writer);

    LoweredModel.Function lowered = new LoweredModel.Function(function.name, "", params, writer.stmts(),
        function.returnType, ReturnInfo.returnsError(writer.stmts()));
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.log(Level.FINE, "lowered {0}: {1} statements, {2} synthesized functions",
          new Object[] {function.name, writer.stmts().size(), sink.functions().size()});
    }
    return new LoweringResult(lowered, writer.stmts(), sink.functions());
  }

  /**
   * 降级不属于任何函数的语句序列（模块顶层断言）。可能抛出的调用以 {@code CheckIfError} 结束检查。
   *
   * @param stmts 源语句
   * @param ids 标识符生成器
   * @return 降级后的语句与合成函数；{@link LoweringResult#function} 为 {@code null}
   */
  public static LoweringResult lowerStatements(List<SourceModel.Stmt> stmts, IdentifierGenerator ids) {
    FunctionSink sink = new FunctionSink(ids);
    StmtWriter writer = new StmtWriter(sink, "", List.of(), null, new ArrayDeque<>());
    lowerStmts(stmts, writer);
    return new LoweringResult(null, writer.stmts(), sink.functions());
  }

  /**
   * 降级整个模块：源函数按原顺序在前，合成函数按创建顺序在后。
   *
   * @param module 已分析的源模块
   * @param ids 标识符生成器
   * @return 降级后的模块（可抛出性标记尚未经过后处理）
   */
  public static LoweredModel.Module lowerModule(SourceModel.Module module, IdentifierGenerator ids) {
    List<LoweredModel.Function> functions = new ArrayList<>();
    List<LoweredModel.Function> synthesized = new ArrayList<>();
    for (SourceModel.Function function : module.functions) {
      LoweringResult result = lowerControlFlow(function, ids);
      functions.add(result.function);
      synthesized.addAll(result.synthesized);
    }
    List<SourceModel.Stmt> assertions = new ArrayList<>(module.assertions);
    LoweringResult toplevel = lowerStatements(assertions, ids);
    synthesized.addAll(toplevel.synthesized);
    functions.addAll(synthesized);

    LOGGER.log(Level.INFO, "Lowered module {0}: {1} functions ({2} synthesized)",
        new Object[] {module.name, functions.size(), synthesized.size()});
    return new LoweredModel.Module(module.name, module.customTypes, functions, toplevel.statements,
        module.publicNames);
  }

  private static Deque<HandlerContext> toDeque(List<HandlerContext> pushOrder) {
    Deque<HandlerContext> deque = new ArrayDeque<>();
    for (HandlerContext context : pushOrder) {
      deque.push(context);
    }
    return deque;
  }

  private static List<LoweredModel.Param> lowerParams(List<SourceModel.Param> params) {
    List<LoweredModel.Param> out = new ArrayList<>(params.size());
    for (SourceModel.Param p : params) {
      out.add(new LoweredModel.Param(p.name, p.type));
    }
    return out;
  }

  private static List<LoweredModel.Param> paramsOf(List<LoweredModel.VarRef> vars) {
    List<LoweredModel.Param> out = new ArrayList<>(vars.size());
    for (LoweredModel.VarRef v : vars) {
      out.add(new LoweredModel.Param(v.name, v.type));
    }
    return out;
  }

  // ---------------------------------------------------------------------------
  // 语句

  private static void lowerStmts(List<SourceModel.Stmt> stmts, StmtWriter writer) {
    for (int i = 0; i < stmts.size(); i++) {
      SourceModel.Stmt stmt = stmts.get(i);
      if (stmt instanceof SourceModel.Assignment a) {
        LoweredModel.VarRef value = lowerExpr(a.rhs, writer);
        writer.write(new LoweredModel.Assignment(lowerVarRef(a.lhs), value));
      } else if (stmt instanceof SourceModel.Return r) {
        writer.write(new LoweredModel.Return(lowerExpr(r.expr, writer), null));
      } else if (stmt instanceof SourceModel.If s) {
        lowerIf(s, writer);
      } else if (stmt instanceof SourceModel.Raise r) {
        lowerRaise(r, writer);
      } else if (stmt instanceof SourceModel.Assert a) {
        writer.write(new LoweredModel.Assert(lowerExpr(a.expr, writer), a.message));
      } else if (stmt instanceof SourceModel.TryExcept t) {
        // 其后的语句成为续延函数的函数体
        lowerTryExcept(t, stmts.subList(i + 1, stmts.size()), writer);
        return;
      } else if (stmt instanceof SourceModel.Pass) {
        // 无语义
      } else {
        throw new LoweringException("Unexpected statement: " + stmt.getClass().getName());
      }
    }
  }

  private static void lowerIf(SourceModel.If stmt, StmtWriter writer) {
    LoweredModel.VarRef cond = lowerExpr(stmt.cond, writer);
    StmtWriter thenWriter = writer.branch();
    lowerStmts(stmt.thenStmts, thenWriter);
    StmtWriter elseWriter = writer.branch();
    lowerStmts(stmt.elseStmts, elseWriter);
    writer.write(new LoweredModel.If(cond, thenWriter.stmts(), elseWriter.stmts()));
  }

  private static void lowerRaise(SourceModel.Raise raise, StmtWriter writer) {
    if (writer.isToplevel()) {
      throw new LoweringException(ErrorMessages.raiseOutsideFunction("module top level"));
    }
    LoweredModel.VarRef exception = lowerExpr(raise.expr, writer);
    for (HandlerContext context : writer.handlers()) {
      if (context.catches(exception.type)) {
        // e = <exception>; res, err = handler(e, ...); return res, err
        writer.write(new LoweredModel.Assignment(
            LoweredModel.VarRef.local(context.caughtName, context.caughtType), exception));
        writer.writeHandlerCallAndReturn(context);
        return;
      }
    }
    writer.write(new LoweredModel.Return(null, exception));
  }

  /**
   * <pre>
   * try:
   *   x = f()
   * except MyError as e:
   *   y = e.x
   * z = y + 3
   * return z
   * </pre>
   * 变为续延函数 {@code then_fun(y)}（try/except 之后的语句）与 {@code except_fun(e, ...)}（except 块），
   * try 块本身在压入处理器的状态下原地降级。
   */
  private static void lowerTryExcept(SourceModel.TryExcept stmt, List<SourceModel.Stmt> followingStmts,
                                     StmtWriter writer) {
    if (writer.isToplevel()) {
      throw new LoweringException(ErrorMessages.raiseOutsideFunction("try/except at module top level"));
    }
    FunctionSink sink = writer.sink();
    ExprType returnType = writer.returnType();

    LoweredModel.FunctionCall thenCall = null;
    if (!followingStmts.isEmpty()) {
      StmtWriter thenWriter = writer.branch();
      lowerStmts(followingStmts, thenWriter);
      List<LoweredModel.VarRef> forwarded = FreeVariables.of(thenWriter.stmts());
      if (forwarded.isEmpty()) {
        forwarded = List.of(writer.fallbackArgument());
      }
      thenCall = writeHelper(sink, forwarded, thenWriter.stmts(), returnType,
          "(meta)function wrapping the code after a try-except statement from the function "
              + writer.functionName());
    }

    StmtWriter exceptWriter = writer.branch();
    lowerStmts(stmt.exceptBody, exceptWriter);
    if (thenCall != null && !ReturnInfo.alwaysReturns(stmt.exceptBody)) {
      writeReturnOfCall(thenCall, exceptWriter);
    }
    List<LoweredModel.VarRef> exceptParams = new ArrayList<>();
    exceptParams.add(LoweredModel.VarRef.local(stmt.caughtName, stmt.caughtType));
    for (LoweredModel.VarRef v : FreeVariables.of(exceptWriter.stmts())) {
      if (!v.name.equals(stmt.caughtName)) {
        exceptParams.add(v);
      }
    }
    LoweredModel.FunctionCall exceptCall = writeHelper(sink, exceptParams, exceptWriter.stmts(), returnType,
        "(meta)function wrapping the code in an except block from the function " + writer.functionName());

    HandlerContext context = new HandlerContext(stmt.caughtType, stmt.caughtName, exceptCall);
    writer.pushHandler(context);
    lowerStmts(stmt.tryBody, writer);
    writer.popHandler(context);

    if (thenCall != null && !ReturnInfo.alwaysReturns(stmt.tryBody)) {
      writeReturnOfCall(thenCall, writer);
    }
  }

  private static void writeReturnOfCall(LoweredModel.FunctionCall call, StmtWriter writer) {
    writer.write(new LoweredModel.Return(lowerCall(call, writer), null));
  }

  /** 写出合成函数并返回对它的调用；{@code mayRaise} 由函数体是否填充错误槽决定。 */
  private static LoweredModel.FunctionCall writeHelper(FunctionSink sink, List<LoweredModel.VarRef> forwarded,
                                                       List<LoweredModel.Stmt> body, ExprType returnType,
                                                       String description) {
    String name = sink.newId();
    List<LoweredModel.Param> params = paramsOf(forwarded);
    boolean mayRaise = ReturnInfo.returnsError(body);
    LoweredModel.Function helper = new LoweredModel.Function(name, description, params, body, returnType, mayRaise);
    sink.write(helper);
    LoweredModel.VarRef ref = LoweredModel.VarRef.global(name, helper.type(), mayRaise);
    return new LoweredModel.FunctionCall(ref, forwarded);
  }

  private static LoweredModel.VarRef lowerCall(LoweredModel.FunctionCall call, StmtWriter writer) {
    if (call.fun.mayRaise) {
      return writer.newVarForExprWithErrorCheck(call);
    }
    return writer.newVarForExpr(call);
  }

  // ---------------------------------------------------------------------------
  // 表达式

  private static LoweredModel.VarRef lowerVarRef(SourceModel.VarRef var) {
    return new LoweredModel.VarRef(var.name, var.type, var.globalFunction, var.mayRaise, var.sourceModule);
  }

  private static List<LoweredModel.VarRef> lowerExprs(List<SourceModel.Expr> exprs, StmtWriter writer) {
    List<LoweredModel.VarRef> out = new ArrayList<>(exprs.size());
    for (SourceModel.Expr e : exprs) {
      out.add(lowerExpr(e, writer));
    }
    return out;
  }

  static LoweredModel.VarRef lowerExpr(SourceModel.Expr expr, StmtWriter writer) {
    if (expr instanceof SourceModel.VarRef v) {
      return lowerVarRef(v);
    } else if (expr instanceof SourceModel.BoolLiteral b) {
      return writer.newVarForExpr(new LoweredModel.BoolLiteral(b.value));
    } else if (expr instanceof SourceModel.IntLiteral i) {
      return writer.newVarForExpr(new LoweredModel.IntLiteral(i.value));
    } else if (expr instanceof SourceModel.TypeLiteral t) {
      return writer.newVarForExpr(new LoweredModel.TypeLiteral(t.cppType));
    } else if (expr instanceof SourceModel.TypeWrapper w) {
      return writer.newVarForExpr(new LoweredModel.TypeWrapper(w.wrapper, lowerExpr(w.inner, writer)));
    } else if (expr instanceof SourceModel.TemplateInstantiation t) {
      return writer.newVarForExpr(new LoweredModel.TemplateInstantiation(t.template, lowerExprs(t.args, writer)));
    } else if (expr instanceof SourceModel.ListExpr l) {
      return writer.newVarForExpr(new LoweredModel.ListExpr(l.elemType, lowerExprs(l.elems, writer)));
    } else if (expr instanceof SourceModel.SetExpr s) {
      return lowerSet(s, writer);
    } else if (expr instanceof SourceModel.FunctionCall c) {
      LoweredModel.VarRef fun = lowerExpr(c.fun, writer);
      List<LoweredModel.VarRef> args = lowerExprs(c.args, writer);
      return lowerCall(new LoweredModel.FunctionCall(fun, args), writer);
    } else if (expr instanceof SourceModel.Construct c) {
      return writer.newVarForExpr(new LoweredModel.Construct(c.customType, lowerExprs(c.args, writer)));
    } else if (expr instanceof SourceModel.AttributeAccess a) {
      return writer.newVarForExpr(new LoweredModel.AttributeAccess(lowerExpr(a.expr, writer), a.attribute, a.type));
    } else if (expr instanceof SourceModel.Equality e) {
      LoweredModel.VarRef lhs = lowerExpr(e.lhs, writer);
      LoweredModel.VarRef rhs = lowerExpr(e.rhs, writer);
      if (lhs.type instanceof ExprType.SetType) {
        return writer.newVarForExpr(new LoweredModel.SetEquality(lhs, rhs));
      }
      return writer.newVarForExpr(new LoweredModel.Equality(lhs, rhs));
    } else if (expr instanceof SourceModel.In e) {
      LoweredModel.VarRef lhs = lowerExpr(e.lhs, writer);
      LoweredModel.VarRef rhs = lowerExpr(e.rhs, writer);
      return writer.newVarForExpr(new LoweredModel.IsInList(lhs, rhs));
    } else if (expr instanceof SourceModel.And e) {
      return lowerShortCircuit(e.lhs, e.rhs, false, writer);
    } else if (expr instanceof SourceModel.Or e) {
      return lowerShortCircuit(e.lhs, e.rhs, true, writer);
    } else if (expr instanceof SourceModel.Not n) {
      return writer.newVarForExpr(new LoweredModel.Not(lowerExpr(n.expr, writer)));
    } else if (expr instanceof SourceModel.UnaryMinus m) {
      return writer.newVarForExpr(new LoweredModel.UnaryMinus(lowerExpr(m.expr, writer)));
    } else if (expr instanceof SourceModel.IntBinaryOp op) {
      LoweredModel.VarRef lhs = lowerExpr(op.lhs, writer);
      LoweredModel.VarRef rhs = lowerExpr(op.rhs, writer);
      return writer.newVarForExpr(new LoweredModel.IntBinaryOp(lhs, rhs, op.op));
    } else if (expr instanceof SourceModel.IntComparison cmp) {
      LoweredModel.VarRef lhs = lowerExpr(cmp.lhs, writer);
      LoweredModel.VarRef rhs = lowerExpr(cmp.rhs, writer);
      return writer.newVarForExpr(new LoweredModel.IntComparison(lhs, rhs, cmp.op));
    } else if (expr instanceof SourceModel.MatchExpr m) {
      return lowerMatch(m, writer);
    } else if (expr instanceof SourceModel.ListComprehension lc) {
      LoweredModel.VarRef list = lowerExpr(lc.listExpr, writer);
      return lowerComprehension(list, lc.loopVar, lc.resultExpr, writer);
    } else if (expr instanceof SourceModel.SetComprehension sc) {
      // l = set_to_list(s); l2 = [... for x in l]; list_to_set(l2)
      LoweredModel.VarRef set = lowerExpr(sc.setExpr, writer);
      LoweredModel.VarRef list = writer.newVarForExpr(new LoweredModel.SetToList(set));
      LoweredModel.VarRef mapped = lowerComprehension(list, sc.loopVar, sc.resultExpr, writer);
      return writer.newVarForExpr(new LoweredModel.ListToSet(mapped));
    }
    throw new LoweringException("Unexpected expression: " + expr.getClass().getName());
  }

  private static LoweredModel.VarRef lowerSet(SourceModel.SetExpr set, StmtWriter writer) {
    LoweredModel.VarRef result = writer.newVar(set.type());
    writer.write(new LoweredModel.Assignment(result, new LoweredModel.ListExpr(set.elemType, List.of())));
    for (LoweredModel.VarRef elem : lowerExprs(set.elems, writer)) {
      result = writer.newVarForExpr(new LoweredModel.AddToSet(result, elem));
    }
    return result;
  }

  /**
   * {@code y = f() and g()} 变为 {@code if f(): r = g() else: r = False}；or 对称处理。
   */
  private static LoweredModel.VarRef lowerShortCircuit(SourceModel.Expr lhsExpr, SourceModel.Expr rhsExpr,
                                                       boolean isOr, StmtWriter writer) {
    LoweredModel.VarRef lhs = lowerExpr(lhsExpr, writer);
    LoweredModel.VarRef result = writer.newVar(ExprType.BOOL);

    StmtWriter evaluated = writer.branch();
    LoweredModel.VarRef rhs = lowerExpr(rhsExpr, evaluated);
    evaluated.write(new LoweredModel.Assignment(result, rhs));
    List<LoweredModel.Stmt> shortCircuited =
        List.of(new LoweredModel.Assignment(result, new LoweredModel.BoolLiteral(isOr)));

    if (isOr) {
      writer.write(new LoweredModel.If(lhs, shortCircuited, evaluated.stmts()));
    } else {
      writer.write(new LoweredModel.If(lhs, evaluated.stmts(), shortCircuited));
    }
    return result;
  }

  private static LoweredModel.VarRef lowerMatch(SourceModel.MatchExpr match, StmtWriter writer) {
    List<LoweredModel.VarRef> matched = lowerExprs(match.matchedExprs, writer);

    // 非兜底分支保持源顺序，兜底分支最后
    List<SourceModel.MatchCase> ordered = new ArrayList<>(match.cases.size());
    SourceModel.MatchCase catchAll = null;
    for (SourceModel.MatchCase c : match.cases) {
      if (c.isCatchAll()) {
        catchAll = c;
      } else {
        ordered.add(c);
      }
    }
    if (catchAll != null) {
      ordered.add(catchAll);
    }

    List<LoweredModel.MatchCase> cases = new ArrayList<>(ordered.size());
    boolean anyMayRaise = false;
    for (SourceModel.MatchCase c : ordered) {
      StmtWriter caseWriter = writer.helper(match.type);
      caseWriter.write(new LoweredModel.Return(lowerExpr(c.expr, caseWriter), null));
      List<LoweredModel.VarRef> forwarded = FreeVariables.of(caseWriter.stmts());
      if (forwarded.isEmpty()) {
        forwarded = List.of(writer.fallbackArgument());
      }
      LoweredModel.FunctionCall call = writeHelper(writer.sink(), forwarded, caseWriter.stmts(), match.type,
          "(meta)function wrapping the code in a branch of a match expression from the function "
              + writer.functionName());
      anyMayRaise |= call.fun.mayRaise;
      cases.add(new LoweredModel.MatchCase(c.patterns, c.matchedVarNames, call));
    }

    LoweredModel.MatchExpr lowered = new LoweredModel.MatchExpr(matched, cases, match.type);
    return anyMayRaise ? writer.newVarForExprWithErrorCheck(lowered) : writer.newVarForExpr(lowered);
  }

  /**
   * <pre>
   * [f(x, y) * 2 for x in l]
   * </pre>
   * 变为 {@code def g(x, y): return f(x, y) * 2} 与 {@code [g(x, y) for x in l]}。
   * 循环变量总是元素函数的第一个参数。
   */
  private static LoweredModel.VarRef lowerComprehension(LoweredModel.VarRef list, SourceModel.VarRef loopVar,
                                                        SourceModel.Expr resultExpr, StmtWriter writer) {
    ExprType elemType = resultExpr.type();
    StmtWriter elemWriter = writer.helper(elemType);
    elemWriter.write(new LoweredModel.Return(lowerExpr(resultExpr, elemWriter), null));

    LoweredModel.VarRef loop = lowerVarRef(loopVar);
    List<LoweredModel.VarRef> forwarded = new ArrayList<>();
    forwarded.add(loop);
    for (LoweredModel.VarRef v : FreeVariables.of(elemWriter.stmts())) {
      if (!v.name.equals(loop.name)) {
        forwarded.add(v);
      }
    }
    LoweredModel.FunctionCall call = writeHelper(writer.sink(), forwarded, elemWriter.stmts(), elemType,
        "(meta)function wrapping the result expression in a list/set comprehension from the function "
            + writer.functionName());

    LoweredModel.ListComprehension lowered = new LoweredModel.ListComprehension(list, loop, call);
    return call.fun.mayRaise ? writer.newVarForExprWithErrorCheck(lowered) : writer.newVarForExpr(lowered);
  }
}
