package metacpp.lowering.cps;

import metacpp.lowering.LoweringException;
import metacpp.lowering.core.ExprType;
import metacpp.lowering.core.LoweredModel.*;
import metacpp.lowering.runtime.ErrorMessages;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 向一个语句块追加降级语句的写入器。
 *
 * <p>分支、续延函数体各自使用独立的写入器，但共享同一个 {@link FunctionSink}。
 * 处理器栈在创建子写入器时复制，因此子块里的 push/pop 不会影响外层。</p>
 */
final class StmtWriter {
  private final FunctionSink sink;
  private final String functionName;
  private final List<Param> functionParams;
  private final ExprType returnType;
  // 栈顶（最近的 except）在前
  private final Deque<HandlerContext> handlers;
  private final List<Stmt> stmts = new ArrayList<>();

  StmtWriter(FunctionSink sink, String functionName, List<Param> functionParams, ExprType returnType,
             Deque<HandlerContext> handlers) {
    this.sink = sink;
    this.functionName = functionName;
    this.functionParams = functionParams;
    this.returnType = returnType;
    this.handlers = new ArrayDeque<>(handlers);
  }

  /** 同一函数内的子块（if 分支、and/or 右操作数、合成续延的函数体）。 */
  StmtWriter branch() {
    return new StmtWriter(sink, functionName, functionParams, returnType, handlers);
  }

  /** 返回类型不同的辅助函数体（match 分支、推导式元素）；处理器不向内传递。 */
  StmtWriter helper(ExprType helperReturnType) {
    return new StmtWriter(sink, functionName, functionParams, helperReturnType, new ArrayDeque<>());
  }

  FunctionSink sink() {
    return sink;
  }

  String functionName() {
    return functionName;
  }

  ExprType returnType() {
    return returnType;
  }

  boolean isToplevel() {
    return returnType == null;
  }

  Deque<HandlerContext> handlers() {
    return handlers;
  }

  List<Stmt> stmts() {
    return stmts;
  }

  void write(Stmt stmt) {
    stmts.add(stmt);
  }

  VarRef newVar(ExprType type) {
    return VarRef.local(sink.newId(), type);
  }

  VarRef newVarForExpr(Expr expr) {
    VarRef var = newVar(expr.type());
    write(new Assignment(var, expr));
    return var;
  }

  void pushHandler(HandlerContext context) {
    handlers.push(context);
  }

  void popHandler(HandlerContext expected) {
    HandlerContext top = handlers.peek();
    if (top != expected) {
      throw new LoweringException(ErrorMessages.handlerStackMismatch(
          String.valueOf(expected), String.valueOf(top)));
    }
    handlers.pop();
  }

  /**
   * 写入双通道调用并检查错误槽。
   *
   * <pre>
   * x, err = expr
   * b = is_error(err)
   * if b:
   *   b1 = isinstance(err, E1)
   *   if b1:
   *     e1 = cast&lt;E1&gt;(err)
   *     res1, err1 = handler1(...)
   *     return res1, err1
   *   ...
   *   return None, err
   * </pre>
   *
   * 顶层没有函数可返回，改为 {@code CheckIfError(err)}。
   */
  VarRef newVarForExprWithErrorCheck(Expr expr) {
    VarRef result = newVar(expr.type());
    VarRef error = newVar(ExprType.ERROR_OR_VOID);
    write(new Assignment(result, error, expr));

    if (isToplevel()) {
      write(new CheckIfError(error));
      return result;
    }

    VarRef isError = newVarForExpr(new IsError(error));
    StmtWriter dispatch = branch();
    for (HandlerContext context : handlers) {
      VarRef isInstance = dispatch.newVarForExpr(new IsInstance(error, context.caughtType));
      StmtWriter handlerBranch = branch();
      handlerBranch.write(new Assignment(VarRef.local(context.caughtName, context.caughtType),
          new SafeUncheckedCast(error, context.caughtType)));
      handlerBranch.writeHandlerCallAndReturn(context);
      dispatch.write(new If(isInstance, handlerBranch.stmts, List.of()));
    }
    dispatch.write(new Return(null, error));
    write(new If(isError, dispatch.stmts, List.of()));
    return result;
  }

  /** {@code res, err = handler(...); return res, err}；处理器不会抛出时省略错误槽。 */
  void writeHandlerCallAndReturn(HandlerContext context) {
    FunctionCall call = context.handlerCall;
    VarRef res = newVar(call.type());
    if (context.handlerMayRaise()) {
      VarRef err = newVar(ExprType.ERROR_OR_VOID);
      write(new Assignment(res, err, call));
      write(new Return(res, err));
    } else {
      write(new Assignment(res, call));
      write(new Return(res, null));
    }
  }

  /**
   * 合成函数没有自由变量时转发的兜底参数：当前函数第一个非函数类型的参数，否则第一个参数，
   * 都没有时写入一个值为 {@code void} 的新变量。
   */
  VarRef fallbackArgument() {
    for (Param p : functionParams) {
      if (!(p.type instanceof ExprType.FunctionType)) {
        return VarRef.local(p.name, p.type);
      }
    }
    if (!functionParams.isEmpty()) {
      Param first = functionParams.get(0);
      return VarRef.local(first.name, first.type);
    }
    return newVarForExpr(new TypeLiteral("void"));
  }
}
