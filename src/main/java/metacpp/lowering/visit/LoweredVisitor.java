package metacpp.lowering.visit;

import metacpp.lowering.LoweringException;
import metacpp.lowering.core.LoweredModel.*;

import java.util.List;

/**
 * 降级树的只读遍历。
 *
 * <p>赋值目标通过 {@link #visitDefinition} 报告，其余变量出现通过 {@link #visitVarRef} 报告，
 * 两者分开是为了让自由变量分析与可抛出性分析共用同一套遍历。</p>
 */
public abstract class LoweredVisitor {

  public void visitStmts(List<Stmt> stmts) {
    for (Stmt stmt : stmts) {
      visitStmt(stmt);
    }
  }

  public void visitStmt(Stmt stmt) {
    if (stmt instanceof Assignment a) {
      visitExpr(a.rhs);
      visitDefinition(a.lhs);
      if (a.lhs2 != null) {
        visitDefinition(a.lhs2);
      }
    } else if (stmt instanceof Return r) {
      visitReturn(r);
    } else if (stmt instanceof If i) {
      visitVarRef(i.cond);
      visitStmts(i.thenStmts);
      visitStmts(i.elseStmts);
    } else if (stmt instanceof Assert a) {
      visitVarRef(a.var);
    } else if (stmt instanceof CheckIfError c) {
      visitVarRef(c.var);
    } else {
      throw new LoweringException("Unexpected statement: " + stmt.getClass().getName());
    }
  }

  protected void visitReturn(Return ret) {
    if (ret.result != null) {
      visitVarRef(ret.result);
    }
    if (ret.error != null) {
      visitVarRef(ret.error);
    }
  }

  /** 变量在此处被赋值（或由模式、循环绑定）。 */
  protected void visitDefinition(VarRef var) {
  }

  protected void visitVarRef(VarRef var) {
  }

  protected void visitFunctionCall(FunctionCall call) {
    visitVarRef(call.fun);
    visitVarRefs(call.args);
  }

  protected final void visitVarRefs(List<VarRef> vars) {
    for (VarRef v : vars) {
      visitVarRef(v);
    }
  }

  public void visitExpr(Expr expr) {
    if (expr instanceof VarRef v) {
      visitVarRef(v);
    } else if (expr instanceof BoolLiteral || expr instanceof IntLiteral || expr instanceof TypeLiteral) {
      // 叶子节点
    } else if (expr instanceof TypeWrapper w) {
      visitVarRef(w.inner);
    } else if (expr instanceof TemplateInstantiation t) {
      visitVarRefs(t.args);
    } else if (expr instanceof ListExpr l) {
      visitVarRefs(l.elems);
    } else if (expr instanceof AddToSet a) {
      visitVarRef(a.set);
      visitVarRef(a.elem);
    } else if (expr instanceof SetToList s) {
      visitVarRef(s.var);
    } else if (expr instanceof ListToSet s) {
      visitVarRef(s.var);
    } else if (expr instanceof SetEquality e) {
      visitVarRef(e.lhs);
      visitVarRef(e.rhs);
    } else if (expr instanceof FunctionCall c) {
      visitFunctionCall(c);
    } else if (expr instanceof Construct c) {
      visitVarRefs(c.args);
    } else if (expr instanceof AttributeAccess a) {
      visitVarRef(a.var);
    } else if (expr instanceof Equality e) {
      visitVarRef(e.lhs);
      visitVarRef(e.rhs);
    } else if (expr instanceof IsInList e) {
      visitVarRef(e.lhs);
      visitVarRef(e.rhs);
    } else if (expr instanceof Not n) {
      visitVarRef(n.var);
    } else if (expr instanceof UnaryMinus m) {
      visitVarRef(m.var);
    } else if (expr instanceof IntBinaryOp op) {
      visitVarRef(op.lhs);
      visitVarRef(op.rhs);
    } else if (expr instanceof IntComparison cmp) {
      visitVarRef(cmp.lhs);
      visitVarRef(cmp.rhs);
    } else if (expr instanceof IsError e) {
      visitVarRef(e.var);
    } else if (expr instanceof IsInstance e) {
      visitVarRef(e.var);
    } else if (expr instanceof SafeUncheckedCast c) {
      visitVarRef(c.var);
    } else if (expr instanceof MatchExpr m) {
      visitVarRefs(m.matchedVars);
      for (MatchCase c : m.cases) {
        visitMatchCase(c);
      }
    } else if (expr instanceof ListComprehension lc) {
      visitVarRef(lc.listVar);
      visitDefinition(lc.loopVar);
      visitFunctionCall(lc.call);
    } else {
      throw new LoweringException("Unexpected expression: " + expr.getClass().getName());
    }
  }

  protected void visitMatchCase(MatchCase matchCase) {
    visitFunctionCall(matchCase.call);
  }
}
