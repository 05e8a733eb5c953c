package metacpp.lowering.visit;

import metacpp.lowering.LoweringException;
import metacpp.lowering.core.SourceModel.*;

import java.util.List;

/**
 * 源树的只读遍历。子类覆盖感兴趣的钩子即可，默认实现会继续深入子节点。
 */
public abstract class SourceVisitor {

  public void visitFunction(Function function) {
    visitStmts(function.body);
  }

  public void visitStmts(List<Stmt> stmts) {
    for (Stmt stmt : stmts) {
      visitStmt(stmt);
    }
  }

  public void visitStmt(Stmt stmt) {
    if (stmt instanceof Assignment a) {
      visitVarRef(a.lhs);
      visitExpr(a.rhs);
    } else if (stmt instanceof Return r) {
      visitExpr(r.expr);
    } else if (stmt instanceof If i) {
      visitExpr(i.cond);
      visitStmts(i.thenStmts);
      visitStmts(i.elseStmts);
    } else if (stmt instanceof Raise r) {
      visitRaise(r);
    } else if (stmt instanceof TryExcept t) {
      visitStmts(t.tryBody);
      visitStmts(t.exceptBody);
    } else if (stmt instanceof Assert a) {
      visitExpr(a.expr);
    } else if (stmt instanceof Pass) {
      // 无内容
    } else {
      throw new LoweringException("Unexpected statement: " + stmt.getClass().getName());
    }
  }

  protected void visitRaise(Raise raise) {
    visitExpr(raise.expr);
  }

  protected void visitVarRef(VarRef var) {
  }

  protected void visitFunctionCall(FunctionCall call) {
    visitExpr(call.fun);
    visitExprs(call.args);
  }

  protected final void visitExprs(List<Expr> exprs) {
    for (Expr e : exprs) {
      visitExpr(e);
    }
  }

  public void visitExpr(Expr expr) {
    if (expr instanceof VarRef v) {
      visitVarRef(v);
    } else if (expr instanceof BoolLiteral || expr instanceof IntLiteral || expr instanceof TypeLiteral) {
      // 叶子节点
    } else if (expr instanceof TypeWrapper w) {
      visitExpr(w.inner);
    } else if (expr instanceof TemplateInstantiation t) {
      visitExprs(t.args);
    } else if (expr instanceof ListExpr l) {
      visitExprs(l.elems);
    } else if (expr instanceof SetExpr s) {
      visitExprs(s.elems);
    } else if (expr instanceof FunctionCall c) {
      visitFunctionCall(c);
    } else if (expr instanceof Construct c) {
      visitExprs(c.args);
    } else if (expr instanceof AttributeAccess a) {
      visitExpr(a.expr);
    } else if (expr instanceof Equality e) {
      visitExpr(e.lhs);
      visitExpr(e.rhs);
    } else if (expr instanceof In e) {
      visitExpr(e.lhs);
      visitExpr(e.rhs);
    } else if (expr instanceof And e) {
      visitExpr(e.lhs);
      visitExpr(e.rhs);
    } else if (expr instanceof Or e) {
      visitExpr(e.lhs);
      visitExpr(e.rhs);
    } else if (expr instanceof Not n) {
      visitExpr(n.expr);
    } else if (expr instanceof UnaryMinus m) {
      visitExpr(m.expr);
    } else if (expr instanceof IntBinaryOp op) {
      visitExpr(op.lhs);
      visitExpr(op.rhs);
    } else if (expr instanceof IntComparison cmp) {
      visitExpr(cmp.lhs);
      visitExpr(cmp.rhs);
    } else if (expr instanceof MatchExpr m) {
      visitExprs(m.matchedExprs);
      for (MatchCase c : m.cases) {
        visitExpr(c.expr);
      }
    } else if (expr instanceof ListComprehension lc) {
      visitExpr(lc.listExpr);
      visitVarRef(lc.loopVar);
      visitExpr(lc.resultExpr);
    } else if (expr instanceof SetComprehension sc) {
      visitExpr(sc.setExpr);
      visitVarRef(sc.loopVar);
      visitExpr(sc.resultExpr);
    } else {
      throw new LoweringException("Unexpected expression: " + expr.getClass().getName());
    }
  }
}
