package metacpp.lowering.visit;

import metacpp.lowering.LoweringException;
import metacpp.lowering.core.SourceModel.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 源树的重写：默认实现按结构复制整棵树，子类覆盖 {@link #transformVarRef} 或
 * {@link #transformFunctionCall} 即可替换局部节点。
 */
public class SourceTransformation {

  public Function transformFunction(Function function) {
    return function.withBody(transformStmts(function.body), function.mayRaise);
  }

  public List<Stmt> transformStmts(List<Stmt> stmts) {
    List<Stmt> out = new ArrayList<>(stmts.size());
    for (Stmt stmt : stmts) {
      out.add(transformStmt(stmt));
    }
    return out;
  }

  public Stmt transformStmt(Stmt stmt) {
    if (stmt instanceof Assignment a) {
      return new Assignment(transformVarRef(a.lhs), transformExpr(a.rhs));
    } else if (stmt instanceof Return r) {
      return new Return(transformExpr(r.expr));
    } else if (stmt instanceof If i) {
      return new If(transformExpr(i.cond), transformStmts(i.thenStmts), transformStmts(i.elseStmts));
    } else if (stmt instanceof Raise r) {
      return new Raise(transformExpr(r.expr));
    } else if (stmt instanceof TryExcept t) {
      return new TryExcept(transformStmts(t.tryBody), t.caughtType, t.caughtName, transformStmts(t.exceptBody));
    } else if (stmt instanceof Assert a) {
      return new Assert(transformExpr(a.expr), a.message);
    } else if (stmt instanceof Pass) {
      return stmt;
    }
    throw new LoweringException("Unexpected statement: " + stmt.getClass().getName());
  }

  protected VarRef transformVarRef(VarRef var) {
    return var;
  }

  protected Expr transformFunctionCall(FunctionCall call) {
    return new FunctionCall(transformExpr(call.fun), transformExprs(call.args), call.mayRaise);
  }

  protected final List<Expr> transformExprs(List<Expr> exprs) {
    List<Expr> out = new ArrayList<>(exprs.size());
    for (Expr e : exprs) {
      out.add(transformExpr(e));
    }
    return out;
  }

  public Expr transformExpr(Expr expr) {
    if (expr instanceof VarRef v) {
      return transformVarRef(v);
    } else if (expr instanceof BoolLiteral || expr instanceof IntLiteral || expr instanceof TypeLiteral) {
      return expr;
    } else if (expr instanceof TypeWrapper w) {
      return new TypeWrapper(w.wrapper, transformExpr(w.inner));
    } else if (expr instanceof TemplateInstantiation t) {
      return new TemplateInstantiation(t.template, transformExprs(t.args));
    } else if (expr instanceof ListExpr l) {
      return new ListExpr(l.elemType, transformExprs(l.elems));
    } else if (expr instanceof SetExpr s) {
      return new SetExpr(s.elemType, transformExprs(s.elems));
    } else if (expr instanceof FunctionCall c) {
      return transformFunctionCall(c);
    } else if (expr instanceof Construct c) {
      return new Construct(c.customType, transformExprs(c.args));
    } else if (expr instanceof AttributeAccess a) {
      return new AttributeAccess(transformExpr(a.expr), a.attribute, a.type);
    } else if (expr instanceof Equality e) {
      return new Equality(transformExpr(e.lhs), transformExpr(e.rhs));
    } else if (expr instanceof In e) {
      return new In(transformExpr(e.lhs), transformExpr(e.rhs));
    } else if (expr instanceof And e) {
      return new And(transformExpr(e.lhs), transformExpr(e.rhs));
    } else if (expr instanceof Or e) {
      return new Or(transformExpr(e.lhs), transformExpr(e.rhs));
    } else if (expr instanceof Not n) {
      return new Not(transformExpr(n.expr));
    } else if (expr instanceof UnaryMinus m) {
      return new UnaryMinus(transformExpr(m.expr));
    } else if (expr instanceof IntBinaryOp op) {
      return new IntBinaryOp(transformExpr(op.lhs), transformExpr(op.rhs), op.op);
    } else if (expr instanceof IntComparison cmp) {
      return new IntComparison(transformExpr(cmp.lhs), transformExpr(cmp.rhs), cmp.op);
    } else if (expr instanceof MatchExpr m) {
      List<MatchCase> cases = new ArrayList<>(m.cases.size());
      for (MatchCase c : m.cases) {
        cases.add(new MatchCase(c.patterns, c.matchedVarNames, transformExpr(c.expr)));
      }
      return new MatchExpr(transformExprs(m.matchedExprs), cases, m.type);
    } else if (expr instanceof ListComprehension lc) {
      return new ListComprehension(transformExpr(lc.listExpr), transformVarRef(lc.loopVar), transformExpr(lc.resultExpr));
    } else if (expr instanceof SetComprehension sc) {
      return new SetComprehension(transformExpr(sc.setExpr), transformVarRef(sc.loopVar), transformExpr(sc.resultExpr));
    }
    throw new LoweringException("Unexpected expression: " + expr.getClass().getName());
  }
}
