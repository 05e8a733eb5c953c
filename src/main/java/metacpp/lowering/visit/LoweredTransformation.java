package metacpp.lowering.visit;

import metacpp.lowering.LoweringException;
import metacpp.lowering.core.LoweredModel.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 降级树的重写。{@link #transformStmt} 返回 {@code null} 表示删除该语句。
 */
public class LoweredTransformation {

  public Function transformFunction(Function function) {
    return function.withBody(transformStmts(function.body), function.mayRaise);
  }

  public List<Stmt> transformStmts(List<Stmt> stmts) {
    List<Stmt> out = new ArrayList<>(stmts.size());
    for (Stmt stmt : stmts) {
      Stmt transformed = transformStmt(stmt);
      if (transformed != null) {
        out.add(transformed);
      }
    }
    return out;
  }

  public Stmt transformStmt(Stmt stmt) {
    if (stmt instanceof Assignment a) {
      return transformAssignment(a);
    } else if (stmt instanceof Return r) {
      return transformReturn(r);
    } else if (stmt instanceof If i) {
      return transformIf(i);
    } else if (stmt instanceof Assert a) {
      return new Assert(transformVarRef(a.var), a.message);
    } else if (stmt instanceof CheckIfError c) {
      return transformCheckIfError(c);
    }
    throw new LoweringException("Unexpected statement: " + stmt.getClass().getName());
  }

  protected Stmt transformAssignment(Assignment assignment) {
    VarRef lhs2 = assignment.lhs2 == null ? null : transformVarRef(assignment.lhs2);
    return new Assignment(transformVarRef(assignment.lhs), lhs2, transformExpr(assignment.rhs));
  }

  protected Stmt transformReturn(Return ret) {
    return new Return(ret.result == null ? null : transformVarRef(ret.result),
        ret.error == null ? null : transformVarRef(ret.error));
  }

  protected Stmt transformIf(If stmt) {
    return new If(transformVarRef(stmt.cond), transformStmts(stmt.thenStmts), transformStmts(stmt.elseStmts));
  }

  protected Stmt transformCheckIfError(CheckIfError stmt) {
    return new CheckIfError(transformVarRef(stmt.var));
  }

  protected VarRef transformVarRef(VarRef var) {
    return var;
  }

  protected final List<VarRef> transformVarRefs(List<VarRef> vars) {
    List<VarRef> out = new ArrayList<>(vars.size());
    for (VarRef v : vars) {
      out.add(transformVarRef(v));
    }
    return out;
  }

  protected FunctionCall transformFunctionCall(FunctionCall call) {
    return new FunctionCall(transformVarRef(call.fun), transformVarRefs(call.args));
  }

  public Expr transformExpr(Expr expr) {
    if (expr instanceof VarRef v) {
      return transformVarRef(v);
    } else if (expr instanceof BoolLiteral || expr instanceof IntLiteral || expr instanceof TypeLiteral) {
      return expr;
    } else if (expr instanceof TypeWrapper w) {
      return new TypeWrapper(w.wrapper, transformVarRef(w.inner));
    } else if (expr instanceof TemplateInstantiation t) {
      return new TemplateInstantiation(t.template, transformVarRefs(t.args));
    } else if (expr instanceof ListExpr l) {
      return new ListExpr(l.elemType, transformVarRefs(l.elems));
    } else if (expr instanceof AddToSet a) {
      return new AddToSet(transformVarRef(a.set), transformVarRef(a.elem));
    } else if (expr instanceof SetToList s) {
      return new SetToList(transformVarRef(s.var));
    } else if (expr instanceof ListToSet s) {
      return new ListToSet(transformVarRef(s.var));
    } else if (expr instanceof SetEquality e) {
      return new SetEquality(transformVarRef(e.lhs), transformVarRef(e.rhs));
    } else if (expr instanceof FunctionCall c) {
      return transformFunctionCall(c);
    } else if (expr instanceof Construct c) {
      return new Construct(c.customType, transformVarRefs(c.args));
    } else if (expr instanceof AttributeAccess a) {
      return new AttributeAccess(transformVarRef(a.var), a.attribute, a.type);
    } else if (expr instanceof Equality e) {
      return new Equality(transformVarRef(e.lhs), transformVarRef(e.rhs));
    } else if (expr instanceof IsInList e) {
      return new IsInList(transformVarRef(e.lhs), transformVarRef(e.rhs));
    } else if (expr instanceof Not n) {
      return new Not(transformVarRef(n.var));
    } else if (expr instanceof UnaryMinus m) {
      return new UnaryMinus(transformVarRef(m.var));
    } else if (expr instanceof IntBinaryOp op) {
      return new IntBinaryOp(transformVarRef(op.lhs), transformVarRef(op.rhs), op.op);
    } else if (expr instanceof IntComparison cmp) {
      return new IntComparison(transformVarRef(cmp.lhs), transformVarRef(cmp.rhs), cmp.op);
    } else if (expr instanceof IsError e) {
      return new IsError(transformVarRef(e.var));
    } else if (expr instanceof IsInstance e) {
      return new IsInstance(transformVarRef(e.var), e.checkedType);
    } else if (expr instanceof SafeUncheckedCast c) {
      return new SafeUncheckedCast(transformVarRef(c.var), c.type);
    } else if (expr instanceof MatchExpr m) {
      List<MatchCase> cases = new ArrayList<>(m.cases.size());
      for (MatchCase c : m.cases) {
        cases.add(new MatchCase(c.patterns, c.matchedVarNames, transformFunctionCall(c.call)));
      }
      return new MatchExpr(transformVarRefs(m.matchedVars), cases, m.type);
    } else if (expr instanceof ListComprehension lc) {
      return new ListComprehension(transformVarRef(lc.listVar), transformVarRef(lc.loopVar),
          transformFunctionCall(lc.call));
    }
    throw new LoweringException("Unexpected expression: " + expr.getClass().getName());
  }
}
