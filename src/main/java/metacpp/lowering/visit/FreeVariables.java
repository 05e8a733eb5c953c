package metacpp.lowering.visit;

import metacpp.lowering.core.LoweredModel.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 降级语句序列中的自由变量：在赋值之前就被读取的局部变量，按名称排序且去重。
 *
 * <p>全局函数引用不算自由变量；if 的两个分支各自从分支前的已定义集合出发，
 * 分支内的定义在合流后才对后续语句可见。</p>
 */
public final class FreeVariables extends LoweredVisitor {
  private Set<String> defined = new HashSet<>();
  private final Map<String, VarRef> free = new LinkedHashMap<>();

  private FreeVariables() {}

  public static List<VarRef> of(List<Stmt> stmts) {
    FreeVariables collector = new FreeVariables();
    collector.visitStmts(stmts);
    List<VarRef> result = new ArrayList<>(collector.free.values());
    result.sort((a, b) -> a.name.compareTo(b.name));
    return result;
  }

  @Override
  public void visitStmt(Stmt stmt) {
    if (stmt instanceof If i) {
      visitVarRef(i.cond);
      Set<String> before = defined;
      defined = new HashSet<>(before);
      visitStmts(i.thenStmts);
      Set<String> afterThen = defined;
      defined = new HashSet<>(before);
      visitStmts(i.elseStmts);
      afterThen.addAll(defined);
      defined = afterThen;
      return;
    }
    super.visitStmt(stmt);
  }

  @Override
  protected void visitDefinition(VarRef var) {
    defined.add(var.name);
  }

  @Override
  protected void visitVarRef(VarRef var) {
    if (var.globalFunction || defined.contains(var.name)) {
      return;
    }
    free.putIfAbsent(var.name, var);
  }

  @Override
  protected void visitMatchCase(MatchCase matchCase) {
    Set<String> before = defined;
    defined = new HashSet<>(before);
    defined.addAll(matchCase.matchedVarNames);
    visitFunctionCall(matchCase.call);
    defined = before;
  }
}
