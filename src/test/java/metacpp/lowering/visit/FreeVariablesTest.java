package metacpp.lowering.visit;

import metacpp.lowering.core.ExprType;
import metacpp.lowering.core.LoweredModel.*;
import metacpp.lowering.core.Pattern;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FreeVariablesTest {

  private static VarRef v(String name) {
    return VarRef.local(name, ExprType.INT);
  }

  private static List<String> names(List<Stmt> stmts) {
    return FreeVariables.of(stmts).stream().map(var -> var.name).toList();
  }

  @Test
  public void testUseBeforeDefinitionIsFree() {
    List<Stmt> stmts = List.of(
        new Assignment(v("a"), new IntBinaryOp(v("x"), v("y"), "+")),
        new Assignment(v("b"), new IntBinaryOp(v("a"), v("x"), "*")),
        new Return(v("b"), null));
    assertEquals(List.of("x", "y"), names(stmts));
  }

  @Test
  public void testSortedAndUnique() {
    List<Stmt> stmts = List.of(new Return(v("zeta"), v("alpha")), new Return(v("zeta"), null));
    assertEquals(List.of("alpha", "zeta"), names(stmts));
  }

  @Test
  public void testDefinitionInOneBranchDoesNotHideUseInOther() {
    VarRef cond = VarRef.local("c", ExprType.BOOL);
    List<Stmt> stmts = List.of(new If(cond,
        List.of(new Assignment(v("x"), new IntLiteral(1))),
        List.of(new Return(v("x"), null))));
    assertEquals(List.of("c", "x"), names(stmts));
  }

  @Test
  public void testDefinitionsFromBranchesVisibleAfterwards() {
    VarRef cond = VarRef.local("c", ExprType.BOOL);
    List<Stmt> stmts = List.of(
        new If(cond, List.of(new Assignment(v("x"), new IntLiteral(1))), List.of()),
        new Return(v("x"), null));
    assertEquals(List.of("c"), names(stmts));
  }

  @Test
  public void testGlobalsAreNotFree() {
    VarRef fun = VarRef.global("helper", new ExprType.FunctionType(List.of(ExprType.INT), ExprType.INT), false);
    List<Stmt> stmts = List.of(new Assignment(v("r"), new FunctionCall(fun, List.of(v("n")))),
        new Return(v("r"), null));
    assertEquals(List.of("n"), names(stmts));
  }

  @Test
  public void testMatchCapturesScopedToCase() {
    VarRef fun = VarRef.global("case0", new ExprType.FunctionType(List.of(ExprType.TYPE), ExprType.INT), false);
    MatchCase c = new MatchCase(List.of(new Pattern.Capture("u")), List.of("u"),
        new FunctionCall(fun, List.of(VarRef.local("u", ExprType.TYPE))));
    List<Stmt> stmts = List.of(
        new Assignment(v("r"), new MatchExpr(List.of(VarRef.local("t", ExprType.TYPE)), List.of(c), ExprType.INT)),
        new Return(v("u"), null));
    assertEquals(List.of("t", "u"), names(stmts), "捕获名只在分支内有定义");
  }

  @Test
  public void testComprehensionLoopVariableDefined() {
    VarRef fun = VarRef.global("elem", new ExprType.FunctionType(List.of(ExprType.INT), ExprType.INT), false);
    VarRef list = VarRef.local("l", new ExprType.ListType(ExprType.INT));
    List<Stmt> stmts = List.of(
        new Assignment(v("r"), new ListComprehension(list, v("x"), new FunctionCall(fun, List.of(v("x"))))),
        new Return(v("r"), null));
    assertEquals(List.of("l"), names(stmts));
  }
}
