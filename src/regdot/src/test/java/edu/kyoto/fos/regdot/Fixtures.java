package edu.kyoto.fos.regdot;

import edu.kyoto.fos.regdot.cfg.BasicBlock;
import soot.IntType;
import soot.Local;
import soot.Modifier;
import soot.SootClass;
import soot.SootMethod;
import soot.Unit;
import soot.VoidType;
import soot.jimple.IntConstant;
import soot.jimple.Jimple;
import soot.jimple.JimpleBody;

import java.util.Collections;
import java.util.List;

public final class Fixtures {
  private Fixtures() {
  }

  public static BasicBlock block() {
    return new BasicBlock(List.of(Jimple.v().newNopStmt()));
  }

  // x = <value>; return
  public static BasicBlock block(int value) {
    Local x = Jimple.v().newLocal("x", IntType.v());
    return new BasicBlock(List.of(Jimple.v().newAssignStmt(x, IntConstant.v(value)), Jimple.v().newReturnVoidStmt()));
  }

  /*
   * static void count() {
   *   i = 0;
   *   while(i < 10) { i = i + 1; }
   * }
   */
  public static JimpleBody countingLoop() {
    Jimple j = Jimple.v();
    SootClass sc = new SootClass("Counter", Modifier.PUBLIC);
    sc.setResolvingLevel(SootClass.BODIES);
    SootMethod m = new SootMethod("count", Collections.emptyList(), VoidType.v(), Modifier.PUBLIC | Modifier.STATIC);
    sc.addMethod(m);
    JimpleBody body = j.newBody(m);
    m.setActiveBody(body);
    Local i = j.newLocal("i", IntType.v());
    body.getLocals().add(i);
    Unit init = j.newAssignStmt(i, IntConstant.v(0));
    Unit ret = j.newReturnVoidStmt();
    Unit cond = j.newIfStmt(j.newGeExpr(i, IntConstant.v(10)), ret);
    Unit incr = j.newAssignStmt(i, j.newAddExpr(i, IntConstant.v(1)));
    Unit back = j.newGotoStmt(cond);
    body.getUnits().add(init);
    body.getUnits().add(cond);
    body.getUnits().add(incr);
    body.getUnits().add(back);
    body.getUnits().add(ret);
    return body;
  }
}
