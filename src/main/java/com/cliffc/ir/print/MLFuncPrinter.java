package com.cliffc.ir.print;

import com.cliffc.ir.module.*;
import com.cliffc.ir.util.SB;

/** Prints a function made of nested statements.
 *
 *  Each nested body is indented one more level, using the SB indent counter.
 *  Operation statements share the operation printing of CFG functions.
 */
public final class MLFuncPrinter extends FuncPrinter {
  private final MLFunc _fn;     // Null when printing a detached statement

  public MLFuncPrinter( MLFunc fn, ModulePrinter other ) {
    super(other);
    _fn = fn;
    if( fn != null ) number(fn._body);
  }

  // Pre-order: loop induction variables before their bodies
  private MLFuncPrinter number( StmtBlock blk ) {
    for( Stmt s : blk._stmts )
      number(s);
    return this;
  }
  private MLFuncPrinter number( Stmt s ) {
    return switch( s._kind ) {
    case OP -> {
      Op op = ((OpStmt)s)._op;
      if( op.numResults() != 0 ) numberValueID(op.result(0));
      yield this;
    }
    case FOR -> {
      ForStmt fs = (ForStmt)s;
      numberValueID(fs._iv);
      yield number(fs._body);
    }
    case IF -> {
      IfStmt is = (IfStmt)s;
      number(is._then);
      yield is.hasElse() ? number(is.elseClause()) : this;
    }
    };
  }

  @Override public SB print( SB sb ) {
    printSignature(sb.p("mlfunc "),_fn).p(" {").nl();
    print(sb,_fn._body);
    return sb.p("  return").nl().p('}').nl().nl();
  }

  // One level deeper; each statement on its own line
  public SB print( SB sb, StmtBlock blk ) {
    sb.ii(1);
    for( Stmt s : blk._stmts )
      print(sb,s).nl();
    return sb.di(1);
  }

  public SB print( SB sb, Stmt s ) {
    return switch( s._kind ) {
    case OP  -> printOperation(sb.i(),((OpStmt)s)._op);
    case FOR -> print(sb,(ForStmt)s);
    case IF  -> print(sb,(IfStmt )s);
    };
  }

  // for x = 0 to 10 step 2 {
  private SB print( SB sb, ForStmt fs ) {
    print(sb.ip("for x = "),fs._lo).p(" to ");
    print(sb,fs._hi);
    if( fs._step._con != 1 )
      print(sb.p(" step "),fs._step);
    print(sb.p(" {").nl(),fs._body);
    return sb.ip("}");
  }

  // The condition is not printed
  private SB print( SB sb, IfStmt is ) {
    print(sb.ip("if () {").nl(),is._then);
    sb.ip("}");
    if( !is.hasElse() ) return sb;
    print(sb.p(" else {").nl(),is.elseClause());
    return sb.ip("}");
  }
}
