package com.cliffc.ir.print;

import com.cliffc.ir.module.Op;
import com.cliffc.ir.util.SB;

/** Custom textual form for a registered operation.
 *
 *  Called after any "%id = " prefix has been printed.  The function printer
 *  is passed in so the hook can print operands, types and attributes the same
 *  way the generic form does.
 */
@FunctionalInterface
public interface CustomAsm {
  SB print( Op op, FuncPrinter p, SB sb );
}
