package com.cliffc.ir.attr;

import java.math.BigInteger;

// Arbitrary precision integer
public final class AttrInt extends Attr {
  public final BigInteger _i;
  private AttrInt( BigInteger i ) { super(Kind.INT); _i = i; }
  public static AttrInt make( BigInteger i ) { return new AttrInt(i); }
  public static AttrInt make( long i ) { return new AttrInt(BigInteger.valueOf(i)); }
}
