package org.astwalk.walker.expand;

import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.ASTOpaqueUnit;

/** Turns a condensed function body into a composite node that can be walked. */
public interface IUnitExpander {
    /** Expand a condensed unit.  Each call must return a fresh tree. */
    ASTExpr expand(ASTOpaqueUnit unit);
}
