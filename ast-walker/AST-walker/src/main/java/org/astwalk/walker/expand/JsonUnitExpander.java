package org.astwalk.walker.expand;

import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.ASTOpaqueUnit;
import org.astwalk.ir.IASTNode;
import org.astwalk.walker.backend.ASTJsonDecoder;
import org.astwalk.walker.errors.UnitExpansionError;

/** Expands units whose payload is the JSON encoding of a composite node. */
public class JsonUnitExpander implements IUnitExpander {
    final ASTJsonDecoder decoder;

    public JsonUnitExpander() {
        this.decoder = new ASTJsonDecoder();
    }

    /** Build a condensed unit holding the specified composite. */
    public static ASTOpaqueUnit condense(ASTExpr expr) {
        return new ASTOpaqueUnit(expr.asJson().toString());
    }

    @Override
    public ASTExpr expand(ASTOpaqueUnit unit) {
        IASTNode node = this.decoder.decode(unit.payload);
        if (!(node instanceof ASTExpr expr))
            throw new UnitExpansionError("Condensed unit does not hold a composite node", unit, null);
        return expr;
    }
}
