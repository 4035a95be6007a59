package org.astwalk.walker.expand;

import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.ASTKind;
import org.astwalk.ir.ASTOpaqueUnit;
import org.astwalk.ir.ASTType;
import org.astwalk.ir.leaf.ASTIntLiteral;
import org.astwalk.ir.leaf.ASTSymbol;
import org.astwalk.walker.errors.UnitExpansionError;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class JsonUnitExpanderTests {
    @Test
    public void testExpandReturnsFreshTrees() {
        ASTExpr body = new ASTExpr(ASTKind.BODY, List.of(
                new ASTExpr(ASTKind.ASSIGN, new ASTSymbol("x"), new ASTIntLiteral(1)),
                new ASTExpr(ASTKind.RETURN, new ASTSymbol("x"))), new ASTType("Int64"));
        ASTOpaqueUnit unit = JsonUnitExpander.condense(body);
        JsonUnitExpander expander = new JsonUnitExpander();
        ASTExpr first = expander.expand(unit);
        ASTExpr second = expander.expand(unit);
        Assert.assertNotSame(first, second);
        Assert.assertNotSame(first.child(0), second.child(0));
        Assert.assertEquals(body.toString(), first.toString());
        Assert.assertEquals(body.toString(), second.toString());
    }

    @Test
    public void testPayloadMustBeComposite() {
        ASTOpaqueUnit unit = new ASTOpaqueUnit(new ASTSymbol("x").asJson().toString());
        Assert.assertThrows(UnitExpansionError.class, () -> new JsonUnitExpander().expand(unit));
    }
}
