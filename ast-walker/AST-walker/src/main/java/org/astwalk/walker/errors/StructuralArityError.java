package org.astwalk.walker.errors;

import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.ASTKind;

/** A node does not have the shape required by its kind:
 * the wrong number of children, or a child of the wrong kind. */
public final class StructuralArityError extends BaseWalkerException {
    public StructuralArityError(ASTExpr expr, String expected) {
        super("Node of kind " + expr.getKind().name() + " must have " + expected +
                " children, but it has " + expr.size() + System.lineSeparator() + expr, expr);
    }

    public StructuralArityError(ASTExpr expr, int index, ASTKind expected) {
        super("Child " + index + " of node of kind " + expr.getKind().name() +
                " must be a node of kind " + expected.name() + System.lineSeparator() + expr, expr);
    }

    @Override
    public String getErrorKind() {
        return "Structural arity error";
    }
}
