package org.astwalk.walker.errors;

import org.astwalk.ir.ASTOpaqueUnit;

import javax.annotation.Nullable;

/** A condensed function body could not be expanded. */
public final class UnitExpansionError extends BaseWalkerException {
    public UnitExpansionError(String message, ASTOpaqueUnit unit, @Nullable Throwable cause) {
        super(message, unit, cause);
    }

    @Override
    public String getErrorKind() {
        return "Unit expansion error";
    }
}
