package org.astwalk.ir;

import org.astwalk.util.IIndentStream;
import org.astwalk.util.ToIndentableString;

/** A type annotation attached to IR nodes.  The walker never
 * interprets types, it only carries them along. */
public record ASTType(String name) implements ToIndentableString {
    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @Override
    public String toString() {
        return this.name;
    }
}
