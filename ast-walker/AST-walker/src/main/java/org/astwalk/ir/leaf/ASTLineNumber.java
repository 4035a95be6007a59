package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** Source position marker. */
public final class ASTLineNumber extends ASTLeaf {
    public final int line;
    @Nullable
    public final String file;

    public ASTLineNumber(int line, @Nullable String file) {
        this.line = line;
        this.file = file;
    }

    public ASTLineNumber(int line) {
        this(line, null);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("# line ").append(this.line);
        if (this.file != null)
            builder.append(" ").append(this.file);
        return builder;
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("line", this.line);
        if (this.file != null)
            result.put("file", this.file);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ASTLineNumber that = (ASTLineNumber) o;
        return this.line == that.line && Objects.equals(this.file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.line, this.file);
    }
}
