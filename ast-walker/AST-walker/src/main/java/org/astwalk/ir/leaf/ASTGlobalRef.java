package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;

import java.util.Objects;

/** A reference to a name qualified by the module which defines it. */
public final class ASTGlobalRef extends ASTLeaf {
    public final String module;
    public final String name;

    public ASTGlobalRef(String module, String name) {
        this.module = module;
        this.name = name;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.module)
                .append(".")
                .append(this.name);
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("module", this.module);
        result.put("name", this.name);
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ASTGlobalRef that = (ASTGlobalRef) o;
        return this.module.equals(that.module) && this.name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.module, this.name);
    }
}
