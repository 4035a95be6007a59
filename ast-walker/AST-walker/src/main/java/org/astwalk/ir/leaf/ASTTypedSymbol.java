package org.astwalk.ir.leaf;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.ir.ASTType;
import org.astwalk.util.IIndentStream;

import java.util.Objects;

/** A variable reference which carries the type inferred for the variable. */
public final class ASTTypedSymbol extends ASTLeaf {
    public final String name;
    public final ASTType type;

    public ASTTypedSymbol(String name, ASTType type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name)
                .append("::")
                .append(this.type);
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("name", this.name);
        result.put("type", this.type.name());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ASTTypedSymbol that = (ASTTypedSymbol) o;
        return this.name.equals(that.name) && this.type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.type);
    }
}
