package org.astwalk.ir;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IndentStreamBuilder;

/** Base class for all IR nodes. */
public abstract class ASTNode implements IASTNode {
    /** A JSON object describing this node; subclasses add their own fields. */
    protected ObjectNode jsonObject() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("class", this.getClass().getSimpleName());
        return result;
    }

    @Override
    public String toString() {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        this.toString(builder);
        return builder.toString();
    }
}
