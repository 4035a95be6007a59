package org.astwalk.ir;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;
import org.astwalk.util.Linq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A fixed-size tuple of values, tagged with the type of the aggregate.
 * Unlike a composite node a tuple is never mutated: the walker
 * builds a new tuple from the traversed elements. */
public final class ASTTuple extends ASTNode {
    private final List<IASTNode> elements;
    public final ASTType type;

    public ASTTuple(List<? extends IASTNode> elements, ASTType type) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.type = type;
    }

    public List<IASTNode> getElements() {
        return this.elements;
    }

    public int size() {
        return this.elements.size();
    }

    @Override
    public ASTTuple deepCopy() {
        return new ASTTuple(Linq.map(this.elements, IASTNode::deepCopy), this.type);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .joinI(", ", this.elements)
                .append(this.elements.size() == 1 ? ",)" : ")")
                .append("::")
                .append(this.type);
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("type", this.type.name());
        ArrayNode array = result.putArray("elements");
        for (IASTNode element: this.elements)
            array.add(element.asJson());
        return result;
    }
}
