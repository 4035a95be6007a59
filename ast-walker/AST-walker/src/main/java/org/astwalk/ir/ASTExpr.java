/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.astwalk.ir;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.util.IIndentStream;
import org.astwalk.util.Linq;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/** A composite IR node: a kind, an ordered list of children, and an
 * optional type annotation.  The kind and the children are rewritten
 * in place by the walker; the type annotation never changes. */
public final class ASTExpr extends ASTNode {
    private ASTKind kind;
    private List<IASTNode> children;
    @Nullable
    private final ASTType type;

    public ASTExpr(ASTKind kind, List<? extends IASTNode> children, @Nullable ASTType type) {
        this.kind = kind;
        this.children = new ArrayList<>(children);
        this.type = type;
    }

    public ASTExpr(ASTKind kind, List<? extends IASTNode> children) {
        this(kind, children, null);
    }

    public ASTExpr(ASTKind kind, IASTNode... children) {
        this(kind, Arrays.asList(children), null);
    }

    public ASTKind getKind() {
        return this.kind;
    }

    /** A read-only view of the children. */
    public List<IASTNode> getChildren() {
        return Collections.unmodifiableList(this.children);
    }

    @Nullable
    public ASTType getType() {
        return this.type;
    }

    public int size() {
        return this.children.size();
    }

    public IASTNode child(int index) {
        return this.children.get(index);
    }

    /** Replace the children, keeping the kind and the type.
     * @return this node. */
    public ASTExpr withChildren(List<? extends IASTNode> children) {
        this.children = new ArrayList<>(children);
        return this;
    }

    /** Replace the kind and the children, keeping the type.
     * @return this node. */
    public ASTExpr withKind(ASTKind kind, List<? extends IASTNode> children) {
        this.kind = kind;
        return this.withChildren(children);
    }

    @Override
    public boolean isComposite() {
        return true;
    }

    @Override
    public ASTExpr deepCopy() {
        return new ASTExpr(this.kind, Linq.map(this.children, IASTNode::deepCopy), this.type);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(").append(this.kind.toString());
        if (this.kind.isBlock() && !this.children.isEmpty()) {
            builder.increase()
                    .lines(this.children)
                    .decrease();
        } else {
            for (IASTNode child: this.children)
                builder.append(" ").append(child);
        }
        builder.append(")");
        if (this.type != null)
            builder.append("::").append(this.type);
        return builder;
    }

    @Override
    public ObjectNode asJson() {
        ObjectNode result = this.jsonObject();
        result.put("kind", this.kind.toString());
        if (this.type != null)
            result.put("type", this.type.name());
        ArrayNode array = result.putArray("children");
        for (IASTNode child: this.children)
            array.add(child.asJson());
        return result;
    }
}
