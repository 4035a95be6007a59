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

package org.astwalk.walker.visitors;

import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.ASTKind;
import org.astwalk.ir.IASTNode;
import org.astwalk.ir.leaf.ASTSymbol;
import org.astwalk.util.IWritesLogs;
import org.astwalk.util.Logger;
import org.astwalk.walker.WalkerOptions;
import org.astwalk.walker.errors.MalformedFunctionBodyError;
import org.astwalk.walker.errors.NonSingletonResultError;
import org.astwalk.walker.errors.StructuralArityError;
import org.astwalk.walker.errors.UnknownNodeKindError;

import java.util.ArrayList;
import java.util.List;

/**
 * Traverses the children of composite nodes, following the
 * {@link org.astwalk.ir.RecursionRule} of each node kind.
 * Children are handed to an {@link INodeVisitor}, which may replace them.
 * A rule computes the complete new list of children before it updates
 * the node, so a failure in a subtree leaves all the ancestors unchanged.
 */
public class ASTDispatcher implements IWritesLogs {
    final WalkerOptions.Walk options;
    final Logger logger;
    final INodeVisitor visitor;

    public ASTDispatcher(WalkerOptions.Walk options, Logger logger, INodeVisitor visitor) {
        this.options = options;
        this.logger = logger;
        this.visitor = visitor;
    }

    /** Check that a traversal produced exactly one node and return it.
     * @param result   Nodes produced.
     * @param position Description of the position that is being filled.
     * @param parent   Node that owns the position. */
    public static IASTNode getOne(List<IASTNode> result, String position, IASTNode parent) {
        if (result.size() != 1)
            throw new NonSingletonResultError(position, parent, result);
        return result.get(0);
    }

    /** Traverse the children of a composite node and update it in place.
     * The type of the node is not changed. */
    public void dispatch(ASTExpr expr, WalkContext context) {
        ASTKind kind = expr.getKind();
        this.logger.belowLevel(this, 3)
                .append(kind.name())
                .append(" ")
                .append(kind.rule.name())
                .append(" ")
                .appendSupplier(context::toString)
                .newline();
        ASTKind resultKind = kind;
        List<IASTNode> children = switch (kind.rule) {
            case FUNCTION_DEF -> this.functionDef(expr, context);
            case BLOCK -> this.sequence(expr.getChildren(), context.deeper());
            case SEQUENCE -> this.sequence(expr.getChildren(), context);
            case ASSIGNMENT -> this.assignment(expr, context);
            case FIRST -> this.first(expr, context);
            case SECOND -> this.second(expr, context);
            case CALL -> this.call(expr, expr.getChildren(), context);
            case ALL -> this.all(expr, context);
            case PAIR -> this.pair(expr, context);
            case ALLOC -> this.alloc(expr, context);
            case REQUEUE_AS_CALL -> {
                resultKind = ASTKind.CALL;
                yield this.copyAsCall(expr, context);
            }
            case SKIP -> expr.getChildren();
            case REJECT -> throw new UnknownNodeKindError(expr);
        };
        expr.withKind(resultKind, children);
    }

    /** Traverse a list of statements or arguments.  Each element may be replaced
     * by any number of nodes.  If the list is the body of a function
     * each element is a top-level statement, numbered by its position in the
     * result list, which may differ from its position in the original list. */
    public List<IASTNode> sequence(List<IASTNode> nodes, WalkContext context) {
        boolean functionBody = context.isFunctionBody();
        List<IASTNode> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            WalkContext elementContext;
            if (functionBody) {
                elementContext = context.statement(result.size() + 1);
                this.logger.belowLevel(this, 2)
                        .append("Processing top-level node #")
                        .append(i + 1)
                        .append(" depth=")
                        .append(context.depth())
                        .newline();
            } else {
                elementContext = context.nested();
                this.logger.belowLevel(this, 2)
                        .append("Processing node #")
                        .append(i + 1)
                        .append(" depth=")
                        .append(context.depth())
                        .newline();
            }
            result.addAll(this.visitor.visit(nodes.get(i), elementContext));
        }
        return result;
    }

    IASTNode one(ASTExpr parent, IASTNode child, String position, WalkContext context) {
        return getOne(this.visitor.visit(child, context), position, parent);
    }

    void checkArity(ASTExpr expr, int expected) {
        if (expr.size() != expected)
            throw new StructuralArityError(expr, Integer.toString(expected));
    }

    /** Children of a function are [parameters, metadata, body]. */
    List<IASTNode> functionDef(ASTExpr expr, WalkContext context) {
        this.checkArity(expr, 3);
        ASTExpr params = this.expectKind(expr, 0, ASTKind.ARGS);
        List<IASTNode> newParams = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            IASTNode param = this.one(params, params.child(i),
                    "parameter " + i, context.write());
            newParams.add(param);
        }

        // Only the body of the outermost function has numbered statements;
        // a function nested in a statement keeps the number of that statement.
        IASTNode body = this.one(expr, expr.child(2), "function body", context.nested());
        if (!(body instanceof ASTExpr block) || !block.getKind().isBlock())
            throw new MalformedFunctionBodyError(expr, body);
        params.withChildren(newParams);
        return List.of(params, expr.child(1), body);
    }

    List<IASTNode> assignment(ASTExpr expr, WalkContext context) {
        this.checkArity(expr, 2);
        IASTNode left = this.one(expr, expr.child(0), "assignment target", context.write());
        IASTNode right = this.one(expr, expr.child(1), "assigned value", context.nested());
        return List.of(left, right);
    }

    List<IASTNode> first(ASTExpr expr, WalkContext context) {
        this.checkArity(expr, 2);
        IASTNode value = this.one(expr, expr.child(0), "child 0", context.nested());
        return List.of(value, expr.child(1));
    }

    List<IASTNode> second(ASTExpr expr, WalkContext context) {
        this.checkArity(expr, 2);
        IASTNode value = this.one(expr, expr.child(1), "child 1", context.nested());
        return List.of(expr.child(0), value);
    }

    /** Children are [function, arguments...].  Plain symbols naming
     * the function are not visited. */
    List<IASTNode> call(ASTExpr expr, List<IASTNode> children, WalkContext context) {
        if (children.isEmpty())
            throw new StructuralArityError(expr, "at least 1");
        IASTNode function = children.get(0);
        if (!function.is(ASTSymbol.class))
            function = this.one(expr, function, "called function", context.nested());
        List<IASTNode> result = new ArrayList<>();
        result.add(function);
        result.addAll(this.sequence(children.subList(1, children.size()), context.deeper()));
        return result;
    }

    List<IASTNode> all(ASTExpr expr, WalkContext context) {
        List<IASTNode> result = new ArrayList<>(expr.size());
        for (int i = 0; i < expr.size(); i++)
            result.add(this.one(expr, expr.child(i), "child " + i, context.nested()));
        return result;
    }

    List<IASTNode> pair(ASTExpr expr, WalkContext context) {
        this.checkArity(expr, 2);
        return this.all(expr, context);
    }

    /** Children are [element type, dimensions]; the dimensions are an 'args' node. */
    List<IASTNode> alloc(ASTExpr expr, WalkContext context) {
        this.checkArity(expr, 2);
        ASTExpr dimensions = this.expectKind(expr, 1, ASTKind.ARGS);
        List<IASTNode> newDimensions = this.sequence(dimensions.getChildren(), context);
        dimensions.withChildren(newDimensions);
        return List.of(expr.child(0), dimensions);
    }

    /** An array copy becomes a call to the copy routine with the same arguments. */
    List<IASTNode> copyAsCall(ASTExpr expr, WalkContext context) {
        List<IASTNode> children = new ArrayList<>();
        children.add(new ASTSymbol(this.options.copyRoutine));
        children.addAll(expr.getChildren());
        return this.call(expr, children, context);
    }

    ASTExpr expectKind(ASTExpr expr, int index, ASTKind kind) {
        IASTNode child = expr.child(index);
        if (child instanceof ASTExpr result && result.getKind() == kind)
            return result;
        throw new StructuralArityError(expr, index, kind);
    }
}
