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
import org.astwalk.ir.ASTOpaqueUnit;
import org.astwalk.ir.ASTTuple;
import org.astwalk.ir.IASTNode;
import org.astwalk.ir.leaf.ASTLeaf;
import org.astwalk.util.IWritesLogs;
import org.astwalk.util.Linq;
import org.astwalk.util.Logger;
import org.astwalk.walker.WalkerOptions;
import org.astwalk.walker.errors.InputError;
import org.astwalk.walker.errors.InternalWalkerError;
import org.astwalk.walker.errors.UnitExpansionError;
import org.astwalk.walker.errors.UnsupportedLeafTypeError;
import org.astwalk.walker.expand.IUnitExpander;
import org.astwalk.walker.expand.JsonUnitExpander;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walks an IR tree depth-first and in pre-order, offering every node to a callback.
 * If the callback returns null the walker traverses the children of the node,
 * as described by the {@link org.astwalk.ir.RecursionRule} of its kind;
 * otherwise the nodes returned by the callback replace the visited node.
 * Composite nodes are rewritten in place.
 *
 * <p>The walker keeps no state between walks; the same walker can be used
 * for many trees, but not for two walks of the same tree at the same time.
 */
public class ASTWalker implements IWritesLogs {
    public final WalkerOptions options;
    final IUnitExpander expander;
    final Logger logger;

    public ASTWalker(WalkerOptions options, IUnitExpander expander, Logger logger) {
        this.options = options;
        this.expander = expander;
        this.logger = logger;
        int level = options.walkOptions.debugLevel;
        if (level > 0) {
            this.logger.setLoggingLevel(ASTWalker.class, level);
            this.logger.setLoggingLevel(ASTDispatcher.class, level);
            this.logger.setLoggingLevel(TreeValidator.class, level);
        }
        for (Map.Entry<String, String> entry: options.ioOptions.loggingLevel.entrySet()) {
            try {
                int classLevel = Integer.parseInt(entry.getValue());
                this.logger.setLoggingLevel(entry.getKey(), classLevel);
            } catch (NumberFormatException ex) {
                throw new InputError("-T option must be followed by 'class=number'; could not parse " + entry, ex);
            }
        }
    }

    public ASTWalker(WalkerOptions options, IUnitExpander expander) {
        this(options, expander, new Logger());
    }

    public ASTWalker(WalkerOptions options) {
        this(options, new JsonUnitExpander());
    }

    public ASTWalker() {
        this(new WalkerOptions());
    }

    public Logger getLogger() {
        return this.logger;
    }

    /** Walk a tree.
     *
     * @param root      Root of the tree; usually a function definition.
     * @param callback  Function invoked for every node.
     * @param data      Object passed to every callback invocation.
     * @return          The root of the rewritten tree.  This is the original root
     *                  unless the callback replaced it. */
    public <T> IASTNode walk(IASTNode root, IWalkCallback<T> callback, T data) {
        if (!this.options.walkOptions.skipTreeCheck)
            new TreeValidator(this.logger).validate(root);
        List<IASTNode> result = this.visit(root, WalkContext.ROOT, callback, data);
        return ASTDispatcher.getOne(result, "root of the walk", root);
    }

    /** Walk a subtree in a given context.  Callbacks can use this method
     * to traverse the replacement nodes they build.
     * @return The nodes that replace the node. */
    public <T> List<IASTNode> visit(IASTNode node, WalkContext context, IWalkCallback<T> callback, T data) {
        return new Walk<>(callback, data).visit(node, context);
    }

    /** The state of one walk. */
    final class Walk<T> implements INodeVisitor {
        final IWalkCallback<T> callback;
        final T data;
        final ASTDispatcher dispatcher;

        Walk(IWalkCallback<T> callback, T data) {
            this.callback = callback;
            this.data = data;
            this.dispatcher = new ASTDispatcher(ASTWalker.this.options.walkOptions, ASTWalker.this.logger, this);
        }

        @Override
        public List<IASTNode> visit(IASTNode node, WalkContext context) {
            if (node instanceof ASTOpaqueUnit unit)
                node = ASTWalker.this.expand(unit);
            final IASTNode current = node;
            ASTWalker.this.logger.belowLevel(ASTWalker.this, 2)
                    .append("visit ")
                    .appendSupplier(context::toString)
                    .append(" ")
                    .appendSupplier(current::toString)
                    .newline();

            List<IASTNode> replacement = this.callback.apply(
                    node, this.data, context.topLevelNumber(), context.isTopLevel(), context.read());
            if (replacement != null) {
                for (IASTNode result: replacement)
                    if (result == null)
                        throw new InternalWalkerError("Callback returned a null node as replacement for " + current);
                ASTWalker.this.logger.belowLevel(ASTWalker.this, 1)
                        .append("Callback replaced ")
                        .appendSupplier(current::toString)
                        .append(" with ")
                        .append(replacement.size())
                        .append(" node(s)")
                        .newline();
                return replacement;
            }

            if (node instanceof ASTExpr expr) {
                this.dispatcher.dispatch(expr, context);
            } else if (node instanceof ASTTuple tuple) {
                node = this.rebuild(tuple, context);
            } else if (!(node instanceof ASTLeaf)) {
                throw new UnsupportedLeafTypeError(node);
            }
            return Linq.list(node);
        }

        /** Tuples are immutable, so a new one is built from the traversed elements. */
        ASTTuple rebuild(ASTTuple tuple, WalkContext context) {
            List<IASTNode> elements = new ArrayList<>(tuple.size());
            for (int i = 0; i < tuple.size(); i++) {
                List<IASTNode> result = this.visit(tuple.getElements().get(i), context.nested());
                elements.add(ASTDispatcher.getOne(result, "tuple element " + i, tuple));
            }
            return new ASTTuple(elements, tuple.type);
        }
    }

    ASTExpr expand(ASTOpaqueUnit unit) {
        this.logger.belowLevel(this, 3)
                .append("Expanding condensed unit of ")
                .append(unit.payload.length())
                .append(" chars")
                .newline();
        try {
            return this.expander.expand(unit);
        } catch (UnitExpansionError ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new UnitExpansionError("Could not expand condensed unit: " + ex.getMessage(), unit, ex);
        }
    }
}
