package org.astwalk.walker.visitors;

import org.astwalk.ir.IASTNode;

import java.util.List;

/** Visits one node in a context and produces its replacements. */
public interface INodeVisitor {
    List<IASTNode> visit(IASTNode node, WalkContext context);
}
