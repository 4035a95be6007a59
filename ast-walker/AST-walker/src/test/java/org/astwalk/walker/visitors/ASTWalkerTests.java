package org.astwalk.walker.visitors;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.ASTKind;
import org.astwalk.ir.ASTNode;
import org.astwalk.ir.ASTOpaqueUnit;
import org.astwalk.ir.ASTTuple;
import org.astwalk.ir.ASTType;
import org.astwalk.ir.IASTNode;
import org.astwalk.ir.leaf.ASTIntLiteral;
import org.astwalk.ir.leaf.ASTSymbol;
import org.astwalk.util.IIndentStream;
import org.astwalk.util.Linq;
import org.astwalk.walker.errors.InternalWalkerError;
import org.astwalk.walker.errors.NonSingletonResultError;
import org.astwalk.walker.errors.UnitExpansionError;
import org.astwalk.walker.errors.UnsupportedLeafTypeError;
import org.astwalk.walker.expand.JsonUnitExpander;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class ASTWalkerTests extends WalkerTestBase {
    /** A node type the walker does not know about. */
    static class ForeignNode extends ASTNode {
        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append("foreign");
        }

        @Override
        public ObjectNode asJson() {
            return this.jsonObject();
        }

        @Override
        public IASTNode deepCopy() {
            return this;
        }
    }

    static class Stop extends RuntimeException {}

    ASTExpr sample() {
        return lambda(List.of(sym("y")),
                assign(sym("x"), call(top("f"), sym("y"), lit(1))),
                expr(ASTKind.RETURN, sym("x")));
    }

    @Test
    public void testIdentityKeepsText() {
        ASTExpr root = this.sample();
        String before = root.toString();
        IASTNode result = this.walker().walk(root, (node, data, top, isTop, read) -> null, null);
        Assert.assertSame(root, result);
        Assert.assertEquals(before, result.toString());
    }

    @Test
    public void testEveryNodeOfferedOnce() {
        ASTSymbol y = sym("y");
        ASTIntLiteral one = lit(1);
        ASTExpr call = call(top("f"), y, one);
        ASTExpr root = lambda(assign(sym("x"), call));
        List<Visit> visits = this.record(root);
        // lambda, body, =, x, call, f, y, 1; the parameter list and the metadata are not offered
        Assert.assertEquals(8, visits.size());
        Assert.assertSame(root, visits.get(0).node());
        visitOf(visits, y);
        visitOf(visits, one);
        visitOf(visits, call);
    }

    @Test
    public void testReplaceLeaf() {
        ASTExpr call = call(top("f"), sym("y"));
        ASTExpr root = lambda(assign(sym("x"), call));
        this.walker().walk(root, (node, data, top, isTop, read) -> {
            if (node instanceof ASTSymbol symbol && symbol.name.equals("y"))
                return Linq.list(lit(42));
            return null;
        }, null);
        Assert.assertEquals("(call top(f) 42)", call.toString());
    }

    @Test
    public void testReplacementIsNotTraversed() {
        ASTSymbol inner = sym("z");
        ASTExpr replacement = call(top("g"), inner);
        ASTExpr stmt = assign(sym("x"), call(top("f"), sym("y")));
        ASTExpr root = lambda(stmt);
        List<IASTNode> seen = new ArrayList<>();
        this.walker().walk(root, (node, data, top, isTop, read) -> {
            seen.add(node);
            if (node instanceof ASTExpr expr && expr.getKind() == ASTKind.CALL && expr != replacement)
                return Linq.list(replacement);
            return null;
        }, null);
        Assert.assertSame(replacement, stmt.child(1));
        Assert.assertFalse(seen.contains(inner));
        Assert.assertFalse(seen.contains(replacement));
    }

    @Test
    public void testTwoNodesInSingletonPosition() {
        ASTExpr root = lambda(assign(sym("x"), sym("y")));
        NonSingletonResultError error = Assert.assertThrows(NonSingletonResultError.class, () ->
                this.walker().walk(root, (node, data, top, isTop, read) -> {
                    if (node instanceof ASTSymbol symbol && symbol.name.equals("y"))
                        return Linq.list(sym("a"), sym("b"));
                    return null;
                }, null));
        Assert.assertEquals(2, error.produced.size());
    }

    @Test
    public void testEmptyResultInSingletonPosition() {
        ASTExpr root = lambda(assign(sym("x"), sym("y")));
        Assert.assertThrows(NonSingletonResultError.class, () ->
                this.walker().walk(root, (node, data, top, isTop, read) -> {
                    if (node instanceof ASTSymbol symbol && symbol.name.equals("x"))
                        return new ArrayList<>();
                    return null;
                }, null));
    }

    @Test
    public void testDeleteStatement() {
        ASTExpr first = assign(sym("x"), lit(1));
        ASTExpr second = assign(sym("y"), lit(2));
        ASTExpr root = lambda(first, second);
        this.walker().walk(root, (node, data, top, isTop, read) -> {
            if (node == first)
                return new ArrayList<>();
            return null;
        }, null);
        ASTExpr body = root.child(2).to(ASTExpr.class);
        Assert.assertEquals(1, body.size());
        Assert.assertSame(second, body.child(0));
    }

    @Test
    public void testExpandArguments() {
        ASTExpr call = call(top("f"), sym("xs"));
        ASTExpr root = lambda(call);
        this.walker().walk(root, (node, data, top, isTop, read) -> {
            if (node instanceof ASTSymbol symbol && symbol.name.equals("xs"))
                return Linq.list(sym("a"), sym("b"), sym("c"));
            return null;
        }, null);
        Assert.assertEquals("(call top(f) a b c)", call.toString());
    }

    @Test
    public void testReplaceRoot() {
        ASTExpr root = this.sample();
        ASTExpr other = lambda();
        IASTNode result = this.walker().walk(root, (node, data, top, isTop, read) ->
                node == root ? Linq.list(other) : null, null);
        Assert.assertSame(other, result);
    }

    @Test
    public void testRootReplacedByTwoNodes() {
        ASTExpr root = this.sample();
        Assert.assertThrows(NonSingletonResultError.class, () ->
                this.walker().walk(root, (node, data, top, isTop, read) ->
                        node == root ? Linq.list(lambda(), lambda()) : null, null));
    }

    @Test
    public void testCallbackExceptionPropagates() {
        ASTExpr root = this.sample();
        Assert.assertThrows(Stop.class, () ->
                this.walker().walk(root, (node, data, top, isTop, read) -> {
                    if (node instanceof ASTIntLiteral)
                        throw new Stop();
                    return null;
                }, null));
    }

    @Test
    public void testDataIsPassedThrough() {
        ASTExpr root = this.sample();
        List<Object> data = new ArrayList<>();
        this.walker().walk(root, (node, d, top, isTop, read) -> {
            Assert.assertSame(data, d);
            return null;
        }, data);
    }

    @Test
    public void testUnsupportedNode() {
        ASTExpr root = lambda(call(top("f"), new ForeignNode()));
        UnsupportedLeafTypeError error = Assert.assertThrows(UnsupportedLeafTypeError.class,
                () -> this.record(root));
        Assert.assertTrue(error.astNode instanceof ForeignNode);
    }

    @Test
    public void testForeignNodeCanBeReplaced() {
        ASTExpr call = call(top("f"), new ForeignNode());
        ASTExpr root = lambda(call);
        this.walker().walk(root, (node, data, top, isTop, read) ->
                node instanceof ForeignNode ? Linq.list(sym("ok")) : null, null);
        Assert.assertEquals("(call top(f) ok)", call.toString());
    }

    @Test
    public void testTupleIsRebuilt() {
        ASTTuple tuple = new ASTTuple(List.of(sym("a"), lit(2)), new ASTType("Tuple{Int64,Int64}"));
        ASTExpr stmt = assign(sym("t"), tuple);
        ASTExpr root = lambda(stmt);
        this.walker().walk(root, (node, data, top, isTop, read) -> {
            if (node instanceof ASTSymbol symbol && symbol.name.equals("a"))
                return Linq.list(lit(1));
            return null;
        }, null);
        Assert.assertNotSame(tuple, stmt.child(1));
        Assert.assertEquals("(1, 2)::Tuple{Int64,Int64}", stmt.child(1).toString());
        // the original is unchanged
        Assert.assertEquals("(a, 2)::Tuple{Int64,Int64}", tuple.toString());
    }

    @Test
    public void testTupleElementCannotExpand() {
        ASTTuple tuple = new ASTTuple(List.of(sym("a")), new ASTType("Tuple{Int64}"));
        ASTExpr root = lambda(assign(sym("t"), tuple));
        Assert.assertThrows(NonSingletonResultError.class, () ->
                this.walker().walk(root, (node, data, top, isTop, read) -> {
                    if (node instanceof ASTSymbol symbol && symbol.name.equals("a"))
                        return Linq.list(lit(1), lit(2));
                    return null;
                }, null));
    }

    @Test
    public void testOpaqueBodyIsExpanded() {
        ASTExpr body = expr(ASTKind.BODY, assign(sym("x"), lit(1)), expr(ASTKind.RETURN, sym("x")));
        String text = body.toString();
        ASTOpaqueUnit unit = JsonUnitExpander.condense(body);
        ASTExpr root = expr(ASTKind.LAMBDA, expr(ASTKind.ARGS), expr(ASTKind.META), unit);
        List<Visit> visits = this.record(root);
        IASTNode newBody = root.child(2);
        Assert.assertTrue(newBody instanceof ASTExpr);
        Assert.assertNotSame(body, newBody);
        Assert.assertEquals(text, newBody.toString());
        // The callback sees the expanded body, never the condensed one
        for (Visit visit: visits)
            Assert.assertFalse(visit.node() instanceof ASTOpaqueUnit);
        Assert.assertTrue(visited(visits, newBody));
    }

    @Test
    public void testBadOpaqueUnit() {
        ASTExpr root = expr(ASTKind.LAMBDA, expr(ASTKind.ARGS), expr(ASTKind.META),
                new ASTOpaqueUnit("not json"));
        UnitExpansionError error = Assert.assertThrows(UnitExpansionError.class, () -> this.record(root));
        Assert.assertTrue(error.astNode instanceof ASTOpaqueUnit);
    }

    @Test
    public void testVisitFromCallback() {
        // A callback can traverse the nodes it builds with the same walker
        ASTWalker walker = this.walker();
        ASTExpr root = lambda(call(top("f"), sym("a")));
        List<String> names = new ArrayList<>();
        walker.walk(root, new IWalkCallback<List<String>>() {
            @Override
            public List<IASTNode> apply(IASTNode node, List<String> data,
                                        int topLevelNumber, boolean isTopLevel, boolean read) {
                if (node instanceof ASTSymbol symbol) {
                    data.add(symbol.name);
                    if (symbol.name.equals("a")) {
                        ASTExpr replacement = call(top("g"), sym("b"));
                        return walker.visit(replacement,
                                new WalkContext(2, topLevelNumber, false, read), this, data);
                    }
                }
                return null;
            }
        }, names);
        Assert.assertEquals(List.of("a", "b"), names);
        Assert.assertEquals("(call top(f) (call top(g) b))",
                root.child(2).to(ASTExpr.class).child(0).toString());
    }

    @Test
    public void testNullReplacementRejected() {
        ASTSymbol a = sym("a");
        ASTExpr root = lambda(call(top("f"), a));
        InternalWalkerError error = Assert.assertThrows(InternalWalkerError.class, () ->
                this.walker().walk(root, (node, data, top, isTop, read) -> {
                    if (node == a)
                        return Arrays.asList(sym("b"), null);
                    return null;
                }, null));
        Assert.assertTrue(error.getMessage().contains("a"));
        Assert.assertEquals("(call top(f) a)", root.child(2).to(ASTExpr.class).child(0).toString());
    }
}
