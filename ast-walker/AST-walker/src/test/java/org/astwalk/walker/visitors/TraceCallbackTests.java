package org.astwalk.walker.visitors;

import org.astwalk.ir.ASTExpr;
import org.astwalk.util.IndentStream;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class TraceCallbackTests extends WalkerTestBase {
    @Test
    public void testTrace() {
        ASTExpr root = lambda(List.of(sym("p")), assign(sym("x"), lit(1)));
        String before = root.toString();
        StringBuilder builder = new StringBuilder();
        this.walker().walk(root, new TraceCallback(), new IndentStream(builder));
        String trace = builder.toString();
        Assert.assertTrue(trace, trace.contains("[0 write] p"));
        Assert.assertTrue(trace, trace.contains("[1 top] (= x 1)"));
        Assert.assertTrue(trace, trace.contains("[1 write] x"));
        Assert.assertTrue(trace, trace.contains("[1] 1"));
        // Multi-line nodes are shortened
        Assert.assertTrue(trace, trace.contains("[0] (body ..."));
        Assert.assertEquals(before, root.toString());
    }
}
