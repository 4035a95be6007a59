package org.astwalk.walker.visitors;

import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.leaf.ASTSymbol;
import org.astwalk.util.Linq;
import org.astwalk.walker.WalkerOptions;
import org.astwalk.walker.errors.InputError;
import org.junit.Assert;
import org.junit.Test;

public class LoggingTests extends WalkerTestBase {
    ASTExpr program() {
        return lambda(
                assign(sym("x"), call(top("f"), sym("y"))),
                call(top("g"), sym("x")));
    }

    @Test
    public void testSilentByDefault() {
        this.record(this.program());
        Assert.assertEquals("", this.log.toString());
    }

    @Test
    public void testDepthIsLogged() {
        WalkerOptions options = new WalkerOptions();
        options.walkOptions.debugLevel = 2;
        this.walker(options).walk(this.program(), (node, data, top, isTop, read) -> null, null);
        String log = this.log.toString();
        // Statements of the function body are one level deeper than the function
        Assert.assertTrue(log, log.contains("Processing top-level node #1 depth=2"));
        Assert.assertTrue(log, log.contains("Processing top-level node #2 depth=2"));
        // Call arguments are one level deeper than the call
        Assert.assertTrue(log, log.contains("Processing node #1 depth=3"));
        Assert.assertTrue(log, log.contains("visit depth=1 top=0 isTop=false read=true"));
    }

    @Test
    public void testReplacementsLoggedAtLevelOne() {
        WalkerOptions options = new WalkerOptions();
        options.walkOptions.debugLevel = 1;
        this.walker(options).walk(this.program(), (node, data, top, isTop, read) -> {
            if (node instanceof ASTSymbol symbol && symbol.name.equals("y"))
                return Linq.list(lit(0));
            return null;
        }, null);
        String log = this.log.toString();
        Assert.assertTrue(log, log.contains("Callback replaced y with 1 node(s)"));
        Assert.assertFalse(log, log.contains("Processing"));
    }

    @Test
    public void testPerClassLevel() {
        WalkerOptions options = new WalkerOptions();
        options.ioOptions.loggingLevel.put("ASTDispatcher", "3");
        this.walker(options).walk(this.program(), (node, data, top, isTop, read) -> null, null);
        String log = this.log.toString();
        Assert.assertTrue(log, log.contains("LAMBDA FUNCTION_DEF"));
        Assert.assertTrue(log, log.contains("Processing top-level node"));
        // the walker itself stays silent
        Assert.assertFalse(log, log.contains("visit "));
    }

    @Test
    public void testUnknownLoggingClass() {
        WalkerOptions options = new WalkerOptions();
        options.ioOptions.loggingLevel.put("NoSuchClass", "1");
        Assert.assertThrows(InputError.class, () -> this.walker(options));
    }

    @Test
    public void testBadLoggingLevel() {
        WalkerOptions options = new WalkerOptions();
        options.ioOptions.loggingLevel.put("ASTWalker", "high");
        Assert.assertThrows(InputError.class, () -> this.walker(options));
    }
}
