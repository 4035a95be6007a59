package org.astwalk;

import com.fasterxml.jackson.databind.JsonNode;
import org.astwalk.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class WalkerMainTests {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final ByteArrayOutputStream err = new ByteArrayOutputStream();

    int run(String... argv) {
        return WalkerMain.execute(
                new PrintStream(this.out, true, StandardCharsets.UTF_8),
                new PrintStream(this.err, true, StandardCharsets.UTF_8),
                argv);
    }

    String output() {
        return this.out.toString(StandardCharsets.UTF_8);
    }

    String errors() {
        return this.err.toString(StandardCharsets.UTF_8);
    }

    static File inputFile() throws IOException {
        File file = File.createTempFile("tree", ".json");
        file.deleteOnExit();
        try (InputStream stream = WalkerMainTests.class.getResourceAsStream("/sum.json")) {
            Assert.assertNotNull(stream);
            Utilities.writeFile(file.toPath(), new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        }
        return file;
    }

    @Test
    public void testTextOutput() throws IOException {
        File input = inputFile();
        int exitCode = this.run(input.getPath());
        Assert.assertEquals(this.errors(), 0, exitCode);
        String output = this.output();
        Assert.assertTrue(output, output.startsWith("(lambda (args a::Array{Float64,1}) (meta) (body"));
        Assert.assertTrue(output, output.contains("(call copy a)"));
    }

    @Test
    public void testJsonOutputToFile() throws IOException {
        File input = inputFile();
        File output = File.createTempFile("walked", ".json");
        output.deleteOnExit();
        int exitCode = this.run("--json", "--copy-routine", "duplicate", "-o", output.getPath(), input.getPath());
        Assert.assertEquals(this.errors(), 0, exitCode);
        Assert.assertEquals("", this.output());
        JsonNode json = Utilities.deterministicObjectMapper().readTree(Utilities.readFile(output.toPath()));
        Assert.assertEquals("ASTExpr", json.get("class").asText());
        Assert.assertEquals("lambda", json.get("kind").asText());
        String text = json.toString();
        Assert.assertTrue(text, text.contains("\"duplicate\""));
        Assert.assertFalse(text, text.contains("\"copy\""));
    }

    @Test
    public void testTrace() throws IOException {
        File input = inputFile();
        int exitCode = this.run("--trace", input.getPath());
        Assert.assertEquals(this.errors(), 0, exitCode);
        String trace = this.errors();
        Assert.assertTrue(trace, trace.contains("[0 write] a::Array{Float64,1}"));
        Assert.assertTrue(trace, trace.contains("[6 top] (return"));
    }

    @Test
    public void testLoggingOption() throws IOException {
        File input = inputFile();
        int exitCode = this.run("-TASTDispatcher=2", input.getPath());
        Assert.assertEquals(this.errors(), 0, exitCode);
        Assert.assertTrue(this.errors().contains("Processing top-level node #6 depth=2"));
    }

    @Test
    public void testMissingInput() {
        int exitCode = this.run("no_such_file.json");
        Assert.assertEquals(1, exitCode);
        Assert.assertTrue(this.errors(), this.errors().contains("ERROR Error reading file"));
    }

    @Test
    public void testMalformedInput() throws IOException {
        File input = File.createTempFile("bad", ".json");
        input.deleteOnExit();
        Utilities.writeFile(input.toPath(), "{\"class\": \"ASTExpr\", \"kind\": \"while\", \"children\": []}");
        int exitCode = this.run(input.getPath());
        Assert.assertEquals(1, exitCode);
        Assert.assertTrue(this.errors(), this.errors().contains("ERROR Unknown node kind"));
    }

    @Test
    public void testInvalidDebugLevel() {
        int exitCode = this.run("-d", "7", "x.json");
        Assert.assertEquals(1, exitCode);
        Assert.assertTrue(this.errors(), this.errors().contains("Debug level"));
    }

    @Test
    public void testUnknownOption() {
        Assert.assertEquals(1, this.run("--frobnicate"));
    }

    @Test
    public void testHelp() {
        Assert.assertEquals(1, this.run("-h"));
        Assert.assertTrue(this.errors(), this.errors().contains("--copy-routine"));
    }
}
