package org.astwalk.util;

import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class UtilitiesTests {
    @Test
    public void testFilesAreUtf8() throws IOException {
        File file = File.createTempFile("walker", ".txt");
        file.deleteOnExit();
        String text = "λ → ü";
        Utilities.writeFile(file.toPath(), text);
        Assert.assertArrayEquals(text.getBytes(StandardCharsets.UTF_8), Files.readAllBytes(file.toPath()));
        Assert.assertEquals(text, Utilities.readFile(file.toPath()));
    }

    @Test
    public void testQuoting() {
        Assert.assertEquals("\"a\"", Utilities.doubleQuote("a"));
        Assert.assertEquals("'b'", Utilities.singleQuote("b"));
    }
}
