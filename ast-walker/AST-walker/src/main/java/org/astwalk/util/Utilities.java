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

package org.astwalk.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.astwalk.walker.errors.InputError;
import org.astwalk.walker.errors.InternalWalkerError;
import org.jetbrains.annotations.Contract;

import javax.annotation.Nullable;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class Utilities {
    private Utilities() {}

    public static String getCurrentStackTrace() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();
        StringBuilder stackTraceBuilder = new StringBuilder();
        for (int i = 3; i < stackTrace.length; i++) {
            stackTraceBuilder.append(stackTrace[i].toString()).append("\n");
        }
        return stackTraceBuilder.toString();
    }

    /** A custom version of assert.  We would like to use assert,
     * but it is compiled out in release.
     * @param expression  When this expression is false, this function throws. */
    @Contract("false -> fail")
    public static void enforce(boolean expression) {
        if (!expression) {
            throw new InternalWalkerError(
                    "Assertion failed" + System.lineSeparator() + getCurrentStackTrace());
        }
    }

    /** A custom version of assert.  We would like to use assert,
     * but it is compiled out in release.
     * @param expression  When this expression is false, this function throws.
     * @param message     Message for exception when expression is false */
    @Contract("false, _ -> fail")
    public static void enforce(boolean expression, String message) {
        if (!expression)
            throw new InternalWalkerError(message + System.lineSeparator() + getCurrentStackTrace());
    }

    /** Escape special characters in a string. */
    public static String escape(String value) {
        StringBuilder builder = new StringBuilder();
        final int length = value.length();
        for (int offset = 0; offset < length; ) {
            final int c = value.codePointAt(offset);
            if (c == '\\')
                builder.append("\\\\");
            else if (c == '\"' )
                builder.append("\\\"");
            else if (c == '\r' )
                builder.append("\\r");
            else if (c == '\n' )
                builder.append("\\n");
            else if (c == '\t' )
                builder.append("\\t");
            else if (c < 32 || c >= 127) {
                builder.append("\\u{");
                builder.append(String.format("%04x", c));
                builder.append("}");
            } else
                builder.append((char)c);
            offset += Character.charCount(c);
        }
        return builder.toString();
    }

    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper
                .builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    /** Add double quotes around string and escape symbols that need it. */
    public static String doubleQuote(String value) {
        return "\"" + escape(value) + "\"";
    }

    /** Just adds single quotes around a string.  No escaping is performed. */
    public static String singleQuote(@Nullable String other) {
        return "'" + other + "'";
    }

    public static String readFile(Path filename) throws IOException {
        List<String> lines = Files.readAllLines(filename, StandardCharsets.UTF_8);
        return String.join(System.lineSeparator(), lines);
    }

    public static void writeFile(Path filename, String contents) throws IOException {
        try (FileWriter writer = new FileWriter(filename.toFile(), StandardCharsets.UTF_8)) {
            writer.write(contents);
        }
    }

    /** Serialize a JSON object on one line, truncating strings that are too long. */
    public static String toDepth(JsonNode node, int maxLength) {
        String result = node.toString();
        if (result.length() > maxLength)
            return result.substring(0, maxLength) + "...";
        return result;
    }

    public static JsonNode getProperty(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null)
            throw new InputError("Node does not have property " + Utilities.singleQuote(property) +
                    " " + Utilities.toDepth(node, 80));
        return prop;
    }

    public static boolean getBooleanProperty(JsonNode node, String property) {
        JsonNode prop = Utilities.getProperty(node, property);
        return prop.asBoolean();
    }

    public static String getStringProperty(JsonNode node, String property) {
        JsonNode prop = Utilities.getProperty(node, property);
        return prop.asText();
    }

    public static int getIntProperty(JsonNode node, String property) {
        JsonNode prop = Utilities.getProperty(node, property);
        return prop.asInt();
    }

    public static long getLongProperty(JsonNode node, String property) {
        JsonNode prop = Utilities.getProperty(node, property);
        return prop.asLong();
    }

    @Nullable
    public static String getOptionalStringProperty(JsonNode node, String property) {
        JsonNode prop = node.get(property);
        if (prop == null || prop.isNull())
            return null;
        return prop.asText();
    }
}
