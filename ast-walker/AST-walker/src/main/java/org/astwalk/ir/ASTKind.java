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

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** The kinds of composite nodes in the IR.  Each kind knows how
 * its children must be traversed. */
public enum ASTKind {
    // Function definitions and statement lists
    LAMBDA("lambda", RecursionRule.FUNCTION_DEF),
    // A function definition with a signature and a body
    FUNCTION("function", RecursionRule.SECOND),
    BODY("body", RecursionRule.BLOCK),
    BLOCK("block", RecursionRule.BLOCK),
    // Parameter lists, dimension lists
    ARGS("args", RecursionRule.SEQUENCE),
    RETURN("return", RecursionRule.SEQUENCE),

    // Assignments
    ASSIGN("=", RecursionRule.ASSIGNMENT),
    ADD_ASSIGN("+=", RecursionRule.ASSIGNMENT),

    // Expressions
    FIELD_ACCESS(".", RecursionRule.BLOCK),
    TYPE_ASSERT("::", RecursionRule.FIRST),
    CALL("call", RecursionRule.CALL),
    // Call with 1-based indexing semantics
    CALL1("call1", RecursionRule.CALL),
    GET_INDEX("getindex", RecursionRule.ALL),
    NEW("new", RecursionRule.ALL),
    FOR("for", RecursionRule.ALL),
    TYPED_COMPREHENSION("typed_comprehension", RecursionRule.ALL),
    COMPREHENSION("comprehension", RecursionRule.ALL),
    RANGE(":", RecursionRule.ALL),
    TUPLE("tuple", RecursionRule.ALL),
    CCALL("ccall", RecursionRule.ALL),
    REF("ref", RecursionRule.ALL),

    // Control flow
    GOTO_IF_NOT("gotoifnot", RecursionRule.PAIR),
    TYPE_GOTO("type_goto", RecursionRule.PAIR),

    // Arrays
    ARRAY_SIZE("arraysize", RecursionRule.PAIR),
    ALLOC("alloc", RecursionRule.ALLOC),
    // Array copy; the walker turns it back into a plain call
    COPY("copy", RecursionRule.REQUEUE_AS_CALL),

    // Markers whose contents are never inspected
    LINE("line", RecursionRule.SKIP),
    COPY_AST("copyast", RecursionRule.SKIP),
    BOUNDS_CHECK("boundscheck", RecursionRule.SKIP),
    ENTER("enter", RecursionRule.SKIP),
    LEAVE("leave", RecursionRule.SKIP),
    THE_EXCEPTION("the_exception", RecursionRule.SKIP),
    ADDRESS_OF("&", RecursionRule.SKIP),
    VCAT("vcat", RecursionRule.SKIP),
    META("meta", RecursionRule.SKIP),
    CONST("const", RecursionRule.SKIP),

    // Surface forms which are lowered before reaching the walker
    IF("if", RecursionRule.REJECT),
    WHILE("while", RecursionRule.REJECT),
    TRY("try", RecursionRule.REJECT),
    MACRO_CALL("macrocall", RecursionRule.REJECT),
    QUOTE("quote", RecursionRule.REJECT),
    GLOBAL("global", RecursionRule.REJECT),
    LOCAL("local", RecursionRule.REJECT),
    KEYWORD("kw", RecursionRule.REJECT),
    LET("let", RecursionRule.REJECT),
    STATIC_TYPEOF("static_typeof", RecursionRule.REJECT),
    ;

    private final String text;
    public final RecursionRule rule;

    ASTKind(String text, RecursionRule rule) {
        this.text = text;
        this.rule = rule;
    }

    static final Map<String, ASTKind> byText = new HashMap<>();

    static {
        for (ASTKind kind: ASTKind.values())
            byText.put(kind.text, kind);
    }

    /** The kind with the specified printed representation, or null if there is none. */
    @Nullable
    public static ASTKind fromText(String text) {
        return byText.get(text);
    }

    /** True for the kinds that represent statement blocks. */
    public boolean isBlock() {
        return this == BODY || this == BLOCK;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
