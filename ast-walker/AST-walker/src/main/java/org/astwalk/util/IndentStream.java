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

import org.astwalk.walker.errors.InternalWalkerError;

import java.io.IOException;

/** An {@link IIndentStream} writing to an {@link Appendable}.
 * Each indentation level adds four spaces; the indentation is emitted
 * lazily, before the first character that follows a newline. */
public class IndentStream implements IIndentStream {
    static final int INDENT = 4;

    private Appendable stream;
    private int level = 0;
    private boolean atLineStart = false;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
    }

    /** Set the output stream.
     * @return The previous output stream. */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    void write(CharSequence data) {
        try {
            this.stream.append(data);
        } catch (IOException ex) {
            throw new InternalWalkerError("Could not write to output stream", ex);
        }
    }

    void indentIfNeeded() {
        if (this.atLineStart) {
            this.atLineStart = false;
            this.write(" ".repeat(this.level * INDENT));
        }
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            this.write("\n");
            this.atLineStart = true;
        } else {
            this.indentIfNeeded();
            this.write(String.valueOf(c));
        }
        return this;
    }

    @Override
    public IIndentStream appendFast(String s) {
        if (!s.isEmpty()) {
            this.indentIfNeeded();
            this.write(s);
        }
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.level++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        Utilities.enforce(this.level > 0, "Negative indentation");
        this.level--;
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
