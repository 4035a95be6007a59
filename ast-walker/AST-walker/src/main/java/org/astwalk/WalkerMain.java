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

package org.astwalk;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.astwalk.ir.IASTNode;
import org.astwalk.util.IIndentStream;
import org.astwalk.util.IndentStream;
import org.astwalk.util.Logger;
import org.astwalk.util.Utilities;
import org.astwalk.walker.IErrorReporter;
import org.astwalk.walker.StderrErrorReporter;
import org.astwalk.walker.WalkerOptions;
import org.astwalk.walker.backend.ASTJsonDecoder;
import org.astwalk.walker.errors.BaseWalkerException;
import org.astwalk.walker.expand.JsonUnitExpander;
import org.astwalk.walker.visitors.ASTWalker;
import org.astwalk.walker.visitors.TraceCallback;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/** Command-line driver: reads a JSON-encoded tree, walks it, and prints the result. */
public class WalkerMain {
    final WalkerOptions options;
    final PrintStream out;
    final PrintStream err;
    final IErrorReporter reporter;

    WalkerMain(PrintStream out, PrintStream err) {
        this.options = new WalkerOptions();
        this.out = out;
        this.err = err;
        this.reporter = new StderrErrorReporter(err);
    }

    WalkerMain() {
        this(System.out, System.err);
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("ast-walker");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            this.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            StringBuilder usage = new StringBuilder();
            commander.getUsageFormatter().usage(usage);
            this.err.println(usage);
            return 1;
        }
        if (!this.options.validate(this.reporter))
            return 1;
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        String outputFile = this.options.ioOptions.outputFile;
        if (outputFile.isEmpty())
            return this.out;
        return new PrintStream(Files.newOutputStream(Paths.get(outputFile)), false, StandardCharsets.UTF_8);
    }

    String readInput(@Nullable String inputFile) throws IOException {
        if (inputFile == null) {
            InputStream stream = System.in;
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Utilities.readFile(Paths.get(inputFile));
    }

    /** Run the walker, return exit code. */
    int run() {
        String input;
        try {
            input = this.readInput(this.options.ioOptions.inputFile);
        } catch (IOException e) {
            this.reporter.reportError("Error reading file",
                    Utilities.singleQuote(this.options.ioOptions.inputFile) + " " + e.getMessage());
            return 1;
        }

        try {
            IASTNode tree = new ASTJsonDecoder().decode(input);
            ASTWalker walker = new ASTWalker(this.options, new JsonUnitExpander(), new Logger(this.err));
            IASTNode result;
            if (this.options.ioOptions.trace) {
                IIndentStream trace = new IndentStream(this.err);
                result = walker.walk(tree, new TraceCallback(), trace);
            } else {
                result = walker.walk(tree, (node, data, top, isTop, read) -> null, null);
            }

            PrintStream stream = this.getOutputStream();
            if (this.options.ioOptions.emitJson)
                stream.println(result.asJson().toPrettyString());
            else
                stream.println(result);
            if (stream != this.out)
                stream.close();
        } catch (BaseWalkerException ex) {
            this.reporter.reportError(ex.getErrorKind(), ex.getMessage());
            return 1;
        } catch (IOException e) {
            this.reporter.reportError("Error writing to output file", e.getMessage());
            return 1;
        }
        return 0;
    }

    static int execute(PrintStream out, PrintStream err, String... argv) {
        WalkerMain main = new WalkerMain(out, err);
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0)
            return exitCode;
        return main.run();
    }

    public static int execute(String... argv) {
        return execute(System.out, System.err, argv);
    }

    public static void main(String[] argv) {
        System.exit(execute(argv));
    }
}
