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

package org.astwalk.walker;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.astwalk.util.IValidate;
import org.astwalk.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Options for the walker and for its command-line driver. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class WalkerOptions implements IValidate {
    /** Options which control the traversal. */
    @SuppressWarnings("CanBeFinal")
    public static class Walk implements IValidate {
        @Parameter(names = "--copy-routine",
                description = "Name of the routine that array copies are rewritten to call")
        public String copyRoutine = "copy";
        @Parameter(names = "--no-check-tree",
                description = "Do not check that the input is a tree before walking it")
        public boolean skipTreeCheck = false;
        @Parameter(names = "-d", description = "Debug level of the walker (0 to 3)")
        public int debugLevel = 0;

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (this.debugLevel < 0 || this.debugLevel > 3) {
                reporter.reportError("Invalid options",
                        "Debug level must be between 0 and 3, not " + this.debugLevel);
                return false;
            }
            if (this.copyRoutine.isEmpty()) {
                reporter.reportError("Invalid options", "The copy routine name cannot be empty");
                return false;
            }
            return true;
        }

        @Override
        public String toString() {
            return "Walk{" +
                    "\n\tcopyRoutine=" + Utilities.singleQuote(this.copyRoutine) +
                    ",\n\tskipTreeCheck=" + this.skipTreeCheck +
                    ",\n\tdebugLevel=" + this.debugLevel +
                    '}';
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-o", description = "Output file; stdout if not specified")
        public String outputFile = "";
        @Parameter(names = "--json", description = "Emit the walked tree as JSON instead of text")
        public boolean emitJson = false;
        @Parameter(names = "--trace", description = "Print every node offered to the callback")
        public boolean trace = false;
        @Parameter(description = "Input file containing a JSON-encoded tree; stdin if not specified")
        @Nullable
        public String inputFile = null;

        @Override
        public boolean validate(IErrorReporter reporter) {
            for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
                try {
                    Integer.parseInt(entry.getValue());
                } catch (NumberFormatException ex) {
                    reporter.reportError("Invalid options",
                            "-T option must be followed by 'class=number'; could not parse " + entry);
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                    ",\n\temitJson=" + this.emitJson +
                    ",\n\ttrace=" + this.trace +
                    ",\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    ",\n\tloggingLevel=" + this.loggingLevel +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;
    @ParametersDelegate
    public IO ioOptions = new IO();
    @ParametersDelegate
    public Walk walkOptions = new Walk();

    public WalkerOptions() {}

    @Override
    public String toString() {
        return "WalkerOptions{" +
                "\nhelp=" + this.help +
                ",\nioOptions=" + this.ioOptions +
                ",\nwalkOptions=" + this.walkOptions +
                "\n}";
    }

    @Override
    public boolean validate(IErrorReporter reporter) {
        return this.ioOptions.validate(reporter) &&
                this.walkOptions.validate(reporter);
    }
}
