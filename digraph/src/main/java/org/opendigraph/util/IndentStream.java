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

package org.opendigraph.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/** An {@link IIndentStream} writing to an {@link Appendable}.
 * The indentation of a line is written when its first character arrives,
 * so empty lines carry no trailing spaces. */
public class IndentStream implements IIndentStream {
    /** Spaces per nesting level */
    static final int STEP = 4;

    private Appendable output;
    int depth;
    boolean atLineStart;

    public IndentStream(Appendable output) {
        this.output = output;
        this.depth = 0;
        this.atLineStart = false;
    }

    /** Redirect the output.
     * @return The previous output. */
    public Appendable setOutputStream(Appendable output) {
        Appendable result = this.output;
        this.output = output;
        return result;
    }

    private void write(CharSequence text) {
        try {
            this.output.append(text);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private void startLine() {
        if (!this.atLineStart)
            return;
        this.atLineStart = false;
        this.write(" ".repeat(STEP * this.depth));
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            this.write("\n");
            this.atLineStart = true;
        } else {
            this.startLine();
            this.write(String.valueOf(c));
        }
        return this;
    }

    @Override
    public IIndentStream appendFast(String string) {
        if (string.isEmpty())
            return this;
        this.startLine();
        this.write(string);
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.depth++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        Utilities.enforce(this.depth > 0, "Indentation decreased below zero");
        this.depth--;
        return this;
    }

    @Override
    public String toString() {
        return this.output.toString();
    }
}
