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

/** A character sink that indents every line by the current nesting depth.
 * Graphs and circuits print themselves through it, one node per line. */
@SuppressWarnings("UnusedReturnValue")
public interface IIndentStream {
    /** Append one character; '\n' ends the current line. */
    IIndentStream appendChar(char c);

    /** Append text that contains no newline. */
    IIndentStream appendFast(String string);

    /** Append text that may span several lines; each new line is indented. */
    default IIndentStream append(String string) {
        int start = 0;
        for (int end = string.indexOf('\n'); end >= 0; end = string.indexOf('\n', start)) {
            this.appendFast(string.substring(start, end));
            this.newline();
            start = end + 1;
        }
        return this.appendFast(string.substring(start));
    }

    default IIndentStream append(int value) {
        return this.appendFast(Integer.toString(value));
    }

    /** Let an object print itself at the current indentation. */
    default IIndentStream append(ToIndentableString value) {
        value.toString(this);
        return this;
    }

    default IIndentStream newline() {
        return this.appendChar('\n');
    }

    /** Open a nested block: indent further and end the current line. */
    IIndentStream increase();

    /** Close a nested block; lines that follow are indented less. */
    IIndentStream decrease();
}
