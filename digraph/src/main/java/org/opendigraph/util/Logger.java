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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Per-class logging to an indenting stream on stderr.
 *
 * <p>Every class has a logging level, 0 unless set.  A message of level L
 * logged by a class is written only when the level of the class is at least L;
 * otherwise it goes to a stream that discards it.  A level set on a class also
 * applies to its subclasses. */
public final class Logger {
    /** There is only one instance of the logger for the whole program. */
    public static final Logger INSTANCE = new Logger();

    static final String BASE_PACKAGE = "org.opendigraph";
    /** Packages, relative to {@link #BASE_PACKAGE}, searched when a level is set by class name */
    static final List<String> PACKAGES = List.of("graph", "graph.algorithms", "graph.io", "circuit", "circuit.rules");

    private final Map<Class<?>, Integer> levels = new HashMap<>();
    private final IndentStream debugStream = new IndentStream(System.err);
    private final IIndentStream discard = new NullIndentStream();

    private Logger() {}

    /** The stream for a message of the specified level logged by a class. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        return this.getLoggingLevel(clazz) >= level ? this.debugStream : this.discard;
    }

    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    /** @return The level the class had before. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.levels.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    /** Set the level of a class given by its simple name, as on the command line.
     * @throws IllegalArgumentException if no package of the project has such a class. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        ClassLoader loader = Logger.class.getClassLoader();
        for (String pack: PACKAGES) {
            String name = BASE_PACKAGE + "." + pack + "." + className;
            if (loader.getResource(name.replace('.', '/') + ".class") == null)
                continue;
            try {
                return this.setLoggingLevel(Class.forName(name, false, loader), level);
            } catch (ClassNotFoundException ex) {
                throw new IllegalStateException("Class file found but class " + name + " cannot be loaded", ex);
            }
        }
        throw new IllegalArgumentException("No class " + Utilities.singleQuote(className) +
                " to set a logging level for in " + PACKAGES);
    }

    /** The level of the class, or of its closest superclass that has one. */
    public int getLoggingLevel(Class<?> clazz) {
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            Integer level = this.levels.get(c);
            if (level != null)
                return level;
        }
        return 0;
    }

    /** Redirect the log.  The indentation is kept.
     * @return The previous destination. */
    public Appendable setDebugStream(Appendable writer) {
        return this.debugStream.setOutputStream(writer);
    }
}
