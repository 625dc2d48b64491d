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

package org.opendigraph.circuit;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.opendigraph.circuit.rules.RewriteRule;
import org.opendigraph.util.Linq;
import org.opendigraph.util.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Options controlling circuit evaluation.  The defaults work without parsing anything. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CircuitOptions {
    @Parameter(names = "--maxRewriteSteps",
            description = "Maximum number of rule applications in one evaluation; 0 picks a bound from the circuit size")
    public int maxRewriteSteps = 0;
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = "--disable",
            description = "Comma-separated names of rewrite rules that are not applied")
    public List<String> disabledRules = new ArrayList<>();

    public static CircuitOptions parse(String... args) {
        CircuitOptions result = new CircuitOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(result)
                .build();
        commander.setProgramName("boolcirc");
        commander.parse(args);
        result.validate();
        return result;
    }

    /** @throws ParameterException if some option has an illegal value. */
    public void validate() {
        if (this.maxRewriteSteps < 0)
            throw new ParameterException("--maxRewriteSteps must not be negative: " + this.maxRewriteSteps);
        List<String> known = Linq.map(RewriteRule.all(), RewriteRule::getName);
        for (String rule: this.disabledRules) {
            if (!known.contains(rule))
                throw new ParameterException("Unknown rewrite rule " + rule + "; known rules are " + known);
        }
        for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
            try {
                Integer.parseInt(entry.getValue());
            } catch (NumberFormatException ex) {
                throw new ParameterException("-T " + entry.getKey() + "=" + entry.getValue() +
                        ": logging level must be an integer", ex);
            }
        }
    }

    /** Set the logging levels requested with -T. */
    public void applyLoggingLevels() {
        for (Map.Entry<String, String> entry: this.loggingLevel.entrySet())
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), Integer.parseInt(entry.getValue()));
    }

    /** The rewrite rules that are enabled, in the order they are tried. */
    public List<RewriteRule> enabledRules() {
        return Linq.where(RewriteRule.all(), r -> !this.disabledRules.contains(r.getName()));
    }

    /** The rewrite step bound for a circuit with the specified number of nodes and edges. */
    public int rewriteLimit(int nodes, int edges) {
        if (this.maxRewriteSteps > 0)
            return this.maxRewriteSteps;
        return 16 * (nodes + edges) + 64;
    }

    @Override
    public String toString() {
        return "CircuitOptions{" +
                "\n\tmaxRewriteSteps=" + this.maxRewriteSteps +
                ",\n\tloggingLevel=" + this.loggingLevel +
                ",\n\tdisabledRules=" + this.disabledRules +
                '}';
    }
}
