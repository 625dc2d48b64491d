package org.opendigraph.graph.io;

import org.opendigraph.graph.OpenDigraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/** Random matrices and graphs, mostly useful for testing.
 * All randomness comes from the supplied {@link Random}, so results are reproducible. */
public final class RandomGraphs {
    private RandomGraphs() {}

    /** A list of n integers between 0 and bound, inclusive.
     * @param unique  If true, no value appears twice. */
    public static List<Integer> randomIntList(Random random, int n, int bound, boolean unique) {
        if (n < 0 || bound < 0)
            throw new IllegalArgumentException("Negative size or bound");
        if (unique) {
            if (n > bound + 1)
                throw new IllegalArgumentException("Cannot draw " + n + " distinct values from 0.." + bound);
            List<Integer> values = new ArrayList<>(bound + 1);
            for (int i = 0; i <= bound; i++)
                values.add(i);
            Collections.shuffle(values, random);
            return new ArrayList<>(values.subList(0, n));
        }
        List<Integer> result = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            result.add(random.nextInt(bound + 1));
        return result;
    }

    /** A random n x n matrix with entries between 0 and bound.
     * @param nullDiagonal  Zero the diagonal.
     * @param symmetric     Mirror the upper triangle into the lower one.
     * @param oriented      For every positive entry above the diagonal, zero the mirrored entry.
     * @param dag           Zero everything below the diagonal. */
    public static int[][] randomIntMatrix(Random random, int n, int bound,
                                          boolean nullDiagonal, boolean symmetric,
                                          boolean oriented, boolean dag) {
        if (symmetric && (oriented || dag))
            throw new IllegalArgumentException("A matrix cannot be symmetric and oriented or acyclic");
        int[][] result = new int[n][];
        for (int i = 0; i < n; i++)
            result[i] = randomIntList(random, n, bound, false).stream().mapToInt(Integer::intValue).toArray();
        for (int i = 0; i < n; i++) {
            if (nullDiagonal || dag)
                result[i][i] = 0;
            for (int j = i + 1; j < n; j++) {
                if (symmetric)
                    result[j][i] = result[i][j];
                if (oriented && result[i][j] > 0)
                    result[j][i] = 0;
                if (dag)
                    result[j][i] = 0;
            }
        }
        return result;
    }

    public static int[][] randomIntMatrix(Random random, int n, int bound, GraphForm form) {
        return randomIntMatrix(random, n, bound, form.nullDiagonal, form.symmetric, form.oriented, form.dag);
    }

    /** A random well-formed graph with n inner nodes.
     * @param inputs   Number of input nodes; each feeds a random inner node.
     * @param outputs  Number of output nodes; each is fed by a random inner node. */
    public static OpenDigraph random(Random random, int n, int bound, int inputs, int outputs, GraphForm form) {
        if (inputs < 0 || outputs < 0)
            throw new IllegalArgumentException("Negative number of inputs or outputs");
        if (n == 0 && inputs + outputs > 0)
            throw new IllegalArgumentException("Cannot attach inputs or outputs to an empty graph");
        OpenDigraph result = AdjacencyMatrix.toGraph(randomIntMatrix(random, n, bound, form));
        for (int i = 0; i < inputs; i++)
            result.addInputNode(random.nextInt(n));
        for (int i = 0; i < outputs; i++)
            result.addOutputNode(random.nextInt(n));
        return result;
    }
}
