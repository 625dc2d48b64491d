package org.opendigraph.graph.io;

/** Shapes of random graphs. */
public enum GraphForm {
    /** Any multigraph, self loops included */
    FREE(false, false, false, false),
    /** Edges only go from lower to higher ids */
    DAG(true, false, false, true),
    /** No pair of nodes is connected in both directions */
    ORIENTED(true, false, true, false),
    LOOP_FREE(true, false, false, false),
    /** Every edge has a reverse edge with the same multiplicity */
    UNDIRECTED(false, true, false, false),
    LOOP_FREE_UNDIRECTED(true, true, false, false);

    public final boolean nullDiagonal;
    public final boolean symmetric;
    public final boolean oriented;
    public final boolean dag;

    GraphForm(boolean nullDiagonal, boolean symmetric, boolean oriented, boolean dag) {
        this.nullDiagonal = nullDiagonal;
        this.symmetric = symmetric;
        this.oriented = oriented;
        this.dag = dag;
    }
}
