package com.graphkit.dot.model;

/**
 * The two kinds of nested scope. Clusters are drawn with an enclosing boundary by
 * the renderer, plain subgraphs only scope attributes and rank constraints.
 */
public enum GroupKind {
    CLUSTER,
    SUBGRAPH
}
