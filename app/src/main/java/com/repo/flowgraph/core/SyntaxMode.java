package com.repo.flowgraph.core;

/**
 * Surface syntax of the input text, inferred by the normalizer.
 */
public enum SyntaxMode {

    /** C/Java style: blocks delimited by braces, statements ended by ';'. */
    BRACE,

    /** Python style: blocks delimited by indentation, ':' opens a block. */
    INDENTATION
}
