package com.dcruver.themerank.cluster;

/**
 * Projects row vectors into a lower-dimensional space.
 */
public interface DimensionReducer {

    double[][] reduce(double[][] rows);

    String name();

    int components();
}
