package com.demo.churn.service.explain;

import java.util.List;

/**
 * Fixed set of encoded reference rows. Immutable: rows are copied on the way in and
 * accessors hand out copies.
 */
public final class BackgroundSample {

    private final List<String> features;
    private final double[][] rows;
    private final String source;

    public BackgroundSample(List<String> features, double[][] rows, String source) {
        if (rows.length == 0) throw new IllegalArgumentException("background sample is empty");
        for (double[] r : rows) {
            if (r.length != features.size()) {
                throw new IllegalArgumentException("background row has " + r.length + " columns, expected " + features.size());
            }
        }
        this.features = List.copyOf(features);
        this.rows = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) this.rows[i] = rows[i].clone();
        this.source = source;
    }

    public List<String> features() {
        return features;
    }

    public int size() {
        return rows.length;
    }

    public String source() {
        return source;
    }

    public double[] row(int i) {
        return rows[i].clone();
    }

    /** Read-only view for the attribution loop, which never writes to it. */
    double[][] rowsView() {
        return rows;
    }
}
