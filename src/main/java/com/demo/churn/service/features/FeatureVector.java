package com.demo.churn.service.features;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Ordered numeric input of the classifier. Immutable; arrays are copied in and out. */
public final class FeatureVector {

    private final List<String> names;
    private final double[] values;

    public FeatureVector(List<String> names, double[] values) {
        if (names.size() != values.length) {
            throw new IllegalArgumentException("names/values length mismatch: " + names.size() + " vs " + values.length);
        }
        this.names = List.copyOf(names);
        this.values = values.clone();
    }

    public static FeatureVector of(double... values) {
        return new FeatureVector(FeatureSchema.MODEL_FEATURES, values);
    }

    public int size() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    public double get(String name) {
        int i = names.indexOf(name);
        if (i < 0) throw new IllegalArgumentException("Unknown feature: " + name);
        return values[i];
    }

    @JsonIgnore
    public List<String> getNames() {
        return names;
    }

    public double[] toArray() {
        return values.clone();
    }

    @JsonValue
    public Map<String, Double> asMap() {
        Map<String, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) m.put(names.get(i), values[i]);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector)) return false;
        FeatureVector that = (FeatureVector) o;
        return names.equals(that.names) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * names.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
