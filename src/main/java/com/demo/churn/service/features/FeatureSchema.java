package com.demo.churn.service.features;

import java.util.List;

/**
 * Column order the classifier was trained with. The model artifact must declare exactly
 * this list; a mismatch would silently score customers on the wrong columns.
 * Note the two names containing a space, they are part of the trained schema.
 */
public final class FeatureSchema {

    private FeatureSchema() {}

    public static final String CREDIT_SCORE = "creditscore";
    public static final String AGE = "age";
    public static final String TENURE = "tenure";
    public static final String BALANCE = "balance";
    public static final String PRODUCTS = "numofproducts";
    public static final String HAS_CARD = "hascrcard";
    public static final String ACTIVE = "isactivemember";
    public static final String SALARY = "estimatedsalary";
    public static final String COMPLAIN = "complain";
    public static final String SATISFACTION = "satisfaction score";
    public static final String POINTS = "point earned";
    public static final String MALE = "Male";
    public static final String GERMANY = "Germany";
    public static final String SPAIN = "Spain";
    public static final String GOLD = "GOLD";
    public static final String PLATINUM = "PLATINUM";
    public static final String SILVER = "SILVER";

    public static final List<String> MODEL_FEATURES = List.of(
            CREDIT_SCORE, AGE, TENURE, BALANCE, PRODUCTS, HAS_CARD, ACTIVE, SALARY, COMPLAIN,
            SATISFACTION, POINTS, MALE, GERMANY, SPAIN, GOLD, PLATINUM, SILVER);

    public static int size() {
        return MODEL_FEATURES.size();
    }

    public static int indexOf(String feature) {
        return MODEL_FEATURES.indexOf(feature);
    }
}
