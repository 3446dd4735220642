package com.demo.churn.service.validation;

import com.demo.churn.model.Country;
import com.demo.churn.model.CustomerRecord;
import com.demo.churn.model.CustomerTier;
import com.demo.churn.model.Gender;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Checks a raw record before it reaches the encoder. Pure: no logging, no state.
 * Every violation found is reported, not only the first one.
 */
@Component
public class CustomerValidator {

    /** Inclusive domain ranges, keyed by record field name. */
    static final Map<String, double[]> RANGES = ranges();

    private static Map<String, double[]> ranges() {
        Map<String, double[]> m = new LinkedHashMap<>();
        m.put("credit_score", new double[]{300, 900});
        m.put("age", new double[]{18, 100});
        m.put("tenure", new double[]{0, 20});
        m.put("balance", new double[]{0, 300_000});
        m.put("num_of_products", new double[]{1, 4});
        m.put("estimated_salary", new double[]{0, 300_000});
        m.put("satisfaction_score", new double[]{0, 5});
        m.put("point_earned", new double[]{0, 100_000});
        return m;
    }

    public ValidationResult validate(CustomerRecord record) {
        List<FieldViolation> out = new ArrayList<>();
        if (record == null) {
            out.add(FieldViolation.error("record", "required", "Customer record is required"));
            return new ValidationResult(out);
        }

        Map<String, Number> numbers = numericFields(record);
        Map<String, Object> others = otherFields(record);

        // (a) presence and type
        for (Map.Entry<String, String> bad : record.getUnparsedFields().entrySet()) {
            out.add(FieldViolation.error(bad.getKey(), "type",
                    bad.getKey() + " has an invalid value: '" + bad.getValue() + "'"));
        }
        numbers.forEach((field, value) -> {
            if (value == null && !record.getUnparsedFields().containsKey(field)) {
                out.add(FieldViolation.error(field, "required", "Field " + field + " is required"));
            }
        });
        others.forEach((field, value) -> {
            boolean blank = value == null || (value instanceof String && ((String) value).isBlank());
            if (blank && !record.getUnparsedFields().containsKey(field)) {
                out.add(FieldViolation.error(field, "required", "Field " + field + " is required"));
            }
        });

        // (b) numeric ranges
        numbers.forEach((field, value) -> {
            if (value == null) return;
            double[] r = RANGES.get(field);
            double v = value.doubleValue();
            if (Double.isNaN(v) || v < r[0] || v > r[1]) {
                out.add(FieldViolation.error(field, "range", String.format(
                        "%s must be between %s and %s, got %s", field, fmt(r[0]), fmt(r[1]), value)));
            }
        });

        // (c) categorical values
        checkAllowed(out, "gender", record.getGender(), Gender::fromLabel, Gender.values(), Gender::getLabel);
        checkAllowed(out, "country", record.getCountry(), Country::fromLabel, Country.values(), Country::getLabel);
        checkAllowed(out, "category", record.getTier(), CustomerTier::fromLabel, CustomerTier.values(), Enum::name);

        // (d) business rules
        out.addAll(businessRules(record));

        return new ValidationResult(out);
    }

    List<FieldViolation> businessRules(CustomerRecord r) {
        List<FieldViolation> out = new ArrayList<>();
        if (r.getAge() != null && r.getEstimatedSalary() != null
                && r.getAge() < 25 && r.getEstimatedSalary() > 150_000) {
            out.add(FieldViolation.error("age,estimated_salary", "rule",
                    "Inconsistent profile: age too young for such a high salary"));
        }
        if (r.getCreditScore() != null && r.getBalance() != null
                && r.getCreditScore() < 400 && r.getBalance() > 200_000) {
            out.add(FieldViolation.error("credit_score,balance", "rule",
                    "Inconsistent profile: credit score too low for such a high balance"));
        }
        if (r.getProductCount() != null && r.getActiveMember() != null
                && r.getProductCount() >= 4 && !r.getActiveMember()) {
            out.add(FieldViolation.error("num_of_products,is_active_member", "rule",
                    "Inconsistent profile: customer holds 4 products but is not an active member"));
        }
        if (r.getSatisfactionScore() != null && r.getSatisfactionScore() == 0) {
            out.add(FieldViolation.warning("satisfaction_score", "rule",
                    "Satisfaction score 0 is below the 1-5 scale of the reference population"));
        }
        return out;
    }

    private static <E> void checkAllowed(List<FieldViolation> out, String field, String raw,
                                         Function<String, Optional<E>> parser, E[] allowed,
                                         Function<E, String> label) {
        if (raw == null || raw.isBlank()) return;
        if (parser.apply(raw).isEmpty()) {
            String values = Arrays.stream(allowed).map(label).collect(Collectors.joining(", "));
            out.add(FieldViolation.error(field, "allowed",
                    field + " must be one of [" + values + "], got '" + raw + "'"));
        }
    }

    private static Map<String, Number> numericFields(CustomerRecord r) {
        Map<String, Number> m = new LinkedHashMap<>();
        m.put("credit_score", r.getCreditScore());
        m.put("age", r.getAge());
        m.put("tenure", r.getTenure());
        m.put("balance", r.getBalance());
        m.put("num_of_products", r.getProductCount());
        m.put("estimated_salary", r.getEstimatedSalary());
        m.put("satisfaction_score", r.getSatisfactionScore());
        m.put("point_earned", r.getLoyaltyPoints());
        return m;
    }

    private static Map<String, Object> otherFields(CustomerRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("gender", r.getGender());
        m.put("country", r.getCountry());
        m.put("category", r.getTier());
        m.put("has_credit_card", r.getHasCreditCard());
        m.put("is_active_member", r.getActiveMember());
        m.put("complain", r.getHasComplaint());
        return m;
    }

    private static String fmt(double d) {
        return d == Math.rint(d) ? String.valueOf((long) d) : String.valueOf(d);
    }
}
