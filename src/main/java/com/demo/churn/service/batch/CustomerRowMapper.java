package com.demo.churn.service.batch;

import com.demo.churn.model.CustomerRecord;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Turns one untyped batch row (CSV cells or a JSON object) into a {@link CustomerRecord}.
 * Never fails: a cell that cannot be read as its field's type is kept as unparsed text on
 * the record, and the validator reports it against that row.
 */
@Component
public class CustomerRowMapper {

    /** Field under which a row that is malformed as a whole is reported. */
    public static final String ROW_FIELD = "row";

    public CustomerRecord fromCells(Map<String, String> row, boolean decimalComma) {
        return build(row, decimalComma, CustomerRecord.builder());
    }

    public CustomerRecord fromJson(JsonNode node) {
        CustomerRecord.CustomerRecordBuilder b = CustomerRecord.builder();
        if (node == null || !node.isObject()) {
            b.unparsed(ROW_FIELD, node == null ? "null" : node.toString());
            return b.build();
        }
        Map<String, String> row = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            String key = e.getKey().trim().toLowerCase(Locale.ROOT);
            JsonNode v = e.getValue();
            if (v.isNull() || v.isMissingNode()) continue;
            if (v.isContainerNode()) {
                b.unparsed(key, v.toString());
                continue;
            }
            row.put(key, v.asText());
        }
        return build(row, false, b);
    }

    private static CustomerRecord build(Map<String, String> row, boolean decimalComma,
                                        CustomerRecord.CustomerRecordBuilder b) {
        b.customerId(blankToNull(row.get("customer_id")));
        b.gender(blankToNull(row.get("gender")));
        b.country(blankToNull(row.get("country")));
        b.tier(blankToNull(row.get("category")));

        b.age(integer(row, "age", decimalComma, b));
        b.creditScore(integer(row, "credit_score", decimalComma, b));
        b.tenure(integer(row, "tenure", decimalComma, b));
        b.productCount(integer(row, "num_of_products", decimalComma, b));
        b.satisfactionScore(integer(row, "satisfaction_score", decimalComma, b));
        b.loyaltyPoints(integer(row, "point_earned", decimalComma, b));
        b.balance(decimal(row, "balance", decimalComma, b));
        b.estimatedSalary(decimal(row, "estimated_salary", decimalComma, b));

        b.hasCreditCard(flag(row, "has_credit_card", b));
        b.activeMember(flag(row, "is_active_member", b));
        b.hasComplaint(flag(row, "complain", b));
        return b.build();
    }

    private static Integer integer(Map<String, String> row, String field, boolean decimalComma,
                                   CustomerRecord.CustomerRecordBuilder b) {
        Double d = decimal(row, field, decimalComma, b);
        if (d == null) return null;
        if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) {
            b.unparsed(field, row.get(field));
            return null;
        }
        return d.intValue();
    }

    private static Double decimal(Map<String, String> row, String field, boolean decimalComma,
                                  CustomerRecord.CustomerRecordBuilder b) {
        String raw = blankToNull(row.get(field));
        if (raw == null) return null;
        String s = decimalComma ? raw.replace(',', '.') : raw;
        double d;
        try {
            d = Double.parseDouble(s.replace(" ", ""));
        } catch (NumberFormatException e) {
            b.unparsed(field, raw);
            return null;
        }
        if (!Double.isFinite(d)) {
            b.unparsed(field, raw);
            return null;
        }
        return d;
    }

    static Boolean parseFlag(String raw) {
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "true":
            case "yes":
            case "y":
            case "oui":
                return Boolean.TRUE;
            case "0":
            case "false":
            case "no":
            case "n":
            case "non":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static Boolean flag(Map<String, String> row, String field, CustomerRecord.CustomerRecordBuilder b) {
        String raw = blankToNull(row.get(field));
        if (raw == null) return null;
        Boolean v = parseFlag(raw);
        if (v == null) b.unparsed(field, raw);
        return v;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
