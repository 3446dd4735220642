package com.demo.churn.service.batch;

import com.demo.churn.model.CustomerRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerRowMapperTest {

    private final CustomerRowMapper rows = new CustomerRowMapper();
    private final ObjectMapper json = new ObjectMapper();

    @Test
    void readsTypedJsonValues() throws Exception {
        JsonNode node = json.readTree("{\"customer_id\":\"C-1\",\"age\":42,\"balance\":1200.5,"
                + "\"has_credit_card\":true,\"complain\":0,\"gender\":\"Female\",\"satisfaction_score\":\"3\"}");

        CustomerRecord r = rows.fromJson(node);

        assertThat(r.getCustomerId()).isEqualTo("C-1");
        assertThat(r.getAge()).isEqualTo(42);
        assertThat(r.getBalance()).isEqualTo(1200.5);
        assertThat(r.getHasCreditCard()).isTrue();
        assertThat(r.getHasComplaint()).isFalse();
        assertThat(r.getSatisfactionScore()).isEqualTo(3);
        assertThat(r.getUnparsedFields()).isEmpty();
    }

    @Test
    void badlyTypedJsonValuesAreKeptAsUnparsed() throws Exception {
        JsonNode node = json.readTree("{\"age\":\"abc\",\"tenure\":2.5,\"balance\":[1,2],\"is_active_member\":\"maybe\"}");

        CustomerRecord r = rows.fromJson(node);

        assertThat(r.getAge()).isNull();
        assertThat(r.getTenure()).isNull();
        assertThat(r.getBalance()).isNull();
        assertThat(r.getActiveMember()).isNull();
        assertThat(r.getUnparsedFields())
                .containsEntry("age", "abc")
                .containsEntry("tenure", "2.5")
                .containsEntry("balance", "[1,2]")
                .containsEntry("is_active_member", "maybe");
    }

    @Test
    void nullJsonValuesAreMissing() throws Exception {
        CustomerRecord r = rows.fromJson(json.readTree("{\"age\":null,\"gender\":null}"));

        assertThat(r.getAge()).isNull();
        assertThat(r.getGender()).isNull();
        assertThat(r.getUnparsedFields()).isEmpty();
    }

    @Test
    void nonObjectElementIsFlaggedAsARow() throws Exception {
        CustomerRecord r = rows.fromJson(json.readTree("42"));

        assertThat(r.getUnparsedFields()).containsEntry(CustomerRowMapper.ROW_FIELD, "42");
    }

    @Test
    void decimalCommaOnlyWhenAsked() {
        assertThat(rows.fromCells(Map.of("balance", "1000,5"), true).getBalance()).isEqualTo(1000.5);
        assertThat(rows.fromCells(Map.of("balance", "1000,5"), false).getUnparsedFields()).containsKey("balance");
    }

    @Test
    void flagsAcceptCommonSpellings() {
        assertThat(CustomerRowMapper.parseFlag("Yes")).isTrue();
        assertThat(CustomerRowMapper.parseFlag(" 0 ")).isFalse();
        assertThat(CustomerRowMapper.parseFlag("non")).isFalse();
        assertThat(CustomerRowMapper.parseFlag("2")).isNull();
    }
}
