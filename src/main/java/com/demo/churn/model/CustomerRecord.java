package com.demo.churn.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Raw snapshot of one customer as submitted by a form or one row of an uploaded batch.
 * Fields are nullable: presence and ranges are checked by the validator, never here.
 * Categorical attributes stay as submitted text until validated.
 */
@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = CustomerRecord.CustomerRecordBuilder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CustomerRecord {

    @JsonProperty("customer_id")
    String customerId;

    Integer age;
    String gender;
    String country;

    @JsonProperty("category")
    String tier;

    @JsonProperty("credit_score")
    Integer creditScore;

    Integer tenure;
    Double balance;

    @JsonProperty("estimated_salary")
    Double estimatedSalary;

    @JsonProperty("num_of_products")
    Integer productCount;

    @JsonProperty("point_earned")
    Integer loyaltyPoints;

    @JsonProperty("has_credit_card")
    Boolean hasCreditCard;

    @JsonProperty("is_active_member")
    Boolean activeMember;

    @JsonProperty("complain")
    Boolean hasComplaint;

    @JsonProperty("satisfaction_score")
    Integer satisfactionScore;

    /** Field name to raw text for cells that could not be read as the expected type. */
    @Singular("unparsed")
    @JsonIgnore
    Map<String, String> unparsedFields;

    @JsonPOJOBuilder(withPrefix = "")
    public static class CustomerRecordBuilder {
    }
}
