package com.demo.churn.service.validation;

import com.demo.churn.TestFixtures;
import com.demo.churn.model.CustomerRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CustomerValidatorTest {

    private final CustomerValidator validator = new CustomerValidator();

    @Test
    void validRecordHasNoViolations() {
        ValidationResult r = validator.validate(TestFixtures.validRecord().build());

        assertThat(r.isValid()).isTrue();
        assertThat(r.violations()).isEmpty();
    }

    @Test
    void frenchLabelsAreAccepted() {
        CustomerRecord rec = TestFixtures.validRecord().gender("Homme").country("Allemagne").tier("platinum").build();

        assertThat(validator.validate(rec).isValid()).isTrue();
    }

    @Test
    void outOfRangeFieldIsNamed() {
        ValidationResult r = validator.validate(TestFixtures.validRecord().age(500).build());

        assertThat(r.isValid()).isFalse();
        assertThat(r.hasErrorOn("age")).isTrue();
        assertThat(r.errors()).singleElement().satisfies(v -> {
            assertThat(v.constraint()).isEqualTo("range");
            assertThat(v.message()).contains("age must be between 18 and 100");
        });
    }

    @Test
    void rangeBoundsAreInclusive() {
        CustomerRecord rec = TestFixtures.validRecord()
                .age(18).estimatedSalary(20_000.0).creditScore(900).tenure(0).satisfactionScore(5)
                .productCount(1).balance(0.0).loyaltyPoints(100_000)
                .build();

        assertThat(validator.validate(rec).isValid()).isTrue();
    }

    @Test
    void reportsEveryViolationNotOnlyTheFirst() {
        CustomerRecord rec = TestFixtures.validRecord()
                .age(null)
                .creditScore(100)
                .country("Italy")
                .satisfactionScore(9)
                .build();

        ValidationResult r = validator.validate(rec);

        assertThat(r.errors()).extracting(FieldViolation::field)
                .contains("age", "credit_score", "country", "satisfaction_score");
        assertThat(r.errors()).filteredOn(v -> v.field().equals("age"))
                .extracting(FieldViolation::constraint).containsExactly("required");
        assertThat(r.errors()).filteredOn(v -> v.field().equals("country"))
                .extracting(FieldViolation::constraint).containsExactly("allowed");
    }

    @Test
    void missingCategoricalAndFlagFieldsAreRequired() {
        CustomerRecord rec = TestFixtures.validRecord().gender(" ").hasComplaint(null).build();

        ValidationResult r = validator.validate(rec);

        assertThat(r.hasErrorOn("gender")).isTrue();
        assertThat(r.hasErrorOn("complain")).isTrue();
    }

    @Test
    void unparsedCellsAreTypeErrors() {
        CustomerRecord rec = TestFixtures.validRecord().age(null).unparsed("age", "forty").build();

        ValidationResult r = validator.validate(rec);

        assertThat(r.errors()).singleElement().satisfies(v -> {
            assertThat(v.field()).isEqualTo("age");
            assertThat(v.constraint()).isEqualTo("type");
            assertThat(v.message()).contains("forty");
        });
    }

    @Test
    void youngHighEarnerBreaksBusinessRule() {
        CustomerRecord rec = TestFixtures.validRecord().age(22).estimatedSalary(180_000.0).build();

        ValidationResult r = validator.validate(rec);

        assertThat(r.isValid()).isFalse();
        assertThat(r.hasErrorOn("age")).isTrue();
        assertThat(r.hasErrorOn("estimated_salary")).isTrue();
    }

    @Test
    void fourProductsRequireActiveMembership() {
        CustomerRecord inactive = TestFixtures.validRecord().productCount(4).activeMember(false).build();
        CustomerRecord active = TestFixtures.validRecord().productCount(4).activeMember(true).build();

        assertThat(validator.validate(inactive).hasErrorOn("num_of_products")).isTrue();
        assertThat(validator.validate(active).isValid()).isTrue();
    }

    @Test
    void lowCreditWithHighBalanceIsRejected() {
        CustomerRecord rec = TestFixtures.validRecord().creditScore(350).balance(250_000.0).build();

        assertThat(validator.validate(rec).hasErrorOn("credit_score")).isTrue();
    }

    @Test
    void zeroSatisfactionIsOnlyAWarning() {
        ValidationResult r = validator.validate(TestFixtures.validRecord().satisfactionScore(0).build());

        assertThat(r.isValid()).isTrue();
        assertThat(r.warnings()).extracting(FieldViolation::field).containsExactly("satisfaction_score");
    }

    @Test
    void nullRecordFailsClosed() {
        ValidationResult r = validator.validate(null);

        assertThat(r.isValid()).isFalse();
        assertThat(r.errors()).hasSize(1);
    }
}
