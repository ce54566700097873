package com.nana.contacts.importer;

import com.nana.contacts.domain.CandidateRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldValidatorTest {

    private final FieldValidator validator = new FieldValidator();

    private CandidateRecord.Builder ada() {
        return CandidateRecord.builder(1)
                .fullName("Ada Lovelace")
                .email("ada@example.com")
                .phone("(555) 123-4567");
    }

    @Nested
    @DisplayName("FieldValidator")
    class ValidatorTests {

        @Test
        @DisplayName("a clean record produces no findings")
        void validate_cleanRecord_noFindings() {
            assertTrue(validator.validate(ada().build()).isEmpty());
        }

        @Test
        @DisplayName("a malformed email is reported with its value")
        void validate_badEmail_warns() {
            List<ValidationFinding> findings =
                    validator.validate(ada().email("not-an-email").build());

            assertEquals(List.of(new ValidationFinding(1, "email",
                    "Invalid email format: \"not-an-email\"")), findings);
        }

        @Test
        @DisplayName("an upper-case email is accepted")
        void validate_upperCaseEmail_accepted() {
            assertTrue(validator.validate(ada().email("ADA@EXAMPLE.COM").build()).isEmpty());
        }

        @Test
        @DisplayName("a short phone number is reported as incomplete")
        void validate_shortPhone_warns() {
            List<ValidationFinding> findings =
                    validator.validate(ada().phone("555-1234").build());

            assertEquals(1, findings.size());
            assertEquals("phone", findings.get(0).getField());
            assertEquals("Phone number appears incomplete: \"555-1234\"",
                    findings.get(0).getMessage());
        }

        @Test
        @DisplayName("a record without name, email or phone is reported under 'name'")
        void validate_unidentifiable_warnsOnName() {
            List<ValidationFinding> findings = validator.validate(
                    CandidateRecord.builder(4).organization("Acme").build());

            assertEquals(1, findings.size());
            assertEquals(4, findings.get(0).getRow());
            assertEquals("name", findings.get(0).getField());
            assertEquals("No name provided and no email/phone for identification",
                    findings.get(0).getMessage());
        }

        @Test
        @DisplayName("length checks on organization, address and notes")
        void validate_lengthChecks() {
            List<ValidationFinding> findings = validator.validate(ada()
                    .organization("A")
                    .address("x".repeat(501))
                    .notes("n".repeat(2001))
                    .build());

            assertEquals(Arrays.asList(
                    "Organization name seems too short",
                    "Address seems unusually long",
                    "Notes are very long (over 2000 characters)"),
                    findings.stream().map(ValidationFinding::getMessage).toList());
        }

        @Test
        @DisplayName("values at the length limits are accepted")
        void validate_atLimits_accepted() {
            assertTrue(validator.validate(ada()
                    .organization("AB")
                    .address("x".repeat(500))
                    .notes("n".repeat(2000))
                    .build()).isEmpty());
        }

        @Test
        @DisplayName("findings for several records keep record order")
        void validate_list_keepsOrder() {
            List<ValidationFinding> findings = validator.validate(List.of(
                    CandidateRecord.builder(1).fullName("A").email("bad").build(),
                    CandidateRecord.builder(2).fullName("B").build(),
                    CandidateRecord.builder(3).fullName("C").phone("12").build()));

            assertEquals(List.of(1, 3),
                    findings.stream().map(ValidationFinding::getRow).toList());
        }

        @Test
        @DisplayName("a null list yields no findings")
        void validate_nullList_empty() {
            assertTrue(validator.validate((List<CandidateRecord>) null).isEmpty());
        }
    }

    @Nested
    @DisplayName("PhoneNumbers")
    class PhoneNumbersTests {

        @ParameterizedTest
        @CsvSource({
                "'+1 (555) 123-4567', 5551234567",
                "1-555-123-4567,      5551234567",
                "555.123.4567,        5551234567",
                "555-1234,            5551234"
        })
        @DisplayName("normalize strips formatting and the US country code")
        void normalize_stripsFormatting(String input, String expected) {
            assertEquals(expected, PhoneNumbers.normalize(input));
        }

        @Test
        @DisplayName("format renders ten digits as (XXX) XXX-XXXX")
        void format_tenDigits() {
            assertEquals("(555) 123-4567", PhoneNumbers.format("+1 555.123.4567"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"12345", "+44 20 7946 0958"})
        @DisplayName("format returns anything else unchanged")
        void format_otherLengths_unchanged(String input) {
            assertEquals(input, PhoneNumbers.format(input));
        }

        @Test
        @DisplayName("isIncomplete is true below ten digits")
        void isIncomplete() {
            assertTrue(PhoneNumbers.isIncomplete("555-1234"));
            assertFalse(PhoneNumbers.isIncomplete("(555) 123-4567"));
            assertTrue(PhoneNumbers.isIncomplete(null));
        }
    }
}
