package com.nana.contacts.importer;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.ContactField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * FieldValidator - Lenient content checks over parsed candidates.
 *
 * <p>Unlike form validation, nothing here rejects a row. Every check yields
 * a {@link ValidationFinding} the user can read in the preview before
 * deciding what to import.
 *
 * <p>CHECKS:
 * <pre>
 *   email        - must look like local@domain.tld
 *   phone        - at least 10 digits after {@link PhoneNumbers#normalize}
 *   name         - some name part, or else an email or phone
 *   organization - at least 2 characters
 *   address      - at most 500 characters
 *   notes        - at most 2000 characters
 * </pre>
 */
public class FieldValidator {

    private static final Logger log = LoggerFactory.getLogger(FieldValidator.class);

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private static final int MIN_ORGANIZATION_LENGTH = 2;
    private static final int MAX_ADDRESS_LENGTH      = 500;
    private static final int MAX_NOTES_LENGTH        = 2000;

    /**
     * Validates every candidate, in order.
     *
     * @param candidates parsed candidates; null is treated as empty
     * @return all findings, grouped by candidate in input order
     */
    public List<ValidationFinding> validate(List<CandidateRecord> candidates) {
        List<ValidationFinding> findings = new ArrayList<>();
        if (candidates == null) {
            return findings;
        }
        for (CandidateRecord candidate : candidates) {
            findings.addAll(validate(candidate));
        }
        log.debug("Validated {} candidates: {} findings.", candidates.size(), findings.size());
        return findings;
    }

    /**
     * Validates one candidate.
     *
     * @param candidate the record to check
     * @return findings for this record, possibly empty
     */
    public List<ValidationFinding> validate(CandidateRecord candidate) {
        List<ValidationFinding> findings = new ArrayList<>();
        int row = candidate.getRowNumber();

        String email = candidate.getEmail();
        if (email != null && !EMAIL_PATTERN.matcher(email.trim().toLowerCase()).matches()) {
            findings.add(new ValidationFinding(row, ContactField.EMAIL.getJsonName(),
                    "Invalid email format: \"" + email + "\""));
        }

        String phone = candidate.getPhone();
        if (phone != null && PhoneNumbers.isIncomplete(phone)) {
            findings.add(new ValidationFinding(row, ContactField.PHONE.getJsonName(),
                    "Phone number appears incomplete: \"" + phone + "\""));
        }

        boolean hasName = candidate.getFullName() != null
                || candidate.getFirstName() != null
                || candidate.getLastName() != null;
        if (!hasName && email == null && phone == null) {
            findings.add(new ValidationFinding(row, "name",
                    "No name provided and no email/phone for identification"));
        }

        String organization = candidate.getOrganization();
        if (organization != null && organization.length() < MIN_ORGANIZATION_LENGTH) {
            findings.add(new ValidationFinding(row, ContactField.ORGANIZATION.getJsonName(),
                    "Organization name seems too short"));
        }

        String address = candidate.getAddress();
        if (address != null && address.length() > MAX_ADDRESS_LENGTH) {
            findings.add(new ValidationFinding(row, ContactField.ADDRESS.getJsonName(),
                    "Address seems unusually long"));
        }

        String notes = candidate.getNotes();
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            findings.add(new ValidationFinding(row, ContactField.NOTES.getJsonName(),
                    "Notes are very long (over 2000 characters)"));
        }

        return findings;
    }
}
