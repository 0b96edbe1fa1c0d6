package com.al.radiologyfiller.hl7;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Patient identification as sent in PID.
 */
@Value
@Builder
public class PatientDemographics {
    String identifier;     // PID-3.1
    String lastName;       // PID-5.1
    String firstName;      // PID-5.2
    LocalDate dateOfBirth; // PID-7
    String gender;         // PID-8

    public boolean hasIdentifier() {
        return identifier != null && !identifier.isBlank();
    }

    public boolean hasName() {
        return firstName != null && !firstName.isBlank() && lastName != null && !lastName.isBlank();
    }

    /**
     * Human-readable form used in log lines and error messages.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (hasIdentifier()) {
            sb.append("PID-3 '").append(identifier).append("'");
        }
        if (hasName()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append("name '").append(firstName).append(' ').append(lastName).append("'");
            if (dateOfBirth != null) {
                sb.append(" born ").append(dateOfBirth);
            }
        }
        return sb.length() == 0 ? "an empty PID segment" : sb.toString();
    }
}
