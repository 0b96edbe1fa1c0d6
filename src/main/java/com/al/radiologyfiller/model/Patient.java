package com.al.radiologyfiller.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * Read-only view of the patient registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "patients")
@CompoundIndex(def = "{'lastName': 1, 'firstName': 1, 'dateOfBirth': 1}", name = "name_dob_idx")
public class Patient {

    @Id
    private String id;

    @Indexed
    private String patientIdentifier;

    private String firstName;
    private String lastName;
    private LocalDate dateOfBirth;
    private String gender;
}
