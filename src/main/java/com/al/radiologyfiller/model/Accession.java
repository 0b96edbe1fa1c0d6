package com.al.radiologyfiller.model;

import com.al.radiologyfiller.model.enums.AccessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One imaging study. Groups one or more procedure requests of the same patient; the accession number
 * is never reused or changed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "accessions")
public class Accession {

    @Id
    private String id;

    @Indexed(unique = true)
    private String accessionNumber;

    @Indexed
    private String patientId;

    // Written once by the imaging side
    private String studyInstanceUid;

    private LocalDate studyDate;
    private LocalTime studyTime;
    private String modality;
    private String performingFacility;
    private String notes;

    private AccessionStatus status;

    /** Generated by this service rather than supplied by the placer. */
    private boolean generated;

    @Builder.Default
    private List<AccessionRequestLink> requests = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime statusUpdatedAt;
}
