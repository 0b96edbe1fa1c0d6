package com.al.radiologyfiller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StudyInstanceUidRequest {

    @NotBlank(message = "study_instance_uid is required")
    @Pattern(regexp = "[0-9]+(\\.[0-9]+)*", message = "study_instance_uid must be a dotted numeric DICOM UID")
    @JsonProperty("study_instance_uid")
    private String studyInstanceUid;
}
