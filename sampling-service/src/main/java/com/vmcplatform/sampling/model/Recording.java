package com.vmcplatform.sampling.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A day-long child recording. Loaded by the external importers; this service only reads it.
 */
@Data
@NoArgsConstructor
@Table("recording")
public class Recording {

    @Id
    private Long id;

    private String assessmentId;

    private Long participantId;

    private LocalDate recordingDate;

    private Double ageAtRecordingInMonths;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private Boolean isValid;
}
