package com.vmcplatform.report.model;

import com.vmcplatform.common.model.SelectionCriterion;
import com.vmcplatform.common.model.UtteranceMetadata;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;

/**
 * Read projection of one utterance joined to its segment, recording and participant.
 * Populated only by the report queries; never saved.
 */
@Data
@NoArgsConstructor
@Table("utterance")
public class UtteranceReportRow {

    @Id
    private Long utteranceId;

    private String assessmentId;

    private LocalDate recordingDate;

    private String childId;

    private String childSex;

    private LocalDate childDateOfBirth;

    private Double ageAtRecordingInMonths;

    private String childGroup;

    private Long segmentId;

    private String selectionCriterion;

    private double startTimeInSeconds;

    private double endTimeInSeconds;

    private double durationInSeconds;

    private double minimumPitch;

    private double maximumPitch;

    private double averagePitch;

    private double pitchRange;

    /** Report form: criterion as its two-letter symbol, missing age as 0. */
    public UtteranceMetadata toMetadata() {
        SelectionCriterion criterion = SelectionCriterion.fromName(selectionCriterion);
        return new UtteranceMetadata(
            utteranceId,
            assessmentId,
            recordingDate,
            childId,
            childSex,
            childDateOfBirth,
            ageAtRecordingInMonths == null ? 0.0 : ageAtRecordingInMonths,
            childGroup,
            segmentId,
            criterion == null ? selectionCriterion : criterion.symbol(),
            startTimeInSeconds,
            endTimeInSeconds,
            durationInSeconds,
            minimumPitch,
            maximumPitch,
            averagePitch,
            pitchRange);
    }
}
