package com.vmcplatform.sampling.model;

import com.vmcplatform.common.model.SegmentCandidate;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Fixed-length slice of a recording. {@code selectionCriterion} holds a
 * {@link com.vmcplatform.common.model.SelectionCriterion} name once the segment is selected.
 */
@Data
@NoArgsConstructor
@Table("segment")
public class Segment {

    @Id
    private Long id;

    private Long recordingId;

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    private Double startTimeInSeconds;

    private Double endTimeInSeconds;

    private Integer childVocalizationCount;

    private Boolean isSelected;

    private String selectionCriterion;

    private LocalDateTime modifiedOn;

    public SegmentCandidate toCandidate() {
        return new SegmentCandidate(
            id, startTime, endTime, startTimeInSeconds, endTimeInSeconds,
            childVocalizationCount == null ? 0 : childVocalizationCount,
            Boolean.TRUE.equals(isSelected));
    }
}
