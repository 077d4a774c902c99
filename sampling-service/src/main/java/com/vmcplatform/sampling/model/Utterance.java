package com.vmcplatform.sampling.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * A target-speaker vocal event inside a selected segment. Immutable once created.
 */
@Data
@NoArgsConstructor
@Table("utterance")
public class Utterance {

    @Id
    private Long id;

    private Long segmentId;

    private Double startTimeInSeconds;

    private Double endTimeInSeconds;

    private Double durationInSeconds;

    private Double minimumPitch;

    private Double maximumPitch;

    private Double averagePitch;

    private Double pitchRange;
}
