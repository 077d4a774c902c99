package com.vmcplatform.sampling.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One rater's code for one utterance. {@code nonCanonicalSyllableCount} is always
 * {@code total - canonical}.
 */
@Data
@NoArgsConstructor
@Table("utterance_coding")
public class UtteranceCoding {

    @Id
    private Long id;

    private Long utteranceId;

    private Long coderId;

    private Long annotationId;

    private Integer totalSyllableCount;

    private Integer canonicalSyllableCount;

    private Integer nonCanonicalSyllableCount;

    private Integer wordSyllableCount;

    private Integer wordCount;

    private String comments;

    private Boolean isAcceptable;

    private LocalDateTime addedOn;

    private LocalDateTime modifiedOn;
}
