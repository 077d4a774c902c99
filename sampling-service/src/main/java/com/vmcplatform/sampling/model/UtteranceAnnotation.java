package com.vmcplatform.sampling.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Reference data: an annotation raters may choose ("Canonical", "Laughing", ...) and the
 * utterance type it belongs to ("Speech", "Non-Speech").
 */
@Data
@NoArgsConstructor
@Table("utterance_annotation")
public class UtteranceAnnotation {

    @Id
    private Long id;

    private String description;

    private String utteranceType;
}
