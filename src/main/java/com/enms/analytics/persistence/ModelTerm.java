package com.enms.analytics.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One regression term: driver name and its fitted coefficient.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelTerm {

    @Column(name = "feature_name", length = 100, nullable = false)
    private String featureName;

    @Column(name = "coefficient", nullable = false)
    private double coefficient;
}
