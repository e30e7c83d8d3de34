package com.enms.analytics.persistence;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Significant Energy User: a named, ordered grouping of equipment units sharing one energy source.
 */
@Entity
@Table(name = "seus")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignificantEnergyUserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", length = 100, nullable = false, unique = true)
    private String name;

    @Column(name = "energy_source", length = 50, nullable = false)
    private String energySource;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "seu_equipment", joinColumns = @JoinColumn(name = "seu_id"))
    @OrderColumn(name = "member_index")
    @Column(name = "equipment_id", length = 64, nullable = false)
    private List<String> equipmentIds = new ArrayList<>();

    @Column(name = "description")
    private String description;

    @Column(name = "active")
    private boolean active;
}
