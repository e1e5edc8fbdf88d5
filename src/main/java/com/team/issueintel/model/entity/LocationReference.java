package com.team.issueintel.model.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A physical location (gym, studio) belonging to one brand.
 */
@Entity
@Table(name = "location", indexes = @Index(name = "idx_location_brand", columnList = "brandId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationReference {

    @Id
    private String id;

    private String name;

    private String brandId;

    private String address;

    private int memberCount;

    private String timezone;
}
