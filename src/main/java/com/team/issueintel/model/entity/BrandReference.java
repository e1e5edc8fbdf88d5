package com.team.issueintel.model.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "brand")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrandReference {

    @Id
    private String id;

    private String name;

    /** Short code, e.g. HAP */
    private String code;

    private String region;

    private int memberCount;
}
