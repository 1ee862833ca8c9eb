/* (C)2026 */
package com.ammann.imputation.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Sort;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;

/**
 * Monitoring station. Readings, models and audit rows reference it by {@link #stationId}.
 */
@Entity
@Table(name = "stations")
public class Station extends PanacheEntityBase {

    @Id
    @Column(name = "station_id", length = 32)
    @NotBlank
    public String stationId;

    @Column(name = "name_en", length = 255)
    public String nameEn;

    @Column
    public Double latitude;

    @Column
    public Double longitude;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt = Instant.now();

    public Station() {
    }

    public Station(String stationId, String nameEn) {
        this.stationId = stationId;
        this.nameEn = nameEn;
    }

    public static boolean exists(String stationId) {
        return count("stationId", stationId) > 0;
    }

    public static List<String> listIds() {
        return Station.<Station>listAll(Sort.by("stationId")).stream()
                .map(station -> station.stationId)
                .toList();
    }
}
