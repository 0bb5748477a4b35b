package io.github.jakubt4.ithil.store;

import io.github.jakubt4.ithil.model.Image;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "images")
@Getter
@Setter
public class ImageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String filename;

    @Column(name = "filter_name")
    private String filterName;

    private String ccdsum;

    @Column(name = "obstype", nullable = false)
    private String imageType;

    @Column(name = "date_obs")
    private Instant dateObs;

    @Column(name = "day_obs", nullable = false)
    private LocalDate dayObs;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "telescope", nullable = false)
    private TelescopeEntity telescope;

    Image toImage() {
        return new Image(id, filename, filterName, ccdsum, imageType, dateObs, dayObs, telescope.getTelescopeId());
    }
}
