package io.github.jakubt4.ithil.store;

import io.github.jakubt4.ithil.model.Telescope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "telescopes")
@Getter
@Setter
public class TelescopeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "telescope_id", nullable = false, unique = true)
    private String telescopeId;

    @Column(nullable = false)
    private String site;

    @Column(nullable = false)
    private String instrument;

    @Column(name = "camera_type")
    private String cameraType;

    Telescope toTelescope() {
        return new Telescope(telescopeId, site, instrument, cameraType);
    }
}
