package com.asvarishch.rewards.model.base;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Created-at plus last-modified timestamp, for rows that are updated in place.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class AuditableEntity extends CreatedAtEntity {

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
