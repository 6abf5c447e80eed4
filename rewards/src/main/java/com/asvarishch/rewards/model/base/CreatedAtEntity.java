package com.asvarishch.rewards.model.base;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;


@Getter
@Setter
@MappedSuperclass
public abstract class CreatedAtEntity {

    @CreationTimestamp
    @Column(name = "created_at",
            nullable = false,
            updatable = false)
    @ColumnDefault("CURRENT_TIMESTAMP")      // rows inserted by data.sql
    private Instant createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            setCreatedAt(Instant.now());
        }
    }
}
