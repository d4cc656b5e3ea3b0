package com.lidar.model.base;

import lombok.Data;
import lombok.experimental.SuperBuilder;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Base entity with an identifier and a creation time
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseEntity<ID> {

    /**
     * Unique identifier for the entity
     */
    private ID id;

    /**
     * Creation timestamp
     */
    private Instant createdAt;
}
