package com.example.Lily.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * One row of the parts catalog.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogPart(
        String partName,
        String partId,
        String mpnId,
        BigDecimal partPrice,
        String installDifficulty,
        String installTime,
        String symptoms,
        String applianceTypes,
        String replaceParts,
        String brand,
        String availability,
        String installVideoUrl,
        String productUrl
) {
}
