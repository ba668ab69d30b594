package com.example.payreport.domain.model;

import java.time.LocalDateTime;

/**
 * Domain DTO describing a tracked content creator as supplied by the record source.
 * Only the identifier and display name are mandatory; every other attribute may be {@code null}.
 */
public record Creator(
        Long id,
        String name,
        String channelLink,
        String category,
        String contact,
        String notes,
        LocalDateTime createdAt
) {
}
