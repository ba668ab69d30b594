package com.example.payreport.domain.model;

import com.example.payreport.domain.exception.UnsupportedReportKindException;

import java.util.List;
import java.util.Locale;

/**
 * Closed set of report variants. {@link #COMBINED} expands to one table per entity kind.
 */
public enum ReportKind {
    CREATORS,
    VIDEOS,
    PAYMENTS,
    COMBINED;

	/**
	 * Parses a request value. {@code all} is accepted as an alias for {@link #COMBINED}.
	 *
	 * @param rawValue value supplied by the caller
	 * @return parsed kind
	 * @throws UnsupportedReportKindException when the value is blank or unknown
	 */
    public static ReportKind fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new UnsupportedReportKindException(rawValue);
        }
        String normalized = rawValue.trim().toUpperCase(Locale.ROOT);
        if ("ALL".equals(normalized)) {
            return COMBINED;
        }
        try {
            return ReportKind.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new UnsupportedReportKindException(rawValue);
        }
    }

	/**
	 * Resolves the single-table kinds this report is made of.
	 *
	 * @return {@code this} for single kinds, the three entity kinds for {@link #COMBINED}
	 */
    public List<ReportKind> components() {
        if (this == COMBINED) {
            return List.of(CREATORS, VIDEOS, PAYMENTS);
        }
        return List.of(this);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
