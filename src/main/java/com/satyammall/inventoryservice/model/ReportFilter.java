package com.satyammall.inventoryservice.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Filter choices of the reports screen. A null {@code type} or a null/"All" location lets
 * everything through.
 */
@Value
@Builder
public class ReportFilter {

    public static final String ALL = "All";

    OperationKind type;
    String location;
    LocalDate startDate;
    LocalDate endDate;

    public static ReportFilter unfiltered() {
        return ReportFilter.builder().build();
    }

    /**
     * Builds a filter from raw request values, where "All" or blank means no restriction.
     */
    public static ReportFilter of(String type, String location, LocalDate startDate, LocalDate endDate) {
        return ReportFilter.builder()
                .type(isAll(type) ? null : OperationKind.fromDisplayName(type))
                .location(isAll(location) ? null : location)
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }

    public boolean matchesAllTypes() {
        return type == null;
    }

    public boolean matchesAllLocations() {
        return isAll(location);
    }

    public String typeLabel() {
        return type == null ? ALL : type.getDisplayName();
    }

    private static boolean isAll(String value) {
        return value == null || value.isBlank() || ALL.equals(value);
    }
}
