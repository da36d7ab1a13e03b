package com.satyammall.inventoryservice.config;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Report presentation settings, bound from {@code inventory.reports.*}.
 */
@Value
@Builder
public class ReportSettings {
    ZoneId zoneId;
    DateTimeFormatter dateFormatter;
    DateTimeFormatter dateTimeFormatter;
    String title;
    String defaultUnit;
    String defaultGeneratedBy;
}
