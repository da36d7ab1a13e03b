package com.satyammall.inventoryservice.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Configuration
public class ReportConfiguration {

    @Value("${inventory.reports.zone-id:Asia/Kolkata}")
    private String zoneId;

    @Value("${inventory.reports.date-pattern:d/M/yyyy}")
    private String datePattern;

    @Value("${inventory.reports.date-time-pattern:d/M/yyyy, h:mm:ss a}")
    private String dateTimePattern;

    @Value("${inventory.reports.title:Satyam Mall}")
    private String title;

    @Value("${inventory.reports.default-unit:pcs}")
    private String defaultUnit;

    @Value("${inventory.reports.default-generated-by:Admin}")
    private String defaultGeneratedBy;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ReportSettings reportSettings() {
        Locale locale = new Locale("en", "IN");
        return ReportSettings.builder()
                .zoneId(ZoneId.of(zoneId))
                .dateFormatter(DateTimeFormatter.ofPattern(datePattern, locale))
                .dateTimeFormatter(DateTimeFormatter.ofPattern(dateTimePattern, locale))
                .title(title)
                .defaultUnit(defaultUnit)
                .defaultGeneratedBy(defaultGeneratedBy)
                .build();
    }
}
