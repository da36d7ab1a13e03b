package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.config.ReportSettings;
import com.satyammall.inventoryservice.model.ReportFilter;
import com.satyammall.inventoryservice.model.Transaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Narrows the transaction log to the reports screen's filter and orders it newest first.
 * Calendar days are taken in the configured report zone.
 */
@Component
@RequiredArgsConstructor
public class TransactionFilter {

    private static final Comparator<Transaction> NEWEST_FIRST = Comparator
            .comparing(Transaction::getDate, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .reversed();

    private final ReportSettings settings;

    public List<Transaction> apply(List<Transaction> transactions, ReportFilter filter) {
        Predicate<Transaction> matches = matcher(filter);
        // Stream.sorted is stable on an ordered stream, so equal dates keep their log order
        return transactions.stream()
                .filter(matches)
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    /**
     * Every distinct location in the log, alphabetically. These are the location filter choices.
     */
    public List<String> locations(List<Transaction> transactions) {
        return transactions.stream()
                .map(Transaction::getLocation)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new))
                .stream()
                .collect(Collectors.toList());
    }

    private Predicate<Transaction> matcher(ReportFilter filter) {
        Instant from = filter.getStartDate() == null ? null : startOf(filter.getStartDate());
        // end date is inclusive, so compare against the start of the following day
        Instant until = filter.getEndDate() == null ? null : startOf(filter.getEndDate().plusDays(1));

        return t -> {
            if (!filter.matchesAllTypes() && t.getType() != filter.getType()) {
                return false;
            }
            if (!filter.matchesAllLocations() && !filter.getLocation().equals(t.getLocation())) {
                return false;
            }
            if (from != null && (t.getDate() == null || t.getDate().isBefore(from))) {
                return false;
            }
            return until == null || (t.getDate() != null && t.getDate().isBefore(until));
        };
    }

    private Instant startOf(LocalDate day) {
        return day.atStartOfDay(settings.getZoneId()).toInstant();
    }
}
