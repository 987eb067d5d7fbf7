package com.example.paperdigest.port;

import com.example.paperdigest.model.DailyReport;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of daily reports, one per resolved date.
 */
public interface ArchivePort {

    /**
     * Stores the report under its date, replacing any previous one.
     *
     * @throws ArchivePersistenceException when the write is not durable
     */
    void write(LocalDate date, DailyReport report);

    /** Reports with {@code start <= date <= end}, oldest first. */
    List<DailyReport> readRange(LocalDate start, LocalDate end);

    Optional<DailyReport> read(LocalDate date);
}
