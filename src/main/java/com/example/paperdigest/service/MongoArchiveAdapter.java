package com.example.paperdigest.service;

import com.example.paperdigest.model.DailyReport;
import com.example.paperdigest.port.ArchivePersistenceException;
import com.example.paperdigest.port.ArchivePort;
import com.example.paperdigest.repository.DailyReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * {@link ArchivePort} backed by MongoDB: one document per resolved date, the date being the
 * document id, so a rewrite replaces the previous report.
 */
@Service
public class MongoArchiveAdapter implements ArchivePort {

    private static final Logger log = LoggerFactory.getLogger(MongoArchiveAdapter.class);

    private final DailyReportRepository repository;

    public MongoArchiveAdapter(DailyReportRepository repository) {
        this.repository = repository;
    }

    @Override
    public void write(LocalDate date, DailyReport report) {
        if (!date.toString().equals(report.date())) {
            throw new IllegalArgumentException("Report dated " + report.date() + " cannot be stored under " + date);
        }
        try {
            repository.save(report);
            log.info("Archived report for {} ({} papers)", date, report.papers().size());
        } catch (DataAccessException e) {
            throw new ArchivePersistenceException("Could not archive report for " + date, e);
        }
    }

    @Override
    public List<DailyReport> readRange(LocalDate start, LocalDate end) {
        return repository.findRange(start.toString(), end.toString());
    }

    @Override
    public Optional<DailyReport> read(LocalDate date) {
        return repository.findById(date.toString());
    }
}
