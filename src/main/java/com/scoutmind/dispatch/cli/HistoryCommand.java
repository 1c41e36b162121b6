package com.scoutmind.dispatch.cli;

import com.scoutmind.core.persistence.ReportStore;
import com.scoutmind.core.persistence.StoredReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: scoutmind history
 * <p>
 * Lists saved reports newest first as a table: Report ID | Created | Query.
 * With {@code --id} prints one full report instead.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List saved research reports")
@Component
public class HistoryCommand implements Callable<Integer> {

    private static final DateTimeFormatter CREATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.systemDefault());

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = {"--id"}, description = "Print the full report with this id")
    private String reportId;

    private final ReportStore reportStore;

    public HistoryCommand(ReportStore reportStore) {
        this.reportStore = reportStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (reportId != null) {
            Optional<StoredReport> report = reportStore.findById(reportId);
            if (report.isEmpty()) {
                ConsoleOutput.error("Report not found: " + reportId);
                return 1;
            }
            ConsoleOutput.info("Query: " + report.get().query());
            ConsoleOutput.report(report.get().content());
            return 0;
        }

        if (limit < 1) {
            ConsoleOutput.error("--limit must be at least 1");
            return 2;
        }

        List<StoredReport> reports = reportStore.findRecent(limit);
        if (reports.isEmpty()) {
            ConsoleOutput.info("No reports found.");
            return 0;
        }

        ConsoleOutput.info("Reports (" + reports.size() + "):");
        System.out.println();
        System.out.printf("  %-36s %-16s %s%n", "REPORT ID", "CREATED", "QUERY");
        System.out.println("  " + "-".repeat(90));
        for (StoredReport report : reports) {
            String created = report.createdAt() != null ? CREATED_FORMAT.format(report.createdAt()) : "-";
            System.out.printf("  %-36s %-16s %s%n", report.id(), created, truncate(report.query(), 40));
        }
        return 0;
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
