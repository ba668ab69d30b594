package com.example.payreport.interfaces.api;

import com.example.payreport.application.service.DashboardService;
import com.example.payreport.application.service.ReportService;
import com.example.payreport.domain.model.AggregationResult;
import com.example.payreport.domain.model.DashboardStats;
import com.example.payreport.domain.model.ExportFormat;
import com.example.payreport.domain.model.ExportedReport;
import com.example.payreport.domain.model.PaymentState;
import com.example.payreport.domain.model.ReportKind;
import com.example.payreport.domain.model.VideoFilter;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * Interfaces-layer MVC controller exposing report downloads, dashboard data and the payments page.
 */
@Controller
public class ReportController {

    static final String SKIPPED_RECORDS_HEADER = "X-Report-Skipped-Records";

    private final ReportService reportService;
    private final DashboardService dashboardService;

	/**
	 * Creates the controller with the required application services.
	 *
	 * @param reportService    service building report exports
	 * @param dashboardService service computing dashboard numbers
	 */
    public ReportController(ReportService reportService, DashboardService dashboardService) {
        this.reportService = reportService;
        this.dashboardService = dashboardService;
    }

	/**
	 * Streams a report as a file download.
	 *
	 * @param type      report kind; {@code all} is accepted for the combined report
	 * @param format    {@code csv} or {@code xlsx}; defaults to xlsx for combined reports and csv otherwise
	 * @param creatorId optional creator restriction for videos
	 * @param status    optional payment status restriction for videos
	 * @return attachment response carrying the skipped-record count as a header
	 */
    @GetMapping("/export")
    public ResponseEntity<byte[]> export(@RequestParam(name = "type", defaultValue = "all") String type,
                                         @RequestParam(name = "format", required = false) String format,
                                         @RequestParam(name = "creatorId", required = false) Long creatorId,
                                         @RequestParam(name = "status", required = false) String status) {
        ReportKind kind = ReportKind.fromString(type);
        ExportFormat exportFormat = resolveFormat(kind, format);
        VideoFilter filter = new VideoFilter(creatorId, status == null || status.isBlank()
                ? null
                : PaymentState.fromString(status));

        ExportedReport report = reportService.buildReport(kind, exportFormat, filter);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(report.fileName()).build().toString())
                .header(SKIPPED_RECORDS_HEADER, String.valueOf(report.diagnostics().skippedCount()))
                .contentType(MediaType.parseMediaType(report.contentType()))
                .body(report.content());
    }

	/**
	 * Returns per-creator summaries, monthly trend points and diagnostics as JSON.
	 *
	 * @param creatorId optional creator restriction
	 * @param status    optional payment status restriction
	 * @return aggregation over the current records
	 */
    @GetMapping(value = "/api/payments", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public AggregationResult payments(@RequestParam(name = "creatorId", required = false) Long creatorId,
                                      @RequestParam(name = "status", required = false) String status) {
        VideoFilter filter = new VideoFilter(creatorId, status == null || status.isBlank()
                ? null
                : PaymentState.fromString(status));
        return reportService.aggregate(filter);
    }

	/**
	 * Dashboard chart data: headline totals, status distribution and recent months.
	 *
	 * @return dashboard statistics
	 */
    @GetMapping(value = "/api/dashboard-data", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public DashboardStats dashboardData() {
        return dashboardService.stats();
    }

	/**
	 * Renders the payments overview page.
	 *
	 * @param model model used to expose attributes to the Thymeleaf view
	 * @return payments view name
	 */
    @GetMapping("/payments")
    public String paymentsPage(Model model) {
        model.addAttribute("overview", dashboardService.paymentsOverview());
        model.addAttribute("kinds", ReportKind.values());
        return "payments";
    }

    private ExportFormat resolveFormat(ReportKind kind, String format) {
        if (format == null || format.isBlank()) {
            return kind == ReportKind.COMBINED ? ExportFormat.WORKBOOK : ExportFormat.FLAT_TABLE;
        }
        return ExportFormat.fromString(format);
    }
}
