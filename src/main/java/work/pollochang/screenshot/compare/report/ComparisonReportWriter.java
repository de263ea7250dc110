package work.pollochang.screenshot.compare.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 以 JSON 讀寫比對報告。
 */
@Slf4j
public class ComparisonReportWriter {

    public static final String REPORT_FILE_NAME = "comparison-report.json";

    private final ObjectMapper mapper;

    public ComparisonReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    /**
     * 將報告寫入輸出目錄下的 {@value #REPORT_FILE_NAME}。
     *
     * @return 報告檔案路徑
     */
    public Path write(BatchReport report, Path outputDir) throws IOException {
        Path reportFile = outputDir.resolve(REPORT_FILE_NAME);
        log.info("正在將 {} 筆比對紀錄寫入 {} ...", report.pairs().size(), reportFile);
        mapper.writeValue(reportFile.toFile(), report);
        log.info("比對報告已寫入。");
        return reportFile;
    }

    public BatchReport read(Path reportFile) throws IOException {
        return mapper.readValue(reportFile.toFile(), BatchReport.class);
    }
}
