package work.pollochang.screenshot.compare.history;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.screenshot.compare.report.ComparisonOutcome;
import work.pollochang.screenshot.compare.report.PairReport;

import java.nio.file.Path;
import java.sql.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * H2 比對歷史管理器。
 * 負責所有與 H2 資料庫的底層互動，包括連線、資料表初始化、批次寫入與統計查詢。
 */
@Slf4j
public class H2HistoryManager implements AutoCloseable {

    private static final int MAX_BATCH_SIZE = 1000;

    private static final String INSERT_SQL = "INSERT INTO COMPARISON_HISTORY " +
            "(BASELINE, ACTUAL, OUTCOME, HASH_SIMILARITY, SSIM, PIXEL_DIFF_RATIO, THRESHOLD, DEGRADED, " +
            "DIFF_IMAGE, ERROR_CODE, ERROR_MESSAGE, COMPARED_AT) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final Connection connection;

    /**
     * 建構子，開啟 (必要時建立) H2 資料庫。
     * @param dbPath H2 資料庫檔案的路徑，可含或不含 .mv.db 副檔名。
     */
    public H2HistoryManager(Path dbPath) {
        // JDBC URL 不需要 .mv.db 副檔名
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        String jdbcUrl = String.format("jdbc:h2:%s", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
    }

    /**
     * 初始化資料庫，如果資料表不存在，則建立它。
     */
    public void initSchema() {
        String createTableSql = "CREATE TABLE IF NOT EXISTS COMPARISON_HISTORY (" +
                "ID BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                "BASELINE VARCHAR(4096) NOT NULL, " +
                "ACTUAL VARCHAR(4096) NOT NULL, " +
                "OUTCOME VARCHAR(32) NOT NULL, " +
                "HASH_SIMILARITY DOUBLE PRECISION, " +
                "SSIM DOUBLE PRECISION, " +
                "PIXEL_DIFF_RATIO DOUBLE PRECISION, " +
                "THRESHOLD DOUBLE PRECISION, " +
                "DEGRADED BOOLEAN, " +
                "DIFF_IMAGE VARCHAR(4096), " +
                "ERROR_CODE VARCHAR(32), " +
                "ERROR_MESSAGE VARCHAR(4096), " +
                "COMPARED_AT TIMESTAMP NOT NULL" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.info("H2 資料表 'COMPARISON_HISTORY' 已確認存在。");
        } catch (SQLException e) {
            throw new RuntimeException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    /**
     * 以單一交易批次寫入比對紀錄，失敗時整批回滾。
     * @param reports 要寫入的比對紀錄
     * @return 是否成功寫入
     */
    public boolean saveAll(Collection<PairReport> reports) {
        if (reports == null || reports.isEmpty()) {
            log.info("沒有比對紀錄，無需寫入 H2。");
            return true;
        }

        log.info("準備將 {} 筆比對紀錄批次寫入 H2 資料庫...", reports.size());
        int batchSize = 0;
        Timestamp now = Timestamp.valueOf(LocalDateTime.now());

        try (PreparedStatement ps = connection.prepareStatement(INSERT_SQL)) {
            // 關閉自動提交，手動管理交易
            connection.setAutoCommit(false);

            for (PairReport report : reports) {
                ps.setString(1, report.baseline());
                ps.setString(2, report.actual());
                ps.setString(3, report.outcome().name());
                ps.setDouble(4, report.hashSimilarity());
                ps.setDouble(5, report.ssim());
                ps.setDouble(6, report.pixelDifferenceRatio());
                ps.setDouble(7, report.threshold());
                ps.setBoolean(8, report.degraded());
                ps.setString(9, report.diffImage());
                ps.setString(10, report.error());
                ps.setString(11, report.errorMessage());
                ps.setTimestamp(12, now);
                ps.addBatch();
                batchSize++;

                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                    log.debug("已提交 {} 筆紀錄至 H2...", batchSize);
                }
            }

            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }

            connection.commit();
            log.info("成功將 {} 筆紀錄寫入 H2 資料庫。", batchSize);
            return true;

        } catch (SQLException e) {
            log.error("批次寫入比對紀錄至 H2 時發生錯誤", e);
            try {
                connection.rollback();
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
            return false;
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    /**
     * 統計各比對結果的歷史數量，沒有紀錄的結果以 0 表示。
     */
    public Map<ComparisonOutcome, Long> loadStatistics() {
        Map<ComparisonOutcome, Long> statistics = new EnumMap<>(ComparisonOutcome.class);
        for (ComparisonOutcome outcome : ComparisonOutcome.values()) {
            statistics.put(outcome, 0L);
        }
        String selectSql = "SELECT OUTCOME, COUNT(*) AS TOTAL FROM COMPARISON_HISTORY GROUP BY OUTCOME";

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {
            while (rs.next()) {
                String outcome = rs.getString("OUTCOME");
                try {
                    statistics.put(ComparisonOutcome.valueOf(outcome), rs.getLong("TOTAL"));
                } catch (IllegalArgumentException e) {
                    log.warn("略過未知的比對結果類型: {}", outcome);
                }
            }
        } catch (SQLException e) {
            log.error("從 H2 讀取比對統計時發生錯誤", e);
        }
        return statistics;
    }

    /**
     * 查詢某張基準截圖最近的比對紀錄，由新到舊排列。
     */
    public List<PairReport> findByBaseline(String baseline, int limit) {
        String selectSql = "SELECT BASELINE, ACTUAL, OUTCOME, HASH_SIMILARITY, SSIM, PIXEL_DIFF_RATIO, THRESHOLD, " +
                "DEGRADED, DIFF_IMAGE, ERROR_CODE, ERROR_MESSAGE FROM COMPARISON_HISTORY " +
                "WHERE BASELINE = ? ORDER BY ID DESC FETCH FIRST ? ROWS ONLY";
        List<PairReport> reports = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(selectSql)) {
            ps.setString(1, baseline);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ComparisonOutcome outcome = ComparisonOutcome.valueOf(rs.getString("OUTCOME"));
                    reports.add(new PairReport(
                            rs.getString("BASELINE"),
                            rs.getString("ACTUAL"),
                            outcome,
                            outcome == ComparisonOutcome.SIMILAR,
                            rs.getDouble("HASH_SIMILARITY"),
                            rs.getDouble("SSIM"),
                            rs.getDouble("PIXEL_DIFF_RATIO"),
                            rs.getDouble("THRESHOLD"),
                            rs.getBoolean("DEGRADED"),
                            null,
                            null,
                            rs.getString("DIFF_IMAGE"),
                            null,
                            rs.getString("ERROR_CODE"),
                            rs.getString("ERROR_MESSAGE")
                    ));
                }
            }
        } catch (SQLException e) {
            log.error("{} - 查詢比對歷史時發生錯誤", baseline, e);
        }
        return reports;
    }

    /**
     * 關閉資料庫連線，釋放資源。
     */
    @Override
    public void close() {
        try {
            log.info("正在關閉 H2 資料庫連線...");
            connection.close();
            log.info("H2 資料庫連線已關閉。");
        } catch (SQLException e) {
            log.error("關閉 H2 資料庫連線時發生錯誤。", e);
        }
    }
}
