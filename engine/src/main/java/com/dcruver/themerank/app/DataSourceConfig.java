package com.dcruver.themerank.app;

import com.dcruver.themerank.config.CacheProperties;
import com.dcruver.themerank.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One SQLite file backs the exact and normalized cache tiers and the job status
 * table. Concurrent runs write to it from several threads, so every connection
 * opens in WAL mode with a busy timeout instead of failing on a locked file.
 *
 * The cache snapshot directory and the run artifact directory are created here
 * too, before any run can start.
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    static final int BUSY_TIMEOUT_MS = 5000;

    @Bean
    public DataSource dataSource(@Value("${themerank.database}") String database,
                                 CacheProperties cacheProperties,
                                 PipelineProperties pipelineProperties) throws IOException {
        Path dbPath = expandHome(database);
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
        Files.createDirectories(expandHome(cacheProperties.getDirectory()));
        Files.createDirectories(expandHome(pipelineProperties.getArtifactsDir()));

        log.info("Using database {}", dbPath.toAbsolutePath());
        return sqliteDataSource(dbPath);
    }

    static DataSource sqliteDataSource(Path dbPath) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath.toAbsolutePath());
        return dataSource;
    }

    static Path expandHome(String location) {
        String home = System.getProperty("user.home");
        String expanded = location.replace("${user.home}", home);
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = home + expanded.substring(1);
        }
        return Path.of(expanded);
    }
}
