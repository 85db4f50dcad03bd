package com.dcruver.themerank.app;

import com.dcruver.themerank.config.CacheProperties;
import com.dcruver.themerank.config.PipelineProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreatesWorkingDirectoriesAndOpensWalDatabase() throws Exception {
        CacheProperties cacheProperties = new CacheProperties();
        cacheProperties.setDirectory(tempDir.resolve("cache").toString());
        PipelineProperties pipelineProperties = new PipelineProperties();
        pipelineProperties.setArtifactsDir(tempDir.resolve("runs").toString());
        String database = tempDir.resolve("data/themerank.db").toString();

        DataSource dataSource = new DataSourceConfig().dataSource(database, cacheProperties, pipelineProperties);

        assertTrue(Files.isDirectory(tempDir.resolve("data")));
        assertTrue(Files.isDirectory(tempDir.resolve("cache")));
        assertTrue(Files.isDirectory(tempDir.resolve("runs")));

        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        assertEquals("wal", jdbc.queryForObject("PRAGMA journal_mode", String.class).toLowerCase());
        assertEquals(DataSourceConfig.BUSY_TIMEOUT_MS, jdbc.queryForObject("PRAGMA busy_timeout", Integer.class));
    }

    @Test
    void testExpandsHomeDirectory() {
        String home = System.getProperty("user.home");

        assertEquals(Path.of(home, ".themerank/cache"), DataSourceConfig.expandHome("~/.themerank/cache"));
        assertEquals(Path.of(home, "runs"), DataSourceConfig.expandHome("${user.home}/runs"));
        assertEquals(Path.of("/var/lib/themerank.db"), DataSourceConfig.expandHome("/var/lib/themerank.db"));
    }
}
