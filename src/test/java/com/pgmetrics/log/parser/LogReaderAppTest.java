package com.pgmetrics.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import picocli.CommandLine;

public class LogReaderAppTest {

    @TempDir
    Path tempDir;

    private LogReader reader;

    @BeforeEach
    public void setUp() {
        reader = new LogReader(Clock.fixed(LogReaderTest.NOW, ZoneOffset.UTC));
    }

    @Test
    public void testJsonReport() throws Exception {
        Path log = tempDir.resolve("postgresql.log");
        Files.writeString(log, LogReaderTest.RECENT);
        Path out = tempDir.resolve("report.json");

        int exitCode = new CommandLine(new LogReaderApp(reader)).execute(
                "-f", log.toString(), "--prefix", LogReaderTest.PREFIX, "--json", out.toString());

        assertEquals(0, exitCode);
        JsonNode report = new ObjectMapper().readTree(out.toFile());
        assertEquals(2, report.get("plans").size());
        assertEquals(1, report.get("autovacuums").size());
        assertEquals(1, report.get("deadlocks").size());
        assertEquals("2024-01-15T10:30:00Z", report.get("metadata").get("windowStart").asText());
    }

    @Test
    public void testConfigFile() throws Exception {
        Path log = tempDir.resolve("postgresql.log");
        Files.writeString(log, LogReaderTest.RECENT);
        Path config = tempDir.resolve("reader.properties");
        Files.writeString(config, "log_line_prefix=" + LogReaderTest.PREFIX + "\n"
                + "log.span.minutes=60\n"
                + "log.files=" + log.toString().replace("\\", "/") + "\n");
        Path out = tempDir.resolve("report.json");

        int exitCode = new CommandLine(new LogReaderApp(reader)).execute(
                "--config", config.toString(), "--json", out.toString());

        assertEquals(0, exitCode);
        JsonNode report = new ObjectMapper().readTree(out.toFile());
        assertEquals(2, report.get("deadlocks").size());
    }

    @Test
    public void testNoFiles() {
        int exitCode = new CommandLine(new LogReaderApp(reader)).execute("--prefix", LogReaderTest.PREFIX);
        assertEquals(1, exitCode);
    }

    @Test
    public void testMissingPrefix() throws Exception {
        Path log = tempDir.resolve("postgresql.log");
        Files.writeString(log, LogReaderTest.RECENT);

        int exitCode = new CommandLine(new LogReaderApp(reader)).execute("-f", log.toString(), "--text");
        assertEquals(1, exitCode);
    }

    @Test
    public void testFilesModifiedSince() throws Exception {
        Instant since = Instant.parse("2024-01-15T10:30:00Z");
        Path old = tempDir.resolve("postgresql-09.log");
        Path recent = tempDir.resolve("postgresql-10.log");
        Path current = tempDir.resolve("postgresql-11.log");
        Files.writeString(old, "");
        Files.writeString(recent, "");
        Files.writeString(current, "");
        Files.createDirectory(tempDir.resolve("archive"));
        Files.setLastModifiedTime(old, FileTime.from(Instant.parse("2024-01-15T09:00:00Z")));
        Files.setLastModifiedTime(recent, FileTime.from(since));
        Files.setLastModifiedTime(current, FileTime.from(Instant.parse("2024-01-15T10:34:00Z")));

        assertEquals(List.of(recent, current), LogReaderApp.filesModifiedSince(tempDir, since));
    }
}
