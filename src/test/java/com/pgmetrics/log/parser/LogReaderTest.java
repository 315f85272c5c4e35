package com.pgmetrics.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;
import com.pgmetrics.log.parser.model.AutoVacuum;
import com.pgmetrics.log.parser.model.Deadlock;
import com.pgmetrics.log.parser.model.Plan;
import com.pgmetrics.log.parser.model.PlanFormat;
import com.pgmetrics.log.prefix.PrefixCompiler;

public class LogReaderTest {

    static final String PREFIX = "%m [%p] %q%u@%d ";

    static final Instant NOW = Instant.parse("2024-01-15T10:35:00Z");

    static final String RECENT = """
            2024-01-15 10:20:00.000 UTC [4240] alice@mydb ERROR:  deadlock detected
            2024-01-15 10:20:00.000 UTC [4240] alice@mydb DETAIL:  too old to be reported
            2024-01-15 10:31:00.000 UTC [4243] alice@mydb ERROR:  deadlock detected
            2024-01-15 10:31:00.000 UTC [4243] alice@mydb DETAIL:  Process 1 waits for ShareLock on transaction 2; blocked by process 3.\t
            \tProcess 3 waits for ShareLock on transaction 4; blocked by process 1.
            2024-01-15 10:31:00.000 UTC [4243] alice@mydb HINT:  See server log for query details.
            2024-01-15 10:32:00.000 UTC [4241] LOG:  automatic vacuum of table "mydb.public.orders": index scans: 1
            \tpages: 0 removed, 45 remain, 0 skipped due to pins, 0 skipped frozen
            \tsystem usage: CPU: user: 0.01 s, system: 0.00 s, elapsed: 12.34 s
            2024-01-15 10:33:00.000 UTC [4244] alice@mydb LOG:  duration: 0.025 ms  plan:
            \t{
            \t  "Query Text": "SELECT 1",
            \t  "Plan": {
            \t    "Node Type": "Result",
            \t    "Plan Rows": 1
            \t  }
            \t}
            2024-01-15 10:34:00.000 UTC [4245] bob@shop LOG:  duration: 1.234 ms  plan:
            \tQuery Text: SELECT * FROM orders WHERE id = 42
            \tIndex Scan using orders_pkey on orders  (cost=0.29..8.30 rows=1 width=97)
            \t  Index Cond: (id = 42)
            2024-01-15 10:34:30.000 UTC [4246] LOG:  checkpoint starting: time
            """;

    @TempDir
    Path tempDir;

    private LogReader reader;
    private Map<String, String> settings;

    @BeforeEach
    public void setUp() {
        reader = new LogReader(Clock.fixed(NOW, ZoneOffset.UTC));
        settings = Map.of(LogReader.LOG_LINE_PREFIX, PREFIX);
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    static String withOldHistory(String recent) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 3000; i++) {
            sb.append(String.format("2024-01-15 09:%02d:%02d.000 UTC [%d] alice@mydb LOG:  statement: SELECT %d\n",
                    (i / 60) % 60, i % 60, 1000 + i, i));
        }
        return sb.append(recent).toString();
    }

    private void assertRecentFacts(LogFactsAccumulator facts) {
        List<Deadlock> deadlocks = facts.getDeadlocks();
        assertEquals(1, deadlocks.size());
        assertEquals(Instant.parse("2024-01-15T10:31:00Z").getEpochSecond(), deadlocks.get(0).getAt());
        assertEquals("Process 1 waits for ShareLock on transaction 2; blocked by process 3.\n"
                + "Process 3 waits for ShareLock on transaction 4; blocked by process 1.\n",
                deadlocks.get(0).getDetail());

        List<AutoVacuum> autoVacuums = facts.getAutoVacuums();
        assertEquals(1, autoVacuums.size());
        assertEquals("mydb.public.orders", autoVacuums.get(0).getTable());
        assertEquals(12.34, autoVacuums.get(0).getElapsed(), 0.0001);
        assertEquals(Instant.parse("2024-01-15T10:32:00Z").getEpochSecond(), autoVacuums.get(0).getAt());

        List<Plan> plans = facts.getPlans();
        assertEquals(2, plans.size());

        Plan json = plans.get(0);
        assertEquals(PlanFormat.JSON, json.getFormat());
        assertEquals("mydb", json.getDatabase());
        assertEquals("alice", json.getUserName());
        assertEquals(Instant.parse("2024-01-15T10:33:00Z").getEpochSecond(), json.getAt());
        assertEquals("SELECT 1", json.getQuery());
        JSONObject body = new JSONObject(json.getPlan());
        assertFalse(body.has("Query Text"));
        assertEquals("Result", body.getJSONObject("Plan").getString("Node Type"));

        Plan text = plans.get(1);
        assertEquals(PlanFormat.TEXT, text.getFormat());
        assertEquals("shop", text.getDatabase());
        assertEquals("bob", text.getUserName());
        assertEquals("SELECT * FROM orders WHERE id = 42", text.getQuery());
        assertEquals("\tIndex Scan using orders_pkey on orders  (cost=0.29..8.30 rows=1 width=97)\n"
                + "\t  Index Cond: (id = 42)\n", text.getPlan());
    }

    @Test
    public void testReadsFactsInWindow() throws Exception {
        Path file = write("postgresql.log", RECENT);
        LogFactsAccumulator facts = new LogFactsAccumulator();

        assertTrue(reader.readLog(settings, 5, file, facts));
        assertRecentFacts(facts);
    }

    @Test
    public void testLargeFileStartsNearWindow() throws Exception {
        Path file = write("postgresql.log", withOldHistory(RECENT));
        assertTrue(Files.size(file) > 20 * WindowLocator.BLOCK_SIZE);

        LogFactsAccumulator facts = new LogFactsAccumulator();
        int lines = LogReader.readLogLines(file, PrefixCompiler.compile(PREFIX),
                reader.windowStart(5), facts);

        // only the lines from 10:31 onwards are inside the window
        assertEquals(7, lines);
        assertRecentFacts(facts);
    }

    @Test
    public void testRereadIsIdentical() throws Exception {
        Path file = write("postgresql.log", withOldHistory(RECENT));
        LogFactsAccumulator first = new LogFactsAccumulator();
        LogFactsAccumulator second = new LogFactsAccumulator();

        assertTrue(reader.readLog(settings, 5, file, first));
        assertTrue(reader.readLog(settings, 5, file, second));

        assertEquals(first.getPlans(), second.getPlans());
        assertEquals(first.getAutoVacuums(), second.getAutoVacuums());
        assertEquals(first.getDeadlocks(), second.getDeadlocks());
    }

    @Test
    public void testWiderSpanIncludesOlderEntries() throws Exception {
        Path file = write("postgresql.log", RECENT);
        LogFactsAccumulator facts = new LogFactsAccumulator();

        assertTrue(reader.readLog(settings, 60, file, facts));
        assertEquals(2, facts.getDeadlocks().size());
        assertEquals("too old to be reported\n", facts.getDeadlocks().get(0).getDetail());
    }

    @Test
    public void testMissingPrefixSetting() throws Exception {
        Path file = write("postgresql.log", RECENT);
        LogFactsAccumulator facts = new LogFactsAccumulator();

        assertFalse(reader.readLog(Map.of(), 5, file, facts));
        assertTrue(facts.isEmpty());
    }

    @Test
    public void testPrefixWithoutTimestamp() throws Exception {
        Path file = write("postgresql.log", RECENT);
        LogFactsAccumulator facts = new LogFactsAccumulator();

        assertFalse(reader.readLog(Map.of(LogReader.LOG_LINE_PREFIX, "[%p] %u@%d "), 5, file, facts));
        assertTrue(facts.isEmpty());
    }

    @Test
    public void testMissingFileDoesNotStopOthers() throws Exception {
        Path good = write("postgresql.log", RECENT);
        Path missing = tempDir.resolve("missing.log");
        LogFactsAccumulator facts = new LogFactsAccumulator();

        assertFalse(reader.readLog(settings, 5, missing, facts));
        assertEquals(1, reader.readLogs(settings, 5, List.of(missing, good), facts));
        assertRecentFacts(facts);
    }

    @Test
    public void testEmptyFile() throws Exception {
        Path file = write("empty.log", "");
        LogFactsAccumulator facts = new LogFactsAccumulator();

        assertTrue(reader.readLog(settings, 5, file, facts));
        assertTrue(facts.isEmpty());
    }

    @Test
    public void testWindowStart() {
        assertEquals(Instant.parse("2024-01-15T10:30:00Z"), reader.windowStart(5));
    }

    @Test
    public void testEpochOutOfRangeStopsQuietly() throws Exception {
        Path file = write("epoch.log", """
                1705314780.000 [alice@mydb] ERROR:  deadlock detected
                1705314790.000 [alice@mydb] LOG:  first
                40000000000000000.000 [alice@mydb] LOG:  bogus
                """);
        LogFactsAccumulator facts = new LogFactsAccumulator();

        assertTrue(reader.readLog(Map.of(LogReader.LOG_LINE_PREFIX, "%n [%u@%d] "), 5, file, facts));
        assertEquals(1, facts.getDeadlocks().size());
    }
}
