package org.dxworks.cobolscope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path output;

    @Test
    void configureAddsCopybookDirectoriesAndTheInputFolder() {
        CobolScopeConfig config = App.configure(CobolScopeConfig.defaults(), TestUtils.SAMPLES,
                new String[]{"in", "out.jsonl", "--copybooks", "copylib", "--cache", "cache"});

        assertEquals(List.of(Paths.get("copylib"), TestUtils.SAMPLES), config.getCopybookPaths());
        assertEquals(Paths.get("cache"), config.getCacheDirectory());
    }

    @Test
    void configureRejectsUnknownOptions() {
        assertThrows(IllegalArgumentException.class, () -> App.configure(CobolScopeConfig.defaults(),
                TestUtils.SAMPLES, new String[]{"in", "out.jsonl", "--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> App.configure(CobolScopeConfig.defaults(),
                TestUtils.SAMPLES, new String[]{"in", "out.jsonl", "--cache"}));
    }

    @Test
    void writesRunModelsAnalyticsAndDoneRecords() throws Exception {
        Path jsonl = output.resolve("result.jsonl");

        App.main(new String[]{TestUtils.SAMPLES.toString(), jsonl.toString()});

        List<JsonNode> records = new ArrayList<>();
        for (String line : Files.readAllLines(jsonl)) {
            records.add(MAPPER.readTree(line));
        }
        assertEquals("run", records.get(0).get("kind").asText());
        assertEquals(8, records.get(0).get("total_files").asInt());

        List<JsonNode> models = new ArrayList<>();
        records.stream().filter(r -> r.get("kind").asText().equals("model")).forEach(models::add);
        assertEquals(8, models.size());
        assertEquals("AUDITLOG.cbl", models.get(0).get("unit").asText());
        assertEquals("AUDITLOG", models.get(0).get("model").get("programId").asText());

        JsonNode analytics = records.get(records.size() - 2);
        assertEquals("analytics", analytics.get("kind").asText());
        assertEquals(5, analytics.get("overview").get("totalPrograms").asInt());

        JsonNode done = records.get(records.size() - 1);
        assertEquals("done", done.get("kind").asText());
        assertEquals(8, done.get("files_analyzed").asInt());
        assertEquals(0, done.get("files_with_errors").asInt());
    }
}
