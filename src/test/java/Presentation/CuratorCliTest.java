package Presentation;

import Model.CurationConfig;
import Model.ImageInput;
import Model.TestImages;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CuratorCliTest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String... args) {
        return new CuratorCli().execute(args,
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private static Path lenientConfig(Path dir) throws IOException {
        Path cfg = dir.resolve("curator.properties");
        Files.writeString(cfg, "min_resolution_pixels=1\nworkers=2\n");
        return cfg;
    }

    @Test
    void parse_readsOptions() {
        CuratorCli.Options o = CuratorCli.parse(new String[]{"photos", "--out", "r.json", "--aesthetic", "s.json"});

        assertEquals(Path.of("photos"), o.folder());
        assertEquals(Path.of("r.json"), o.outFile());
        assertEquals(Path.of("s.json"), o.aestheticFile());
        assertNull(o.configFile());
    }

    @Test
    void parse_rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> CuratorCli.parse(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> CuratorCli.parse(new String[]{"a", "b"}));
        assertThrows(IllegalArgumentException.class, () -> CuratorCli.parse(new String[]{"a", "--out"}));
        assertThrows(IllegalArgumentException.class, () -> CuratorCli.parse(new String[]{"a", "--verbose"}));
    }

    @Test
    void usageErrorExitCode() {
        assertEquals(CuratorCli.EXIT_USAGE, run());
        assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void invalidConfig_isUsageError(@TempDir Path dir) throws IOException {
        Path cfg = dir.resolve("bad.properties");
        Files.writeString(cfg, "similar_threshold=99\n");

        assertEquals(CuratorCli.EXIT_USAGE, run(dir.toString(), "--config", cfg.toString()));
    }

    @Test
    void loadConfig_defaultsFromClasspath() throws IOException {
        CurationConfig c = CuratorCli.loadConfig(null);

        assertEquals(10, c.nearDuplicateThreshold());
        assertEquals(512, c.hashMaxDimension());
    }

    @Test
    void collectInputs_attachesAestheticScores(@TempDir Path dir) throws IOException {
        Path photos = Files.createDirectories(dir.resolve("photos"));
        ImageIO.write(TestImages.stripes(32, 32, 8), "png", photos.resolve("IMG_1.png").toFile());
        ImageIO.write(TestImages.stripes(32, 32, 8), "png", photos.resolve("IMG_2.png").toFile());
        Path scores = dir.resolve("scores.json");
        Files.writeString(scores, "{\"IMG_2\": 5}");

        List<ImageInput> inputs = new CuratorCli().collectInputs(
                new CuratorCli.Options(photos, scores, null, null));

        assertEquals(2, inputs.size());
        assertEquals("IMG_1", inputs.get(0).imageId());
        assertEquals(3, inputs.get(0).aestheticOrDefault());
        assertEquals(5, inputs.get(1).aestheticOrDefault());
        assertEquals(32, inputs.get(1).source().load().getWidth());
    }

    @Test
    void endToEnd_writesReportFile(@TempDir Path dir) throws IOException {
        Path photos = Files.createDirectories(dir.resolve("photos"));
        ImageIO.write(TestImages.stripes(160, 120, 16), "png", photos.resolve("burst_1.png").toFile());
        ImageIO.write(TestImages.stripes(160, 120, 16), "png", photos.resolve("burst_2.png").toFile());
        Path aesthetic = dir.resolve("aesthetic.json");
        Files.writeString(aesthetic, "{\"burst_2\": 5, \"burst_1\": 2}");
        Path out = dir.resolve("out/report.json");

        int code = run(photos.toString(), "--aesthetic", aesthetic.toString(),
                "--out", out.toString(), "--config", lenientConfig(dir).toString());

        assertEquals(CuratorCli.EXIT_OK, code);
        JsonNode report = new ObjectMapper().readTree(out.toFile());
        assertEquals(2, report.get("quality_assessments").size());
        assertEquals("success", report.get("summary").get("status").asText());

        JsonNode group = report.get("similarity_groups").get(0);
        assertEquals("duplicate", group.get("similarity_type").asText());
        assertEquals("burst_2", group.get("selected_best").asText());
    }

    @Test
    void endToEnd_printsToStdoutWithoutOutFile(@TempDir Path dir) throws IOException {
        Path photos = Files.createDirectories(dir.resolve("photos"));
        ImageIO.write(TestImages.stripes(64, 64, 16), "png", photos.resolve("one.png").toFile());
        Files.writeString(photos.resolve("broken.jpg"), "not really a jpeg");

        int code = run(photos.toString(), "--config", lenientConfig(dir).toString());

        assertEquals(CuratorCli.EXIT_OK, code);
        JsonNode report = new ObjectMapper().readTree(stdout.toString(StandardCharsets.UTF_8));
        assertEquals("warning", report.get("summary").get("status").asText());
        assertEquals(1, report.get("summary").get("issue_counts").get("processing_error").asInt());
    }
}
