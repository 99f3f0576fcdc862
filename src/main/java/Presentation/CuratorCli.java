package Presentation;

import Model.BatchStatus;
import Model.CurationConfig;
import Model.CurationPipeline;
import Model.CurationResult;
import Model.ImageInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

public final class CuratorCli {

    private static final Logger log = LoggerFactory.getLogger(CuratorCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_BATCH_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String DEFAULT_CONFIG_RESOURCE = "/curator.properties";

    private static final String USAGE = """
            Usage: CuratorCli <image-folder> [--aesthetic scores.json] [--out report.json] [--config curator.properties]
            """;

    record Options(Path folder, Path aestheticFile, Path outFile, Path configFile) {}

    private final ImageScanner scanner = new ImageScanner();
    private final ReportWriter writer = new ReportWriter();
    private final AestheticScoreFile aestheticReader = new AestheticScoreFile(ReportWriter.defaultMapper());

    public static void main(String[] args) {
        System.exit(new CuratorCli().execute(args, System.out, System.err));
    }

    int execute(String[] args, PrintStream out, PrintStream err) {
        Options opts;
        CurationConfig config;
        try {
            opts = parse(args);
            config = loadConfig(opts.configFile());
        } catch (IllegalArgumentException | IOException e) {
            err.println(e.getMessage());
            err.print(USAGE);
            return EXIT_USAGE;
        }

        try (CurationPipeline pipeline = new CurationPipeline(config)) {
            List<ImageInput> inputs = collectInputs(opts);
            CurationResult result = pipeline.run(inputs);

            if (opts.outFile() != null) {
                writer.write(result, opts.outFile());
                log.info("Report written to {}", opts.outFile());
            } else {
                writer.write(result, out);
                out.println();
            }
            return result.summary().status() == BatchStatus.ERROR ? EXIT_BATCH_ERROR : EXIT_OK;
        } catch (IOException e) {
            log.error("Curation failed: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_BATCH_ERROR;
        }
    }

    List<ImageInput> collectInputs(Options opts) throws IOException {
        Map<String, Integer> aesthetic = opts.aestheticFile() == null
                ? Map.of()
                : aestheticReader.read(opts.aestheticFile());

        List<Path> images = scanner.scan(opts.folder());
        log.info("Found {} images under {}", images.size(), opts.folder());

        List<ImageInput> inputs = new ArrayList<>(images.size());
        Set<String> used = new HashSet<>();
        for (Path p : images) {
            String id = scanner.imageId(opts.folder(), p);
            if (!used.add(id)) {
                // same stem, different extension
                id = opts.folder().relativize(p).toString().replace('\\', '/');
                used.add(id);
            }
            inputs.add(new ImageInput(id, () -> ImageIO.read(p.toFile()), aesthetic.get(id), 0L));
        }
        return inputs;
    }

    static Options parse(String[] args) {
        Path folder = null;
        Path aesthetic = null;
        Path out = null;
        Path config = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--aesthetic" -> aesthetic = Paths.get(value(args, ++i, a));
                case "--out" -> out = Paths.get(value(args, ++i, a));
                case "--config" -> config = Paths.get(value(args, ++i, a));
                default -> {
                    if (a.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (folder != null) throw new IllegalArgumentException("Only one image folder may be given");
                    folder = Paths.get(a);
                }
            }
        }
        if (folder == null) throw new IllegalArgumentException("Missing image folder");
        return new Options(folder, aesthetic, out, config);
    }

    static CurationConfig loadConfig(Path file) throws IOException {
        Properties props = new Properties();
        if (file != null) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
            }
        } else {
            try (InputStream in = CuratorCli.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
                if (in != null) props.load(in);
            }
        }
        return CurationConfig.fromProperties(props);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }
}
