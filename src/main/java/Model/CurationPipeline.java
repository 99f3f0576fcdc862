package Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class CurationPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CurationPipeline.class);

    private record Scored(QualityAssessment assessment, ImageRecord record) {}

    private final ExecutorService pool;
    private final HashExtractor hasher;
    private final QualityAssessor assessor;
    private final SimilarityGrouper grouper;
    private final BestShotSelector selector;
    private final RecordValidator validator = new RecordValidator();

    public CurationPipeline(CurationConfig config) {
        this(config, new QualityAssessor(config));
    }

    CurationPipeline(CurationConfig config, QualityAssessor assessor) {
        this.pool = Executors.newFixedThreadPool(config.workers());
        this.hasher = new HashExtractor(config.hashMaxDimension());
        this.assessor = assessor;
        this.grouper = new SimilarityGrouper(config);
        this.selector = new BestShotSelector(config);
    }

    public CurationResult run(List<ImageInput> inputs) {
        try {
            return runAsync(inputs).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
    }

    /** Cancelling the returned future before every image is scored yields no groups. */
    public CompletableFuture<CurationResult> runAsync(List<ImageInput> inputs) {
        checkUniqueIds(inputs);
        log.info("Starting curation of {} images", inputs.size());

        List<CompletableFuture<Scored>> tasks = new ArrayList<>(inputs.size());
        for (ImageInput in : inputs) {
            tasks.add(CompletableFuture.supplyAsync(() -> score(in), pool));
        }

        CompletableFuture<CurationResult> result = CompletableFuture
                .allOf(tasks.toArray(new CompletableFuture[0]))
                .thenCompose(v -> groupAndSelect(tasks.stream().map(CompletableFuture::join).toList()));

        result.whenComplete((r, ex) -> {
            if (result.isCancelled()) {
                log.info("Curation cancelled before completion");
                tasks.forEach(t -> t.cancel(false));
            }
        });
        return result;
    }

    private CompletableFuture<CurationResult> groupAndSelect(List<Scored> scored) {
        Map<String, ImageRecord> byId = new LinkedHashMap<>();
        List<QualityAssessment> assessments = new ArrayList<>(scored.size());
        for (Scored s : scored) {
            byId.put(s.record().imageId(), s.record());
            assessments.add(s.assessment());
        }
        Map<String, ImageRecord> records = Map.copyOf(byId);

        List<SimilarityGroup> groups = grouper.group(records.values());

        List<CompletableFuture<SimilarityGroup>> selections = new ArrayList<>(groups.size());
        for (SimilarityGroup g : groups) {
            selections.add(CompletableFuture.supplyAsync(() -> selector.select(g, records), pool));
        }

        return CompletableFuture.allOf(selections.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    List<SimilarityGroup> selected = selections.stream().map(CompletableFuture::join).toList();

                    List<String> violations = validator.validate(assessments, selected);
                    for (String violation : violations) {
                        log.error("Invalid output record: {}", violation);
                    }

                    BatchSummary summary = BatchSummary.of(assessments, byId.values(), selected, violations.size());
                    log.info("Curation completed ({}): {}", summary.status().wireName(), summary.summary());
                    return new CurationResult(assessments, selected, summary);
                });
    }

    private Scored score(ImageInput in) {
        String id = in.imageId();
        BufferedImage img;
        try {
            img = in.source().load();
            if (img == null) throw new IOException("no decoder for image data");
        } catch (IOException | RuntimeException e) {
            log.error("{}: cannot decode image: {}", id, e.toString());
            return failed(in);
        }

        try {
            long pixels = in.resolutionPixels() > 0
                    ? in.resolutionPixels()
                    : (long) img.getWidth() * img.getHeight();

            QualityAssessment qa = assessor.assess(id, img, pixels);
            HashExtractor.Result hashes = hasher.extract(img);
            if (hashes.failed()) qa = qa.withIssue(HashExtractor.HASH_ERROR);

            log.debug("{}: quality {} issues {}", id, qa.qualityScore(), qa.issues());
            return new Scored(qa, ImageRecord.of(in, qa, hashes, pixels));
        } catch (RuntimeException e) {
            log.error("{}: scoring failed", id, e);
            return failed(in);
        }
    }

    private static Scored failed(ImageInput in) {
        QualityAssessment qa = QualityAssessment.fallback(in.imageId()).withIssue(HashExtractor.HASH_ERROR);
        HashExtractor.Result none = new HashExtractor.Result(PerceptualHashes.EMPTY, true);
        return new Scored(qa, ImageRecord.of(in, qa, none, Math.max(0L, in.resolutionPixels())));
    }

    private static void checkUniqueIds(List<ImageInput> inputs) {
        Set<String> seen = new HashSet<>();
        for (ImageInput in : inputs) {
            if (!seen.add(in.imageId())) {
                throw new IllegalArgumentException("Duplicate image id in batch: " + in.imageId());
            }
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
