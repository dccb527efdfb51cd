package com.quoteflow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.quoteflow.embedding.EmbeddingService;
import com.quoteflow.embedding.EmbeddingServices;
import com.quoteflow.engine.ExtractionEngine;
import com.quoteflow.examples.ExampleStore;
import com.quoteflow.examples.JsonFileExampleRepository;
import com.quoteflow.extraction.FieldMap;
import com.quoteflow.extraction.FieldResult;
import com.quoteflow.extraction.HttpLlmExtractionService;
import com.quoteflow.extraction.LlmExtractionService;
import com.quoteflow.feedback.CurationReport;
import com.quoteflow.feedback.CurationScheduler;
import com.quoteflow.feedback.FeedbackLog;
import com.quoteflow.feedback.FeedbackRecord;
import com.quoteflow.feedback.FeedbackRecorder;
import com.quoteflow.feedback.JsonFileFeedbackLog;
import com.quoteflow.feedback.QualityCurator;
import com.quoteflow.feedback.QualityStats;
import com.quoteflow.feedback.QualityStatsCalculator;
import com.quoteflow.runtime.AppConfig;
import com.quoteflow.schema.FieldSchema;
import com.quoteflow.schema.JsonTemplateSchemaProvider;
import com.quoteflow.source.PlainTextSourceProvider;
import com.quoteflow.source.SourceDocument;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "quoteflow-extract",
        mixinStandardHelpOptions = true,
        version = "quoteflow-extract 0.1.0",
        description = "Schema-driven field extraction from machinery quotes with a self-curating example store.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "extract")
    Mode mode;

    @Option(names = "--source", description = "Source text file; line items are read from <file>.items.json when present")
    String source;

    @Option(names = "--variant", description = "Template variant naming the field schema", defaultValue = "default")
    String variant;

    @Option(names = "--category", description = "Domain category scoping example retrieval", defaultValue = "general")
    String category;

    @Option(names = "--schema-dir", description = "Directory holding <variant>.json schemas (overrides config)")
    Path schemaDir;

    @Option(names = "--examples-path", description = "Example store JSON file (overrides config)")
    Path examplesPath;

    @Option(names = "--feedback-path", description = "Feedback log JSON file (overrides config)")
    Path feedbackPath;

    @Option(names = "--output", description = "Write the extraction result as JSON to this file instead of stdout")
    Path output;

    @Option(names = "--field", description = "Field name for feedback mode")
    String field;

    @Option(names = "--context", description = "Input context the corrected value belongs to")
    String context;

    @Option(names = "--original", description = "Value the extraction produced", defaultValue = "")
    String original;

    @Option(names = "--corrected", description = "Value the user corrected it to", defaultValue = "")
    String corrected;

    @Option(names = "--example-id", description = "Example that produced the original value, when known")
    String exampleId;

    @Option(names = "--watch", description = "In curate mode keep running passes on the configured interval", defaultValue = "false")
    boolean watch;

    LlmExtractionService llmService;

    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    enum Mode {
        extract,
        feedback,
        stats,
        curate
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting quoteflow-extract in {} mode", mode);
        log.info("Using config file: {}", configPath);

        OkHttpClient httpClient = HttpLlmExtractionService.httpClient(config.getLlm(), config.getWorkerThreads());
        EmbeddingService embeddingService = EmbeddingServices.fromEnvironment(httpClient, config.getEmbedding().getDimension());
        ExampleStore store = new ExampleStore(new JsonFileExampleRepository(
                examplesPath != null ? examplesPath : Path.of(config.getStorage().getExamplesPath())));
        FeedbackLog feedbackLog = new JsonFileFeedbackLog(
                feedbackPath != null ? feedbackPath : Path.of(config.getStorage().getFeedbackPath()));

        switch (mode) {
            case extract:
                return runExtract(config, httpClient, store, embeddingService, feedbackLog);
            case feedback:
                return runFeedback(config, store, embeddingService, feedbackLog);
            case stats:
                QualityStats stats = new QualityStatsCalculator().compute(store.scan());
                System.out.println(jsonMapper.writeValueAsString(stats));
                return 0;
            case curate:
                return runCurate(config, store, embeddingService);
            default:
                return 2;
        }
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private int runExtract(AppConfig config, OkHttpClient httpClient, ExampleStore store,
            EmbeddingService embeddingService, FeedbackLog feedbackLog) throws IOException {
        if (source == null || source.isBlank()) {
            log.error("--source is required in extract mode");
            return 2;
        }
        LlmExtractionService service = llmService;
        if (service == null) {
            try {
                service = HttpLlmExtractionService.fromEnvironment(
                        httpClient, config.getLlm().getModel(), config.getLlm().getTemperature());
            } catch (IllegalStateException e) {
                log.error("Cannot reach an LLM service: {}", e.getMessage());
                return 2;
            }
        }

        SourceDocument document = new PlainTextSourceProvider().load(source);
        FieldSchema schema = new JsonTemplateSchemaProvider(
                schemaDir != null ? schemaDir : Path.of(config.getStorage().getSchemaDir())).schemaFor(variant);

        FieldMap fields;
        try (ExtractionEngine engine = new ExtractionEngine(config, store, embeddingService, service, feedbackLog)) {
            fields = engine.extractFields(document.fullText(), document.lineItems(), schema, category, variant);
        }

        String json = jsonMapper.writeValueAsString(report(fields));
        if (output != null) {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, json);
            log.info("Wrote {} fields to {}", fields.size(), output);
        } else {
            System.out.println(json);
        }
        fields.needsReview().forEach((status, names) ->
                log.warn("Fields needing review status={} count={} fields={}", status, names.size(), names));
        return 0;
    }

    private int runFeedback(AppConfig config, ExampleStore store, EmbeddingService embeddingService, FeedbackLog feedbackLog) {
        if (field == null || context == null) {
            log.error("--field and --context are required in feedback mode");
            return 2;
        }
        FeedbackRecorder recorder = new FeedbackRecorder(store, embeddingService, feedbackLog, config.getLearning());
        FeedbackRecord record = recorder.recordFeedback(field, context, original, corrected, category, variant, exampleId);
        log.info("Captured feedback id={} field={} type={} createdExample={}",
                record.id(), record.fieldName(), record.feedbackType(), record.createdExampleId());
        return 0;
    }

    private int runCurate(AppConfig config, ExampleStore store, EmbeddingService embeddingService) throws InterruptedException {
        QualityCurator curator = QualityCurator.from(store, embeddingService, config.getLearning());
        CurationReport report = curator.curate();
        log.info("Curation scanned={} deprioritized={} backfilled={}",
                report.scanned(), report.deprioritized(), report.embeddingsBackfilled());
        if (!watch) {
            return 0;
        }
        CountDownLatch stopped = new CountDownLatch(1);
        CurationScheduler scheduler = new CurationScheduler(curator, config.getLearning().getCurationIntervalMs());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.close();
            stopped.countDown();
        }));
        scheduler.start();
        stopped.await();
        return 0;
    }

    static Map<String, Object> report(FieldMap fields) {
        List<Map<String, Object>> rows = new ArrayList<>(fields.size());
        for (FieldResult result : fields.results()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("field", result.fieldName());
            row.put("value", result.value().text());
            row.put("status", result.status());
            row.put("evidenceBacked", result.evidenceBacked());
            row.put("batchId", result.batchId());
            row.put("confidence", result.confidence());
            rows.add(row);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("fields", rows);
        out.put("needsReview", fields.needsReview());
        out.put("suggestions", fields.suggestions());
        out.put("cancelled", fields.cancelled());
        return out;
    }
}
