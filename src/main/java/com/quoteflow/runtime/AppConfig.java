package com.quoteflow.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private LlmConfig llm = new LlmConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private PartitionConfig partition = new PartitionConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private EvidenceConfig evidence = new EvidenceConfig();
    private LearningConfig learning = new LearningConfig();
    private PostProcessingConfig postProcessing = new PostProcessingConfig();
    private StorageConfig storage = new StorageConfig();
    private int workerThreads = 4;

    public LlmConfig getLlm() {
        return llm;
    }

    public void setLlm(LlmConfig llm) {
        this.llm = llm == null ? new LlmConfig() : llm;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public PartitionConfig getPartition() {
        return partition;
    }

    public void setPartition(PartitionConfig partition) {
        this.partition = partition == null ? new PartitionConfig() : partition;
    }

    public RetrievalConfig getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalConfig retrieval) {
        this.retrieval = retrieval == null ? new RetrievalConfig() : retrieval;
    }

    public EvidenceConfig getEvidence() {
        return evidence;
    }

    public void setEvidence(EvidenceConfig evidence) {
        this.evidence = evidence == null ? new EvidenceConfig() : evidence;
    }

    public LearningConfig getLearning() {
        return learning;
    }

    public void setLearning(LearningConfig learning) {
        this.learning = learning == null ? new LearningConfig() : learning;
    }

    public PostProcessingConfig getPostProcessing() {
        return postProcessing;
    }

    public void setPostProcessing(PostProcessingConfig postProcessing) {
        this.postProcessing = postProcessing == null ? new PostProcessingConfig() : postProcessing;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LlmConfig {
        private String model = "gemini-2.5-flash-lite";
        private double temperature = 0.1;
        private int timeoutMs = 60000;
        private int maxRetries = 2;
        private long initialBackoffMs = 1000;
        private int maxSourceChars = 20000;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public int getMaxSourceChars() {
            return maxSourceChars;
        }

        public void setMaxSourceChars(int maxSourceChars) {
            this.maxSourceChars = maxSourceChars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private int dimension = 384;

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PartitionConfig {
        private int maxFieldsPerBatch = 40;
        private int maxPromptChars = 24000;

        public int getMaxFieldsPerBatch() {
            return maxFieldsPerBatch;
        }

        public void setMaxFieldsPerBatch(int maxFieldsPerBatch) {
            this.maxFieldsPerBatch = maxFieldsPerBatch;
        }

        public int getMaxPromptChars() {
            return maxPromptChars;
        }

        public void setMaxPromptChars(int maxPromptChars) {
            this.maxPromptChars = maxPromptChars;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalConfig {
        private int examplesPerField = 2;
        private double minSimilarity = 0.2;
        private double similarityWeight = 0.7;
        private double qualityWeight = 0.3;

        public int getExamplesPerField() {
            return examplesPerField;
        }

        public void setExamplesPerField(int examplesPerField) {
            this.examplesPerField = examplesPerField;
        }

        public double getMinSimilarity() {
            return minSimilarity;
        }

        public void setMinSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
        }

        public double getSimilarityWeight() {
            return similarityWeight;
        }

        public void setSimilarityWeight(double similarityWeight) {
            this.similarityWeight = similarityWeight;
        }

        public double getQualityWeight() {
            return qualityWeight;
        }

        public void setQualityWeight(double qualityWeight) {
            this.qualityWeight = qualityWeight;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvidenceConfig {
        private double fuzzyThreshold = 0.85;
        private double tokenSimilarity = 0.85;

        public double getFuzzyThreshold() {
            return fuzzyThreshold;
        }

        public void setFuzzyThreshold(double fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
        }

        public double getTokenSimilarity() {
            return tokenSimilarity;
        }

        public void setTokenSimilarity(double tokenSimilarity) {
            this.tokenSimilarity = tokenSimilarity;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LearningConfig {
        private boolean harvestEnabled = true;
        private double feedbackConfidence = 0.85;
        private double harvestConfidence = 0.75;
        private double harvestConfidenceFloor = 0.8;
        private int curationMinUsage = 5;
        private double curationSuccessRateFloor = 0.3;
        private long curationIntervalMs = 3_600_000;

        public boolean isHarvestEnabled() {
            return harvestEnabled;
        }

        public void setHarvestEnabled(boolean harvestEnabled) {
            this.harvestEnabled = harvestEnabled;
        }

        public double getFeedbackConfidence() {
            return feedbackConfidence;
        }

        public void setFeedbackConfidence(double feedbackConfidence) {
            this.feedbackConfidence = feedbackConfidence;
        }

        public double getHarvestConfidence() {
            return harvestConfidence;
        }

        public void setHarvestConfidence(double harvestConfidence) {
            this.harvestConfidence = harvestConfidence;
        }

        public double getHarvestConfidenceFloor() {
            return harvestConfidenceFloor;
        }

        public void setHarvestConfidenceFloor(double harvestConfidenceFloor) {
            this.harvestConfidenceFloor = harvestConfidenceFloor;
        }

        public int getCurationMinUsage() {
            return curationMinUsage;
        }

        public void setCurationMinUsage(int curationMinUsage) {
            this.curationMinUsage = curationMinUsage;
        }

        public double getCurationSuccessRateFloor() {
            return curationSuccessRateFloor;
        }

        public void setCurationSuccessRateFloor(double curationSuccessRateFloor) {
            this.curationSuccessRateFloor = curationSuccessRateFloor;
        }

        public long getCurationIntervalMs() {
            return curationIntervalMs;
        }

        public void setCurationIntervalMs(long curationIntervalMs) {
            this.curationIntervalMs = curationIntervalMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PostProcessingConfig {
        private List<ExclusiveGroup> exclusiveGroups = new ArrayList<>();
        private Map<String, List<String>> implications = new LinkedHashMap<>();
        private Map<String, String> unitSuffixes = defaultUnitSuffixes();
        private String summaryField = "options_listing";

        public List<ExclusiveGroup> getExclusiveGroups() {
            return exclusiveGroups;
        }

        public void setExclusiveGroups(List<ExclusiveGroup> exclusiveGroups) {
            this.exclusiveGroups = exclusiveGroups == null ? new ArrayList<>() : exclusiveGroups;
        }

        public Map<String, List<String>> getImplications() {
            return implications;
        }

        public void setImplications(Map<String, List<String>> implications) {
            this.implications = implications == null ? new LinkedHashMap<>() : implications;
        }

        public Map<String, String> getUnitSuffixes() {
            return unitSuffixes;
        }

        public void setUnitSuffixes(Map<String, String> unitSuffixes) {
            this.unitSuffixes = unitSuffixes == null ? defaultUnitSuffixes() : unitSuffixes;
        }

        public String getSummaryField() {
            return summaryField;
        }

        public void setSummaryField(String summaryField) {
            this.summaryField = summaryField;
        }

        private static Map<String, String> defaultUnitSuffixes() {
            Map<String, String> suffixes = new LinkedHashMap<>();
            suffixes.put("voltage", "V");
            suffixes.put("hz", " Hz");
            suffixes.put("psi", " PSI");
            suffixes.put("production_speed", " units per minute");
            return suffixes;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExclusiveGroup {
        private String name;
        private List<String> fields = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getFields() {
            return fields;
        }

        public void setFields(List<String> fields) {
            this.fields = fields == null ? new ArrayList<>() : fields;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String examplesPath = ".quoteflow/examples.json";
        private String feedbackPath = ".quoteflow/feedback-log.json";
        private String schemaDir = "src/main/resources/schemas";

        public String getExamplesPath() {
            return examplesPath;
        }

        public void setExamplesPath(String examplesPath) {
            this.examplesPath = examplesPath;
        }

        public String getFeedbackPath() {
            return feedbackPath;
        }

        public void setFeedbackPath(String feedbackPath) {
            this.feedbackPath = feedbackPath;
        }

        public String getSchemaDir() {
            return schemaDir;
        }

        public void setSchemaDir(String schemaDir) {
            this.schemaDir = schemaDir;
        }
    }
}
