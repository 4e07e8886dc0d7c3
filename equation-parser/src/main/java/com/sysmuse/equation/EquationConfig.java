package com.sysmuse.equation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sysmuse.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * EquationConfig - parser and logging settings, loaded from a JSON file.
 * <p>
 * Every key is optional:
 * <pre>
 * {
 *   "parser":  { "divisionMode": "LEGACY_SUBTRACT", "evaluationOrder": "LEFT_TO_RIGHT", "maxTerms": 0 },
 *   "logging": { "level": "INFO", "console": true, "file": false, "filename": "equation-parser.log",
 *               "consoleMode": "SPLIT_SEVERE_TO_ERR" }
 * }
 * </pre>
 */
public class EquationConfig {

    public static final String DEFAULT_RESOURCE = "equation-parser.json";
    public static final String DEFAULT_LOG_FILE = "equation-parser.log";

    // Parser parameters with defaults
    private DivisionMode divisionMode = DivisionMode.LEGACY_SUBTRACT;
    private EvaluationOrder evaluationOrder = EvaluationOrder.LEFT_TO_RIGHT;
    private int maxTerms = ExpressionBuilder.DEFAULT_MAX_TERMS;

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private boolean fileLoggingEnabled = false;
    private String logFileName = DEFAULT_LOG_FILE;
    private LoggingUtil.ConsoleOutputMode consoleOutputMode = LoggingUtil.ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    /**
     * Default constructor
     */
    public EquationConfig() {
    }

    /**
     * Constructor that loads from file
     */
    public EquationConfig(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    /**
     * Load the bundled {@value #DEFAULT_RESOURCE} from the classpath, or defaults if it is absent.
     */
    public static EquationConfig loadDefault() throws IOException {
        EquationConfig config = new EquationConfig();
        try (InputStream in = EquationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                config.loadFromStream(in);
            }
        }
        return config;
    }

    /**
     * Load configuration from a JSON file. A missing file keeps the current values.
     */
    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Equation parser config file not found: " + configFilePath);
            LoggingUtil.info("Using default equation parser configuration");
            return;
        }

        apply(new ObjectMapper().readTree(configFile));
        LoggingUtil.debug("Loaded equation parser configuration from: " + configFilePath);
    }

    public void loadFromStream(InputStream in) throws IOException {
        apply(new ObjectMapper().readTree(in));
    }

    private void apply(JsonNode configJson) throws IOException {
        if (configJson == null || !configJson.isObject()) {
            throw new IOException("Equation parser config must be a JSON object");
        }

        if (configJson.has("parser")) {
            JsonNode parserNode = configJson.get("parser");

            if (parserNode.has("divisionMode")) {
                setDivisionMode(DivisionMode.valueOf(parserNode.get("divisionMode").asText().toUpperCase()));
            }

            if (parserNode.has("evaluationOrder")) {
                setEvaluationOrder(EvaluationOrder.valueOf(parserNode.get("evaluationOrder").asText().toUpperCase()));
            }

            if (parserNode.has("maxTerms")) {
                setMaxTerms(parserNode.get("maxTerms").asInt());
            }
        }

        if (configJson.has("logging")) {
            JsonNode loggingNode = configJson.get("logging");

            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }

            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }

            if (loggingNode.has("file")) {
                fileLoggingEnabled = loggingNode.get("file").asBoolean();
            }

            if (loggingNode.has("filename")) {
                logFileName = loggingNode.get("filename").asText();
            }

            if (loggingNode.has("consoleMode")) {
                setConsoleOutputMode(LoggingUtil.ConsoleOutputMode.valueOf(
                        loggingNode.get("consoleMode").asText().toUpperCase()));
            }
        }
    }

    /**
     * Save configuration to a JSON file
     */
    public void saveToFile(String configFilePath) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);

        ObjectNode rootNode = mapper.createObjectNode();

        ObjectNode parserNode = rootNode.putObject("parser");
        parserNode.put("divisionMode", divisionMode.name());
        parserNode.put("evaluationOrder", evaluationOrder.name());
        parserNode.put("maxTerms", maxTerms);

        ObjectNode loggingNode = rootNode.putObject("logging");
        loggingNode.put("level", loggingLevel);
        loggingNode.put("console", consoleLoggingEnabled);
        loggingNode.put("file", fileLoggingEnabled);
        loggingNode.put("filename", logFileName);
        loggingNode.put("consoleMode", consoleOutputMode.name());

        mapper.writeValue(new File(configFilePath), rootNode);
        LoggingUtil.info("Saved equation parser configuration to: " + configFilePath);
    }

    // Getters and setters

    public DivisionMode getDivisionMode() {
        return divisionMode;
    }

    public void setDivisionMode(DivisionMode divisionMode) {
        if (divisionMode == null) {
            throw new IllegalArgumentException("divisionMode must not be null");
        }
        this.divisionMode = divisionMode;
    }

    public EvaluationOrder getEvaluationOrder() {
        return evaluationOrder;
    }

    public void setEvaluationOrder(EvaluationOrder evaluationOrder) {
        if (evaluationOrder == null) {
            throw new IllegalArgumentException("evaluationOrder must not be null");
        }
        this.evaluationOrder = evaluationOrder;
    }

    public int getMaxTerms() {
        return maxTerms;
    }

    public void setMaxTerms(int maxTerms) {
        if (maxTerms < 0) {
            throw new IllegalArgumentException("maxTerms must be >= 0 but was " + maxTerms);
        }
        this.maxTerms = maxTerms;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public void setFileLoggingEnabled(boolean fileLoggingEnabled) {
        this.fileLoggingEnabled = fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }

    public LoggingUtil.ConsoleOutputMode getConsoleOutputMode() {
        return consoleOutputMode;
    }

    public void setConsoleOutputMode(LoggingUtil.ConsoleOutputMode consoleOutputMode) {
        if (consoleOutputMode == null) {
            throw new IllegalArgumentException("consoleOutputMode must not be null");
        }
        this.consoleOutputMode = consoleOutputMode;
    }
}
