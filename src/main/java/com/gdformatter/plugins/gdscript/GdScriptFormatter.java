package com.gdformatter.plugins.gdscript;

import com.gdformatter.api.FormatterPlugin;
import com.gdformatter.api.FormatterResult;
import com.gdformatter.api.error.FormatterError;
import com.gdformatter.config.FormatterConfig;
import com.gdformatter.plugins.gdscript.checks.CheckResult;
import com.gdformatter.plugins.gdscript.checks.CommentPreservationCheck;
import com.gdformatter.plugins.gdscript.checks.FormattingRun;
import com.gdformatter.plugins.gdscript.checks.IdempotenceCheck;
import com.gdformatter.plugins.gdscript.checks.SafetyCheck;
import com.gdformatter.plugins.gdscript.checks.TreeEquivalenceCheck;
import com.gdformatter.plugins.gdscript.format.BlankLinePolicies;
import com.gdformatter.plugins.gdscript.format.BlankLinePolicy;
import com.gdformatter.plugins.gdscript.format.FormattingOptions;
import com.gdformatter.plugins.gdscript.format.GdScriptCodeFormatter;
import com.gdformatter.plugins.gdscript.parser.GdScriptParser;
import com.gdformatter.plugins.gdscript.parser.GdScriptSyntaxException;
import com.gdformatter.plugins.gdscript.parser.ParsedScript;
import com.gdformatter.util.LoggerUtil;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * GDScript formatter plugin. Parses each file, formats it and, unless
 * disabled, runs the safety checks before handing the result back. Parse
 * results are kept in a small bounded cache keyed by source text, so the
 * checks parse the formatted code once between them, and already formatted
 * files are parsed once in total.
 */
public class GdScriptFormatter implements FormatterPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(GdScriptFormatter.class);
    static final String PLUGIN_NAME = "gdscript";
    private static final int CACHE_SIZE = 100;

    private FormattingOptions options = FormattingOptions.defaults();
    private boolean safetyChecks = true;
    private final GdScriptParser parser = new GdScriptParser();
    private final GdScriptCodeFormatter codeFormatter = new GdScriptCodeFormatter();
    private List<SafetyCheck> checks = List.of();

    private final Map<String, ParsedScript> parseCache = new LinkedHashMap<String, ParsedScript>(CACHE_SIZE, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, ParsedScript> eldest) {
            return size() > CACHE_SIZE;
        }
    };

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    @Override
    public void initialize(FormatterConfig config) {
        int lineLength = config.getGeneralConfig("lineLength", FormattingOptions.DEFAULT_MAX_LINE_LENGTH);
        boolean useTabs = config.getGeneralConfig("useTabs", Boolean.TRUE);
        int indentSize = config.getGeneralConfig("indentSize", 4);
        this.options = new FormattingOptions(lineLength, useTabs ? null : indentSize, _blankLinePolicies(config));
        this.safetyChecks = config.getPluginConfig(PLUGIN_NAME, "safetyChecks", Boolean.TRUE);

        List<SafetyCheck> enabled = new ArrayList<>();
        if (safetyChecks) {
            enabled.add(new TreeEquivalenceCheck());
            enabled.add(new CommentPreservationCheck());
            enabled.add(new IdempotenceCheck(codeFormatter));
        }
        this.checks = Collections.unmodifiableList(enabled);
        logger.fine("GDScript plugin initialized: lineLength=" + lineLength
                + ", indent=" + (useTabs ? "tabs" : indentSize + " spaces") + ", safetyChecks=" + safetyChecks);
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        ParsedScript parsed;
        try {
            parsed = _parse(sourceCode);
        } catch (GdScriptSyntaxException e) {
            logger.fine("Syntax error in " + filePath + ": " + e.getMessage());
            return FormatterResult.fatal("Failed to parse GDScript: " + e.getMessage(), e.getLine(), e.getColumn());
        }

        String formattedCode = codeFormatter.formatCode(sourceCode, options, parsed.getTree(), parsed.getComments());

        List<FormatterError> errors = new ArrayList<>();
        FormattingRun run = new FormattingRun(parsed, formattedCode, options, this::_parse);
        for (SafetyCheck check : checks) {
            CheckResult result = check.check(run);
            if (!result.isPassed()) {
                logger.warning("Safety check '" + check.getName() + "' failed for " + filePath);
                errors.addAll(result.getErrors());
            }
        }

        if (!errors.isEmpty()) {
            return FormatterResult.builder()
                    .successful(false)
                    .formattedCode(null)
                    .errors(errors)
                    .build();
        }
        return FormatterResult.builder()
                .successful(true)
                .formattedCode(formattedCode)
                .changed(!formattedCode.equals(sourceCode))
                .build();
    }

    public FormattingOptions getOptions() {
        return options;
    }

    public List<SafetyCheck> getChecks() {
        return checks;
    }

    /**
     * Number of parse results currently cached.
     */
    int cachedScriptCount() {
        readLock.lock();
        try {
            return parseCache.size();
        } finally {
            readLock.unlock();
        }
    }

    private ParsedScript _parse(String sourceCode) throws GdScriptSyntaxException {
        readLock.lock();
        try {
            ParsedScript cached = parseCache.get(sourceCode);
            if (cached != null) {
                return cached;
            }
        } finally {
            readLock.unlock();
        }

        ParsedScript parsed = ParsedScript.parse(parser, sourceCode);

        writeLock.lock();
        try {
            parseCache.put(sourceCode, parsed);
        } finally {
            writeLock.unlock();
        }
        return parsed;
    }

    @SuppressWarnings("unchecked")
    private static BlankLinePolicies _blankLinePolicies(FormatterConfig config) {
        BlankLinePolicies defaults = BlankLinePolicies.defaults();
        Object raw = config.getPluginConfigsMap().getOrDefault(PLUGIN_NAME, Collections.emptyMap()).get("blankLines");
        if (!(raw instanceof Map)) {
            return defaults;
        }
        Map<String, Object> scopes = (Map<String, Object>) raw;
        return new BlankLinePolicies(
                _policy(scopes.get("topLevel"), 2, 2, 2),
                _policy(scopes.get("classBody"), 1, 1, 1),
                _policy(scopes.get("functionBody"), 1, 0, 0));
    }

    @SuppressWarnings("unchecked")
    private static BlankLinePolicy _policy(Object raw, int maxConsecutive, int aroundClasses, int aroundFunctions) {
        if (!(raw instanceof Map)) {
            return BlankLinePolicy.around(maxConsecutive, aroundClasses, aroundFunctions);
        }
        Map<String, Object> counts = (Map<String, Object>) raw;
        return BlankLinePolicy.around(
                _intValue(counts.get("maxConsecutive"), maxConsecutive),
                _intValue(counts.get("class"), aroundClasses),
                _intValue(counts.get("func"), aroundFunctions));
    }

    private static int _intValue(Object value, int defaultValue) {
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    /**
     * Releases cached parse results.
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            parseCache.clear();
        } finally {
            writeLock.unlock();
        }
    }
}
