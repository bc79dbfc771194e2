package com.sentrius.yang;

import com.sentrius.yang.model.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the grammar parser first and falls back to the recovery parser when the
 * grammar rejects a document.
 *
 * <p>The fallback result replaces the primary one only when the fallback found a
 * module and the primary found none; otherwise the primary result is kept for
 * its more precise diagnostics. Diagnostics of both parsers are merged in either
 * case.
 */
public class ParseCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(ParseCoordinator.class);

    private final SchemaParser primary;
    private final SchemaParser fallback;
    private final String defaultFilename;

    /**
     * @param primary The grammar parser, or null to use the fallback parser only
     * @param fallback The recovery parser
     * @param defaultFilename Name recorded for documents submitted without one
     */
    public ParseCoordinator(SchemaParser primary, SchemaParser fallback, String defaultFilename) {
        if (fallback == null) {
            throw new IllegalArgumentException("Fallback parser cannot be null");
        }
        this.primary = primary;
        this.fallback = fallback;
        this.defaultFilename = defaultFilename;
    }

    public ParseCoordinator(YangExplorerConfiguration configuration) {
        this(configuration.isPrimaryParserEnabled() ? new PrimaryParser() : null,
            new FallbackParser(),
            configuration.getDefaultFilename());
    }

    public ParseResult parseDocument(String content, String filename) {
        String name = filename == null || filename.isBlank() ? defaultFilename : filename;
        if (primary == null) {
            return fallback.parse(content, name);
        }

        ParseResult primaryResult = primary.parse(content, name);
        if (primaryResult.isValid() || primaryResult.getErrors().isEmpty()) {
            return primaryResult;
        }

        logger.warn("Primary parser failed for {}, falling back to line parser: {}",
            name, primaryResult.getErrors().get(0).getMessage());
        ParseResult fallbackResult = fallback.parse(content, name);

        if (!fallbackResult.getModules().isEmpty() && primaryResult.getModules().isEmpty()) {
            logger.debug("Using fallback result for {} ({} module(s))", name, fallbackResult.getModules().size());
            return fallbackResult.withAdditionalErrors(
                DiagnosticReporter.missingFrom(fallbackResult.getErrors(), primaryResult.getErrors()));
        }
        return primaryResult.withAdditionalErrors(
            DiagnosticReporter.missingFrom(primaryResult.getErrors(), fallbackResult.getErrors()));
    }
}
