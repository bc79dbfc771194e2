package com.sentrius.yang;

import com.sentrius.yang.model.ModuleMetadata;
import com.sentrius.yang.model.NodeProperties;
import com.sentrius.yang.model.NodeType;
import com.sentrius.yang.model.ParseResult;
import com.sentrius.yang.model.ParserKind;
import com.sentrius.yang.model.SchemaNode;
import com.sentrius.yang.model.YangStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Parses documents with the full YANG grammar and maps the resulting statement
 * tree onto {@link SchemaNode}s.
 */
public class PrimaryParser implements SchemaParser {
    private static final Logger logger = LoggerFactory.getLogger(PrimaryParser.class);

    private static final Set<String> DATA_KEYWORDS = Set.of(
        "container", "list", "leaf", "leaf-list", "choice", "case", "grouping",
        "rpc", "action", "input", "output", "notification", "anydata", "anyxml", "augment"
    );

    private final MetadataExtractor metadataExtractor;

    public PrimaryParser() {
        this(new MetadataExtractor());
    }

    public PrimaryParser(MetadataExtractor metadataExtractor) {
        this.metadataExtractor = metadataExtractor;
    }

    @Override
    public ParseResult parse(String content, String filename) {
        ParseResult.Builder result = new ParseResult.Builder(ParserKind.PRIMARY);
        DiagnosticReporter reporter = new DiagnosticReporter();
        ModuleMetadata metadata = null;

        try {
            List<YangStatement> statements = YangStatementParser.parse(content != null ? content : "");
            for (YangStatement statement : statements) {
                String keyword = statement.getKeyword();
                if (!"module".equals(keyword) && !"submodule".equals(keyword)) {
                    reporter.error(statement.getLine(),
                        "Unexpected top-level statement '" + keyword + "', expected module or submodule");
                    continue;
                }
                if (statement.getArgument() == null) {
                    reporter.error(statement.getLine(), "The " + keyword + " statement requires a name");
                    continue;
                }

                checkHeader(statement, reporter);
                result.addModule(toModuleNode(statement));
                if (metadata == null) {
                    metadata = metadataExtractor.extract(statement, filename);
                }
            }
            if (result.moduleCount() == 0) {
                reporter.missingModule();
            }
        } catch (YangParseException e) {
            logger.debug("Grammar rejected {}: {}", filename, e.getMessage());
            reporter.grammarError(e);
        } catch (RuntimeException e) {
            logger.warn("Unexpected failure parsing {}", filename, e);
            reporter.error(1, e.getMessage());
        }

        return result
            .addErrors(reporter.getDiagnostics())
            .metadata(metadata != null ? metadata : ModuleMetadata.empty(filename))
            .valid(!reporter.hasErrors())
            .build();
    }

    private void checkHeader(YangStatement root, DiagnosticReporter reporter) {
        String kind = "module".equals(root.getKeyword()) ? "Module" : "Submodule";
        if ("module".equals(root.getKeyword())) {
            requireSubstatement(root, "namespace", kind, reporter);
            requireSubstatement(root, "prefix", kind, reporter);
        } else {
            requireSubstatement(root, "belongs-to", kind, reporter);
        }
    }

    private void requireSubstatement(YangStatement root, String keyword, String kind,
                                     DiagnosticReporter reporter) {
        if (root.substatement(keyword) == null) {
            reporter.error(root.getLine(),
                kind + " '" + root.getArgument() + "' is missing required '" + keyword + "' statement");
        }
    }

    private SchemaNode toModuleNode(YangStatement root) {
        SchemaNode module = new SchemaNode(NodeType.fromKeyword(root.getKeyword()), root.getArgument(),
            root.getLine());
        module.setDescription(root.argumentOf("description"));
        addChildren(root, module);
        return module;
    }

    private void addChildren(YangStatement parent, SchemaNode target) {
        for (YangStatement child : parent.getSubstatements()) {
            if (DATA_KEYWORDS.contains(child.getKeyword())) {
                target.addChild(toNode(child));
            }
        }
    }

    private SchemaNode toNode(YangStatement statement) {
        String keyword = statement.getKeyword();
        String name = statement.getArgument() != null ? statement.getArgument() : keyword;
        SchemaNode node = new SchemaNode(NodeType.fromKeyword(keyword), name, statement.getLine());

        node.setDescription(statement.argumentOf("description"));
        node.setMandatory("true".equals(statement.argumentOf("mandatory")));
        node.setConfig(!"false".equals(statement.argumentOf("config")));

        NodeProperties properties = node.getProperties();
        YangStatement type = statement.substatement("type");
        if (type != null) {
            properties.setType(type.getArgument());
            properties.setRange(type.argumentOf("range"));
            properties.setLength(type.argumentOf("length"));
            properties.setPattern(type.argumentOf("pattern"));
        }
        properties.setDefaultValue(statement.argumentOf("default"));
        properties.setUnits(statement.argumentOf("units"));
        properties.setStatus(statement.argumentOf("status"));

        addChildren(statement, node);
        return node;
    }
}
