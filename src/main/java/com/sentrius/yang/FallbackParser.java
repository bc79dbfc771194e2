package com.sentrius.yang;

import com.sentrius.yang.StructuralTokenizer.LogicalLine;
import com.sentrius.yang.StructuralTokenizer.TokenizedDocument;
import com.sentrius.yang.model.ModuleMetadata;
import com.sentrius.yang.model.NodeProperties;
import com.sentrius.yang.model.NodeType;
import com.sentrius.yang.model.ParseResult;
import com.sentrius.yang.model.ParserKind;
import com.sentrius.yang.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented recovery parser. Recognizes statements by keyword at the start
 * of each logical line and attaches nodes to a stack of open scopes, so a
 * partially broken document still yields a tree.
 */
public class FallbackParser implements SchemaParser {
    private static final Logger logger = LoggerFactory.getLogger(FallbackParser.class);

    private static final String NAME = "([^\\s{;]+)";

    private static final Pattern MODULE_PATTERN = Pattern.compile("^(module|submodule)\\s+" + NAME);
    private static final Pattern IMPORT_PATTERN = Pattern.compile("^import\\s+" + NAME);
    private static final Pattern INCLUDE_PATTERN = Pattern.compile("^include\\s+" + NAME);
    private static final Pattern REVISION_PATTERN = Pattern.compile("^revision\\s+" + NAME);
    private static final Pattern SCOPE_PATTERN = Pattern.compile(
        "^(container|list|rpc|notification|grouping|choice|case|augment|action)\\s+" + NAME);
    private static final Pattern LEAF_PATTERN = Pattern.compile("^(leaf|leaf-list|anydata|anyxml)\\s+" + NAME);
    private static final Pattern IO_PATTERN = Pattern.compile("^(input|output)\\s*\\{");
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile(
        "^(namespace|prefix|description|mandatory|config|type|range|length|pattern|default|units|status)" +
        "\\s+(.+?)\\s*[;{]?$", Pattern.DOTALL);
    private static final Pattern KEYWORD_PATTERN = Pattern.compile("^([^\\s{;]+)");
    private static final Pattern QUOTED_PART = Pattern.compile("\"((?:\\\\.|[^\"\\\\])*)\"|'([^']*)'");

    private final StructuralTokenizer tokenizer = new StructuralTokenizer();

    @Override
    public ParseResult parse(String content, String filename) {
        ParseResult.Builder result = new ParseResult.Builder(ParserKind.FALLBACK);
        ModuleMetadata.Builder metadata = new ModuleMetadata.Builder(filename);
        DiagnosticReporter reporter = new DiagnosticReporter();

        try {
            TokenizedDocument document = tokenizer.tokenize(content);
            Scan scan = new Scan(result, metadata);
            for (LogicalLine line : document.getLines()) {
                scan.accept(line);
            }

            if (document.getFinalDepth() != 0) {
                reporter.unmatchedBraces(document.getPhysicalLineCount(), document.getFinalDepth());
            }
            if (document.getUnterminatedStringLine() > 0) {
                reporter.error(document.getUnterminatedStringLine(),
                    "Unterminated string starting at line " + document.getUnterminatedStringLine());
            }
        } catch (RuntimeException e) {
            logger.debug("Fallback scan of {} aborted", filename, e);
            reporter.parseFailure(e);
        }

        if (result.moduleCount() == 0) {
            reporter.missingModule();
        }

        ParseResult parsed = result
            .addErrors(reporter.getDiagnostics())
            .metadata(metadata.build())
            .valid(!reporter.hasErrors())
            .build();
        logger.debug("Fallback parse of {}: {} module(s), {} diagnostic(s)",
            filename, parsed.getModules().size(), parsed.getErrors().size());
        return parsed;
    }

    /**
     * Scan state for one document: the stack of open brace scopes.
     */
    private static final class Scan {
        private final ParseResult.Builder result;
        private final ModuleMetadata.Builder metadata;
        private final List<Frame> stack = new ArrayList<>();

        Scan(ParseResult.Builder result, ModuleMetadata.Builder metadata) {
            this.result = result;
            this.metadata = metadata;
        }

        void accept(LogicalLine line) {
            String text = line.getText();
            if (line.getCloseBraces() > 0) {
                for (int i = 0; i < line.getCloseBraces(); i++) {
                    // the first module frame is never evicted
                    if (stack.size() > 1) {
                        stack.remove(stack.size() - 1);
                    }
                }
                return;
            }

            Matcher m = MODULE_PATTERN.matcher(text);
            if (m.find()) {
                SchemaNode module = new SchemaNode(NodeType.fromKeyword(m.group(1)),
                    YangStrings.unquote(m.group(2)), line.getLineNumber());
                result.addModule(module);
                stack.add(new Frame(module, m.group(1), true));
                return;
            }

            m = IMPORT_PATTERN.matcher(text);
            if (m.find()) {
                metadata.addImport(YangStrings.unquote(m.group(1)));
                openOpaque(line, "import");
                return;
            }

            m = INCLUDE_PATTERN.matcher(text);
            if (m.find()) {
                metadata.addInclude(YangStrings.unquote(m.group(1)));
                openOpaque(line, "include");
                return;
            }

            m = REVISION_PATTERN.matcher(text);
            if (m.find()) {
                metadata.addRevision(YangStrings.unquote(m.group(1)));
                openOpaque(line, "revision");
                return;
            }

            m = SCOPE_PATTERN.matcher(text);
            if (m.find()) {
                SchemaNode node = attach(NodeType.fromKeyword(m.group(1)), YangStrings.unquote(m.group(2)), line);
                if (line.opensBlock()) {
                    stack.add(new Frame(node, m.group(1), true));
                }
                return;
            }

            m = LEAF_PATTERN.matcher(text);
            if (m.find()) {
                SchemaNode node = attach(NodeType.fromKeyword(m.group(1)), YangStrings.unquote(m.group(2)), line);
                if (line.opensBlock()) {
                    stack.add(new Frame(node, m.group(1), false));
                }
                return;
            }

            m = IO_PATTERN.matcher(text);
            if (m.find()) {
                SchemaNode node = attach(NodeType.fromKeyword(m.group(1)), m.group(1), line);
                stack.add(new Frame(node, m.group(1), true));
                return;
            }

            m = ATTRIBUTE_PATTERN.matcher(text);
            if (m.find()) {
                applyAttribute(m.group(1), argument(m.group(2)));
                if (line.opensBlock()) {
                    Frame top = top();
                    SchemaNode owner = top != null && isNodeFrame(top) ? top.node : null;
                    stack.add(new Frame(owner, m.group(1), false));
                }
                return;
            }

            if (line.opensBlock()) {
                Matcher keyword = KEYWORD_PATTERN.matcher(text);
                openOpaque(line, keyword.find() ? keyword.group(1) : "{");
            }
        }

        private SchemaNode attach(NodeType type, String name, LogicalLine line) {
            SchemaNode node = new SchemaNode(type, name, line.getLineNumber());
            SchemaNode parent = insertionParent();
            if (parent != null) {
                parent.addChild(node);
            }
            return node;
        }

        private void openOpaque(LogicalLine line, String keyword) {
            if (line.opensBlock()) {
                stack.add(new Frame(null, keyword, false));
            }
        }

        private void applyAttribute(String keyword, String value) {
            Frame top = top();
            if (top == null) {
                return;
            }

            if ("namespace".equals(keyword)) {
                if (isModuleFrame(top) && !metadata.hasNamespace()) {
                    metadata.namespace(value);
                }
                return;
            }
            if ("prefix".equals(keyword)) {
                if ((isModuleFrame(top) || "belongs-to".equals(top.keyword)) && !metadata.hasPrefix()) {
                    metadata.prefix(value);
                }
                return;
            }

            if (top.node == null) {
                return;
            }
            NodeProperties properties = top.node.getProperties();
            if ("type".equals(top.keyword)) {
                switch (keyword) {
                    case "range":
                        properties.setRange(value);
                        break;
                    case "length":
                        properties.setLength(value);
                        break;
                    case "pattern":
                        if (properties.getPattern() == null) {
                            properties.setPattern(value);
                        }
                        break;
                    default:
                        break;
                }
                return;
            }
            if (!isNodeFrame(top)) {
                return;
            }

            switch (keyword) {
                case "description":
                    top.node.setDescription(value);
                    break;
                case "mandatory":
                    top.node.setMandatory("true".equals(value));
                    break;
                case "config":
                    top.node.setConfig(!"false".equals(value));
                    break;
                case "type":
                    if (properties.getType() == null) {
                        properties.setType(value);
                    }
                    break;
                case "default":
                    properties.setDefaultValue(value);
                    break;
                case "units":
                    properties.setUnits(value);
                    break;
                case "status":
                    properties.setStatus(value);
                    break;
                default:
                    break;
            }
        }

        private SchemaNode insertionParent() {
            for (int i = stack.size() - 1; i >= 0; i--) {
                Frame frame = stack.get(i);
                if (frame.insertionParent) {
                    return frame.node;
                }
            }
            return null;
        }

        private Frame top() {
            return stack.isEmpty() ? null : stack.get(stack.size() - 1);
        }

        private boolean isNodeFrame(Frame frame) {
            return frame.node != null && frame.keyword.equals(frame.node.getType().getKeyword());
        }

        private boolean isModuleFrame(Frame frame) {
            return "module".equals(frame.keyword) || "submodule".equals(frame.keyword);
        }
    }

    private static final class Frame {
        private final SchemaNode node;
        private final String keyword;
        private final boolean insertionParent;

        Frame(SchemaNode node, String keyword, boolean insertionParent) {
            this.node = node;
            this.keyword = keyword;
            this.insertionParent = insertionParent;
        }
    }

    /**
     * Argument text of an attribute line: quoted parts are unquoted and joined,
     * anything else is returned as written.
     */
    static String argument(String raw) {
        String value = raw.trim();
        if (value.isEmpty() || (value.charAt(0) != '"' && value.charAt(0) != '\'')) {
            return value;
        }
        StringBuilder joined = new StringBuilder();
        Matcher m = QUOTED_PART.matcher(value);
        while (m.find()) {
            joined.append(m.group(1) != null ? YangStrings.unescape(m.group(1)) : m.group(2));
        }
        return joined.toString();
    }
}
