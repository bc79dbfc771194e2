package com.sentrius.yang;

import com.sentrius.yang.model.ModuleMetadata;
import com.sentrius.yang.model.YangStatement;

/**
 * Reads the header statements of a module or submodule.
 */
public class MetadataExtractor {

    /**
     * Extract namespace, prefix, imports, includes and revision dates from a
     * parsed root statement. Lists keep declaration order and duplicates.
     * @param root The module or submodule statement
     * @param filename The source file name recorded in the metadata
     * @return The metadata; lists are empty when the statements are absent
     */
    public ModuleMetadata extract(YangStatement root, String filename) {
        ModuleMetadata.Builder builder = new ModuleMetadata.Builder(filename);
        if (root == null) {
            return builder.build();
        }

        builder.namespace(root.argumentOf("namespace"));

        String prefix = root.argumentOf("prefix");
        if (prefix == null) {
            YangStatement belongsTo = root.substatement("belongs-to");
            if (belongsTo != null) {
                prefix = belongsTo.argumentOf("prefix");
            }
        }
        builder.prefix(prefix);

        for (YangStatement statement : root.substatements("import")) {
            if (statement.getArgument() != null) {
                builder.addImport(statement.getArgument());
            }
        }
        for (YangStatement statement : root.substatements("include")) {
            if (statement.getArgument() != null) {
                builder.addInclude(statement.getArgument());
            }
        }
        for (YangStatement statement : root.substatements("revision")) {
            if (statement.getArgument() != null) {
                builder.addRevision(statement.getArgument());
            }
        }
        return builder.build();
    }
}
