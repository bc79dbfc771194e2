package com.sentrius.yang;

import com.sentrius.yang.model.YangStatement;

import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

public class YangStatementVisitor extends YANGBaseVisitor<Object> {

    @Override
    public List<YangStatement> visitDocument(YANGParser.DocumentContext ctx) {
        List<YangStatement> statements = new ArrayList<>();
        for (YANGParser.StatementContext stmtCtx : ctx.statement()) {
            statements.add(visitStatement(stmtCtx));
        }
        return statements;
    }

    @Override
    public YangStatement visitStatement(YANGParser.StatementContext ctx) {
        String keyword = ctx.keyword().getText();
        String argument = null;
        if (ctx.argument() != null) {
            argument = (String) visit(ctx.argument());
        }

        List<YangStatement> substatements = new ArrayList<>();
        if (ctx.block() != null) {
            for (YANGParser.StatementContext childCtx : ctx.block().statement()) {
                substatements.add(visitStatement(childCtx));
            }
        }

        return new YangStatement(keyword, argument, ctx.getStart().getLine(), substatements);
    }

    @Override
    public Object visitQuotedArgument(YANGParser.QuotedArgumentContext ctx) {
        StringBuilder value = new StringBuilder();
        for (TerminalNode part : ctx.STRING()) {
            value.append(YangStrings.unquote(part.getText()));
        }
        return value.toString();
    }

    @Override
    public Object visitUnquotedArgument(YANGParser.UnquotedArgumentContext ctx) {
        return ctx.UNQUOTED().getText();
    }
}
