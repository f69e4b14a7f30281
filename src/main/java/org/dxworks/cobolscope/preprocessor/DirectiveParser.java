package org.dxworks.cobolscope.preprocessor;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.dxworks.cobolscope.preprocessor.generated.CobolDirectiveBaseVisitor;
import org.dxworks.cobolscope.preprocessor.generated.CobolDirectiveLexer;
import org.dxworks.cobolscope.preprocessor.generated.CobolDirectiveParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the text of one COPY or REPLACE statement with the generated {@code CobolDirective} grammar.
 */
public class DirectiveParser {

    public DirectiveStatement parse(String text) {
        CobolDirectiveLexer lexer = new CobolDirectiveLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CobolDirectiveParser parser = new CobolDirectiveParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        return new StatementVisitor().visit(parser.directive());
    }

    private static final class StatementVisitor extends CobolDirectiveBaseVisitor<DirectiveStatement> {

        @Override
        public DirectiveStatement visitDirective(CobolDirectiveParser.DirectiveContext ctx) {
            if (ctx.copyStatement() != null) {
                return visitCopyStatement(ctx.copyStatement());
            }
            return visitReplaceStatement(ctx.replaceStatement());
        }

        @Override
        public DirectiveStatement visitCopyStatement(CobolDirectiveParser.CopyStatementContext ctx) {
            CobolDirectiveParser.CopySourceContext source = ctx.copySource();
            String member = unquote(source.sourceName().getText());
            String library = source.libraryName() != null ? unquote(source.libraryName().getText()) : null;
            List<ReplacementRule> rules = new ArrayList<>();
            for (CobolDirectiveParser.ReplacingPhraseContext phrase : ctx.replacingPhrase()) {
                rules.addAll(rules(phrase.replaceClause()));
            }
            return new CopyStatement(member, library, !ctx.SUPPRESS().isEmpty(), rules);
        }

        @Override
        public DirectiveStatement visitReplaceStatement(CobolDirectiveParser.ReplaceStatementContext ctx) {
            if (ctx.OFF() != null) {
                return new ReplaceStatement(List.of());
            }
            return new ReplaceStatement(rules(ctx.replaceClause()));
        }

        private static List<ReplacementRule> rules(List<CobolDirectiveParser.ReplaceClauseContext> clauses) {
            List<ReplacementRule> rules = new ArrayList<>();
            for (CobolDirectiveParser.ReplaceClauseContext clause : clauses) {
                ReplacementRule.Mode mode = ReplacementRule.Mode.FULL;
                if (clause.LEADING() != null) {
                    mode = ReplacementRule.Mode.LEADING;
                } else if (clause.TRAILING() != null) {
                    mode = ReplacementRule.Mode.TRAILING;
                }
                rules.add(new ReplacementRule(mode,
                        operand(clause.replaceable().operand()),
                        operand(clause.replacement().operand())));
            }
            return rules;
        }

        private static ReplacementOperand operand(CobolDirectiveParser.OperandContext ctx) {
            TerminalNode node = ctx.PSEUDO_TEXT() != null ? ctx.PSEUDO_TEXT()
                    : ctx.STRING() != null ? ctx.STRING() : ctx.WORD();
            return ReplacementOperand.parse(node.getText());
        }
    }

    static String unquote(String raw) {
        String text = raw.trim();
        if (text.length() >= 2 && (text.startsWith("\"") && text.endsWith("\"")
                || text.startsWith("'") && text.endsWith("'"))) {
            text = text.substring(1, text.length() - 1).trim();
        }
        return text;
    }
}
