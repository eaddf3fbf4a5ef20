package com.gdformatter.plugins.gdscript.format;

import java.util.List;

import com.gdformatter.plugins.gdscript.parser.Tree;

/**
 * Rendering shared by the class and function statement dispatchers.
 */
final class StatementUtils {

    private StatementUtils() {
    }

    /**
     * One line of fixed text at the context's indentation.
     */
    static Outcome formatSimpleStatement(String text, Tree statement, Context context) {
        return new Outcome(List.of(FormattedLine.of(statement.getLine(), context.getIndentString(), text)),
                statement.getEndLine());
    }

    /**
     * {@code var} and {@code const} declarations: the name, type and operator
     * form the prefix of the value expression.
     */
    static Outcome formatDeclaration(String keyword, Tree statement, Context context,
                                     ExpressionFormatter expressionFormatter) {
        String head = keyword + " " + ExpressionToString.declarationHead(statement);
        if (!ExpressionToString.hasValue(statement)) {
            return formatSimpleStatement(head, statement, context);
        }
        ExpressionContext expressionContext =
                new ExpressionContext(head, statement.getLine(), "", statement.getEndLine());
        return expressionFormatter.formatExpression(statement.last(), expressionContext, context);
    }

    /**
     * A compound statement: its already rendered header followed by its body
     * one level deeper.
     */
    static Outcome formatCompound(Outcome header, List<Tree> body, StatementFormatter bodyFormatter,
                                  Context context, BlankLinePolicy policy, BlockFormatter blockFormatter) {
        Context bodyContext = context.createChildContext(header.getLastProcessedLine());
        return header.followedBy(blockFormatter.formatBlock(body, bodyFormatter, bodyContext, policy));
    }
}
