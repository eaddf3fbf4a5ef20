package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.gdformatter.plugins.gdscript.parser.SyntaxElement;
import com.gdformatter.plugins.gdscript.parser.Token;
import com.gdformatter.plugins.gdscript.parser.Tree;
import com.gdformatter.util.LoggerUtil;

/**
 * Dispatcher for statements allowed at file and class scope.
 */
public class ClassStatementFormatter implements StatementFormatter {
    private static final Logger logger = LoggerUtil.getLogger(ClassStatementFormatter.class);

    private final BlockFormatter blockFormatter;
    private final ExpressionFormatter expressionFormatter;
    private final StatementFormatter functionStatementFormatter;

    public ClassStatementFormatter(BlockFormatter blockFormatter, ExpressionFormatter expressionFormatter,
                                   StatementFormatter functionStatementFormatter) {
        this.blockFormatter = blockFormatter;
        this.expressionFormatter = expressionFormatter;
        this.functionStatementFormatter = functionStatementFormatter;
    }

    @Override
    public Outcome format(Tree statement, Context context) {
        return switch (statement.getKind()) {
            case PASS_STMT -> StatementUtils.formatSimpleStatement("pass", statement, context);
            case EXTENDS_STMT -> StatementUtils.formatSimpleStatement(
                    "extends " + _extendsTarget(statement, 0), statement, context);
            case CLASSNAME_STMT -> StatementUtils.formatSimpleStatement(
                    "class_name " + statement.token(0).getValue(), statement, context);
            case CLASSNAME_EXTENDS_STMT -> StatementUtils.formatSimpleStatement(
                    "class_name " + statement.token(0).getValue() + " extends " + _extendsTarget(statement, 1),
                    statement, context);
            case CLASS_VAR_STMT -> StatementUtils.formatDeclaration("var", statement, context, expressionFormatter);
            case CONST_STMT -> StatementUtils.formatDeclaration("const", statement, context, expressionFormatter);
            case SIGNAL_STMT -> _formatSignal(statement, context);
            case ENUM_STMT -> _formatEnum(statement, context);
            case CLASS_DEF -> _formatClass(statement, context);
            case FUNC_DEF -> _formatFunction(statement, context);
            case STATIC_FUNC_DEF -> _formatStaticFunction(statement, context);
            case FILE, FUNC_VAR_STMT, BREAK_STMT, CONTINUE_STMT, RETURN_STMT, EXPR_STMT, IF_STMT, WHILE_STMT,
                    FOR_STMT, MATCH_STMT, MATCH_BRANCH, FUNC_HEADER, PARAMETERS, PARAMETER, TYPE, ENUM_BODY,
                    ENUM_ELEMENT, IF_BRANCH, ELIF_BRANCH, ELSE_BRANCH, PATTERN_LIST, PATTERN_BINDING, PATTERN_REST,
                    NAME, LITERAL, GET_NODE, ARRAY, DICT, DICT_ENTRY_COLON, DICT_ENTRY_EQ, PAREN, CALL, ARGUMENTS,
                    SUBSCRIPT, ATTRIBUTE, UNARY, BINARY, TERNARY, AWAIT, ASSIGNMENT ->
                    throw new DispatchMismatchException("class statement", statement.getKind());
        };
    }

    private static String _extendsTarget(Tree statement, int from) {
        StringBuilder target = new StringBuilder();
        for (SyntaxElement part : statement.getChildren().subList(from, statement.size())) {
            if (target.length() > 0) {
                target.append('.');
            }
            target.append(((Token) part).getValue());
        }
        return target.toString();
    }

    private Outcome _formatSignal(Tree statement, Context context) {
        String name = statement.token(0).getValue();
        boolean noParameters = statement.size() == 1 || statement.child(1).size() == 0;
        if (noParameters && !ExpressionFormatter.hasCommentInside(statement, context)) {
            return StatementUtils.formatSimpleStatement("signal " + name, statement, context);
        }
        ExpressionContext expressionContext =
                new ExpressionContext("signal " + name, statement.getLine(), "", statement.getEndLine());
        return expressionFormatter.formatExpression(statement.child(1), expressionContext, context);
    }

    private Outcome _formatEnum(Tree statement, Context context) {
        String prefix = statement.size() == 2 ? "enum " + statement.token(0).getValue() + " " : "enum ";
        ExpressionContext expressionContext =
                new ExpressionContext(prefix, statement.getLine(), "", statement.getEndLine());
        return expressionFormatter.formatExpression(statement.last(), expressionContext, context);
    }

    private Outcome _formatClass(Tree statement, Context context) {
        String name = statement.token(0).getValue();
        logger.finer("Formatting inner class " + name);
        Outcome header = new Outcome(
                List.of(FormattedLine.of(statement.getLine(), context.getIndentString(), "class " + name + ":")),
                statement.getLine());
        return StatementUtils.formatCompound(header, statement.subtrees(), this, context,
                context.getBlankLinePolicies().getClassBody(), blockFormatter);
    }

    private Outcome _formatFunction(Tree statement, Context context) {
        Tree header = statement.child(0);
        String name = header.token(0).getValue();
        String suffix = header.size() == 3 ? " -> " + ExpressionToString.toText(header.child(2)) + ":" : ":";
        ExpressionContext expressionContext =
                new ExpressionContext("func " + name, header.getLine(), suffix, header.getEndLine());
        Outcome headerOutcome = expressionFormatter.formatExpression(header.child(1), expressionContext, context);

        List<Tree> body = new ArrayList<>(statement.subtrees());
        body.remove(0);
        return StatementUtils.formatCompound(headerOutcome, body, functionStatementFormatter, context,
                context.getBlankLinePolicies().getFunctionBody(), blockFormatter);
    }

    /**
     * Renders the wrapped function and rewrites its first line to carry the
     * {@code static} keyword.
     */
    private Outcome _formatStaticFunction(Tree statement, Context context) {
        Outcome function = format(statement.child(0), context);
        List<FormattedLine> lines = new ArrayList<>(function.getLines());
        FormattedLine first = lines.get(0);
        lines.set(0, FormattedLine.of(first.getSourceLine(), context.getIndentString(),
                "static " + first.getText().strip()));
        return new Outcome(lines, function.getLastProcessedLine());
    }
}
