package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.List;

import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.Tree;

/**
 * Dispatcher for statements allowed inside function bodies.
 */
public class FunctionStatementFormatter implements StatementFormatter {
    private final BlockFormatter blockFormatter;
    private final ExpressionFormatter expressionFormatter;

    public FunctionStatementFormatter(BlockFormatter blockFormatter, ExpressionFormatter expressionFormatter) {
        this.blockFormatter = blockFormatter;
        this.expressionFormatter = expressionFormatter;
    }

    @Override
    public Outcome format(Tree statement, Context context) {
        return switch (statement.getKind()) {
            case PASS_STMT -> StatementUtils.formatSimpleStatement("pass", statement, context);
            case BREAK_STMT -> StatementUtils.formatSimpleStatement("break", statement, context);
            case CONTINUE_STMT -> StatementUtils.formatSimpleStatement("continue", statement, context);
            case FUNC_VAR_STMT -> StatementUtils.formatDeclaration("var", statement, context, expressionFormatter);
            case CONST_STMT -> StatementUtils.formatDeclaration("const", statement, context, expressionFormatter);
            case RETURN_STMT -> _formatReturn(statement, context);
            case EXPR_STMT -> _formatExpressionStatement(statement, context);
            case IF_STMT -> _formatIf(statement, context);
            case WHILE_STMT -> _formatLoop("while ", statement.child(0), statement, context);
            case FOR_STMT -> _formatFor(statement, context);
            case MATCH_STMT -> _formatMatch(statement, context);
            case MATCH_BRANCH -> _formatMatchBranch(statement, context);
            case FILE, EXTENDS_STMT, CLASSNAME_STMT, CLASSNAME_EXTENDS_STMT, CLASS_VAR_STMT, SIGNAL_STMT, ENUM_STMT,
                    CLASS_DEF, FUNC_DEF, STATIC_FUNC_DEF, FUNC_HEADER, PARAMETERS, PARAMETER, TYPE, ENUM_BODY,
                    ENUM_ELEMENT, IF_BRANCH, ELIF_BRANCH, ELSE_BRANCH, PATTERN_LIST, PATTERN_BINDING, PATTERN_REST,
                    NAME, LITERAL, GET_NODE, ARRAY, DICT, DICT_ENTRY_COLON, DICT_ENTRY_EQ, PAREN, CALL, ARGUMENTS,
                    SUBSCRIPT, ATTRIBUTE, UNARY, BINARY, TERNARY, AWAIT, ASSIGNMENT ->
                    throw new DispatchMismatchException("function statement", statement.getKind());
        };
    }

    private Outcome _formatReturn(Tree statement, Context context) {
        if (statement.size() == 0) {
            return StatementUtils.formatSimpleStatement("return", statement, context);
        }
        return expressionFormatter.formatExpression(statement.child(0),
                new ExpressionContext("return ", statement.getLine(), "", statement.getEndLine()), context);
    }

    private Outcome _formatExpressionStatement(Tree statement, Context context) {
        Tree expression = statement.child(0);
        if (expression.getKind() == NodeKind.ASSIGNMENT) {
            String prefix = ExpressionToString.toText(expression.get(0)) + " " + expression.token(1).getValue() + " ";
            return expressionFormatter.formatExpression(expression.child(2),
                    new ExpressionContext(prefix, statement.getLine(), "", statement.getEndLine()), context);
        }
        return expressionFormatter.formatExpression(expression,
                new ExpressionContext("", statement.getLine(), "", statement.getEndLine()), context);
    }

    private Outcome _formatIf(Tree statement, Context context) {
        List<FormattedLine> lines = new ArrayList<>();
        int last = context.getPreviouslyProcessedLineNumber();
        for (Tree branch : statement.subtrees()) {
            Outcome rendered = switch (branch.getKind()) {
                case IF_BRANCH -> _formatConditionalBranch("if ", branch, context);
                case ELIF_BRANCH -> _formatConditionalBranch("elif ", branch, context);
                case ELSE_BRANCH -> _formatElseBranch(branch, context);
                default -> throw new DispatchMismatchException("if branch", branch.getKind());
            };
            lines.addAll(rendered.getLines());
            last = rendered.getLastProcessedLine();
        }
        return new Outcome(lines, last);
    }

    private Outcome _formatConditionalBranch(String keyword, Tree branch, Context context) {
        Tree condition = branch.child(0);
        List<Tree> body = branch.subtrees().subList(1, branch.subtrees().size());
        return _formatHeaderAndBody(keyword, condition, ":", branch.getLine(), body, context);
    }

    private Outcome _formatElseBranch(Tree branch, Context context) {
        Outcome header = new Outcome(
                List.of(FormattedLine.of(branch.getLine(), context.getIndentString(), "else:")), branch.getLine());
        return StatementUtils.formatCompound(header, branch.subtrees(), this, context,
                context.getBlankLinePolicies().getFunctionBody(), blockFormatter);
    }

    private Outcome _formatLoop(String keyword, Tree condition, Tree statement, Context context) {
        List<Tree> body = statement.subtrees().subList(1, statement.subtrees().size());
        return _formatHeaderAndBody(keyword, condition, ":", statement.getLine(), body, context);
    }

    private Outcome _formatFor(Tree statement, Context context) {
        String variable = statement.token(0).getValue();
        List<Tree> parts = statement.subtrees();
        int iterableIndex = 0;
        if (parts.get(0).getKind() == NodeKind.TYPE) {
            variable += ": " + ExpressionToString.toText(parts.get(0));
            iterableIndex = 1;
        }
        Tree iterable = parts.get(iterableIndex);
        List<Tree> body = parts.subList(iterableIndex + 1, parts.size());
        return _formatHeaderAndBody("for " + variable + " in ", iterable, ":", statement.getLine(), body, context);
    }

    private Outcome _formatMatch(Tree statement, Context context) {
        List<Tree> branches = statement.subtrees().subList(1, statement.subtrees().size());
        return _formatHeaderAndBody("match ", statement.child(0), ":", statement.getLine(), branches, context);
    }

    private Outcome _formatMatchBranch(Tree branch, Context context) {
        List<Tree> body = branch.subtrees().subList(1, branch.subtrees().size());
        return _formatHeaderAndBody("", branch.child(0), ":", branch.getLine(), body, context);
    }

    private Outcome _formatHeaderAndBody(String prefix, Tree headerExpression, String suffix, int headerLine,
                                         List<Tree> body, Context context) {
        Outcome header = expressionFormatter.formatExpression(headerExpression,
                new ExpressionContext(prefix, headerLine, suffix, headerExpression.getEndLine()), context);
        return StatementUtils.formatCompound(header, body, this, context,
                context.getBlankLinePolicies().getFunctionBody(), blockFormatter);
    }
}
