package com.gdformatter.plugins.gdscript.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.SyntaxElement;
import com.gdformatter.plugins.gdscript.parser.Token;
import com.gdformatter.plugins.gdscript.parser.Tree;

/**
 * Lays out an expression between a prefix and a suffix.
 * <p>
 * An expression stays on one line when it fits within the maximum line
 * length and no comment sits inside it. Otherwise bracketed constructs are
 * exploded one element per line, one level deeper, and over-long operator
 * chains are wrapped in parentheses and split before each operator.
 * A comment inside a call chain breaks the call or subscript that holds
 * it. Anything else stays on one line even if it is too long.
 */
public class ExpressionFormatter {
    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("or", 1), Map.entry("||", 1),
            Map.entry("and", 2), Map.entry("&&", 2),
            Map.entry("==", 3), Map.entry("!=", 3), Map.entry("<", 3), Map.entry(">", 3),
            Map.entry("<=", 3), Map.entry(">=", 3), Map.entry("in", 3), Map.entry("not in", 3),
            Map.entry("|", 4),
            Map.entry("^", 5),
            Map.entry("&", 6),
            Map.entry("<<", 7), Map.entry(">>", 7),
            Map.entry("+", 8), Map.entry("-", 8),
            Map.entry("*", 9), Map.entry("/", 9), Map.entry("%", 9),
            Map.entry("**", 10),
            Map.entry("is", 11), Map.entry("is not", 11), Map.entry("as", 11));

    /**
     * Formats an expression at the context's indentation level.
     * The last processed line of the outcome is the suffix line.
     */
    public Outcome formatExpression(Tree expression, ExpressionContext expressionContext, Context context) {
        List<FormattedLine> lines = new ArrayList<>();
        _render(expression, expressionContext.getPrefix(), expressionContext.getPrefixLine(),
                expressionContext.getSuffix(), expressionContext.getSuffixLine(),
                context.getIndentLevel(), context, lines);
        return new Outcome(lines, expressionContext.getSuffixLine());
    }

    private void _render(Tree node, String prefix, int firstLine, String suffix, int lastLine,
                         int level, Context context, List<FormattedLine> out) {
        String singleLine = prefix + ExpressionToString.toText(node) + suffix;
        if (_fits(singleLine, level, context) && !hasCommentInside(node, context)) {
            out.add(FormattedLine.of(firstLine, context.indentStringFor(level), singleLine));
            return;
        }

        switch (node.getKind()) {
            case ARRAY:
                _renderContainer(prefix + "[", node.getChildren(), true, "]", node,
                        firstLine, suffix, lastLine, level, context, out);
                return;
            case DICT:
            case ENUM_BODY:
                _renderContainer(prefix + "{", node.getChildren(), true, "}", node,
                        firstLine, suffix, lastLine, level, context, out);
                return;
            case PARAMETERS:
            case ARGUMENTS:
                _renderContainer(prefix + "(", node.getChildren(), false, ")", node,
                        firstLine, suffix, lastLine, level, context, out);
                return;
            case CALL:
                _renderPostfix(node, "(", node.child(1).getChildren(), ")", prefix,
                        firstLine, suffix, lastLine, level, context, out);
                return;
            case SUBSCRIPT:
                _renderPostfix(node, "[", List.of(node.get(1)), "]", prefix,
                        firstLine, suffix, lastLine, level, context, out);
                return;
            case ATTRIBUTE:
                if (hasCommentInside(node.child(0), context)) {
                    _render(node.child(0), prefix, firstLine, "." + ExpressionToString.toText(node.get(1)) + suffix,
                            lastLine, level, context, out);
                    return;
                }
                break;
            case PAREN:
                _renderParenthesized(prefix, node.child(0), firstLine, suffix, lastLine, level, context, out);
                return;
            case BINARY:
                _renderParenthesized(prefix, node, firstLine, suffix, lastLine, level, context, out);
                return;
            case DICT_ENTRY_COLON:
                _render(node.child(1), prefix + ExpressionToString.toText(node.get(0)) + ": ",
                        firstLine, suffix, lastLine, level, context, out);
                return;
            case DICT_ENTRY_EQ:
                _render(node.child(1), prefix + ExpressionToString.toText(node.get(0)) + " = ",
                        firstLine, suffix, lastLine, level, context, out);
                return;
            case PARAMETER:
            case ENUM_ELEMENT:
                if (ExpressionToString.hasValue(node)) {
                    _render(node.last(), prefix + ExpressionToString.declarationHead(node),
                            firstLine, suffix, lastLine, level, context, out);
                    return;
                }
                break;
            case UNARY:
                _render(node.child(1), prefix + ExpressionToString.unaryOperatorText(node.token(0)),
                        firstLine, suffix, lastLine, level, context, out);
                return;
            case AWAIT:
                _render(node.child(1), prefix + "await ", firstLine, suffix, lastLine, level, context, out);
                return;
            default:
                break;
        }
        out.add(FormattedLine.of(firstLine, context.indentStringFor(level), singleLine));
    }

    private void _renderContainer(String header, List<SyntaxElement> elements, boolean trailingComma,
                                  String closer, Tree node, int firstLine, String suffix, int lastLine,
                                  int level, Context context, List<FormattedLine> out) {
        if (elements.isEmpty() && !hasCommentInside(node, context)) {
            out.add(FormattedLine.of(firstLine, context.indentStringFor(level), header + closer + suffix));
            return;
        }
        out.add(FormattedLine.of(firstLine, context.indentStringFor(level), header));
        _renderElements(elements, trailingComma, closer, node.getEndLine(), suffix, lastLine, level, context, out);
    }

    /**
     * A call or subscript. The part holding a comment is the one broken up:
     * when only the callee or subscripted value has one, the bracket part
     * rides along as its suffix. Otherwise the brackets are exploded, with
     * the callee rendered in front of the opening bracket.
     */
    private void _renderPostfix(Tree node, String opener, List<SyntaxElement> elements, String closer,
                                String prefix, int firstLine, String suffix, int lastLine,
                                int level, Context context, List<FormattedLine> out) {
        Tree head = node.child(0);
        boolean headHasComment = hasCommentInside(head, context);
        boolean tailHasComment = _hasCommentOnLines(Math.max(head.getEndLine(), node.getLine() + 1),
                node.getEndLine(), context);

        if (headHasComment && !tailHasComment) {
            String tail = opener + elements.stream().map(ExpressionToString::toText)
                    .collect(Collectors.joining(", ")) + closer;
            _render(head, prefix, firstLine, tail + suffix, lastLine, level, context, out);
            return;
        }
        if (elements.isEmpty() && !tailHasComment) {
            out.add(FormattedLine.of(firstLine, context.indentStringFor(level),
                    prefix + ExpressionToString.toText(head) + opener + closer + suffix));
            return;
        }
        if (headHasComment) {
            _render(head, prefix, firstLine, opener, head.getEndLine(), level, context, out);
        } else {
            out.add(FormattedLine.of(firstLine, context.indentStringFor(level),
                    prefix + ExpressionToString.toText(head) + opener));
        }
        _renderElements(elements, false, closer, node.getEndLine(), suffix, lastLine, level, context, out);
    }

    private void _renderElements(List<SyntaxElement> elements, boolean trailingComma, String closer, int closerLine,
                                 String suffix, int lastLine, int level, Context context, List<FormattedLine> out) {
        for (int i = 0; i < elements.size(); i++) {
            Tree element = (Tree) elements.get(i);
            boolean last = i == elements.size() - 1;
            String elementSuffix = !last || trailingComma ? "," : "";
            _render(element, "", element.getLine(), elementSuffix, element.getEndLine(), level + 1, context, out);
        }
        out.add(FormattedLine.of(Math.max(lastLine, closerLine), context.indentStringFor(level), closer + suffix));
    }

    /**
     * Parenthesized content on its own lines. An operator chain is split
     * before each operator of its outermost precedence level.
     */
    private void _renderParenthesized(String prefix, Tree inner, int firstLine, String suffix, int lastLine,
                                      int level, Context context, List<FormattedLine> out) {
        out.add(FormattedLine.of(firstLine, context.indentStringFor(level), prefix + "("));
        if (inner.getKind() == NodeKind.BINARY) {
            List<Tree> operands = new ArrayList<>();
            List<Token> operators = new ArrayList<>();
            _flattenChain(inner, _precedence(inner), operands, operators);
            Tree first = operands.get(0);
            _render(first, "", first.getLine(), "", first.getEndLine(), level + 1, context, out);
            for (int i = 1; i < operands.size(); i++) {
                Tree operand = operands.get(i);
                _render(operand, operators.get(i - 1).getValue() + " ", operand.getLine(), "",
                        operand.getEndLine(), level + 1, context, out);
            }
        } else {
            _render(inner, "", inner.getLine(), "", inner.getEndLine(), level + 1, context, out);
        }
        out.add(FormattedLine.of(Math.max(lastLine, inner.getEndLine()), context.indentStringFor(level),
                ")" + suffix));
    }

    private static void _flattenChain(Tree binary, int precedence, List<Tree> operands, List<Token> operators) {
        Tree left = binary.child(0);
        if (left.getKind() == NodeKind.BINARY && _precedence(left) == precedence) {
            _flattenChain(left, precedence, operands, operators);
        } else {
            operands.add(left);
        }
        operators.add(binary.token(1));
        operands.add(binary.child(2));
    }

    private static int _precedence(Tree binary) {
        return BINARY_PRECEDENCE.getOrDefault(binary.token(1).getValue(), 0);
    }

    private static boolean _fits(String text, int level, Context context) {
        int newline = text.indexOf('\n');
        String firstLine = newline < 0 ? text : text.substring(0, newline);
        return context.indentWidthFor(level) + firstLine.length() <= context.getMaxLineLength();
    }

    /**
     * True when a standalone or inline comment sits on a line strictly inside the node's span.
     */
    static boolean hasCommentInside(Tree node, Context context) {
        return _hasCommentOnLines(node.getLine() + 1, node.getEndLine(), context);
    }

    private static boolean _hasCommentOnLines(int from, int to, Context context) {
        return !context.getStandaloneComments().commentsBetween(from, to).isEmpty()
                || !context.getInlineComments().commentsBetween(from, to).isEmpty();
    }
}
