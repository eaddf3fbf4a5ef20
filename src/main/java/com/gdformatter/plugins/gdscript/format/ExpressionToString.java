package com.gdformatter.plugins.gdscript.format;

import java.util.List;
import java.util.stream.Collectors;

import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.SyntaxElement;
import com.gdformatter.plugins.gdscript.parser.Token;
import com.gdformatter.plugins.gdscript.parser.Tree;

/**
 * Single-line rendering of expressions with normalized spacing.
 */
public final class ExpressionToString {

    private ExpressionToString() {
    }

    public static String toText(SyntaxElement element) {
        if (element instanceof Token) {
            return ((Token) element).getValue();
        }
        Tree node = (Tree) element;
        switch (node.getKind()) {
            case NAME:
            case LITERAL:
            case GET_NODE:
                return node.token(0).getValue();
            case TYPE:
                return _type(node);
            case ARRAY:
                return "[" + _join(node.getChildren()) + "]";
            case DICT:
            case ENUM_BODY:
                return "{" + _join(node.getChildren()) + "}";
            case ARGUMENTS:
            case PARAMETERS:
                return "(" + _join(node.getChildren()) + ")";
            case DICT_ENTRY_COLON:
                return toText(node.get(0)) + ": " + toText(node.get(1));
            case DICT_ENTRY_EQ:
                return toText(node.get(0)) + " = " + toText(node.get(1));
            case PAREN:
                return "(" + toText(node.get(0)) + ")";
            case CALL:
                return toText(node.get(0)) + toText(node.get(1));
            case SUBSCRIPT:
                return toText(node.get(0)) + "[" + toText(node.get(1)) + "]";
            case ATTRIBUTE:
                return toText(node.get(0)) + "." + toText(node.get(1));
            case UNARY:
                return unaryOperatorText(node.token(0)) + toText(node.get(1));
            case BINARY:
                return toText(node.get(0)) + " " + node.token(1).getValue() + " " + toText(node.get(2));
            case TERNARY:
                return toText(node.get(0)) + " if " + toText(node.get(1)) + " else " + toText(node.get(2));
            case AWAIT:
                return "await " + toText(node.get(1));
            case ASSIGNMENT:
                return toText(node.get(0)) + " " + node.token(1).getValue() + " " + toText(node.get(2));
            case PARAMETER:
            case ENUM_ELEMENT:
                return declarationHead(node) + (hasValue(node) ? toText(node.last()) : "");
            case PATTERN_LIST:
                return node.getChildren().stream().map(ExpressionToString::toText).collect(Collectors.joining(", "));
            case PATTERN_BINDING:
                return "var " + node.token(0).getValue();
            case PATTERN_REST:
                return "..";
            default:
                throw new DispatchMismatchException("expression", node.getKind());
        }
    }

    /**
     * Everything of a declaration-like node up to its value: {@code name},
     * {@code name: Type}, {@code name = }, {@code name: Type = } or {@code name := }.
     * Works for var, const, parameter and enum element nodes.
     */
    public static String declarationHead(Tree node) {
        StringBuilder head = new StringBuilder(node.token(0).getValue());
        for (SyntaxElement child : node.getChildren().subList(1, node.size())) {
            if (child instanceof Tree && ((Tree) child).getKind() == NodeKind.TYPE) {
                head.append(": ").append(_type((Tree) child));
            } else if (child instanceof Token) {
                head.append(' ').append(((Token) child).getValue()).append(' ');
                return head.toString();
            }
        }
        if (node.getKind() == NodeKind.ENUM_ELEMENT && node.size() == 2) {
            head.append(" = ");
        }
        return head.toString();
    }

    /**
     * Whether a declaration-like node ends with an assigned value.
     */
    public static boolean hasValue(Tree node) {
        if (node.getKind() == NodeKind.ENUM_ELEMENT) {
            return node.size() == 2;
        }
        for (SyntaxElement child : node.getChildren()) {
            if (child instanceof Token && (((Token) child).isOperator("=") || ((Token) child).isOperator(":="))) {
                return true;
            }
        }
        return false;
    }

    public static String unaryOperatorText(Token operator) {
        return operator.getValue().equals("not") ? "not " : operator.getValue();
    }

    private static String _type(Tree type) {
        StringBuilder text = new StringBuilder();
        for (SyntaxElement child : type.getChildren()) {
            if (child instanceof Token) {
                if (text.length() > 0) {
                    text.append('.');
                }
                text.append(((Token) child).getValue());
            } else {
                text.append('[').append(_type((Tree) child)).append(']');
            }
        }
        return text.toString();
    }

    private static String _join(List<SyntaxElement> elements) {
        return elements.stream().map(ExpressionToString::toText).collect(Collectors.joining(", "));
    }
}
