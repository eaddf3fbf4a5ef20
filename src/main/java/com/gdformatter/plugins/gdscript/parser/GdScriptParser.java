package com.gdformatter.plugins.gdscript.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import com.gdformatter.util.LoggerUtil;

/**
 * Recursive-descent parser for the supported GDScript subset.
 * Produces an immutable {@link Tree} whose statement nodes carry
 * 1-based start and end lines.
 */
public class GdScriptParser {
    private static final Logger logger = LoggerUtil.getLogger(GdScriptParser.class);

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "**=", "&=", "|=", "^=", "<<=", ">>=");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("==", "!=", "<", ">", "<=", ">=");
    private static final Set<String> LITERAL_KEYWORDS = Set.of("true", "false", "null");
    private static final Set<String> UNSUPPORTED_KEYWORDS = Set.of("setget", "yield", "onready", "export", "tool");

    /**
     * Parses source text into a tree rooted at a {@link NodeKind#FILE} node.
     */
    public Tree parse(String source) throws GdScriptSyntaxException {
        List<Token> tokens = new GdScriptTokenizer(source).tokenize();
        Tree file = new Parsing(tokens, SourceLines.count(source)).file();
        logger.fine("Parsed " + file.size() + " top-level statements");
        return file;
    }

    /**
     * Collects every comment in the source, in order.
     */
    public List<CommentToken> parseComments(String source) throws GdScriptSyntaxException {
        GdScriptTokenizer tokenizer = new GdScriptTokenizer(source);
        tokenizer.tokenize();
        return tokenizer.getComments();
    }

    private enum Scope {
        CLASS,
        FUNCTION
    }

    /**
     * State of one parse run.
     */
    private static final class Parsing {
        private final List<Token> tokens;
        private final int lineCount;
        private int index;

        Parsing(List<Token> tokens, int lineCount) {
            this.tokens = tokens;
            this.lineCount = lineCount;
        }

        Tree file() throws GdScriptSyntaxException {
            List<Tree> statements = new ArrayList<>();
            _skipNewLines();
            while (peek().getKind() != TokenKind.EOF) {
                statements.addAll(statementLine(Scope.CLASS));
                _skipNewLines();
            }
            return new Tree(NodeKind.FILE, statements, 1, Math.max(1, lineCount));
        }

        // ---- statements

        private List<Tree> statementLine(Scope scope) throws GdScriptSyntaxException {
            Token first = peek();
            if (first.getKind() == TokenKind.INDENT) {
                throw _error("Unexpected indentation", first);
            }
            Tree compound = scope == Scope.CLASS ? _classCompound() : _functionCompound();
            if (compound != null) {
                return List.of(compound);
            }
            return _simpleStatements(scope);
        }

        private List<Tree> _simpleStatements(Scope scope) throws GdScriptSyntaxException {
            List<Tree> statements = new ArrayList<>();
            while (true) {
                statements.add(scope == Scope.CLASS ? _classSimple() : _functionSimple());
                if (accept(TokenKind.OPERATOR, ";") != null) {
                    if (peek().getKind() == TokenKind.NEWLINE) {
                        next();
                        return statements;
                    }
                    continue;
                }
                expect(TokenKind.NEWLINE, "end of line");
                return statements;
            }
        }

        private Tree _classCompound() throws GdScriptSyntaxException {
            Token first = peek();
            if (first.isKeyword("class") && peek(1).getKind() == TokenKind.NAME) {
                next();
                Token name = expect(TokenKind.NAME, "class name");
                expectOperator(":");
                List<SyntaxElement> children = new ArrayList<>();
                children.add(name);
                children.addAll(block(Scope.CLASS));
                return new Tree(NodeKind.CLASS_DEF, children, first.getLine(), _lastLine(children));
            }
            if (first.isKeyword("func")) {
                return _func();
            }
            if (first.isKeyword("static")) {
                next();
                if (!peek().isKeyword("func")) {
                    throw _error("Expected 'func' after 'static'", peek());
                }
                Tree func = _func();
                return new Tree(NodeKind.STATIC_FUNC_DEF, List.of(func), first.getLine(), func.getEndLine());
            }
            return null;
        }

        private Tree _func() throws GdScriptSyntaxException {
            Token keyword = next();
            Token name = expect(TokenKind.NAME, "function name");
            Tree parameters = parameters();
            List<SyntaxElement> headerChildren = new ArrayList<>(List.of(name, parameters));
            if (accept(TokenKind.OPERATOR, "->") != null) {
                headerChildren.add(type());
            }
            Token colon = expectOperator(":");
            Tree header = new Tree(NodeKind.FUNC_HEADER, headerChildren, keyword.getLine(), colon.getLine());
            List<SyntaxElement> children = new ArrayList<>();
            children.add(header);
            children.addAll(block(Scope.FUNCTION));
            return new Tree(NodeKind.FUNC_DEF, children, keyword.getLine(), _lastLine(children));
        }

        private Tree _classSimple() throws GdScriptSyntaxException {
            Token first = peek();
            if (first.isOperator("@")) {
                throw _error("Annotations are not supported", first);
            }
            if (first.getKind() != TokenKind.NAME) {
                throw _error("Unexpected '" + first.getValue() + "' at class scope", first);
            }
            switch (first.getValue()) {
                case "pass":
                    next();
                    return new Tree(NodeKind.PASS_STMT, List.of(first), first.getLine(), first.getLine());
                case "extends":
                    next();
                    return _extends(NodeKind.EXTENDS_STMT, new ArrayList<>(), first);
                case "class_name": {
                    next();
                    Token name = expect(TokenKind.NAME, "class name");
                    if (accept(TokenKind.NAME, "extends") != null) {
                        List<SyntaxElement> children = new ArrayList<>();
                        children.add(name);
                        return _extends(NodeKind.CLASSNAME_EXTENDS_STMT, children, first);
                    }
                    return new Tree(NodeKind.CLASSNAME_STMT, List.of(name), first.getLine(), name.getLine());
                }
                case "var":
                    return _variable(NodeKind.CLASS_VAR_STMT);
                case "const":
                    return _const();
                case "signal":
                    return _signal();
                case "enum":
                    return _enum();
                default:
                    if (UNSUPPORTED_KEYWORDS.contains(first.getValue())) {
                        throw _error("'" + first.getValue() + "' is not supported", first);
                    }
                    throw _error("Unexpected '" + first.getValue() + "' at class scope", first);
            }
        }

        private Tree _extends(NodeKind kind, List<SyntaxElement> children, Token keyword)
                throws GdScriptSyntaxException {
            Token target = next();
            if (target.getKind() != TokenKind.NAME && target.getKind() != TokenKind.STRING) {
                throw _error("Expected class or path after 'extends'", target);
            }
            children.add(target);
            while (accept(TokenKind.OPERATOR, ".") != null) {
                children.add(expect(TokenKind.NAME, "attribute name"));
            }
            return new Tree(kind, children, keyword.getLine(), _lastLine(children));
        }

        private Tree _variable(NodeKind kind) throws GdScriptSyntaxException {
            Token keyword = next();
            List<SyntaxElement> children = _declaration(keyword, false);
            return new Tree(kind, children, keyword.getLine(), _lastLine(children));
        }

        private Tree _const() throws GdScriptSyntaxException {
            Token keyword = next();
            List<SyntaxElement> children = _declaration(keyword, true);
            return new Tree(NodeKind.CONST_STMT, children, keyword.getLine(), _lastLine(children));
        }

        /**
         * NAME [: TYPE] [(= | :=) expression]; the value is mandatory for constants.
         */
        private List<SyntaxElement> _declaration(Token keyword, boolean valueRequired) throws GdScriptSyntaxException {
            List<SyntaxElement> children = new ArrayList<>();
            children.add(expect(TokenKind.NAME, "name after '" + keyword.getValue() + "'"));
            if (accept(TokenKind.OPERATOR, ":") != null) {
                children.add(type());
            }
            Token operator = peek();
            boolean inferred = operator.isOperator(":=") && children.size() == 1;
            if (operator.isOperator("=") || inferred) {
                next();
                children.add(operator);
                children.add(expression());
            } else if (valueRequired) {
                throw _error("Expected '=' or ':=' in constant declaration", operator);
            }
            return children;
        }

        private Tree _signal() throws GdScriptSyntaxException {
            Token keyword = next();
            Token name = expect(TokenKind.NAME, "signal name");
            if (peek().isOperator("(")) {
                Tree parameters = parameters();
                return new Tree(NodeKind.SIGNAL_STMT, List.of(name, parameters), keyword.getLine(),
                        parameters.getEndLine());
            }
            return new Tree(NodeKind.SIGNAL_STMT, List.of(name), keyword.getLine(), name.getLine());
        }

        private Tree _enum() throws GdScriptSyntaxException {
            Token keyword = next();
            List<SyntaxElement> children = new ArrayList<>();
            if (peek().getKind() == TokenKind.NAME) {
                children.add(next());
            }
            Token open = expectOperator("{");
            List<SyntaxElement> elements = new ArrayList<>();
            while (!peek().isOperator("}")) {
                Token name = expect(TokenKind.NAME, "enum element");
                if (accept(TokenKind.OPERATOR, "=") != null) {
                    elements.add(Tree.of(NodeKind.ENUM_ELEMENT, List.of(name, expression())));
                } else {
                    elements.add(Tree.of(NodeKind.ENUM_ELEMENT, List.of(name)));
                }
                if (accept(TokenKind.OPERATOR, ",") == null) {
                    break;
                }
            }
            Token close = expectOperator("}");
            children.add(new Tree(NodeKind.ENUM_BODY, elements, open.getLine(), close.getLine()));
            return new Tree(NodeKind.ENUM_STMT, children, keyword.getLine(), close.getLine());
        }

        private Tree _functionCompound() throws GdScriptSyntaxException {
            Token first = peek();
            if (first.getKind() != TokenKind.NAME) {
                return null;
            }
            switch (first.getValue()) {
                case "if":
                    return _if();
                case "while": {
                    next();
                    Tree condition = expression();
                    expectOperator(":");
                    List<SyntaxElement> children = new ArrayList<>();
                    children.add(condition);
                    children.addAll(block(Scope.FUNCTION));
                    return new Tree(NodeKind.WHILE_STMT, children, first.getLine(), _lastLine(children));
                }
                case "for": {
                    next();
                    List<SyntaxElement> children = new ArrayList<>();
                    children.add(expect(TokenKind.NAME, "loop variable"));
                    if (accept(TokenKind.OPERATOR, ":") != null) {
                        children.add(type());
                    }
                    if (accept(TokenKind.NAME, "in") == null) {
                        throw _error("Expected 'in' but found " + _describe(peek()), peek());
                    }
                    children.add(expression());
                    expectOperator(":");
                    children.addAll(block(Scope.FUNCTION));
                    return new Tree(NodeKind.FOR_STMT, children, first.getLine(), _lastLine(children));
                }
                case "match":
                    return _match();
                default:
                    return null;
            }
        }

        private Tree _if() throws GdScriptSyntaxException {
            List<Tree> branches = new ArrayList<>();
            branches.add(_conditionalBranch(NodeKind.IF_BRANCH));
            while (peek().isKeyword("elif")) {
                branches.add(_conditionalBranch(NodeKind.ELIF_BRANCH));
            }
            if (peek().isKeyword("else")) {
                Token keyword = next();
                expectOperator(":");
                List<Tree> body = block(Scope.FUNCTION);
                branches.add(new Tree(NodeKind.ELSE_BRANCH, body, keyword.getLine(), _lastLine(body)));
            }
            return Tree.of(NodeKind.IF_STMT, branches);
        }

        private Tree _conditionalBranch(NodeKind kind) throws GdScriptSyntaxException {
            Token keyword = next();
            List<SyntaxElement> children = new ArrayList<>();
            children.add(expression());
            expectOperator(":");
            children.addAll(block(Scope.FUNCTION));
            return new Tree(kind, children, keyword.getLine(), _lastLine(children));
        }

        private Tree _match() throws GdScriptSyntaxException {
            Token keyword = next();
            List<SyntaxElement> children = new ArrayList<>();
            children.add(expression());
            expectOperator(":");
            expect(TokenKind.NEWLINE, "end of line after 'match'");
            expect(TokenKind.INDENT, "indented match branches");
            while (peek().getKind() != TokenKind.DEDENT) {
                children.add(_matchBranch());
                _skipNewLines();
            }
            next();
            return new Tree(NodeKind.MATCH_STMT, children, keyword.getLine(), _lastLine(children));
        }

        private Tree _matchBranch() throws GdScriptSyntaxException {
            List<Tree> patterns = new ArrayList<>();
            patterns.add(expression());
            while (accept(TokenKind.OPERATOR, ",") != null) {
                patterns.add(expression());
            }
            expectOperator(":");
            List<SyntaxElement> children = new ArrayList<>();
            children.add(Tree.of(NodeKind.PATTERN_LIST, patterns));
            children.addAll(block(Scope.FUNCTION));
            return Tree.of(NodeKind.MATCH_BRANCH, children);
        }

        private Tree _functionSimple() throws GdScriptSyntaxException {
            Token first = peek();
            if (first.isOperator("@")) {
                throw _error("Annotations are not supported", first);
            }
            if (first.getKind() == TokenKind.NAME) {
                switch (first.getValue()) {
                    case "pass":
                        next();
                        return new Tree(NodeKind.PASS_STMT, List.of(first), first.getLine(), first.getLine());
                    case "break":
                        next();
                        return new Tree(NodeKind.BREAK_STMT, List.of(first), first.getLine(), first.getLine());
                    case "continue":
                        next();
                        return new Tree(NodeKind.CONTINUE_STMT, List.of(first), first.getLine(), first.getLine());
                    case "var":
                        return _variable(NodeKind.FUNC_VAR_STMT);
                    case "const":
                        return _const();
                    case "return": {
                        next();
                        if (peek().getKind() == TokenKind.NEWLINE || peek().isOperator(";")) {
                            return new Tree(NodeKind.RETURN_STMT, List.of(), first.getLine(), first.getLine());
                        }
                        Tree value = expression();
                        return new Tree(NodeKind.RETURN_STMT, List.of(value), first.getLine(), value.getEndLine());
                    }
                    default:
                        if (UNSUPPORTED_KEYWORDS.contains(first.getValue())) {
                            throw _error("'" + first.getValue() + "' is not supported", first);
                        }
                }
            }
            Tree target = expression();
            Token operator = peek();
            if (operator.getKind() == TokenKind.OPERATOR && ASSIGNMENT_OPERATORS.contains(operator.getValue())) {
                next();
                Tree value = expression();
                Tree assignment = Tree.of(NodeKind.ASSIGNMENT, List.of(target, operator, value));
                return Tree.of(NodeKind.EXPR_STMT, List.of(assignment));
            }
            return Tree.of(NodeKind.EXPR_STMT, List.of(target));
        }

        /**
         * Body after a ':' - either an indented suite or simple statements on the same line.
         */
        private List<Tree> block(Scope scope) throws GdScriptSyntaxException {
            if (peek().getKind() != TokenKind.NEWLINE) {
                return _simpleStatements(scope);
            }
            next();
            expect(TokenKind.INDENT, "indented block");
            List<Tree> statements = new ArrayList<>();
            while (peek().getKind() != TokenKind.DEDENT) {
                statements.addAll(statementLine(scope));
                _skipNewLines();
            }
            next();
            return statements;
        }

        private Tree parameters() throws GdScriptSyntaxException {
            Token open = expectOperator("(");
            List<Tree> parameters = new ArrayList<>();
            while (!peek().isOperator(")")) {
                List<SyntaxElement> children = new ArrayList<>();
                children.add(expect(TokenKind.NAME, "parameter name"));
                if (accept(TokenKind.OPERATOR, ":") != null) {
                    children.add(type());
                }
                Token operator = peek();
                if (operator.isOperator("=") || (operator.isOperator(":=") && children.size() == 1)) {
                    next();
                    children.add(operator);
                    children.add(expression());
                }
                parameters.add(Tree.of(NodeKind.PARAMETER, children));
                if (accept(TokenKind.OPERATOR, ",") == null) {
                    break;
                }
            }
            Token close = expectOperator(")");
            return new Tree(NodeKind.PARAMETERS, parameters, open.getLine(), close.getLine());
        }

        private Tree type() throws GdScriptSyntaxException {
            List<SyntaxElement> children = new ArrayList<>();
            children.add(expect(TokenKind.NAME, "type name"));
            while (peek().isOperator(".") && peek(1).getKind() == TokenKind.NAME) {
                next();
                children.add(next());
            }
            if (peek().isOperator("[")) {
                next();
                children.add(type());
                Token close = expectOperator("]");
                return new Tree(NodeKind.TYPE, children, children.get(0).getLine(), close.getLine());
            }
            return Tree.of(NodeKind.TYPE, children);
        }

        // ---- expressions, lowest precedence first

        Tree expression() throws GdScriptSyntaxException {
            Tree value = _or();
            if (peek().isKeyword("if")) {
                next();
                Tree condition = _or();
                if (accept(TokenKind.NAME, "else") == null) {
                    throw _error("Expected 'else' in conditional expression", peek());
                }
                Tree alternative = expression();
                return Tree.of(NodeKind.TERNARY, List.of(value, condition, alternative));
            }
            return value;
        }

        private Tree _or() throws GdScriptSyntaxException {
            Tree left = _and();
            while (peek().isKeyword("or") || peek().isOperator("||")) {
                Token operator = next();
                left = _binary(left, operator, _and());
            }
            return left;
        }

        private Tree _and() throws GdScriptSyntaxException {
            Tree left = _not();
            while (peek().isKeyword("and") || peek().isOperator("&&")) {
                Token operator = next();
                left = _binary(left, operator, _not());
            }
            return left;
        }

        private Tree _not() throws GdScriptSyntaxException {
            if (peek().isKeyword("not") || peek().isOperator("!")) {
                Token operator = next();
                return Tree.of(NodeKind.UNARY, List.of(operator, _not()));
            }
            return _comparison();
        }

        private Tree _comparison() throws GdScriptSyntaxException {
            Tree left = _bitOr();
            while (true) {
                Token operator = peek();
                if (operator.getKind() == TokenKind.OPERATOR && COMPARISON_OPERATORS.contains(operator.getValue())
                        || operator.isKeyword("in")) {
                    next();
                    left = _binary(left, operator, _bitOr());
                } else if (operator.isKeyword("not") && peek(1).isKeyword("in")) {
                    next();
                    next();
                    Token notIn = new Token(TokenKind.NAME, "not in", operator.getLine(), operator.getColumn());
                    left = _binary(left, notIn, _bitOr());
                } else {
                    return left;
                }
            }
        }

        private Tree _bitOr() throws GdScriptSyntaxException {
            Tree left = _bitXor();
            while (peek().isOperator("|")) {
                Token operator = next();
                left = _binary(left, operator, _bitXor());
            }
            return left;
        }

        private Tree _bitXor() throws GdScriptSyntaxException {
            Tree left = _bitAnd();
            while (peek().isOperator("^")) {
                Token operator = next();
                left = _binary(left, operator, _bitAnd());
            }
            return left;
        }

        private Tree _bitAnd() throws GdScriptSyntaxException {
            Tree left = _shift();
            while (peek().isOperator("&")) {
                Token operator = next();
                left = _binary(left, operator, _shift());
            }
            return left;
        }

        private Tree _shift() throws GdScriptSyntaxException {
            Tree left = _additive();
            while (peek().isOperator("<<") || peek().isOperator(">>")) {
                Token operator = next();
                left = _binary(left, operator, _additive());
            }
            return left;
        }

        private Tree _additive() throws GdScriptSyntaxException {
            Tree left = _multiplicative();
            while (peek().isOperator("+") || peek().isOperator("-")) {
                Token operator = next();
                left = _binary(left, operator, _multiplicative());
            }
            return left;
        }

        private Tree _multiplicative() throws GdScriptSyntaxException {
            Tree left = _unary();
            while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("%")) {
                Token operator = next();
                left = _binary(left, operator, _unary());
            }
            return left;
        }

        private Tree _unary() throws GdScriptSyntaxException {
            Token token = peek();
            if (token.isOperator("-") || token.isOperator("+") || token.isOperator("~")) {
                next();
                return Tree.of(NodeKind.UNARY, List.of(token, _unary()));
            }
            return _power();
        }

        private Tree _power() throws GdScriptSyntaxException {
            Tree left = _typeTest();
            while (peek().isOperator("**")) {
                Token operator = next();
                left = _binary(left, operator, _typeTest());
            }
            return left;
        }

        private Tree _typeTest() throws GdScriptSyntaxException {
            Tree left = _await();
            while (true) {
                Token operator = peek();
                if (operator.isKeyword("is")) {
                    next();
                    if (accept(TokenKind.NAME, "not") != null) {
                        operator = new Token(TokenKind.NAME, "is not", operator.getLine(), operator.getColumn());
                    }
                    left = _binary(left, operator, type());
                } else if (operator.isKeyword("as")) {
                    next();
                    left = _binary(left, operator, type());
                } else {
                    return left;
                }
            }
        }

        private Tree _await() throws GdScriptSyntaxException {
            if (peek().isKeyword("await")) {
                Token keyword = next();
                return Tree.of(NodeKind.AWAIT, List.of(keyword, _await()));
            }
            return _postfix();
        }

        private Tree _postfix() throws GdScriptSyntaxException {
            Tree value = _primary();
            while (true) {
                Token token = peek();
                if (token.isOperator("(")) {
                    Tree arguments = _sequence(NodeKind.ARGUMENTS, "(", ")");
                    value = Tree.of(NodeKind.CALL, List.of(value, arguments));
                } else if (token.isOperator("[")) {
                    next();
                    Tree subscript = expression();
                    Token close = expectOperator("]");
                    value = new Tree(NodeKind.SUBSCRIPT, List.of(value, subscript), value.getLine(), close.getLine());
                } else if (token.isOperator(".")) {
                    next();
                    Token name = expect(TokenKind.NAME, "attribute name");
                    value = Tree.of(NodeKind.ATTRIBUTE, List.of(value, name));
                } else {
                    return value;
                }
            }
        }

        private Tree _primary() throws GdScriptSyntaxException {
            Token token = peek();
            switch (token.getKind()) {
                case NUMBER:
                case STRING:
                    next();
                    return Tree.of(NodeKind.LITERAL, List.of(token));
                case NAME:
                    if (token.isKeyword("var")) {
                        next();
                        Token name = expect(TokenKind.NAME, "binding name");
                        return new Tree(NodeKind.PATTERN_BINDING, List.of(name), token.getLine(), name.getLine());
                    }
                    next();
                    if (LITERAL_KEYWORDS.contains(token.getValue())) {
                        return Tree.of(NodeKind.LITERAL, List.of(token));
                    }
                    return Tree.of(NodeKind.NAME, List.of(token));
                case OPERATOR:
                    return _bracketedOrSpecial(token);
                default:
                    throw _error("Expected an expression", token);
            }
        }

        private Tree _bracketedOrSpecial(Token token) throws GdScriptSyntaxException {
            switch (token.getValue()) {
                case "(": {
                    next();
                    Tree inner = expression();
                    Token close = expectOperator(")");
                    return new Tree(NodeKind.PAREN, List.of(inner), token.getLine(), close.getLine());
                }
                case "[":
                    return _sequence(NodeKind.ARRAY, "[", "]");
                case "{":
                    return _dictionary();
                case "$":
                case "%":
                    return _nodePath();
                case "..":
                    next();
                    return Tree.of(NodeKind.PATTERN_REST, List.of(token));
                default:
                    throw _error("Expected an expression", token);
            }
        }

        private Tree _sequence(NodeKind kind, String open, String close) throws GdScriptSyntaxException {
            Token openToken = expectOperator(open);
            List<Tree> elements = new ArrayList<>();
            while (!peek().isOperator(close)) {
                elements.add(expression());
                if (accept(TokenKind.OPERATOR, ",") == null) {
                    break;
                }
            }
            Token closeToken = expectOperator(close);
            return new Tree(kind, elements, openToken.getLine(), closeToken.getLine());
        }

        private Tree _dictionary() throws GdScriptSyntaxException {
            Token open = expectOperator("{");
            List<Tree> entries = new ArrayList<>();
            while (!peek().isOperator("}")) {
                Tree key = expression();
                if (accept(TokenKind.OPERATOR, ":") != null) {
                    entries.add(Tree.of(NodeKind.DICT_ENTRY_COLON, List.of(key, expression())));
                } else if (accept(TokenKind.OPERATOR, "=") != null) {
                    if (key.getKind() != NodeKind.NAME) {
                        throw _error("Expected a name before '=' in dictionary", peek());
                    }
                    entries.add(Tree.of(NodeKind.DICT_ENTRY_EQ, List.of(key, expression())));
                } else {
                    throw _error("Expected ':' or '=' in dictionary", peek());
                }
                if (accept(TokenKind.OPERATOR, ",") == null) {
                    break;
                }
            }
            Token close = expectOperator("}");
            return new Tree(NodeKind.DICT, entries, open.getLine(), close.getLine());
        }

        /**
         * $Path/To/Node, $"path", %Unique - segments must touch each other.
         */
        private Tree _nodePath() throws GdScriptSyntaxException {
            Token sigil = next();
            Token previous = sigil;
            StringBuilder path = new StringBuilder(sigil.getValue());
            Token segment = peek();
            if (!_touches(previous, segment)
                    || (segment.getKind() != TokenKind.NAME && segment.getKind() != TokenKind.STRING)) {
                throw _error("Expected node path after '" + sigil.getValue() + "'", segment);
            }
            next();
            path.append(segment.getValue());
            previous = segment;
            if (segment.getKind() == TokenKind.NAME) {
                while (peek().isOperator("/") && _touches(previous, peek())
                        && _touches(peek(), peek(1)) && peek(1).getKind() == TokenKind.NAME) {
                    path.append(next().getValue());
                    previous = next();
                    path.append(previous.getValue());
                }
            }
            Token pathToken = new Token(TokenKind.NAME, path.toString(), sigil.getLine(), sigil.getColumn());
            return Tree.of(NodeKind.GET_NODE, List.of(pathToken));
        }

        private static boolean _touches(Token left, Token right) {
            return left.getLine() == right.getLine() && left.getEndColumn() == right.getColumn();
        }

        private Tree _binary(Tree left, Token operator, Tree right) {
            return Tree.of(NodeKind.BINARY, List.of(left, operator, right));
        }

        // ---- token helpers

        private Token peek() {
            return peek(0);
        }

        private Token peek(int offset) {
            int at = Math.min(index + offset, tokens.size() - 1);
            return tokens.get(at);
        }

        private Token next() {
            Token token = tokens.get(index);
            if (index < tokens.size() - 1) {
                index++;
            }
            return token;
        }

        private Token accept(TokenKind kind, String value) {
            if (peek().is(kind, value)) {
                return next();
            }
            return null;
        }

        private Token expect(TokenKind kind, String description) throws GdScriptSyntaxException {
            Token token = peek();
            if (token.getKind() != kind) {
                throw _error("Expected " + description + " but found " + _describe(token), token);
            }
            return next();
        }

        private Token expectOperator(String operator) throws GdScriptSyntaxException {
            Token token = peek();
            if (!token.isOperator(operator)) {
                throw _error("Expected '" + operator + "' but found " + _describe(token), token);
            }
            return next();
        }

        private void _skipNewLines() {
            while (peek().getKind() == TokenKind.NEWLINE) {
                next();
            }
        }

        private static int _lastLine(List<? extends SyntaxElement> children) {
            int last = 0;
            for (SyntaxElement child : children) {
                last = Math.max(last, child.getEndLine());
            }
            return last;
        }

        private static String _describe(Token token) {
            switch (token.getKind()) {
                case NEWLINE:
                    return "end of line";
                case INDENT:
                    return "indentation";
                case DEDENT:
                    return "dedent";
                case EOF:
                    return "end of file";
                default:
                    return "'" + token.getValue() + "'";
            }
        }

        private static GdScriptSyntaxException _error(String message, Token token) {
            return new GdScriptSyntaxException(message, token.getLine(), token.getColumn());
        }
    }
}
