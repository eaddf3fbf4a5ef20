package com.gdformatter.plugins.gdscript.format;

import java.util.List;

import com.gdformatter.plugins.gdscript.parser.NodeKind;
import com.gdformatter.plugins.gdscript.parser.Token;
import com.gdformatter.plugins.gdscript.parser.TokenKind;
import com.gdformatter.plugins.gdscript.parser.Tree;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatementFormatterDispatchTest {

    private final BlockFormatter blockFormatter = new BlockFormatter();
    private final ExpressionFormatter expressionFormatter = new ExpressionFormatter();
    private final FunctionStatementFormatter functionFormatter =
            new FunctionStatementFormatter(blockFormatter, expressionFormatter);
    private final ClassStatementFormatter classFormatter =
            new ClassStatementFormatter(blockFormatter, expressionFormatter, functionFormatter);

    private static Tree statement(NodeKind kind, String keyword) {
        return new Tree(kind, List.of(new Token(TokenKind.NAME, keyword, 1, 1)), 1, 1);
    }

    @Test
    void class_dispatcher_rejects_function_only_statements() {
        DispatchMismatchException e = assertThrows(DispatchMismatchException.class,
                () -> classFormatter.format(statement(NodeKind.BREAK_STMT, "break"), Context.builder().build()));

        assertEquals(NodeKind.BREAK_STMT, e.getKind());
    }

    @Test
    void function_dispatcher_rejects_class_only_statements() {
        DispatchMismatchException e = assertThrows(DispatchMismatchException.class,
                () -> functionFormatter.format(statement(NodeKind.EXTENDS_STMT, "Node"), Context.builder().build()));

        assertEquals(NodeKind.EXTENDS_STMT, e.getKind());
    }

    @Test
    void both_dispatchers_render_pass() {
        Context context = Context.builder().build().createChildContext(0);

        Outcome fromClass = classFormatter.format(statement(NodeKind.PASS_STMT, "pass"), context);
        Outcome fromFunction = functionFormatter.format(statement(NodeKind.PASS_STMT, "pass"), context);

        assertEquals("\tpass", fromClass.getLines().get(0).getText());
        assertEquals(fromClass.getLines(), fromFunction.getLines());
        assertEquals(1, fromFunction.getLastProcessedLine());
    }
}
