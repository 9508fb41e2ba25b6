package com.abt.mixfix.syntax;

import java.util.List;

import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.precedence.PrecedenceOrder;
import com.abt.mixfix.term.Binder;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;

/**
 * Precedence-directed printing of nodes.
 *
 * Each call receives the cursor positions to the left and right of the node
 * as seen by its parent ({@code bot} at the top level). The node's own outer
 * positions are its entry position and the exit position of its last field.
 * Brackets are omitted exactly when
 * <pre>
 *   incomingLeft  &lt;= entry   and   incomingRight &lt;= lastExit
 * </pre>
 * holds in the precedence order. Each field is printed between the exit
 * position of the field before it (the entry position for the first) and
 * its own exit position. When the node is bracketed, its first and last
 * fields see {@code bot} on the bracketed side instead.
 */
public final class PrecedencePrinter {

    private PrecedencePrinter() {
        // Utility class
    }

    public static String render(Node node, Mode mode, CursorPosition left, CursorPosition right) {
        Kind kind = node.getKind();
        PrecedenceOrder order = kind.getSyntax().getPrecedenceOrder();
        boolean bracketing = !(order.lessOrEqual(left, kind.getEntry())
                && order.lessOrEqual(right, kind.lastExit()));

        List<FieldSpec> fields = kind.getFields();
        StringBuilder out = new StringBuilder();
        CursorPosition previous = bracketing ? CursorPosition.BOTTOM : kind.getEntry();
        int argument = 0;
        for (int i = 0; i < fields.size(); i++) {
            FieldSpec field = fields.get(i);
            CursorPosition exit = kind.exit(field.getName());
            CursorPosition outgoing = bracketing && i == fields.size() - 1 ? CursorPosition.BOTTOM : exit;

            switch (field.getKind()) {
                case LITERAL -> out.append(field.getSpelling().inMode(mode));
                case TERM -> {
                    Term term = node.getArguments().get(argument++);
                    out.append(term.render(mode, previous, outgoing));
                }
                case BINDER -> {
                    Binder binder = (Binder) node.getArguments().get(argument++);
                    out.append(binder.render(mode, field.getSpelling(), outgoing));
                }
            }
            previous = exit;
        }

        return bracketing ? kind.bracketerFor(mode).bracket(out.toString()) : out.toString();
    }
}
