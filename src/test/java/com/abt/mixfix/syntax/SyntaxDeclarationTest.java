package com.abt.mixfix.syntax;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.abt.mixfix.exception.DeclarationReuseException;
import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.term.Atom;
import com.abt.mixfix.term.Binder;
import com.abt.mixfix.term.Name;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;
import com.abt.mixfix.term.Var;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for kind declaration: validation, registration, output modes
 * and bracketers.
 */
class SyntaxDeclarationTest {

    private static final Mode LATEX = Mode.of("latex");

    private Syntax syntax;

    @BeforeEach
    void setUp() {
        syntax = new Syntax();
    }

    private Kind declareMul() {
        Kind mul = syntax.declare(KindDeclaration.builder()
                .name("Mul")
                .term("p")
                .literal("times", Spelling.of(" * ").in(LATEX, " \\cdot "))
                .term("q")
                .bracketer(LATEX, s -> "\\left(" + s + "\\right)")
                .build());
        syntax.declareGreaterOrEqual(mul.getEntry(), mul.exit("times"));
        return mul;
    }

    @Test
    void testDeclarationRegistersCursorPositions() {
        Kind mul = declareMul();

        assertThat(mul.getEntry()).isEqualTo(CursorPosition.entry("Mul"));
        assertThat(mul.getExits().values()).extracting(CursorPosition::toString)
                .containsExactly("Mul.p", "Mul.times", "Mul.q");
        assertThat(syntax.getPrecedenceOrder().contains(mul.exit("q"))).isTrue();
        assertThat(mul.lastExit()).isEqualTo(mul.exit("q"));
        assertThat(syntax.findKind("Mul")).containsSame(mul);
        assertThat(syntax.getKinds()).containsExactly(mul);
    }

    @Test
    void testArgumentFieldsExcludeLiterals() {
        Kind mul = declareMul();

        assertThat(mul.getFields()).hasSize(3);
        assertThat(mul.getArgumentFields()).extracting(FieldSpec::getName).containsExactly("p", "q");
        assertThat(mul.argumentIndex("q")).isEqualTo(1);
    }

    @Test
    void testRedeclarationFails() {
        declareMul();

        assertThatThrownBy(this::declareMul)
                .isInstanceOf(DeclarationReuseException.class)
                .hasMessageContaining("Mul");
    }

    @Test
    void testModeSpecificSpellingsAndBracketers() {
        Kind mul = declareMul();
        Term term = mul.make(mul.make(Atom.number("1"), Atom.number("2")), Atom.number("3"));

        assertThat(term.render()).isEqualTo("(1 * 2) * 3");
        assertThat(term.render(LATEX)).isEqualTo("\\left(1 \\cdot 2\\right) \\cdot 3");
        assertThat(term.render(Mode.of("other"))).isEqualTo("(1 * 2) * 3");
    }

    @Test
    void testDisplaySpellingDoesNotParse() {
        declareMul();

        assertThat(syntax.parse("1 * 2 * 3").render(LATEX)).isEqualTo("1 \\cdot 2 \\cdot 3");
        assertThatThrownBy(() -> syntax.parse("1 \\cdot 2")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void testCustomBinderSeparator() {
        Kind let = syntax.declare(KindDeclaration.builder()
                .name("Let")
                .literal("let", "let ")
                .term("value")
                .literal("in", " in ")
                .binder("body", Spelling.of(" => "))
                .build());

        Term parsed = syntax.parse("let 1 in x => x");

        assertThat(parsed.render()).isEqualTo("let 1 in x => x");
        assertThat(parsed.freeNames()).isEmpty();
        assertThat(let.getFields().get(3).getSpelling().inMode(Mode.DEFAULT)).isEqualTo(" => ");
    }

    @Test
    void testConfigSuppliesBinderSeparatorAndBrackets() {
        Syntax custom = new Syntax(SyntaxConfig.builder()
                .binderSeparator(Spelling.of(":"))
                .openBracket('[')
                .closeBracket(']')
                .build());
        Kind lam = custom.declare(KindDeclaration.builder()
                .name("Lam")
                .literal("lam", "fn ")
                .binder("m")
                .build());
        Kind pair = custom.declare(KindDeclaration.builder()
                .name("Pair")
                .term("a")
                .literal("comma", ", ")
                .term("b")
                .build());

        Term term = pair.make(lam.make(Binder.create("x", x -> x)), Atom.number("2"));

        assertThat(term.simplifyNames().render()).isEqualTo("[fn x:x], 2");
        assertThat(custom.parse("[fn x:x], 2").alphaEquals(term)).isTrue();
    }

    @Test
    void testBareBinderAlwaysUsesDefaultSeparator() {
        Syntax custom = new Syntax(SyntaxConfig.builder()
                .binderSeparator(Spelling.of(":"))
                .build());
        Kind lam = custom.declare(KindDeclaration.builder()
                .name("Lam")
                .literal("lam", "fn ")
                .binder("m")
                .build());
        Name x = Name.plain("x");
        Node node = lam.make(Binder.of(x, Var.of(x)));

        Binder bare = node.getBinder("m");

        assertThat(node.render()).isEqualTo("fn x:x");
        assertThat(bare.render()).isEqualTo("x.x");
        assertThat(bare.render(Mode.of("pretty"))).isEqualTo("x. x");
    }

    @Test
    void testEmptyDeclarationIsRejected() {
        assertThatThrownBy(() -> syntax.declare(KindDeclaration.builder().name("Empty").build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no fields");
    }

    @Test
    void testDuplicateFieldIsRejected() {
        assertThatThrownBy(() -> syntax.declare(KindDeclaration.builder()
                .name("Dup")
                .term("p")
                .literal("op", "#")
                .term("p")
                .build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("field p twice");
    }

    @Test
    void testUnitProductionIsRejected() {
        assertThatThrownBy(() -> syntax.declare(KindDeclaration.builder().name("Id").term("x").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(syntax.findKind("Id")).isEmpty();
    }

    @Test
    void testBracketInSpellingIsRejected() {
        assertThatThrownBy(() -> syntax.declare(KindDeclaration.builder()
                .name("Call")
                .term("f")
                .literal("open", "(")
                .term("x")
                .literal("close", ")")
                .build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDefaultModeBracketerIsRejected() {
        assertThatThrownBy(() -> syntax.declare(KindDeclaration.builder()
                .name("Neg")
                .literal("neg", "-")
                .term("x")
                .bracketer(Mode.DEFAULT, s -> "[" + s + "]")
                .build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testReservedNamesAreRejected() {
        assertThatThrownBy(() -> syntax.declare(KindDeclaration.builder().name("bot").literal("b", "b").build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> syntax.declare(KindDeclaration.builder().name("#x").literal("b", "b").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInequalityOverUndeclaredPositionIsRejected() {
        Kind mul = declareMul();

        assertThatThrownBy(() -> syntax.declareGreaterOrEqual(mul.getEntry(), CursorPosition.entry("Nope")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mul.exit("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDescribeGrammarListsEveryAlternative() {
        declareMul();

        String grammar = syntax.describeGrammar();

        assertThat(grammar).contains("#paren", "#identifier", "#number", "#string");
        assertThat(grammar).contains("term \"*\" term -> Mul");
    }

    @Test
    void testGlobalSyntaxIsShared() {
        assertThat(Syntax.global()).isSameAs(Syntax.global());
    }
}
