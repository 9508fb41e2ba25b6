package com.abt.mixfix.syntax;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abt.mixfix.exception.AmbiguousParseException;
import com.abt.mixfix.exception.DeclarationReuseException;
import com.abt.mixfix.exception.InvalidConstructionException;
import com.abt.mixfix.exception.NoParseException;
import com.abt.mixfix.parser.CanonicalReduction;
import com.abt.mixfix.parser.DerivationEngine;
import com.abt.mixfix.parser.DerivationTree;
import com.abt.mixfix.parser.Grammar;
import com.abt.mixfix.parser.Production;
import com.abt.mixfix.parser.Symbol;
import com.abt.mixfix.parser.Token;
import com.abt.mixfix.precedence.CursorPosition;
import com.abt.mixfix.precedence.GraphPrecedenceOrder;
import com.abt.mixfix.precedence.PrecedenceOrder;
import com.abt.mixfix.term.Atom;
import com.abt.mixfix.term.Binder;
import com.abt.mixfix.term.Name;
import com.abt.mixfix.term.Node;
import com.abt.mixfix.term.Term;
import com.abt.mixfix.term.Var;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import lombok.Getter;
import lombok.Value;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Registry of declared kinds together with the precedence order and the
 * grammar they induce.
 *
 * Declaring a kind registers its cursor positions with the precedence order
 * and swaps in a new grammar and transformer table in one step; parses
 * always run against a complete snapshot. Precedence inequalities are
 * declared separately by the caller and may be added at any time.
 *
 * Parsing enumerates every derivation of the input, drops those that do not
 * build a valid term, and keeps a term only if its canonical rendering is
 * the input with some brackets removed. Exactly one survivor is required.
 */
public class Syntax {
    private static final Logger log = LoggerFactory.getLogger(Syntax.class);

    @Getter
    private final SyntaxConfig config;
    @Getter
    private final PrecedenceOrder precedenceOrder;
    private final DerivationEngine engine = new DerivationEngine();

    private final Object declarationLock = new Object();
    private final Map<String, Kind> kinds = new LinkedHashMap<>();
    private volatile ParserState state;

    @Value
    private static class ParserState {
        Grammar grammar;
        ImmutableMap<String, ProductionTransformer> transformers;
    }

    private static class GlobalHolder {
        static final Syntax INSTANCE = new Syntax();
    }

    public Syntax() {
        this(SyntaxConfig.defaults());
    }

    public Syntax(SyntaxConfig config) {
        this(config, new GraphPrecedenceOrder());
    }

    public Syntax(SyntaxConfig config, PrecedenceOrder precedenceOrder) {
        this.config = config;
        this.precedenceOrder = precedenceOrder;
        this.state = new ParserState(
                Grammar.base(config.getOpenBracket(), config.getCloseBracket()),
                baseTransformers());
    }

    /**
     * The process-wide syntax, created on first use with default settings.
     */
    public static Syntax global() {
        return GlobalHolder.INSTANCE;
    }

    /**
     * Declares a new kind.
     *
     * @throws DeclarationReuseException if a kind with this name exists
     * @throws IllegalArgumentException if the declaration is malformed
     */
    public Kind declare(KindDeclaration declaration) {
        validate(declaration);

        synchronized (declarationLock) {
            String name = declaration.getName();
            if (kinds.containsKey(name)) {
                throw new DeclarationReuseException(name);
            }

            Kind kind = new Kind(this, declaration, config);
            Production production = productionFor(kind);
            checkArgument(!production.isUnit(),
                    "Kind %s would print exactly like its only operand", name);

            precedenceOrder.addToken(kind.getEntry());
            for (CursorPosition exit : kind.getExits().values()) {
                precedenceOrder.addToken(exit);
            }

            ParserState current = state;
            state = new ParserState(
                    current.getGrammar().with(production),
                    ImmutableMap.<String, ProductionTransformer>builder()
                            .putAll(current.getTransformers())
                            .put(name, transformerFor(kind))
                            .build());
            kinds.put(name, kind);

            log.debug("Declared kind {}: {}", name, production);
            return kind;
        }
    }

    /**
     * Declares {@code hi >= lo}.
     */
    public Syntax declareGreaterOrEqual(CursorPosition hi, CursorPosition lo) {
        precedenceOrder.add(lo, hi);
        return this;
    }

    /**
     * Declares each position above every other, so nothing ever forces
     * brackets at it.
     */
    public Syntax declareTop(CursorPosition... positions) {
        for (CursorPosition position : positions) {
            precedenceOrder.addTop(position);
        }
        return this;
    }

    public Syntax declareBottom(CursorPosition... positions) {
        for (CursorPosition position : positions) {
            precedenceOrder.addBottom(position);
        }
        return this;
    }

    public Optional<Kind> findKind(String name) {
        synchronized (declarationLock) {
            return Optional.ofNullable(kinds.get(name));
        }
    }

    public List<Kind> getKinds() {
        synchronized (declarationLock) {
            return List.copyOf(kinds.values());
        }
    }

    /**
     * Parses {@code input} into its unique term.
     *
     * @throws NoParseException if nothing survives
     * @throws AmbiguousParseException if more than one term survives
     */
    public Term parse(String input) {
        List<Term> candidates = parses(input);
        if (candidates.isEmpty()) {
            throw new NoParseException(input, "no derivation prints back to the input");
        }
        if (candidates.size() > 1) {
            throw new AmbiguousParseException(input, candidates);
        }
        return candidates.get(0);
    }

    /**
     * Returns every term whose canonical rendering is {@code input} with
     * redundant brackets and whitespace removed.
     *
     * @throws NoParseException if the input does not lex or matches no
     *         alternative at all
     */
    public List<Term> parses(String input) {
        ParserState snapshot = state;
        Grammar grammar = snapshot.getGrammar();
        List<Token> tokens = grammar.tokenize(input);
        List<DerivationTree> trees = engine.deriveAll(grammar, tokens, input);
        if (trees.size() > config.getForestWarningThreshold()) {
            log.warn("Input '{}' has {} derivations", input, trees.size());
        }

        TermBuilder builder = new TermBuilder(snapshot.getTransformers());
        List<Term> survivors = new ArrayList<>();
        for (DerivationTree tree : trees) {
            Term term;
            try {
                term = builder.build(tree);
            } catch (InvalidConstructionException e) {
                log.trace("Rejected derivation {}: {}", tree, e.getMessage());
                continue;
            }

            String canonical = term.render(Mode.DEFAULT);
            if (CanonicalReduction.reducesTo(input, canonical, config.getOpenBracket(), config.getCloseBracket())) {
                survivors.add(term);
            } else {
                log.trace("Discarded {}: prints as '{}'", term, canonical);
            }
        }

        log.debug("Parsed '{}': {} derivation(s), {} survivor(s)", input, trees.size(), survivors.size());
        return survivors;
    }

    public String describeGrammar() {
        return state.getGrammar().describe();
    }

    private void validate(KindDeclaration declaration) {
        String name = declaration.getName();
        checkArgument(!name.isBlank() && !name.startsWith("#"), "Invalid kind name: '%s'", name);
        checkArgument(!name.equals(CursorPosition.BOTTOM.getKindName()) && !name.equals(CursorPosition.TOP.getKindName()),
                "Kind name '%s' is reserved for the precedence order", name);
        checkArgument(!declaration.getFields().isEmpty(), "Kind %s declares no fields", name);
        checkArgument(!declaration.getBracketers().containsKey(Mode.DEFAULT),
                "Kind %s cannot replace the default-mode bracketer; the parser relies on it", name);

        Set<String> seen = new HashSet<>();
        for (FieldSpec field : declaration.getFields()) {
            checkArgument(seen.add(field.getName()), "Kind %s declares field %s twice", name, field.getName());
            if (field.isLiteral()) {
                checkArgument(field.getSpelling() != null, "Literal %s.%s has no spelling", name, field.getName());
            }
            if (field.getSpelling() != null) {
                for (String token : field.getSpelling().tokens()) {
                    checkLiteralToken(name, field.getName(), token);
                }
            }
        }
    }

    private void checkLiteralToken(String kindName, String fieldName, String token) {
        for (char c : token.toCharArray()) {
            checkArgument(c != config.getOpenBracket() && c != config.getCloseBracket() && c != '"',
                    "Spelling of %s.%s may not contain '%s'", kindName, fieldName, c);
        }
    }

    private static Production productionFor(Kind kind) {
        ImmutableList.Builder<Symbol> symbols = ImmutableList.builder();
        for (FieldSpec field : kind.getFields()) {
            switch (field.getKind()) {
                case TERM -> symbols.add(Symbol.TERM);
                case BINDER -> {
                    symbols.add(Symbol.TERM);
                    field.getSpelling().tokens().forEach(token -> symbols.add(Symbol.literal(token)));
                    symbols.add(Symbol.TERM);
                }
                case LITERAL -> field.getSpelling().tokens().forEach(token -> symbols.add(Symbol.literal(token)));
            }
        }
        return new Production(kind.getName(), symbols.build());
    }

    /**
     * A binder field takes the name from a bare variable operand and the body
     * from the operand after the separator, and wraps them without
     * freshening.
     */
    private static ProductionTransformer transformerFor(Kind kind) {
        return (operands, tokens) -> {
            List<Term> arguments = new ArrayList<>(kind.getArgumentFields().size());
            int next = 0;
            for (FieldSpec field : kind.getArgumentFields()) {
                if (field.getKind() == FieldKind.BINDER) {
                    Term bound = operands.get(next++);
                    Term body = operands.get(next++);
                    if (!(bound instanceof Var var)) {
                        throw new InvalidConstructionException(
                                kind.getName() + "." + field.getName() + " must bind a variable, not " + bound);
                    }
                    arguments.add(Binder.of(var.getName(), body));
                } else {
                    arguments.add(operands.get(next++));
                }
            }
            return new Node(kind, arguments);
        };
    }

    private static ImmutableMap<String, ProductionTransformer> baseTransformers() {
        return ImmutableMap.of(
                Grammar.PAREN, (operands, tokens) -> operands.get(0),
                Grammar.IDENTIFIER, (operands, tokens) -> Var.of(Name.plain(tokens.get(0).getText())),
                Grammar.NUMBER, (operands, tokens) -> Atom.number(tokens.get(0).getText()),
                Grammar.STRING, (operands, tokens) -> Atom.string(tokens.get(0).getText()));
    }
}
