package com.abt.mixfix.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.abt.mixfix.exception.NoParseException;
import com.google.common.collect.ImmutableList;

import lombok.Value;

/**
 * Enumerates every derivation of a token sequence under a {@link Grammar}.
 *
 * Works bottom-up over token spans with memoization, so left-recursive
 * alternatives are fine. Every symbol consumes at least one token and unit
 * alternatives are never registered, so each nested span is strictly
 * shorter than its parent and the recursion terminates. The number of trees
 * can grow exponentially with the input on highly ambiguous grammars.
 */
public class DerivationEngine {
    private static final Logger log = LoggerFactory.getLogger(DerivationEngine.class);

    /**
     * Returns all distinct derivations of {@code tokens} from {@code term}.
     *
     * @throws NoParseException if there are none
     */
    public List<DerivationTree> deriveAll(Grammar grammar, List<Token> tokens, String input) {
        if (tokens.isEmpty()) {
            throw new NoParseException(input, "empty input");
        }
        Chart chart = new Chart(grammar.getProductions(), tokens);
        List<DerivationTree> trees = List.copyOf(new LinkedHashSet<>(chart.derive(0, tokens.size())));
        log.debug("{} derivation(s) for {} token(s)", trees.size(), tokens.size());
        if (trees.isEmpty()) {
            throw new NoParseException(input, "input matches no alternative");
        }
        return trees;
    }

    @Value
    private static class SequenceKey {
        int production;
        int symbol;
        int from;
        int to;
    }

    private static class Chart {
        private final List<Production> productions;
        private final List<Token> tokens;
        private final Map<Long, List<DerivationTree>> spans = new HashMap<>();
        private final Map<SequenceKey, List<ImmutableList<Derivation>>> sequences = new HashMap<>();

        Chart(List<Production> productions, List<Token> tokens) {
            this.productions = productions;
            this.tokens = tokens;
        }

        List<DerivationTree> derive(int from, int to) {
            long key = (long) from * (tokens.size() + 1) + to;
            List<DerivationTree> cached = spans.get(key);
            if (cached != null) {
                return cached;
            }

            List<DerivationTree> trees = new ArrayList<>();
            for (int p = 0; p < productions.size(); p++) {
                Production production = productions.get(p);
                if (production.getSymbols().size() > to - from) {
                    continue;
                }
                for (ImmutableList<Derivation> children : match(p, 0, from, to)) {
                    trees.add(new DerivationTree(production, children));
                }
            }
            spans.put(key, trees);
            return trees;
        }

        /**
         * All ways symbols {@code symbol..} of production {@code p} cover
         * tokens {@code from..to}.
         */
        private List<ImmutableList<Derivation>> match(int p, int symbol, int from, int to) {
            SequenceKey key = new SequenceKey(p, symbol, from, to);
            List<ImmutableList<Derivation>> cached = sequences.get(key);
            if (cached != null) {
                return cached;
            }

            List<Symbol> symbols = productions.get(p).getSymbols();
            List<ImmutableList<Derivation>> results = new ArrayList<>();
            if (symbol == symbols.size()) {
                if (from == to) {
                    results.add(ImmutableList.of());
                }
            } else {
                Symbol current = symbols.get(symbol);
                int remaining = symbols.size() - symbol - 1;
                if (!current.isNonterminal()) {
                    if (to - from > remaining && current.matches(tokens.get(from))) {
                        for (ImmutableList<Derivation> rest : match(p, symbol + 1, from + 1, to)) {
                            results.add(prepend(tokens.get(from), rest));
                        }
                    }
                } else {
                    for (int mid = from + 1; mid <= to - remaining; mid++) {
                        List<DerivationTree> heads = derive(from, mid);
                        if (heads.isEmpty()) {
                            continue;
                        }
                        List<ImmutableList<Derivation>> rests = match(p, symbol + 1, mid, to);
                        for (DerivationTree head : heads) {
                            for (ImmutableList<Derivation> rest : rests) {
                                results.add(prepend(head, rest));
                            }
                        }
                    }
                }
            }
            sequences.put(key, results);
            return results;
        }

        private static ImmutableList<Derivation> prepend(Derivation head, ImmutableList<Derivation> rest) {
            return ImmutableList.<Derivation>builderWithExpectedSize(rest.size() + 1).add(head).addAll(rest).build();
        }
    }
}
