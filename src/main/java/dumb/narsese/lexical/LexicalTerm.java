package dumb.narsese.lexical;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.narsese.util.Json;

import java.util.List;

import static java.util.Objects.requireNonNull;

sealed public interface LexicalTerm extends LexicalNarsese
        permits LexicalTerm.Atom, LexicalTerm.Compound, LexicalTerm.TermSet, LexicalTerm.Statement {

    static Atom atom(String prefix, String name) {
        return new Atom(prefix, name);
    }

    static Atom word(String name) {
        return new Atom("", name);
    }

    static Compound compound(String connector, LexicalTerm... terms) {
        return new Compound(connector, List.of(terms));
    }

    static TermSet set(String left, List<LexicalTerm> terms, String right) {
        return new TermSet(left, terms, right);
    }

    static Statement statement(String copula, LexicalTerm subject, LexicalTerm predicate) {
        return new Statement(copula, subject, predicate);
    }

    private static ObjectNode node(String type) {
        return Json.node().put("type", type);
    }

    record Atom(String prefix, String name) implements LexicalTerm {
        public Atom {
            requireNonNull(prefix);
            requireNonNull(name);
        }

        @Override
        public JsonNode toJson() {
            return node("atom").put("prefix", prefix).put("name", name);
        }
    }

    record Compound(String connector, List<LexicalTerm> terms) implements LexicalTerm {
        public Compound {
            requireNonNull(connector);
            terms = List.copyOf(terms);
        }

        @Override
        public JsonNode toJson() {
            var o = node("compound").put("connector", connector);
            var a = o.putArray("terms");
            terms.forEach(t -> a.add(t.toJson()));
            return o;
        }
    }

    /** A compound told apart by its bracket pair instead of a connector. */
    record TermSet(String left, List<LexicalTerm> terms, String right) implements LexicalTerm {
        public TermSet {
            requireNonNull(left);
            requireNonNull(right);
            terms = List.copyOf(terms);
        }

        @Override
        public JsonNode toJson() {
            var o = node("set").put("left", left).put("right", right);
            var a = o.putArray("terms");
            terms.forEach(t -> a.add(t.toJson()));
            return o;
        }
    }

    record Statement(String copula, LexicalTerm subject, LexicalTerm predicate) implements LexicalTerm {
        public Statement {
            requireNonNull(copula);
            requireNonNull(subject);
            requireNonNull(predicate);
        }

        @Override
        public JsonNode toJson() {
            var o = node("statement").put("copula", copula);
            o.set("subject", subject.toJson());
            o.set("predicate", predicate.toJson());
            return o;
        }
    }
}
