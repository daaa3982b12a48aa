package dumb.narsese.ast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static dumb.narsese.ast.Term.*;
import static org.junit.jupiter.api.Assertions.*;

class TermTest {

    private static final Term A = word("A"), B = word("B"), C = word("C");

    @ParameterizedTest
    @EnumSource(value = TermType.class, names = {"SET_EXTENSION", "SET_INTENSION", "INTERSECTION_EXTENSION",
            "INTERSECTION_INTENSION", "CONJUNCTION", "DISJUNCTION", "CONJUNCTION_PARALLEL"})
    void unorderedCompoundsAreSets(TermType type) {
        assertEquals(TermCapacity.SET, type.capacity());
        assertEquals(compound(type, A, B, C), compound(type, C, A, B));
        assertEquals(compound(type, A, B, C).hashCode(), compound(type, B, C, A).hashCode());
        assertEquals(compound(type, A, B), compound(type, A, B, A, B));
        assertEquals(2, compound(type, A, B, B, A).components().size());
    }

    @ParameterizedTest
    @EnumSource(value = TermType.class, names = {"PRODUCT", "CONJUNCTION_SEQUENTIAL"})
    void orderedCompoundsKeepOrderAndMultiplicity(TermType type) {
        assertNotEquals(compound(type, A, B), compound(type, B, A));
        assertEquals(3, compound(type, A, B, A).components().size());
        assertNotEquals(compound(type, A, B), compound(type, A, B, A));
    }

    @Test
    void differenceIsBinary() {
        assertNotEquals(compound(TermType.DIFFERENCE_EXTENSION, A, B), compound(TermType.DIFFERENCE_EXTENSION, B, A));
        assertThrows(IllegalArgumentException.class, () -> compound(TermType.DIFFERENCE_INTENSION, A));
        assertThrows(IllegalArgumentException.class, () -> compound(TermType.DIFFERENCE_INTENSION, A, B, C));
    }

    @Test
    void negationIsUnary() {
        assertEquals(TermCapacity.UNARY, negation(A).capacity());
        assertThrows(IllegalArgumentException.class, () -> compound(TermType.NEGATION, A, B));
        assertThrows(IllegalArgumentException.class, () -> compound(TermType.PRODUCT));
    }

    @ParameterizedTest
    @EnumSource(value = TermType.class, names = {"SIMILARITY", "EQUIVALENCE", "EQUIVALENCE_CONCURRENT"})
    void symmetricStatements(TermType type) {
        assertEquals(statement(type, A, B), statement(type, B, A));
        assertEquals(statement(type, A, B).hashCode(), statement(type, B, A).hashCode());
    }

    @ParameterizedTest
    @EnumSource(value = TermType.class, names = {"INHERITANCE", "IMPLICATION", "IMPLICATION_PREDICTIVE",
            "IMPLICATION_CONCURRENT", "IMPLICATION_RETROSPECTIVE", "EQUIVALENCE_PREDICTIVE"})
    void directedStatements(TermType type) {
        assertNotEquals(statement(type, A, B), statement(type, B, A));
    }

    @Test
    void imageIndexRange() {
        assertEquals(List.of(A, PLACEHOLDER, B), image(TermType.IMAGE_EXTENSION, 1, A, B).withPlaceholder());
        assertEquals(List.of(A, B, PLACEHOLDER), image(TermType.IMAGE_INTENSION, 2, A, B).withPlaceholder());
        assertEquals(List.of(PLACEHOLDER, A), image(TermType.IMAGE_INTENSION, 0, A).withPlaceholder());
        assertThrows(IllegalArgumentException.class, () -> image(TermType.IMAGE_EXTENSION, 3, A, B));
        assertThrows(IllegalArgumentException.class, () -> image(TermType.IMAGE_EXTENSION, -1, A, B));
        assertThrows(IllegalArgumentException.class, () -> image(TermType.PRODUCT, 0, A));
        assertNotEquals(image(TermType.IMAGE_EXTENSION, 0, A, B), image(TermType.IMAGE_EXTENSION, 1, A, B));
    }

    @Test
    void placeholderIsCanonical() {
        assertSame(PLACEHOLDER, placeholder());
        assertSame(PLACEHOLDER, atom(TermType.PLACEHOLDER, ""));
        assertEquals("", PLACEHOLDER.name());
        assertThrows(IllegalArgumentException.class, () -> new Atom(TermType.PLACEHOLDER, "x"));
    }

    @Test
    void atoms() {
        assertThrows(IllegalArgumentException.class, () -> word(""));
        assertThrows(IllegalArgumentException.class, () -> new Atom(TermType.PRODUCT, "x"));
        assertEquals("137", interval(137).name());
        assertEquals(interval(7), atom(TermType.INTERVAL, "007"));
        assertEquals(7, atom(TermType.INTERVAL, "007").interval());
        assertThrows(IllegalArgumentException.class, () -> atom(TermType.INTERVAL, "-1"));
        assertThrows(IllegalArgumentException.class, () -> atom(TermType.INTERVAL, "x"));
        assertNotEquals(word("x"), variableIndependent("x"));
    }

    @Test
    void introspection() {
        var s = inheritance(product(setExtension(word("SELF")), variableIndependent("any")), operator("op"));
        assertEquals(TermCategory.STATEMENT, s.category());
        assertEquals(TermCapacity.BINARY_VEC, s.capacity());
        assertEquals(2, s.components().size());
        assertEquals(TermCategory.COMPOUND, s.subject().category());
        assertEquals(TermCategory.ATOM, s.predicate().category());
        assertEquals("op", s.predicate().name());
        assertThrows(IllegalStateException.class, s::name);
        assertTrue(A.components().isEmpty());
        assertTrue(TermCapacity.ATOM.baseNumber() < TermCapacity.BINARY_SET.baseNumber());
        assertTrue(TermCapacity.BINARY_VEC.baseNumber() < TermCapacity.SET.baseNumber());
        assertEquals(TermCapacity.UNARY.baseNumber(), TermCapacity.ATOM.baseNumber());
    }

    @Test
    void sugarCopulas() {
        assertEquals(inheritance(setExtension(A), B), Copula.INSTANCE.apply(A, B));
        assertEquals(inheritance(A, setIntension(B)), Copula.PROPERTY.apply(A, B));
        assertEquals(inheritance(setExtension(A), setIntension(B)), Copula.INSTANCE_PROPERTY.apply(A, B));
        assertEquals(statement(TermType.EQUIVALENCE_PREDICTIVE, B, A), Copula.EQUIVALENCE_RETROSPECTIVE.apply(A, B));
        assertEquals(similarity(A, B), Copula.SIMILARITY.apply(B, A));
        assertEquals(Copula.IMPLICATION_CONCURRENT, Copula.of(TermType.IMPLICATION_CONCURRENT));
        assertThrows(IllegalArgumentException.class, () -> Copula.of(TermType.PRODUCT));
    }

    @Test
    void narseseCasts() {
        Narsese n = A;
        assertTrue(n.isTerm());
        assertSame(A, n.asTerm());
        assertThrows(IllegalStateException.class, n::asSentence);
        assertThrows(IllegalStateException.class, n::asTask);
    }

    @Test
    void toJson() {
        var json = image(TermType.IMAGE_EXTENSION, 1, word("R"), variableDependent("b")).toJson();
        assertEquals("image_extension", json.get("type").asText());
        assertEquals(1, json.get("placeholderIndex").asInt());
        assertEquals("R", json.get("components").get(0).get("name").asText());
        assertEquals("variable_dependent", json.get("components").get(1).get("type").asText());
        var s = inheritance(A, B).toJson();
        assertEquals("A", s.get("subject").get("name").asText());
    }
}
