package org.pragmatica.composer.walk;

import org.junit.jupiter.api.Test;
import org.pragmatica.composer.error.CompositionError;
import org.pragmatica.composer.error.Diagnostic;
import org.pragmatica.composer.error.Diagnostics;
import org.pragmatica.composer.error.MalformedTreeException;
import org.pragmatica.composer.tree.Kind;
import org.pragmatica.composer.tree.Label;
import org.pragmatica.composer.tree.Node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.composer.Fixtures.*;

class CoupletsTest {

    private final Diagnostics diagnostics = Diagnostics.create(false);

    // === Labels ===

    @Test
    void label_ofNameOrLabel_isDirect() {
        assertEquals(Label.of("a"), Couplets.label(new Node.Name("a"), diagnostics).get());
        assertEquals(Label.of("b", "t"), Couplets.label(new Node.LabelNode(Label.of("b", "t")), diagnostics).get());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void label_ofQualifiedName_isHeadSegment() {
        assertEquals(Label.of("a"), Couplets.label(Node.QualifiedName.of("a", "b"), diagnostics).get());
    }

    @Test
    void label_ofAlternatives_warnsAndGivesNothing() {
        var result = Couplets.label(alternatives(label("a"), label("b")), diagnostics);

        assertTrue(result.isEmpty());
        assertThat(diagnostics.reported()).extracting(Diagnostic::code)
                                          .containsExactly(Diagnostic.UNSUPPORTED_ALTERNATIVES);
    }

    @Test
    void label_ofIllegalShape_reportsError() {
        var result = Couplets.label(manifold("f"), diagnostics);

        assertTrue(result.isEmpty());
        assertEquals(Diagnostic.Severity.ERROR, diagnostics.reported().get(0).severity());
        assertEquals(Diagnostic.ILLEGAL_LEFT_HAND_SIDE, diagnostics.reported().get(0).code());
    }

    // === Comparison ===

    @Test
    void sameLeftHandSide_comparesHeadLabels() {
        var g = manifold("g");

        assertTrue(Couplets.sameLeftHandSide(path("a"), bindPath(g, "a", "b"), diagnostics));
        assertTrue(Couplets.sameLeftHandSide(bind("a", g), new Node.Binding(new Node.Name("a"), g), diagnostics));
        assertFalse(Couplets.sameLeftHandSide(path("a"), bind("b", g), diagnostics));
    }

    @Test
    void sameLeftHandSide_withNonCouplet_isFalse() {
        assertFalse(Couplets.sameLeftHandSide(label("a"), bind("a", manifold("g")), diagnostics));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void leftHandSideLength_countsSegments() {
        var g = manifold("g");

        assertEquals(1, Couplets.leftHandSideLength(bind("a", g)));
        assertEquals(3, Couplets.leftHandSideLength(bindPath(g, "a", "b", "c")));
        assertEquals(2, Couplets.leftHandSideLength(new Node.Binding(alternatives(label("a"), label("b")), g)));
    }

    // === Splitting ===

    @Test
    void splitCouplet_withAlternatives_yieldsOneCoupletPerAlternative() throws MalformedTreeException {
        var body = composon(manifold("f"));
        var couplet = new Node.Binding(alternatives(label("a"), Node.QualifiedName.of("b", "c")), body);

        var result = Couplets.splitCouplet(couplet);

        assertEquals(2, result.size());
        assertEquals(label("a"), ((Node.Couplet) result.get(0)).lhs());
        assertEquals(Node.QualifiedName.of("b", "c"), ((Node.Couplet) result.get(1)).lhs());
        for (var node : result) {
            assertSame(body, ((Node.Couplet) node).rhs());
            assertEquals(Kind.BINDING, node.kind());
        }
    }

    @Test
    void splitCouplet_withSingularLhs_returnsCoupletUnchanged() throws MalformedTreeException {
        var couplet = bindPath(manifold("f"), "a", "b");

        var result = Couplets.splitCouplet(couplet);

        assertEquals(1, result.size());
        assertSame(couplet, result.get(0));
    }

    @Test
    void splitCouplet_keepsCoupletKind() throws MalformedTreeException {
        var type = new Node.TypeDecl(alternatives(label("a"), label("b")), label("int"));

        var result = Couplets.splitCouplet(type);

        assertThat(result.nodes()).containsExactly(new Node.TypeDecl(label("a"), label("int")),
                                                   new Node.TypeDecl(label("b"), label("int")));
    }

    @Test
    void splitCouplet_withNonCouplet_fails() {
        var thrown = assertThrows(MalformedTreeException.class, () -> Couplets.splitCouplet(manifold("f")));

        assertEquals(new CompositionError.NotACouplet(Kind.MANIFOLD), thrown.error());
    }

    @Test
    void splitCouplet_withInvalidLhs_fails() {
        var couplet = new Node.Binding(composon(), manifold("f"));

        var thrown = assertThrows(MalformedTreeException.class, () -> Couplets.splitCouplet(couplet));

        assertEquals(new CompositionError.InvalidLeftHandSide(Kind.COMPOSON), thrown.error());
        assertThat(thrown).hasMessageContaining("COMPOSON");
    }
}
