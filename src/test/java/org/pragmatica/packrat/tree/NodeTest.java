package org.pragmatica.packrat.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NodeTest {

    // === Structure ===

    @Test
    void branch_concatenatesLeafContentInOrder() {
        var node = Node.branch("sum",
                               Node.leaf("num", "1"),
                               Node.leaf(":Text", "+"),
                               Node.branch("num", Node.leaf(":RegExp", "23")));

        assertThat(node.content()).isEqualTo("1+23");
        assertThat(node.length()).isEqualTo(4);
        assertThat(node.isLeaf()).isFalse();
        assertThat(node.isAnonymous()).isFalse();
    }

    @Test
    void branch_withoutChildren_becomesEmptyLeaf() {
        var node = Node.branch("empty", List.of());

        assertThat(node.isLeaf()).isTrue();
        assertThat(node.hasResult()).isFalse();
        assertThat(node.content()).isEmpty();
    }

    @Test
    void anonymousNodes_startWithColon() {
        assertThat(Node.leaf(":Text", "x").isAnonymous()).isTrue();
        assertThat(Node.leaf("word", "x").isAnonymous()).isFalse();
        assertThat(Node.zombie("x").isAnonymous()).isFalse();
        assertThat(Node.zombie("x").isZombie()).isTrue();
    }

    @Test
    void pick_returnsFirstChildWithName() {
        var first = Node.leaf("a", "1");
        var node = Node.branch("root", Node.leaf("b", "0"), first, Node.leaf("a", "2"));

        assertThat(node.pick("a")).containsSame(first);
        assertThat(node.pick("c")).isEmpty();
    }

    @Test
    void renamed_keepsResultAndErrors() {
        var template = Node.leaf(":RegExp", "42");
        template.addError(Diagnostic.of(ErrorCode.MANDATORY_CONTINUATION, "boom", 0));

        var renamed = Node.renamed("number", template);

        assertThat(renamed.name()).isEqualTo("number");
        assertThat(renamed.text()).isEqualTo("42");
        assertThat(renamed.errors()).hasSize(1);
        renamed.addError(Diagnostic.of(ErrorCode.MANDATORY_CONTINUATION, "again", 1));
        assertThat(template.errors()).hasSize(1);
    }

    // === Positions ===

    @Test
    void withPos_assignsPositionsToChildren() {
        var a = Node.leaf("a", "xy");
        var b = Node.leaf("b", "");
        var c = Node.leaf("c", "z");
        var node = Node.branch("root", a, b, c).withPos(5);

        assertThat(node.pos()).isEqualTo(5);
        assertThat(a.pos()).isEqualTo(5);
        assertThat(b.pos()).isEqualTo(7);
        assertThat(c.pos()).isEqualTo(7);
    }

    @Test
    void withPos_samePositionTwice_isAccepted() {
        var node = Node.leaf("a", "x").withPos(3);

        assertThat(node.withPos(3).pos()).isEqualTo(3);
    }

    @Test
    void withPos_differentPosition_throws() {
        var node = Node.leaf("a", "x").withPos(3);

        assertThrows(IllegalStateException.class, () -> node.withPos(4));
    }

    @Test
    void ensurePos_keepsExistingPosition() {
        var node = Node.leaf("a", "x").withPos(3);

        assertThat(node.ensurePos(9).pos()).isEqualTo(3);
    }

    @Test
    void emptyNode_neverReceivesPositionOrChanges() {
        assertThat(Node.EMPTY.withPos(4).hasPos()).isFalse();
        assertThrows(IllegalStateException.class, () -> Node.EMPTY.setText("x"));
        assertThrows(IllegalStateException.class,
                     () -> Node.EMPTY.addError(Diagnostic.of(ErrorCode.MANDATORY_CONTINUATION, "x", 0)));
    }

    // === Rendering ===

    @Test
    void asSxpr_rendersNestedStructure() {
        var node = Node.branch("number", Node.leaf(":RegExp", "3"), Node.leaf("fraction", ".14"));

        assertThat(node.asSxpr()).isEqualTo("(number (:RegExp \"3\") (fraction \".14\"))");
    }

    @Test
    void asSxpr_escapesQuotesAndLineBreaks() {
        assertThat(Node.leaf("s", "a\"b\n").asSxpr()).isEqualTo("(s \"a\\\"b\\n\")");
    }

    @Test
    void descendants_arePreOrder() {
        var node = Node.branch("r", Node.branch("x", Node.leaf("y", "1")), Node.leaf("z", "2"));

        assertThat(node.descendants()).extracting(Node::name).containsExactly("r", "x", "y", "z");
    }
}
