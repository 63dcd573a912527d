package io.packscan.rules;

import io.packscan.ast.AttributeNode;
import io.packscan.ast.CallNode;
import io.packscan.ast.ImportNode;
import io.packscan.ast.ModuleNode;
import io.packscan.ast.NumberNode;
import io.packscan.ast.TraversalResult;
import io.packscan.ast.TreeVisitor;
import io.packscan.ast.VariableNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NameLookupRewriterTest {

    private static final String RSA = "cryptography.hazmat.primitives.asymmetric.rsa";

    @Test
    void visit_replacesImportedAliasWithImportCopy() {
        ImportNode imported = new ImportNode(RSA, "rsa", ImportNode.Form.FROM);
        VariableNode name = VariableNode.name("rsa");
        name.setLineNumber(4);
        AttributeNode attribute = new AttributeNode(name, "generate_private_key");
        CallNode call = new CallNode(attribute, List.of(new NumberNode(2048)), Map.of());
        ModuleNode module = new ModuleNode(List.of(imported, call));
        NameLookupRewriter rewriter = new NameLookupRewriter();

        TraversalResult result = new TreeVisitor(List.of(rewriter)).traverse(module);

        assertThat(result.modified()).isTrue();
        assertThat(attribute.source()).isInstanceOfSatisfying(ImportNode.class, copy -> {
            assertThat(copy).isNotSameAs(imported);
            assertThat(copy.module()).isEqualTo(RSA);
            assertThat(copy.lineNumber()).isEqualTo(4);
        });
        assertThat(call.fullName()).contains(RSA + ".generate_private_key");
        assertThat(rewriter.knownAliases()).containsExactly("rsa");
    }

    @Test
    void visit_leavesUnknownNamesAndAssignmentsAlone() {
        ImportNode imported = new ImportNode("os", null, ImportNode.Form.IMPORT);
        VariableNode unknown = VariableNode.name("sys");
        VariableNode assignment = VariableNode.assign("os", new NumberNode(1));
        ModuleNode module = new ModuleNode(List.of(imported, new CallNode(unknown, List.of(), Map.of()), assignment));

        TraversalResult result = new TreeVisitor(List.of(new NameLookupRewriter())).traverse(module);

        assertThat(result.modified()).isFalse();
        assertThat(module.body().get(2)).isSameAs(assignment);
        assertThat(((CallNode) module.body().get(1)).func()).isSameAs(unknown);
    }

    @Test
    void visit_settlesWithinTwoPasses() {
        ModuleNode module = new ModuleNode(List.of(
                new ImportNode("os", null, ImportNode.Form.IMPORT),
                new CallNode(new AttributeNode(VariableNode.name("os"), "system"), List.of(), Map.of())));

        TraversalResult result = new TreeVisitor(List.of(new NameLookupRewriter()))
                .traverseUntilStable(module, null, 10);

        assertThat(result.passes()).isEqualTo(2);
        ModuleNode root = (ModuleNode) result.root();
        assertThat(root.body().get(1).fullName()).contains("os.system");
    }
}
