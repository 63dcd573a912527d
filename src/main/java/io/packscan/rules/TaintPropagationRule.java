package io.packscan.rules;

import io.packscan.ast.AttributeNode;
import io.packscan.ast.BinaryOpNode;
import io.packscan.ast.CallNode;
import io.packscan.ast.CompareNode;
import io.packscan.ast.Context;
import io.packscan.ast.DictionaryNode;
import io.packscan.ast.Node;
import io.packscan.ast.NodeKind;
import io.packscan.ast.NodeRule;
import io.packscan.ast.NumberNode;
import io.packscan.ast.StringNode;
import io.packscan.ast.Taint;
import io.packscan.ast.VariableNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies nodes as safe, unknown or tainted.
 * <p>
 * Literals are safe. A node whose full name is a configured taint source, or lies under one,
 * is tainted. Operators, dictionaries, comparisons and calls combine the taint of their
 * operands; attribute access and assignments take the taint of their source. A change marks
 * the pass modified, so the classification settles over repeated passes.
 */
public class TaintPropagationRule implements NodeRule {

    private final Set<String> sources;

    public TaintPropagationRule(Set<String> sources) {
        this.sources = Set.copyOf(sources);
    }

    @Override
    public String id() {
        return "taint-propagation";
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return Set.of();
    }

    @Override
    public void visit(Context context) {
        Node node = context.node();
        Taint computed = classify(node);
        if (computed != node.taint()) {
            node.setTaint(computed);
            context.markModified();
        }
    }

    private Taint classify(Node node) {
        if (node instanceof NumberNode || node instanceof StringNode) {
            return Taint.SAFE;
        }
        Optional<String> name = node.fullName();
        if (name.isPresent() && isSource(name.get())) {
            return Taint.TAINTED;
        }
        if (node instanceof AttributeNode attribute) {
            return attribute.source().taint();
        }
        if (node instanceof BinaryOpNode op) {
            return op.left().taint().combine(op.right().taint());
        }
        if (node instanceof DictionaryNode dictionary) {
            List<Node> operands = new ArrayList<>(dictionary.keys());
            operands.addAll(dictionary.values());
            return combine(operands);
        }
        if (node instanceof CompareNode compare) {
            List<Node> operands = new ArrayList<>(compare.comparators());
            operands.add(compare.left());
            return combine(operands);
        }
        if (node instanceof CallNode call) {
            List<Node> operands = new ArrayList<>(call.args());
            operands.addAll(call.kwargs().values());
            call.kwargsDictionary().ifPresent(operands::add);
            operands.add(call.func());
            return combine(operands);
        }
        if (node instanceof VariableNode variable && variable.value().isPresent()) {
            return variable.value().get().taint();
        }
        return node.taint();
    }

    private boolean isSource(String name) {
        for (String source : sources) {
            if (name.equals(source) || name.startsWith(source + ".")) {
                return true;
            }
        }
        return false;
    }

    private static Taint combine(List<Node> operands) {
        List<Taint> taints = new ArrayList<>(operands.size());
        for (Node operand : operands) {
            taints.add(operand.taint());
        }
        return Taint.combineAll(taints);
    }
}
