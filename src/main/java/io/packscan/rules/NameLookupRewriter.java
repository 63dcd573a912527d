package io.packscan.rules;

import io.packscan.ast.Context;
import io.packscan.ast.ImportNode;
import io.packscan.ast.NodeKind;
import io.packscan.ast.NodeRule;
import io.packscan.ast.VariableNode;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Replaces bare names that refer to an imported alias with a copy of the import, so that
 * {@code rsa.generate_private_key} resolves to the imported module's full path.
 * <p>
 * The alias table grows as imports are visited and is kept across passes; use one instance per
 * tree.
 */
public class NameLookupRewriter implements NodeRule {

    private final Map<String, ImportNode> imports = new HashMap<>();

    @Override
    public String id() {
        return "name-lookup";
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return Set.of(NodeKind.IMPORT, NodeKind.VARIABLE);
    }

    @Override
    public void visit(Context context) {
        if (context.node() instanceof ImportNode imported) {
            imports.put(imported.alias(), imported);
            return;
        }
        if (context.node() instanceof VariableNode variable
                && variable.variableKind() == VariableNode.Kind.NAME
                && variable.value().isEmpty()) {
            ImportNode target = imports.get(variable.name());
            if (target != null) {
                context.replace(target.copyAt(variable.lineNumber()));
            }
        }
    }

    /**
     * Aliases seen so far.
     */
    public Set<String> knownAliases() {
        return Set.copyOf(imports.keySet());
    }
}
