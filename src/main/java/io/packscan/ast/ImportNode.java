package io.packscan.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Import of a module or of a name from a module.
 * <p>
 * For {@code from a.b import c as d} the module path is {@code a.b.c} and the alias {@code d}.
 */
public final class ImportNode extends Node {

    /**
     * Syntactic form of the import statement.
     */
    public enum Form {
        IMPORT,
        FROM
    }

    private final String module;
    private final String alias;
    private final Form form;

    public ImportNode(String module, String alias, Form form) {
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("module cannot be null or blank");
        }
        this.module = module;
        this.alias = alias != null ? alias : module;
        this.form = Objects.requireNonNull(form, "form");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT;
    }

    public String module() {
        return module;
    }

    /**
     * Name the import binds in the importing scope.
     */
    public String alias() {
        return alias;
    }

    public Form form() {
        return form;
    }

    /**
     * Returns a detached copy carrying the given line number, for substitution at a use site.
     */
    public ImportNode copyAt(int lineNumber) {
        ImportNode copy = new ImportNode(module, alias, form);
        copy.setLineNumber(lineNumber);
        copy.setTaint(taint());
        return copy;
    }

    @Override
    protected String resolveFullName() {
        return module;
    }

    @Override
    List<ChildSlot> children() {
        return List.of();
    }

    @Override
    protected Object hashKey() {
        return alias;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> data = super.toMap();
        data.put("module", module);
        data.put("alias", alias);
        data.put("import_type", form.name().toLowerCase());
        return data;
    }

    @Override
    public String toString() {
        return "Import(" + module + " as " + alias + ")";
    }
}
