package io.packscan.parser;

import io.packscan.ast.ModuleNode;

import java.nio.file.Path;

/**
 * A parsed source file.
 *
 * @param source         The file the tree was read from
 * @param implementation Identity of the interpreter that produced the primitive tree
 * @param module         Root of the converted tree
 */
public record ParsedModule(Path source, String implementation, ModuleNode module) {

    public ParsedModule {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (module == null) {
            throw new IllegalArgumentException("module cannot be null");
        }
        implementation = implementation != null ? implementation : "unknown";
    }
}
