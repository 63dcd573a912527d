package io.packscan.parser;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Boundary to the front end that turns source files into trees.
 */
public interface SourceParser {

    /**
     * Returns true if this parser handles the given file.
     */
    boolean supports(Path path);

    /**
     * Parses a file into a tree rooted at a module node.
     *
     * @throws IOException if the file cannot be read or is not in the expected format
     */
    ParsedModule parse(Path path) throws IOException;
}
