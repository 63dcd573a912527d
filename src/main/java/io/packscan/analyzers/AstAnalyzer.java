package io.packscan.analyzers;

import io.packscan.ScanConfig;
import io.packscan.ast.NodeRule;
import io.packscan.ast.TraversalResult;
import io.packscan.ast.TreeVisitor;
import io.packscan.model.ScanItem;
import io.packscan.model.ScanLocation;
import io.packscan.parser.JsonTreeParser;
import io.packscan.parser.ParsedModule;
import io.packscan.parser.SourceParser;
import io.packscan.rules.CryptoKeyGenerationRule;
import io.packscan.rules.NameLookupRewriter;
import io.packscan.rules.TaintPropagationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs the tree rules over source files the parser understands.
 * <p>
 * Rewrite rules are repeated until a pass changes nothing or the configured number of passes
 * is reached; detection rules then run once over the settled tree.
 */
public class AstAnalyzer implements Analyzer {

    private static final Logger log = LoggerFactory.getLogger(AstAnalyzer.class);

    private final ScanConfig config;
    private final SourceParser parser;

    public AstAnalyzer(ScanConfig config) {
        this(config, new JsonTreeParser());
    }

    public AstAnalyzer(ScanConfig config, SourceParser parser) {
        this.config = config;
        this.parser = parser;
    }

    @Override
    public String id() {
        return "ast";
    }

    @Override
    public String description() {
        return "Resolves names in parsed source and runs the detection rules on it";
    }

    @Override
    public Stream<ScanItem> analyze(ScanLocation location) throws IOException {
        if (!parser.supports(location.path())) {
            return Stream.empty();
        }
        ParsedModule parsed = parser.parse(location.path());

        TreeVisitor rewriter = new TreeVisitor(rewriteRules());
        TraversalResult rewritten = rewriter.traverseUntilStable(parsed.module(), location, config.rewritePasses());
        log.debug("Rewrote {} in {} passes ({} nodes visited)",
                location.path(), rewritten.passes(), rewritten.nodesVisited());

        TreeVisitor detector = new TreeVisitor(detectionRules());
        TraversalResult detected = detector.traverse(rewritten.root(), location);
        return detected.findings().stream().map(ScanItem.class::cast);
    }

    /**
     * Rules applied until the tree is stable. Fresh instances per tree.
     */
    protected List<NodeRule> rewriteRules() {
        return List.of(
                new NameLookupRewriter(),
                new TaintPropagationRule(config.taintSources())
        );
    }

    /**
     * Rules reporting findings over the settled tree.
     */
    protected List<NodeRule> detectionRules() {
        return List.of(new CryptoKeyGenerationRule(config));
    }
}
