package io.packscan.rules;

import io.packscan.ScanConfig;
import io.packscan.ast.CallNode;
import io.packscan.ast.Context;
import io.packscan.ast.Node;
import io.packscan.ast.NodeKind;
import io.packscan.ast.NodeRule;
import io.packscan.ast.NumberNode;
import io.packscan.ast.signature.BoundArguments;
import io.packscan.ast.signature.CallSignature;
import io.packscan.ast.signature.SignatureBinder;
import io.packscan.model.Finding;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Detects generation of RSA and DSA keys and records the requested key size.
 * <p>
 * Calls are matched by resolved full name against a catalogue of key generation functions and
 * bound to the function's parameter shape. Only literal key sizes are reported; a size below
 * the family minimum raises the score to {@link Finding#MAX_SCORE}.
 */
public class CryptoKeyGenerationRule implements NodeRule {

    public static final String NAME = "CryptoKeyGeneration";
    public static final String SCORE_NAME = "crypto-gen-key";

    /**
     * Shape of a catalogued function.
     *
     * @param family        Key family, {@code rsa} or {@code dsa}
     * @param signature     Formal parameters of the function
     * @param sizeParameter Parameter carrying the key size
     */
    record KeyGenerator(String family, CallSignature signature, String sizeParameter) {
    }

    // cryptography: generate_private_key(key_size, backend=None)
    private static final CallSignature CRYPTOGRAPHY = CallSignature.builder()
            .positionalOrKeyword("key_size")
            .keyword("backend", null)
            .build();

    // PyCrypto and PyCryptodome: generate(bits, randfunc=None, domain=None)
    private static final CallSignature PYCRYPTO = CallSignature.builder()
            .positionalOrKeyword("bits")
            .keyword("randfunc", null)
            .keyword("domain", null)
            .build();

    static final Map<String, KeyGenerator> CATALOGUE = catalogue();

    private final ScanConfig config;

    public CryptoKeyGenerationRule(ScanConfig config) {
        this.config = config;
    }

    private static Map<String, KeyGenerator> catalogue() {
        Map<String, KeyGenerator> entries = new LinkedHashMap<>();
        for (String family : new String[]{"rsa", "dsa"}) {
            String module = "cryptography.hazmat.primitives.asymmetric." + family;
            entries.put(module + ".generate_private_key", new KeyGenerator(family, CRYPTOGRAPHY, "key_size"));
            entries.put(module + ".generate_parameters", new KeyGenerator(family, CRYPTOGRAPHY, "key_size"));
            for (String library : new String[]{"Crypto", "Cryptodome"}) {
                String function = library + ".PublicKey." + family.toUpperCase() + ".generate";
                entries.put(function, new KeyGenerator(family, PYCRYPTO, "bits"));
            }
        }
        return Map.copyOf(entries);
    }

    @Override
    public String id() {
        return "crypto-gen-key";
    }

    @Override
    public Set<NodeKind> nodeKinds() {
        return Set.of(NodeKind.CALL);
    }

    @Override
    public void visit(Context context) {
        if (!(context.node() instanceof CallNode call)) {
            return;
        }
        Optional<String> function = call.fullName();
        if (function.isEmpty() || !CATALOGUE.containsKey(function.get())) {
            return;
        }
        KeyGenerator generator = CATALOGUE.get(function.get());
        Optional<BoundArguments> bound = SignatureBinder.tryBind(call, generator.signature());
        if (bound.isEmpty()) {
            return;
        }
        Optional<Node> size = bound.get().node(generator.sizeParameter());
        // Key sizes are integers; a float literal is not a usable size
        if (size.isEmpty() || !(size.get() instanceof NumberNode number) || !number.isIntegral()) {
            return;
        }

        Number keySize = number.value();
        int score = config.scoreOrDefault(SCORE_NAME, 0);
        if (keySize.doubleValue() < config.minKeySize(generator.family())) {
            score = Finding.MAX_SCORE;
        }
        String location = context.location().map(l -> l.path().toString()).orElse("");

        context.report(Finding.builder()
                .name(NAME)
                .location(location)
                .message("Generation of cryptography key detected")
                .signature(Finding.signatureOf("crypto", "gen_key", location, call.lineNumber()))
                .score(score)
                .lineNumber(call.lineNumber())
                .extra("function", function.get())
                .extra("key_type", generator.family())
                .extra("key_size", keySize)
                .build());
    }
}
