package io.packscan.ast.signature;

import io.packscan.ast.CallNode;
import io.packscan.ast.DictionaryNode;
import io.packscan.ast.Node;
import io.packscan.ast.NumberNode;
import io.packscan.ast.StringNode;
import io.packscan.ast.VariableNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignatureBinderTest {

    // f(a, b=None)
    private static final CallSignature A_B = CallSignature.builder()
            .positionalOrKeyword("a")
            .keyword("b", null)
            .build();

    private static CallNode call(List<Node> args, Map<String, Node> kwargs) {
        return new CallNode(VariableNode.name("f"), args, kwargs);
    }

    @Test
    void bind_positionalAndKeywordSpellingsAgree() throws SignatureBindingException {
        NumberNode one = new NumberNode(1);

        BoundArguments positional = SignatureBinder.bind(call(List.of(one), Map.of()), A_B);
        BoundArguments keyword = SignatureBinder.bind(call(List.of(), Map.of("a", one)), A_B);

        assertThat(positional.get("a")).isSameAs(one);
        assertThat(keyword.get("a")).isSameAs(one);
        assertThat(positional.arguments()).containsOnlyKeys("a", "b");
        assertThat(positional.get("b")).isNull();
        assertThat(positional.isDefaulted("b")).isTrue();
        assertThat(positional.isDefaulted("a")).isFalse();
    }

    @Test
    void bind_keywordOrderDoesNotMatter() throws SignatureBindingException {
        NumberNode one = new NumberNode(1);
        NumberNode two = new NumberNode(2);
        Map<String, Node> reversed = new LinkedHashMap<>();
        reversed.put("b", two);
        reversed.put("a", one);

        BoundArguments bound = SignatureBinder.bind(call(List.of(), reversed), A_B);

        assertThat(bound.node("a")).containsSame(one);
        assertThat(bound.node("b")).containsSame(two);
        assertThat(bound.arguments().keySet()).containsExactly("a", "b");
    }

    @Test
    void bind_missingRequiredArgumentFails() {
        assertThatThrownBy(() -> SignatureBinder.bind(call(List.of(), Map.of()), A_B))
                .isInstanceOf(SignatureBindingException.class)
                .hasMessageContaining("missing required argument 'a'");
    }

    @Test
    void bind_multipleValuesFails() {
        NumberNode one = new NumberNode(1);

        assertThatThrownBy(() -> SignatureBinder.bind(call(List.of(one), Map.of("a", one)), A_B))
                .isInstanceOf(SignatureBindingException.class)
                .hasMessageContaining("multiple values");
    }

    @Test
    void bind_tooManyPositionalFails() {
        List<Node> args = List.of(new NumberNode(1), new NumberNode(2), new NumberNode(3));

        assertThatThrownBy(() -> SignatureBinder.bind(call(args, Map.of()), A_B))
                .isInstanceOf(SignatureBindingException.class)
                .hasMessageContaining("too many positional arguments");
    }

    @Test
    void bind_unexpectedKeywordFails() {
        assertThatThrownBy(() -> SignatureBinder.bind(
                call(List.of(new NumberNode(1)), Map.of("c", new NumberNode(3))), A_B))
                .isInstanceOf(SignatureBindingException.class)
                .hasMessageContaining("unexpected keyword");
    }

    @Test
    void bind_variadicParametersCollectLeftovers() throws SignatureBindingException {
        CallSignature signature = CallSignature.builder()
                .positionalOrKeyword("a")
                .varPositional("args")
                .keywordOnly("flag", null)
                .varKeyword("kwargs")
                .build();
        NumberNode one = new NumberNode(1);
        NumberNode two = new NumberNode(2);
        NumberNode three = new NumberNode(3);
        StringNode extra = new StringNode("x");

        BoundArguments bound = SignatureBinder.bind(
                call(List.of(one, two, three), Map.of("other", extra)), signature);

        assertThat(bound.get("a")).isSameAs(one);
        assertThat(bound.varPositional()).containsExactly(two, three);
        assertThat(bound.varKeyword()).containsOnly(Map.entry("other", extra));
        assertThat(bound.isDefaulted("flag")).isTrue();
    }

    @Test
    void bind_positionalOnlyCannotBePassedByKeyword() {
        CallSignature signature = CallSignature.builder().positionalOnly("a").build();

        assertThatThrownBy(() -> SignatureBinder.bind(call(List.of(), Map.of("a", new NumberNode(1))), signature))
                .isInstanceOf(SignatureBindingException.class);
    }

    @Test
    void bind_keywordOnlyCannotBePassedPositionally() {
        CallSignature signature = CallSignature.builder().keywordOnly("a").build();

        assertThatThrownBy(() -> SignatureBinder.bind(call(List.of(new NumberNode(1)), Map.of()), signature))
                .isInstanceOf(SignatureBindingException.class)
                .hasMessageContaining("too many positional arguments");
    }

    @Test
    void bind_materializesDictionaryKeywords() throws SignatureBindingException {
        NumberNode one = new NumberNode(1);
        DictionaryNode dictionary = new DictionaryNode(List.of(new StringNode("a")), List.of(one));
        CallNode call = new CallNode(VariableNode.name("f"), List.of(), dictionary);

        BoundArguments bound = SignatureBinder.bind(call, A_B);

        assertThat(bound.node("a")).containsSame(one);
    }

    @Test
    void bind_dictionaryKeyBesideExplicitKeywords() throws SignatureBindingException {
        NumberNode one = new NumberNode(1);
        NumberNode two = new NumberNode(2);
        DictionaryNode dictionary = new DictionaryNode(List.of(new StringNode("b")), List.of(two));
        CallNode call = new CallNode(VariableNode.name("f"), List.of(), Map.of("a", one), dictionary);

        BoundArguments bound = SignatureBinder.bind(call, A_B);

        assertThat(bound.node("a")).containsSame(one);
        assertThat(bound.node("b")).containsSame(two);
        assertThat(bound.isDefaulted("b")).isFalse();
    }

    @Test
    void bind_dictionaryKeyRepeatingExplicitKeywordFails() {
        DictionaryNode dictionary = new DictionaryNode(List.of(new StringNode("a")), List.of(new NumberNode(2)));
        CallNode call = new CallNode(VariableNode.name("f"), List.of(), Map.of("a", new NumberNode(1)), dictionary);

        assertThatThrownBy(() -> SignatureBinder.bind(call, A_B))
                .isInstanceOf(SignatureBindingException.class)
                .hasMessageContaining("multiple values for keyword argument 'a'");
        assertThat(SignatureBinder.tryBind(call, A_B)).isEmpty();
    }

    @Test
    void bind_dictionaryWithNonStringKeyFails() {
        DictionaryNode dictionary = new DictionaryNode(List.of(new NumberNode(1)), List.of(new NumberNode(2)));
        CallNode call = new CallNode(VariableNode.name("f"), List.of(), dictionary);

        assertThatThrownBy(() -> SignatureBinder.bind(call, A_B))
                .isInstanceOf(SignatureBindingException.class)
                .hasMessageContaining("keywords must be strings");
        assertThat(SignatureBinder.tryBind(call, A_B)).isEmpty();
    }

    @Test
    void callSignature_rejectsInvalidOrder() {
        assertThatThrownBy(() -> CallSignature.builder().keyword("a", null).positionalOrKeyword("b").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-default parameter");
        assertThatThrownBy(() -> CallSignature.builder().keywordOnly("a").positionalOrKeyword("b").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CallSignature.builder().positionalOrKeyword("a").keywordOnly("a").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
    }
}
