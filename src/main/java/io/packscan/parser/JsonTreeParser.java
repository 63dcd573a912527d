package io.packscan.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.packscan.ast.ArgumentsNode;
import io.packscan.ast.AttributeNode;
import io.packscan.ast.BinaryOpNode;
import io.packscan.ast.CallNode;
import io.packscan.ast.CompareNode;
import io.packscan.ast.DictionaryNode;
import io.packscan.ast.FunctionDefNode;
import io.packscan.ast.ImportNode;
import io.packscan.ast.ModuleNode;
import io.packscan.ast.Node;
import io.packscan.ast.NumberNode;
import io.packscan.ast.PrintNode;
import io.packscan.ast.StringNode;
import io.packscan.ast.VariableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads primitive trees dumped by an external front end.
 * <p>
 * Input files end in {@code .ast.json} and hold {@code {"implementation": ..., "ast_tree": ...}}
 * where every tree object is tagged with {@code _type}. Statements without a node variant
 * contribute the statements nested in their {@code body}, {@code orelse}, {@code handlers} and
 * {@code finalbody} lists. Expressions without a variant become opaque names such as
 * {@code <Lambda>} so that call arguments keep their positions.
 */
public class JsonTreeParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(JsonTreeParser.class);

    public static final String SUFFIX = ".ast.json";

    private static final List<String> NESTED_BLOCKS = List.of("body", "orelse", "handlers", "finalbody");

    private final ObjectMapper mapper;

    public JsonTreeParser() {
        this(new ObjectMapper());
    }

    public JsonTreeParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public boolean supports(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().endsWith(SUFFIX) && Files.isRegularFile(path);
    }

    @Override
    public ParsedModule parse(Path path) throws IOException {
        JsonNode document = mapper.readTree(path.toFile());
        if (document == null || !document.isObject() || !document.path("ast_tree").isObject()) {
            throw new IOException("Not a tree dump (expected an object with 'ast_tree'): " + path);
        }
        JsonNode tree = document.get("ast_tree");
        if (!"Module".equals(type(tree))) {
            throw new IOException("Tree root must be a Module, found " + type(tree) + ": " + path);
        }
        String implementation = document.path("implementation").asText(null);
        ModuleNode module = new ModuleNode(statements(tree.path("body")));
        log.debug("Parsed {} top-level statements from {}", module.body().size(), path);
        return new ParsedModule(path, implementation, module);
    }

    // Statements

    private List<Node> statements(JsonNode list) {
        List<Node> out = new ArrayList<>();
        for (JsonNode statement : list) {
            statement(statement, out);
        }
        return out;
    }

    private void statement(JsonNode json, List<Node> out) {
        switch (type(json)) {
            case "Import" -> {
                for (JsonNode alias : json.path("names")) {
                    out.add(at(json, new ImportNode(alias.path("name").asText(),
                            alias.path("asname").asText(null), ImportNode.Form.IMPORT)));
                }
            }
            case "ImportFrom" -> {
                String module = json.path("module").asText(null);
                for (JsonNode alias : json.path("names")) {
                    String name = alias.path("name").asText();
                    String path = module != null ? module + "." + name : name;
                    String bound = alias.path("asname").asText(name);
                    out.add(at(json, new ImportNode(path, bound, ImportNode.Form.FROM)));
                }
            }
            case "Expr" -> out.add(expression(json.get("value")));
            case "Assign" -> {
                // One value subtree per target so no node is shared between two slots
                boolean bound = false;
                for (JsonNode target : json.path("targets")) {
                    if ("Name".equals(type(target))) {
                        out.add(at(json, VariableNode.assign(target.path("id").asText(),
                                expression(json.get("value")))));
                        bound = true;
                    }
                }
                // Attribute, subscript and tuple targets keep only the value
                if (!bound) {
                    out.add(expression(json.get("value")));
                }
            }
            case "AnnAssign" -> {
                JsonNode target = json.get("target");
                Node value = optionalExpression(json.get("value"));
                if (value != null && "Name".equals(type(target))) {
                    out.add(at(json, VariableNode.assign(target.path("id").asText(), value)));
                } else if (value != null) {
                    out.add(value);
                }
            }
            case "AugAssign" -> out.add(expression(json.get("value")));
            case "FunctionDef", "AsyncFunctionDef" -> out.add(functionDef(json));
            case "Print" -> out.add(at(json, new PrintNode(expressions(json.path("values")),
                    optionalExpression(json.get("dest")))));
            case "Return" -> {
                Node value = optionalExpression(json.get("value"));
                if (value != null) {
                    out.add(value);
                }
            }
            default -> {
                for (String block : NESTED_BLOCKS) {
                    JsonNode nested = json.path(block);
                    if (nested.isArray()) {
                        for (JsonNode statement : nested) {
                            statement(statement, out);
                        }
                    }
                }
            }
        }
    }

    private FunctionDefNode functionDef(JsonNode json) {
        JsonNode args = json.path("args");
        List<String> positional = new ArrayList<>();
        for (JsonNode arg : args.path("posonlyargs")) {
            positional.add(arg.path("arg").asText());
        }
        for (JsonNode arg : args.path("args")) {
            positional.add(arg.path("arg").asText());
        }
        List<String> kwonly = new ArrayList<>();
        Map<String, Node> kwDefaults = new LinkedHashMap<>();
        JsonNode kwDefaultList = args.path("kw_defaults");
        int index = 0;
        for (JsonNode arg : args.path("kwonlyargs")) {
            String name = arg.path("arg").asText();
            kwonly.add(name);
            Node value = optionalExpression(kwDefaultList.get(index++));
            if (value != null) {
                kwDefaults.put(name, value);
            }
        }
        ArgumentsNode parameters = new ArgumentsNode(
                positional,
                args.path("vararg").path("arg").asText(null),
                kwonly,
                args.path("kwarg").path("arg").asText(null),
                expressions(args.path("defaults")),
                kwDefaults
        );
        return at(json, new FunctionDefNode(
                json.path("name").asText(),
                parameters,
                statements(json.path("body")),
                expressions(json.path("decorator_list")),
                optionalExpression(json.get("returns"))
        ));
    }

    // Expressions

    private List<Node> expressions(JsonNode list) {
        List<Node> out = new ArrayList<>();
        for (JsonNode expression : list) {
            out.add(expression(expression));
        }
        return out;
    }

    private Node optionalExpression(JsonNode json) {
        return json == null || json.isNull() ? null : expression(json);
    }

    private Node expression(JsonNode json) {
        String type = type(json);
        Node node = switch (type) {
            case "Name" -> VariableNode.name(json.path("id").asText());
            case "Attribute" -> new AttributeNode(expression(json.get("value")),
                    json.path("attr").asText(), access(json.path("ctx")));
            case "Call" -> call(json);
            case "Num" -> number(json.get("n"));
            case "Str", "Bytes" -> new StringNode(json.path("s").asText());
            case "Constant", "NameConstant" -> constant(json.get("value"));
            case "Dict" -> dictionary(json);
            case "Compare" -> {
                List<String> operators = new ArrayList<>();
                for (JsonNode op : json.path("ops")) {
                    operators.add(type(op));
                }
                yield new CompareNode(expression(json.get("left")), operators,
                        expressions(json.path("comparators")));
            }
            case "BinOp" -> new BinaryOpNode(type(json.path("op")),
                    expression(json.get("left")), expression(json.get("right")));
            default -> VariableNode.name("<" + type + ">");
        };
        return at(json, node);
    }

    private Node call(JsonNode json) {
        Node func = expression(json.get("func"));
        List<Node> args = expressions(json.path("args"));
        Map<String, Node> kwargs = new LinkedHashMap<>();
        JsonNode doubleStar = null;
        for (JsonNode keyword : json.path("keywords")) {
            JsonNode name = keyword.get("arg");
            if (name == null || name.isNull()) {
                doubleStar = keyword.get("value");
            } else {
                kwargs.put(name.asText(), expression(keyword.get("value")));
            }
        }
        if (doubleStar != null && "Dict".equals(type(doubleStar))) {
            return new CallNode(func, args, kwargs, dictionary(doubleStar));
        } else if (doubleStar != null) {
            log.debug("Dropping non-literal keyword collection of type {} at line {}",
                    type(doubleStar), json.path("lineno").asInt(-1));
        }
        return new CallNode(func, args, kwargs);
    }

    private DictionaryNode dictionary(JsonNode json) {
        List<Node> keys = new ArrayList<>();
        List<Node> values = new ArrayList<>();
        JsonNode valueList = json.path("values");
        int index = 0;
        for (JsonNode key : json.path("keys")) {
            JsonNode value = valueList.get(index++);
            // A null key is a {**other} unpacking
            if (key.isNull() || value == null) {
                continue;
            }
            keys.add(expression(key));
            values.add(expression(value));
        }
        return at(json, new DictionaryNode(keys, values));
    }

    private static Node number(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return VariableNode.name("<Num>");
        }
        return new NumberNode(value.numberValue());
    }

    private static Node constant(JsonNode value) {
        if (value == null || value.isNull()) {
            return VariableNode.name("None");
        }
        if (value.isBoolean()) {
            return VariableNode.name(value.booleanValue() ? "True" : "False");
        }
        if (value.isNumber()) {
            return new NumberNode(value.numberValue());
        }
        if (value.isTextual()) {
            return new StringNode(value.textValue());
        }
        return VariableNode.name("<Constant>");
    }

    private static AttributeNode.Access access(JsonNode ctx) {
        return switch (type(ctx)) {
            case "Store" -> AttributeNode.Access.STORE;
            case "Del" -> AttributeNode.Access.DELETE;
            default -> AttributeNode.Access.LOAD;
        };
    }

    private static String type(JsonNode json) {
        return json == null ? "" : json.path("_type").asText("");
    }

    private static <N extends Node> N at(JsonNode json, N node) {
        JsonNode line = json.get("lineno");
        if (line != null && line.canConvertToInt() && node.lineNumber() < 0) {
            node.setLineNumber(line.intValue());
        }
        return node;
    }
}
