package com.numu.script.ast;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.numu.script.ast.Node.AssignmentNode;
import com.numu.script.ast.Node.BinaryOpNode;
import com.numu.script.ast.Node.BlockNode;
import com.numu.script.ast.Node.BooleanNode;
import com.numu.script.ast.Node.ForNode;
import com.numu.script.ast.Node.FunctionNode;
import com.numu.script.ast.Node.IfNode;
import com.numu.script.ast.Node.MatrixNode;
import com.numu.script.ast.Node.NumberNode;
import com.numu.script.ast.Node.ReturnNode;
import com.numu.script.ast.Node.StringNode;
import com.numu.script.ast.Node.TensorNode;
import com.numu.script.ast.Node.UnaryOpNode;
import com.numu.script.ast.Node.VariableNode;
import com.numu.script.ast.Node.WhileNode;

/**
 * Dumps an AST as JSON for diagnostics and golden tests. One-way: there is no reader.
 *
 * Shape: {"type": "BINARY_OP", "op": "ADD", "left": {...}, "right": {...}}.
 * Non-finite numbers are written as the strings "Infinity", "-Infinity" and "NaN".
 */
public final class AstJson {

    private static final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final JsonNodeFactory f = JsonNodeFactory.instance;

    private AstJson() {}

    public static JsonNode toTree(Node node) {
        if (node == null) return NullNode.getInstance();
        return node.accept(new Writer());
    }

    public static String toJson(Node node) {
        try {
            return om.writeValueAsString(toTree(node));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("AST serialization failed", e);
        }
    }

    private static final class Writer implements NodeVisitor<JsonNode> {

        private ObjectNode base(Node node) {
            ObjectNode o = f.objectNode();
            o.put("type", node.type.name());
            return o;
        }

        private JsonNode child(Node n) {
            return n == null ? NullNode.getInstance() : n.accept(this);
        }

        private ArrayNode list(List<Node> nodes) {
            ArrayNode arr = f.arrayNode();
            for (Node n : nodes) arr.add(child(n));
            return arr;
        }

        public JsonNode visitNumber(NumberNode node) {
            ObjectNode o = base(node);
            double v = node.value;
            if (Double.isNaN(v) || Double.isInfinite(v)) o.put("value", Double.toString(v));
            else o.put("value", v);
            return o;
        }

        public JsonNode visitBoolean(BooleanNode node) {
            return base(node).put("value", node.value);
        }

        public JsonNode visitString(StringNode node) {
            return base(node).put("value", node.value);
        }

        public JsonNode visitVariable(VariableNode node) {
            return base(node).put("name", node.name);
        }

        public JsonNode visitBinaryOp(BinaryOpNode node) {
            ObjectNode o = base(node);
            o.put("op", node.op.name());
            o.set("left", child(node.left));
            o.set("right", child(node.right));
            return o;
        }

        public JsonNode visitUnaryOp(UnaryOpNode node) {
            ObjectNode o = base(node);
            o.put("op", node.op.name());
            o.set("operand", child(node.operand));
            return o;
        }

        public JsonNode visitFunction(FunctionNode node) {
            ObjectNode o = base(node);
            o.put("name", node.name);
            o.set("args", list(node.args));
            return o;
        }

        public JsonNode visitMatrix(MatrixNode node) {
            ObjectNode o = base(node);
            ArrayNode rows = f.arrayNode();
            for (List<Node> row : node.rows) rows.add(list(row));
            o.set("rows", rows);
            return o;
        }

        public JsonNode visitTensor(TensorNode node) {
            ObjectNode o = base(node);
            ArrayNode dims = f.arrayNode();
            for (Integer d : node.dims) dims.add(d);
            o.set("dims", dims);
            o.set("values", list(node.values));
            return o;
        }

        public JsonNode visitAssignment(AssignmentNode node) {
            ObjectNode o = base(node);
            o.put("name", node.name);
            o.set("value", child(node.value));
            return o;
        }

        public JsonNode visitBlock(BlockNode node) {
            ObjectNode o = base(node);
            o.set("statements", list(node.statements));
            return o;
        }

        public JsonNode visitIf(IfNode node) {
            ObjectNode o = base(node);
            o.set("condition", child(node.condition));
            o.set("then", child(node.thenBranch));
            o.set("else", child(node.elseBranch));
            return o;
        }

        public JsonNode visitWhile(WhileNode node) {
            ObjectNode o = base(node);
            o.set("condition", child(node.condition));
            o.set("body", child(node.body));
            return o;
        }

        public JsonNode visitFor(ForNode node) {
            ObjectNode o = base(node);
            o.set("initializer", child(node.initializer));
            o.set("condition", child(node.condition));
            o.set("increment", child(node.increment));
            o.set("body", child(node.body));
            return o;
        }

        public JsonNode visitReturn(ReturnNode node) {
            ObjectNode o = base(node);
            o.set("value", child(node.value));
            return o;
        }
    }
}
