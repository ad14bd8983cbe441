package com.numu.script.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.numu.script.InvariantViolation;
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
 * Owns every node it creates. Nodes are appended to a growable store, addressed by stable index,
 * and released all at once when the arena is dropped.
 *
 * Ownership rule: a node handed to a factory as a child becomes owned by the new parent.
 * Handing an owned node (or a node from another arena) to a second factory is an
 * {@link InvariantViolation}, so trees built here never share subtrees.
 *
 * Not thread-safe. One arena per interpreter instance.
 */
public final class NodeArena {

    private final List<Node> nodes = new ArrayList<>();

    public int size() { return nodes.size(); }

    public Node get(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node #" + id + " in arena of size " + nodes.size());
        }
        return nodes.get(id);
    }

    public boolean contains(Node node) {
        return node != null && node.arena == this;
    }

    // -------------------------
    // Leaves
    // -------------------------

    public NumberNode number(double value) {
        return register(new NumberNode(value));
    }

    public BooleanNode bool(boolean value) {
        return register(new BooleanNode(value));
    }

    public StringNode string(String value) {
        requireNonNull(value, "string value");
        return register(new StringNode(value));
    }

    public VariableNode variable(String name) {
        requireNonNull(name, "variable name");
        return register(new VariableNode(name));
    }

    // -------------------------
    // Expressions
    // -------------------------

    public BinaryOpNode binary(BinaryOp op, Node left, Node right) {
        requireNonNull(op, "binary operator");
        claim("binary operand", left, right);
        return register(new BinaryOpNode(op, left, right));
    }

    public UnaryOpNode unary(UnaryOp op, Node operand) {
        requireNonNull(op, "unary operator");
        claim("unary operand", operand);
        return register(new UnaryOpNode(op, operand));
    }

    public FunctionNode function(String name, List<Node> args) {
        requireNonNull(name, "function name");
        List<Node> copy = copyOf(args, "function argument list");
        claim("function argument", copy.toArray(new Node[0]));
        return register(new FunctionNode(name, Collections.unmodifiableList(copy)));
    }

    public MatrixNode matrix(List<List<Node>> rows) {
        requireNonNull(rows, "matrix rows");
        List<List<Node>> copy = new ArrayList<>(rows.size());
        List<Node> all = new ArrayList<>();
        for (List<Node> row : rows) {
            List<Node> r = copyOf(row, "matrix row");
            all.addAll(r);
            copy.add(Collections.unmodifiableList(r));
        }
        claim("matrix element", all.toArray(new Node[0]));
        return register(new MatrixNode(Collections.unmodifiableList(copy)));
    }

    public TensorNode tensor(List<Integer> dims, List<Node> values) {
        requireNonNull(dims, "tensor dims");
        List<Integer> dimsCopy = new ArrayList<>(dims);
        for (Integer d : dimsCopy) {
            if (d == null || d < 0) throw new InvariantViolation("tensor dimension must be a non-negative integer, got " + d);
        }
        List<Node> copy = copyOf(values, "tensor values");
        claim("tensor value", copy.toArray(new Node[0]));
        return register(new TensorNode(Collections.unmodifiableList(dimsCopy), Collections.unmodifiableList(copy)));
    }

    // -------------------------
    // Statements
    // -------------------------

    public AssignmentNode assignment(String name, Node value) {
        requireNonNull(name, "assignment target");
        claim("assignment value", value);
        return register(new AssignmentNode(name, value));
    }

    public BlockNode block(List<Node> statements) {
        List<Node> copy = copyOf(statements, "block statements");
        claim("block statement", copy.toArray(new Node[0]));
        return register(new BlockNode(Collections.unmodifiableList(copy)));
    }

    /** elseBranch is optional. */
    public IfNode ifNode(Node condition, Node thenBranch, Node elseBranch) {
        if (elseBranch == null) {
            claim("if child", condition, thenBranch);
        } else {
            claim("if child", condition, thenBranch, elseBranch);
        }
        return register(new IfNode(condition, thenBranch, elseBranch));
    }

    public WhileNode whileNode(Node condition, Node body) {
        claim("while child", condition, body);
        return register(new WhileNode(condition, body));
    }

    public ForNode forNode(Node initializer, Node condition, Node increment, Node body) {
        claim("for child", initializer, condition, increment, body);
        return register(new ForNode(initializer, condition, increment, body));
    }

    /** value is optional. */
    public ReturnNode returnNode(Node value) {
        if (value != null) claim("return value", value);
        return register(new ReturnNode(value));
    }

    // -------------------------
    // Ownership bookkeeping
    // -------------------------

    private <T extends Node> T register(T node) {
        node.arena = this;
        node.id = nodes.size();
        nodes.add(node);
        return node;
    }

    /** Validates every child first, then marks them owned, so a rejected call changes nothing. */
    private void claim(String role, Node... children) {
        Map<Node, Boolean> seen = new IdentityHashMap<>();
        for (Node child : children) {
            if (child == null) {
                throw new InvariantViolation(role + " must not be null");
            }
            if (child.arena != this) {
                throw new InvariantViolation(role + " belongs to a different arena");
            }
            if (child.owned || seen.put(child, Boolean.TRUE) != null) {
                throw new InvariantViolation(role + " #" + child.id + " is already owned by another parent");
            }
        }
        for (Node child : children) {
            child.owned = true;
        }
    }

    private static <T> List<T> copyOf(List<T> list, String what) {
        requireNonNull(list, what);
        return new ArrayList<>(list);
    }

    private static void requireNonNull(Object o, String what) {
        if (o == null) throw new InvariantViolation(what + " must not be null");
    }
}
