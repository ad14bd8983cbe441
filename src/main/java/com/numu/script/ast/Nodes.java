package com.numu.script.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

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
 * Structural algorithms over the AST: deep copy, equality, hashing, traversal and constant folding.
 *
 * clone/equals/hash/simplify recurse on the host stack; traverse is iterative.
 */
public final class Nodes {

    /** Multiplier used to mix child hashes into the parent's. */
    static final long HASH_PRIME = 0x100000001B3L;

    private Nodes() {}

    // ===================== CLONE =====================

    /** Deep copy allocated in {@code arena}. Null in, null out. */
    public static Node clone(NodeArena arena, Node node) {
        if (node == null) return null;
        return node.accept(new Cloner(arena));
    }

    private static final class Cloner implements NodeVisitor<Node> {
        private final NodeArena arena;

        Cloner(NodeArena arena) {
            if (arena == null) throw new InvariantViolation("clone target arena must not be null");
            this.arena = arena;
        }

        private Node copy(Node n) {
            return n == null ? null : n.accept(this);
        }

        private List<Node> copyAll(List<Node> list) {
            List<Node> out = new ArrayList<>(list.size());
            for (Node n : list) out.add(copy(n));
            return out;
        }

        public Node visitNumber(NumberNode node) { return arena.number(node.value); }
        public Node visitBoolean(BooleanNode node) { return arena.bool(node.value); }
        public Node visitString(StringNode node) { return arena.string(node.value); }
        public Node visitVariable(VariableNode node) { return arena.variable(node.name); }

        public Node visitBinaryOp(BinaryOpNode node) {
            return arena.binary(node.op, copy(node.left), copy(node.right));
        }

        public Node visitUnaryOp(UnaryOpNode node) {
            return arena.unary(node.op, copy(node.operand));
        }

        public Node visitFunction(FunctionNode node) {
            return arena.function(node.name, copyAll(node.args));
        }

        public Node visitMatrix(MatrixNode node) {
            List<List<Node>> rows = new ArrayList<>(node.rows.size());
            for (List<Node> row : node.rows) rows.add(copyAll(row));
            return arena.matrix(rows);
        }

        public Node visitTensor(TensorNode node) {
            return arena.tensor(node.dims, copyAll(node.values));
        }

        public Node visitAssignment(AssignmentNode node) {
            return arena.assignment(node.name, copy(node.value));
        }

        public Node visitBlock(BlockNode node) {
            return arena.block(copyAll(node.statements));
        }

        public Node visitIf(IfNode node) {
            return arena.ifNode(copy(node.condition), copy(node.thenBranch), copy(node.elseBranch));
        }

        public Node visitWhile(WhileNode node) {
            return arena.whileNode(copy(node.condition), copy(node.body));
        }

        public Node visitFor(ForNode node) {
            return arena.forNode(copy(node.initializer), copy(node.condition), copy(node.increment), copy(node.body));
        }

        public Node visitReturn(ReturnNode node) {
            return arena.returnNode(copy(node.value));
        }
    }

    // ===================== EQUALS =====================

    /**
     * Structural equality. Numbers compare with ==, except that any NaN equals any NaN,
     * so a tree equals its own clone. 0.0 equals -0.0.
     */
    public static boolean equals(Node a, Node b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a.type != b.type) return false;

        switch (a.type) {
            case NUMBER:
                return sameNumber(((NumberNode) a).value, ((NumberNode) b).value);
            case BOOLEAN:
                return ((BooleanNode) a).value == ((BooleanNode) b).value;
            case STRING:
                return ((StringNode) a).value.equals(((StringNode) b).value);
            case VARIABLE:
                return ((VariableNode) a).name.equals(((VariableNode) b).name);
            case BINARY_OP: {
                BinaryOpNode x = (BinaryOpNode) a;
                BinaryOpNode y = (BinaryOpNode) b;
                return x.op == y.op && equals(x.left, y.left) && equals(x.right, y.right);
            }
            case UNARY_OP: {
                UnaryOpNode x = (UnaryOpNode) a;
                UnaryOpNode y = (UnaryOpNode) b;
                return x.op == y.op && equals(x.operand, y.operand);
            }
            case FUNCTION: {
                FunctionNode x = (FunctionNode) a;
                FunctionNode y = (FunctionNode) b;
                return x.name.equals(y.name) && equalsAll(x.args, y.args);
            }
            case MATRIX: {
                MatrixNode x = (MatrixNode) a;
                MatrixNode y = (MatrixNode) b;
                if (x.rows.size() != y.rows.size()) return false;
                for (int i = 0; i < x.rows.size(); i++) {
                    if (!equalsAll(x.rows.get(i), y.rows.get(i))) return false;
                }
                return true;
            }
            case TENSOR: {
                TensorNode x = (TensorNode) a;
                TensorNode y = (TensorNode) b;
                return x.dims.equals(y.dims) && equalsAll(x.values, y.values);
            }
            case ASSIGNMENT: {
                AssignmentNode x = (AssignmentNode) a;
                AssignmentNode y = (AssignmentNode) b;
                return x.name.equals(y.name) && equals(x.value, y.value);
            }
            case BLOCK:
                return equalsAll(((BlockNode) a).statements, ((BlockNode) b).statements);
            case IF: {
                IfNode x = (IfNode) a;
                IfNode y = (IfNode) b;
                return equals(x.condition, y.condition)
                        && equals(x.thenBranch, y.thenBranch)
                        && equals(x.elseBranch, y.elseBranch);
            }
            case WHILE: {
                WhileNode x = (WhileNode) a;
                WhileNode y = (WhileNode) b;
                return equals(x.condition, y.condition) && equals(x.body, y.body);
            }
            case FOR: {
                ForNode x = (ForNode) a;
                ForNode y = (ForNode) b;
                return equals(x.initializer, y.initializer)
                        && equals(x.condition, y.condition)
                        && equals(x.increment, y.increment)
                        && equals(x.body, y.body);
            }
            case RETURN:
                return equals(((ReturnNode) a).value, ((ReturnNode) b).value);
            default:
                throw new InvariantViolation("Unknown node type in equals: " + a.type);
        }
    }

    private static boolean sameNumber(double x, double y) {
        return x == y || (Double.isNaN(x) && Double.isNaN(y));
    }

    private static boolean equalsAll(List<Node> xs, List<Node> ys) {
        if (xs.size() != ys.size()) return false;
        for (int i = 0; i < xs.size(); i++) {
            if (!equals(xs.get(i), ys.get(i))) return false;
        }
        return true;
    }

    // ===================== HASH =====================

    /** Structural hash; equal trees hash equal. Null hashes to 0. */
    public static long hash(Node node) {
        if (node == null) return 0L;

        long h = (node.type.ordinal() + 1) * 0x9E3779B97F4A7C15L;

        switch (node.type) {
            case NUMBER: {
                double v = ((NumberNode) node).value;
                if (v == 0.0) v = 0.0; // -0.0 == 0.0; doubleToLongBits collapses every NaN
                h = mix(h, Double.doubleToLongBits(v));
                break;
            }
            case BOOLEAN:
                h = mix(h, ((BooleanNode) node).value ? 1L : 2L);
                break;
            case STRING:
                h = mix(h, ((StringNode) node).value.hashCode());
                break;
            case VARIABLE:
                h = mix(h, ((VariableNode) node).name.hashCode());
                break;
            case BINARY_OP: {
                BinaryOpNode n = (BinaryOpNode) node;
                h = mix(h, n.op.ordinal());
                h = mix(h, hash(n.left));
                h = mix(h, hash(n.right));
                break;
            }
            case UNARY_OP: {
                UnaryOpNode n = (UnaryOpNode) node;
                h = mix(h, n.op.ordinal());
                h = mix(h, hash(n.operand));
                break;
            }
            case FUNCTION: {
                FunctionNode n = (FunctionNode) node;
                h = mix(h, n.name.hashCode());
                h = mixAll(h, n.args);
                break;
            }
            case MATRIX: {
                MatrixNode n = (MatrixNode) node;
                h = mix(h, n.rows.size());
                for (List<Node> row : n.rows) {
                    h = mixAll(h, row);
                }
                break;
            }
            case TENSOR: {
                TensorNode n = (TensorNode) node;
                h = mix(h, n.dims.size());
                for (Integer d : n.dims) h = mix(h, d);
                h = mixAll(h, n.values);
                break;
            }
            case ASSIGNMENT: {
                AssignmentNode n = (AssignmentNode) node;
                h = mix(h, n.name.hashCode());
                h = mix(h, hash(n.value));
                break;
            }
            case BLOCK:
                h = mixAll(h, ((BlockNode) node).statements);
                break;
            case IF: {
                IfNode n = (IfNode) node;
                h = mix(h, hash(n.condition));
                h = mix(h, hash(n.thenBranch));
                h = mix(h, hash(n.elseBranch));
                break;
            }
            case WHILE: {
                WhileNode n = (WhileNode) node;
                h = mix(h, hash(n.condition));
                h = mix(h, hash(n.body));
                break;
            }
            case FOR: {
                ForNode n = (ForNode) node;
                h = mix(h, hash(n.initializer));
                h = mix(h, hash(n.condition));
                h = mix(h, hash(n.increment));
                h = mix(h, hash(n.body));
                break;
            }
            case RETURN:
                h = mix(h, hash(((ReturnNode) node).value));
                break;
            default:
                throw new InvariantViolation("Unknown node type in hash: " + node.type);
        }
        return h;
    }

    private static long mix(long h, long v) {
        return (h ^ v) * HASH_PRIME;
    }

    private static long mixAll(long h, List<Node> nodes) {
        h = mix(h, nodes.size());
        for (Node n : nodes) h = mix(h, hash(n));
        return h;
    }

    // ===================== TRAVERSE =====================

    /**
     * Pre-order walk (node, then children left to right) driven by an explicit stack,
     * so depth is not limited by the call stack.
     */
    public static void traverse(Node node, Consumer<Node> visitor) {
        if (node == null) return;

        Deque<Node> stack = new ArrayDeque<>();
        stack.push(node);

        while (!stack.isEmpty()) {
            Node current = stack.pop();
            visitor.accept(current);

            List<Node> children = children(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /** Direct children in evaluation order; absent optional children are skipped. */
    public static List<Node> children(Node node) {
        List<Node> out = new ArrayList<>();
        switch (node.type) {
            case NUMBER:
            case BOOLEAN:
            case STRING:
            case VARIABLE:
                break;
            case BINARY_OP: {
                BinaryOpNode n = (BinaryOpNode) node;
                out.add(n.left);
                out.add(n.right);
                break;
            }
            case UNARY_OP:
                out.add(((UnaryOpNode) node).operand);
                break;
            case FUNCTION:
                out.addAll(((FunctionNode) node).args);
                break;
            case MATRIX:
                for (List<Node> row : ((MatrixNode) node).rows) out.addAll(row);
                break;
            case TENSOR:
                out.addAll(((TensorNode) node).values);
                break;
            case ASSIGNMENT:
                out.add(((AssignmentNode) node).value);
                break;
            case BLOCK:
                out.addAll(((BlockNode) node).statements);
                break;
            case IF: {
                IfNode n = (IfNode) node;
                out.add(n.condition);
                out.add(n.thenBranch);
                if (n.elseBranch != null) out.add(n.elseBranch);
                break;
            }
            case WHILE: {
                WhileNode n = (WhileNode) node;
                out.add(n.condition);
                out.add(n.body);
                break;
            }
            case FOR: {
                ForNode n = (ForNode) node;
                out.add(n.initializer);
                out.add(n.condition);
                out.add(n.increment);
                out.add(n.body);
                break;
            }
            case RETURN: {
                Node v = ((ReturnNode) node).value;
                if (v != null) out.add(v);
                break;
            }
            default:
                throw new InvariantViolation("Unknown node type in traverse: " + node.type);
        }
        return out;
    }

    // ===================== SIMPLIFY =====================

    /**
     * Constant folding into {@code arena}. BinaryOp (+ - * / ^) over two Number operands and scalar
     * UnaryOp over a Number operand collapse to a Number; every other node is deep-cloned.
     * The scalar unary set is NEGATE, SIN, COS, TAN, ASIN, ACOS, ATAN, EXP, LOG and SQRT, the same
     * table the evaluator uses. Folding is unguarded: 1/0 becomes Infinity and log(-1) becomes NaN.
     */
    public static Node simplify(NodeArena arena, Node node) {
        if (node == null) return null;
        if (arena == null) throw new InvariantViolation("simplify target arena must not be null");

        switch (node.type) {
            case BINARY_OP: {
                BinaryOpNode bin = (BinaryOpNode) node;
                Node left = simplify(arena, bin.left);
                Node right = simplify(arena, bin.right);
                if (isFoldable(bin.op) && left instanceof NumberNode && right instanceof NumberNode) {
                    return arena.number(bin.op.apply(((NumberNode) left).value, ((NumberNode) right).value));
                }
                return arena.binary(bin.op, left, right);
            }
            case UNARY_OP: {
                UnaryOpNode un = (UnaryOpNode) node;
                Node operand = simplify(arena, un.operand);
                if (un.op.isScalarMath() && operand instanceof NumberNode) {
                    return arena.number(un.op.apply(((NumberNode) operand).value));
                }
                return arena.unary(un.op, operand);
            }
            default:
                return clone(arena, node);
        }
    }

    private static boolean isFoldable(BinaryOp op) {
        switch (op) {
            case ADD: case SUB: case MUL: case DIV: case POW:
                return true;
            default:
                return false;
        }
    }
}
