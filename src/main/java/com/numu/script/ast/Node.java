package com.numu.script.ast;

import java.util.List;

/**
 * AST node. The variant set is closed: every subclass is declared here and created only by a
 * {@link NodeArena}, which also enforces that each node has at most one parent.
 */
public abstract class Node {

    public final NodeType type;

    NodeArena arena;
    int id = -1;
    boolean owned;

    Node(NodeType type) {
        this.type = type;
    }

    /** Stable index of this node inside its arena. */
    public int id() { return id; }

    /** True once this node has been attached as the child of another node. */
    public boolean isOwned() { return owned; }

    public NodeArena arena() { return arena; }

    public boolean isLeaf() {
        switch (type) {
            case NUMBER:
            case BOOLEAN:
            case STRING:
            case VARIABLE:
                return true;
            default:
                return false;
        }
    }

    public abstract <R> R accept(NodeVisitor<R> visitor);

    // -------------------------
    // Leaves
    // -------------------------

    public static final class NumberNode extends Node {
        public final double value;

        NumberNode(double value) {
            super(NodeType.NUMBER);
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitNumber(this); }

        @Override
        public String toString() { return Double.toString(value); }
    }

    public static final class BooleanNode extends Node {
        public final boolean value;

        BooleanNode(boolean value) {
            super(NodeType.BOOLEAN);
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitBoolean(this); }

        @Override
        public String toString() { return Boolean.toString(value); }
    }

    public static final class StringNode extends Node {
        public final String value;

        StringNode(String value) {
            super(NodeType.STRING);
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitString(this); }

        @Override
        public String toString() { return "\"" + value + "\""; }
    }

    public static final class VariableNode extends Node {
        public final String name;

        VariableNode(String name) {
            super(NodeType.VARIABLE);
            this.name = name;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitVariable(this); }

        @Override
        public String toString() { return name; }
    }

    // -------------------------
    // Expressions
    // -------------------------

    public static final class BinaryOpNode extends Node {
        public final BinaryOp op;
        public final Node left;
        public final Node right;

        BinaryOpNode(BinaryOp op, Node left, Node right) {
            super(NodeType.BINARY_OP);
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitBinaryOp(this); }

        @Override
        public String toString() { return "(" + op.symbol + " " + left + " " + right + ")"; }
    }

    public static final class UnaryOpNode extends Node {
        public final UnaryOp op;
        public final Node operand;

        UnaryOpNode(UnaryOp op, Node operand) {
            super(NodeType.UNARY_OP);
            this.op = op;
            this.operand = operand;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitUnaryOp(this); }

        @Override
        public String toString() { return "(" + op.name().toLowerCase() + " " + operand + ")"; }
    }

    public static final class FunctionNode extends Node {
        public final String name;
        public final List<Node> args;

        FunctionNode(String name, List<Node> args) {
            super(NodeType.FUNCTION);
            this.name = name;
            this.args = args;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitFunction(this); }

        @Override
        public String toString() { return "(call " + name + " " + args + ")"; }
    }

    /** Rows of elements; rows may differ in length. */
    public static final class MatrixNode extends Node {
        public final List<List<Node>> rows;

        MatrixNode(List<List<Node>> rows) {
            super(NodeType.MATRIX);
            this.rows = rows;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitMatrix(this); }

        @Override
        public String toString() { return "(matrix " + rows + ")"; }
    }

    public static final class TensorNode extends Node {
        public final List<Integer> dims;
        public final List<Node> values;

        TensorNode(List<Integer> dims, List<Node> values) {
            super(NodeType.TENSOR);
            this.dims = dims;
            this.values = values;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitTensor(this); }

        @Override
        public String toString() { return "(tensor " + dims + " " + values + ")"; }
    }

    // -------------------------
    // Statements
    // -------------------------

    public static final class AssignmentNode extends Node {
        public final String name;
        public final Node value;

        AssignmentNode(String name, Node value) {
            super(NodeType.ASSIGNMENT);
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitAssignment(this); }

        @Override
        public String toString() { return "(= " + name + " " + value + ")"; }
    }

    public static final class BlockNode extends Node {
        public final List<Node> statements;

        BlockNode(List<Node> statements) {
            super(NodeType.BLOCK);
            this.statements = statements;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitBlock(this); }

        @Override
        public String toString() { return "(block " + statements + ")"; }
    }

    public static final class IfNode extends Node {
        public final Node condition;
        public final Node thenBranch;
        public final Node elseBranch; // may be null

        IfNode(Node condition, Node thenBranch, Node elseBranch) {
            super(NodeType.IF);
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitIf(this); }

        @Override
        public String toString() { return "(if " + condition + " " + thenBranch + " " + elseBranch + ")"; }
    }

    public static final class WhileNode extends Node {
        public final Node condition;
        public final Node body;

        WhileNode(Node condition, Node body) {
            super(NodeType.WHILE);
            this.condition = condition;
            this.body = body;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitWhile(this); }

        @Override
        public String toString() { return "(while " + condition + " " + body + ")"; }
    }

    public static final class ForNode extends Node {
        public final Node initializer;
        public final Node condition;
        public final Node increment;
        public final Node body;

        ForNode(Node initializer, Node condition, Node increment, Node body) {
            super(NodeType.FOR);
            this.initializer = initializer;
            this.condition = condition;
            this.increment = increment;
            this.body = body;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitFor(this); }

        @Override
        public String toString() {
            return "(for " + initializer + " " + condition + " " + increment + " " + body + ")";
        }
    }

    public static final class ReturnNode extends Node {
        public final Node value; // may be null

        ReturnNode(Node value) {
            super(NodeType.RETURN);
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitReturn(this); }

        @Override
        public String toString() { return "(return " + value + ")"; }
    }
}
