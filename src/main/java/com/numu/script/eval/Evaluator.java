package com.numu.script.eval;

import java.util.ArrayList;
import java.util.List;

import com.numu.debug.Debug;
import com.numu.debug.DebugLevel;
import com.numu.script.InvariantViolation;
import com.numu.script.ast.BinaryOp;
import com.numu.script.ast.Node;
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
import com.numu.script.ast.NodeVisitor;
import com.numu.script.ast.UnaryOp;

/**
 * Tree-walking evaluator: reduces an AST to a double against an {@link Environment}.
 *
 * Operands are evaluated left to right before the operator is applied. There is no compiled form
 * and no recovery: the first failure aborts with an {@link EvaluationError}.
 */
public class Evaluator implements NodeVisitor<Double> {

    private static final String TAG = "numu.eval";

    private final Environment env;

    public Evaluator(Environment env) {
        if (env == null) throw new IllegalArgumentException("environment must not be null");
        this.env = env;
    }

    public static double evaluate(Node node, Environment env) {
        return new Evaluator(env).eval(node);
    }

    public double eval(Node node) {
        if (node == null) {
            throw new InvariantViolation("Null node in evaluation");
        }
        return node.accept(this);
    }

    // ===================== OPERATOR TABLES =====================

    /** Arithmetic with the division and modulo zero checks. */
    public static double applyBinary(BinaryOp op, double left, double right) {
        switch (op) {
            case ADD:
            case SUB:
            case MUL:
            case POW:
                return op.apply(left, right);
            case DIV:
                if (right == 0.0) throw new EvaluationError("division by zero");
                return op.apply(left, right);
            case MOD:
                if (right == 0.0) throw new EvaluationError("modulo by zero");
                return op.apply(left, right);
            default:
                throw new EvaluationError("operator not supported in numeric evaluation: " + op);
        }
    }

    /** Scalar math with the log and sqrt domain checks. */
    public static double applyUnary(UnaryOp op, double operand) {
        if (op.isMatrixOp()) {
            throw new EvaluationError("matrix operation not yet implemented: " + op);
        }
        if (!op.isScalarMath()) {
            throw new EvaluationError("operator not supported in numeric evaluation: " + op);
        }
        if (op == UnaryOp.LOG && operand <= 0.0) {
            throw new EvaluationError("logarithm of non-positive number");
        }
        if (op == UnaryOp.SQRT && operand < 0.0) {
            throw new EvaluationError("square root of negative number");
        }
        return op.apply(operand);
    }

    // ===================== EXPRESSIONS =====================

    @Override
    public Double visitNumber(NumberNode node) {
        return node.value;
    }

    @Override
    public Double visitBoolean(BooleanNode node) {
        throw unsupported(node);
    }

    @Override
    public Double visitString(StringNode node) {
        throw unsupported(node);
    }

    @Override
    public Double visitVariable(VariableNode node) {
        return env.getVariable(node.name);
    }

    @Override
    public Double visitBinaryOp(BinaryOpNode node) {
        double left = eval(node.left);
        double right = eval(node.right);
        return applyBinary(node.op, left, right);
    }

    @Override
    public Double visitUnaryOp(UnaryOpNode node) {
        double operand = eval(node.operand);
        return applyUnary(node.op, operand);
    }

    @Override
    public Double visitFunction(FunctionNode node) {
        List<Double> args = new ArrayList<>(node.args.size());
        for (Node arg : node.args) {
            args.add(eval(arg));
        }

        RegisteredFunction fn = env.lookupFunction(node.name);
        if (fn == null) {
            throw new EvaluationError("unknown function: " + node.name);
        }
        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "call " + node.name + args);
        }
        return fn.call(args);
    }

    @Override
    public Double visitMatrix(MatrixNode node) {
        throw new EvaluationError("matrix evaluation not yet implemented");
    }

    @Override
    public Double visitTensor(TensorNode node) {
        throw new EvaluationError("tensor evaluation not yet implemented");
    }

    // ===================== STATEMENTS =====================

    @Override
    public Double visitAssignment(AssignmentNode node) {
        double value = eval(node.value);
        env.setVariable(node.name, value);
        return value;
    }

    /** Value of the last statement. */
    @Override
    public Double visitBlock(BlockNode node) {
        if (node.statements.isEmpty()) {
            throw new EvaluationError("empty block has no value");
        }
        double last = 0.0;
        for (Node stmt : node.statements) {
            last = eval(stmt);
        }
        return last;
    }

    @Override
    public Double visitIf(IfNode node) {
        throw statementNotImplemented(node);
    }

    @Override
    public Double visitWhile(WhileNode node) {
        throw statementNotImplemented(node);
    }

    @Override
    public Double visitFor(ForNode node) {
        throw statementNotImplemented(node);
    }

    @Override
    public Double visitReturn(ReturnNode node) {
        throw statementNotImplemented(node);
    }

    private static EvaluationError unsupported(Node node) {
        return new EvaluationError("unsupported node in numeric evaluation: " + node.type);
    }

    private static EvaluationError statementNotImplemented(Node node) {
        return new EvaluationError("statement evaluation not yet implemented: " + node.type);
    }
}
