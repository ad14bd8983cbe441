package com.numu.script.ast;

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

public interface NodeVisitor<R> {
    R visitNumber(NumberNode node);
    R visitBoolean(BooleanNode node);
    R visitString(StringNode node);
    R visitVariable(VariableNode node);
    R visitBinaryOp(BinaryOpNode node);
    R visitUnaryOp(UnaryOpNode node);
    R visitFunction(FunctionNode node);
    R visitMatrix(MatrixNode node);
    R visitTensor(TensorNode node);
    R visitAssignment(AssignmentNode node);
    R visitBlock(BlockNode node);
    R visitIf(IfNode node);
    R visitWhile(WhileNode node);
    R visitFor(ForNode node);
    R visitReturn(ReturnNode node);
}
