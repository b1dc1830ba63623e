package com.pulselang.compiler.ast;

import com.pulselang.compiler.ast.decl.*;
import com.pulselang.compiler.ast.expr.*;
import com.pulselang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法都是抽象的：新增节点类型时，每个实现类都必须处理它，
 * 分派的完整性由编译器检查。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    R visitProgram(Program node, C ctx);

    R visitClassDecl(ClassDecl node, C ctx);

    R visitMethodDecl(MethodDecl node, C ctx);

    R visitFieldDecl(FieldDecl node, C ctx);

    R visitParameter(Parameter node, C ctx);

    R visitAnnotation(Annotation node, C ctx);

    // ============ 语句 ============

    R visitBlock(Block node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitVarDeclStmt(VarDeclStmt node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitWhileStmt(WhileStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitReturnStmt(ReturnStmt node, C ctx);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitAssignExpr(AssignExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitMemberExpr(MemberExpr node, C ctx);

    R visitNewExpr(NewExpr node, C ctx);

    R visitIndexExpr(IndexExpr node, C ctx);

    R visitArrayLiteral(ArrayLiteral node, C ctx);
}
