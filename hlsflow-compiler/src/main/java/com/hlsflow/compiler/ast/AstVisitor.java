package com.hlsflow.compiler.ast;

import com.hlsflow.compiler.ast.decl.*;
import com.hlsflow.compiler.ast.expr.*;
import com.hlsflow.compiler.ast.stmt.*;
import com.hlsflow.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitTranslationUnit(TranslationUnit node, C ctx) { return null; }

    default R visitNamespaceDecl(NamespaceDecl node, C ctx) { return null; }

    default R visitFunctionDecl(FunctionDecl node, C ctx) { return null; }

    default R visitParamDecl(ParamDecl node, C ctx) { return null; }

    default R visitTemplateParameter(TemplateParameter node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitFieldDecl(FieldDecl node, C ctx) { return null; }

    default R visitTypedefDecl(TypedefDecl node, C ctx) { return null; }

    default R visitGlobalVarDecl(GlobalVarDecl node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitCompoundStmt(CompoundStmt node, C ctx) { return null; }

    default R visitDeclStmt(DeclStmt node, C ctx) { return null; }

    default R visitVarDecl(VarDecl node, C ctx) { return null; }

    default R visitTypeDeclStmt(TypeDeclStmt node, C ctx) { return null; }

    default R visitExprStmt(ExprStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitSwitchStmt(SwitchStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitEmptyStmt(EmptyStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitIntLiteral(IntLiteral node, C ctx) { return null; }

    default R visitBoolLiteral(BoolLiteral node, C ctx) { return null; }

    default R visitNameExpr(NameExpr node, C ctx) { return null; }

    default R visitThisExpr(ThisExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitConditionalExpr(ConditionalExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitMemberExpr(MemberExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitCastExpr(CastExpr node, C ctx) { return null; }

    default R visitConstructExpr(ConstructExpr node, C ctx) { return null; }

    default R visitInitListExpr(InitListExpr node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitBuiltinType(BuiltinType node, C ctx) { return null; }

    default R visitNamedType(NamedType node, C ctx) { return null; }
}
