package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.AstNode;
import com.hlsflow.compiler.ast.AstVisitor;
import com.hlsflow.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 翻译单元（一个源文件的全部顶层声明）
 */
public class TranslationUnit extends AstNode {
    private final String fileName;
    private final List<Declaration> declarations;

    public TranslationUnit(SourceLocation location, String fileName, List<Declaration> declarations) {
        super(location);
        this.fileName = fileName;
        this.declarations = declarations;
    }

    public String getFileName() {
        return fileName;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTranslationUnit(this, context);
    }
}
