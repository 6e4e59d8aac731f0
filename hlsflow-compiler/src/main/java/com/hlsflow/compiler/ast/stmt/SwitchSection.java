package com.hlsflow.compiler.ast.stmt;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.Expression;

import java.util.List;

/**
 * switch 中的一段：若干连续的 case/default 标签及其后的语句
 */
public final class SwitchSection {
    private final SourceLocation location;
    private final List<Expression> labels;
    private final boolean hasDefault;
    private final List<Statement> statements;

    public SwitchSection(SourceLocation location, List<Expression> labels, boolean hasDefault,
                         List<Statement> statements) {
        this.location = location;
        this.labels = labels;
        this.hasDefault = hasDefault;
        this.statements = statements;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<Expression> getLabels() {
        return labels;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public List<Statement> getStatements() {
        return statements;
    }
}
