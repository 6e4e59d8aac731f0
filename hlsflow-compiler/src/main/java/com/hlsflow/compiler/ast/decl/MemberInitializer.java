package com.hlsflow.compiler.ast.decl;

import com.hlsflow.compiler.ast.SourceLocation;
import com.hlsflow.compiler.ast.expr.Expression;

import java.util.List;

/**
 * 构造函数成员初始化项：x(v) 或 Base(args)
 */
public final class MemberInitializer {
    private final SourceLocation location;
    private final String name;
    private final List<Expression> arguments;

    public MemberInitializer(SourceLocation location, String name, List<Expression> arguments) {
        this.location = location;
        this.name = name;
        this.arguments = arguments;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }
}
