package com.sheetdoc.app.formula.ast;

import java.util.Collections;
import java.util.List;

/**
 * NAME(arg, ...). The name is uppercased by the tokenizer.
 */
public final class FunctionCall implements Expression {
    private final String name;
    private final List<Expression> arguments;

    public FunctionCall(String name, List<Expression> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
