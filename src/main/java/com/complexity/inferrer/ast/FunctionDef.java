package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A function (or method) definition.
 */
public final class FunctionDef extends SyntaxNode {

    private final String name;
    private final List<Parameter> parameters;
    private final List<SyntaxNode> body;

    public FunctionDef(String name, List<Parameter> parameters, List<? extends SyntaxNode> body) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(parameters);
        this.body = List.copyOf(body);
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    /**
     * Names of the parameters whose default value is a literal constant.
     */
    public Set<String> getConstantDefaultParameters() {
        return parameters.stream()
                .filter(Parameter::hasConstantDefault)
                .map(Parameter::getName)
                .collect(Collectors.toSet());
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children(parameters, body);
    }

    @Override
    public <A> void accept(SyntaxVisitor<A> visitor, A arg) {
        visitor.visit(this, arg);
    }
}
