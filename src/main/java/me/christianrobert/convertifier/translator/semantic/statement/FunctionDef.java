package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.expression.Expression;

import java.util.List;

/**
 * Function definition: {@code def name(params) -> returns: body}.
 */
public class FunctionDef extends CompoundStatement {

    private final String name;
    private final List<Parameter> parameters;
    private final Expression returns;
    private final List<Statement> body;

    public FunctionDef(String name, List<Parameter> parameters, Expression returns,
                       List<Statement> body, String headerLine) {
        super(headerLine);
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name cannot be null or empty");
        }
        this.name = name;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.returns = returns;
        this.body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    /**
     * Return annotation, or null when the definition declares none.
     */
    public Expression getReturns() {
        return returns;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "FunctionDef{name=" + name + ", parameters=" + parameters
                + (returns != null ? ", returns=" + returns : "")
                + ", body=" + body + "}";
    }
}
