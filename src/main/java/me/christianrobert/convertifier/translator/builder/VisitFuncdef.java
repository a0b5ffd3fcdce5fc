package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.statement.FunctionDef;
import me.christianrobert.convertifier.translator.semantic.statement.Parameter;
import me.christianrobert.convertifier.translator.semantic.statement.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for function definitions.
 *
 * <p>Parameter forms:
 * <ul>
 *   <li>{@code name}, {@code name: T}, {@code name: T = d}: regular parameter</li>
 *   <li>{@code *args}: {@link Parameter.Kind#VAR_POSITIONAL}</li>
 *   <li>{@code **kwargs}: {@link Parameter.Kind#VAR_KEYWORD}</li>
 *   <li>bare {@code *} and {@code /} markers: dropped</li>
 * </ul>
 */
public class VisitFuncdef {

    public static FunctionDef v(PythonParser.FuncdefContext ctx, SemanticTreeBuilder b) {
        String name = ctx.NAME().getText();

        List<Parameter> parameters = new ArrayList<>();
        PythonParser.TypedargslistContext argsCtx = ctx.parameters().typedargslist();
        if (argsCtx != null) {
            for (PythonParser.TypedargContext argCtx : argsCtx.typedarg()) {
                Parameter parameter = parameter(argCtx, b);
                if (parameter != null) {
                    parameters.add(parameter);
                }
            }
        }

        // The only test directly under funcdef is the return annotation
        Expression returns = ctx.test() != null ? b.expression(ctx.test()) : null;
        List<Statement> body = VisitFileInput.block(ctx.block(), b);

        return new FunctionDef(name, parameters, returns, body, b.firstLine(ctx));
    }

    private static Parameter parameter(PythonParser.TypedargContext ctx, SemanticTreeBuilder b) {
        PythonParser.TfpdefContext def = ctx.tfpdef();
        if (def == null) {
            return null;
        }

        Parameter.Kind kind = Parameter.Kind.REGULAR;
        String first = ctx.getChild(0).getText();
        if ("*".equals(first)) {
            kind = Parameter.Kind.VAR_POSITIONAL;
        } else if ("**".equals(first)) {
            kind = Parameter.Kind.VAR_KEYWORD;
        }

        Expression annotation = def.test() != null ? b.expression(def.test()) : null;
        Expression defaultValue = ctx.test() != null ? b.expression(ctx.test()) : null;
        return new Parameter(def.NAME().getText(), kind, annotation, defaultValue);
    }
}
