package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.expression.Attribute;
import me.christianrobert.convertifier.translator.semantic.expression.Call;
import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.Subscript;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static helper for an atom followed by trailers.
 *
 * <p>Trailers fold left to right onto the atom:
 * {@code a.b(c)[d]} becomes {@code Subscript(Call(Attribute(a, b), [c]), d)}.
 */
public class VisitAtomExpr {

    public static Expression v(PythonParser.Atom_exprContext ctx, SemanticTreeBuilder b) {
        Expression result = b.expression(ctx.atom());
        for (PythonParser.TrailerContext trailer : ctx.trailer()) {
            result = applyTrailer(result, trailer, b);
        }
        return result;
    }

    private static Expression applyTrailer(Expression target, PythonParser.TrailerContext ctx, SemanticTreeBuilder b) {
        if (ctx instanceof PythonParser.AttributeTrailerContext) {
            PythonParser.AttributeTrailerContext attr = (PythonParser.AttributeTrailerContext) ctx;
            return new Attribute(target, attr.NAME().getText());
        }
        if (ctx instanceof PythonParser.SubscriptTrailerContext) {
            return subscript(target, ((PythonParser.SubscriptTrailerContext) ctx).subscriptlist(), b);
        }
        return call(target, ((PythonParser.CallTrailerContext) ctx).arglist(), b);
    }

    private static Expression call(Expression func, PythonParser.ArglistContext ctx, SemanticTreeBuilder b) {
        List<Expression> args = new ArrayList<>();
        Map<String, Expression> keywords = new LinkedHashMap<>();
        if (ctx != null) {
            for (PythonParser.ArgumentContext argCtx : ctx.argument()) {
                if (argCtx instanceof PythonParser.KeywordArgumentContext) {
                    PythonParser.KeywordArgumentContext keyword = (PythonParser.KeywordArgumentContext) argCtx;
                    keywords.put(keyword.NAME().getText(), b.expression(keyword.test()));
                } else if (argCtx instanceof PythonParser.PositionalArgumentContext
                        && ((PythonParser.PositionalArgumentContext) argCtx).comp_for() == null) {
                    args.add(b.expression(((PythonParser.PositionalArgumentContext) argCtx).test()));
                } else {
                    // generator argument, *args, **kwargs
                    args.add(b.raw(argCtx));
                }
            }
        }
        return new Call(func, args, keywords);
    }

    private static Expression subscript(Expression value, PythonParser.SubscriptlistContext ctx, SemanticTreeBuilder b) {
        if (ctx.subscript().size() == 1 && ctx.getChildCount() == 1
                && ctx.subscript(0) instanceof PythonParser.IndexSubscriptContext) {
            PythonParser.IndexSubscriptContext index = (PythonParser.IndexSubscriptContext) ctx.subscript(0);
            return new Subscript(value, b.expression(index.test()));
        }
        // slices and multi-dimensional indexes
        return new Subscript(value, b.raw(ctx));
    }
}
