package me.christianrobert.convertifier.translator.builder;

import me.christianrobert.convertifier.antlr.PythonParser;
import me.christianrobert.convertifier.translator.semantic.statement.Import;
import me.christianrobert.convertifier.translator.semantic.statement.ImportFrom;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for {@code import} and {@code from ... import}. Aliases are not kept;
 * only module names matter for include collection.
 */
public class VisitImport {

    public static Import v(PythonParser.ImportStmtContext ctx, SemanticTreeBuilder b) {
        List<String> modules = new ArrayList<>();
        for (PythonParser.Dotted_as_nameContext nameCtx : ctx.dotted_as_name()) {
            modules.add(nameCtx.dotted_name().getText());
        }
        return new Import(modules);
    }

    public static ImportFrom v(PythonParser.ImportFromStmtContext ctx, SemanticTreeBuilder b) {
        String module = ctx.relative_module().getText();
        PythonParser.Import_targetsContext targets = ctx.import_targets();

        List<String> names = new ArrayList<>();
        if (targets.import_as_name().isEmpty()) {
            names.add("*");
        } else {
            for (PythonParser.Import_as_nameContext nameCtx : targets.import_as_name()) {
                names.add(nameCtx.NAME(0).getText());
            }
        }
        return new ImportFrom(module, names);
    }
}
