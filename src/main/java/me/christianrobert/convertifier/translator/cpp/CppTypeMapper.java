package me.christianrobert.convertifier.translator.cpp;

import me.christianrobert.convertifier.translator.semantic.expression.Expression;
import me.christianrobert.convertifier.translator.semantic.expression.Literal;
import me.christianrobert.convertifier.translator.semantic.expression.Name;

/**
 * Maps Python type annotations to C++ type names.
 *
 * <p>Only plain names are understood ({@code int}, {@code str}, a class name).
 * Quoted forward references ({@code "Node"}) are unwrapped first. Any other
 * annotation shape (subscripted generics, unions, dotted names) yields null and
 * the caller falls back to its default type.
 */
public class CppTypeMapper {

    public static String toCpp(String pythonType) {
        if (pythonType == null) {
            return null;
        }

        String type = pythonType.trim();
        switch (type) {
            case "int":
                return "int";
            case "float":
                return "double";
            case "str":
                return "std::string";
            case "bool":
                return "bool";
            case "None":
                return "void";
            case "":
                return null;
            default:
                return type;
        }
    }

    /**
     * Maps an annotation expression, or returns null when it cannot be mapped.
     */
    public static String toCpp(Expression annotation) {
        if (annotation instanceof Name) {
            return toCpp(((Name) annotation).getId());
        }
        if (annotation instanceof Literal) {
            Literal literal = (Literal) annotation;
            if (literal.getKind() == Literal.Kind.NONE) {
                return "void";
            }
            if (literal.getKind() == Literal.Kind.STRING && literal.getValue().matches("[A-Za-z_]\\w*")) {
                return toCpp(literal.getValue());
            }
        }
        return null;
    }
}
