package me.christianrobert.convertifier.translator.util;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Formats ANTLR parse trees into human-readable, indented text representation.
 *
 * <p>The Python expression grammar is layered (test, or_test, and_test, ... atom), so a
 * plain name sits a dozen rules deep. Chains of rules with a single rule child are
 * collapsed onto one line, joined with {@code " > "}.
 *
 * <p>Example output for {@code print(1 + 2)}:
 * <pre>
 * File_input
 *   Stmt > Simple_stmts
 *     ExprStmt > Testlist > ConditionalTest > ... > Atom_expr
 *       NameAtom [print]
 *         "print" (NAME)
 *       CallTrailer
 *         "(" (OPEN_PAREN)
 *         ...
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final String CHAIN_SEPARATOR = " > ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a parse tree without token type names.
   *
   * @param tree Root of the parse tree
   * @return Formatted string representation
   */
  public static String format(ParseTree tree) {
    return format(tree, null);
  }

  /**
   * Formats a parse tree, labelling terminals with their token names.
   *
   * @param tree Root of the parse tree
   * @param vocabulary Token vocabulary of the lexer, may be null
   * @return Formatted string representation
   */
  public static String format(ParseTree tree, Vocabulary vocabulary) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb, vocabulary);
    return sb.toString();
  }

  private static void formatNode(ParseTree tree, int depth, StringBuilder sb, Vocabulary vocabulary) {
    sb.append(INDENT.repeat(depth));

    if (tree instanceof TerminalNode) {
      TerminalNode terminal = (TerminalNode) tree;
      sb.append("\"").append(escapeAndTruncate(terminal.getText())).append("\"");

      String tokenName = getTokenName(terminal, vocabulary);
      if (!tokenName.isEmpty()) {
        sb.append(" (").append(tokenName).append(")");
      }
      sb.append("\n");

    } else if (tree instanceof ParserRuleContext) {
      // Follow single-child rule chains and print them on one line
      ParserRuleContext ctx = (ParserRuleContext) tree;
      sb.append(getRuleName(ctx));
      while (ctx.getChildCount() == 1 && ctx.getChild(0) instanceof ParserRuleContext) {
        ctx = (ParserRuleContext) ctx.getChild(0);
        sb.append(CHAIN_SEPARATOR).append(getRuleName(ctx));
      }

      // Text snippet only for small token-only nodes
      if (ctx.getChildCount() <= 2 && hasOnlyTerminals(ctx)) {
        String text = ctx.getText();
        if (text.length() <= 30) {
          sb.append(" [").append(escapeAndTruncate(text)).append("]");
        }
      }
      sb.append("\n");

      for (int i = 0; i < ctx.getChildCount(); i++) {
        formatNode(ctx.getChild(i), depth + 1, sb, vocabulary);
      }

    } else {
      sb.append("(unknown: ").append(tree.getClass().getSimpleName()).append(")\n");
    }
  }

  private static boolean hasOnlyTerminals(ParserRuleContext ctx) {
    for (int i = 0; i < ctx.getChildCount(); i++) {
      if (!(ctx.getChild(i) instanceof TerminalNode)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Gets the rule name from a parser rule context ("IfStmt" for IfStmtContext).
   */
  private static String getRuleName(ParserRuleContext ctx) {
    String className = ctx.getClass().getSimpleName();
    if (className.endsWith("Context")) {
      className = className.substring(0, className.length() - "Context".length());
    }
    return className;
  }

  private static String getTokenName(TerminalNode terminal, Vocabulary vocabulary) {
    int type = terminal.getSymbol().getType();
    if (type == Token.EOF) {
      return "EOF";
    }
    if (vocabulary == null) {
      return "";
    }
    String name = vocabulary.getSymbolicName(type);
    return name != null ? name : "";
  }

  /**
   * Escapes and truncates text for display.
   */
  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
