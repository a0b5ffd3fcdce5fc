package me.christianrobert.convertifier.translator.semantic;

/**
 * Base interface for all nodes of the Python semantic tree.
 *
 * <p>The tree is built once by {@code SemanticTreeBuilder} from the ANTLR parse tree and
 * is never mutated afterwards. Each node owns its children exclusively.
 *
 * <p>Nodes do not translate themselves. Statements are dispatched through
 * {@link me.christianrobert.convertifier.translator.semantic.statement.StatementVisitor}
 * and expressions through
 * {@link me.christianrobert.convertifier.translator.semantic.expression.ExpressionVisitor};
 * adding a node variant breaks every translator at compile time until it handles it.
 */
public interface PyNode {
}
