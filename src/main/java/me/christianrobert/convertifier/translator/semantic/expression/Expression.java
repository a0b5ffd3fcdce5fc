package me.christianrobert.convertifier.translator.semantic.expression;

import me.christianrobert.convertifier.translator.semantic.PyNode;

/**
 * A Python expression node.
 */
public interface Expression extends PyNode {

    <R> R accept(ExpressionVisitor<R> visitor);
}
