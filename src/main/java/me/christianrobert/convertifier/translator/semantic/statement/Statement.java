package me.christianrobert.convertifier.translator.semantic.statement;

import me.christianrobert.convertifier.translator.semantic.PyNode;

/**
 * A Python statement. Translators dispatch through {@link StatementVisitor}.
 */
public interface Statement extends PyNode {

    <R> R accept(StatementVisitor<R> visitor);
}
