package org.l20n.dsl;

/**
 * Base interface of the L20n syntax tree handed over by the parser.
 *
 * Type hierarchy:
 * Node
 * ├── Primary expressions (Identifier, ThisExpression, Variable, Global, literals)
 * ├── Selector literals (ArrayLiteral, HashLiteral with KeyValuePair members)
 * ├── ComplexString (interpolated string)
 * ├── Operator expressions (Unary, Binary, Logical, Conditional)
 * ├── Member expressions (Call, Property, Attribute)
 * └── Definitions (EntityDefinition, AttributeDefinition, MacroDefinition, Comment)
 *
 * Nodes are immutable; the compiler only reads them.
 */
public sealed interface Node
        permits Identifier, ThisExpression, Variable, Global, NumberLiteral, StringLiteral,
        ArrayLiteral, HashLiteral, ComplexString, KeyValuePair,
        UnaryExpression, BinaryExpression, LogicalExpression, ConditionalExpression,
        CallExpression, PropertyExpression, AttributeExpression,
        EntityDefinition, AttributeDefinition, MacroDefinition, Comment {
}
