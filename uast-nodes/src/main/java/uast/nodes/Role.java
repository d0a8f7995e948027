package uast.nodes;

/// Well-known semantic roles attached to nodes through `@role`.
///
/// The id of a role is its declaration position and is part of the contract with consumers of
/// the tree: new roles are only ever appended.
public enum Role {
    INVALID,
    IDENTIFIER,
    QUALIFIED,
    OPERATOR,
    BINARY,
    UNARY,
    LEFT,
    RIGHT,
    INFIX,
    POSTFIX,
    BITWISE,
    BOOLEAN,
    UNSIGNED,
    LEFT_SHIFT,
    RIGHT_SHIFT,
    OR,
    XOR,
    AND,
    EXPRESSION,
    STATEMENT,
    EQUAL,
    NOT,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    IDENTICAL,
    CONTAINS,
    INCREMENT,
    DECREMENT,
    NEGATIVE,
    POSITIVE,
    DEREFERENCE,
    TAKE_ADDRESS,
    FILE,
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    MODULO,
    PACKAGE,
    DECLARATION,
    IMPORT,
    PATHNAME,
    ALIAS,
    FUNCTION,
    BODY,
    NAME,
    RECEIVER,
    ARGUMENT,
    VALUE,
    ARGS_LIST,
    BASE,
    IMPLEMENTS,
    INSTANCE,
    SUBTYPE,
    SUBPACKAGE,
    MODULE,
    FRIEND,
    WORLD,
    IF,
    CONDITION,
    THEN,
    ELSE,
    SWITCH,
    CASE,
    DEFAULT,
    FOR,
    INITIALIZATION,
    UPDATE,
    ITERATOR,
    WHILE,
    DO_WHILE,
    BREAK,
    CONTINUE,
    GOTO,
    BLOCK,
    SCOPE,
    RETURN,
    TRY,
    CATCH,
    FINALLY,
    THROW,
    ASSERT,
    CALL,
    CALLEE,
    POSITIONAL,
    NOOP,
    LITERAL,
    BYTE,
    BYTE_STRING,
    CHARACTER,
    LIST,
    MAP,
    NULL,
    NUMBER,
    REGEXP,
    SET,
    STRING,
    TUPLE,
    TYPE,
    ENTRY,
    KEY,
    PRIMITIVE,
    ASSIGNMENT,
    THIS,
    COMMENT,
    DOCUMENTATION,
    WHITESPACE,
    INCOMPLETE,
    UNANNOTATED,
    VISIBILITY,
    ANNOTATION,
    ANONYMOUS,
    ENUMERATION,
    ARITHMETIC,
    RELATIONAL,
    VARIABLE;

    private static final Role[] BY_ID = values();

    public int id() {
        return ordinal();
    }

    /// {@return the role with the given id}
    /// @throws IllegalArgumentException if no role has that id
    public static Role byId(int id) {
        if (id < 0 || id >= BY_ID.length) {
            throw new IllegalArgumentException("unknown role id: " + id);
        }
        return BY_ID[id];
    }
}
