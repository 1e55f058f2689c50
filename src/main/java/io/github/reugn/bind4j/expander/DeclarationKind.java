package io.github.reugn.bind4j.expander;

import io.github.reugn.bind4j.syntax.Symbol;

/**
 * The kind of a declaration specifier.
 * <p>
 * <b>Variable</b> kinds name the variables they apply to and are owned by the
 * binding that introduces those variables. <b>Non-variable</b> kinds apply to
 * the whole scope and are claimed by the first binding processed.
 *
 * <table border="1">
 *   <caption>Declaration kinds</caption>
 *   <tr><th>Kind</th><th>Specifier</th><th>Variable</th></tr>
 *   <tr><td>{@link #TYPE}</td><td>{@code (type integer a b)}</td><td>yes</td></tr>
 *   <tr><td>{@link #DYNAMIC_EXTENT}</td><td>{@code (dynamic-extent a #'f)}</td><td>yes</td></tr>
 *   <tr><td>{@link #IGNORE}</td><td>{@code (ignore a)}</td><td>yes</td></tr>
 *   <tr><td>{@link #IGNORABLE}</td><td>{@code (ignorable a)}</td><td>yes</td></tr>
 *   <tr><td>{@link #SPECIAL}</td><td>{@code (special a)}</td><td>yes</td></tr>
 *   <tr><td>{@link #NOTINLINE}</td><td>{@code (notinline f)}</td><td>yes</td></tr>
 *   <tr><td>{@link #OPTIMIZE}</td><td>{@code (optimize (speed 3))}</td><td>no</td></tr>
 *   <tr><td>{@link #FTYPE}</td><td>{@code (ftype (function (fixnum) fixnum) f)}</td><td>no</td></tr>
 *   <tr><td>{@link #INLINE}</td><td>{@code (inline f)}</td><td>no</td></tr>
 *   <tr><td>{@link #OTHER}</td><td>implementation-specific hints</td><td>no</td></tr>
 * </table>
 */
public enum DeclarationKind {
    TYPE("type", true),
    DYNAMIC_EXTENT("dynamic-extent", true),
    IGNORE("ignore", true),
    IGNORABLE("ignorable", true),
    SPECIAL("special", true),
    NOTINLINE("notinline", true),
    OPTIMIZE("optimize", false),
    FTYPE("ftype", false),
    INLINE("inline", false),
    OTHER(null, false);

    private final String symbolName;
    private final boolean variable;

    DeclarationKind(String symbolName, boolean variable) {
        this.symbolName = symbolName;
        this.variable = variable;
    }

    public boolean isVariable() {
        return variable;
    }

    /**
     * Resolves the kind named by a specifier head. Unknown heads are {@link #OTHER}.
     */
    public static DeclarationKind of(Symbol head) {
        for (DeclarationKind kind : values()) {
            if (kind.symbolName != null && head.is(kind.symbolName)) {
                return kind;
            }
        }
        return OTHER;
    }
}
