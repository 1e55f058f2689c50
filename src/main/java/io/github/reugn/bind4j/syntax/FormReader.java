package io.github.reugn.bind4j.syntax;

import io.github.reugn.bind4j.FormSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads s-expression text into {@link Form} trees.
 *
 * <p><b>Supported syntax:</b>
 * <ul>
 *   <li>{@code (a b c)} - lists, {@code #(a b c)} - vectors</li>
 *   <li>{@code "text"} - strings with {@code \"} and {@code \\} escapes</li>
 *   <li>{@code 42}, {@code -7}, {@code 3.5} - integers (as {@code Long}) and decimals (as {@code Double})</li>
 *   <li>{@code #\c} - characters</li>
 *   <li>{@code 'x} - {@code (quote x)}, {@code #'f} - {@code (function f)}</li>
 *   <li>{@code ; comment} - ignored up to the end of the line</li>
 * </ul>
 * Everything else up to a delimiter is a symbol. Symbol names keep their case.
 */
public final class FormReader {

    private final String text;
    private int pos;

    private FormReader(String text) {
        this.text = text;
    }

    /**
     * Reads exactly one form.
     *
     * @throws FormSyntaxException if the text is empty, malformed or has trailing forms
     */
    public static Form read(String text) {
        List<Form> forms = readAll(text);
        if (forms.size() != 1) {
            throw new FormSyntaxException("Expected exactly one form but found " + forms.size(), 0);
        }
        return forms.get(0);
    }

    /**
     * Reads every top-level form in the text.
     */
    public static List<Form> readAll(String text) {
        FormReader reader = new FormReader(text);
        List<Form> forms = new ArrayList<>();
        Form form;
        while ((form = reader.next()) != null) {
            forms.add(form);
        }
        return forms;
    }

    /**
     * Reads a top-level form, or returns {@code null} at end of input.
     */
    private Form next() {
        whitespace();
        if (pos >= text.length()) {
            return null;
        }
        if (text.charAt(pos) == ')') {
            throw new FormSyntaxException("Unbalanced ')'", pos);
        }
        return readForm();
    }

    private Form readForm() {
        whitespace();
        if (pos >= text.length()) {
            throw new FormSyntaxException("Unexpected end of input", pos);
        }
        char c = text.charAt(pos);
        return switch (c) {
            case '(' -> {
                pos++;
                yield new ListForm(readElements());
            }
            case '"' -> readString();
            case '\'' -> {
                pos++;
                yield ListForm.call("quote", readForm());
            }
            case '#' -> readDispatch();
            default -> readAtom();
        };
    }

    private List<Form> readElements() {
        List<Form> elements = new ArrayList<>();
        while (true) {
            whitespace();
            if (pos >= text.length()) {
                throw new FormSyntaxException("Unterminated list", pos);
            }
            if (text.charAt(pos) == ')') {
                pos++;
                return elements;
            }
            elements.add(readForm());
        }
    }

    private Form readDispatch() {
        int start = pos;
        if (pos + 1 >= text.length()) {
            throw new FormSyntaxException("Unexpected end of input after '#'", start);
        }
        char sub = text.charAt(pos + 1);
        return switch (sub) {
            case '(' -> {
                pos += 2;
                yield new VectorForm(readElements());
            }
            case '\'' -> {
                pos += 2;
                yield ListForm.call("function", readForm());
            }
            case '\\' -> {
                if (pos + 2 >= text.length()) {
                    throw new FormSyntaxException("Unterminated character", start);
                }
                char value = text.charAt(pos + 2);
                pos += 3;
                yield Literal.of(value);
            }
            default -> throw new FormSyntaxException("Unsupported dispatch '#" + sub + "'", start);
        };
    }

    private Form readString() {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return Literal.of(sb.toString());
            }
            if (c == '\\') {
                if (pos >= text.length()) {
                    break;
                }
                c = text.charAt(pos++);
            }
            sb.append(c);
        }
        throw new FormSyntaxException("Unterminated string", start);
    }

    private Form readAtom() {
        int start = pos;
        while (pos < text.length() && !isDelimiter(text.charAt(pos))) {
            pos++;
        }
        String token = text.substring(start, pos);
        if (token.isEmpty()) {
            throw new FormSyntaxException("Unexpected character '" + text.charAt(pos) + "'", pos);
        }
        Number number = parseNumber(token);
        return number != null ? Literal.of(number) : Symbol.of(token);
    }

    private static Number parseNumber(String token) {
        if (!token.matches("[+-]?\\d+(\\.\\d+)?")) {
            return null;
        }
        if (token.indexOf('.') >= 0) {
            return Double.parseDouble(token);
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            // out of long range, keep it readable as a decimal
            return Double.parseDouble(token);
        }
    }

    private void whitespace() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == ';') {
                while (pos < text.length() && text.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else {
                return;
            }
        }
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == ';' || c == '\'';
    }
}
