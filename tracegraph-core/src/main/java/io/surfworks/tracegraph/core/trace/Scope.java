package io.surfworks.tracegraph.core.trace;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Call-site path of an operation inside the model's module hierarchy.
 *
 * <p>String form joins the elements with {@code /}, for example
 * {@code ResNet/Sequential[layer1]/Conv2d[conv1]}. {@link #parse(String)} reverses it.
 *
 * @param elements the path from the model root to the innermost calling module
 */
public record Scope(List<Element> elements) {

    /**
     * One level of a scope path.
     *
     * @param callingModuleName class name of the module, e.g. {@code Conv2d}
     * @param callingField      attribute name under which the parent holds the module, or null
     */
    public record Element(String callingModuleName, String callingField) {

        public Element {
            Objects.requireNonNull(callingModuleName, "callingModuleName cannot be null");
        }

        public static Element parse(String text) {
            int open = text.indexOf('[');
            if (open < 0 || !text.endsWith("]")) {
                return new Element(text, null);
            }
            return new Element(text.substring(0, open), text.substring(open + 1, text.length() - 1));
        }

        @Override
        public String toString() {
            if (callingField == null) {
                return callingModuleName;
            }
            return callingModuleName + "[" + callingField + "]";
        }
    }

    public Scope {
        elements = List.copyOf(elements);
    }

    /**
     * Scope with no elements (a call made outside any module).
     */
    public static Scope empty() {
        return new Scope(List.of());
    }

    /**
     * Parse the string form produced by {@link #toString()}.
     */
    public static Scope parse(String text) {
        if (text == null || text.isEmpty()) {
            return empty();
        }
        List<Element> parsed = new ArrayList<>();
        for (String part : text.split("/")) {
            if (!part.isEmpty()) {
                parsed.add(Element.parse(part));
            }
        }
        return new Scope(parsed);
    }

    public Scope child(String callingModuleName, String callingField) {
        List<Element> extended = new ArrayList<>(elements);
        extended.add(new Element(callingModuleName, callingField));
        return new Scope(extended);
    }

    public int depth() {
        return elements.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append('/');
            sb.append(elements.get(i));
        }
        return sb.toString();
    }
}
