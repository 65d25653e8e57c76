package com.questrail.webm.model;

import com.questrail.webm.decode.EbmlDecodeException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Diagnostic text rendering of a node tree.
 *
 * <p>One line per node, indented two spaces per level:</p>
 * <pre>
 *   Info [0x1549A966] size=25
 *     TimestampScale [0x2AD7B1] size=3 value=1000000
 *     MuxingApp [0x4D80] size=4 value="test"
 * </pre>
 *
 * <p>Unregistered identifiers render as {@value #UNKNOWN_NAME}. Binary and
 * unknown payloads render as hex. A string payload that is not valid UTF-8
 * renders as hex with a marker instead of failing the render.</p>
 */
public final class NodeFormatter
{
    static final String UNKNOWN_NAME = "Unknown";

    private NodeFormatter() {}

    public static String format(Node root)
    {
        StringBuilder out = new StringBuilder();

        // Iterative pre-order walk; deep trees must not overflow the stack.
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);

        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int depth = depths.pop();

            if (out.length() > 0) {
                out.append('\n');
            }
            out.append("  ".repeat(depth));
            appendLine(out, node.element());

            for (int i = node.children().size() - 1; i >= 0; i--) {
                nodes.push(node.children().get(i));
                depths.push(depth + 1);
            }
        }
        return out.toString();
    }

    /**
     * Renders a single element header and value, without children.
     */
    public static String formatElement(Element element)
    {
        StringBuilder out = new StringBuilder();
        appendLine(out, element);
        return out.toString();
    }

    private static void appendLine(StringBuilder out, Element element)
    {
        out.append(element.name().orElse(UNKNOWN_NAME))
                .append(" [0x").append(Long.toHexString(element.id()).toUpperCase()).append(']')
                .append(" size=").append(element.declaredSize());

        if (!element.kind().isContainer()) {
            out.append(" value=").append(renderValue(element));
        }
    }

    private static String renderValue(Element element)
    {
        ElementData data = element.data();
        return switch (element.kind()) {
            case UNSIGNED_INT -> Long.toUnsignedString(data.asUnsigned());
            case SIGNED_INT -> Long.toString(data.asSigned());
            case FLOAT -> Double.toString(data.asFloat());
            case DATE -> data.asDate().toString();
            case RESTRICTED_STRING, UTF8_STRING -> renderString(data);
            case BINARY, UNKNOWN, CONTAINER -> "0x" + data.hexDump();
        };
    }

    private static String renderString(ElementData data)
    {
        try {
            return '"' + data.asUtf8() + '"';
        }
        catch (EbmlDecodeException e) {
            return "<invalid utf-8> 0x" + data.hexDump();
        }
    }
}
