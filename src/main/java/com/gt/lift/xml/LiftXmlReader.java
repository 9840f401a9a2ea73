package com.gt.lift.xml;

import org.jdom2.Document;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.jdom2.input.sax.XMLReaders;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads raw LIFT input into a JDOM document. Input handling mirrors what LIFT producers actually emit:
 * bare entry and header fragments get a synthetic root, and a {@code lift:} prefix used without its declaration
 * gets the LIFT namespace declared on the root.
 */
public final class LiftXmlReader {

    private static final int DECLARATION_SCAN_LENGTH = 256;

    private static final Pattern ENCODING_DECLARATION =
            Pattern.compile("^\\s*<\\?xml[^>]*?encoding\\s*=\\s*[\"']([A-Za-z0-9._\\-]+)[\"']");
    private static final Pattern PROLOG =
            Pattern.compile("^(?:\\s*<\\?xml[^>]*\\?>)?((?:\\s+|<!--.*?-->|<\\?[^>]*\\?>|<!DOCTYPE[^>]*>)*)", Pattern.DOTALL);
    private static final Pattern START_TAG_NAME = Pattern.compile("^<([A-Za-z_][\\w.\\-]*:)?([A-Za-z_][\\w.\\-]*)");

    private static final ThreadLocal<SAXBuilder> SAX_BUILDERS = ThreadLocal.withInitial(LiftXmlReader::createBuilder);

    private LiftXmlReader() { }

    public record NormalizedInput(String xml, boolean wrapped, boolean namespaceDeclared) { }

    public static Document read(String xml) throws JDOMException, IOException {
        return SAX_BUILDERS.get().build(new StringReader(xml));
    }

    /**
     * Prepares text for parsing against the expected root element name ({@code lift} or {@code lift-ranges}).
     * Input is wrapped in a synthetic root only when its first element is one of {@code fragmentNames}; any
     * other root is passed through for the caller to reject.
     */
    public static NormalizedInput normalize(String xml, String rootName, Set<String> fragmentNames) {
        String text = xml.startsWith("\uFEFF") ? xml.substring(1) : xml;

        Matcher prolog = PROLOG.matcher(text);
        int bodyStart = prolog.lookingAt() ? prolog.end() : 0;
        String body = text.substring(bodyStart);

        Matcher rootTag = START_TAG_NAME.matcher(body);
        if (!rootTag.lookingAt()) {
            return new NormalizedInput(text, false, false);
        }

        if (fragmentNames.contains(rootTag.group(2))) {
            String wrapped = "<" + rootName + " xmlns:" + LiftXml.LIFT_PREFIX + "=\"" + LiftXml.LIFT_NAMESPACE_URI + "\">"
                    + body
                    + "</" + rootName + ">";
            return new NormalizedInput(wrapped, true, false);
        }

        String prefix = LiftXml.LIFT_PREFIX + ":";
        if (body.contains("<" + prefix) && !body.contains("xmlns:" + LiftXml.LIFT_PREFIX + "=")) {
            int insertAt = bodyStart + rootTag.end();
            String declared = text.substring(0, insertAt)
                    + " xmlns:" + LiftXml.LIFT_PREFIX + "=\"" + LiftXml.LIFT_NAMESPACE_URI + "\""
                    + text.substring(insertAt);
            return new NormalizedInput(declared, false, true);
        }

        return new NormalizedInput(text, false, false);
    }

    // Charset from byte order mark or XML declaration, UTF-8 otherwise
    public static String decode(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE);
        }

        String head = new String(bytes, 0, Math.min(bytes.length, DECLARATION_SCAN_LENGTH), StandardCharsets.ISO_8859_1);
        Matcher matcher = ENCODING_DECLARATION.matcher(head);
        return new String(bytes, matcher.find() ? charsetFor(matcher.group(1)) : StandardCharsets.UTF_8);
    }

    private static Charset charsetFor(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            return StandardCharsets.UTF_8;
        }
    }

    private static SAXBuilder createBuilder() {
        SAXBuilder builder = new SAXBuilder(XMLReaders.NONVALIDATING);
        builder.setFeature("http://xml.org/sax/features/external-general-entities", false);
        builder.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        builder.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return builder;
    }
}
