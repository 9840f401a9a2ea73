package com.gt.lift.parser;

import com.gt.lift.exception.LiftParseException;
import com.gt.lift.model.ExtensionElement;
import com.gt.lift.xml.LiftExtensions;
import com.gt.lift.xml.LiftXml;
import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Per-call parse state. Parsers are shared between threads, so everything a single parse accumulates
 * lives here.
 */
public class ParseSession {

    private static final Logger log = LoggerFactory.getLogger(ParseSession.class);

    private final ParseMode parseMode;
    private final PreservationMode preservationMode;
    private final List<ParseIssue> issues = new ArrayList<>();

    public ParseSession(ParseMode parseMode, PreservationMode preservationMode) {
        this.parseMode = parseMode;
        this.preservationMode = preservationMode;
    }

    /**
     * Reports a missing required part of a modeled construct. In strict mode this aborts the parse; in
     * lenient mode the caller skips the construct and the issue is recorded.
     */
    public void schemaViolation(Element element, String reason) throws LiftParseException {
        String path = LiftXml.path(element);
        if (parseMode == ParseMode.STRICT) {
            throw new LiftParseException(ParseErrorType.SCHEMA_VIOLATION, path, reason);
        }

        log.warn("Skipping {}: {}", path, reason);
        issues.add(new ParseIssue(IssueType.SCHEMA_VIOLATION, path, reason));
    }

    public void unresolvedNamespace(String path, String message) {
        log.warn("{}: {}", path, message);
        issues.add(new ParseIssue(IssueType.UNRESOLVED_NAMESPACE, path, message));
    }

    /**
     * Reports every child of {@code parent} outside {@code knownChildren}. When the owner can hold
     * extensions and the session preserves unknown elements, the children are captured and returned.
     */
    public List<ExtensionElement> unknownChildren(Element parent, Set<String> knownChildren, boolean preservable) {
        List<ExtensionElement> extensions = new ArrayList<>();
        for (Element child : parent.getChildren()) {
            if (LiftXml.isLiftNamespace(child.getNamespaceURI()) && knownChildren.contains(child.getName())) {
                continue;
            }

            boolean preserve = preservable && preservationMode == PreservationMode.STRICT_LOSSLESS;
            String path = LiftXml.path(child);
            String message = "Unrecognized element <" + child.getName() + "> " + (preserve ? "preserved" : "ignored");
            log.debug("{}: {}", path, message);
            issues.add(new ParseIssue(IssueType.UNKNOWN_CONSTRUCT, path, message));

            if (preserve) {
                extensions.add(LiftExtensions.capture(child));
            }
        }
        return extensions;
    }

    public ParseMode getParseMode() {
        return parseMode;
    }

    public List<ParseIssue> getIssues() {
        return issues;
    }
}
