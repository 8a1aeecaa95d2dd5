package com.questrail.opcua.types;

/**
 * OPC UA DiagnosticInfo.
 *
 * <p>The four index fields refer to the string table of the response that
 * carries the diagnostic; {@code -1} means absent. The chain of inner
 * diagnostics is a plain nullable link, so a value is always a finite list.
 * Decoders bound its length through the nesting limit.</p>
 */
public record DiagnosticInfo(
        int symbolicId,
        int namespaceUri,
        int locale,
        int localizedText,
        String additionalInfo,
        StatusCode innerStatusCode,
        DiagnosticInfo innerDiagnosticInfo
) {
    public static final DiagnosticInfo NULL = new DiagnosticInfo(-1, -1, -1, -1, null, null, null);

    public DiagnosticInfo {
        innerStatusCode = innerStatusCode == null ? StatusCode.GOOD : innerStatusCode;
    }

    public boolean isNull()
    {
        return symbolicId == -1 && namespaceUri == -1 && locale == -1 && localizedText == -1
                && additionalInfo == null
                && innerStatusCode.value() == StatusCodes.Good
                && innerDiagnosticInfo == null;
    }

    /**
     * Number of links in the chain, counting this one.
     */
    public int depth()
    {
        int depth = 1;
        DiagnosticInfo inner = innerDiagnosticInfo;
        while (inner != null) {
            depth++;
            inner = inner.innerDiagnosticInfo;
        }
        return depth;
    }

    public DiagnosticInfo withInner(DiagnosticInfo inner)
    {
        return new DiagnosticInfo(symbolicId, namespaceUri, locale, localizedText,
                additionalInfo, innerStatusCode, inner);
    }
}
