package com.diamondline.ingest.exception;

import com.diamondline.ingest.model.EntityKind;

/** No alias and no confident heuristic match. Recoverable: the record is skipped. */
public class UnresolvedAliasException extends RuntimeException {
    private final String source;
    private final EntityKind kind;
    private final String rawToken;

    public UnresolvedAliasException(String source, EntityKind kind, String rawToken) {
        super("Unresolved " + kind + " alias '" + rawToken + "' from source " + source);
        this.source = source;
        this.kind = kind;
        this.rawToken = rawToken;
    }

    public String getSource() { return source; }
    public EntityKind getKind() { return kind; }
    public String getRawToken() { return rawToken; }
}
