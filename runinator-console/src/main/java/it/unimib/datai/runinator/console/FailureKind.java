package it.unimib.datai.runinator.console;

/**
 * Categories of failure surfaced by the console core, so callers can tell network problems from
 * backend contract violations and local preconditions.
 */
public enum FailureKind {
    /** No backend has been discovered or configured; nothing was sent. */
    NO_BACKEND,
    /** Non-2xx status or connection-level failure. */
    TRANSPORT,
    /** Body could not be decoded or violates the response contract. */
    UNEXPECTED_RESPONSE,
    /** A local precondition failed; nothing was sent. */
    PRECONDITION,
    /** The gossip socket could not be bound; discovery stays inert. */
    DISCOVERY_BIND
}
