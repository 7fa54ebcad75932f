package com.gymcoach.common.result;

public enum ErrorKind {
    /** Input could not be interpreted at all (not just individual skipped records). */
    MALFORMED_INPUT,
    /** An analyzer threw while computing. */
    COMPUTATION_FAILURE,
    /** The historical-data service could not supply a required input. */
    UPSTREAM_UNAVAILABLE
}
