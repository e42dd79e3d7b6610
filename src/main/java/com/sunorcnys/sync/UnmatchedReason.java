package com.sunorcnys.sync;

public enum UnmatchedReason {
    /** Neither ISRC lookup nor text search returned a candidate. */
    NOT_FOUND,
    /** Candidates came back but the matcher accepted none of them. */
    NO_ACCEPTED_CANDIDATE
}
