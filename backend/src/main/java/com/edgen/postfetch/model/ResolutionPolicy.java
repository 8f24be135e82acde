package com.edgen.postfetch.model;

public enum ResolutionPolicy {

    ANY_CONTENT,

    /**
     * The post must satisfy the required-mention predicate, otherwise resolution fails
     * with {@link FailureKind#CONTENT_REJECTED}.
     */
    REQUIRE_MEMBERSHIP
}
