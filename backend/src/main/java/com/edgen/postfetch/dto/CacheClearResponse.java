package com.edgen.postfetch.dto;

public record CacheClearResponse(int cleared) {
}
