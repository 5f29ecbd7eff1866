package com.forum.adapter.in.web;

public record ErrorResponse(
    String error,
    String message,
    String requestId
) {}
