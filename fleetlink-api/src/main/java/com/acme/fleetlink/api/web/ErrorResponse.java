package com.acme.fleetlink.api.web;

/** Simple payload for error responses. */
public record ErrorResponse(String message, int statusCode) {}
