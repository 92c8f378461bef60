package com.acme.fleetlink.dispatcher.web;

/** Simple payload for error responses. */
public record ErrorResponse(String message, int statusCode) {}
