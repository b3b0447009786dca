package com.example.reports.web;

/** JSON error body: a short error kind plus a human readable message. */
public record ErrorResponse(String error, String message) {}
