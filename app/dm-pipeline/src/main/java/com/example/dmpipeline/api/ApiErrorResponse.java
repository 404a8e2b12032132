package com.example.dmpipeline.api;

public record ApiErrorResponse(String code, String message) {}
