package com.taskforge.core.intent;

/**
 * Why a model response could not be decoded.
 */
public record ParseError(String message) {}
