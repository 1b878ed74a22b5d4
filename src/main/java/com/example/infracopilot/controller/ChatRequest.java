package com.example.infracopilot.controller;

/**
 * Body of POST /api/chat.
 *
 * @param mode auto (default), health, metrics, report or daily_report
 * @param sessionId omitted to start a new conversation
 */
public record ChatRequest(String input, String mode, String sessionId) {
}
