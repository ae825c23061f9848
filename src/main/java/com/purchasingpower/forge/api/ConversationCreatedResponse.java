package com.purchasingpower.forge.api;

public record ConversationCreatedResponse(String conversationId) {
}
