package com.purchasingpower.forge.model.conversation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private String role;
    private String content;

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content);
    }

    public boolean isUser() {
        return USER.equals(role);
    }
}
