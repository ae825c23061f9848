package com.purchasingpower.forge.client.generation;

import java.util.List;

public record GenerationMessage(Role role, List<ContentBlock> blocks) {

    public enum Role {
        USER,
        MODEL
    }

    public static GenerationMessage userText(String text) {
        return new GenerationMessage(Role.USER, List.of(new ContentBlock.Text(text)));
    }

    public static GenerationMessage modelText(String text) {
        return new GenerationMessage(Role.MODEL, List.of(new ContentBlock.Text(text)));
    }
}
