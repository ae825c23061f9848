package com.purchasingpower.forge.prompt;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.MustacheException;

import java.io.IOException;
import java.io.Writer;

/**
 * Mustache factory for prompts and markdown documents: values are written as-is, no HTML escaping.
 */
public class PlainTextMustacheFactory extends DefaultMustacheFactory {

    public PlainTextMustacheFactory() {
        super();
    }

    public PlainTextMustacheFactory(String resourceRoot) {
        super(resourceRoot);
    }

    @Override
    public void encode(String value, Writer writer) {
        try {
            writer.write(value);
        } catch (IOException e) {
            throw new MustacheException("Failed to write template value", e);
        }
    }
}
