package org.blockgen;

public class UnsupportedBlockException extends BlockGenerationException {

    private final String language;

    public UnsupportedBlockException(String language, String blockType) {
        super("Language \"" + language + "\" does not know how to generate code for block type \"" + blockType + "\"",
              blockType);
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
