package com.example.doimetadata.application.port;

/**
 * Resolves the language of the calling context.
 */
public interface LanguageResolver {

    /**
     * @return language tag such as {@code "en"}
     */
    String currentLanguage();
}
