package com.example.doimetadata.infrastructure.locale;

import com.example.doimetadata.application.port.LanguageResolver;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Reads the language from Spring's {@link LocaleContextHolder}.
 * Within an HTTP request this is the negotiated request locale, elsewhere the JVM default.
 */
@Component
public class ContextLanguageResolver implements LanguageResolver {

    @Override
    public String currentLanguage() {
        Locale locale = LocaleContextHolder.getLocale();
        return locale.getLanguage();
    }
}
