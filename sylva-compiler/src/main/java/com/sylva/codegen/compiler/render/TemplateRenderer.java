/*
 * Copyright (c) 2025 Sylva Tree Converter
 * Licensed under the Apache License, Version 2.0
 */
package com.sylva.codegen.compiler.render;

import com.sylva.codegen.api.exceptions.UnresolvedPlaceholderException;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {@code ${name}} placeholders in a template. {@code $$} stands for a literal {@code $};
 * any other {@code $} is copied unchanged.
 *
 * Substitution is purely textual and knows nothing about the target language.
 * Substituted values are not rescanned.
 */
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$(\\$|\\{([A-Za-z_][A-Za-z0-9_]*)})");

    /**
     * @param templateName name used in diagnostics
     * @param template     the template text
     * @param values       placeholder values
     * @return the rendered text
     * @throws UnresolvedPlaceholderException if the template uses a placeholder missing from {@code values}
     */
    public String render(String templateName, String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length() + 64);
        while (matcher.find()) {
            String replacement;
            if ("$".equals(matcher.group(1))) {
                replacement = "$";
            } else {
                String name = matcher.group(2);
                replacement = values.get(name);
                if (replacement == null) {
                    throw new UnresolvedPlaceholderException(name, templateName);
                }
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
