/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;

import java.util.Objects;


/**
 * The immutable configuration of an {@link EmbeddingsProcess}: the language
 * whose embeddings to attach, the name of the backend variant to load them
 * with and a description of the resulting process.
 *
 * <p>The variant is kept as the configured name and only checked when the
 * process first resolves its backend.
 */
public final class EmbeddingsConfig {

    public static final String DEFAULT_VARIANT = EmbeddingsVariant.FASTTEXT.getName();

    private final String language;

    private final String variant;

    private final String description;

    /**
     * Creates a configuration for the language using the default variant.
     */
    public EmbeddingsConfig(String language) {
        this(language, DEFAULT_VARIANT, null);
    }

    /**
     * @param language the code of the language, e.g. {@code "lat"}
     * @param variant the name of the backend variant
     * @param description a human-readable description, or {@code null} to
     *        have one generated from the language and variant
     */
    public EmbeddingsConfig(String language, String variant,
                            String description) {
        this.language = language;
        this.variant = variant;
        this.description = (description != null) ? description
            : String.format("%s embeddings for %s.", variant, language);
    }

    public String getLanguage() {
        return language;
    }

    public String getVariant() {
        return variant;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns a copy of this configuration bound to another language.
     */
    public EmbeddingsConfig withLanguage(String otherLanguage) {
        return new EmbeddingsConfig(otherLanguage, variant, description);
    }

    /**
     * Returns a copy of this configuration using another variant.
     */
    public EmbeddingsConfig withVariant(String otherVariant) {
        return new EmbeddingsConfig(language, otherVariant, description);
    }

    public boolean equals(Object o) {
        if (o instanceof EmbeddingsConfig) {
            EmbeddingsConfig c = (EmbeddingsConfig)o;
            return Objects.equals(language, c.language)
                && Objects.equals(variant, c.variant)
                && description.equals(c.description);
        }
        return false;
    }

    public int hashCode() {
        return Objects.hash(language, variant, description);
    }

    public String toString() {
        return String.format("%s (%s, %s)", description, language, variant);
    }
}
