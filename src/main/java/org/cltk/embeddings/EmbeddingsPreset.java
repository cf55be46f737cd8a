/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;

import org.cltk.Doc;


/**
 * The default embeddings configuration of each language that has embeddings.
 * Word embeddings are inherently language-specific, so there is no preset
 * that applies to every language.
 */
public enum EmbeddingsPreset {

    ARABIC("arb", "Arabic"),

    // Aramaic has its own fastText vectors and is not bound to the Arabic
    // code
    ARAMAIC("arc", "Aramaic"),

    GOTHIC("got", "Gothic"),

    GREEK("grc", "Ancient Greek", EmbeddingsVariant.NLPL),

    LATIN("lat", "Latin"),

    OLD_ENGLISH("ang", "Old English"),

    PALI("pli", "Pali"),

    SANSKRIT("san", "Sanskrit");

    private final EmbeddingsConfig config;

    EmbeddingsPreset(String language, String languageName) {
        this(language, languageName, EmbeddingsVariant.FASTTEXT);
    }

    EmbeddingsPreset(String language, String languageName,
                     EmbeddingsVariant variant) {
        this.config = new EmbeddingsConfig(
            language, variant.getName(),
            "Default embeddings for " + languageName + ".");
    }

    public String getLanguage() {
        return config.getLanguage();
    }

    public EmbeddingsConfig getConfig() {
        return config;
    }

    /**
     * Returns a new process configured by this preset.
     */
    public EmbeddingsProcess newProcess() {
        return new EmbeddingsProcess(config);
    }

    /**
     * Returns a new process configured by this preset that annotates the
     * provided document.
     */
    public EmbeddingsProcess newProcess(Doc inputDoc) {
        return new EmbeddingsProcess(config, inputDoc);
    }

    /**
     * Returns the preset for the language code or {@code null} if the
     * language has no default embeddings.
     */
    public static EmbeddingsPreset forLanguage(String language) {
        for (EmbeddingsPreset p : values()) {
            if (p.getLanguage().equals(language))
                return p;
        }
        return null;
    }
}
