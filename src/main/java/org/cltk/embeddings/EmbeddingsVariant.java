/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;

import java.util.ArrayList;
import java.util.List;

import org.cltk.ConfigurationException;


/**
 * The backend families an {@link EmbeddingsProcess} can be configured with.
 */
public enum EmbeddingsVariant {

    /**
     * Facebook's fastText vectors trained on Wikipedia.
     */
    FASTTEXT("fasttext"),

    /**
     * word2vec vectors from the NLPL word embeddings repository.
     */
    NLPL("nlpl");

    private final String variantName;

    EmbeddingsVariant(String variantName) {
        this.variantName = variantName;
    }

    /**
     * Returns the name by which this variant is configured.
     */
    public String getName() {
        return variantName;
    }

    /**
     * Returns the variant configured by {@code name}.
     *
     * @throws ConfigurationException if no variant has this name
     */
    public static EmbeddingsVariant forName(String name) {
        for (EmbeddingsVariant v : values()) {
            if (v.variantName.equals(name))
                return v;
        }
        throw new ConfigurationException("embeddings variant", name, names());
    }

    /**
     * Returns the names of all variants, in declaration order.
     */
    public static List<String> names() {
        List<String> names = new ArrayList<String>();
        for (EmbeddingsVariant v : values())
            names.add(v.variantName);
        return names;
    }

    public String toString() {
        return variantName;
    }
}
