/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;


/**
 * The {@link EmbeddingsFactory} used for each {@link EmbeddingsVariant}.
 */
public final class EmbeddingsBackends {

    private static final EmbeddingsBackends DEFAULTS =
        new EmbeddingsBackends(FastTextEmbeddings.FACTORY,
                               Word2VecEmbeddings.FACTORY);

    private final EmbeddingsFactory fastText;

    private final EmbeddingsFactory nlpl;

    public EmbeddingsBackends(EmbeddingsFactory fastText,
                              EmbeddingsFactory nlpl) {
        if (fastText == null || nlpl == null)
            throw new NullPointerException("Every variant needs a factory");
        this.fastText = fastText;
        this.nlpl = nlpl;
    }

    /**
     * Returns the backends that load the models from the data directory.
     */
    public static EmbeddingsBackends defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the factory that constructs embeddings of this variant.
     */
    public EmbeddingsFactory forVariant(EmbeddingsVariant variant) {
        switch (variant) {
        case FASTTEXT:
            return fastText;
        case NLPL:
            return nlpl;
        default:
            throw new AssertionError("No factory for variant " + variant);
        }
    }
}
