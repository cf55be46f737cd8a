/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;


/**
 * Constructs the {@link Embeddings} of one backend family for a language.
 */
public interface EmbeddingsFactory {

    /**
     * Returns the embeddings for the language, loading them if needed.
     *
     * @throws org.cltk.UnknownLanguageException if this family has no model
     *         for the language
     * @throws java.io.IOError if the model could not be read
     */
    Embeddings newEmbeddings(String language);
}
