/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;


/**
 * A lookup table from words to fixed-length vectors for one language.
 * Implementations are read-only once constructed.
 */
public interface Embeddings {

    /**
     * Returns the vector for the word, or {@code null} if the word is not in
     * the table.  Callers must not modify the returned array.
     */
    float[] getWordVector(String word);

    /**
     * Returns the number of dimensions of every vector in this table.
     */
    int getEmbeddingLength();
}
