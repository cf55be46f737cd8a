/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk;

import edu.stanford.nlp.util.CoreMap;


/**
 * A single token of a {@link Doc}.  The token's string never changes once the
 * word is created; everything processes derive for it is written to its
 * annotations.
 */
public interface Word {

    /**
     * Returns the position of this word within its document.
     */
    int getIndex();

    /**
     * Returns the token text, as produced by the tokenizer.
     *
     * @return the token string
     */
    String getString();

    /**
     * Returns the lemma of this word, or the token string if no lemma has been
     * annotated.
     */
    String getLemma();

    /**
     * Returns the embedding vector of this word or {@code null} if no
     * embeddings process has run on it yet.
     */
    float[] getEmbedding();

    /**
     * Sets the embedding vector of this word, replacing any previous one.
     */
    void setEmbedding(float[] embedding);

    /**
     * Returns the heterogeneous map of annotations on top of this word.
     *
     * @return the annotations for the word
     * @see CltkAnnotations
     */
    CoreMap getAnnotations();
}
