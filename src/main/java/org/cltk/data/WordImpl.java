/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.data;

import java.util.Arrays;

import edu.stanford.nlp.util.ArrayCoreMap;
import edu.stanford.nlp.util.CoreMap;

import org.cltk.CltkAnnotations;
import org.cltk.Word;


/**
 * The basic implementation of {@link Word}, which keeps all derived values in
 * an {@link ArrayCoreMap}.
 */
public class WordImpl implements Word {

    private final int index;

    private final String string;

    private final CoreMap annotations;

    public WordImpl(int index, String string) {
        if (string == null)
            throw new NullPointerException("Word string cannot be null");
        this.index = index;
        this.string = string;
        this.annotations = new ArrayCoreMap();
    }

    /**
     * {@inheritDoc}
     */
    @Override public int getIndex() {
        return index;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getString() {
        return string;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getLemma() {
        String lemma = annotations.get(CltkAnnotations.Lemma.class);
        return (lemma == null) ? string : lemma;
    }

    /**
     * {@inheritDoc}
     */
    @Override public float[] getEmbedding() {
        return annotations.get(CltkAnnotations.Embedding.class);
    }

    /**
     * {@inheritDoc}
     */
    @Override public void setEmbedding(float[] embedding) {
        annotations.set(CltkAnnotations.Embedding.class, embedding);
    }

    /**
     * {@inheritDoc}
     */
    @Override public CoreMap getAnnotations() {
        return annotations;
    }

    public String toString() {
        float[] vec = getEmbedding();
        return String.format("%d:%s%s", index, string,
                             (vec == null) ? "" : " " + Arrays.toString(vec));
    }
}
