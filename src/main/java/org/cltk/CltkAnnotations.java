/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk;

import java.util.List;

import edu.mit.jwi.item.ISynset;

import edu.stanford.nlp.ling.CoreAnnotation;

import edu.stanford.nlp.util.ErasureUtils;


/**
 * The keys under which processes store what they derive for a {@link Word} in
 * its {@link Word#getAnnotations() annotations}.
 */
public final class CltkAnnotations {

    private CltkAnnotations() { }

    /**
     * The word's embedding vector.
     */
    public static class Embedding implements CoreAnnotation<float[]> {
        public Class<float[]> getType() {
            return float[].class;
        }
    }

    public static class Lemma implements CoreAnnotation<String> {
        public Class<String> getType() {
            return String.class;
        }
    }

    /**
     * The WordNet senses of the word's lemma.  Nothing in the library sets
     * this yet; see {@link org.cltk.wordnet.WordNetProcess#attachSenses}.
     */
    public static class Senses implements CoreAnnotation<List<ISynset>> {
        public Class<List<ISynset>> getType() {
            return ErasureUtils.uncheckedCast(List.class);
        }
    }
}
