/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.data;

import java.util.ArrayList;
import java.util.List;

import org.cltk.Doc;
import org.cltk.Word;


/**
 * The basic implementation of {@link Doc}.
 */
public class DocImpl implements Doc {

    private final String raw;

    private final List<Word> words;

    /**
     * Creates a document without any words yet.
     */
    public DocImpl(String raw) {
        this(raw, new ArrayList<Word>());
    }

    /**
     * Creates a document over the provided list, which is used directly and
     * not copied.
     */
    public DocImpl(String raw, List<Word> words) {
        if (words == null)
            throw new NullPointerException("words cannot be null");
        this.raw = raw;
        this.words = words;
    }

    /**
     * Creates a document whose words are the provided, already tokenized
     * strings, indexed by their position.
     */
    public static DocImpl fromTokens(String raw, List<String> tokens) {
        List<Word> words = new ArrayList<Word>(tokens.size());
        for (String token : tokens)
            words.add(new WordImpl(words.size(), token));
        return new DocImpl(raw, words);
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getRaw() {
        return raw;
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<Word> getWords() {
        return words;
    }

    public String toString() {
        return words.toString();
    }
}
